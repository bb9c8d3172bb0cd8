package com.whereq.conductor.registry;

import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.model.FileProxy;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobVariable;
import com.whereq.conductor.model.TypedArgs;
import com.whereq.conductor.model.VariableType;
import com.whereq.conductor.support.FakeRecordStoreClient;
import com.whereq.conductor.support.InMemoryFileProxyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VariableValidatorTest {

    private final FakeRecordStoreClient records = new FakeRecordStoreClient()
        .add("dcim.device", Map.of("id", "7", "name", "sw7"));
    private final InMemoryFileProxyStore files = new InMemoryFileProxyStore();
    private final VariableValidator validator = new VariableValidator(records, files);

    private JobDefinition definition;

    @BeforeEach
    void setUp() {
        definition = JobDefinition.builder()
            .id("Audit")
            .dryrunDefault(true)
            .variables(List.of(
                JobVariable.builder().name("site").type(VariableType.STRING).maxLength(8).build(),
                JobVariable.builder().name("limit").type(VariableType.INTEGER).minValue(1L).maxValue(100L)
                    .required(false).defaultValue(10).build(),
                JobVariable.builder().name("mode").type(VariableType.CHOICE).choices(List.of("fast", "full"))
                    .required(false).build(),
                JobVariable.builder().name("device").type(VariableType.OBJECT).objectType("dcim.device")
                    .required(false).build(),
                JobVariable.builder().name("prefix").type(VariableType.NETWORK).required(false).build(),
                JobVariable.builder().name("upload").type(VariableType.FILE).required(false).build()))
            .build();
    }

    @Test
    void shouldNormalizeValidInputs() {
        StepVerifier.create(validator.validate(definition, Map.of(
                "site", "ams1",
                "limit", "25",
                "mode", "full",
                "device", "7",
                "prefix", "10.0.0.0/8")))
            .assertNext(args -> {
                assertThat(args.getString("site")).isEqualTo("ams1");
                assertThat(args.getLong("limit")).isEqualTo(25L);
                assertThat(args.getObject("device").getId()).isEqualTo("7");
                assertThat(args.get("prefix")).isEqualTo("10.0.0.0/8");
                assertThat(args.isDryrun()).isTrue();
            })
            .verifyComplete();
    }

    @Test
    void shouldApplyDefaultsAndDryrunOverride() {
        StepVerifier.create(validator.validate(definition, Map.of("site", "ams1", TypedArgs.DRYRUN, "false")))
            .assertNext(args -> {
                assertThat(args.getLong("limit")).isEqualTo(10L);
                assertThat(args.has("mode")).isFalse();
                assertThat(args.isDryrun()).isFalse();
            })
            .verifyComplete();
    }

    @Test
    void shouldReportEveryProblemAtOnce() {
        StepVerifier.create(validator.validate(definition, Map.of(
                "limit", "500",
                "mode", "slow",
                "color", "red")))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unknown input 'color'")
                .hasMessageContaining("Missing required input 'site'")
                .hasMessageContaining("greater than 100")
                .hasMessageContaining("'slow' is not one of"))
            .verify();
    }

    @Test
    void shouldRejectMissingObjectsAndFiles() {
        StepVerifier.create(validator.validate(definition, Map.of("site", "ams1", "device", "8", "upload", "nope")))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Object not found: dcim.device:8")
                .hasMessageContaining("File not found or expired: nope"))
            .verify();
    }

    @Test
    void shouldAcceptStoredUpload() {
        files.save(FileProxy.builder().id("f-1").name("a.csv").content(new byte[0]).build()).block();

        StepVerifier.create(validator.validate(definition, Map.of("site", "ams1", "upload", "f-1")))
            .assertNext(args -> assertThat(args.getString("upload")).isEqualTo("f-1"))
            .verifyComplete();
    }

    @Test
    void shouldRejectMalformedNetwork() {
        StepVerifier.create(validator.validate(definition, Map.of("site", "ams1", "prefix", "10.0.0.0/40")))
            .expectError(ValidationException.class)
            .verify();
    }
}
