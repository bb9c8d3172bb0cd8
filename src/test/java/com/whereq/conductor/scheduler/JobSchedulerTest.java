package com.whereq.conductor.scheduler;

import com.whereq.conductor.dto.RunJobRequest;
import com.whereq.conductor.dto.ScheduleSpec;
import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.RequestUser;
import com.whereq.conductor.model.ScheduleInterval;
import com.whereq.conductor.model.ScheduleState;
import com.whereq.conductor.model.ScheduledRun;
import com.whereq.conductor.support.ConductorHarness;
import com.whereq.conductor.support.ScriptedJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class JobSchedulerTest {

    private static final RequestUser ALICE = RequestUser.builder()
        .username("alice")
        .permissions(Set.of("run_job"))
        .build();

    private ConductorHarness harness;
    private JobScheduler scheduler;
    private JobDefinition backup;

    @BeforeEach
    void setUp() {
        harness = new ConductorHarness(List.of(ScriptedJob.backup()));
        scheduler = harness.scheduler;
        backup = harness.enable("BackupJob");
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private ScheduledRun schedule(ScheduleSpec spec) {
        return harness.submissionService.run("BackupJob", RunJobRequest.builder().schedule(spec).build(), ALICE)
            .block(ConductorHarness.TIMEOUT)
            .getScheduledRun();
    }

    private void tickFor(Duration total, Duration step) {
        for (Duration elapsed = Duration.ZERO; elapsed.compareTo(total) < 0; elapsed = elapsed.plus(step)) {
            harness.clock.advance(step);
            scheduler.tick(harness.clock.instant()).block(ConductorHarness.TIMEOUT);
        }
    }

    @Test
    void shouldFireDailyCrontabTwiceInTwoDays() {
        ScheduledRun run = schedule(ScheduleSpec.builder().interval(ScheduleInterval.CUSTOM).crontab("0 2 * * *").build());

        tickFor(Duration.ofHours(48), Duration.ofMinutes(5));

        await().atMost(ConductorHarness.TIMEOUT).until(() -> harness.resultStore.all().size() == 2);
        ScheduledRun stored = scheduler.find(run.getId()).block();
        assertThat(stored.getTotalRunCount()).isEqualTo(2);
        assertThat(stored.getLastRunAt()).isEqualTo(Instant.parse("2024-03-02T02:00:00Z"));
        assertThat(stored.getState()).isEqualTo(ScheduleState.ELIGIBLE);
        assertThat(harness.resultStore.all())
            .allSatisfy(result -> assertThat(result.getScheduledRunId()).isEqualTo(run.getId()));
    }

    @Test
    void shouldFireFutureRunOnce() {
        ScheduledRun run = schedule(ScheduleSpec.builder()
            .interval(ScheduleInterval.FUTURE)
            .startTime(harness.clock.instant().plus(Duration.ofMinutes(10)))
            .build());

        tickFor(Duration.ofMinutes(30), Duration.ofMinutes(1));

        await().atMost(ConductorHarness.TIMEOUT).until(() -> harness.resultStore.all().size() == 1);
        ScheduledRun stored = scheduler.find(run.getId()).block();
        assertThat(stored.getState()).isEqualTo(ScheduleState.FIRED);
        assertThat(stored.getTotalRunCount()).isEqualTo(1);
    }

    @Test
    void shouldFireImmediateRunOnSubmission() {
        ScheduledRun run = schedule(ScheduleSpec.builder().interval(ScheduleInterval.IMMEDIATE).build());

        assertThat(run.getState()).isEqualTo(ScheduleState.FIRED);
        await().atMost(ConductorHarness.TIMEOUT).until(() -> harness.resultStore.all().size() == 1);

        tickFor(Duration.ofMinutes(5), Duration.ofMinutes(1));
        assertThat(harness.resultStore.all()).hasSize(1);
    }

    @Test
    void shouldCatchUpOneOccurrencePerTick() {
        ScheduledRun run = schedule(ScheduleSpec.builder()
            .interval(ScheduleInterval.HOURLY)
            .startTime(harness.clock.instant().plus(Duration.ofMinutes(30)))
            .build());

        harness.clock.advance(Duration.ofHours(5));
        Long fired = scheduler.tick(harness.clock.instant()).block();

        assertThat(fired).isEqualTo(1L);
        ScheduledRun stored = scheduler.find(run.getId()).block();
        assertThat(stored.getLastRunAt()).isEqualTo(Instant.parse("2024-03-01T00:30:00Z"));

        scheduler.tick(harness.clock.instant()).block();
        assertThat(scheduler.find(run.getId()).block().getLastRunAt()).isEqualTo(Instant.parse("2024-03-01T01:30:00Z"));
    }

    @Test
    void shouldNotFireDisabledOrCancelledRuns() {
        ScheduledRun disabled = schedule(ScheduleSpec.builder().interval(ScheduleInterval.CUSTOM).crontab("* * * * *").build());
        ScheduledRun cancelled = schedule(ScheduleSpec.builder().interval(ScheduleInterval.CUSTOM).crontab("* * * * *").build());
        scheduler.setEnabled(disabled.getId(), false).block();
        scheduler.cancel(cancelled.getId()).block();

        tickFor(Duration.ofMinutes(10), Duration.ofMinutes(1));

        assertThat(harness.resultStore.all()).isEmpty();
        assertThat(scheduler.find(cancelled.getId()).block().getState()).isEqualTo(ScheduleState.CANCELLED);
    }

    @Test
    void shouldDeriveCrontabFromStartTime() {
        ScheduledRun run = scheduler.prepare(backup, ScheduleSpec.builder()
            .interval(ScheduleInterval.WEEKLY)
            .startTime(Instant.parse("2024-03-03T14:45:00Z"))
            .build(), "alice", Map.of(), "default", false);

        assertThat(run.getCrontab()).isEqualTo("45 14 * * 0");
        assertThat(run.getTimeZone()).isEqualTo("UTC");
        assertThat(run.getName()).startsWith("Backup - weekly - ");
    }

    @Test
    void shouldRejectCrontabOnNonCustomInterval() {
        assertThatThrownBy(() -> scheduler.prepare(backup, ScheduleSpec.builder()
            .interval(ScheduleInterval.DAILY)
            .startTime(harness.clock.instant().plus(Duration.ofHours(1)))
            .crontab("0 2 * * *")
            .build(), "alice", Map.of(), "default", false))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectFutureRunStartingTooSoon() {
        assertThatThrownBy(() -> scheduler.prepare(backup, ScheduleSpec.builder()
            .interval(ScheduleInterval.FUTURE)
            .startTime(harness.clock.instant().plusSeconds(5))
            .build(), "alice", Map.of(), "default", false))
            .isInstanceOf(ValidationException.class);
    }
}
