package com.whereq.conductor.store.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.conductor.model.ApprovalStage;
import com.whereq.conductor.model.ApprovalWorkflow;
import com.whereq.conductor.model.ApprovalWorkflowDefinition;
import com.whereq.conductor.model.ScheduledRun;
import com.whereq.conductor.store.ApprovalStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Approval definitions and workflow instances. Workflows carry a version that is checked and
 * bumped by a Lua script on every save, so two approvers racing on the same stage cannot both win.
 */
@Slf4j
@Repository
public class RedisApprovalStore implements ApprovalStore {

    private static final String DEFINITIONS_KEY = "conductor:approval:definitions";
    private static final String WORKFLOWS_KEY = "conductor:approval:workflows";
    private static final String VERSIONS_KEY = "conductor:approval:versions";
    private static final String STAGE_INDEX_KEY = "conductor:approval:stages";
    private static final String RUN_INDEX_KEY = "conductor:approval:runs";

    private static final RedisScript<Long> CREATE_WITH_RUN = new DefaultRedisScript<>(
        "redis.call('HSET', KEYS[1], ARGV[1], ARGV[2]); "
            + "redis.call('HSET', KEYS[2], ARGV[1], '0'); "
            + "redis.call('HSET', KEYS[4], ARGV[3], ARGV[1]); "
            + "for i = 5, #ARGV do redis.call('HSET', KEYS[3], ARGV[i], ARGV[1]); end; "
            + "redis.call('HSET', KEYS[5], ARGV[3], ARGV[4]); "
            + "return 1;",
        Long.class);

    private static final RedisScript<Long> COMPARE_AND_SAVE = new DefaultRedisScript<>(
        "if redis.call('HGET', KEYS[2], ARGV[1]) == ARGV[2] then "
            + "redis.call('HSET', KEYS[1], ARGV[1], ARGV[3]); "
            + "redis.call('HSET', KEYS[2], ARGV[1], ARGV[4]); "
            + "return 1; end; "
            + "return 0;",
        Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final RedisJson json;

    public RedisApprovalStore(ReactiveRedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.json = new RedisJson(objectMapper);
    }

    @Override
    public Mono<ApprovalWorkflowDefinition> saveDefinition(ApprovalWorkflowDefinition definition) {
        return redisTemplate.<String, String>opsForHash()
            .put(DEFINITIONS_KEY, definition.getName(), json.write(definition))
            .thenReturn(definition);
    }

    @Override
    public Mono<ApprovalWorkflowDefinition> findDefinition(String name) {
        return redisTemplate.<String, String>opsForHash()
            .get(DEFINITIONS_KEY, name)
            .map(value -> json.read(value, ApprovalWorkflowDefinition.class));
    }

    @Override
    public Flux<ApprovalWorkflowDefinition> findAllDefinitions() {
        return redisTemplate.<String, String>opsForHash()
            .values(DEFINITIONS_KEY)
            .map(value -> json.read(value, ApprovalWorkflowDefinition.class));
    }

    @Override
    public Mono<Void> createWithRun(ApprovalWorkflow workflow, ScheduledRun run) {
        workflow.setVersion(0);
        List<String> keys = List.of(WORKFLOWS_KEY, VERSIONS_KEY, STAGE_INDEX_KEY, RUN_INDEX_KEY,
            RedisScheduledRunStore.SCHEDULES_KEY);
        List<String> args = new ArrayList<>();
        args.add(workflow.getId());
        args.add(json.write(workflow));
        args.add(run.getId());
        args.add(json.write(run));
        for (ApprovalStage stage : workflow.getStages()) {
            args.add(stage.getId());
        }
        return redisTemplate.execute(CREATE_WITH_RUN, keys, args)
            .then()
            .doOnSuccess(v -> log.info("Stored approval workflow {} for scheduled run {}", workflow.getId(), run.getId()));
    }

    @Override
    public Mono<Boolean> compareAndSave(ApprovalWorkflow workflow) {
        long expected = workflow.getVersion();
        workflow.setVersion(expected + 1);
        String document = json.write(workflow);
        List<String> args = List.of(workflow.getId(), String.valueOf(expected), document, String.valueOf(expected + 1));

        return redisTemplate.execute(COMPARE_AND_SAVE, List.of(WORKFLOWS_KEY, VERSIONS_KEY), args)
            .next()
            .map(changed -> changed == 1L)
            .defaultIfEmpty(false)
            .doOnNext(saved -> {
                if (!saved) {
                    workflow.setVersion(expected);
                }
            });
    }

    @Override
    public Mono<ApprovalWorkflow> findWorkflow(String id) {
        return redisTemplate.<String, String>opsForHash()
            .get(WORKFLOWS_KEY, id)
            .map(value -> json.read(value, ApprovalWorkflow.class));
    }

    @Override
    public Mono<ApprovalWorkflow> findWorkflowByStage(String stageId) {
        return redisTemplate.<String, String>opsForHash()
            .get(STAGE_INDEX_KEY, stageId)
            .flatMap(this::findWorkflow);
    }

    @Override
    public Mono<ApprovalWorkflow> findWorkflowByRun(String scheduledRunId) {
        return redisTemplate.<String, String>opsForHash()
            .get(RUN_INDEX_KEY, scheduledRunId)
            .flatMap(this::findWorkflow);
    }

    @Override
    public Flux<ApprovalWorkflow> findAllWorkflows() {
        return redisTemplate.<String, String>opsForHash()
            .values(WORKFLOWS_KEY)
            .map(value -> json.read(value, ApprovalWorkflow.class));
    }
}
