package com.whereq.conductor.support;

import com.whereq.conductor.job.Job;
import com.whereq.conductor.job.JobContext;
import com.whereq.conductor.job.JobMeta;
import com.whereq.conductor.model.JobVariable;
import com.whereq.conductor.model.TypedArgs;
import com.whereq.conductor.model.VariableType;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Job whose metadata and body are supplied by the test
 */
public class ScriptedJob implements Job {

    @FunctionalInterface
    public interface Body {
        Object run(JobContext context, TypedArgs args) throws Exception;
    }

    private final JobMeta meta;
    private final Body body;
    private final AtomicInteger runs = new AtomicInteger();

    public ScriptedJob(JobMeta meta, Body body) {
        this.meta = meta;
        this.body = body;
    }

    @Override
    public JobMeta meta() {
        return meta;
    }

    @Override
    public Object run(JobContext context, TypedArgs args) throws Exception {
        runs.incrementAndGet();
        return body.run(context, args);
    }

    public int runs() {
        return runs.get();
    }

    public static ScriptedJob backup() {
        return new ScriptedJob(JobMeta.builder().id("BackupJob").name("Backup").build(), (context, args) -> {
            context.getLogger().info("Backing up");
            return "backed up";
        });
    }

    /**
     * Singleton job with a short hard limit
     */
    public static ScriptedJob longAudit() {
        return new ScriptedJob(JobMeta.builder()
            .id("LongAudit")
            .name("Long Audit")
            .singleton(true)
            .softTimeLimit(Duration.ofSeconds(30))
            .timeLimit(Duration.ofSeconds(60))
            .build(), (context, args) -> "audited");
    }

    public static ScriptedJob sensitive() {
        return new ScriptedJob(JobMeta.builder()
            .id("RotateSecret")
            .name("Rotate Secret")
            .hasSensitiveVariables(true)
            .variables(List.of(JobVariable.builder()
                .name("password")
                .type(VariableType.STRING)
                .build()))
            .build(), (context, args) -> null);
    }

    public static ScriptedJob failing() {
        return new ScriptedJob(JobMeta.builder().id("Failing").name("Failing").build(), (context, args) -> {
            throw new IllegalStateException("boom");
        });
    }
}
