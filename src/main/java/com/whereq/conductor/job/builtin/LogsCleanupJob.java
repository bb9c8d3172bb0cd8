package com.whereq.conductor.job.builtin;

import com.whereq.conductor.job.Job;
import com.whereq.conductor.job.JobContext;
import com.whereq.conductor.job.JobMeta;
import com.whereq.conductor.model.JobResult;
import com.whereq.conductor.model.JobVariable;
import com.whereq.conductor.model.TypedArgs;
import com.whereq.conductor.model.VariableType;
import com.whereq.conductor.store.JobLogStore;
import com.whereq.conductor.store.JobResultStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Deletes finished job results, with their logs, older than a cutoff
 */
@Component
@RequiredArgsConstructor
public class LogsCleanupJob implements Job {

    public static final String ID = "LogsCleanup";

    static final String MAX_AGE_DAYS = "max_age_days";

    private static final int SCAN_LIMIT = 10_000;
    private static final Duration STORE_TIMEOUT = Duration.ofSeconds(30);

    private final JobResultStore resultStore;
    private final JobLogStore logStore;
    private final Clock clock;

    @Override
    public JobMeta meta() {
        return JobMeta.builder()
            .id(ID)
            .name("Logs Cleanup")
            .description("Delete finished job results and their logs older than the given age")
            .variables(List.of(JobVariable.builder()
                .name(MAX_AGE_DAYS)
                .type(VariableType.INTEGER)
                .label("Maximum age (days)")
                .minValue(0L)
                .defaultValue(30)
                .build()))
            .singleton(true)
            .dryrunDefault(true)
            .build();
    }

    @Override
    public Object run(JobContext context, TypedArgs args) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(args.getLong(MAX_AGE_DAYS)));
        List<JobResult> expired = resultStore.list(null, null, SCAN_LIMIT)
            .filter(result -> result.getStatus().isTerminal())
            .filter(result -> !result.getId().equals(context.getJobResultId()))
            .filter(result -> result.getCompletedAt() != null && result.getCompletedAt().isBefore(cutoff))
            .collectList()
            .block(STORE_TIMEOUT);
        int count = expired == null ? 0 : expired.size();

        if (context.isDryrun()) {
            context.getLogger().info("Dry run: " + count + " job result(s) completed before " + cutoff + " would be deleted");
            return Map.of("deleted", 0, "matched", count);
        }
        int deleted = 0;
        for (JobResult result : expired == null ? List.<JobResult>of() : expired) {
            if (context.isSoftLimitExceeded()) {
                context.getLogger().warning("Soft time limit reached, stopping after " + deleted + " deletion(s)");
                break;
            }
            logStore.deleteAll(result.getId()).block(STORE_TIMEOUT);
            if (Boolean.TRUE.equals(resultStore.delete(result.getId()).block(STORE_TIMEOUT))) {
                deleted++;
            }
        }
        context.getLogger().success("Deleted " + deleted + " job result(s) completed before " + cutoff);
        return Map.of("deleted", deleted, "matched", count);
    }
}
