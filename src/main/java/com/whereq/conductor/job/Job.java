package com.whereq.conductor.job;

import com.whereq.conductor.model.TypedArgs;

/**
 * A unit of background work. Implementations are Spring beans discovered by the
 * {@link com.whereq.conductor.registry.JobRegistry}.
 */
public interface Job {

    /**
     * Declarative metadata: id, variables, limits, flags
     */
    JobMeta meta();

    /**
     * Execute the job.
     *
     * @param context execution context: logger, dry-run flag, soft-limit signal
     * @param args inputs validated against {@link JobMeta#getVariables()}
     * @return JSON-serializable output stored on the JobResult, may be null
     * @throws Exception any failure; the result is recorded as errored
     */
    Object run(JobContext context, TypedArgs args) throws Exception;
}
