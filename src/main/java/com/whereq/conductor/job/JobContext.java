package com.whereq.conductor.job;

import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.model.FileProxy;
import com.whereq.conductor.store.FileProxyStore;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * What a running job can see of its execution
 */
@Getter
public class JobContext {

    private final String jobResultId;

    private final String jobId;

    private final String user;

    private final boolean dryrun;

    private final JobLogger logger;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean softLimitExceeded = new AtomicBoolean(false);

    @Getter(AccessLevel.NONE)
    private final FileProxyStore fileProxyStore;

    public JobContext(String jobResultId, String jobId, String user, boolean dryrun,
                      JobLogger logger, FileProxyStore fileProxyStore) {
        this.jobResultId = jobResultId;
        this.jobId = jobId;
        this.user = user;
        this.dryrun = dryrun;
        this.logger = logger;
        this.fileProxyStore = fileProxyStore;
    }

    /**
     * Set once the soft time limit passed. Long running jobs should check it and wind down.
     */
    public boolean isSoftLimitExceeded() {
        return softLimitExceeded.get();
    }

    public void signalSoftLimit() {
        softLimitExceeded.set(true);
    }

    /**
     * Content of an uploaded file passed in a FILE variable
     */
    public byte[] readFile(String fileProxyId) {
        FileProxy file = fileProxyStore.find(fileProxyId).block(Duration.ofSeconds(10));
        if (file == null) {
            throw new ValidationException("File not found or expired: " + fileProxyId);
        }
        return file.getContent();
    }
}
