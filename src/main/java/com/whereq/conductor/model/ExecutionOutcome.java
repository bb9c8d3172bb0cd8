package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * How an execution ended. Returned across the backend boundary instead of throwing.
 */
@Getter
@ToString
@AllArgsConstructor
public class ExecutionOutcome {

    public enum Kind {
        COMPLETED,
        ERRORED,
        TIMED_OUT
    }

    private final Kind kind;

    private final Object output;

    private final FailureInfo failure;

    public static ExecutionOutcome completed(Object output) {
        return new ExecutionOutcome(Kind.COMPLETED, output, null);
    }

    public static ExecutionOutcome errored(FailureInfo failure) {
        return new ExecutionOutcome(Kind.ERRORED, null, failure);
    }

    public static ExecutionOutcome timedOut(FailureInfo failure) {
        return new ExecutionOutcome(Kind.TIMED_OUT, null, failure);
    }

    /**
     * Status recorded on the JobResult. A timeout is an error.
     */
    public JobResultStatus toStatus() {
        return kind == Kind.COMPLETED ? JobResultStatus.COMPLETED : JobResultStatus.ERRORED;
    }
}
