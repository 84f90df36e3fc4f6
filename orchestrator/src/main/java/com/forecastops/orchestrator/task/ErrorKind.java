package com.forecastops.orchestrator.task;

/**
 * Failure taxonomy shared by every task of the workflow.
 *
 * Only retryable kinds are re-attempted by {@link TaskInvoker}; everything
 * else ends the execution on the first occurrence.
 */
public enum ErrorKind {
    DATA_LOAD(false),
    DATA_MISMATCH(false),
    SUBMISSION(false),
    QUERY(true),
    TRAINING_JOB_FAILED(false),
    NO_CANDIDATE(false),
    REGISTRATION(false),
    NOTIFICATION(true),
    TRANSIENT(true),
    CANCELLED(false),
    INTERNAL(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
