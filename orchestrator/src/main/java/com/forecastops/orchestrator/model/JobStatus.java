package com.forecastops.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of an external training job as observed by polling.
 *
 * Serialised with the training service's own spelling so the execution
 * context JSON reads the same as the job description it came from.
 */
public enum JobStatus {
    SUBMITTED("Submitted"),
    IN_PROGRESS("InProgress"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    STOPPED("Stopped");

    private final String wireName;

    JobStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Failed and Stopped end the workflow; Completed moves on to candidate selection. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }
}
