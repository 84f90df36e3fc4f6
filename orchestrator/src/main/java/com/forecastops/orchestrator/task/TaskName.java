package com.forecastops.orchestrator.task;

/** The task invocations the workflow makes; used as the metrics tag. */
public enum TaskName {
    EVALUATE,
    START_TRAINING,
    POLL_TRAINING,
    SELECT_CANDIDATE,
    NOTIFY;

    public String tag() {
        return name().toLowerCase();
    }
}
