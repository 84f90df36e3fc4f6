package com.forecastops.orchestrator.model;

/**
 * States of one retraining workflow execution.
 *
 * Transitions:
 *   EVALUATING → EVAL_CHOICE → SUCCEEDED → NOTIFYING → COMPLETED
 *                            ↘ RETRAINING → WAITING → POLLING → STATUS_CHOICE
 *   STATUS_CHOICE → WAITING              (job still running)
 *   STATUS_CHOICE → SELECTING_CANDIDATE  (job completed) → NOTIFYING → COMPLETED
 *
 * Any task failure, a failed/stopped training job, or a cancel request
 * moves the execution to FAILED.
 */
public enum ExecutionState {
    EVALUATING,
    EVAL_CHOICE,
    SUCCEEDED,
    RETRAINING,
    WAITING,
    POLLING,
    STATUS_CHOICE,
    SELECTING_CANDIDATE,
    NOTIFYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
