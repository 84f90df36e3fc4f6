package com.forecastops.orchestrator.workflow;

import com.forecastops.orchestrator.model.EvalResult;
import com.forecastops.orchestrator.model.ExecutionState;
import com.forecastops.orchestrator.model.JobStatus;

/**
 * The branching rules of the retraining workflow as pure functions.
 */
public final class WorkflowTransitions {

    private WorkflowTransitions() {}

    /** EVAL_CHOICE: a passing model skips retraining. */
    public static ExecutionState afterEvaluation(EvalResult result) {
        return switch (result) {
            case PASS -> ExecutionState.SUCCEEDED;
            case FAIL -> ExecutionState.RETRAINING;
        };
    }

    /**
     * STATUS_CHOICE: only Completed moves forward, Failed and Stopped abort,
     * every other status goes back to WAITING for another poll.
     */
    public static ExecutionState afterPoll(JobStatus status) {
        return switch (status) {
            case COMPLETED          -> ExecutionState.SELECTING_CANDIDATE;
            case FAILED, STOPPED    -> ExecutionState.FAILED;
            case SUBMITTED, IN_PROGRESS -> ExecutionState.WAITING;
        };
    }

    /** States whose successor is fixed regardless of task output. */
    public static ExecutionState fixedSuccessor(ExecutionState state) {
        return switch (state) {
            case EVALUATING          -> ExecutionState.EVAL_CHOICE;
            case SUCCEEDED           -> ExecutionState.NOTIFYING;
            case RETRAINING          -> ExecutionState.WAITING;
            case WAITING             -> ExecutionState.POLLING;
            case POLLING             -> ExecutionState.STATUS_CHOICE;
            case SELECTING_CANDIDATE -> ExecutionState.NOTIFYING;
            case NOTIFYING           -> ExecutionState.COMPLETED;
            default -> throw new IllegalArgumentException(state + " has no fixed successor");
        };
    }
}
