package com.forecastops.orchestrator.workflow;

import com.forecastops.orchestrator.model.ExecutionContext;
import com.forecastops.orchestrator.model.ExecutionState;
import com.forecastops.orchestrator.task.ErrorKind;

/**
 * Result of advancing an execution by one state.
 *
 * @param from         state the execution was in
 * @param to           state it moves to
 * @param context      context after the step (unchanged for choice states)
 * @param failureKind  set only when {@code to} is FAILED
 * @param detail       human-readable note stored in the transition audit row
 */
public record Advance(ExecutionState from,
                      ExecutionState to,
                      ExecutionContext context,
                      ErrorKind failureKind,
                      String detail) {

    static Advance to(ExecutionState from, ExecutionState to, ExecutionContext ctx, String detail) {
        return new Advance(from, to, ctx, null, detail);
    }

    static Advance fail(ExecutionState from, ExecutionContext ctx, ErrorKind kind, String detail) {
        return new Advance(from, ExecutionState.FAILED, ctx, kind, detail);
    }

    public boolean failed() {
        return to == ExecutionState.FAILED;
    }

    /** True when the execution must be persisted and parked until the poll interval passes. */
    public boolean suspends() {
        return to == ExecutionState.WAITING;
    }
}
