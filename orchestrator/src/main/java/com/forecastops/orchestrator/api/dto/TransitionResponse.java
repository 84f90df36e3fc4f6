package com.forecastops.orchestrator.api.dto;

import com.forecastops.orchestrator.model.ExecutionState;
import com.forecastops.orchestrator.model.TransitionRecord;

import java.time.Instant;

/** One entry of GET /executions/{id}/transitions. */
public record TransitionResponse(ExecutionState from, ExecutionState to, String detail, Instant at) {

    public static TransitionResponse from(TransitionRecord t) {
        return new TransitionResponse(t.getFromState(), t.getToState(), t.getDetail(), t.getCreatedAt());
    }
}
