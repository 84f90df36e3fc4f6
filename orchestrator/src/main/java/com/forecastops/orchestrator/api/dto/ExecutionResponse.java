package com.forecastops.orchestrator.api.dto;

import com.forecastops.orchestrator.model.Execution;
import com.forecastops.orchestrator.model.ExecutionContext;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for execution endpoints. Carries the full context so a
 * caller can see how far the workflow got.
 */
public record ExecutionResponse(
        UUID             id,
        String           state,
        boolean          terminal,
        ExecutionContext context,
        int              pollCount,
        Instant          nextRunAt,
        String           failureKind,
        String           failureReason,
        Instant          createdAt,
        Instant          updatedAt,
        Instant          finishedAt
) {
    public static ExecutionResponse from(Execution execution, ExecutionContext context) {
        return new ExecutionResponse(
                execution.getId(),
                execution.getState().name(),
                execution.isTerminal(),
                context,
                execution.getPollCount(),
                execution.getNextRunAt(),
                execution.getFailureKind(),
                execution.getFailureReason(),
                execution.getCreatedAt(),
                execution.getUpdatedAt(),
                execution.getFinishedAt()
        );
    }
}
