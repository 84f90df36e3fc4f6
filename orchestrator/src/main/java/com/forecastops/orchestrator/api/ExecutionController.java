package com.forecastops.orchestrator.api;

import com.forecastops.orchestrator.api.dto.ExecutionResponse;
import com.forecastops.orchestrator.api.dto.StartExecutionRequest;
import com.forecastops.orchestrator.api.dto.TransitionResponse;
import com.forecastops.orchestrator.model.Execution;
import com.forecastops.orchestrator.model.ExecutionState;
import com.forecastops.orchestrator.service.ExecutionService;
import com.forecastops.orchestrator.service.ExecutionService.CancelOutcome;
import com.forecastops.orchestrator.trigger.TriggerEvent;
import com.forecastops.orchestrator.trigger.TriggerException;
import com.forecastops.orchestrator.trigger.TriggerListener;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for workflow executions.
 *
 * POST /executions                  start an execution for a historical object
 * GET  /executions?state=WAITING    list executions in a state
 * GET  /executions/{id}             current state and context
 * GET  /executions/{id}/transitions audit trail of state changes
 * POST /executions/{id}/cancel      stop observing and fail the execution
 */
@RestController
@RequestMapping("/executions")
public class ExecutionController {

    private final ExecutionService executionService;
    private final TriggerListener  triggerListener;

    public ExecutionController(ExecutionService executionService, TriggerListener triggerListener) {
        this.executionService = executionService;
        this.triggerListener  = triggerListener;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/executions \
     *     -H "Content-Type: application/json" \
     *     -d '{"bucket":"solar-forecasts","key":"data/hist/2024-05-01/hist-solar.csv"}'
     */
    @PostMapping
    public ResponseEntity<ExecutionResponse> start(@RequestBody StartExecutionRequest req) {
        Execution execution = startOrReject(triggerListener, req.toEvent());
        return ResponseEntity.status(HttpStatus.CREATED).body(view(execution));
    }

    @GetMapping
    public List<ExecutionResponse> list(@RequestParam ExecutionState state) {
        return executionService.findByState(state).stream()
                .map(this::view)
                .toList();
    }

    @GetMapping("/{id}")
    public ExecutionResponse get(@PathVariable UUID id) {
        return executionService.findById(id)
                .map(this::view)
                .orElseThrow(() -> notFound(id));
    }

    @GetMapping("/{id}/transitions")
    public List<TransitionResponse> transitions(@PathVariable UUID id) {
        executionService.findById(id).orElseThrow(() -> notFound(id));
        return executionService.getTransitions(id).stream()
                .map(TransitionResponse::from)
                .toList();
    }

    /**
     * HTTP 202: cancelled, or cancel requested from the running worker
     * HTTP 404: unknown id
     * HTTP 409: execution already finished
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable UUID id) {
        CancelOutcome outcome = executionService.cancel(id);
        return switch (outcome) {
            case NOT_FOUND -> throw notFound(id);
            case ALREADY_TERMINAL -> throw new ResponseStatusException(
                    HttpStatus.CONFLICT, "Execution already finished: " + id);
            case CANCELLED, CANCEL_REQUESTED -> ResponseEntity.accepted()
                    .body(Map.of("id", id.toString(), "outcome", outcome.name()));
        };
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Trigger errors never create an execution; map them to the caller's status code. */
    static Execution startOrReject(TriggerListener listener, TriggerEvent event) {
        try {
            return listener.start(event);
        } catch (TriggerException e) {
            HttpStatus status = e.getKind() == TriggerException.Kind.INPUT
                    ? HttpStatus.BAD_REQUEST
                    : HttpStatus.SERVICE_UNAVAILABLE;
            throw new ResponseStatusException(status, e.getMessage(), e);
        }
    }

    private ExecutionResponse view(Execution execution) {
        return ExecutionResponse.from(execution, executionService.contextOf(execution));
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Execution not found: " + id);
    }
}
