package com.forecastops.orchestrator.api;

import com.forecastops.orchestrator.api.dto.ExecutionResponse;
import com.forecastops.orchestrator.model.Execution;
import com.forecastops.orchestrator.service.ExecutionService;
import com.forecastops.orchestrator.trigger.ObjectCreatedNotification;
import com.forecastops.orchestrator.trigger.TriggerException;
import com.forecastops.orchestrator.trigger.TriggerListener;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Receives object-created notifications from the data bucket
 * (S3 event JSON, forwarded by a webhook subscription).
 */
@RestController
@RequestMapping("/events")
public class EventController {

    private final ExecutionService executionService;
    private final TriggerListener  triggerListener;

    public EventController(ExecutionService executionService, TriggerListener triggerListener) {
        this.executionService = executionService;
        this.triggerListener  = triggerListener;
    }

    @PostMapping("/object-created")
    public ResponseEntity<ExecutionResponse> objectCreated(@RequestBody ObjectCreatedNotification notification) {
        Execution execution;
        try {
            execution = ExecutionController.startOrReject(triggerListener, notification.firstEvent());
        } catch (TriggerException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ExecutionResponse.from(execution, executionService.contextOf(execution)));
    }
}
