package com.forecastops.orchestrator.api.dto;

import com.forecastops.orchestrator.trigger.TriggerEvent;

/**
 * Request body for POST /executions: the historical object that just landed.
 */
public record StartExecutionRequest(String bucket, String key) {

    public TriggerEvent toEvent() {
        return new TriggerEvent(bucket, key);
    }
}
