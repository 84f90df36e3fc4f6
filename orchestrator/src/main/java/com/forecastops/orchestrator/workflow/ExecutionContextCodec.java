package com.forecastops.orchestrator.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastops.orchestrator.model.ExecutionContext;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the execution context column.
 */
@Component
public class ExecutionContextCodec {

    private final ObjectMapper objectMapper;

    public ExecutionContextCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(ExecutionContext ctx) {
        try {
            return objectMapper.writeValueAsString(ctx);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise execution context", e);
        }
    }

    public ExecutionContext read(String json) {
        try {
            return objectMapper.readValue(json, ExecutionContext.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt execution context: " + e.getOriginalMessage(), e);
        }
    }
}
