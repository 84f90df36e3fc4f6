package com.forecastops.orchestrator.trigger;

/**
 * A newly written historical-data object.
 *
 * The key encodes the evaluation date as its parent path segment,
 * e.g. {@code data/hist/2024-05-01/hist-solar.csv}.
 */
public record TriggerEvent(String bucket, String key) {}
