package com.forecastops.orchestrator.evaluation;

import java.time.LocalDateTime;

/** One row of a historical or predicted series. */
public record SeriesPoint(String id, LocalDateTime timestamp, double value) {}
