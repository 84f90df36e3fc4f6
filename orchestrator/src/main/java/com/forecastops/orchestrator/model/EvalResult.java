package com.forecastops.orchestrator.model;

/** Outcome of the daily accuracy evaluation. */
public enum EvalResult {
    PASS,
    FAIL
}
