package com.forecastops.orchestrator.model;

/**
 * Objective metric used both to judge the deployed model and to rank
 * retrained candidates. Lower is better.
 */
public enum Metric {
    RMSE
}
