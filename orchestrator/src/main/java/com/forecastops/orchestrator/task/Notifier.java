package com.forecastops.orchestrator.task;

import com.forecastops.orchestrator.model.ExecutionContext;

/**
 * Tells the human reviewer how the run ended. Failures never change the
 * execution's outcome.
 */
public interface Notifier {

    void report(ExecutionContext context);
}
