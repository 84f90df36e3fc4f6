package com.forecastops.orchestrator.trigger;

/**
 * Configuration store holding the acceptance threshold.
 */
public interface ThresholdSource {

    /**
     * @throws TriggerException CONFIGURATION if the parameter is missing,
     *         unreadable or not numeric
     */
    double threshold(String parameterName);
}
