package com.forecastops.orchestrator.task;

import com.forecastops.orchestrator.model.EvalResult;
import com.forecastops.orchestrator.model.ExecutionContext;

/**
 * Scores the deployed model's forecast for the context's date against the
 * actual series and judges it against the context's threshold.
 *
 * @throws TaskException DATA_LOAD, DATA_MISMATCH or TRANSIENT
 */
public interface Evaluator {

    Evaluation evaluate(ExecutionContext context);

    record Evaluation(EvalResult result, double averageScore) {}
}
