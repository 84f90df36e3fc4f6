package com.forecastops.orchestrator.evaluation;

import com.forecastops.orchestrator.model.DatasetLocation;
import com.forecastops.orchestrator.model.EvalResult;
import com.forecastops.orchestrator.model.ExecutionContext;
import com.forecastops.orchestrator.model.Metric;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.Evaluator.Evaluation;
import com.forecastops.orchestrator.task.TaskException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RmseEvaluator. The bucket is a mocked ObjectStore.
 */
@ExtendWith(MockitoExtension.class)
class RmseEvaluatorTest {

    static final String BUCKET   = "solar-forecasts";
    static final String HIST_KEY = "data/hist/2024-05-01/hist-solar.csv";
    static final String PRED_KEY = "data/pred/2024-05-01/pred-solar.csv";

    @Mock ObjectStore objectStore;

    RmseEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new RmseEvaluator(objectStore, "actual_power", "p50");
    }

    @Test
    void evaluate_scoreBelowThreshold_passes() {
        // single id, diffs 30 and 40 -> rmse sqrt(1250) ~ 35.36
        stubObjects("""
                id,timestamp,actual_power
                s1,2024-05-01 10:00:00,100
                s1,2024-05-01 10:15:00,100
                """, """
                id,timestamp,p50
                s1,2024-05-01 10:00:00,70
                s1,2024-05-01 10:15:00,140
                """);

        Evaluation eval = evaluator.evaluate(context(50));

        assertThat(eval.result()).isEqualTo(EvalResult.PASS);
        assertThat(eval.averageScore()).isCloseTo(Math.sqrt(1250), within(1e-9));
    }

    @Test
    void evaluate_scoreEqualToThreshold_fails() {
        stubObjects("""
                id,timestamp,actual_power
                s1,2024-05-01 10:00:00,100
                """, """
                id,timestamp,p50
                s1,2024-05-01 10:00:00,50
                """);

        Evaluation eval = evaluator.evaluate(context(50));

        assertThat(eval.averageScore()).isEqualTo(50.0);
        assertThat(eval.result()).isEqualTo(EvalResult.FAIL);
    }

    @Test
    void evaluate_thresholdJustAboveScore_passes() {
        stubObjects("""
                id,timestamp,actual_power
                s1,2024-05-01 10:00:00,100
                """, """
                id,timestamp,p50
                s1,2024-05-01 10:00:00,50
                """);

        assertThat(evaluator.evaluate(context(50.001)).result()).isEqualTo(EvalResult.PASS);
    }

    @Test
    void evaluate_missingPredictionObject_dataLoad() {
        when(objectStore.open(BUCKET, HIST_KEY)).thenReturn(csv("id,timestamp,actual_power\n"));
        when(objectStore.open(BUCKET, PRED_KEY))
                .thenThrow(new TaskException(ErrorKind.DATA_LOAD, "No such key " + PRED_KEY));

        assertThatThrownBy(() -> evaluator.evaluate(context(50)))
                .isInstanceOf(TaskException.class)
                .extracting(e -> ((TaskException) e).getKind())
                .isEqualTo(ErrorKind.DATA_LOAD);
    }

    @Test
    void evaluate_noMatchingRows_dataMismatch() {
        stubObjects("""
                id,timestamp,actual_power
                s1,2024-05-01 10:00:00,100
                """, """
                id,timestamp,p50
                s2,2024-05-01 10:00:00,100
                """);

        assertThatThrownBy(() -> evaluator.evaluate(context(50)))
                .isInstanceOf(TaskException.class)
                .extracting(e -> ((TaskException) e).getKind())
                .isEqualTo(ErrorKind.DATA_MISMATCH);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void stubObjects(String hist, String pred) {
        when(objectStore.open(BUCKET, HIST_KEY)).thenReturn(csv(hist));
        when(objectStore.open(BUCKET, PRED_KEY)).thenReturn(csv(pred));
    }

    private static ByteArrayInputStream csv(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    private static ExecutionContext context(double threshold) {
        return ExecutionContext.initial(new DatasetLocation(BUCKET, HIST_KEY, PRED_KEY),
                LocalDate.of(2024, 5, 1), threshold, Metric.RMSE);
    }
}
