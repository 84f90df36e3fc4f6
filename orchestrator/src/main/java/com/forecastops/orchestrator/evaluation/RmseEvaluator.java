package com.forecastops.orchestrator.evaluation;

import com.forecastops.orchestrator.model.DatasetLocation;
import com.forecastops.orchestrator.model.EvalResult;
import com.forecastops.orchestrator.model.ExecutionContext;
import com.forecastops.orchestrator.model.Metric;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.Evaluator;
import com.forecastops.orchestrator.task.TaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Evaluates yesterday's forecast: loads the actual and predicted CSVs,
 * scores them with {@link RmseScorer} and compares against the threshold.
 *
 * The model passes only when the threshold is strictly greater than the
 * score; a score equal to the threshold fails.
 */
@Component
public class RmseEvaluator implements Evaluator {

    private static final Logger log = LoggerFactory.getLogger(RmseEvaluator.class);

    private final ObjectStore objectStore;
    private final String      actualColumn;
    private final String      predictedColumn;

    public RmseEvaluator(ObjectStore objectStore,
                         @Value("${retrain.evaluation.actual-column:actual_power}") String actualColumn,
                         @Value("${retrain.evaluation.predicted-column:p50}") String predictedColumn) {
        this.objectStore     = objectStore;
        this.actualColumn    = actualColumn;
        this.predictedColumn = predictedColumn;
    }

    @Override
    public Evaluation evaluate(ExecutionContext ctx) {
        if (ctx.metric() != Metric.RMSE) {
            throw new TaskException(ErrorKind.INTERNAL, "Unsupported metric " + ctx.metric());
        }
        DatasetLocation loc = ctx.datasetLocation();
        List<SeriesPoint> actual    = load(loc.bucket(), loc.histKey(), actualColumn);
        List<SeriesPoint> predicted = load(loc.bucket(), loc.predKey(), predictedColumn);
        log.debug("Loaded {} actual and {} predicted rows", actual.size(), predicted.size());

        double score = RmseScorer.averageRmse(actual, predicted, ctx.date());
        EvalResult result = ctx.threshold() > score ? EvalResult.PASS : EvalResult.FAIL;
        return new Evaluation(result, score);
    }

    private List<SeriesPoint> load(String bucket, String key, String valueColumn) {
        String source = "s3://" + bucket + "/" + key;
        try (InputStream in = objectStore.open(bucket, key)) {
            return CsvSeriesReader.read(in, source, valueColumn);
        } catch (IOException e) {
            throw new TaskException(ErrorKind.TRANSIENT, "Failed closing " + source, e);
        }
    }
}
