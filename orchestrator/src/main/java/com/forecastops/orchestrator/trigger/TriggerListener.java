package com.forecastops.orchestrator.trigger;

import com.forecastops.orchestrator.model.DatasetLocation;
import com.forecastops.orchestrator.model.Execution;
import com.forecastops.orchestrator.model.ExecutionContext;
import com.forecastops.orchestrator.model.Metric;
import com.forecastops.orchestrator.service.ExecutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Entry point for "new data arrived" events.
 *
 * From the historical object's location it derives the paired prediction
 * key, the evaluation date and the current threshold, then starts exactly
 * one execution.
 */
@Component
public class TriggerListener {

    private static final Logger log = LoggerFactory.getLogger(TriggerListener.class);

    private final ExecutionService executionService;
    private final ThresholdSource  thresholdSource;
    private final String           thresholdParameter;

    public TriggerListener(ExecutionService executionService,
                           ThresholdSource thresholdSource,
                           @Value("${retrain.trigger.threshold-parameter:rmse}") String thresholdParameter) {
        this.executionService   = executionService;
        this.thresholdSource    = thresholdSource;
        this.thresholdParameter = thresholdParameter;
    }

    /**
     * @throws TriggerException INPUT for a malformed event,
     *         CONFIGURATION if the threshold cannot be fetched
     */
    public Execution start(TriggerEvent event) {
        if (event == null || isBlank(event.bucket()) || isBlank(event.key())) {
            throw new TriggerException(TriggerException.Kind.INPUT, "Event must carry a bucket and a key");
        }
        String bucket  = event.bucket();
        String histKey = event.key();
        String predKey = predictionKey(histKey);
        LocalDate date = evaluationDate(histKey);

        double threshold = thresholdSource.threshold(thresholdParameter);

        ExecutionContext ctx = ExecutionContext.initial(
                new DatasetLocation(bucket, histKey, predKey), date, threshold, Metric.RMSE);
        log.info("Trigger s3://{}/{} → date={}, pred_key={}, threshold={}",
                bucket, histKey, date, predKey, threshold);
        return executionService.start(ctx, bucket + "/" + histKey);
    }

    /** The prediction object sits at the same path with every "hist" replaced by "pred". */
    public static String predictionKey(String histKey) {
        return histKey.replace("hist", "pred");
    }

    /**
     * The date is the key's parent path segment:
     * {@code data/hist/2024-05-01/file.csv} → 2024-05-01.
     */
    public static LocalDate evaluationDate(String key) {
        String[] segments = key.split("/");
        if (segments.length < 2) {
            throw new TriggerException(TriggerException.Kind.INPUT,
                    "Key '" + key + "' has no date path segment");
        }
        String segment = segments[segments.length - 2];
        try {
            return LocalDate.parse(segment);
        } catch (DateTimeParseException e) {
            throw new TriggerException(TriggerException.Kind.INPUT,
                    "Key '" + key + "' parent segment '" + segment + "' is not a YYYY-MM-DD date", e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
