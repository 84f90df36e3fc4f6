package com.forecastops.orchestrator.evaluation;

import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.TaskException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Scores a predicted series against the actual one for a single day.
 *
 * Rows are matched on (id, timestamp) with inner-join semantics: a row
 * without a partner on the other side is dropped. When a key repeats,
 * every actual row pairs with every predicted row of that key. The score is
 * the RMSE of each id averaged over all ids that have at least one pair.
 */
public final class RmseScorer {

    private RmseScorer() {}

    private record Key(String id, LocalDateTime timestamp) {}

    /** One (actual, predicted) pair. */
    public record Pair(double actual, double predicted) {}

    /** Root of the mean squared difference. Zero for identical series. */
    public static double rmse(List<Pair> pairs) {
        if (pairs.isEmpty()) {
            throw new IllegalArgumentException("RMSE of an empty series is undefined");
        }
        double sumSq = 0;
        for (Pair p : pairs) {
            double d = p.actual() - p.predicted();
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / pairs.size());
    }

    /**
     * Pairs both series for the target date, grouped by id in sorted id order.
     */
    public static SortedMap<String, List<Pair>> join(List<SeriesPoint> actual,
                                                     List<SeriesPoint> predicted,
                                                     LocalDate date) {
        Map<Key, List<Double>> predictionsByKey = new HashMap<>();
        for (SeriesPoint p : predicted) {
            if (p.timestamp().toLocalDate().equals(date)) {
                predictionsByKey.computeIfAbsent(new Key(p.id(), p.timestamp()), k -> new ArrayList<>())
                        .add(p.value());
            }
        }

        SortedMap<String, List<Pair>> byId = new TreeMap<>();
        for (SeriesPoint a : actual) {
            if (!a.timestamp().toLocalDate().equals(date)) {
                continue;
            }
            List<Double> matches = predictionsByKey.get(new Key(a.id(), a.timestamp()));
            if (matches == null) {
                continue;
            }
            List<Pair> pairs = byId.computeIfAbsent(a.id(), k -> new ArrayList<>());
            for (double predictedValue : matches) {
                pairs.add(new Pair(a.value(), predictedValue));
            }
        }
        return byId;
    }

    /**
     * Average of the per-id RMSE.
     *
     * @throws TaskException DATA_MISMATCH when no id has a matched pair
     */
    public static double averageRmse(List<SeriesPoint> actual, List<SeriesPoint> predicted, LocalDate date) {
        SortedMap<String, List<Pair>> byId = join(actual, predicted, date);
        if (byId.isEmpty()) {
            throw new TaskException(ErrorKind.DATA_MISMATCH,
                    "No (id, timestamp) pairs match between actual and predicted series for " + date);
        }
        double total = 0;
        for (List<Pair> pairs : byId.values()) {
            total += rmse(pairs);
        }
        return total / byId.size();
    }
}
