package com.forecastops.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

/**
 * The data record threaded through one workflow execution.
 *
 * The record is append-only: the creation fields are fixed by the trigger,
 * and every later field is set exactly once by the task that owns it.
 * Each {@code withX} method returns an augmented copy and refuses to
 * overwrite a field that is already set. {@code job_status} is the one
 * exception: polling refreshes it on every cycle.
 *
 * Stored as JSON in executions.context_json. Unknown fields are ignored on
 * read so older rows stay readable when fields are added.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionContext(
        @JsonProperty("dataset_location")     DatasetLocation datasetLocation,
        @JsonProperty("date")
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
                                              LocalDate date,
        @JsonProperty("threshold")            double threshold,
        @JsonProperty("metric")               Metric metric,
        @JsonProperty("eval_result")          EvalResult evalResult,
        @JsonProperty("average_score")        Double averageScore,
        @JsonProperty("job_id")               String jobId,
        @JsonProperty("job_status")           JobStatus jobStatus,
        @JsonProperty("best_candidate_name")  String bestCandidateName,
        @JsonProperty("best_candidate_score") Double bestCandidateScore
) {

    public ExecutionContext {
        Objects.requireNonNull(datasetLocation, "dataset_location");
        Objects.requireNonNull(date, "date");
        if (metric == null) metric = Metric.RMSE;
    }

    /** Initial context built by the trigger listener. */
    public static ExecutionContext initial(DatasetLocation location, LocalDate date,
                                           double threshold, Metric metric) {
        return new ExecutionContext(location, date, threshold, metric,
                null, null, null, null, null, null);
    }

    // ------------------------------------------------------------------
    // Task outputs
    // ------------------------------------------------------------------

    public ExecutionContext withEvaluation(EvalResult result, double score) {
        requireUnset("eval_result", evalResult);
        requireUnset("average_score", averageScore);
        return new ExecutionContext(datasetLocation, date, threshold, metric,
                Objects.requireNonNull(result), score, jobId, jobStatus,
                bestCandidateName, bestCandidateScore);
    }

    public ExecutionContext withJobId(String id) {
        requireUnset("job_id", jobId);
        return new ExecutionContext(datasetLocation, date, threshold, metric,
                evalResult, averageScore, Objects.requireNonNull(id), jobStatus,
                bestCandidateName, bestCandidateScore);
    }

    /** Refreshed by every poll, so this one may overwrite. */
    public ExecutionContext withJobStatus(JobStatus status) {
        return new ExecutionContext(datasetLocation, date, threshold, metric,
                evalResult, averageScore, jobId, Objects.requireNonNull(status),
                bestCandidateName, bestCandidateScore);
    }

    public ExecutionContext withBestCandidate(String name, double score) {
        requireUnset("best_candidate_name", bestCandidateName);
        requireUnset("best_candidate_score", bestCandidateScore);
        return new ExecutionContext(datasetLocation, date, threshold, metric,
                evalResult, averageScore, jobId, jobStatus,
                Objects.requireNonNull(name), score);
    }

    private static void requireUnset(String field, Object current) {
        if (current != null) {
            throw new IllegalStateException("Execution context field '" + field + "' is already set");
        }
    }
}
