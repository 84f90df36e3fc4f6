package com.forecastops.orchestrator.task;

/**
 * Picks the best candidate of a completed training job and registers it as
 * a deployable model.
 *
 * @throws TaskException NO_CANDIDATE, QUERY, REGISTRATION or TRANSIENT
 */
public interface CandidateSelector {

    Candidate select(String jobId);

    record Candidate(String name, double score) {}
}
