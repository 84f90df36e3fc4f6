package com.forecastops.orchestrator.task;

import com.forecastops.orchestrator.model.ExecutionContext;
import com.forecastops.orchestrator.model.JobStatus;

/**
 * Submits and observes retraining jobs.
 *
 * Neither call blocks on the job itself; waiting between polls belongs to
 * the workflow state machine.
 */
public interface TrainingJobManager {

    /**
     * Submit a retraining job for the context's historical data.
     *
     * @return the new job id
     * @throws TaskException SUBMISSION if the job was rejected
     */
    String start(ExecutionContext context);

    /**
     * Current status of a job.
     *
     * @throws TaskException QUERY if the status could not be read
     */
    JobStatus poll(String jobId);

    /** Ask the training service to stop a job. Best-effort. */
    void stop(String jobId);
}
