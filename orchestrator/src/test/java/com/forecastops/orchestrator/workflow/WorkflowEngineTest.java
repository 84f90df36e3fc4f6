package com.forecastops.orchestrator.workflow;

import com.forecastops.orchestrator.model.DatasetLocation;
import com.forecastops.orchestrator.model.EvalResult;
import com.forecastops.orchestrator.model.ExecutionContext;
import com.forecastops.orchestrator.model.ExecutionState;
import com.forecastops.orchestrator.model.JobStatus;
import com.forecastops.orchestrator.model.Metric;
import com.forecastops.orchestrator.task.CandidateSelector;
import com.forecastops.orchestrator.task.CandidateSelector.Candidate;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.Evaluator;
import com.forecastops.orchestrator.task.Evaluator.Evaluation;
import com.forecastops.orchestrator.task.Notifier;
import com.forecastops.orchestrator.task.RetryPolicy;
import com.forecastops.orchestrator.task.TaskException;
import com.forecastops.orchestrator.task.TaskInvoker;
import com.forecastops.orchestrator.task.TrainingJobManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * One-state-at-a-time tests for WorkflowEngine.
 * Collaborators are Mockito mocks; retries do not sleep.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowEngineTest {

    @Mock Evaluator          evaluator;
    @Mock TrainingJobManager trainingJobs;
    @Mock CandidateSelector  candidateSelector;
    @Mock Notifier           notifier;

    WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        TaskInvoker invoker = new TaskInvoker(new RetryPolicy(3, Duration.ofSeconds(2), 2.0),
                new SimpleMeterRegistry(), d -> { });
        engine = new WorkflowEngine(evaluator, trainingJobs, candidateSelector, notifier, invoker);
    }

    // ------------------------------------------------------------------
    // Task states
    // ------------------------------------------------------------------

    @Test
    void evaluating_recordsScoreAndMovesToChoice() {
        when(evaluator.evaluate(any())).thenReturn(new Evaluation(EvalResult.FAIL, 60.0));

        Advance a = engine.advance(ExecutionState.EVALUATING, initial());

        assertThat(a.to()).isEqualTo(ExecutionState.EVAL_CHOICE);
        assertThat(a.context().evalResult()).isEqualTo(EvalResult.FAIL);
        assertThat(a.context().averageScore()).isEqualTo(60.0);
    }

    @Test
    void evaluating_dataLoadError_failsExecution() {
        when(evaluator.evaluate(any())).thenThrow(new TaskException(ErrorKind.DATA_LOAD, "missing pred"));

        Advance a = engine.advance(ExecutionState.EVALUATING, initial());

        assertThat(a.failed()).isTrue();
        assertThat(a.failureKind()).isEqualTo(ErrorKind.DATA_LOAD);
        verify(evaluator, times(1)).evaluate(any());
    }

    @Test
    void retraining_recordsJobAndSuspends() {
        when(trainingJobs.start(any())).thenReturn("ts-20240501-000000-abcd");

        Advance a = engine.advance(ExecutionState.RETRAINING, evaluated(EvalResult.FAIL));

        assertThat(a.to()).isEqualTo(ExecutionState.WAITING);
        assertThat(a.suspends()).isTrue();
        assertThat(a.context().jobId()).isEqualTo("ts-20240501-000000-abcd");
        assertThat(a.context().jobStatus()).isEqualTo(JobStatus.SUBMITTED);
    }

    @Test
    void retraining_submissionRejected_failsWithoutRetry() {
        when(trainingJobs.start(any())).thenThrow(new TaskException(ErrorKind.SUBMISSION, "bad role"));

        Advance a = engine.advance(ExecutionState.RETRAINING, evaluated(EvalResult.FAIL));

        assertThat(a.failureKind()).isEqualTo(ErrorKind.SUBMISSION);
        verify(trainingJobs, times(1)).start(any());
    }

    @Test
    void waiting_alwaysPollsNext() {
        Advance a = engine.advance(ExecutionState.WAITING, withJob());

        assertThat(a.to()).isEqualTo(ExecutionState.POLLING);
        verifyNoInteractions(trainingJobs);
    }

    @Test
    void polling_throttledThenAnswers_retried() {
        when(trainingJobs.poll("job-1"))
                .thenThrow(new TaskException(ErrorKind.QUERY, "throttled"))
                .thenReturn(JobStatus.IN_PROGRESS);

        Advance a = engine.advance(ExecutionState.POLLING, withJob());

        assertThat(a.to()).isEqualTo(ExecutionState.STATUS_CHOICE);
        assertThat(a.context().jobStatus()).isEqualTo(JobStatus.IN_PROGRESS);
        verify(trainingJobs, times(2)).poll("job-1");
    }

    @Test
    void selectingCandidate_recordsBestCandidate() {
        when(candidateSelector.select("job-1")).thenReturn(new Candidate("cand-7", 41.0));

        Advance a = engine.advance(ExecutionState.SELECTING_CANDIDATE, withJob().withJobStatus(JobStatus.COMPLETED));

        assertThat(a.to()).isEqualTo(ExecutionState.NOTIFYING);
        assertThat(a.context().bestCandidateName()).isEqualTo("cand-7");
        assertThat(a.context().bestCandidateScore()).isEqualTo(41.0);
    }

    @Test
    void selectingCandidate_noCandidate_fails() {
        when(candidateSelector.select("job-1")).thenThrow(new TaskException(ErrorKind.NO_CANDIDATE, "none"));

        Advance a = engine.advance(ExecutionState.SELECTING_CANDIDATE, withJob());

        assertThat(a.failureKind()).isEqualTo(ErrorKind.NO_CANDIDATE);
    }

    @Test
    void notifying_deliveryFailure_stillCompletes() {
        doThrow(new TaskException(ErrorKind.NOTIFICATION, "topic gone")).when(notifier).report(any());

        Advance a = engine.advance(ExecutionState.NOTIFYING, evaluated(EvalResult.PASS));

        assertThat(a.to()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(a.detail()).contains("Notification failed");
        verify(notifier, times(3)).report(any());
    }

    // ------------------------------------------------------------------
    // Choice states
    // ------------------------------------------------------------------

    @Test
    void statusChoice_failedJob_failsWithTrainingJobFailed() {
        Advance a = engine.advance(ExecutionState.STATUS_CHOICE, withJob().withJobStatus(JobStatus.FAILED));

        assertThat(a.to()).isEqualTo(ExecutionState.FAILED);
        assertThat(a.failureKind()).isEqualTo(ErrorKind.TRAINING_JOB_FAILED);
    }

    @Test
    void statusChoice_inProgress_waitsAgain() {
        Advance a = engine.advance(ExecutionState.STATUS_CHOICE, withJob().withJobStatus(JobStatus.IN_PROGRESS));

        assertThat(a.suspends()).isTrue();
    }

    @Test
    void evalChoice_withoutResult_internalError() {
        Advance a = engine.advance(ExecutionState.EVAL_CHOICE, initial());

        assertThat(a.failureKind()).isEqualTo(ErrorKind.INTERNAL);
    }

    @Test
    void terminalState_rejected() {
        assertThatThrownBy(() -> engine.advance(ExecutionState.COMPLETED, initial()))
                .isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static ExecutionContext initial() {
        return ExecutionContext.initial(
                new DatasetLocation("solar-forecasts", "data/hist/2024-05-01/h.csv", "data/pred/2024-05-01/h.csv"),
                LocalDate.of(2024, 5, 1), 50.0, Metric.RMSE);
    }

    static ExecutionContext evaluated(EvalResult result) {
        return initial().withEvaluation(result, result == EvalResult.PASS ? 40.0 : 60.0);
    }

    static ExecutionContext withJob() {
        return evaluated(EvalResult.FAIL).withJobId("job-1").withJobStatus(JobStatus.SUBMITTED);
    }
}
