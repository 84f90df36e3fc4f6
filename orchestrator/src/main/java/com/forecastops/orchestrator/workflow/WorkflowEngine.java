package com.forecastops.orchestrator.workflow;

import com.forecastops.orchestrator.model.ExecutionContext;
import com.forecastops.orchestrator.model.ExecutionState;
import com.forecastops.orchestrator.model.JobStatus;
import com.forecastops.orchestrator.task.CandidateSelector;
import com.forecastops.orchestrator.task.CandidateSelector.Candidate;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.Evaluator;
import com.forecastops.orchestrator.task.Evaluator.Evaluation;
import com.forecastops.orchestrator.task.Notifier;
import com.forecastops.orchestrator.task.TaskInvoker;
import com.forecastops.orchestrator.task.TaskName;
import com.forecastops.orchestrator.task.TaskResult;
import com.forecastops.orchestrator.task.TrainingJobManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Executes one state of the retraining workflow.
 *
 * Task states call their collaborator through the {@link TaskInvoker};
 * choice states apply {@link WorkflowTransitions}. The engine holds no
 * per-execution state: callers pass the current state and context in and
 * persist the returned {@link Advance} before asking for the next one.
 *
 * WAITING is the suspension point. The engine only knows that WAITING is
 * followed by POLLING; keeping the execution parked for the poll interval
 * is the runner's job.
 */
@Component
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final Evaluator          evaluator;
    private final TrainingJobManager trainingJobs;
    private final CandidateSelector  candidateSelector;
    private final Notifier           notifier;
    private final TaskInvoker        invoker;

    public WorkflowEngine(Evaluator evaluator,
                          TrainingJobManager trainingJobs,
                          CandidateSelector candidateSelector,
                          Notifier notifier,
                          TaskInvoker invoker) {
        this.evaluator         = evaluator;
        this.trainingJobs      = trainingJobs;
        this.candidateSelector = candidateSelector;
        this.notifier          = notifier;
        this.invoker           = invoker;
    }

    public Advance advance(ExecutionState state, ExecutionContext ctx) {
        return switch (state) {
            case EVALUATING          -> evaluate(ctx);
            case EVAL_CHOICE         -> chooseAfterEvaluation(ctx);
            case SUCCEEDED           -> Advance.to(state, WorkflowTransitions.fixedSuccessor(state), ctx,
                                                   "Current model within threshold");
            case RETRAINING          -> startRetraining(ctx);
            case WAITING             -> Advance.to(state, WorkflowTransitions.fixedSuccessor(state), ctx,
                                                   "Poll interval elapsed");
            case POLLING             -> poll(ctx);
            case STATUS_CHOICE       -> chooseAfterPoll(ctx);
            case SELECTING_CANDIDATE -> selectCandidate(ctx);
            case NOTIFYING           -> notifyReviewer(ctx);
            case COMPLETED, FAILED   -> throw new IllegalStateException(
                    "Execution already terminal in state " + state);
        };
    }

    // ------------------------------------------------------------------
    // Task states
    // ------------------------------------------------------------------

    private Advance evaluate(ExecutionContext ctx) {
        TaskResult<Evaluation> r = invoker.invoke(TaskName.EVALUATE, () -> evaluator.evaluate(ctx));
        if (!r.isSuccess()) {
            return Advance.fail(ExecutionState.EVALUATING, ctx, r.errorKind(), r.errorMessage());
        }
        Evaluation eval = r.value();
        log.info("Evaluation for {}: average {} = {} (threshold {}) → {}",
                ctx.date(), ctx.metric(), eval.averageScore(), ctx.threshold(), eval.result());
        return Advance.to(ExecutionState.EVALUATING, ExecutionState.EVAL_CHOICE,
                ctx.withEvaluation(eval.result(), eval.averageScore()),
                "average_score=" + eval.averageScore());
    }

    private Advance startRetraining(ExecutionContext ctx) {
        TaskResult<String> r = invoker.invoke(TaskName.START_TRAINING, () -> trainingJobs.start(ctx));
        if (!r.isSuccess()) {
            return Advance.fail(ExecutionState.RETRAINING, ctx, r.errorKind(), r.errorMessage());
        }
        log.info("Submitted retraining job {}", r.value());
        return Advance.to(ExecutionState.RETRAINING, ExecutionState.WAITING,
                ctx.withJobId(r.value()).withJobStatus(JobStatus.SUBMITTED),
                "job_id=" + r.value());
    }

    private Advance poll(ExecutionContext ctx) {
        TaskResult<JobStatus> r = invoker.invoke(TaskName.POLL_TRAINING, () -> trainingJobs.poll(ctx.jobId()));
        if (!r.isSuccess()) {
            return Advance.fail(ExecutionState.POLLING, ctx, r.errorKind(), r.errorMessage());
        }
        return Advance.to(ExecutionState.POLLING, ExecutionState.STATUS_CHOICE,
                ctx.withJobStatus(r.value()), "job_status=" + r.value().wireName());
    }

    private Advance selectCandidate(ExecutionContext ctx) {
        TaskResult<Candidate> r = invoker.invoke(TaskName.SELECT_CANDIDATE,
                () -> candidateSelector.select(ctx.jobId()));
        if (!r.isSuccess()) {
            return Advance.fail(ExecutionState.SELECTING_CANDIDATE, ctx, r.errorKind(), r.errorMessage());
        }
        Candidate best = r.value();
        log.info("Best candidate of job {}: {} ({} = {})", ctx.jobId(), best.name(), ctx.metric(), best.score());
        return Advance.to(ExecutionState.SELECTING_CANDIDATE, ExecutionState.NOTIFYING,
                ctx.withBestCandidate(best.name(), best.score()),
                "best_candidate=" + best.name());
    }

    /** Delivery is best-effort: a failed notification still completes the execution. */
    private Advance notifyReviewer(ExecutionContext ctx) {
        TaskResult<Boolean> r = invoker.invoke(TaskName.NOTIFY, () -> {
            notifier.report(ctx);
            return Boolean.TRUE;
        });
        if (!r.isSuccess()) {
            log.warn("Reviewer notification not delivered ({}): {}", r.errorKind(), r.errorMessage());
            return Advance.to(ExecutionState.NOTIFYING, ExecutionState.COMPLETED, ctx,
                    "Notification failed: " + r.errorMessage());
        }
        return Advance.to(ExecutionState.NOTIFYING, ExecutionState.COMPLETED, ctx, "Reviewer notified");
    }

    // ------------------------------------------------------------------
    // Choice states
    // ------------------------------------------------------------------

    private Advance chooseAfterEvaluation(ExecutionContext ctx) {
        if (ctx.evalResult() == null) {
            return Advance.fail(ExecutionState.EVAL_CHOICE, ctx, ErrorKind.INTERNAL,
                    "eval_result missing at EVAL_CHOICE");
        }
        return Advance.to(ExecutionState.EVAL_CHOICE,
                WorkflowTransitions.afterEvaluation(ctx.evalResult()), ctx,
                "eval_result=" + ctx.evalResult());
    }

    private Advance chooseAfterPoll(ExecutionContext ctx) {
        JobStatus status = ctx.jobStatus();
        if (status == null) {
            return Advance.fail(ExecutionState.STATUS_CHOICE, ctx, ErrorKind.INTERNAL,
                    "job_status missing at STATUS_CHOICE");
        }
        ExecutionState next = WorkflowTransitions.afterPoll(status);
        if (next == ExecutionState.FAILED) {
            log.error("Retraining job {} ended with status {}", ctx.jobId(), status.wireName());
            return Advance.fail(ExecutionState.STATUS_CHOICE, ctx, ErrorKind.TRAINING_JOB_FAILED,
                    "Training job " + ctx.jobId() + " " + status.wireName());
        }
        return Advance.to(ExecutionState.STATUS_CHOICE, next, ctx, "job_status=" + status.wireName());
    }
}
