package com.forecastops.orchestrator.service;

import com.forecastops.orchestrator.model.Execution;
import com.forecastops.orchestrator.model.ExecutionContext;
import com.forecastops.orchestrator.model.ExecutionState;
import com.forecastops.orchestrator.model.TransitionRecord;
import com.forecastops.orchestrator.repository.ExecutionRepository;
import com.forecastops.orchestrator.repository.TransitionRepository;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.TrainingJobManager;
import com.forecastops.orchestrator.workflow.Advance;
import com.forecastops.orchestrator.workflow.ExecutionContextCodec;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable lifecycle of workflow executions.
 *
 * Every state change goes through here so that the executions row and its
 * transitions audit trail are written in the same transaction. A worker
 * never holds state that is not already persisted: after a crash the
 * execution resumes from the last committed state.
 */
@Service
public class ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionService.class);

    static final Set<ExecutionState> TERMINAL = EnumSet.of(ExecutionState.COMPLETED, ExecutionState.FAILED);

    public enum CancelOutcome { NOT_FOUND, ALREADY_TERMINAL, CANCELLED, CANCEL_REQUESTED }

    private final ExecutionRepository   executionRepo;
    private final TransitionRepository  transitionRepo;
    private final ExecutionContextCodec codec;
    private final TrainingJobManager    trainingJobs;
    private final MeterRegistry         meterRegistry;
    private final Duration              pollInterval;
    private final Duration              stallTimeout;
    private final boolean               deduplicateTriggers;

    public ExecutionService(ExecutionRepository executionRepo,
                            TransitionRepository transitionRepo,
                            ExecutionContextCodec codec,
                            TrainingJobManager trainingJobs,
                            MeterRegistry meterRegistry,
                            @Value("${retrain.workflow.poll-interval:5m}") Duration pollInterval,
                            @Value("${retrain.scheduler.stall-timeout:10m}") Duration stallTimeout,
                            @Value("${retrain.trigger.deduplicate:false}") boolean deduplicateTriggers) {
        this.executionRepo       = executionRepo;
        this.transitionRepo      = transitionRepo;
        this.codec               = codec;
        this.trainingJobs        = trainingJobs;
        this.meterRegistry       = meterRegistry;
        this.pollInterval        = pollInterval;
        this.stallTimeout        = stallTimeout;
        this.deduplicateTriggers = deduplicateTriggers;
    }

    // ------------------------------------------------------------------
    // Start
    // ------------------------------------------------------------------

    /**
     * Persist a new execution in EVALUATING, due immediately.
     * The scheduler picks it up on its next tick.
     *
     * With de-duplication enabled, a trigger key that already has a running
     * execution returns that execution instead.
     */
    @Transactional
    public Execution start(ExecutionContext ctx, String triggerKey) {
        if (deduplicateTriggers) {
            List<Execution> running = executionRepo.findByTriggerKeyAndStateNotIn(triggerKey, TERMINAL);
            if (!running.isEmpty()) {
                Execution existing = running.get(0);
                log.info("Trigger {} already has running execution {}, not starting another",
                        triggerKey, existing.getId());
                return existing;
            }
        }
        Execution execution = executionRepo.save(new Execution(triggerKey, codec.write(ctx)));
        log.info("Execution {} started for {} (date={}, threshold={})",
                execution.getId(), triggerKey, ctx.date(), ctx.threshold());
        return execution;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<Execution> findById(UUID id) {
        return executionRepo.findById(id);
    }

    public List<Execution> findByState(ExecutionState state) {
        return executionRepo.findByState(state);
    }

    @Transactional(readOnly = true)
    public List<TransitionRecord> getTransitions(UUID executionId) {
        return transitionRepo.findByExecutionIdOrderByCreatedAtAsc(executionId);
    }

    public ExecutionContext contextOf(Execution execution) {
        return codec.read(execution.getContextJson());
    }

    @Transactional(readOnly = true)
    public boolean isCancelRequested(UUID executionId) {
        return executionRepo.isCancelRequested(executionId);
    }

    // ------------------------------------------------------------------
    // Claiming (called by the scheduler)
    // ------------------------------------------------------------------

    /**
     * Claim the longest-due execution for a worker.
     * The row lock is held until worker_id is committed.
     */
    @Transactional
    public Optional<Execution> claimNext(String workerId) {
        Optional<Execution> opt = executionRepo.claimNextDue(TERMINAL, Instant.now());
        opt.ifPresent(execution -> {
            execution.setWorkerId(workerId);
            execution.setHeartbeatAt(Instant.now());
            executionRepo.save(execution);
            log.info("Worker '{}' claimed execution {} in state {}",
                    workerId, execution.getId(), execution.getState());
        });
        return opt;
    }

    // ------------------------------------------------------------------
    // Advancing (called by the runner after every state)
    // ------------------------------------------------------------------

    /**
     * Persist one state change made by the worker holding the claim.
     *
     * Entering WAITING parks the execution: next_run_at moves out by the poll
     * interval and the claim is released so no worker sits idle on it.
     * Entering a terminal state releases the claim for good.
     *
     * @return false if nothing was written: the execution was already
     *         terminal, or its claim no longer belongs to {@code workerId}
     */
    @Transactional
    public boolean applyAdvance(UUID executionId, String workerId, Advance advance) {
        Execution execution = executionRepo.lockById(executionId).orElseThrow();
        if (execution.isTerminal()) {
            log.warn("Ignoring {} → {} for execution {}: already {}",
                    advance.from(), advance.to(), executionId, execution.getState());
            return false;
        }
        if (!holdsClaim(execution, workerId)) {
            log.warn("Ignoring {} → {} for execution {}: claim moved from '{}' to '{}'",
                    advance.from(), advance.to(), executionId, workerId, execution.getWorkerId());
            return false;
        }

        execution.setState(advance.to());
        execution.setContextJson(codec.write(advance.context()));
        if (advance.from() == ExecutionState.POLLING) {
            execution.incrementPollCount();
        }

        Instant now = Instant.now();
        if (advance.suspends()) {
            execution.setNextRunAt(now.plus(pollInterval));
            execution.setWorkerId(null);
            log.info("Execution {} waiting {} before next poll", executionId, pollInterval);
        } else if (advance.to().isTerminal()) {
            finish(execution, advance.failureKind(), advance.detail());
        } else {
            execution.setHeartbeatAt(now);
        }

        executionRepo.save(execution);
        transitionRepo.save(new TransitionRecord(executionId, advance.from(), advance.to(), advance.detail()));
        return true;
    }

    /**
     * Move a non-terminal execution straight to FAILED on behalf of the
     * worker holding the claim. Used for cancellation and for errors the
     * engine did not anticipate. A cancelled execution's running training
     * job is asked to stop.
     *
     * @return false if nothing was written
     */
    @Transactional
    public boolean abort(UUID executionId, String workerId, ErrorKind kind, String reason) {
        Execution execution = executionRepo.lockById(executionId).orElseThrow();
        if (execution.isTerminal()) {
            return false;
        }
        if (!holdsClaim(execution, workerId)) {
            log.warn("Not aborting execution {}: claim moved from '{}' to '{}'",
                    executionId, workerId, execution.getWorkerId());
            return false;
        }
        if (kind == ErrorKind.CANCELLED) {
            stopTrainingJob(execution);
        }
        ExecutionState from = execution.getState();
        execution.setState(ExecutionState.FAILED);
        finish(execution, kind, reason);
        executionRepo.save(execution);
        transitionRepo.save(new TransitionRecord(executionId, from, ExecutionState.FAILED, reason));
        return true;
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Cancel an execution.
     *
     * An unclaimed execution (usually one parked in WAITING) fails right
     * away. A claimed one gets the cancel flag, which its worker checks
     * before each state. In both cases a training job that is still running
     * is asked to stop; the workflow stops observing it either way.
     */
    @Transactional
    public CancelOutcome cancel(UUID executionId) {
        Optional<Execution> opt = executionRepo.lockById(executionId);
        if (opt.isEmpty()) {
            return CancelOutcome.NOT_FOUND;
        }
        Execution execution = opt.get();
        if (execution.isTerminal()) {
            return CancelOutcome.ALREADY_TERMINAL;
        }

        stopTrainingJob(execution);

        if (execution.getWorkerId() == null) {
            ExecutionState from = execution.getState();
            execution.setState(ExecutionState.FAILED);
            finish(execution, ErrorKind.CANCELLED, "Cancelled by request");
            executionRepo.save(execution);
            transitionRepo.save(new TransitionRecord(executionId, from, ExecutionState.FAILED,
                    "Cancelled by request"));
            return CancelOutcome.CANCELLED;
        }

        executionRepo.requestCancel(executionId);
        log.info("Cancel requested for execution {} (running on {})", executionId, execution.getWorkerId());
        return CancelOutcome.CANCEL_REQUESTED;
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    /**
     * Release executions whose worker stopped heart-beating.
     * They resume from their last persisted state on a later tick.
     */
    @Transactional
    public void recoverStalledExecutions() {
        Instant cutoff = Instant.now().minus(stallTimeout);
        List<Execution> stalled = executionRepo.findByWorkerIdIsNotNullAndHeartbeatAtBefore(cutoff);
        for (Execution execution : stalled) {
            log.warn("Releasing stalled execution {} (worker={}, state={}, last heartbeat={})",
                    execution.getId(), execution.getWorkerId(), execution.getState(), execution.getHeartbeatAt());
            execution.setWorkerId(null);
            execution.setNextRunAt(Instant.now());
            executionRepo.save(execution);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static boolean holdsClaim(Execution execution, String workerId) {
        return workerId != null && workerId.equals(execution.getWorkerId());
    }

    private void finish(Execution execution, ErrorKind failureKind, String detail) {
        execution.setWorkerId(null);
        execution.setFinishedAt(Instant.now());
        if (execution.getState() == ExecutionState.FAILED) {
            execution.setFailure(failureKind == null ? ErrorKind.INTERNAL.name() : failureKind.name(), detail);
            log.error("Execution {} FAILED ({}): {}", execution.getId(), execution.getFailureKind(), detail);
        } else {
            log.info("Execution {} COMPLETED", execution.getId());
        }
        meterRegistry.counter("retrain.executions.finished",
                "outcome", execution.getState().name().toLowerCase()).increment();
    }

    /**
     * Ask the training service to stop the execution's job, if it has one
     * that is still running. Never propagates: the cancel must commit even
     * when the training service is unreachable.
     */
    private void stopTrainingJob(Execution execution) {
        ExecutionContext ctx;
        try {
            ctx = codec.read(execution.getContextJson());
        } catch (IllegalStateException e) {
            log.warn("Cannot read context of execution {} to stop its job: {}", execution.getId(), e.getMessage());
            return;
        }
        if (ctx.jobId() == null || (ctx.jobStatus() != null && ctx.jobStatus().isTerminal())) {
            return;
        }
        try {
            trainingJobs.stop(ctx.jobId());
            log.info("Requested stop of training job {} for execution {}", ctx.jobId(), execution.getId());
        } catch (Exception e) {
            log.warn("Could not stop training job {} for execution {}: {}",
                    ctx.jobId(), execution.getId(), e.getMessage());
        }
    }
}
