package com.forecastops.orchestrator.service;

import com.forecastops.orchestrator.model.Execution;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.workflow.ExecutionRunner;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Background scheduler that drives executions.
 *
 * The executions table is the queue: a tick claims the longest-due
 * execution with SELECT FOR UPDATE SKIP LOCKED and hands it to a fixed
 * worker pool. Executions parked in WAITING become due again when their
 * poll interval has passed, which is how the polling loop resumes.
 * A tick only claims while a worker thread is free, so a claimed
 * execution never waits in the pool queue where its heartbeat would age.
 */
@Component
@EnableScheduling
public class ExecutionScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionScheduler.class);

    private final ExecutorService workers;
    private final Semaphore       freeWorkers;

    private final ExecutionService executionService;
    private final ExecutionRunner  runner;

    public ExecutionScheduler(ExecutionService executionService,
                              ExecutionRunner runner,
                              @Value("${retrain.scheduler.workers:4}") int workerCount) {
        this.executionService = executionService;
        this.runner           = runner;
        this.workers          = Executors.newFixedThreadPool(workerCount);
        this.freeWorkers      = new Semaphore(workerCount);
    }

    /** Claim one due execution (if any) and dispatch it to a free worker thread. */
    @Scheduled(fixedDelayString = "${retrain.scheduler.tick-ms:2000}")
    public void tick() {
        if (!freeWorkers.tryAcquire()) {
            log.debug("All workers busy, not claiming");
            return;
        }
        String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

        Optional<Execution> claimed;
        try {
            claimed = executionService.claimNext(workerId);
        } catch (RuntimeException e) {
            freeWorkers.release();
            throw e;
        }
        if (claimed.isEmpty()) {
            freeWorkers.release();
            return;
        }

        Execution execution = claimed.get();
        try {
            workers.submit(() -> {
                try {
                    runner.run(execution);
                } catch (Exception e) {
                    log.error("Unhandled error running execution {}: {}",
                            execution.getId(), e.getMessage(), e);
                    executionService.abort(execution.getId(), workerId, ErrorKind.INTERNAL,
                            "Unhandled exception: " + e.getMessage());
                } finally {
                    freeWorkers.release();
                }
            });
        } catch (RejectedExecutionException e) {
            // Shutting down; stall recovery releases the claim.
            freeWorkers.release();
            log.warn("Worker pool rejected execution {}: {}", execution.getId(), e.getMessage());
        }
    }

    /** Release executions whose worker died without finishing or parking them. */
    @Scheduled(fixedDelayString = "${retrain.scheduler.recovery-ms:60000}")
    public void recoverStalled() {
        executionService.recoverStalledExecutions();
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
    }
}
