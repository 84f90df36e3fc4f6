package com.forecastops.orchestrator.task;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs one collaborator call with the retry policy and turns its outcome
 * into a {@link TaskResult}.
 *
 * Every attempt is timed and counted:
 * <pre>
 *   retrain.task.calls{task, status="success|retry|&lt;error kind&gt;"}
 *   retrain.task.duration{task}
 * </pre>
 */
public class TaskInvoker {

    private static final Logger log = LoggerFactory.getLogger(TaskInvoker.class);

    /** Blocking pause between attempts; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final RetryPolicy   policy;
    private final MeterRegistry meterRegistry;
    private final Sleeper       sleeper;

    public TaskInvoker(RetryPolicy policy, MeterRegistry meterRegistry, Sleeper sleeper) {
        this.policy        = policy;
        this.meterRegistry = meterRegistry;
        this.sleeper       = sleeper;
    }

    public TaskInvoker(RetryPolicy policy, MeterRegistry meterRegistry) {
        this(policy, meterRegistry, d -> Thread.sleep(d.toMillis()));
    }

    public <T> TaskResult<T> invoke(TaskName task, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            Timer.Sample sample = Timer.start(meterRegistry);
            String status = "success";
            try {
                return TaskResult.success(call.get(), attempt);
            } catch (TaskException e) {
                ErrorKind kind = e.getKind();
                if (!kind.isRetryable() || attempt >= policy.maxAttempts()) {
                    status = kind.name().toLowerCase();
                    log.warn("Task {} failed after {} attempt(s): {}", task, attempt, e.getMessage());
                    return TaskResult.failure(kind, e.getMessage(), attempt);
                }
                status = "retry";
                Duration backoff = policy.backoffAfter(attempt);
                log.warn("Task {} attempt {}/{} failed, retrying in {} ms: {}",
                        task, attempt, policy.maxAttempts(), backoff.toMillis(), e.getMessage());
                if (!pause(backoff)) {
                    return TaskResult.failure(ErrorKind.CANCELLED,
                            "Interrupted while waiting to retry " + task, attempt);
                }
            } catch (RuntimeException e) {
                status = "internal";
                log.error("Task {} threw an unexpected exception", task, e);
                return TaskResult.failure(ErrorKind.INTERNAL,
                        "Unexpected error in " + task.tag() + ": " + e.getMessage(), attempt);
            } finally {
                sample.stop(meterRegistry.timer("retrain.task.duration", "task", task.tag()));
                meterRegistry.counter("retrain.task.calls",
                        "task", task.tag(), "status", status).increment();
            }
        }
    }

    private boolean pause(Duration backoff) {
        try {
            sleeper.sleep(backoff);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
