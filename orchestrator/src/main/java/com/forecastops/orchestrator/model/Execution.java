package com.forecastops.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One run of the retraining workflow for one trigger event.
 *
 * The row is the durable copy of the state machine: current state plus the
 * execution context as JSON. The scheduler claims a due row via
 * SELECT FOR UPDATE SKIP LOCKED, sets worker_id, and a worker thread
 * advances it until it either finishes or suspends in WAITING.
 *
 * DB table: executions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "executions")
public class Execution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionState state = ExecutionState.EVALUATING;

    @Column(name = "context_json", nullable = false, columnDefinition = "TEXT")
    private String contextJson;

    // bucket + "/" + key of the historical object that triggered this run.
    @Column(name = "trigger_key", nullable = false)
    private String triggerKey;

    // Null while nobody is running this execution.
    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    // The scheduler only claims executions whose next_run_at has passed.
    @Column(name = "next_run_at", nullable = false)
    private Instant nextRunAt = Instant.now();

    @Column(name = "poll_count", nullable = false)
    private int pollCount = 0;

    @Column(name = "failure_kind")
    private String failureKind;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    // Written only through ExecutionRepository.requestCancel so that a
    // worker saving its own copy of the row never clears it.
    @Column(name = "cancel_requested", nullable = false, updatable = false)
    private boolean cancelRequested = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Execution() {}   // required by JPA

    public Execution(String triggerKey, String contextJson) {
        this.triggerKey  = triggerKey;
        this.contextJson = contextJson;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()              { return id; }
    public ExecutionState getState()           { return state; }
    public String         getContextJson()     { return contextJson; }
    public String         getTriggerKey()      { return triggerKey; }
    public String         getWorkerId()        { return workerId; }
    public Instant        getHeartbeatAt()     { return heartbeatAt; }
    public Instant        getNextRunAt()       { return nextRunAt; }
    public int            getPollCount()       { return pollCount; }
    public String         getFailureKind()     { return failureKind; }
    public String         getFailureReason()   { return failureReason; }
    public boolean        isCancelRequested()  { return cancelRequested; }
    public Instant        getCreatedAt()       { return createdAt; }
    public Instant        getUpdatedAt()       { return updatedAt; }
    public Instant        getFinishedAt()      { return finishedAt; }

    public boolean isTerminal() { return state.isTerminal(); }

    public void setState(ExecutionState state)       { this.state = state; }
    public void setContextJson(String contextJson)   { this.contextJson = contextJson; }
    public void setWorkerId(String workerId)         { this.workerId = workerId; }
    public void setHeartbeatAt(Instant t)            { this.heartbeatAt = t; }
    public void setNextRunAt(Instant t)              { this.nextRunAt = t; }
    public void setFinishedAt(Instant t)             { this.finishedAt = t; }
    public void incrementPollCount()                 { this.pollCount++; }

    public void setFailure(String kind, String reason) {
        this.failureKind   = kind;
        this.failureReason = reason;
    }
}
