package com.forecastops.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit row written for every state change of an execution.
 *
 * DB table: transitions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "transitions")
public class TransitionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "execution_id", nullable = false)
    private UUID executionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", nullable = false)
    private ExecutionState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false)
    private ExecutionState toState;

    @Column(columnDefinition = "TEXT")
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected TransitionRecord() {}   // required by JPA

    public TransitionRecord(UUID executionId, ExecutionState fromState,
                            ExecutionState toState, String detail) {
        this.executionId = executionId;
        this.fromState   = fromState;
        this.toState     = toState;
        this.detail      = detail;
    }

    public UUID           getId()          { return id; }
    public UUID           getExecutionId() { return executionId; }
    public ExecutionState getFromState()   { return fromState; }
    public ExecutionState getToState()     { return toState; }
    public String         getDetail()      { return detail; }
    public Instant        getCreatedAt()   { return createdAt; }
}
