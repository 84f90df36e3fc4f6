package com.forecastops.orchestrator.repository;

import com.forecastops.orchestrator.model.Execution;
import com.forecastops.orchestrator.model.ExecutionState;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + scheduler queries for the executions table.
 */
public interface ExecutionRepository extends JpaRepository<Execution, UUID> {

    /**
     * Claim the execution that has been due the longest.
     *
     * FOR UPDATE SKIP LOCKED (lock timeout -2 in Hibernate): a row locked by
     * another scheduler instance is skipped instead of waited on. Must run
     * inside a @Transactional method that sets worker_id before committing.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT e FROM Execution e
            WHERE e.state NOT IN :terminal
              AND e.workerId IS NULL
              AND e.nextRunAt <= :now
            ORDER BY e.nextRunAt ASC
            LIMIT 1
            """)
    Optional<Execution> claimNextDue(@Param("terminal") Collection<ExecutionState> terminal,
                                     @Param("now") Instant now);

    /** Blocking row lock for writes that must not race a claim or stall recovery. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Execution e WHERE e.id = :id")
    Optional<Execution> lockById(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE Execution e SET e.cancelRequested = true WHERE e.id = :id")
    int requestCancel(@Param("id") UUID id);

    @Query("SELECT e.cancelRequested FROM Execution e WHERE e.id = :id")
    boolean isCancelRequested(@Param("id") UUID id);

    List<Execution> findByState(ExecutionState state);

    /** Non-terminal executions for a trigger key (used by de-duplication). */
    List<Execution> findByTriggerKeyAndStateNotIn(String triggerKey, Collection<ExecutionState> states);

    /** Claimed executions whose worker stopped heart-beating before 'cutoff'. */
    List<Execution> findByWorkerIdIsNotNullAndHeartbeatAtBefore(Instant cutoff);
}
