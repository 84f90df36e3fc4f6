package com.forecastops.orchestrator.repository;

import com.forecastops.orchestrator.model.TransitionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TransitionRepository extends JpaRepository<TransitionRecord, UUID> {

    /** Audit trail of one execution, oldest first. */
    List<TransitionRecord> findByExecutionIdOrderByCreatedAtAsc(UUID executionId);
}
