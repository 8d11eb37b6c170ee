package com.flowpilot.orchestrator.repository;

import com.flowpilot.orchestrator.model.WorkflowEntity;
import com.flowpilot.orchestrator.model.WorkflowState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CRUD + locking queries for the workflows table.
 */
public interface WorkflowRepository extends JpaRepository<WorkflowEntity, String> {

    /**
     * Load a run and hold a write lock on its row until the surrounding
     * transaction ends.
     *
     * Every mutation of a run or of one of its steps goes through this lock
     * first, so concurrent writers to the same run are serialized and the
     * validate-then-update sequence in the checkpoint store cannot interleave.
     *
     * Must run inside a @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WorkflowEntity w WHERE w.id = :id")
    Optional<WorkflowEntity> lockById(@Param("id") String id);

    /** Runs not yet in the given state, oldest first. */
    List<WorkflowEntity> findByStateNotOrderByCreatedAtAsc(WorkflowState state);
}
