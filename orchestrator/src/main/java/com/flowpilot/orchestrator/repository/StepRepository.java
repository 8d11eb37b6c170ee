package com.flowpilot.orchestrator.repository;

import com.flowpilot.orchestrator.model.StepEntity;
import com.flowpilot.orchestrator.model.StepKey;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * CRUD queries for the steps table.
 */
public interface StepRepository extends JpaRepository<StepEntity, StepKey> {

    /** All steps of a run, in definition order. */
    List<StepEntity> findByIdWorkflowIdOrderByPositionAsc(String workflowId);
}
