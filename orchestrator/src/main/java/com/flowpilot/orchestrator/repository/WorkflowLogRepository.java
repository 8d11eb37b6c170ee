package com.flowpilot.orchestrator.repository;

import com.flowpilot.orchestrator.model.WorkflowLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkflowLogRepository extends JpaRepository<WorkflowLogEntity, Long> {

    List<WorkflowLogEntity> findByWorkflowIdOrderByIdAsc(String workflowId);
}
