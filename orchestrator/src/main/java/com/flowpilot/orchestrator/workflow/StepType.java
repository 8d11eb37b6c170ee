package com.flowpilot.orchestrator.workflow;

/**
 * Kind of step, recorded in the serialized workflow definition.
 */
public enum StepType {
    TASK,           // always runs its action
    CONDITIONAL,    // runs only when its predicate holds
    BRANCH          // picks one action from a case table
}
