package com.asra.orchestrator.workflow;

/**
 * Lifecycle of a single workflow run.
 *
 * Transitions:
 *   IDLE → CONVERTING → EXECUTING → REPORTED
 *   IDLE → CONVERTING → FAILED    (fault not attributable to one stage)
 */
public enum WorkflowState {
    IDLE,
    CONVERTING,
    EXECUTING,
    REPORTED,
    FAILED
}
