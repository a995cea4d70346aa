package com.asra.orchestrator.workflow;

/**
 * A fault outside any single stage's scope, e.g. the scripts directory
 * cannot be created. The only error that replaces the whole report with
 * the top-level failure shape.
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
