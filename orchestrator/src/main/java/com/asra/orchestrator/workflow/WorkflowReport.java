package com.asra.orchestrator.workflow;

import com.asra.orchestrator.executor.ExecutionResult;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a workflow run, in one of two shapes:
 * <ul>
 *   <li>per-stage: stage name → {@link ExecutionResult}</li>
 *   <li>failure: a single {@code error} + {@code trace}, when the run failed
 *       as a whole</li>
 * </ul>
 * Check {@link #isFailure()} before reading stage results; the stage
 * accessors throw {@link IllegalStateException} on the failure shape.
 */
public final class WorkflowReport {

    private final Map<String, ExecutionResult> stages;
    private final String error;
    private final String trace;

    private WorkflowReport(Map<String, ExecutionResult> stages, String error, String trace) {
        this.stages = stages;
        this.error  = error;
        this.trace  = trace;
    }

    public static WorkflowReport of(Map<String, ExecutionResult> stages) {
        return new WorkflowReport(Collections.unmodifiableMap(new LinkedHashMap<>(stages)), null, null);
    }

    public static WorkflowReport failure(String error, String trace) {
        return new WorkflowReport(null, error, trace == null ? "" : trace);
    }

    public static WorkflowReport failure(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return failure(message, stackTrace(cause));
    }

    public boolean isFailure() {
        return stages == null;
    }

    public Map<String, ExecutionResult> stages() {
        requireStages();
        return stages;
    }

    public Optional<ExecutionResult> result(String stageName) {
        requireStages();
        return Optional.ofNullable(stages.get(stageName));
    }

    /** False for the failure shape and for stages that are absent or did not succeed. */
    public boolean succeeded(String stageName) {
        return !isFailure() && result(stageName).map(ExecutionResult::success).orElse(false);
    }

    public String error() { return error; }
    public String trace() { return trace; }

    private void requireStages() {
        if (isFailure()) {
            throw new IllegalStateException("Workflow failed as a whole: " + error);
        }
    }

    static String stackTrace(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    @Override
    public String toString() {
        return isFailure()
                ? "WorkflowReport[failure=" + error + "]"
                : "WorkflowReport[stages=" + stages.keySet() + "]";
    }
}
