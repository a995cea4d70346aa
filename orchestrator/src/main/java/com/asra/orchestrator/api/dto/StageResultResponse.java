package com.asra.orchestrator.api.dto;

import com.asra.orchestrator.executor.ExecutionResult;

/**
 * One stage of a workflow report as returned by POST /workflows/run.
 *
 * {@code script} is the synthesized program path, null when the notebook
 * never converted.
 */
public record StageResultResponse(
        boolean success,
        String  output,
        String  script,
        String  outcome,
        Integer exitCode,
        long    elapsedMs
) {
    public static StageResultResponse from(ExecutionResult r) {
        return new StageResultResponse(
                r.success(),
                r.output(),
                r.programPath() != null ? r.programPath().toString() : null,
                r.outcome().name(),
                r.exitCode(),
                r.elapsed().toMillis()
        );
    }
}
