package com.asra.orchestrator.executor;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Result of one stage in a workflow run. Created once, never mutated.
 *
 * @param output      stdout on success; stderr, or an explanatory message, otherwise
 * @param programPath null when the notebook never became a program
 * @param exitCode    null when no process exited (spawn failure, timeout, skip, conversion failure)
 */
public record ExecutionResult(
        String       stageName,
        StageOutcome outcome,
        String       output,
        Path         programPath,
        Integer      exitCode,
        Duration     elapsed
) {
    public boolean success() {
        return outcome == StageOutcome.SUCCEEDED;
    }

    /** Process ran to completion; success is decided by its exit status. */
    public static ExecutionResult exited(String stageName, Path programPath, int exitCode,
                                         String stdout, String stderr, Duration elapsed) {
        return exitCode == 0
                ? new ExecutionResult(stageName, StageOutcome.SUCCEEDED, stdout, programPath, 0, elapsed)
                : new ExecutionResult(stageName, StageOutcome.FAILED, stderr, programPath, exitCode, elapsed);
    }

    public static ExecutionResult failed(String stageName, Path programPath, String message, Duration elapsed) {
        return new ExecutionResult(stageName, StageOutcome.FAILED, message, programPath, null, elapsed);
    }

    public static ExecutionResult timedOut(String stageName, Path programPath, String message, Duration elapsed) {
        return new ExecutionResult(stageName, StageOutcome.TIMED_OUT, message, programPath, null, elapsed);
    }

    public static ExecutionResult conversionFailed(String stageName, String message) {
        return new ExecutionResult(stageName, StageOutcome.CONVERSION_FAILED, message, null, null, Duration.ZERO);
    }

    public static ExecutionResult skipped(String stageName, Path programPath, String message) {
        return new ExecutionResult(stageName, StageOutcome.SKIPPED, message, programPath, null, Duration.ZERO);
    }
}
