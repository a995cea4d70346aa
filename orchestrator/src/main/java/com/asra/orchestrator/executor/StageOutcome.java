package com.asra.orchestrator.executor;

/**
 * How a stage ended in a workflow run.
 *
 *   SUCCEEDED          program exited with status 0
 *   FAILED             non-zero exit, or the process could not be started
 *   TIMED_OUT          killed after exceeding the per-process ceiling
 *   CONVERSION_FAILED  the notebook never became a program
 *   SKIPPED            not run because an upstream stage did not succeed
 */
public enum StageOutcome {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    CONVERSION_FAILED,
    SKIPPED
}
