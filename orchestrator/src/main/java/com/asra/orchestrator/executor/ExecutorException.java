package com.asra.orchestrator.executor;

/**
 * Thrown inside {@link StageExecutor} when a stage process cannot be run to
 * completion. The executor turns it into a failed {@link ExecutionResult};
 * it is never thrown to callers.
 */
public class ExecutorException extends RuntimeException {

    public enum Kind { SPAWN_FAILURE, IO_FAILURE, TIMEOUT, INTERRUPTED }

    private final Kind kind;

    public ExecutorException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ExecutorException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
