package com.asra.orchestrator.artifact;

/**
 * Thrown when an upload cannot be stored or an artifact cannot be removed.
 */
public class ArtifactException extends RuntimeException {

    public ArtifactException(String message) {
        super(message);
    }

    public ArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
