package com.asra.orchestrator.notebook;

/**
 * Thrown when a notebook cannot be turned into a stage program: the file is
 * unreadable, is not valid JSON, or does not have the expected cell layout.
 *
 * Never escapes the workflow orchestrator; it is recorded as a failed stage.
 */
public class ConversionException extends RuntimeException {

    private final String stageName;

    public ConversionException(String stageName, String message) {
        super("[" + stageName + "] " + message);
        this.stageName = stageName;
    }

    public ConversionException(String stageName, String message, Throwable cause) {
        super("[" + stageName + "] " + message, cause);
        this.stageName = stageName;
    }

    public String getStageName() { return stageName; }
}
