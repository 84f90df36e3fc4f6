package com.forecastops.orchestrator.trigger;

/**
 * Thrown when an incoming event cannot start an execution.
 * No execution row exists when this is thrown.
 */
public class TriggerException extends RuntimeException {

    public enum Kind { INPUT, CONFIGURATION }

    private final Kind kind;

    public TriggerException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public TriggerException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
