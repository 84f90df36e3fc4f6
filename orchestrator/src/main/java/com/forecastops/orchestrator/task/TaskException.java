package com.forecastops.orchestrator.task;

/**
 * Thrown by a workflow collaborator when a task cannot produce its output.
 *
 * Unchecked: collaborators throw it, {@link TaskInvoker} is the only place
 * that catches it and turns it into a {@link TaskResult}.
 */
public class TaskException extends RuntimeException {

    private final ErrorKind kind;

    public TaskException(ErrorKind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public TaskException(ErrorKind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }
}
