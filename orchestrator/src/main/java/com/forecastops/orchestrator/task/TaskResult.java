package com.forecastops.orchestrator.task;

import java.util.Objects;

/**
 * Outcome of one task invocation: either a value or a typed error.
 * The state machine inspects this instead of catching exceptions.
 */
public record TaskResult<T>(T value, ErrorKind errorKind, String errorMessage, int attempts) {

    public static <T> TaskResult<T> success(T value, int attempts) {
        return new TaskResult<>(value, null, null, attempts);
    }

    public static <T> TaskResult<T> failure(ErrorKind kind, String message, int attempts) {
        return new TaskResult<>(null, Objects.requireNonNull(kind), message, attempts);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }
}
