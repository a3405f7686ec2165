package com.libragraph.job.core.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured failure produced by validation or by a task's own logic.
 * <p>
 * {@code code} becomes the failed result's retcode and is always positive.
 */
public record TaskError(
        String kind,
        int code,
        String message,
        Map<String, Object> details
) {
    public static final String MISSING_PARAMETER = "MissingParameter";
    public static final String RUN_ERROR = "RunError";
    public static final String UNEXPECTED = "Unexpected";

    public static final int CODE_VALIDATION = 400;
    public static final int CODE_UNEXPECTED = 500;

    public TaskError {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (code <= 0) {
            throw new IllegalArgumentException("code must be > 0, got: " + code);
        }
        message = message == null ? kind : message;
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public TaskError(String kind, int code, String message) {
        this(kind, code, message, Map.of());
    }

    public static TaskError missingParameter(String name) {
        return new TaskError(MISSING_PARAMETER, CODE_VALIDATION,
                "Missing required parameter: " + name,
                Map.of("parameter", name));
    }

    public static TaskError unexpected(String message) {
        return new TaskError(UNEXPECTED, CODE_UNEXPECTED, message);
    }

    public static TaskError from(Throwable t) {
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        return new TaskError(
                t.getClass().getSimpleName(),
                CODE_UNEXPECTED,
                message,
                Map.of("exceptionType", t.getClass().getName())
        );
    }

    @Override
    public String toString() {
        return kind + " (" + code + "): " + message;
    }
}
