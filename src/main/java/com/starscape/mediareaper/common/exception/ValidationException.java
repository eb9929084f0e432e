package com.starscape.mediareaper.common.exception;

import java.util.Map;

/**
 * Thrown for malformed input that is rejected before any state changes.
 * Field-level problems are carried in {@link #getDetails()}.
 */
public class ValidationException extends RuntimeException {

    private final Map<String, String> details;

    public ValidationException(String message) {
        this(message, Map.of());
    }

    public ValidationException(String message, Map<String, String> details) {
        super(message);
        this.details = Map.copyOf(details);
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
