package com.starscape.mediareaper.common.exception;

/**
 * Thrown when the requested change no longer applies to the current state,
 * e.g. the item was modified concurrently.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
