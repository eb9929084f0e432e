package com.starscape.mediareaper.common.exception;

/**
 * Thrown when a rule, media item or pending deletion does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
