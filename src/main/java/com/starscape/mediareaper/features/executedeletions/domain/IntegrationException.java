package com.starscape.mediareaper.features.executedeletions.domain;

/**
 * A downstream integration was unreachable, rejected the request or did not answer in time.
 * Recorded against the single item being executed; never aborts an execution pass.
 */
public class IntegrationException extends Exception {
    
    public IntegrationException(String message) {
        super(message);
    }
    
    public IntegrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
