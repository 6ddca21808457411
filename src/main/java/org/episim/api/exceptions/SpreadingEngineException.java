package org.episim.api.exceptions;

/**
 * Thrown by a spreading engine that cannot complete the integration, or when the configured
 * engine class cannot be instantiated.
 */
public class SpreadingEngineException extends EpiSimException {

    public SpreadingEngineException(String message) {
        super(message);
    }

    public SpreadingEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
