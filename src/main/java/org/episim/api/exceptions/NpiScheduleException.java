package org.episim.api.exceptions;

/**
 * Thrown when the intervention schedule vectors cannot be aligned into change points.
 */
public class NpiScheduleException extends EpiSimException {

    public NpiScheduleException(String message) {
        super(message);
    }
}
