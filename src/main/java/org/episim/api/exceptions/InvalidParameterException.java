package org.episim.api.exceptions;

/**
 * Thrown when a parameter is present but malformed: wrong vector length, wrong type,
 * unparseable date or an inconsistent combination of values.
 */
public class InvalidParameterException extends EpiSimException {

    public InvalidParameterException(String message) {
        super(message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
