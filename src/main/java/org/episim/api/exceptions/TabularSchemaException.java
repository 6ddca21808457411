package org.episim.api.exceptions;

/**
 * Thrown when a CSV input does not match the column layout or value types expected for it.
 */
public class TabularSchemaException extends EpiSimException {

    public TabularSchemaException(String message) {
        super(message);
    }

    public TabularSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
