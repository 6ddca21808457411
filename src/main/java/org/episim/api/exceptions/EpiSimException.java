package org.episim.api.exceptions;

/**
 * Base class of all checked failures raised while preparing, running or serializing a
 * simulation.
 * <p>
 * Library code propagates these exceptions unchanged. Only the CLI commands translate them
 * into log output and a process exit code.
 */
public class EpiSimException extends Exception {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public EpiSimException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the underlying cause
     */
    public EpiSimException(String message, Throwable cause) {
        super(message, cause);
    }
}
