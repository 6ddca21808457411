package org.episim.api.exceptions;

import java.nio.file.Path;

/**
 * Thrown when an input file declared by the configuration or the command line does not exist.
 */
public class MissingInputFileException extends EpiSimException {

    private final Path path;

    /**
     * @param description what the file was supposed to contain
     * @param path the resolved location that was checked
     */
    public MissingInputFileException(String description, Path path) {
        super("Missing " + description + ": " + path.toAbsolutePath());
        this.path = path;
    }

    /**
     * Constructs an exception for an input that has no candidate file at all.
     *
     * @param message the detail message
     */
    public MissingInputFileException(String message) {
        super(message);
        this.path = null;
    }

    public Path getPath() {
        return path;
    }
}
