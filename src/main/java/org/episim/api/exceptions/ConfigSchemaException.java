package org.episim.api.exceptions;

/**
 * Thrown when a simulation configuration lacks a section required by its engine variant,
 * has an entry of the wrong type, or cannot be parsed at all.
 */
public class ConfigSchemaException extends EpiSimException {

    private final String missingSection;

    /**
     * Constructs an exception for a missing top-level section.
     *
     * @param missingSection name of the absent section
     * @param engineId engine the configuration was validated against
     */
    public ConfigSchemaException(String missingSection, String engineId) {
        super("Configuration for engine '" + engineId + "' is missing required section '" + missingSection + "'");
        this.missingSection = missingSection;
    }

    /**
     * Constructs an exception for a configuration entry of the wrong shape.
     *
     * @param message the detail message
     */
    public ConfigSchemaException(String message) {
        super(message);
        this.missingSection = null;
    }

    /**
     * Constructs an exception for an unparseable configuration document.
     *
     * @param message the detail message
     * @param cause the parser failure
     */
    public ConfigSchemaException(String message, Throwable cause) {
        super(message, cause);
        this.missingSection = null;
    }

    /**
     * @return the missing section, or {@code null} if the document was malformed
     *         or an entry had the wrong type
     */
    public String getMissingSection() {
        return missingSection;
    }
}
