package org.episim.api.exceptions;

/**
 * Thrown when a required parameter is absent from its configuration section and cannot be
 * derived from other parameters.
 */
public class MissingParameterException extends EpiSimException {

    /**
     * @param section configuration section that was searched
     * @param key parameter name
     */
    public MissingParameterException(String section, String key) {
        super("Missing parameter '" + key + "' in section '" + section + "'");
    }

    public MissingParameterException(String message) {
        super(message);
    }
}
