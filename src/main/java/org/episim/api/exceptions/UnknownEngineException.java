package org.episim.api.exceptions;

/**
 * Thrown when {@code simulation.engine} names no registered engine variant.
 */
public class UnknownEngineException extends EpiSimException {

    private final String engineId;

    /**
     * @param engineId the unrecognized identifier
     * @param knownEngines comma separated list of valid identifiers, for the message
     */
    public UnknownEngineException(String engineId, String knownEngines) {
        super("Unknown engine '" + engineId + "'. Known engines: " + knownEngines);
        this.engineId = engineId;
    }

    public String getEngineId() {
        return engineId;
    }
}
