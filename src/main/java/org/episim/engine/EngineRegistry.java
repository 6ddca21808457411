package org.episim.engine;

import java.util.LinkedHashMap;
import java.util.Map;

import org.episim.api.exceptions.UnknownEngineException;

/**
 * Maps {@code simulation.engine} identifiers to their {@link IEngineHandler}.
 */
public class EngineRegistry {

    private final Map<String, IEngineHandler> handlers = new LinkedHashMap<>();

    /**
     * Creates a registry holding the handlers of all built-in variants.
     */
    public EngineRegistry() {
        register(new BasicEngineHandler());
        register(new VaccinationEngineHandler());
    }

    private void register(IEngineHandler handler) {
        handlers.put(handler.variant().id(), handler);
    }

    /**
     * @param engineId identifier from the configuration
     * @return the handler of that variant
     * @throws UnknownEngineException if no variant has this identifier
     */
    public IEngineHandler resolve(String engineId) throws UnknownEngineException {
        IEngineHandler handler = handlers.get(engineId);
        if (handler == null) {
            throw new UnknownEngineException(engineId, String.join(", ", handlers.keySet()));
        }
        return handler;
    }

    public IEngineHandler resolve(EngineVariant variant) {
        return handlers.get(variant.id());
    }
}
