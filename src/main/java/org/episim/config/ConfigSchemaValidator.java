package org.episim.config;

import java.util.Locale;

import org.episim.api.exceptions.ConfigSchemaException;
import org.episim.api.exceptions.UnknownEngineException;
import org.episim.engine.EngineRegistry;
import org.episim.engine.EngineVariant;
import org.episim.engine.IEngineHandler;

import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValueType;

/**
 * Structural validation of a simulation configuration against its engine variant.
 * <p>
 * Only the presence of top-level sections and the type of {@code simulation.engine} are checked; parameter values are validated later
 * by the builders that consume them. Runs before any data file is opened.
 */
public final class ConfigSchemaValidator {

    private ConfigSchemaValidator() {
    }

    /**
     * @param config  the configuration to check
     * @param variant the engine it will be run with
     * @throws ConfigSchemaException naming the first missing section
     */
    public static void validate(SimulationConfig config, EngineVariant variant) throws ConfigSchemaException {
        for (String section : variant.requiredSections()) {
            if (!config.hasSection(section)) {
                throw new ConfigSchemaException(section, variant.id());
            }
        }
    }

    /**
     * Resolves the engine named by {@code simulation.engine} and validates the configuration for it.
     *
     * @return the handler of the configured engine
     * @throws ConfigSchemaException  if the engine is not named by a string or a required section is missing
     * @throws UnknownEngineException if the named engine is not registered
     */
    public static IEngineHandler validate(SimulationConfig config, EngineRegistry registry)
            throws ConfigSchemaException, UnknownEngineException {
        if (!config.hasSection(SimulationConfig.SIMULATION)) {
            throw new ConfigSchemaException(SimulationConfig.SIMULATION, "<unspecified>");
        }
        String enginePath = ConfigUtil.joinPath(SimulationConfig.SIMULATION, "engine");
        if (config.root().hasPath(enginePath)
                && config.root().getValue(enginePath).valueType() != ConfigValueType.STRING) {
            throw new ConfigSchemaException("simulation.engine must be a string naming the engine, found "
                    + config.root().getValue(enginePath).valueType().name().toLowerCase(Locale.ROOT));
        }
        String engineId = config.engineId()
                .orElseThrow(() -> new ConfigSchemaException(SimulationConfig.SIMULATION + ".engine", "<unspecified>"));
        IEngineHandler handler = registry.resolve(engineId);
        validate(config, handler.variant());
        return handler;
    }
}
