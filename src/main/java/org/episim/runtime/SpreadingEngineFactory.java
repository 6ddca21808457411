package org.episim.runtime;

import java.lang.reflect.Constructor;

import org.episim.api.exceptions.SpreadingEngineException;
import org.episim.runtime.spi.ISpreadingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Instantiates the configured {@link ISpreadingEngine}.
 * <p>
 * Expects a configuration block of the form:
 * <pre>
 * spreading-engine {
 *   className = "org.episim.runtime.impl.StationarySpreadingEngine"
 *   options { }
 * }
 * </pre>
 */
public final class SpreadingEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(SpreadingEngineFactory.class);

    private SpreadingEngineFactory() {
    }

    /**
     * @param engineConfig block holding {@code className} and optional {@code options}
     * @return an initialized engine
     * @throws SpreadingEngineException if the class is missing, does not implement the SPI or fails to construct
     */
    public static ISpreadingEngine create(Config engineConfig) throws SpreadingEngineException {
        if (!engineConfig.hasPath("className")) {
            throw new SpreadingEngineException("Spreading engine configuration has no 'className'");
        }
        String className = engineConfig.getString("className");
        ISpreadingEngine engine;
        try {
            Class<?> clazz = Class.forName(className);
            if (!ISpreadingEngine.class.isAssignableFrom(clazz)) {
                throw new SpreadingEngineException("Class " + className + " does not implement ISpreadingEngine");
            }
            Constructor<?> constructor = clazz.getConstructor();
            engine = (ISpreadingEngine) constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new SpreadingEngineException("Failed to instantiate spreading engine: " + className, e);
        }

        // Initialize with options if present, otherwise empty config
        Config options = engineConfig.hasPath("options") ? engineConfig.getConfig("options") : ConfigFactory.empty();
        engine.initialize(options);
        log.debug("Loaded spreading engine {}", engine.getClass().getSimpleName());
        return engine;
    }
}
