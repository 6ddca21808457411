package org.episim.runtime.spi;

import org.episim.api.exceptions.SpreadingEngineException;

import com.typesafe.config.Config;

/**
 * Service Provider Interface for the numerical integration of the compartment model.
 * <p>
 * Implementations advance the densities in {@link SpreadingContext#epidemic()} from step 0 to
 * the last step of the horizon, in place. They are instantiated by class name from the
 * {@code episim.spreading-engine} configuration and must provide a public no-argument
 * constructor.
 */
public interface ISpreadingEngine {

    /**
     * Called once after instantiation.
     *
     * @param options the {@code options} block of the engine configuration, or an empty Config
     */
    void initialize(Config options);

    /**
     * Integrates the model over the whole horizon.
     *
     * @param context inputs of the run; densities are filled in place
     * @throws SpreadingEngineException if the integration cannot be completed
     */
    void run(SpreadingContext context) throws SpreadingEngineException;
}
