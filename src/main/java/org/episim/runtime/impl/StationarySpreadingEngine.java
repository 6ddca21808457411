package org.episim.runtime.impl;

import org.episim.api.exceptions.SpreadingEngineException;
import org.episim.api.model.Compartment;
import org.episim.api.model.CompartmentLayout;
import org.episim.api.model.DenseArray;
import org.episim.runtime.spi.ISpreadingEngine;
import org.episim.runtime.spi.SpreadingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Spreading engine that holds the initial state constant over the horizon.
 * <p>
 * Every compartment keeps its step-0 density at every later step, so the population is
 * conserved exactly. Useful to check a model folder end to end before plugging in a real
 * engine.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code validate-mass} (default false): fail if the step-0 densities of a populated
 *       {@code (age group, patch)} cell do not sum to 1 within {@code tolerance}</li>
 *   <li>{@code tolerance} (default 1e-6)</li>
 * </ul>
 */
public class StationarySpreadingEngine implements ISpreadingEngine {

    private static final Logger log = LoggerFactory.getLogger(StationarySpreadingEngine.class);

    private boolean validateMass = false;
    private double tolerance = 1e-6;

    @Override
    public void initialize(Config options) {
        if (options.hasPath("validate-mass")) {
            validateMass = options.getBoolean("validate-mass");
        }
        if (options.hasPath("tolerance")) {
            tolerance = options.getDouble("tolerance");
        }
    }

    @Override
    public void run(SpreadingContext context) throws SpreadingEngineException {
        CompartmentLayout layout = context.epidemic().layout();
        if (validateMass) {
            checkInitialMass(context);
        }
        for (Compartment compartment : Compartment.all()) {
            double[] density = context.epidemic().density(compartment).data();
            for (int g = 0; g < layout.ageGroups(); g++) {
                for (int m = 0; m < layout.patches(); m++) {
                    for (int v = 0; v < layout.vaccinationStates(); v++) {
                        double initial = density[layout.densityOffset(g, m, 0, v)];
                        for (int t = 1; t < layout.timeSteps(); t++) {
                            density[layout.densityOffset(g, m, t, v)] = initial;
                        }
                    }
                }
            }
        }
        log.debug("Held initial state constant over {} steps", layout.timeSteps());
    }

    private void checkInitialMass(SpreadingContext context) throws SpreadingEngineException {
        CompartmentLayout layout = context.epidemic().layout();
        for (int g = 0; g < layout.ageGroups(); g++) {
            for (int m = 0; m < layout.patches(); m++) {
                if (context.population().count(g, m) == 0) {
                    continue;
                }
                double sum = 0.0;
                for (Compartment compartment : Compartment.all()) {
                    DenseArray density = context.epidemic().density(compartment);
                    for (int v = 0; v < layout.vaccinationStates(); v++) {
                        sum += density.data()[layout.densityOffset(g, m, 0, v)];
                    }
                }
                if (Math.abs(sum - 1.0) > tolerance) {
                    throw new SpreadingEngineException("Initial densities of age group '"
                            + context.population().ageLabels().get(g) + "' in patch '"
                            + context.population().patchIds().get(m) + "' sum to " + sum + ", expected 1");
                }
            }
        }
    }
}
