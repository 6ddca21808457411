package org.episim.runtime.spi;

import java.util.Optional;

import org.episim.api.model.EpidemicParams;
import org.episim.api.model.NpiSchedule;
import org.episim.api.model.PopulationParams;
import org.episim.api.model.VaccinationSchedule;
import org.episim.engine.EngineVariant;

/**
 * Everything a spreading engine needs for one integration.
 *
 * @param variant     engine variant the inputs were built for
 * @param population  demographic and mobility structure
 * @param epidemic    rates and densities; step 0 holds the initial condition
 * @param npi         intervention schedule
 * @param vaccination vaccine allocation, present only for the vaccination variant
 */
public record SpreadingContext(
        EngineVariant variant,
        PopulationParams population,
        EpidemicParams epidemic,
        NpiSchedule npi,
        Optional<VaccinationSchedule> vaccination
) {
}
