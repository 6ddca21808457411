package org.episim.engine;

import java.util.Optional;

import org.episim.api.exceptions.EpiSimException;
import org.episim.api.model.EpidemicParams;
import org.episim.api.model.PopulationParams;
import org.episim.api.model.TimeAxis;
import org.episim.api.model.VaccinationSchedule;
import org.episim.config.SimulationConfig;

/**
 * Variant-specific construction of engine inputs.
 * <p>
 * Everything that differs between engine variants is reached through this interface, so the
 * pipeline never inspects the variant itself. Implementations are stateless.
 */
public interface IEngineHandler {

    EngineVariant variant();

    /**
     * Builds rates and zero-filled density arrays for the run.
     *
     * @param config     the validated configuration
     * @param population population structure providing G and M
     * @param timeAxis   simulation horizon providing T
     * @return epidemic parameters laid out for this variant
     * @throws EpiSimException if a required parameter is missing or malformed
     */
    EpidemicParams buildEpidemicParams(SimulationConfig config, PopulationParams population, TimeAxis timeAxis)
            throws EpiSimException;

    /**
     * Builds the vaccine allocation schedule.
     *
     * @return the schedule, or empty for variants without vaccination
     * @throws EpiSimException if the vaccination section is malformed
     */
    Optional<VaccinationSchedule> buildVaccinationSchedule(SimulationConfig config, PopulationParams population,
            TimeAxis timeAxis) throws EpiSimException;

    /**
     * @return the exact shape an initial-condition array must have for this variant
     */
    default int[] initialConditionShape(int ageGroups, int patches) {
        EngineVariant variant = variant();
        return variant.hasVaccinationAxis()
                ? new int[] {ageGroups, patches, variant.vaccinationLabels().size(), variant.compartmentCount()}
                : new int[] {ageGroups, patches, variant.compartmentCount()};
    }
}
