package org.episim.engine;

import java.util.Optional;

import org.episim.api.exceptions.EpiSimException;
import org.episim.api.model.CompartmentLayout;
import org.episim.api.model.EpidemicParams;
import org.episim.api.model.PopulationParams;
import org.episim.api.model.TimeAxis;
import org.episim.api.model.VaccinationSchedule;
import org.episim.config.ConfigSection;
import org.episim.config.SimulationConfig;
import org.episim.params.EpidemicParamsBuilder;
import org.episim.params.VaccinationScheduleBuilder;

/**
 * Handler of the {@code MMCACovid19Vac} variant.
 * <p>
 * Densities carry a trailing vaccination axis (non-vaccinated, vaccinated, post-vaccinated)
 * and the run receives a {@link VaccinationSchedule} built from the {@code vaccination} section.
 */
public class VaccinationEngineHandler implements IEngineHandler {

    @Override
    public EngineVariant variant() {
        return EngineVariant.VACCINATION;
    }

    @Override
    public EpidemicParams buildEpidemicParams(SimulationConfig config, PopulationParams population,
            TimeAxis timeAxis) throws EpiSimException {
        CompartmentLayout layout = new CompartmentLayout(population.ageGroups(), population.patches(),
                timeAxis.steps(), variant().vaccinationLabels());
        ConfigSection epidemic = config.section(SimulationConfig.EPIDEMIC_PARAMS);
        return new EpidemicParams(layout,
                EpidemicParamsBuilder.buildRates(epidemic, population.ageGroups()),
                EpidemicParamsBuilder.buildVaccinationEffects(epidemic, layout.vaccinationStates()));
    }

    @Override
    public Optional<VaccinationSchedule> buildVaccinationSchedule(SimulationConfig config,
            PopulationParams population, TimeAxis timeAxis) throws EpiSimException {
        return Optional.of(VaccinationScheduleBuilder.build(
                config.section(SimulationConfig.VACCINATION), population, timeAxis));
    }
}
