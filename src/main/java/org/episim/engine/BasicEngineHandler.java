package org.episim.engine;

import java.util.List;
import java.util.Optional;

import org.episim.api.exceptions.EpiSimException;
import org.episim.api.model.CompartmentLayout;
import org.episim.api.model.EpidemicParams;
import org.episim.api.model.PopulationParams;
import org.episim.api.model.TimeAxis;
import org.episim.api.model.VaccinationSchedule;
import org.episim.config.SimulationConfig;
import org.episim.params.EpidemicParamsBuilder;

/**
 * Handler of the {@code MMCACovid19} variant: age-structured compartments without vaccination.
 */
public class BasicEngineHandler implements IEngineHandler {

    @Override
    public EngineVariant variant() {
        return EngineVariant.BASIC;
    }

    @Override
    public EpidemicParams buildEpidemicParams(SimulationConfig config, PopulationParams population,
            TimeAxis timeAxis) throws EpiSimException {
        CompartmentLayout layout = new CompartmentLayout(
                population.ageGroups(), population.patches(), timeAxis.steps(), List.of());
        return new EpidemicParams(layout,
                EpidemicParamsBuilder.buildRates(config.section(SimulationConfig.EPIDEMIC_PARAMS), population.ageGroups()),
                null);
    }

    @Override
    public Optional<VaccinationSchedule> buildVaccinationSchedule(SimulationConfig config,
            PopulationParams population, TimeAxis timeAxis) {
        return Optional.empty();
    }
}
