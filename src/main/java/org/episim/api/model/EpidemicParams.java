package org.episim.api.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rates and compartment density time series of one run.
 * <p>
 * Each compartment owns a {@link DenseArray} shaped by {@link CompartmentLayout#densityShape()}.
 * The initial condition resolver fills step 0; the spreading engine fills the remaining steps
 * in place. Densities are fractions of the local {@code (age group, patch)} population.
 */
public final class EpidemicParams {

    private final CompartmentLayout layout;
    private final EpidemicRates rates;
    private final VaccinationEffects vaccinationEffects;
    private final Map<Compartment, DenseArray> densities = new EnumMap<>(Compartment.class);

    /**
     * @param layout             array extents
     * @param rates              transmission and progression rates
     * @param vaccinationEffects vaccine rates, or {@code null} for variants without vaccination
     */
    public EpidemicParams(CompartmentLayout layout, EpidemicRates rates, VaccinationEffects vaccinationEffects) {
        this.layout = layout;
        this.rates = rates;
        this.vaccinationEffects = vaccinationEffects;
        for (Compartment compartment : Compartment.all()) {
            densities.put(compartment, new DenseArray(layout.densityShape()));
        }
    }

    public CompartmentLayout layout() {
        return layout;
    }

    public EpidemicRates rates() {
        return rates;
    }

    public Optional<VaccinationEffects> vaccinationEffects() {
        return Optional.ofNullable(vaccinationEffects);
    }

    /**
     * @param compartment any of the eleven compartments
     * @return the live density array of that compartment
     */
    public DenseArray density(Compartment compartment) {
        return densities.get(compartment);
    }

    public List<Compartment> compartments() {
        return Compartment.all();
    }
}
