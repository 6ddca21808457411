package org.episim.output;

import org.episim.api.model.DenseArray;

/**
 * Daily epidemiological indicators, each shaped {@code (G, M, T)} and summed over vaccination states.
 *
 * @param newInfected     asymptomatic individuals turning symptomatic, {@code A · n · αᵍ}
 * @param newHospitalized symptomatic individuals admitted to hospital, {@code I · n · μᵍ(1 − θᵍ)γᵍ}
 * @param newDeaths       increase of deceased counts since the previous step; 0 at the first step
 */
public record Observables(DenseArray newInfected, DenseArray newHospitalized, DenseArray newDeaths) {

    public static final String NEW_INFECTED = "new_infected";
    public static final String NEW_HOSPITALIZED = "new_hospitalized";
    public static final String NEW_DEATHS = "new_deaths";
}
