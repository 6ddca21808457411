package org.episim.api.model;

/**
 * Transmission and progression rates. Vectors are indexed by age group.
 *
 * @param betaI  infectivity of symptomatic individuals βᴵ
 * @param betaA  infectivity of asymptomatic individuals βᴬ
 * @param eta    exposed to asymptomatic rate ηᵍ
 * @param alpha  asymptomatic to symptomatic rate αᵍ
 * @param mu     escape rate from the symptomatic compartment μᵍ
 * @param theta  direct death probability θᵍ
 * @param gamma  ICU probability γᵍ
 * @param zeta   pre-deceased to deceased rate ζᵍ
 * @param lambda pre-hospitalized to ICU rate λᵍ
 * @param omega  fatality probability in ICU ωᵍ
 * @param psi    death rate in ICU ψᵍ
 * @param chi    ICU discharge rate χᵍ
 */
public record EpidemicRates(
        double betaI,
        double betaA,
        double[] eta,
        double[] alpha,
        double[] mu,
        double[] theta,
        double[] gamma,
        double[] zeta,
        double[] lambda,
        double[] omega,
        double[] psi,
        double[] chi
) {

    /**
     * Per-age rate at which symptomatic individuals enter hospital, {@code μᵍ(1 − θᵍ)γᵍ}.
     */
    public double hospitalizationRate(int ageGroup) {
        return mu[ageGroup] * (1.0 - theta[ageGroup]) * gamma[ageGroup];
    }
}
