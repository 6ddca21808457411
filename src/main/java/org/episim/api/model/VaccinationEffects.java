package org.episim.api.model;

/**
 * Vaccine-related rates of the vaccination engine variant.
 *
 * @param efficacy              rᵥ, reduction of susceptibility per vaccination state
 * @param transmissionReduction kᵥ, reduction of infectiousness per vaccination state
 * @param waningRate            Λ
 * @param reinfectionRate       Γ
 * @param riskReductionDirectDeath reduction of θᵍ for vaccinated individuals
 * @param riskReductionHospital reduction of γᵍ for vaccinated individuals
 * @param riskReductionDeath    reduction of ωᵍ for vaccinated individuals
 */
public record VaccinationEffects(
        double[] efficacy,
        double[] transmissionReduction,
        double waningRate,
        double reinfectionRate,
        double riskReductionDirectDeath,
        double riskReductionHospital,
        double riskReductionDeath
) {
}
