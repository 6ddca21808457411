package org.episim.params;

import org.episim.api.exceptions.InvalidParameterException;
import org.episim.api.exceptions.MissingParameterException;
import org.episim.api.model.EpidemicRates;
import org.episim.api.model.VaccinationEffects;
import org.episim.config.ConfigSection;

/**
 * Reads transmission and progression rates from {@code epidemic_params}.
 */
public final class EpidemicParamsBuilder {

    private EpidemicParamsBuilder() {
    }

    /**
     * @param section   the {@code epidemic_params} section
     * @param ageGroups G, the required length of every per-age vector
     * @return the rates; {@code βᴬ} falls back to {@code scale_β · βᴵ}
     * @throws MissingParameterException if a rate, or both {@code βᴬ} and {@code scale_β}, are absent
     * @throws InvalidParameterException if a vector does not have G entries
     */
    public static EpidemicRates buildRates(ConfigSection section, int ageGroups)
            throws MissingParameterException, InvalidParameterException {
        double betaI = section.number("βᴵ");
        return new EpidemicRates(
                betaI,
                asymptomaticInfectivity(section, betaI),
                section.doubleVector("ηᵍ", ageGroups),
                section.doubleVector("αᵍ", ageGroups),
                section.doubleVector("μᵍ", ageGroups),
                section.doubleVector("θᵍ", ageGroups),
                section.doubleVector("γᵍ", ageGroups),
                section.doubleVector("ζᵍ", ageGroups),
                section.doubleVector("λᵍ", ageGroups),
                section.doubleVector("ωᵍ", ageGroups),
                section.doubleVector("ψᵍ", ageGroups),
                section.doubleVector("χᵍ", ageGroups));
    }

    /**
     * Reads the vaccine rates of the vaccination variant. Absent entries default to 0.
     *
     * @param vaccinationStates V, the required length of {@code rᵥ} and {@code kᵥ}
     */
    public static VaccinationEffects buildVaccinationEffects(ConfigSection section, int vaccinationStates)
            throws MissingParameterException, InvalidParameterException {
        return new VaccinationEffects(
                optionalVector(section, "rᵥ", vaccinationStates),
                optionalVector(section, "kᵥ", vaccinationStates),
                section.optionalNumber("Λ").orElse(0.0),
                section.optionalNumber("Γ").orElse(0.0),
                section.optionalNumber("risk_reduction_dd").orElse(0.0),
                section.optionalNumber("risk_reduction_h").orElse(0.0),
                section.optionalNumber("risk_reduction_d").orElse(0.0));
    }

    private static double asymptomaticInfectivity(ConfigSection section, double betaI)
            throws MissingParameterException, InvalidParameterException {
        if (section.has("βᴬ")) {
            return section.number("βᴬ");
        }
        if (section.has("scale_β")) {
            return section.number("scale_β") * betaI;
        }
        throw new MissingParameterException(section.name(), "βᴬ (or scale_β to derive it from βᴵ)");
    }

    private static double[] optionalVector(ConfigSection section, String key, int length)
            throws MissingParameterException, InvalidParameterException {
        return section.has(key) ? section.doubleVector(key, length) : new double[length];
    }
}
