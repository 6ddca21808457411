package org.episim.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.episim.config.SimulationConfig;

/**
 * The closed set of supported engine variants.
 * <p>
 * A variant fixes the number of compartments carried by initial conditions, whether densities
 * have a vaccination axis and which configuration sections must be present.
 */
public enum EngineVariant {

    BASIC("MMCACovid19", 10, List.of()),

    VACCINATION("MMCACovid19Vac", 11, List.of("NV", "V", "PV"));

    private static final List<String> COMMON_SECTIONS = List.of(
            SimulationConfig.SIMULATION,
            SimulationConfig.DATA,
            SimulationConfig.EPIDEMIC_PARAMS,
            SimulationConfig.POPULATION_PARAMS,
            SimulationConfig.NPI);

    private final String id;
    private final int compartmentCount;
    private final List<String> vaccinationLabels;

    EngineVariant(String id, int compartmentCount, List<String> vaccinationLabels) {
        this.id = id;
        this.compartmentCount = compartmentCount;
        this.vaccinationLabels = vaccinationLabels;
    }

    /**
     * @return the identifier used in {@code simulation.engine}
     */
    public String id() {
        return id;
    }

    /**
     * @return size of the compartment axis of initial conditions for this variant
     */
    public int compartmentCount() {
        return compartmentCount;
    }

    public List<String> vaccinationLabels() {
        return vaccinationLabels;
    }

    public boolean hasVaccinationAxis() {
        return !vaccinationLabels.isEmpty();
    }

    /**
     * @return top-level configuration sections this variant cannot run without
     */
    public List<String> requiredSections() {
        if (!hasVaccinationAxis()) {
            return COMMON_SECTIONS;
        }
        return List.of(
                SimulationConfig.SIMULATION,
                SimulationConfig.DATA,
                SimulationConfig.EPIDEMIC_PARAMS,
                SimulationConfig.POPULATION_PARAMS,
                SimulationConfig.VACCINATION,
                SimulationConfig.NPI);
    }

    public static Optional<EngineVariant> fromId(String id) {
        return Arrays.stream(values()).filter(v -> v.id.equals(id)).findFirst();
    }
}
