package org.episim.api.model;

import java.util.List;

/**
 * Extents of the density arrays of one run.
 * <p>
 * Densities are indexed {@code (age group, patch, time step)}, with a trailing vaccination-state
 * axis when {@link #vaccinationLabels()} is non-empty.
 *
 * @param ageGroups         G
 * @param patches           M
 * @param timeSteps         T
 * @param vaccinationLabels labels of the vaccination axis, empty when the variant has none
 */
public record CompartmentLayout(int ageGroups, int patches, int timeSteps, List<String> vaccinationLabels) {

    public CompartmentLayout {
        if (ageGroups < 1 || patches < 1 || timeSteps < 1) {
            throw new IllegalArgumentException("Layout extents must be positive: G=" + ageGroups
                    + ", M=" + patches + ", T=" + timeSteps);
        }
        vaccinationLabels = List.copyOf(vaccinationLabels);
    }

    public boolean hasVaccinationAxis() {
        return !vaccinationLabels.isEmpty();
    }

    /**
     * @return V, or 1 when there is no vaccination axis
     */
    public int vaccinationStates() {
        return hasVaccinationAxis() ? vaccinationLabels.size() : 1;
    }

    public int[] densityShape() {
        return hasVaccinationAxis()
                ? new int[] {ageGroups, patches, timeSteps, vaccinationLabels.size()}
                : new int[] {ageGroups, patches, timeSteps};
    }

    /**
     * @param compartments size of the trailing compartment axis
     * @return {@code (G, M, [V,] compartments)}, the layout of one time step
     */
    public int[] snapshotShape(int compartments) {
        return hasVaccinationAxis()
                ? new int[] {ageGroups, patches, vaccinationLabels.size(), compartments}
                : new int[] {ageGroups, patches, compartments};
    }

    /**
     * Flat offset of a density element. {@code v} is ignored without a vaccination axis.
     */
    public int densityOffset(int g, int m, int t, int v) {
        int offset = (g * patches + m) * timeSteps + t;
        return hasVaccinationAxis() ? offset * vaccinationLabels.size() + v : offset;
    }
}
