package org.episim.api.model;

import java.util.List;

/**
 * Non-pharmaceutical interventions as ordered change points.
 *
 * @param changePoints interventions sorted by the step at which they take effect
 * @param enabled      {@code are_there_npi}; when false engines ignore the change points
 */
public record NpiSchedule(List<ChangePoint> changePoints, boolean enabled) {

    public NpiSchedule {
        changePoints = List.copyOf(changePoints);
    }

    /**
     * @param timeStep 1-based step at which the intervention starts
     * @param kappa0   mobility/confinement reduction κ₀
     * @param phi      household permeability ϕ
     * @param delta    social distancing δ
     */
    public record ChangePoint(int timeStep, double kappa0, double phi, double delta) {
    }

    public int size() {
        return changePoints.size();
    }
}
