package org.episim.api.model;

/**
 * Daily vaccine allocation of the vaccination engine variant.
 * <p>
 * {@code doses} has shape {@code (G, phases)}: column {@code k} is the number of doses per day
 * and age group applied from {@code phaseStarts[k]} until the next phase starts.
 *
 * @param phaseStarts 1-based steps at which each phase begins: start, end of campaign, horizon
 * @param doses       doses per day by age group and phase
 */
public record VaccinationSchedule(int[] phaseStarts, DenseArray doses) {

    public VaccinationSchedule {
        if (doses.rank() != 2 || doses.dim(1) != phaseStarts.length) {
            throw new IllegalArgumentException("Dose matrix " + doses + " does not match "
                    + phaseStarts.length + " phases");
        }
        phaseStarts = phaseStarts.clone();
    }

    public int phases() {
        return phaseStarts.length;
    }

    public double dosesPerDay(int ageGroup, int phase) {
        return doses.get(ageGroup, phase);
    }
}
