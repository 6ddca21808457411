package org.episim.initial;

import java.util.Arrays;

import org.episim.api.exceptions.InvalidParameterException;
import org.episim.api.exceptions.TabularSchemaException;
import org.episim.api.model.Compartment;
import org.episim.api.model.DenseArray;
import org.episim.api.model.PopulationParams;
import org.episim.io.SeedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes initial compartment counts from a seed table.
 * <p>
 * Everybody starts susceptible and non-vaccinated. In every seeded patch the seed count is
 * split across age groups by the age fractions and placed in the asymptomatic compartment;
 * the same number is removed from the susceptibles. Several rows for one patch are added up
 * first. The last age group receives the remainder of the split, so the asymptomatic counts of
 * a patch, summed in age order, equal its seed count exactly.
 */
public final class SeedInitialConditionBuilder {

    private static final Logger log = LoggerFactory.getLogger(SeedInitialConditionBuilder.class);

    /** Default split of seeds across three age groups (young, adult, old). */
    public static final double[] DEFAULT_AGE_FRACTIONS = {0.12, 0.16, 0.72};

    private static final double FRACTION_TOLERANCE = 1e-9;

    private final double[] ageFractions;

    /**
     * @param ageFractions share of seeds per age group; length G, summing to 1
     * @throws InvalidParameterException if the fractions are negative or do not sum to 1
     */
    public SeedInitialConditionBuilder(double[] ageFractions) throws InvalidParameterException {
        double sum = 0.0;
        for (double fraction : ageFractions) {
            if (fraction < 0 || !Double.isFinite(fraction)) {
                throw new InvalidParameterException("Age fractions must be non-negative: " + Arrays.toString(ageFractions));
            }
            sum += fraction;
        }
        if (ageFractions.length == 0 || Math.abs(sum - 1.0) > FRACTION_TOLERANCE) {
            throw new InvalidParameterException("Age fractions must sum to 1, got " + sum + " for "
                    + Arrays.toString(ageFractions));
        }
        this.ageFractions = ageFractions.clone();
    }

    public double[] ageFractions() {
        return ageFractions.clone();
    }

    /**
     * @param shape      {@code (G, M, [V,] C)} as required by the engine variant
     * @param population population counts per age group and patch
     * @param seeds      seeded patches
     * @return initial counts; vaccination index 0 holds everybody when a vaccination axis exists
     * @throws InvalidParameterException if the number of age fractions differs from G
     * @throws TabularSchemaException    if a seed references a patch that does not exist
     */
    public DenseArray build(int[] shape, PopulationParams population, SeedTable seeds)
            throws InvalidParameterException, TabularSchemaException {
        int ageGroups = population.ageGroups();
        int patches = population.patches();
        if (ageFractions.length != ageGroups) {
            throw new InvalidParameterException("Got " + ageFractions.length + " age fractions for "
                    + ageGroups + " age groups " + population.ageLabels());
        }
        boolean vaccinationAxis = shape.length == 4;
        DenseArray counts = new DenseArray(shape);
        int susceptible = Compartment.S.ordinal();
        int asymptomatic = Compartment.A.ordinal();

        for (int g = 0; g < ageGroups; g++) {
            for (int m = 0; m < patches; m++) {
                counts.set(population.count(g, m), index(vaccinationAxis, g, m, susceptible));
            }
        }

        double[] seedsPerPatch = new double[patches];
        for (int i = 0; i < seeds.size(); i++) {
            int patch = seeds.patches()[i];
            if (patch >= patches) {
                throw new TabularSchemaException("Seed row " + (i + 1) + " references patch " + patch
                        + " but there are only " + patches + " patches");
            }
            seedsPerPatch[patch] += seeds.seeds()[i];
        }

        for (int m = 0; m < patches; m++) {
            if (seedsPerPatch[m] == 0.0) {
                continue;
            }
            double[] shares = split(seedsPerPatch[m]);
            for (int g = 0; g < ageGroups; g++) {
                int[] s = index(vaccinationAxis, g, m, susceptible);
                counts.set(shares[g], index(vaccinationAxis, g, m, asymptomatic));
                double remaining = counts.get(s) - shares[g];
                if (remaining < 0) {
                    log.warn("Seeds exceed the population of age group '{}' in patch '{}'; susceptibles clamped to 0",
                            population.ageLabels().get(g), population.patchIds().get(m));
                    remaining = 0.0;
                }
                counts.set(remaining, s);
            }
        }
        log.debug("Seeded {} patch(es) with {} infections", seeds.size(), seeds.totalSeeds());
        return counts;
    }

    /**
     * Splits one patch's seeds across age groups. The last group takes the remainder, nudged by
     * single ulps until the shares, summed from the first group on, give back {@code seed} exactly.
     */
    double[] split(double seed) {
        int groups = ageFractions.length;
        double[] shares = new double[groups];
        double assigned = 0.0;
        for (int g = 0; g < groups - 1; g++) {
            shares[g] = ageFractions[g] * seed;
            assigned += shares[g];
        }
        double last = seed - assigned;
        while (assigned + last > seed) {
            last = Math.nextDown(last);
        }
        while (assigned + last < seed) {
            last = Math.nextUp(last);
        }
        shares[groups - 1] = last;
        return shares;
    }

    private static int[] index(boolean vaccinationAxis, int g, int m, int compartment) {
        return vaccinationAxis ? new int[] {g, m, 0, compartment} : new int[] {g, m, compartment};
    }
}
