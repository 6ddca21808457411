package org.episim.api.model;

import java.util.List;

/**
 * Demographic and mobility structure of a metapopulation.
 *
 * @param ageLabels       labels of the G age strata
 * @param patchIds        identifiers of the M patches
 * @param counts          rounded, non-negative population per {@code (age group, patch)}
 * @param contacts        G×G contact matrix C
 * @param contactsPerAge  average contacts kᵍ
 * @param contactsHome    household contacts kᵍ_h
 * @param contactsWork    work contacts kᵍ_w
 * @param mobilityPerAge  mobility factor pᵍ
 * @param mobility        mobility edges between distinct patches
 * @param areas           surface of each patch
 * @param densityFactor   ξ
 * @param householdSize   σ
 */
public record PopulationParams(
        List<String> ageLabels,
        List<String> patchIds,
        DenseArray counts,
        double[][] contacts,
        double[] contactsPerAge,
        double[] contactsHome,
        double[] contactsWork,
        double[] mobilityPerAge,
        List<MobilityEdge> mobility,
        double[] areas,
        double densityFactor,
        double householdSize
) {

    public PopulationParams {
        ageLabels = List.copyOf(ageLabels);
        patchIds = List.copyOf(patchIds);
        mobility = List.copyOf(mobility);
        if (!counts.hasShape(ageLabels.size(), patchIds.size())) {
            throw new IllegalArgumentException("Population counts " + counts + " do not match G="
                    + ageLabels.size() + ", M=" + patchIds.size());
        }
    }

    public int ageGroups() {
        return ageLabels.size();
    }

    public int patches() {
        return patchIds.size();
    }

    public double count(int ageGroup, int patch) {
        return counts.get(ageGroup, patch);
    }

    public double patchTotal(int patch) {
        double total = 0.0;
        for (int g = 0; g < ageGroups(); g++) {
            total += counts.get(g, patch);
        }
        return total;
    }

    public double totalPopulation() {
        return counts.sum();
    }
}
