package org.episim.fixtures;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.episim.api.exceptions.ConfigSchemaException;
import org.episim.api.model.DenseArray;
import org.episim.api.model.PopulationParams;
import org.episim.config.SimulationConfig;
import org.episim.engine.EngineVariant;
import org.episim.setup.ModelTemplateFactory;

/**
 * Small populations and configurations shared by tests.
 */
public final class ModelFixtures {

    private ModelFixtures() {
    }

    /**
     * The template configuration of a variant, as written by {@code episim setup}.
     */
    public static SimulationConfig config(EngineVariant variant, int ageGroups) throws ConfigSchemaException {
        return SimulationConfig.parse(new ModelTemplateFactory().createConfig(variant, ageGroups).toString());
    }

    /**
     * Builds a population without mobility.
     *
     * @param counts individuals indexed {@code [age group][patch]}
     */
    public static PopulationParams population(double[][] counts) {
        int ageGroups = counts.length;
        int patches = counts[0].length;
        DenseArray array = new DenseArray(ageGroups, patches);
        List<String> ageLabels = new ArrayList<>();
        for (int g = 0; g < ageGroups; g++) {
            ageLabels.add("G" + (g + 1));
            for (int m = 0; m < patches; m++) {
                array.set(counts[g][m], g, m);
            }
        }
        List<String> patchIds = new ArrayList<>();
        for (int m = 0; m < patches; m++) {
            patchIds.add(String.valueOf(m + 1));
        }
        double[][] contacts = new double[ageGroups][ageGroups];
        for (double[] row : contacts) {
            Arrays.fill(row, 1.0 / ageGroups);
        }
        return new PopulationParams(ageLabels, patchIds, array, contacts,
                filled(ageGroups, 10.0), filled(ageGroups, 3.0), filled(ageGroups, 1.0), filled(ageGroups, 1.0),
                List.of(), filled(patches, 1.0), 0.01, 2.5);
    }

    private static double[] filled(int length, double value) {
        double[] values = new double[length];
        Arrays.fill(values, value);
        return values;
    }
}
