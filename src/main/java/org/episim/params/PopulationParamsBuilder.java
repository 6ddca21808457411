package org.episim.params;

import java.util.ArrayList;
import java.util.List;

import org.episim.api.exceptions.InvalidParameterException;
import org.episim.api.exceptions.MissingParameterException;
import org.episim.api.exceptions.TabularSchemaException;
import org.episim.api.model.DenseArray;
import org.episim.api.model.MobilityEdge;
import org.episim.api.model.PopulationParams;
import org.episim.config.ConfigSection;
import org.episim.io.MetapopulationTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link PopulationParams} from {@code population_params} and the loaded tables.
 * <p>
 * Population counts are rounded half-to-even. Non-finite or negative cells are replaced by 0
 * and reported at WARN, so the count matrix is always non-negative.
 */
public final class PopulationParamsBuilder {

    private static final Logger log = LoggerFactory.getLogger(PopulationParamsBuilder.class);

    private PopulationParamsBuilder() {
    }

    /**
     * @param section       the {@code population_params} section
     * @param metapopulation patch table with one column per age label
     * @param mobility      raw mobility edges, self-loops included
     * @throws MissingParameterException if a structural parameter is absent
     * @throws InvalidParameterException if a parameter has the wrong length
     * @throws TabularSchemaException    if a mobility edge references an unknown patch
     */
    public static PopulationParams build(ConfigSection section, MetapopulationTable metapopulation,
            List<MobilityEdge> mobility)
            throws MissingParameterException, InvalidParameterException, TabularSchemaException {
        List<String> ageLabels = section.stringList("G_labels");
        int ageGroups = ageLabels.size();
        if (ageGroups == 0) {
            throw new InvalidParameterException("population_params.G_labels must name at least one age group");
        }
        int patches = metapopulation.rows();
        if (patches == 0) {
            throw new TabularSchemaException("Metapopulation table has no patches");
        }

        DenseArray counts = new DenseArray(ageGroups, patches);
        for (int g = 0; g < ageGroups; g++) {
            double[] column = metapopulation.ageColumn(ageLabels.get(g));
            for (int m = 0; m < patches; m++) {
                counts.set(normalizeCount(column[m], ageLabels.get(g), metapopulation.ids().get(m)), g, m);
            }
        }
        checkDeclaredTotals(counts, metapopulation);

        return new PopulationParams(
                ageLabels,
                metapopulation.ids(),
                counts,
                section.doubleMatrix("C", ageGroups, ageGroups),
                section.doubleVector("kᵍ", ageGroups),
                section.doubleVector("kᵍ_h", ageGroups),
                section.doubleVector("kᵍ_w", ageGroups),
                section.doubleVector("pᵍ", ageGroups),
                dropSelfLoops(checkBounds(mobility, patches)),
                metapopulation.areas().clone(),
                section.number("ξ"),
                section.number("σ"));
    }

    /**
     * Removes edges whose origin equals their destination. Their weight is discarded.
     *
     * @param edges edges as read from the mobility file
     * @return the remaining edges in input order
     */
    public static List<MobilityEdge> dropSelfLoops(List<MobilityEdge> edges) {
        List<MobilityEdge> result = new ArrayList<>(edges.size());
        int dropped = 0;
        for (MobilityEdge edge : edges) {
            if (edge.isSelfLoop()) {
                dropped++;
            } else {
                result.add(edge);
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} self-loop(s) from mobility network", dropped);
        }
        return result;
    }

    private static List<MobilityEdge> checkBounds(List<MobilityEdge> edges, int patches) throws TabularSchemaException {
        for (MobilityEdge edge : edges) {
            if (edge.origin() >= patches || edge.destination() >= patches) {
                throw new TabularSchemaException("Mobility edge " + edge.origin() + " -> " + edge.destination()
                        + " references a patch outside the " + patches + " patches of the metapopulation table");
            }
        }
        return edges;
    }

    private static double normalizeCount(double value, String ageLabel, String patchId) {
        if (!Double.isFinite(value) || value < 0) {
            log.warn("Population of age group '{}' in patch '{}' is {}; using 0", ageLabel, patchId, value);
            return 0.0;
        }
        return Math.rint(value);
    }

    private static void checkDeclaredTotals(DenseArray counts, MetapopulationTable metapopulation) {
        int ageGroups = counts.dim(0);
        double tolerance = 0.5 * ageGroups + 1e-9;
        for (int m = 0; m < counts.dim(1); m++) {
            double sum = 0.0;
            for (int g = 0; g < ageGroups; g++) {
                sum += counts.get(g, m);
            }
            double declared = metapopulation.totals()[m];
            if (Math.abs(sum - declared) > tolerance) {
                log.warn("Patch '{}' declares total {} but its age groups sum to {}",
                        metapopulation.ids().get(m), declared, sum);
            }
        }
    }
}
