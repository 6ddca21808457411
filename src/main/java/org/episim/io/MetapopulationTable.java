package org.episim.io;

import java.util.List;
import java.util.Map;

/**
 * Typed content of the metapopulation CSV: one row per patch.
 *
 * @param ids        patch identifiers ({@code id} column)
 * @param areas      patch surfaces ({@code area} column)
 * @param ageColumns population per age label, in {@code G_labels} order
 * @param totals     declared total population per patch ({@code total} column)
 */
public record MetapopulationTable(List<String> ids, double[] areas, Map<String, double[]> ageColumns, double[] totals) {

    public MetapopulationTable {
        ids = List.copyOf(ids);
    }

    public int rows() {
        return ids.size();
    }

    public double[] ageColumn(String label) {
        return ageColumns.get(label);
    }
}
