package org.episim.io;

import java.time.LocalDate;
import java.util.List;

/**
 * Observed mobility reduction over time, used as κ₀ change points.
 *
 * @param dates      day of each observation
 * @param reductions κ₀ value taking effect on that day
 */
public record MobilityReductionSeries(List<LocalDate> dates, double[] reductions) {

    public MobilityReductionSeries {
        dates = List.copyOf(dates);
        if (dates.size() != reductions.length) {
            throw new IllegalArgumentException("Mobility reduction columns differ in length");
        }
    }

    public int size() {
        return dates.size();
    }
}
