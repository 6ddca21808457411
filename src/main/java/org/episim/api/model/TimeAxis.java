package org.episim.api.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily simulation horizon between two inclusive dates.
 * <p>
 * Time steps are 1-based: step 1 is {@link #start()}, step {@link #steps()} is {@link #end()}.
 *
 * @param start first simulated day
 * @param end   last simulated day, not before {@code start}
 */
public record TimeAxis(LocalDate start, LocalDate end) {

    public TimeAxis {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("End date " + end + " precedes start date " + start);
        }
    }

    /**
     * @return number of simulated days, {@code end - start + 1}
     */
    public int steps() {
        return (int) ChronoUnit.DAYS.between(start, end) + 1;
    }

    /**
     * @param step 1-based time step
     * @return the calendar date of that step
     */
    public LocalDate dateAt(int step) {
        return start.plusDays(step - 1L);
    }

    /**
     * @param date any date
     * @return the 1-based step of {@code date}, which may lie outside {@code [1, steps()]}
     */
    public int stepOf(LocalDate date) {
        return (int) ChronoUnit.DAYS.between(start, date) + 1;
    }

    public boolean contains(int step) {
        return step >= 1 && step <= steps();
    }

    /**
     * @return ISO-8601 date label of every step
     */
    public List<String> labels() {
        List<String> labels = new ArrayList<>(steps());
        for (int step = 1; step <= steps(); step++) {
            labels.add(dateAt(step).toString());
        }
        return labels;
    }
}
