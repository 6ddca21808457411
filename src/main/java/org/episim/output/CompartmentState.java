package org.episim.output;

import java.util.List;

import org.episim.api.exceptions.ExportIndexOutOfRangeException;
import org.episim.api.model.Compartment;
import org.episim.api.model.CompartmentLayout;
import org.episim.api.model.DenseArray;
import org.episim.api.model.EpidemicParams;
import org.episim.api.model.PopulationParams;
import org.episim.api.model.TimeAxis;

/**
 * Read-only view of a finished run in absolute counts.
 * <p>
 * Counts are densities multiplied by the population of their {@code (age group, patch)} cell.
 */
public final class CompartmentState {

    private final PopulationParams population;
    private final EpidemicParams epidemic;
    private final TimeAxis timeAxis;

    public CompartmentState(PopulationParams population, EpidemicParams epidemic, TimeAxis timeAxis) {
        if (epidemic.layout().timeSteps() != timeAxis.steps()) {
            throw new IllegalArgumentException("Densities cover " + epidemic.layout().timeSteps()
                    + " steps but the time axis has " + timeAxis.steps());
        }
        this.population = population;
        this.epidemic = epidemic;
        this.timeAxis = timeAxis;
    }

    public CompartmentLayout layout() {
        return epidemic.layout();
    }

    public PopulationParams population() {
        return population;
    }

    public EpidemicParams epidemic() {
        return epidemic;
    }

    public TimeAxis timeAxis() {
        return timeAxis;
    }

    /**
     * @return counts of one compartment, shaped {@code (G, M, T, [V])}
     */
    public DenseArray counts(Compartment compartment) {
        CompartmentLayout layout = layout();
        double[] density = epidemic.density(compartment).data();
        DenseArray counts = new DenseArray(layout.densityShape());
        double[] target = counts.data();
        for (int g = 0; g < layout.ageGroups(); g++) {
            for (int m = 0; m < layout.patches(); m++) {
                double n = population.count(g, m);
                for (int t = 0; t < layout.timeSteps(); t++) {
                    for (int v = 0; v < layout.vaccinationStates(); v++) {
                        int offset = layout.densityOffset(g, m, t, v);
                        target[offset] = density[offset] * n;
                    }
                }
            }
        }
        return counts;
    }

    /**
     * Counts of all compartments at one step.
     *
     * @param step 1-based time step
     * @return array shaped {@code (G, M, [V,] 11)}
     * @throws ExportIndexOutOfRangeException if {@code step} is outside {@code [1, T]}
     */
    public DenseArray snapshot(int step) throws ExportIndexOutOfRangeException {
        if (!timeAxis.contains(step)) {
            throw new ExportIndexOutOfRangeException(step, timeAxis.steps());
        }
        CompartmentLayout layout = layout();
        List<Compartment> compartments = Compartment.all();
        DenseArray snapshot = new DenseArray(layout.snapshotShape(compartments.size()));
        int t = step - 1;
        for (Compartment compartment : compartments) {
            double[] density = epidemic.density(compartment).data();
            for (int g = 0; g < layout.ageGroups(); g++) {
                for (int m = 0; m < layout.patches(); m++) {
                    double n = population.count(g, m);
                    for (int v = 0; v < layout.vaccinationStates(); v++) {
                        double count = density[layout.densityOffset(g, m, t, v)] * n;
                        if (layout.hasVaccinationAxis()) {
                            snapshot.set(count, g, m, v, compartment.ordinal());
                        } else {
                            snapshot.set(count, g, m, compartment.ordinal());
                        }
                    }
                }
            }
        }
        return snapshot;
    }

    /**
     * @return total individuals across all compartments at each step, index 0 is step 1
     */
    public double[] totalsPerStep() {
        CompartmentLayout layout = layout();
        double[] totals = new double[layout.timeSteps()];
        for (Compartment compartment : Compartment.all()) {
            double[] density = epidemic.density(compartment).data();
            for (int g = 0; g < layout.ageGroups(); g++) {
                for (int m = 0; m < layout.patches(); m++) {
                    double n = population.count(g, m);
                    for (int t = 0; t < layout.timeSteps(); t++) {
                        for (int v = 0; v < layout.vaccinationStates(); v++) {
                            totals[t] += density[layout.densityOffset(g, m, t, v)] * n;
                        }
                    }
                }
            }
        }
        return totals;
    }
}
