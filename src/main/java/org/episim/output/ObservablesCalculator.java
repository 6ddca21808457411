package org.episim.output;

import org.episim.api.model.Compartment;
import org.episim.api.model.CompartmentLayout;
import org.episim.api.model.DenseArray;
import org.episim.api.model.EpidemicRates;

/**
 * Derives {@link Observables} from a finished run.
 */
public final class ObservablesCalculator {

    private ObservablesCalculator() {
    }

    public static Observables compute(CompartmentState state) {
        CompartmentLayout layout = state.layout();
        EpidemicRates rates = state.epidemic().rates();
        int[] shape = {layout.ageGroups(), layout.patches(), layout.timeSteps()};
        DenseArray newInfected = new DenseArray(shape);
        DenseArray newHospitalized = new DenseArray(shape);
        DenseArray deceased = new DenseArray(shape);

        double[] asymptomatic = state.epidemic().density(Compartment.A).data();
        double[] symptomatic = state.epidemic().density(Compartment.I).data();
        double[] dead = state.epidemic().density(Compartment.D).data();

        for (int g = 0; g < layout.ageGroups(); g++) {
            double alpha = rates.alpha()[g];
            double hospitalization = rates.hospitalizationRate(g);
            for (int m = 0; m < layout.patches(); m++) {
                double n = state.population().count(g, m);
                for (int t = 0; t < layout.timeSteps(); t++) {
                    double a = 0.0;
                    double i = 0.0;
                    double d = 0.0;
                    for (int v = 0; v < layout.vaccinationStates(); v++) {
                        int offset = layout.densityOffset(g, m, t, v);
                        a += asymptomatic[offset];
                        i += symptomatic[offset];
                        d += dead[offset];
                    }
                    newInfected.set(a * n * alpha, g, m, t);
                    newHospitalized.set(i * n * hospitalization, g, m, t);
                    deceased.set(d * n, g, m, t);
                }
            }
        }
        return new Observables(newInfected, newHospitalized, dailyIncrease(deceased));
    }

    /**
     * Differences along the last axis of a {@code (G, M, T)} array; step 0 is 0.
     */
    static DenseArray dailyIncrease(DenseArray cumulative) {
        DenseArray increase = new DenseArray(cumulative.shape());
        for (int g = 0; g < cumulative.dim(0); g++) {
            for (int m = 0; m < cumulative.dim(1); m++) {
                for (int t = 1; t < cumulative.dim(2); t++) {
                    increase.set(cumulative.get(g, m, t) - cumulative.get(g, m, t - 1), g, m, t);
                }
            }
        }
        return increase;
    }
}
