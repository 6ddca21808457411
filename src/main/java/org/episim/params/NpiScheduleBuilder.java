package org.episim.params;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.episim.api.exceptions.InvalidParameterException;
import org.episim.api.exceptions.MissingParameterException;
import org.episim.api.exceptions.NpiScheduleException;
import org.episim.api.model.NpiSchedule;
import org.episim.api.model.NpiSchedule.ChangePoint;
import org.episim.api.model.TimeAxis;
import org.episim.config.ConfigSection;
import org.episim.io.MobilityReductionSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the intervention schedule from the {@code NPI} section.
 * <p>
 * The vectors {@code κ₀s}, {@code ϕs}, {@code δs} and {@code tᶜs} are aligned index for index.
 * When a mobility reduction series is supplied it replaces {@code κ₀s} and {@code tᶜs}; each
 * observation inside the horizon becomes a change point carrying the first configured
 * {@code ϕ} and {@code δ}.
 */
public final class NpiScheduleBuilder {

    private static final Logger log = LoggerFactory.getLogger(NpiScheduleBuilder.class);

    private NpiScheduleBuilder() {
    }

    /**
     * @param section   the {@code NPI} section
     * @param reduction mobility reduction series, or {@code null}
     * @param timeAxis  simulation horizon
     * @throws NpiScheduleException if the vectors differ in length, are empty or a step is below 1
     */
    public static NpiSchedule build(ConfigSection section, MobilityReductionSeries reduction, TimeAxis timeAxis)
            throws MissingParameterException, InvalidParameterException, NpiScheduleException {
        boolean enabled = section.bool("are_there_npi", true);
        double[] phis = section.doubleVector("ϕs", -1);
        double[] deltas = section.doubleVector("δs", -1);

        List<ChangePoint> changePoints = reduction != null
                ? fromReductionSeries(reduction, phis, deltas, timeAxis)
                : fromVectors(section, phis, deltas);

        changePoints.sort(Comparator.comparingInt(ChangePoint::timeStep));
        for (ChangePoint point : changePoints) {
            if (point.timeStep() > timeAxis.steps()) {
                log.warn("NPI change point at step {} lies beyond the horizon of {} steps", point.timeStep(),
                        timeAxis.steps());
            }
        }
        return new NpiSchedule(changePoints, enabled);
    }

    private static List<ChangePoint> fromVectors(ConfigSection section, double[] phis, double[] deltas)
            throws MissingParameterException, InvalidParameterException, NpiScheduleException {
        double[] kappas = section.doubleVector("κ₀s", -1);
        int[] steps = section.intVector("tᶜs");
        if (kappas.length != phis.length || kappas.length != deltas.length || kappas.length != steps.length) {
            throw new NpiScheduleException("NPI vectors must have equal length: κ₀s=" + kappas.length
                    + ", ϕs=" + phis.length + ", δs=" + deltas.length + ", tᶜs=" + steps.length);
        }
        if (kappas.length == 0) {
            throw new NpiScheduleException("NPI schedule has no change points");
        }
        List<ChangePoint> points = new ArrayList<>(kappas.length);
        for (int i = 0; i < kappas.length; i++) {
            if (steps[i] < 1) {
                throw new NpiScheduleException("NPI change point " + i + " starts at step " + steps[i]
                        + "; steps are 1-based");
            }
            points.add(new ChangePoint(steps[i], kappas[i], phis[i], deltas[i]));
        }
        return points;
    }

    private static List<ChangePoint> fromReductionSeries(MobilityReductionSeries reduction, double[] phis,
            double[] deltas, TimeAxis timeAxis) throws NpiScheduleException {
        if (phis.length == 0 || deltas.length == 0) {
            throw new NpiScheduleException("ϕs and δs need at least one value to accompany the mobility reduction series");
        }
        List<ChangePoint> points = new ArrayList<>();
        for (int i = 0; i < reduction.size(); i++) {
            int step = timeAxis.stepOf(reduction.dates().get(i));
            if (timeAxis.contains(step)) {
                points.add(new ChangePoint(step, reduction.reductions()[i], phis[0], deltas[0]));
            }
        }
        if (points.isEmpty()) {
            throw new NpiScheduleException("Mobility reduction series has no observation between "
                    + timeAxis.start() + " and " + timeAxis.end());
        }
        log.debug("Built {} NPI change points from mobility reduction series", points.size());
        return points;
    }
}
