package org.episim.params;

import org.episim.api.exceptions.InvalidParameterException;
import org.episim.api.exceptions.MissingParameterException;
import org.episim.api.model.DenseArray;
import org.episim.api.model.PopulationParams;
import org.episim.api.model.TimeAxis;
import org.episim.api.model.VaccinationSchedule;
import org.episim.config.ConfigSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the three-phase vaccination schedule from the {@code vaccination} section.
 * <p>
 * The campaign runs from {@code start_vacc} for {@code dur_vacc} days. During the campaign
 * {@code round(total population · percentage_of_vacc_per_day)} doses are given per day,
 * split across age groups by {@code ϵᵍ}; before and after it no doses are given. With
 * {@code are_there_vaccines = false} every phase has zero doses.
 */
public final class VaccinationScheduleBuilder {

    private static final Logger log = LoggerFactory.getLogger(VaccinationScheduleBuilder.class);

    private VaccinationScheduleBuilder() {
    }

    public static VaccinationSchedule build(ConfigSection section, PopulationParams population, TimeAxis timeAxis)
            throws MissingParameterException, InvalidParameterException {
        int start = section.integer("start_vacc");
        int duration = section.integer("dur_vacc");
        if (start < 1 || duration < 0) {
            throw new InvalidParameterException("Vaccination campaign needs start_vacc >= 1 and dur_vacc >= 0, got "
                    + start + " and " + duration);
        }
        if (!section.has("are_there_vaccines")) {
            throw new MissingParameterException(section.name(), "are_there_vaccines");
        }
        boolean enabled = section.bool("are_there_vaccines", false);
        int ageGroups = population.ageGroups();
        double[] shares = section.doubleVector("ϵᵍ", ageGroups);
        double dailyDoses = Math.rint(population.totalPopulation() * section.number("percentage_of_vacc_per_day"));

        int[] phaseStarts = {start, start + duration, timeAxis.steps()};
        DenseArray doses = new DenseArray(ageGroups, phaseStarts.length);
        if (enabled) {
            for (int g = 0; g < ageGroups; g++) {
                doses.set(shares[g] * dailyDoses, g, 1);
            }
        }
        log.debug("Vaccination campaign: steps {}..{}, {} doses/day, enabled={}",
                start, start + duration, dailyDoses, enabled);
        return new VaccinationSchedule(phaseStarts, doses);
    }
}
