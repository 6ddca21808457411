package org.episim.params;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.List;

import org.episim.api.exceptions.NpiScheduleException;
import org.episim.api.model.NpiSchedule;
import org.episim.api.model.NpiSchedule.ChangePoint;
import org.episim.api.model.TimeAxis;
import org.episim.config.ConfigSection;
import org.episim.config.SimulationConfig;
import org.episim.engine.EngineVariant;
import org.episim.fixtures.ModelFixtures;
import org.episim.io.MobilityReductionSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("NpiScheduleBuilder Unit Tests")
class NpiScheduleBuilderTest {

    private final TimeAxis timeAxis = new TimeAxis(LocalDate.of(2020, 2, 9), LocalDate.of(2020, 3, 9));

    private SimulationConfig config;

    @BeforeEach
    void setUp() throws Exception {
        config = ModelFixtures.config(EngineVariant.BASIC, 2);
    }

    @Test
    void changePointsAreSortedByStep() throws Exception {
        SimulationConfig changed = config
                .withValue(SimulationConfig.NPI, "κ₀s", List.of(0.6, 0.3))
                .withValue(SimulationConfig.NPI, "ϕs", List.of(0.2, 0.1))
                .withValue(SimulationConfig.NPI, "δs", List.of(0.8, 0.4))
                .withValue(SimulationConfig.NPI, "tᶜs", List.of(20, 5));

        NpiSchedule schedule = NpiScheduleBuilder.build(npi(changed), null, timeAxis);

        assertThat(schedule.enabled()).isTrue();
        assertThat(schedule.changePoints()).containsExactly(
                new ChangePoint(5, 0.3, 0.1, 0.4),
                new ChangePoint(20, 0.6, 0.2, 0.8));
    }

    @Test
    @DisplayName("Vectors of different lengths are rejected")
    void mismatchedLengths() {
        SimulationConfig changed = config.withValue(SimulationConfig.NPI, "ϕs", List.of(1.0, 0.5));

        assertThatThrownBy(() -> NpiScheduleBuilder.build(npi(changed), null, timeAxis))
                .isInstanceOf(NpiScheduleException.class)
                .hasMessageContaining("ϕs=2");
    }

    @Test
    void stepsAreOneBased() {
        SimulationConfig changed = config.withValue(SimulationConfig.NPI, "tᶜs", List.of(0));

        assertThatThrownBy(() -> NpiScheduleBuilder.build(npi(changed), null, timeAxis))
                .isInstanceOf(NpiScheduleException.class);
    }

    @Test
    void disabledScheduleKeepsChangePoints() throws Exception {
        SimulationConfig changed = config.withValue(SimulationConfig.NPI, "are_there_npi", false);

        NpiSchedule schedule = NpiScheduleBuilder.build(npi(changed), null, timeAxis);

        assertThat(schedule.enabled()).isFalse();
        assertThat(schedule.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("A reduction series replaces κ₀s and tᶜs inside the simulated window")
    void reductionSeriesDrivesChangePoints() throws Exception {
        MobilityReductionSeries series = new MobilityReductionSeries(
                List.of(LocalDate.of(2020, 2, 1), LocalDate.of(2020, 2, 15), LocalDate.of(2020, 2, 10)),
                new double[] {0.9, 0.5, 0.2});

        NpiSchedule schedule = NpiScheduleBuilder.build(npi(config), series, timeAxis);

        assertThat(schedule.changePoints()).containsExactly(
                new ChangePoint(2, 0.2, 1.0, 0.0),
                new ChangePoint(7, 0.5, 1.0, 0.0));
    }

    @Test
    void reductionSeriesOutsideWindowIsRejected() {
        MobilityReductionSeries series = new MobilityReductionSeries(
                List.of(LocalDate.of(2021, 1, 1)), new double[] {0.5});

        assertThatThrownBy(() -> NpiScheduleBuilder.build(npi(config), series, timeAxis))
                .isInstanceOf(NpiScheduleException.class)
                .hasMessageContaining("2020-02-09");
    }

    private static ConfigSection npi(SimulationConfig config) throws Exception {
        return config.section(SimulationConfig.NPI);
    }
}
