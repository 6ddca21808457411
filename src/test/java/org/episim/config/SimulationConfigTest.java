package org.episim.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import org.episim.api.exceptions.ConfigSchemaException;
import org.episim.api.exceptions.InvalidParameterException;
import org.episim.api.exceptions.MissingInputFileException;
import org.episim.api.exceptions.MissingParameterException;
import org.episim.engine.EngineVariant;
import org.episim.fixtures.ModelFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
@DisplayName("SimulationConfig Unit Tests")
class SimulationConfigTest {

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        void loadsJsonFileWithUnicodeKeys(@TempDir Path tempDir) throws Exception {
            Path file = tempDir.resolve("config.json");
            Files.writeString(file, "{\"epidemic_params\": {\"βᴵ\": 0.09, \"ηᵍ\": [0.2, 0.3]}}");

            ConfigSection epidemic = SimulationConfig.load(file).section(SimulationConfig.EPIDEMIC_PARAMS);

            assertThat(epidemic.number("βᴵ")).isEqualTo(0.09);
            assertThat(epidemic.doubleVector("ηᵍ", 2)).containsExactly(0.2, 0.3);
        }

        @Test
        void missingFileIsReported(@TempDir Path tempDir) {
            Path file = tempDir.resolve("absent.json");

            assertThatThrownBy(() -> SimulationConfig.load(file))
                    .isInstanceOfSatisfying(MissingInputFileException.class,
                            e -> assertThat(e.getPath()).isEqualTo(file));
        }

        @Test
        void malformedJsonIsASchemaError() {
            assertThatThrownBy(() -> SimulationConfig.parse("{\"simulation\": "))
                    .isInstanceOf(ConfigSchemaException.class);
        }
    }

    @Nested
    @DisplayName("Section access")
    class SectionAccess {

        @Test
        void readsTypedValues() throws Exception {
            SimulationConfig config = ModelFixtures.config(EngineVariant.VACCINATION, 3);
            ConfigSection simulation = config.section(SimulationConfig.SIMULATION);
            ConfigSection population = config.section(SimulationConfig.POPULATION_PARAMS);

            assertThat(config.engineId()).contains("MMCACovid19Vac");
            assertThat(simulation.date("start_date")).isEqualTo(LocalDate.of(2020, 2, 9));
            assertThat(simulation.bool("save_full_output", false)).isTrue();
            assertThat(simulation.optionalInteger("save_time_step")).isEmpty();
            assertThat(population.stringList("G_labels")).containsExactly("G1", "G2", "G3");
            assertThat(population.doubleMatrix("C", 3, 3)[2]).hasSize(3);
        }

        @Test
        void absentKeyIsAMissingParameter() throws Exception {
            ConfigSection data = ModelFixtures.config(EngineVariant.BASIC, 2).section(SimulationConfig.DATA);

            assertThatThrownBy(() -> data.string("kappa0_filename"))
                    .isInstanceOf(MissingParameterException.class)
                    .hasMessageContaining("kappa0_filename")
                    .hasMessageContaining("data");
        }

        @Test
        void wrongVectorLengthIsInvalid() throws Exception {
            ConfigSection epidemic = ModelFixtures.config(EngineVariant.BASIC, 2)
                    .section(SimulationConfig.EPIDEMIC_PARAMS);

            assertThatThrownBy(() -> epidemic.doubleVector("αᵍ", 3))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("expected 3");
        }

        @Test
        void wrongTypeIsInvalid() throws Exception {
            SimulationConfig config = ModelFixtures.config(EngineVariant.BASIC, 2)
                    .withValue(SimulationConfig.SIMULATION, "start_date", "9th of February");

            assertThatThrownBy(() -> config.section(SimulationConfig.SIMULATION).date("start_date"))
                    .isInstanceOf(InvalidParameterException.class);
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        void withValueLeavesOriginalUntouched() throws Exception {
            SimulationConfig original = ModelFixtures.config(EngineVariant.BASIC, 2);

            SimulationConfig changed = original.withValue(SimulationConfig.SIMULATION, "end_date", "2020-02-20");

            assertThat(changed.section(SimulationConfig.SIMULATION).date("end_date"))
                    .isEqualTo(LocalDate.of(2020, 2, 20));
            assertThat(original.section(SimulationConfig.SIMULATION).date("end_date"))
                    .isEqualTo(LocalDate.of(2020, 3, 9));
        }

        @Test
        void withGroupValueReplacesOneAgeGroup() throws Exception {
            SimulationConfig config = ModelFixtures.config(EngineVariant.BASIC, 3)
                    .withGroupValue(SimulationConfig.EPIDEMIC_PARAMS, "θᵍ", "G2", 0.4);

            assertThat(config.section(SimulationConfig.EPIDEMIC_PARAMS).doubleVector("θᵍ", 3))
                    .containsExactly(0.0, 0.4, 0.0);
        }

        @Test
        void withGroupValueRejectsUnknownLabel() throws Exception {
            SimulationConfig config = ModelFixtures.config(EngineVariant.BASIC, 3);

            assertThatThrownBy(() -> config.withGroupValue(SimulationConfig.EPIDEMIC_PARAMS, "θᵍ", "elderly", 0.4))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("elderly");
        }

        @Test
        void rendersBackToParseableJson() throws Exception {
            SimulationConfig config = ModelFixtures.config(EngineVariant.VACCINATION, 2);

            SimulationConfig reparsed = SimulationConfig.parse(config.toJson());

            assertThat(reparsed.section(SimulationConfig.VACCINATION).integer("dur_vacc")).isEqualTo(8);
        }
    }
}
