package org.episim.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.nio.file.Files;
import java.nio.file.Path;

import org.episim.api.exceptions.InvalidParameterException;
import org.episim.api.exceptions.MissingInputFileException;
import org.episim.api.exceptions.SpreadingEngineException;
import org.episim.api.model.Compartment;
import org.episim.api.model.DenseArray;
import org.episim.config.SimulationConfig;
import org.episim.engine.EngineRegistry;
import org.episim.engine.EngineVariant;
import org.episim.initial.InitialConditionResolver;
import org.episim.initial.SeedInitialConditionBuilder;
import org.episim.io.TabularDataLoader;
import org.episim.io.formats.netcdf.NetCdfCodec;
import org.episim.runtime.spi.ISpreadingEngine;
import org.episim.runtime.spi.SpreadingContext;
import org.episim.setup.ModelTemplateFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.typesafe.config.ConfigFactory;

/**
 * Runs complete simulations on template models written to a temporary directory.
 */
@Tag("integration")
@DisplayName("SimulationRunner Integration Tests")
class SimulationRunnerTest {

    @TempDir
    Path tempDir;

    private Path dataFolder;
    private Path instanceFolder;

    private SimulationConfig writeModel(EngineVariant variant, int patches, int ageGroups) throws Exception {
        Path modelFolder = tempDir.resolve("model");
        Path configFile = new ModelTemplateFactory().writeModel(modelFolder, variant, patches, ageGroups);
        dataFolder = modelFolder.resolve(ModelTemplateFactory.DATA_FOLDER);
        instanceFolder = tempDir.resolve("instance");
        return SimulationConfig.load(configFile);
    }

    private static SimulationRunner defaultRunner() throws Exception {
        return SimulationRunner.fromSettings(ConfigFactory.defaultReference());
    }

    @Nested
    @DisplayName("Stationary engine")
    class StationaryRuns {

        @Test
        @DisplayName("Basic model from seeds writes full dump and observables")
        void basicRunFromSeeds() throws Exception {
            SimulationConfig config = writeModel(EngineVariant.BASIC, 2, 3);

            RunSummary summary = defaultRunner().run(config, new RunPaths(dataFolder, instanceFolder));

            assertThat(summary.outputFolder()).isEqualTo(instanceFolder.resolve("output"));
            assertThat(summary.writtenFiles()).extracting(path -> path.getFileName().toString())
                    .containsExactly("compartments_full.nc", "observables.nc");
            assertThat(summary.hasReportedErrors()).isFalse();

            NetCdfCodec.Reader reader = NetCdfCodec.Reader.open(summary.outputFolder().resolve("compartments_full.nc"));
            assertThat(reader.shapeOf("S")).containsExactly(3, 2, 30);
            DenseArray asymptomatic = reader.readNumeric("A");
            double seeded = 0.0;
            for (int g = 0; g < 3; g++) {
                seeded += asymptomatic.get(g, 0, 29);
            }
            assertThat(seeded).isCloseTo(10.0, within(1e-9));
            assertThat(asymptomatic.get(2, 0, 0)).isCloseTo(7.2, within(1e-9));
            assertThat(asymptomatic.get(0, 1, 0)).isZero();
        }

        @Test
        @DisplayName("Vaccination model writes a snapshot with a vaccination axis")
        void vaccinationSnapshot() throws Exception {
            SimulationConfig config = writeModel(EngineVariant.VACCINATION, 1, 2)
                    .withValue(SimulationConfig.SIMULATION, "save_time_step", 3);

            RunSummary summary = defaultRunner().run(config, new RunPaths(dataFolder, instanceFolder));

            Path snapshot = summary.outputFolder().resolve("compartments_t_2020-02-11.nc");
            assertThat(summary.writtenFiles()).contains(snapshot);
            NetCdfCodec.Reader reader = NetCdfCodec.Reader.open(snapshot);
            assertThat(reader.dimensionsOf("data")).containsExactly("G", "M", "V", "epi_states");
            assertThat(reader.shapeOf("data")).containsExactly(2, 1, 3, 11);
            assertThat(reader.readLabels("V_label")).containsExactly("NV", "V", "PV");
            DenseArray data = reader.readNumeric("data");
            // Seed fractions are uniform for two age groups
            assertThat(data.get(0, 0, 0, Compartment.A.ordinal())).isCloseTo(5.0, within(1e-9));
            assertThat(data.get(0, 0, 0, Compartment.S.ordinal())).isCloseTo(995.0, within(1e-9));
        }

        @Test
        @DisplayName("A snapshot beyond the horizon is reported while other outputs are written")
        void outOfRangeSnapshotIsReported() throws Exception {
            SimulationConfig config = writeModel(EngineVariant.BASIC, 1, 3)
                    .withValue(SimulationConfig.SIMULATION, "save_time_step", 31);

            RunSummary summary = defaultRunner().run(config, new RunPaths(dataFolder, instanceFolder));

            assertThat(summary.hasReportedErrors()).isTrue();
            assertThat(summary.reportedErrors().get(0)).hasMessageContaining("31");
            assertThat(summary.writtenFiles()).hasSize(2);
        }

        @Test
        @DisplayName("An initial condition generated from seeds is picked up by the next run")
        void generatedInitialCondition() throws Exception {
            SimulationConfig config = writeModel(EngineVariant.BASIC, 2, 3)
                    .withValue(SimulationConfig.DATA, "seeds_filename", "absent.csv");
            SimulationRunner runner = defaultRunner();

            Path written = runner.generateInitialCondition(config, dataFolder,
                    dataFolder.resolve(ModelTemplateFactory.SEEDS_FILE),
                    dataFolder.resolve(ModelTemplateFactory.INITIAL_CONDITION_FILE));
            RunSummary summary = runner.run(config, new RunPaths(dataFolder, instanceFolder));

            assertThat(NetCdfCodec.Reader.open(written).shapeOf("data")).containsExactly(3, 2, 10);
            assertThat(summary.writtenFiles()).isNotEmpty();
        }

        @Test
        void runsWithoutAnyOutputRequested() throws Exception {
            SimulationConfig config = writeModel(EngineVariant.BASIC, 1, 3)
                    .withValue(SimulationConfig.SIMULATION, "save_full_output", false)
                    .withValue(SimulationConfig.SIMULATION, "save_observables", false);

            RunSummary summary = defaultRunner().run(config, new RunPaths(dataFolder, instanceFolder));

            assertThat(summary.writtenFiles()).isEmpty();
            assertThat(summary.outputFolder()).isDirectory();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void endBeforeStart() throws Exception {
            SimulationConfig config = writeModel(EngineVariant.BASIC, 1, 3)
                    .withValue(SimulationConfig.SIMULATION, "end_date", "2020-01-01");

            assertThatThrownBy(() -> defaultRunner().run(config, new RunPaths(dataFolder, instanceFolder)))
                    .isInstanceOf(InvalidParameterException.class);
        }

        @Test
        void missingMobilityFile() throws Exception {
            SimulationConfig config = writeModel(EngineVariant.BASIC, 1, 3);
            Files.delete(dataFolder.resolve(ModelTemplateFactory.MOBILITY_FILE));

            assertThatThrownBy(() -> defaultRunner().run(config, new RunPaths(dataFolder, instanceFolder)))
                    .isInstanceOf(MissingInputFileException.class)
                    .hasMessageContaining(ModelTemplateFactory.MOBILITY_FILE);
            assertThat(instanceFolder).doesNotExist();
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Engine boundary")
    class EngineBoundary {

        @Mock
        ISpreadingEngine engine;

        private SimulationRunner runner;

        @BeforeEach
        void setUp() throws Exception {
            TabularDataLoader loader = new TabularDataLoader(1);
            runner = new SimulationRunner(new EngineRegistry(), loader,
                    new InitialConditionResolver(loader, SeedInitialConditionBuilder.DEFAULT_AGE_FRACTIONS), engine);
        }

        @Test
        @DisplayName("The engine receives the built inputs with the initial condition at step 0")
        void engineReceivesContext() throws Exception {
            SimulationConfig config = writeModel(EngineVariant.VACCINATION, 2, 3);

            runner.run(config, new RunPaths(dataFolder, instanceFolder));

            ArgumentCaptor<SpreadingContext> captor = ArgumentCaptor.forClass(SpreadingContext.class);
            verify(engine).run(captor.capture());
            SpreadingContext context = captor.getValue();
            assertThat(context.variant()).isEqualTo(EngineVariant.VACCINATION);
            assertThat(context.vaccination()).isPresent();
            assertThat(context.population().mobility()).isEmpty();
            assertThat(context.npi().size()).isEqualTo(1);
            assertThat(context.epidemic().density(Compartment.S).get(1, 1, 0, 0)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Engine failures abort the run before any output is written")
        void engineFailurePropagates() throws Exception {
            SimulationConfig config = writeModel(EngineVariant.BASIC, 1, 3);
            doThrow(new SpreadingEngineException("integration diverged")).when(engine).run(any());

            assertThatThrownBy(() -> runner.run(config, new RunPaths(dataFolder, instanceFolder)))
                    .isInstanceOf(SpreadingEngineException.class)
                    .hasMessage("integration diverged");
            assertThat(instanceFolder).doesNotExist();
        }
    }
}
