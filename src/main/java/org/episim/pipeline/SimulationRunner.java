package org.episim.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.episim.api.exceptions.EpiSimException;
import org.episim.api.exceptions.ExportIndexOutOfRangeException;
import org.episim.api.exceptions.InvalidParameterException;
import org.episim.api.model.DenseArray;
import org.episim.api.model.EpidemicParams;
import org.episim.api.model.MobilityEdge;
import org.episim.api.model.NpiSchedule;
import org.episim.api.model.PopulationParams;
import org.episim.api.model.TimeAxis;
import org.episim.api.model.VaccinationSchedule;
import org.episim.config.ConfigSchemaValidator;
import org.episim.config.ConfigSection;
import org.episim.config.SimulationConfig;
import org.episim.engine.EngineRegistry;
import org.episim.engine.IEngineHandler;
import org.episim.initial.InitialConditionResolver;
import org.episim.io.MetapopulationTable;
import org.episim.io.MobilityReductionSeries;
import org.episim.io.TabularDataLoader;
import org.episim.io.formats.ArrayFileFormats;
import org.episim.output.CompartmentState;
import org.episim.output.ObservablesCalculator;
import org.episim.output.OutputSerializer;
import org.episim.params.NpiScheduleBuilder;
import org.episim.params.PopulationParamsBuilder;
import org.episim.runtime.SpreadingEngineFactory;
import org.episim.runtime.spi.ISpreadingEngine;
import org.episim.runtime.spi.SpreadingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Runs one simulation from configuration to output files.
 * <p>
 * Stages, strictly in order: validation, data loading, parameter construction, initial
 * conditions, spreading engine, serialization. Any failure before serialization aborts the run.
 * An out-of-range snapshot request is reported in the {@link RunSummary} while the other
 * outputs are still written.
 * <p>
 * <strong>Thread Safety:</strong> A runner holds no per-run state and may execute runs
 * sequentially; each run owns its parameter structures.
 */
public class SimulationRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunner.class);

    public static final String DEFAULT_OUTPUT_FOLDER = "output";

    private final EngineRegistry registry;
    private final TabularDataLoader loader;
    private final InitialConditionResolver initialConditions;
    private final ISpreadingEngine spreadingEngine;

    public SimulationRunner(EngineRegistry registry, TabularDataLoader loader,
            InitialConditionResolver initialConditions, ISpreadingEngine spreadingEngine) {
        this.registry = registry;
        this.loader = loader;
        this.initialConditions = initialConditions;
        this.spreadingEngine = spreadingEngine;
    }

    /**
     * Creates a runner from the {@code episim} block of the application configuration.
     *
     * @param settings application configuration containing {@code episim.*}
     * @throws EpiSimException if the configured spreading engine cannot be created
     */
    public static SimulationRunner fromSettings(Config settings) throws EpiSimException {
        Config episim = settings.getConfig("episim");
        TabularDataLoader loader = new TabularDataLoader(episim.getInt("data.index-base"));
        double[] fractions = episim.getDoubleList("initial-condition.age-fractions").stream()
                .mapToDouble(Double::doubleValue)
                .toArray();
        return new SimulationRunner(new EngineRegistry(), loader,
                new InitialConditionResolver(loader, fractions),
                SpreadingEngineFactory.create(episim.getConfig("spreading-engine")));
    }

    /**
     * @param config simulation configuration
     * @param paths  input and output locations
     * @return the written files and any non-fatal errors
     * @throws EpiSimException if validation, parameter construction or the engine fail
     * @throws IOException     if an input cannot be read or an output cannot be written
     */
    public RunSummary run(SimulationConfig config, RunPaths paths) throws EpiSimException, IOException {
        IEngineHandler handler = ConfigSchemaValidator.validate(config, registry);
        ConfigSection simulation = config.section(SimulationConfig.SIMULATION);
        ConfigSection data = config.section(SimulationConfig.DATA);
        TimeAxis timeAxis = timeAxis(simulation);
        log.info("Running {} from {} to {} ({} steps)", handler.variant().id(), timeAxis.start(), timeAxis.end(),
                timeAxis.steps());

        log.info("Loading data from {}", paths.dataFolder());
        ConfigSection populationSection = config.section(SimulationConfig.POPULATION_PARAMS);
        MetapopulationTable metapopulation = loader.loadMetapopulation(
                paths.dataFolder().resolve(data.string("metapopulation_data_filename")),
                populationSection.stringList("G_labels"));
        List<MobilityEdge> mobility = loader.loadMobility(
                paths.dataFolder().resolve(data.string("mobility_matrix_filename")));
        MobilityReductionSeries reduction = data.has("kappa0_filename")
                ? loader.loadMobilityReduction(paths.dataFolder().resolve(data.string("kappa0_filename")))
                : null;

        log.info("Building parameter structures");
        PopulationParams population = PopulationParamsBuilder.build(populationSection, metapopulation, mobility);
        log.info("Metapopulation: G={} age groups, M={} patches, {} mobility edges, population {}",
                population.ageGroups(), population.patches(), population.mobility().size(),
                population.totalPopulation());
        EpidemicParams epidemic = handler.buildEpidemicParams(config, population, timeAxis);
        NpiSchedule npi = NpiScheduleBuilder.build(config.section(SimulationConfig.NPI), reduction, timeAxis);
        Optional<VaccinationSchedule> vaccination = handler.buildVaccinationSchedule(config, population, timeAxis);

        DenseArray initialCounts = initialConditions.resolve(config, handler, population, paths.dataFolder(),
                paths.initialCondition());
        InitialConditionResolver.applyCounts(initialCounts, epidemic, population);

        log.info("Running spreading engine {}", spreadingEngine.getClass().getSimpleName());
        spreadingEngine.run(new SpreadingContext(handler.variant(), population, epidemic, npi, vaccination));

        return writeOutputs(simulation, handler, paths, new CompartmentState(population, epidemic, timeAxis));
    }

    /**
     * Builds initial conditions from a seed table and writes them as an initial-condition file.
     *
     * @param config     simulation configuration; {@code simulation.init_format} selects the format
     * @param dataFolder folder containing the metapopulation table
     * @param seedsFile  seed table
     * @param outputFile target file
     * @return the written file
     */
    public Path generateInitialCondition(SimulationConfig config, Path dataFolder, Path seedsFile, Path outputFile)
            throws EpiSimException, IOException {
        IEngineHandler handler = ConfigSchemaValidator.validate(config, registry);
        ConfigSection data = config.section(SimulationConfig.DATA);
        ConfigSection populationSection = config.section(SimulationConfig.POPULATION_PARAMS);
        MetapopulationTable metapopulation = loader.loadMetapopulation(
                dataFolder.resolve(data.string("metapopulation_data_filename")),
                populationSection.stringList("G_labels"));
        PopulationParams population = PopulationParamsBuilder.build(populationSection, metapopulation, List.of());

        DenseArray counts = initialConditions.fromSeeds(config, population, seedsFile,
                handler.initialConditionShape(population.ageGroups(), population.patches()));
        ConfigSection simulation = config.section(SimulationConfig.SIMULATION);
        OutputSerializer serializer = new OutputSerializer(
                ArrayFileFormats.forOutput(simulation.optionalString("init_format").orElse(null)),
                handler.variant().id());
        if (outputFile.toAbsolutePath().getParent() != null) {
            Files.createDirectories(outputFile.toAbsolutePath().getParent());
        }
        return serializer.writeInitialCondition(outputFile, counts, population, handler.variant());
    }

    private RunSummary writeOutputs(ConfigSection simulation, IEngineHandler handler, RunPaths paths,
            CompartmentState state) throws EpiSimException, IOException {
        Path outputFolder = paths.instanceFolder()
                .resolve(simulation.optionalString("output_folder").orElse(DEFAULT_OUTPUT_FOLDER));
        Files.createDirectories(outputFolder);
        OutputSerializer serializer = new OutputSerializer(
                ArrayFileFormats.forOutput(simulation.optionalString("output_format").orElse(null)),
                handler.variant().id());

        List<Path> written = new ArrayList<>();
        List<EpiSimException> reported = new ArrayList<>();
        if (simulation.bool("save_full_output", false)) {
            written.add(serializer.writeFullDump(outputFolder, state));
        }
        if (simulation.bool("save_observables", false)) {
            written.add(serializer.writeObservables(outputFolder, state, ObservablesCalculator.compute(state)));
        }
        Optional<Integer> snapshotStep = simulation.optionalInteger("save_time_step");
        if (snapshotStep.isPresent()) {
            try {
                written.add(serializer.writeSnapshot(outputFolder, state, snapshotStep.get()));
            } catch (ExportIndexOutOfRangeException e) {
                log.error("Snapshot not written: {}", e.getMessage());
                reported.add(e);
            }
        }
        log.info("Run finished, {} file(s) written to {}", written.size(), outputFolder);
        return new RunSummary(outputFolder, written, reported);
    }

    static TimeAxis timeAxis(ConfigSection simulation) throws EpiSimException {
        var start = simulation.date("start_date");
        var end = simulation.date("end_date");
        if (end.isBefore(start)) {
            throw new InvalidParameterException("simulation.end_date " + end + " precedes start_date " + start);
        }
        return new TimeAxis(start, end);
    }
}
