package org.episim.initial;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.episim.api.exceptions.EpiSimException;
import org.episim.api.exceptions.InitialConditionShapeException;
import org.episim.api.exceptions.MissingInputFileException;
import org.episim.api.model.Compartment;
import org.episim.api.model.CompartmentLayout;
import org.episim.api.model.DenseArray;
import org.episim.api.model.EpidemicParams;
import org.episim.api.model.PopulationParams;
import org.episim.config.ConfigSection;
import org.episim.config.SimulationConfig;
import org.episim.engine.IEngineHandler;
import org.episim.io.TabularDataLoader;
import org.episim.io.formats.ArrayFileFormats;
import org.episim.io.formats.IArrayFileFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the initial compartment state of a run and writes it into step 0 of the densities.
 * <p>
 * Sources, in order of precedence:
 * <ol>
 *   <li>an explicit initial-condition file (command line)</li>
 *   <li>{@code data.initial_condition_filename}, if the file exists in the data folder</li>
 *   <li>{@code data.seeds_filename}, synthesized by {@link SeedInitialConditionBuilder}</li>
 * </ol>
 * Initial-condition files hold a variable {@code data} of shape {@code (G, M, [V,] C)} with
 * absolute counts.
 */
public class InitialConditionResolver {

    private static final Logger log = LoggerFactory.getLogger(InitialConditionResolver.class);

    public static final String DATA_VARIABLE = "data";

    private final TabularDataLoader loader;
    private final double[] defaultAgeFractions;

    /**
     * @param loader              loader used for seed tables
     * @param defaultAgeFractions seed split used when {@code simulation.seed_age_fractions} is absent
     */
    public InitialConditionResolver(TabularDataLoader loader, double[] defaultAgeFractions) {
        this.loader = loader;
        this.defaultAgeFractions = defaultAgeFractions.clone();
    }

    /**
     * Resolves initial counts for a run.
     *
     * @param config       simulation configuration
     * @param handler      handler of the configured engine variant
     * @param population   population structure
     * @param dataFolder   folder that relative data file names are resolved against
     * @param explicitFile initial-condition file given on the command line, or {@code null}
     * @return counts of shape {@code handler.initialConditionShape(G, M)}
     * @throws MissingInputFileException       if no source is available
     * @throws InitialConditionShapeException if a file has the wrong shape
     * @throws IOException                     if a file cannot be read
     */
    public DenseArray resolve(SimulationConfig config, IEngineHandler handler, PopulationParams population,
            Path dataFolder, Path explicitFile) throws EpiSimException, IOException {
        int[] expectedShape = handler.initialConditionShape(population.ageGroups(), population.patches());
        ConfigSection data = config.section(SimulationConfig.DATA);
        ConfigSection simulation = config.section(SimulationConfig.SIMULATION);
        IArrayFileFormat format = ArrayFileFormats.forInput(simulation.optionalString("init_format").orElse(null));

        if (explicitFile != null) {
            return readFile(format, explicitFile, expectedShape);
        }

        Optional<Path> configured = data.optionalString("initial_condition_filename").map(dataFolder::resolve);
        if (configured.isPresent() && Files.isRegularFile(configured.get())) {
            return readFile(format, configured.get(), expectedShape);
        }

        Optional<String> seedsFile = data.optionalString("seeds_filename");
        if (seedsFile.isPresent()) {
            Path seeds = dataFolder.resolve(seedsFile.get());
            log.info("Building initial conditions from seeds in {}", seeds);
            return fromSeeds(config, population, seeds, expectedShape);
        }

        if (configured.isPresent()) {
            throw new MissingInputFileException("initial condition file", configured.get());
        }
        throw new MissingInputFileException("No initial condition available: set data.initial_condition_filename, "
                + "data.seeds_filename or pass an initial condition file");
    }

    /**
     * Builds initial counts from a seed table, using {@code simulation.seed_age_fractions} when present.
     */
    public DenseArray fromSeeds(SimulationConfig config, PopulationParams population, Path seedsFile,
            int[] shape) throws EpiSimException, IOException {
        SeedInitialConditionBuilder builder = new SeedInitialConditionBuilder(ageFractions(config, population));
        return builder.build(shape, population, loader.loadSeeds(seedsFile));
    }

    /**
     * Converts counts into densities at step 0 of every compartment carried by {@code counts}.
     * Cells with zero population get density 0.
     *
     * @param counts     initial counts {@code (G, M, [V,] C)}
     * @param params     epidemic parameters whose densities are filled
     * @param population population used as denominator
     */
    public static void applyCounts(DenseArray counts, EpidemicParams params, PopulationParams population) {
        CompartmentLayout layout = params.layout();
        int compartmentAxis = counts.rank() - 1;
        List<Compartment> carried = Compartment.firstN(counts.dim(compartmentAxis));
        for (Compartment compartment : carried) {
            double[] density = params.density(compartment).data();
            for (int g = 0; g < layout.ageGroups(); g++) {
                for (int m = 0; m < layout.patches(); m++) {
                    double n = population.count(g, m);
                    for (int v = 0; v < layout.vaccinationStates(); v++) {
                        double count = layout.hasVaccinationAxis()
                                ? counts.get(g, m, v, compartment.ordinal())
                                : counts.get(g, m, compartment.ordinal());
                        double value = count / n;
                        density[layout.densityOffset(g, m, 0, v)] = Double.isFinite(value) ? value : 0.0;
                    }
                }
            }
        }
    }

    private DenseArray readFile(IArrayFileFormat format, Path file, int[] expectedShape)
            throws MissingInputFileException, InitialConditionShapeException, IOException {
        if (!Files.isRegularFile(file)) {
            throw new MissingInputFileException("initial condition file", file);
        }
        log.info("Loading initial conditions from {} ({})", file, format.name());
        DenseArray counts = format.read(file, DATA_VARIABLE);
        if (!counts.hasShape(expectedShape)) {
            throw new InitialConditionShapeException(expectedShape, counts.shape());
        }
        return counts;
    }

    private double[] ageFractions(SimulationConfig config, PopulationParams population) throws EpiSimException {
        ConfigSection simulation = config.section(SimulationConfig.SIMULATION);
        if (simulation.has("seed_age_fractions")) {
            return simulation.doubleVector("seed_age_fractions", population.ageGroups());
        }
        return defaultAgeFractions;
    }
}
