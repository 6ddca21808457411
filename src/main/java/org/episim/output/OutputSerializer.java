package org.episim.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.episim.api.exceptions.ExportIndexOutOfRangeException;
import org.episim.api.model.Compartment;
import org.episim.api.model.CompartmentLayout;
import org.episim.api.model.DenseArray;
import org.episim.api.model.PopulationParams;
import org.episim.engine.EngineVariant;
import org.episim.io.formats.IArrayFileFormat;
import org.episim.io.formats.LabeledDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the results of a run into an output folder in one {@link IArrayFileFormat}.
 * <p>
 * Output files:
 * <ul>
 *   <li>{@code compartments_full.<ext>}: every compartment over the whole horizon, dims {@code (G, M, T, [V])}</li>
 *   <li>{@code compartments_t_<date>.<ext>}: variable {@code data} for one step, dims {@code (G, M, [V,] epi_states)}</li>
 *   <li>{@code observables.<ext>}: new infections, hospitalizations and deaths, dims {@code (G, M, T)}</li>
 * </ul>
 * Existing files are deleted before they are rewritten.
 */
public class OutputSerializer {

    private static final Logger log = LoggerFactory.getLogger(OutputSerializer.class);

    public static final String DIM_AGE = "G";
    public static final String DIM_PATCH = "M";
    public static final String DIM_TIME = "T";
    public static final String DIM_VACCINATION = "V";
    public static final String DIM_COMPARTMENT = "epi_states";
    public static final String SNAPSHOT_VARIABLE = "data";

    private final IArrayFileFormat format;
    private final String engineId;

    /**
     * @param format   container format of all files
     * @param engineId recorded as a global attribute
     */
    public OutputSerializer(IArrayFileFormat format, String engineId) {
        this.format = format;
        this.engineId = engineId;
    }

    public IArrayFileFormat format() {
        return format;
    }

    public Path writeFullDump(Path outputDir, CompartmentState state) throws IOException {
        LabeledDataset.Builder dataset = baseDataset(state, true);
        List<String> dims = new ArrayList<>(List.of(DIM_AGE, DIM_PATCH, DIM_TIME));
        if (state.layout().hasVaccinationAxis()) {
            dims.add(DIM_VACCINATION);
        }
        for (Compartment compartment : Compartment.all()) {
            dataset.variable(compartment.name(), dims, state.counts(compartment), compartment.description());
        }
        return write(outputDir.resolve("compartments_full." + format.extension()), dataset.build());
    }

    /**
     * @param step 1-based time step
     * @throws ExportIndexOutOfRangeException if {@code step} is outside the horizon; nothing is written
     */
    public Path writeSnapshot(Path outputDir, CompartmentState state, int step)
            throws ExportIndexOutOfRangeException, IOException {
        LabeledDataset.Builder dataset = baseDataset(state, false);
        dataset.dimension(DIM_COMPARTMENT, Compartment.labels());
        List<String> dims = new ArrayList<>(List.of(DIM_AGE, DIM_PATCH));
        if (state.layout().hasVaccinationAxis()) {
            dims.add(DIM_VACCINATION);
        }
        dims.add(DIM_COMPARTMENT);
        String date = state.timeAxis().dateAt(step).toString();
        dataset.variable(SNAPSHOT_VARIABLE, dims, state.snapshot(step), "Compartment counts on " + date);
        dataset.attribute("date", date);
        return write(outputDir.resolve("compartments_t_" + date + "." + format.extension()), dataset.build());
    }

    public Path writeObservables(Path outputDir, CompartmentState state, Observables observables)
            throws IOException {
        LabeledDataset.Builder dataset = LabeledDataset.builder()
                .dimension(DIM_AGE, state.population().ageLabels())
                .dimension(DIM_PATCH, state.population().patchIds())
                .dimension(DIM_TIME, state.timeAxis().labels())
                .attribute("engine", engineId);
        List<String> dims = List.of(DIM_AGE, DIM_PATCH, DIM_TIME);
        dataset.variable(Observables.NEW_INFECTED, dims, observables.newInfected(), "Daily new symptomatic infections");
        dataset.variable(Observables.NEW_HOSPITALIZED, dims, observables.newHospitalized(), "Daily new hospitalizations");
        dataset.variable(Observables.NEW_DEATHS, dims, observables.newDeaths(), "Daily new deaths");
        return write(outputDir.resolve("observables." + format.extension()), dataset.build());
    }

    /**
     * Writes initial counts as variable {@code data} with dims {@code (G, M, [V,] epi_states)}.
     *
     * @param file       target file
     * @param counts     counts shaped by the engine variant
     * @param population provides age and patch labels
     * @param variant    determines the vaccination axis and the compartment labels
     */
    public Path writeInitialCondition(Path file, DenseArray counts, PopulationParams population,
            EngineVariant variant) throws IOException {
        LabeledDataset.Builder dataset = LabeledDataset.builder()
                .dimension(DIM_AGE, population.ageLabels())
                .dimension(DIM_PATCH, population.patchIds());
        List<String> dims = new ArrayList<>(List.of(DIM_AGE, DIM_PATCH));
        if (variant.hasVaccinationAxis()) {
            dataset.dimension(DIM_VACCINATION, variant.vaccinationLabels());
            dims.add(DIM_VACCINATION);
        }
        List<String> compartments = Compartment.firstN(variant.compartmentCount()).stream().map(Enum::name).toList();
        dataset.dimension(DIM_COMPARTMENT, compartments);
        dims.add(DIM_COMPARTMENT);
        dataset.variable(SNAPSHOT_VARIABLE, dims, counts, "Initial compartment counts")
                .attribute("engine", engineId);
        return write(file, dataset.build());
    }

    private LabeledDataset.Builder baseDataset(CompartmentState state, boolean withTime) {
        CompartmentLayout layout = state.layout();
        LabeledDataset.Builder dataset = LabeledDataset.builder()
                .dimension(DIM_AGE, state.population().ageLabels())
                .dimension(DIM_PATCH, state.population().patchIds());
        if (withTime) {
            dataset.dimension(DIM_TIME, state.timeAxis().labels());
        }
        if (layout.hasVaccinationAxis()) {
            dataset.dimension(DIM_VACCINATION, layout.vaccinationLabels());
        }
        return dataset.attribute("engine", engineId);
    }

    private Path write(Path file, LabeledDataset dataset) throws IOException {
        Files.deleteIfExists(file);
        format.write(file, dataset);
        log.info("Wrote {}", file);
        return file;
    }
}
