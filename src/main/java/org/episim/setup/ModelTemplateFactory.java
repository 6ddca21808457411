package org.episim.setup;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.episim.config.SimulationConfig;
import org.episim.engine.EngineVariant;
import org.episim.initial.SeedInitialConditionBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Creates a ready-to-edit model folder: a configuration template and placeholder data files.
 * <p>
 * Layout of a model folder:
 * <pre>
 *   &lt;name&gt;/config.json
 *   &lt;name&gt;/data/metapopulation_data.csv
 *   &lt;name&gt;/data/R_mobility_matrix.csv
 *   &lt;name&gt;/data/seeds.csv
 * </pre>
 * The template runs as is: every patch holds {@value #PLACEHOLDER_POPULATION} individuals per age
 * group and the first patch is seeded with {@value #PLACEHOLDER_SEEDS} infections.
 */
public class ModelTemplateFactory {

    private static final Logger log = LoggerFactory.getLogger(ModelTemplateFactory.class);

    public static final String CONFIG_FILE = "config.json";
    public static final String DATA_FOLDER = "data";
    public static final String METAPOPULATION_FILE = "metapopulation_data.csv";
    public static final String MOBILITY_FILE = "R_mobility_matrix.csv";
    public static final String SEEDS_FILE = "seeds.csv";
    public static final String INITIAL_CONDITION_FILE = "initial_conditions.nc";

    static final int PLACEHOLDER_POPULATION = 1000;
    static final int PLACEHOLDER_SEEDS = 10;

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    /**
     * Builds the configuration template for a variant.
     *
     * @param variant   engine variant
     * @param ageGroups number of age strata G, labelled {@code G1..Gn}
     * @return the configuration document
     */
    public JsonObject createConfig(EngineVariant variant, int ageGroups) {
        if (ageGroups < 1) {
            throw new IllegalArgumentException("Need at least one age group: " + ageGroups);
        }
        JsonObject config = new JsonObject();
        config.add(SimulationConfig.SIMULATION, simulationSection(variant, ageGroups));
        config.add(SimulationConfig.DATA, dataSection());
        config.add(SimulationConfig.EPIDEMIC_PARAMS, epidemicSection(variant, ageGroups));
        config.add(SimulationConfig.POPULATION_PARAMS, populationSection(ageGroups));
        if (variant.hasVaccinationAxis()) {
            config.add(SimulationConfig.VACCINATION, vaccinationSection(ageGroups));
        }
        config.add(SimulationConfig.NPI, npiSection());
        return config;
    }

    /**
     * Writes a complete model folder.
     *
     * @param modelFolder target folder, created if missing
     * @param variant     engine variant
     * @param patches     number of patches M
     * @param ageGroups   number of age groups G
     * @return path of the written configuration
     * @throws IOException if a file cannot be written
     */
    public Path writeModel(Path modelFolder, EngineVariant variant, int patches, int ageGroups) throws IOException {
        if (patches < 1) {
            throw new IllegalArgumentException("Need at least one patch: " + patches);
        }
        Path dataFolder = modelFolder.resolve(DATA_FOLDER);
        Files.createDirectories(dataFolder);

        Path configFile = modelFolder.resolve(CONFIG_FILE);
        Files.writeString(configFile, gson.toJson(createConfig(variant, ageGroups)) + System.lineSeparator(),
                StandardCharsets.UTF_8);
        Files.write(dataFolder.resolve(METAPOPULATION_FILE), metapopulationRows(patches, ageGroups),
                StandardCharsets.UTF_8);
        Files.write(dataFolder.resolve(MOBILITY_FILE), mobilityRows(patches), StandardCharsets.UTF_8);
        Files.write(dataFolder.resolve(SEEDS_FILE), List.of("idx,seed", "1," + PLACEHOLDER_SEEDS),
                StandardCharsets.UTF_8);
        log.info("Created {} model with G={}, M={} in {}", variant.id(), ageGroups, patches, modelFolder);
        return configFile;
    }

    static List<String> ageLabels(int ageGroups) {
        List<String> labels = new ArrayList<>(ageGroups);
        for (int g = 1; g <= ageGroups; g++) {
            labels.add("G" + g);
        }
        return labels;
    }

    private JsonObject simulationSection(EngineVariant variant, int ageGroups) {
        JsonObject simulation = new JsonObject();
        simulation.addProperty("engine", variant.id());
        simulation.addProperty("start_date", "2020-02-09");
        simulation.addProperty("end_date", "2020-03-09");
        simulation.addProperty("save_full_output", true);
        simulation.addProperty("save_observables", true);
        simulation.addProperty("output_folder", "output");
        simulation.addProperty("output_format", "netcdf");
        simulation.addProperty("init_format", "netcdf");
        if (ageGroups != SeedInitialConditionBuilder.DEFAULT_AGE_FRACTIONS.length) {
            simulation.add("seed_age_fractions", constant(ageGroups, 1.0 / ageGroups));
        }
        return simulation;
    }

    private JsonObject dataSection() {
        JsonObject data = new JsonObject();
        data.addProperty("initial_condition_filename", INITIAL_CONDITION_FILE);
        data.addProperty("metapopulation_data_filename", METAPOPULATION_FILE);
        data.addProperty("mobility_matrix_filename", MOBILITY_FILE);
        data.addProperty("seeds_filename", SEEDS_FILE);
        return data;
    }

    private JsonObject epidemicSection(EngineVariant variant, int ageGroups) {
        JsonObject epidemic = new JsonObject();
        epidemic.addProperty("scale_β", 0.5);
        epidemic.addProperty("βᴬ", 0.05);
        epidemic.addProperty("βᴵ", 0.09);
        epidemic.add("ηᵍ", constant(ageGroups, 0.275));
        epidemic.add("αᵍ", constant(ageGroups, 0.65));
        epidemic.add("μᵍ", constant(ageGroups, 0.3));
        epidemic.add("θᵍ", constant(ageGroups, 0.0));
        epidemic.add("γᵍ", constant(ageGroups, 0.03));
        epidemic.add("ζᵍ", constant(ageGroups, 0.12));
        epidemic.add("λᵍ", constant(ageGroups, 0.275));
        epidemic.add("ωᵍ", constant(ageGroups, 0.1));
        epidemic.add("ψᵍ", constant(ageGroups, 0.14));
        epidemic.add("χᵍ", constant(ageGroups, 0.047));
        if (variant.hasVaccinationAxis()) {
            epidemic.add("rᵥ", array(0.0, 0.6, 0.0));
            epidemic.add("kᵥ", array(0.0, 0.4, 0.0));
            epidemic.addProperty("Λ", 0.02);
            epidemic.addProperty("Γ", 0.01);
            epidemic.addProperty("risk_reduction_dd", 0.0);
            epidemic.addProperty("risk_reduction_h", 0.1);
            epidemic.addProperty("risk_reduction_d", 0.05);
        }
        return epidemic;
    }

    private JsonObject populationSection(int ageGroups) {
        JsonObject population = new JsonObject();
        JsonArray labels = new JsonArray();
        ageLabels(ageGroups).forEach(labels::add);
        population.add("G_labels", labels);
        JsonArray contacts = new JsonArray();
        for (int g = 0; g < ageGroups; g++) {
            contacts.add(constant(ageGroups, 1.0 / ageGroups));
        }
        population.add("C", contacts);
        population.add("kᵍ", constant(ageGroups, 10.0));
        population.add("kᵍ_h", constant(ageGroups, 3.0));
        population.add("kᵍ_w", constant(ageGroups, 1.0));
        population.add("pᵍ", constant(ageGroups, 1.0));
        population.addProperty("ξ", 0.01);
        population.addProperty("σ", 2.5);
        return population;
    }

    private JsonObject vaccinationSection(int ageGroups) {
        JsonObject vaccination = new JsonObject();
        vaccination.add("ϵᵍ", constant(ageGroups, 1.0 / ageGroups));
        vaccination.addProperty("percentage_of_vacc_per_day", 0.005);
        vaccination.addProperty("start_vacc", 2);
        vaccination.addProperty("dur_vacc", 8);
        vaccination.addProperty("are_there_vaccines", false);
        return vaccination;
    }

    private JsonObject npiSection() {
        JsonObject npi = new JsonObject();
        npi.add("κ₀s", array(0.0));
        npi.add("ϕs", array(1.0));
        npi.add("δs", array(0.0));
        JsonArray steps = new JsonArray();
        steps.add(1);
        npi.add("tᶜs", steps);
        npi.addProperty("are_there_npi", true);
        return npi;
    }

    private static List<String> metapopulationRows(int patches, int ageGroups) {
        List<String> rows = new ArrayList<>(patches + 1);
        rows.add("id,area," + String.join(",", ageLabels(ageGroups)) + ",total");
        for (int m = 1; m <= patches; m++) {
            StringBuilder row = new StringBuilder().append(m).append(",1.0");
            for (int g = 0; g < ageGroups; g++) {
                row.append(',').append(PLACEHOLDER_POPULATION);
            }
            rows.add(row.append(',').append(PLACEHOLDER_POPULATION * ageGroups).toString());
        }
        return rows;
    }

    private static List<String> mobilityRows(int patches) {
        List<String> rows = new ArrayList<>(patches + 1);
        rows.add("source_idx,target_idx,ratio");
        for (int m = 1; m <= patches; m++) {
            rows.add(m + "," + m + ",1.0");
        }
        return rows;
    }

    private static JsonArray constant(int length, double value) {
        JsonArray array = new JsonArray();
        for (int i = 0; i < length; i++) {
            array.add(value);
        }
        return array;
    }

    private static JsonArray array(double... values) {
        JsonArray array = new JsonArray();
        for (double value : values) {
            array.add(value);
        }
        return array;
    }
}
