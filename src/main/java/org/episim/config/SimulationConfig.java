package org.episim.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.episim.api.exceptions.ConfigSchemaException;
import org.episim.api.exceptions.InvalidParameterException;
import org.episim.api.exceptions.MissingInputFileException;
import org.episim.api.exceptions.MissingParameterException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigRenderOptions;
import com.typesafe.config.ConfigSyntax;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValueFactory;

/**
 * Immutable view of a JSON simulation configuration.
 * <p>
 * The document is parsed with Typesafe Config in strict JSON syntax. Parameter names such as
 * {@code βᴵ} or {@code κ₀s} are not valid unquoted HOCON path elements, so all lookups go through
 * {@link ConfigSection}, which quotes keys with {@link ConfigUtil#joinPath(String...)}.
 * <p>
 * Modifications return a new instance; callers that advance a simulation step by step derive
 * one configuration per step.
 */
public final class SimulationConfig {

    public static final String SIMULATION = "simulation";
    public static final String DATA = "data";
    public static final String EPIDEMIC_PARAMS = "epidemic_params";
    public static final String POPULATION_PARAMS = "population_params";
    public static final String NPI = "NPI";
    public static final String VACCINATION = "vaccination";

    private static final ConfigParseOptions JSON = ConfigParseOptions.defaults()
            .setSyntax(ConfigSyntax.JSON)
            .setAllowMissing(false);

    private final Config root;

    private SimulationConfig(Config root) {
        this.root = root;
    }

    /**
     * Parses a configuration file.
     *
     * @param file JSON document
     * @return the parsed configuration
     * @throws MissingInputFileException if the file does not exist
     * @throws ConfigSchemaException     if the file is not valid JSON
     */
    public static SimulationConfig load(Path file) throws MissingInputFileException, ConfigSchemaException {
        if (!Files.isRegularFile(file)) {
            throw new MissingInputFileException("simulation configuration", file);
        }
        try {
            return new SimulationConfig(ConfigFactory.parseFile(file.toFile(), JSON));
        } catch (ConfigException e) {
            throw new ConfigSchemaException("Malformed configuration " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a configuration from a JSON string.
     *
     * @throws ConfigSchemaException if the text is not valid JSON
     */
    public static SimulationConfig parse(String json) throws ConfigSchemaException {
        try {
            return new SimulationConfig(ConfigFactory.parseString(json, JSON));
        } catch (ConfigException e) {
            throw new ConfigSchemaException("Malformed configuration: " + e.getMessage(), e);
        }
    }

    public static SimulationConfig of(Config root) {
        return new SimulationConfig(root);
    }

    public boolean hasSection(String name) {
        return root.hasPath(ConfigUtil.joinPath(name));
    }

    /**
     * @param name top-level section name
     * @return accessor for the section
     * @throws MissingParameterException if the section is absent or not an object
     */
    public ConfigSection section(String name) throws MissingParameterException {
        String path = ConfigUtil.joinPath(name);
        if (!root.hasPath(path)) {
            throw new MissingParameterException("Missing configuration section '" + name + "'");
        }
        try {
            return new ConfigSection(name, root.getConfig(path));
        } catch (ConfigException.WrongType e) {
            throw new MissingParameterException("Configuration section '" + name + "' is not an object");
        }
    }

    public Optional<ConfigSection> optionalSection(String name) {
        String path = ConfigUtil.joinPath(name);
        if (!root.hasPath(path)) {
            return Optional.empty();
        }
        return Optional.of(new ConfigSection(name, root.getConfig(path)));
    }

    /**
     * @return the value of {@code simulation.engine}, if present
     */
    public Optional<String> engineId() {
        String path = ConfigUtil.joinPath(SIMULATION, "engine");
        return root.hasPath(path) ? Optional.of(root.getString(path)) : Optional.empty();
    }

    /**
     * Returns a copy with one parameter replaced or added.
     *
     * @param section top-level section
     * @param key     parameter name inside the section
     * @param value   a string, number, boolean, {@link List} or {@link java.util.Map}
     */
    public SimulationConfig withValue(String section, String key, Object value) {
        return new SimulationConfig(root.withValue(ConfigUtil.joinPath(section, key),
                ConfigValueFactory.fromAnyRef(value)));
    }

    /**
     * Returns a copy in which one entry of an age-group vector is replaced.
     *
     * @param section top-level section holding the vector
     * @param key     vector parameter, e.g. {@code θᵍ}
     * @param label   age group label from {@code population_params.G_labels}
     * @param value   new value for that age group
     * @throws MissingParameterException if the vector or the age labels are absent
     * @throws InvalidParameterException if the label is unknown or the parameter is not a vector of length G
     */
    public SimulationConfig withGroupValue(String section, String key, String label, double value)
            throws MissingParameterException, InvalidParameterException {
        List<String> labels = section(POPULATION_PARAMS).stringList("G_labels");
        int index = labels.indexOf(label);
        if (index < 0) {
            throw new InvalidParameterException("Unknown age group '" + label + "', expected one of " + labels);
        }
        List<Double> vector = new ArrayList<>();
        for (double element : section(section).doubleVector(key, labels.size())) {
            vector.add(element);
        }
        vector.set(index, value);
        return withValue(section, key, vector);
    }

    /**
     * @return the configuration rendered as formatted JSON
     */
    public String toJson() {
        return root.root().render(ConfigRenderOptions.concise().setJson(true).setFormatted(true));
    }

    public Config root() {
        return root;
    }
}
