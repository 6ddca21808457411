package org.episim.config;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.episim.api.exceptions.InvalidParameterException;
import org.episim.api.exceptions.MissingParameterException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

/**
 * Typed access to one top-level section of a {@link SimulationConfig}.
 * <p>
 * Absent keys raise {@link MissingParameterException}; values of the wrong type or length raise
 * {@link InvalidParameterException}. Both name the section and key.
 */
public final class ConfigSection {

    private final String name;
    private final Config config;

    ConfigSection(String name, Config config) {
        this.name = name;
        this.config = config;
    }

    public String name() {
        return name;
    }

    public boolean has(String key) {
        return config.hasPath(path(key));
    }

    public String string(String key) throws MissingParameterException, InvalidParameterException {
        require(key);
        try {
            return config.getString(path(key));
        } catch (ConfigException e) {
            throw invalid(key, "a string", e);
        }
    }

    public Optional<String> optionalString(String key) throws InvalidParameterException {
        if (!has(key)) {
            return Optional.empty();
        }
        try {
            return Optional.of(config.getString(path(key)));
        } catch (ConfigException e) {
            throw invalid(key, "a string", e);
        }
    }

    public double number(String key) throws MissingParameterException, InvalidParameterException {
        require(key);
        return readDouble(key);
    }

    public Optional<Double> optionalNumber(String key) throws InvalidParameterException {
        return has(key) ? Optional.of(readDouble(key)) : Optional.empty();
    }

    public int integer(String key) throws MissingParameterException, InvalidParameterException {
        require(key);
        return readInt(key);
    }

    public Optional<Integer> optionalInteger(String key) throws InvalidParameterException {
        return has(key) ? Optional.of(readInt(key)) : Optional.empty();
    }

    public boolean bool(String key, boolean defaultValue) throws InvalidParameterException {
        if (!has(key)) {
            return defaultValue;
        }
        try {
            return config.getBoolean(path(key));
        } catch (ConfigException e) {
            throw invalid(key, "a boolean", e);
        }
    }

    public LocalDate date(String key) throws MissingParameterException, InvalidParameterException {
        String text = string(key);
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new InvalidParameterException("Parameter '" + key + "' in section '" + name
                    + "' is not an ISO date (yyyy-MM-dd): " + text, e);
        }
    }

    public List<String> stringList(String key) throws MissingParameterException, InvalidParameterException {
        require(key);
        try {
            return List.copyOf(config.getStringList(path(key)));
        } catch (ConfigException e) {
            throw invalid(key, "a list of strings", e);
        }
    }

    /**
     * Reads a numeric vector.
     *
     * @param key            parameter name
     * @param expectedLength required length, or {@code -1} for any length
     */
    public double[] doubleVector(String key, int expectedLength)
            throws MissingParameterException, InvalidParameterException {
        require(key);
        List<Double> values;
        try {
            values = config.getDoubleList(path(key));
        } catch (ConfigException e) {
            throw invalid(key, "a list of numbers", e);
        }
        if (expectedLength >= 0 && values.size() != expectedLength) {
            throw new InvalidParameterException("Parameter '" + key + "' in section '" + name + "' has "
                    + values.size() + " entries, expected " + expectedLength);
        }
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }

    public int[] intVector(String key) throws MissingParameterException, InvalidParameterException {
        require(key);
        try {
            return config.getIntList(path(key)).stream().mapToInt(Integer::intValue).toArray();
        } catch (ConfigException e) {
            throw invalid(key, "a list of integers", e);
        }
    }

    /**
     * Reads a rectangular numeric matrix given as a list of rows.
     */
    public double[][] doubleMatrix(String key, int rows, int columns)
            throws MissingParameterException, InvalidParameterException {
        require(key);
        ConfigList outer;
        try {
            outer = config.getList(path(key));
        } catch (ConfigException e) {
            throw invalid(key, "a list of rows", e);
        }
        if (outer.size() != rows) {
            throw new InvalidParameterException("Parameter '" + key + "' in section '" + name + "' has "
                    + outer.size() + " rows, expected " + rows);
        }
        double[][] matrix = new double[rows][];
        for (int r = 0; r < rows; r++) {
            ConfigValue row = outer.get(r);
            if (row.valueType() != ConfigValueType.LIST || ((ConfigList) row).size() != columns) {
                throw new InvalidParameterException("Row " + r + " of parameter '" + key + "' in section '"
                        + name + "' must be a list of " + columns + " numbers");
            }
            matrix[r] = new double[columns];
            for (int c = 0; c < columns; c++) {
                Object cell = ((ConfigList) row).get(c).unwrapped();
                if (!(cell instanceof Number number)) {
                    throw new InvalidParameterException("Entry (" + r + ", " + c + ") of parameter '" + key
                            + "' in section '" + name + "' is not a number: " + cell);
                }
                matrix[r][c] = number.doubleValue();
            }
        }
        return matrix;
    }

    /**
     * @return the key names present in this section
     */
    public List<String> keys() {
        return new ArrayList<>(config.root().keySet());
    }

    private double readDouble(String key) throws InvalidParameterException {
        try {
            return config.getDouble(path(key));
        } catch (ConfigException e) {
            throw invalid(key, "a number", e);
        }
    }

    private int readInt(String key) throws InvalidParameterException {
        try {
            return config.getInt(path(key));
        } catch (ConfigException e) {
            throw invalid(key, "an integer", e);
        }
    }

    private void require(String key) throws MissingParameterException {
        if (!has(key)) {
            throw new MissingParameterException(name, key);
        }
    }

    private InvalidParameterException invalid(String key, String expected, ConfigException cause) {
        return new InvalidParameterException("Parameter '" + key + "' in section '" + name + "' must be "
                + expected, cause);
    }

    private static String path(String key) {
        return ConfigUtil.joinPath(key);
    }
}
