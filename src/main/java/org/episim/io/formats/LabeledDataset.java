package org.episim.io.formats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.episim.api.model.DenseArray;

/**
 * Self-describing collection of named arrays sharing labelled dimensions.
 * <p>
 * This is the unit handed to an {@link IArrayFileFormat}. Every variable refers to dimensions
 * by name, and its array must have exactly the extents of those dimensions.
 */
public final class LabeledDataset {

    /**
     * @param name   dimension name, e.g. {@code G}
     * @param labels one coordinate label per index
     */
    public record Dimension(String name, List<String> labels) {
        public Dimension {
            labels = List.copyOf(labels);
        }

        public int size() {
            return labels.size();
        }
    }

    /**
     * @param name        variable name
     * @param dimensions  dimension names, outermost first
     * @param values      data, shaped by {@code dimensions}
     * @param description value of the {@code description} attribute, may be {@code null}
     */
    public record Variable(String name, List<String> dimensions, DenseArray values, String description) {
        public Variable {
            dimensions = List.copyOf(dimensions);
        }
    }

    private final Map<String, Dimension> dimensions;
    private final List<Variable> variables;
    private final Map<String, String> attributes;

    private LabeledDataset(Builder builder) {
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.dimensions));
        this.variables = List.copyOf(builder.variables);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Dimension> dimensions() {
        return List.copyOf(dimensions.values());
    }

    public Dimension dimension(String name) {
        return dimensions.get(name);
    }

    public List<Variable> variables() {
        return variables;
    }

    public Optional<Variable> variable(String name) {
        return variables.stream().filter(v -> v.name().equals(name)).findFirst();
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public static final class Builder {
        private final Map<String, Dimension> dimensions = new LinkedHashMap<>();
        private final List<Variable> variables = new ArrayList<>();
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder dimension(String name, List<String> labels) {
            if (dimensions.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate dimension: " + name);
            }
            dimensions.put(name, new Dimension(name, labels));
            return this;
        }

        public Builder variable(String name, List<String> dimensionNames, DenseArray values, String description) {
            int[] expected = new int[dimensionNames.size()];
            for (int i = 0; i < expected.length; i++) {
                Dimension dimension = dimensions.get(dimensionNames.get(i));
                if (dimension == null) {
                    throw new IllegalArgumentException("Variable " + name + " uses undeclared dimension "
                            + dimensionNames.get(i));
                }
                expected[i] = dimension.size();
            }
            if (!values.hasShape(expected)) {
                throw new IllegalArgumentException("Variable " + name + " has shape " + Arrays.toString(values.shape())
                        + " but its dimensions " + dimensionNames + " require " + Arrays.toString(expected));
            }
            variables.add(new Variable(name, dimensionNames, values, description));
            return this;
        }

        public Builder attribute(String name, String value) {
            attributes.put(name, value);
            return this;
        }

        public LabeledDataset build() {
            return new LabeledDataset(this);
        }
    }
}
