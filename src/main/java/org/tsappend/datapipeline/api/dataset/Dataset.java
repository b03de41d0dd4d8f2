package org.tsappend.datapipeline.api.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * An in-memory collection of labeled N-dimensional arrays sharing named dimensions.
 * <p>
 * A dataset holds {@link Variable}s (in declaration order) and {@link Coordinate}s. Every
 * dimension has one dataset-wide length; the builder rejects any variable or coordinate whose
 * length along a dimension disagrees with what was declared before it.
 * <p>
 * All operations return new instances. Array storage is shared between a dataset and the
 * datasets derived from it only where nothing changed, which is safe because no variable or
 * coordinate exposes its backing array.
 * <p>
 * <strong>Thread Safety:</strong> Immutable, safe to share.
 */
public final class Dataset {

    private final Map<String, Variable> variables;
    private final Map<String, Coordinate> coordinates;
    private final Map<String, Integer> sizes;

    private Dataset(Map<String, Variable> variables, Map<String, Coordinate> coordinates,
                    Map<String, Integer> sizes) {
        this.variables = Collections.unmodifiableMap(variables);
        this.coordinates = Collections.unmodifiableMap(coordinates);
        this.sizes = Collections.unmodifiableMap(sizes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return variable names in declaration order
     */
    public List<String> getVariableNames() {
        return List.copyOf(variables.keySet());
    }

    public List<Variable> getVariables() {
        return List.copyOf(variables.values());
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException if no such variable exists
     */
    public Variable getVariable(String name) {
        Variable variable = variables.get(name);
        if (variable == null) {
            throw new IllegalArgumentException("No variable '" + name + "' in dataset " + getVariableNames());
        }
        return variable;
    }

    public List<Coordinate> getCoordinates() {
        return List.copyOf(coordinates.values());
    }

    /**
     * @throws IllegalArgumentException if no such coordinate exists
     */
    public Coordinate getCoordinate(String name) {
        Coordinate coordinate = coordinates.get(name);
        if (coordinate == null) {
            throw new IllegalArgumentException("No coordinate '" + name + "' in dataset " + coordinates.keySet());
        }
        return coordinate;
    }

    /**
     * @return length of every dimension, in first-declared order
     */
    public Map<String, Integer> getSizes() {
        return sizes;
    }

    /**
     * @return the length of {@code dimension}, or 0 if no variable or coordinate spans it
     */
    public int sizeOf(String dimension) {
        return sizes.getOrDefault(dimension, 0);
    }

    /**
     * Keeps only the named variables, in the given order, together with the coordinates whose
     * dimensions they all still use.
     *
     * @param names variables to keep
     * @return the subset
     * @throws SelectionException if any name is not a variable of this dataset
     */
    public Dataset select(List<String> names) {
        List<String> missing = names.stream().filter(n -> !variables.containsKey(n)).toList();
        if (!missing.isEmpty()) {
            throw new SelectionException("Variables " + missing + " not found; available: " + getVariableNames());
        }
        Builder builder = builder();
        Set<String> usedDimensions = new HashSet<>();
        for (String name : names) {
            Variable variable = variables.get(name);
            usedDimensions.addAll(variable.getDimensions());
        }
        for (Coordinate coordinate : coordinates.values()) {
            if (usedDimensions.containsAll(coordinate.getDimensions())) {
                builder.coordinate(coordinate);
            }
        }
        names.stream().distinct().forEach(n -> builder.variable(variables.get(n)));
        return builder.build();
    }

    /**
     * Picks positions along {@code dimension} in the given order (positions may repeat).
     *
     * @param dimension dimension to index
     * @param indices   positions to keep
     * @return the re-indexed dataset
     */
    public Dataset take(String dimension, int[] indices) {
        int length = sizeOf(dimension);
        for (int index : indices) {
            if (index < 0 || index >= length) {
                throw new IndexOutOfBoundsException("Index " + index + " out of bounds for dimension '"
                        + dimension + "' of length " + length);
            }
        }
        Builder builder = builder();
        coordinates.values().forEach(c -> builder.coordinate(c.take(dimension, indices)));
        variables.values().forEach(v -> builder.variable(v.take(dimension, indices)));
        return builder.build();
    }

    /**
     * Keeps positions {@code [from, to)} along {@code dimension}.
     */
    public Dataset slice(String dimension, int from, int to) {
        if (from < 0 || to < from || to > sizeOf(dimension)) {
            throw new IndexOutOfBoundsException("Slice [" + from + ", " + to + ") out of bounds for dimension '"
                    + dimension + "' of length " + sizeOf(dimension));
        }
        int[] indices = new int[to - from];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = from + i;
        }
        return take(dimension, indices);
    }

    /**
     * Appends {@code other} after this dataset along {@code dimension}.
     * <p>
     * Both datasets must hold the same variables and coordinates. Variables and coordinates
     * spanning {@code dimension} are concatenated; coordinates not spanning it must be equal.
     * The result keeps this dataset's declaration order and storage metadata.
     *
     * @throws AxisMismatchException if the datasets disagree on variables, coordinates, or any
     *                               dimension other than {@code dimension}
     */
    public Dataset concat(Dataset other, String dimension) {
        if (!variables.keySet().equals(other.variables.keySet())) {
            throw new AxisMismatchException("Variable sets differ: " + getVariableNames()
                    + " vs " + other.getVariableNames());
        }
        if (!coordinates.keySet().equals(other.coordinates.keySet())) {
            throw new AxisMismatchException("Coordinate sets differ: " + coordinates.keySet()
                    + " vs " + other.coordinates.keySet());
        }
        for (Map.Entry<String, Integer> entry : sizes.entrySet()) {
            String dim = entry.getKey();
            if (!dim.equals(dimension) && other.sizes.containsKey(dim)
                    && !entry.getValue().equals(other.sizes.get(dim))) {
                throw new AxisMismatchException("Dimension '" + dim + "' has length " + entry.getValue()
                        + " vs " + other.sizes.get(dim));
            }
        }
        Builder builder = builder();
        for (Coordinate coordinate : coordinates.values()) {
            Coordinate otherCoordinate = other.coordinates.get(coordinate.getName());
            if (coordinate.spans(dimension)) {
                builder.coordinate(coordinate.concat(otherCoordinate, dimension));
            } else if (coordinate.equals(otherCoordinate)) {
                builder.coordinate(coordinate);
            } else {
                throw new AxisMismatchException("Coordinate '" + coordinate.getName()
                        + "' does not span '" + dimension + "' and differs between datasets");
            }
        }
        for (Variable variable : variables.values()) {
            builder.variable(variable.concat(other.variables.get(variable.getName()), dimension));
        }
        return builder.build();
    }

    /**
     * Replaces every variable by {@code mapper(variable)}; coordinates are kept.
     */
    public Dataset mapVariables(UnaryOperator<Variable> mapper) {
        Builder builder = builder();
        coordinates.values().forEach(builder::coordinate);
        variables.values().forEach(v -> builder.variable(mapper.apply(v)));
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dataset that)) {
            return false;
        }
        return variables.equals(that.variables) && coordinates.equals(that.coordinates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variables, coordinates);
    }

    @Override
    public String toString() {
        String dims = sizes.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", ", "(", ")"));
        return "Dataset{dimensions=" + dims
                + ", coordinates=" + coordinates.keySet()
                + ", variables=" + variables.values() + "}";
    }

    /**
     * Assembles a {@link Dataset}, validating dimension lengths as parts are added.
     */
    public static final class Builder {

        private final Map<String, Variable> variables = new LinkedHashMap<>();
        private final Map<String, Coordinate> coordinates = new LinkedHashMap<>();
        private final Map<String, Integer> sizes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder coordinate(Coordinate coordinate) {
            if (coordinates.containsKey(coordinate.getName())) {
                throw new IllegalArgumentException("Duplicate coordinate '" + coordinate.getName() + "'");
            }
            declare(coordinate.getName(), coordinate.getDimensions(), coordinate.getShape());
            coordinates.put(coordinate.getName(), coordinate);
            return this;
        }

        public Builder variable(Variable variable) {
            if (variables.containsKey(variable.getName())) {
                throw new IllegalArgumentException("Duplicate variable '" + variable.getName() + "'");
            }
            declare(variable.getName(), variable.getDimensions(), variable.getShape());
            variables.put(variable.getName(), variable);
            return this;
        }

        private void declare(String owner, List<String> dimensions, int[] shape) {
            List<String> conflicts = new ArrayList<>();
            for (int i = 0; i < shape.length; i++) {
                Integer known = sizes.get(dimensions.get(i));
                if (known != null && known != shape[i]) {
                    conflicts.add(dimensions.get(i) + "=" + shape[i] + " (expected " + known + ")");
                }
            }
            if (!conflicts.isEmpty()) {
                throw new AxisMismatchException("'" + owner + "' disagrees on dimension lengths: " + conflicts);
            }
            for (int i = 0; i < shape.length; i++) {
                sizes.putIfAbsent(dimensions.get(i), shape[i]);
            }
        }

        public Dataset build() {
            return new Dataset(new LinkedHashMap<>(variables), new LinkedHashMap<>(coordinates),
                    new LinkedHashMap<>(sizes));
        }
    }
}
