package org.tsappend.datapipeline.api.dataset;

import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Labels positions along one or more dimensions of a {@link Dataset}.
 * <p>
 * A coordinate is either <em>ordinal</em> (signed 64-bit values, each step worth one
 * {@link #getUnit() unit}, e.g. nanoseconds since the epoch) or <em>numeric</em>
 * ({@code double} values such as latitudes). Only ordinal coordinates can serve as the
 * ordering coordinate: sorting, deduplication and windowing compare the exact {@code long}
 * values, never a floating approximation.
 * <p>
 * Values are stored row-major over {@link #getDimensions()}. Instances are immutable.
 */
public final class Coordinate {

    private final String name;
    private final List<String> dimensions;
    private final int[] shape;
    private final long[] ordinals;
    private final double[] values;
    private final ChronoUnit unit;

    private Coordinate(String name, List<String> dimensions, int[] shape,
                       long[] ordinals, double[] values, ChronoUnit unit) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Coordinate name cannot be null or blank");
        }
        if (dimensions.size() != shape.length) {
            throw new IllegalArgumentException("Coordinate '" + name + "' has " + dimensions.size()
                    + " dimensions but shape of rank " + shape.length);
        }
        int expected = Shapes.size(shape);
        int actual = ordinals != null ? ordinals.length : values.length;
        if (expected != actual) {
            throw new IllegalArgumentException("Coordinate '" + name + "' shape " + Arrays.toString(shape)
                    + " requires " + expected + " values, got " + actual);
        }
        this.name = name;
        this.dimensions = List.copyOf(dimensions);
        this.shape = shape.clone();
        this.ordinals = ordinals;
        this.values = values;
        this.unit = unit;
    }

    /**
     * Creates a one-dimensional ordinal coordinate.
     *
     * @param name      coordinate name
     * @param dimension the single dimension it labels
     * @param ordinals  ordinal values, one per position (copied)
     * @param unit      duration of one ordinal step
     * @return the coordinate
     */
    public static Coordinate ordinal(String name, String dimension, long[] ordinals, ChronoUnit unit) {
        Objects.requireNonNull(unit, "unit");
        return new Coordinate(name, List.of(dimension), new int[]{ordinals.length}, ordinals.clone(), null, unit);
    }

    /**
     * Creates a numeric coordinate over the given dimensions.
     *
     * @param name       coordinate name
     * @param dimensions dimensions it labels, outermost first
     * @param shape      length along each dimension
     * @param values     row-major values (copied)
     * @return the coordinate
     */
    public static Coordinate numeric(String name, List<String> dimensions, int[] shape, double[] values) {
        return new Coordinate(name, dimensions, shape, null, values.clone(), null);
    }

    /**
     * Creates a one-dimensional numeric coordinate.
     */
    public static Coordinate numeric(String name, String dimension, double[] values) {
        return numeric(name, List.of(dimension), new int[]{values.length}, values);
    }

    public String getName() {
        return name;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public boolean isOrdinal() {
        return ordinals != null;
    }

    /**
     * @return the duration of one ordinal step, or {@code null} for numeric coordinates
     */
    public ChronoUnit getUnit() {
        return unit;
    }

    /**
     * @return number of values (product of the shape)
     */
    public int size() {
        return ordinals != null ? ordinals.length : values.length;
    }

    /**
     * @return a copy of the ordinal values
     * @throws IllegalStateException if this coordinate is numeric
     */
    public long[] getOrdinals() {
        if (ordinals == null) {
            throw new IllegalStateException("Coordinate '" + name + "' is not ordinal");
        }
        return ordinals.clone();
    }

    /**
     * @return a copy of the numeric values
     * @throws IllegalStateException if this coordinate is ordinal
     */
    public double[] getValues() {
        if (values == null) {
            throw new IllegalStateException("Coordinate '" + name + "' is ordinal");
        }
        return values.clone();
    }

    public long ordinalAt(int index) {
        return ordinals[index];
    }

    boolean spans(String dimension) {
        return dimensions.contains(dimension);
    }

    /**
     * Picks positions along {@code dimension}; coordinates not spanning it are returned as-is.
     */
    Coordinate take(String dimension, int[] indices) {
        int axis = dimensions.indexOf(dimension);
        if (axis < 0) {
            return this;
        }
        int[] newShape = shape.clone();
        newShape[axis] = indices.length;
        if (ordinals != null) {
            return new Coordinate(name, dimensions, newShape, Shapes.take(ordinals, shape, axis, indices), null, unit);
        }
        return new Coordinate(name, dimensions, newShape, null, Shapes.take(values, shape, axis, indices), null);
    }

    /**
     * Appends {@code other} after this coordinate along {@code dimension}.
     */
    Coordinate concat(Coordinate other, String dimension) {
        int axis = dimensions.indexOf(dimension);
        if (!dimensions.equals(other.dimensions) || isOrdinal() != other.isOrdinal() || unit != other.unit) {
            throw new AxisMismatchException("Coordinate '" + name + "' differs in dimensions or kind: "
                    + describe() + " vs " + other.describe());
        }
        if (!Shapes.sameExcept(shape, other.shape, axis)) {
            throw new AxisMismatchException("Coordinate '" + name + "' shape " + Arrays.toString(shape)
                    + " cannot be concatenated with " + Arrays.toString(other.shape) + " along '" + dimension + "'");
        }
        int[] newShape = shape.clone();
        newShape[axis] += other.shape[axis];
        if (ordinals != null) {
            return new Coordinate(name, dimensions, newShape,
                    Shapes.concat(ordinals, shape, other.ordinals, other.shape, axis), null, unit);
        }
        return new Coordinate(name, dimensions, newShape, null,
                Shapes.concat(values, shape, other.values, other.shape, axis), null);
    }

    private String describe() {
        return dimensions + (isOrdinal() ? " ordinal[" + unit + "]" : " numeric");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coordinate that)) {
            return false;
        }
        return name.equals(that.name)
                && dimensions.equals(that.dimensions)
                && Arrays.equals(shape, that.shape)
                && Arrays.equals(ordinals, that.ordinals)
                && Arrays.equals(values, that.values)
                && unit == that.unit;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, dimensions, unit);
        result = 31 * result + Arrays.hashCode(shape);
        result = 31 * result + Arrays.hashCode(ordinals);
        result = 31 * result + Arrays.hashCode(values);
        return result;
    }

    @Override
    public String toString() {
        return "Coordinate{" + name + " " + describe() + " shape=" + Arrays.toString(shape) + "}";
    }
}
