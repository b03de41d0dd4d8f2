package org.tsappend.datapipeline.api.dataset;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A named N-dimensional array of {@code double} values stored row-major over its dimensions.
 * <p>
 * Besides its values a variable may carry storage metadata: the chunk geometry it is (or will
 * be) stored with and the compressor bound to it. Datasets read back from a store carry both;
 * freshly ingested ones carry neither until the chunk planner and store encoder run.
 * <p>
 * Instances are immutable; the {@code with*} methods return modified copies.
 */
public final class Variable {

    private final String name;
    private final List<String> dimensions;
    private final int[] shape;
    private final double[] data;
    private final double fillValue;
    private final int[] chunks;
    private final CompressionSpec compressor;

    private Variable(String name, List<String> dimensions, int[] shape, double[] data,
                     double fillValue, int[] chunks, CompressionSpec compressor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be null or blank");
        }
        if (dimensions.size() != shape.length) {
            throw new IllegalArgumentException("Variable '" + name + "' has " + dimensions.size()
                    + " dimensions but shape of rank " + shape.length);
        }
        if (dimensions.stream().distinct().count() != dimensions.size()) {
            throw new IllegalArgumentException("Variable '" + name + "' repeats a dimension: " + dimensions);
        }
        if (Shapes.size(shape) != data.length) {
            throw new IllegalArgumentException("Variable '" + name + "' shape " + Arrays.toString(shape)
                    + " requires " + Shapes.size(shape) + " values, got " + data.length);
        }
        if (chunks != null && chunks.length != shape.length) {
            throw new IllegalArgumentException("Variable '" + name + "' chunk rank " + chunks.length
                    + " does not match its rank " + shape.length);
        }
        this.name = name;
        this.dimensions = List.copyOf(dimensions);
        this.shape = shape;
        this.data = data;
        this.fillValue = fillValue;
        this.chunks = chunks;
        this.compressor = compressor;
    }

    /**
     * Creates a variable with the default fill value ({@code NaN}) and no storage metadata.
     *
     * @param name       unique name within its dataset
     * @param dimensions dimension names, outermost first
     * @param shape      length along each dimension
     * @param data       row-major values (copied)
     * @return the variable
     */
    public static Variable of(String name, List<String> dimensions, int[] shape, double[] data) {
        return new Variable(name, dimensions, shape.clone(), data.clone(), Double.NaN, null, null);
    }

    /**
     * Creates a one-dimensional variable.
     */
    public static Variable of(String name, String dimension, double... data) {
        return of(name, List.of(dimension), new int[]{data.length}, data);
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

    public int getRank() {
        return shape.length;
    }

    /**
     * @return a copy of the row-major values
     */
    public double[] getData() {
        return data.clone();
    }

    /**
     * Reads one element.
     *
     * @param index one index per dimension
     * @return the value at that position
     */
    public double get(int... index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Expected " + shape.length + " indices, got " + index.length);
        }
        int flat = 0;
        for (int i = 0; i < shape.length; i++) {
            if (index[i] < 0 || index[i] >= shape[i]) {
                throw new IndexOutOfBoundsException("Index " + Arrays.toString(index)
                        + " out of bounds for shape " + Arrays.toString(shape));
            }
            flat = flat * shape[i] + index[i];
        }
        return data[flat];
    }

    public double getFillValue() {
        return fillValue;
    }

    /**
     * @return chunk size per dimension, or {@code null} when no chunk geometry is bound
     */
    public int[] getChunks() {
        return chunks == null ? null : chunks.clone();
    }

    /**
     * @return the bound compressor, or {@code null}
     */
    public CompressionSpec getCompressor() {
        return compressor;
    }

    public int lengthOf(String dimension) {
        int axis = dimensions.indexOf(dimension);
        if (axis < 0) {
            throw new IllegalArgumentException("Variable '" + name + "' has no dimension '" + dimension + "'");
        }
        return shape[axis];
    }

    public Variable withFillValue(double fillValue) {
        return new Variable(name, dimensions, shape, data, fillValue, chunks, compressor);
    }

    public Variable withChunks(int[] chunks) {
        return new Variable(name, dimensions, shape, data, fillValue, chunks == null ? null : chunks.clone(), compressor);
    }

    public Variable withCompressor(CompressionSpec compressor) {
        return new Variable(name, dimensions, shape, data, fillValue, chunks, compressor);
    }

    /**
     * Picks positions along {@code dimension}; variables not spanning it are returned as-is.
     */
    Variable take(String dimension, int[] indices) {
        int axis = dimensions.indexOf(dimension);
        if (axis < 0) {
            return this;
        }
        int[] newShape = shape.clone();
        newShape[axis] = indices.length;
        return new Variable(name, dimensions, newShape, Shapes.take(data, shape, axis, indices),
                fillValue, chunks, compressor);
    }

    /**
     * Appends {@code other} after this variable along {@code dimension}. Storage metadata of
     * this variable is kept.
     *
     * @throws AxisMismatchException if dimensions differ or any other dimension length differs
     */
    Variable concat(Variable other, String dimension) {
        if (!dimensions.equals(other.dimensions)) {
            throw new AxisMismatchException("Variable '" + name + "' dimensions " + dimensions
                    + " do not match " + other.dimensions);
        }
        int axis = dimensions.indexOf(dimension);
        if (axis < 0) {
            throw new AxisMismatchException("Variable '" + name + "' does not span dimension '" + dimension + "'");
        }
        if (!Shapes.sameExcept(shape, other.shape, axis)) {
            throw new AxisMismatchException("Variable '" + name + "' shape " + Arrays.toString(shape)
                    + " cannot be concatenated with " + Arrays.toString(other.shape) + " along '" + dimension + "'");
        }
        int[] newShape = shape.clone();
        newShape[axis] += other.shape[axis];
        return new Variable(name, dimensions, newShape,
                Shapes.concat(data, shape, other.data, other.shape, axis), fillValue, chunks, compressor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variable that)) {
            return false;
        }
        return name.equals(that.name)
                && dimensions.equals(that.dimensions)
                && Arrays.equals(shape, that.shape)
                && Arrays.equals(data, that.data)
                && Double.compare(fillValue, that.fillValue) == 0
                && Arrays.equals(chunks, that.chunks)
                && Objects.equals(compressor, that.compressor);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, dimensions, fillValue, compressor);
        result = 31 * result + Arrays.hashCode(shape);
        result = 31 * result + Arrays.hashCode(data);
        result = 31 * result + Arrays.hashCode(chunks);
        return result;
    }

    @Override
    public String toString() {
        return "Variable{" + name + " " + dimensions + " shape=" + Arrays.toString(shape)
                + (chunks != null ? " chunks=" + Arrays.toString(chunks) : "")
                + (compressor != null ? " compressor=" + compressor : "") + "}";
    }
}
