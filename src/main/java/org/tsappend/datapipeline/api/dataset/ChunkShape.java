package org.tsappend.datapipeline.api.dataset;

import java.util.Arrays;

/**
 * A fixed tuple of chunk sizes.
 * <p>
 * Element 0 applies to the ordering dimension; the remaining elements apply, in order, to a
 * variable's other dimensions. Keeping the tuple fixed across runs keeps new chunks aligned
 * with existing chunk boundaries along the ordering dimension.
 */
public final class ChunkShape {

    private final int[] sizes;

    private ChunkShape(int[] sizes) {
        if (sizes.length == 0) {
            throw new IllegalArgumentException("Chunk shape needs at least one size");
        }
        for (int size : sizes) {
            if (size < 1) {
                throw new IllegalArgumentException("Chunk sizes must be >= 1, got: " + Arrays.toString(sizes));
            }
        }
        this.sizes = sizes;
    }

    public static ChunkShape of(int... sizes) {
        return new ChunkShape(sizes.clone());
    }

    /**
     * @return chunk size along the ordering dimension
     */
    public int orderingSize() {
        return sizes[0];
    }

    /**
     * @return number of sizes in the tuple
     */
    public int length() {
        return sizes.length;
    }

    public int get(int index) {
        return sizes[index];
    }

    public int[] toArray() {
        return sizes.clone();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ChunkShape that && Arrays.equals(sizes, that.sizes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(sizes);
    }

    @Override
    public String toString() {
        return Arrays.toString(sizes);
    }
}
