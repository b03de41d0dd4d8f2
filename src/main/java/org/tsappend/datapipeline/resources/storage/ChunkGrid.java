package org.tsappend.datapipeline.resources.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/**
 * Partition of a row-major array into fixed-size chunks.
 * <p>
 * Chunks at the upper edge of a dimension are clipped to the array, so every chunk holds
 * exactly the values inside it. A chunk is addressed by its grid index per dimension and
 * stored under the key {@code i.j.k} ({@code 0} for scalars).
 */
final class ChunkGrid {

    private final int[] shape;
    private final int[] chunks;
    private final int[] counts;

    ChunkGrid(int[] shape, int[] chunks) {
        if (shape.length != chunks.length) {
            throw new IllegalArgumentException("Chunk rank " + chunks.length + " does not match rank " + shape.length);
        }
        this.shape = shape.clone();
        this.chunks = chunks.clone();
        this.counts = new int[shape.length];
        for (int i = 0; i < shape.length; i++) {
            if (chunks[i] < 1) {
                throw new IllegalArgumentException("Chunk sizes must be >= 1: " + Arrays.toString(chunks));
            }
            counts[i] = (shape[i] + chunks[i] - 1) / chunks[i];
        }
    }

    /**
     * @return grid index of every chunk, in row-major order
     */
    List<int[]> chunkIndices() {
        List<int[]> result = new ArrayList<>();
        for (int count : counts) {
            if (count == 0) {
                return result;
            }
        }
        int[] index = new int[shape.length];
        while (true) {
            result.add(index.clone());
            int d = shape.length - 1;
            while (d >= 0) {
                if (++index[d] < counts[d]) {
                    break;
                }
                index[d] = 0;
                d--;
            }
            if (d < 0) {
                return result;
            }
        }
    }

    static String key(int[] chunkIndex) {
        if (chunkIndex.length == 0) {
            return "0";
        }
        StringJoiner joiner = new StringJoiner(".");
        for (int i : chunkIndex) {
            joiner.add(Integer.toString(i));
        }
        return joiner.toString();
    }

    /**
     * @return the clipped extent of the chunk along each dimension
     */
    int[] extent(int[] chunkIndex) {
        int[] extent = new int[shape.length];
        for (int i = 0; i < shape.length; i++) {
            extent[i] = Math.min(chunks[i], shape[i] - chunkIndex[i] * chunks[i]);
        }
        return extent;
    }

    /**
     * Copies the values of one chunk out of the full array.
     */
    double[] extract(double[] data, int[] chunkIndex) {
        int[] extent = extent(chunkIndex);
        double[] block = new double[product(extent)];
        copy(data, block, chunkIndex, extent, true);
        return block;
    }

    /**
     * Copies the values of one chunk into the full array.
     */
    void insert(double[] data, int[] chunkIndex, double[] block) {
        int[] extent = extent(chunkIndex);
        if (block.length != product(extent)) {
            throw new IllegalArgumentException("Chunk " + key(chunkIndex) + " holds " + block.length
                    + " values, expected " + product(extent));
        }
        copy(data, block, chunkIndex, extent, false);
    }

    private void copy(double[] data, double[] block, int[] chunkIndex, int[] extent, boolean toBlock) {
        int rank = shape.length;
        if (rank == 0) {
            if (toBlock) {
                block[0] = data[0];
            } else {
                data[0] = block[0];
            }
            return;
        }
        int[] local = new int[rank];
        int innerRun = extent[rank - 1];
        int blockPos = 0;
        while (true) {
            int flat = 0;
            for (int i = 0; i < rank; i++) {
                flat = flat * shape[i] + chunkIndex[i] * chunks[i] + local[i];
            }
            if (toBlock) {
                System.arraycopy(data, flat, block, blockPos, innerRun);
            } else {
                System.arraycopy(block, blockPos, data, flat, innerRun);
            }
            blockPos += innerRun;
            int d = rank - 2;
            while (d >= 0) {
                if (++local[d] < extent[d]) {
                    break;
                }
                local[d] = 0;
                d--;
            }
            if (d < 0) {
                return;
            }
        }
    }

    private static int product(int[] values) {
        int product = 1;
        for (int v : values) {
            product *= v;
        }
        return product;
    }
}
