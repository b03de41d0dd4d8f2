package org.tsappend.datapipeline.merge;

import java.util.Arrays;

import org.tsappend.datapipeline.api.dataset.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Removes repeated samples along the ordering dimension.
 * <p>
 * Works on a sorted ordering coordinate: each run of equal ordinals keeps its first sample and
 * drops the others. Duplicates are reported with a warning, never raised as an error.
 */
public class AxisDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(AxisDeduplicator.class);

    /**
     * Outcome of {@link #deduplicate(Dataset, String)}.
     *
     * @param dataset        the dataset without duplicates
     * @param droppedIndices positions (in the input) that were removed, ascending
     */
    public record DeduplicationResult(Dataset dataset, int[] droppedIndices) {
    }

    /**
     * Drops every sample whose ordinal equals its predecessor's.
     *
     * @param dataset     dataset sorted along {@code orderingDim}
     * @param orderingDim name of the ordering dimension
     * @return the deduplicated dataset and the dropped positions
     */
    public DeduplicationResult deduplicate(Dataset dataset, String orderingDim) {
        long[] ordinals = OrderingCoordinates.find(dataset, orderingDim).getOrdinals();
        int[] drop = findDuplicates(ordinals);
        if (drop.length == 0) {
            return new DeduplicationResult(dataset, drop);
        }

        log.warn("Duplicate time steps detected: dropping {} time steps at indices: {}",
                String.format("%,d", drop.length), Arrays.toString(drop));

        int[] keep = new int[ordinals.length - drop.length];
        int k = 0;
        int d = 0;
        for (int i = 0; i < ordinals.length; i++) {
            if (d < drop.length && drop[d] == i) {
                d++;
            } else {
                keep[k++] = i;
            }
        }
        return new DeduplicationResult(dataset.take(orderingDim, keep), drop);
    }

    /**
     * Finds the positions to drop under the keep-first policy.
     * <p>
     * Equality is exact on the ordinal values. Only consecutive runs are detected, so the
     * input should be sorted.
     *
     * @param ordinals ordering coordinate values
     * @return ascending indices {@code i} with {@code ordinals[i] == ordinals[i - 1]}
     */
    public static int[] findDuplicates(long[] ordinals) {
        IntArrayList drop = new IntArrayList();
        for (int i = 1; i < ordinals.length; i++) {
            if (ordinals[i] == ordinals[i - 1]) {
                drop.add(i);
            }
        }
        return drop.toIntArray();
    }
}
