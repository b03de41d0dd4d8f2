package org.tsappend.datapipeline.merge;

import java.util.List;
import java.util.Optional;

import org.tsappend.datapipeline.api.dataset.AxisMismatchException;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.dataset.SelectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrays;

/**
 * Combines the dataset already in the store with a newly ingested one.
 * <p>
 * The incoming dataset is narrowed to the requested variables, appended after the existing
 * dataset along the ordering dimension and the result stably sorted by the ordering
 * coordinate. Samples with equal ordinals therefore keep their concatenation order (existing
 * before incoming), which the keep-first policy of {@link AxisDeduplicator} relies on.
 * <p>
 * <strong>Thread Safety:</strong> Stateless, safe to share.
 */
public class DatasetMerger {

    private static final Logger log = LoggerFactory.getLogger(DatasetMerger.class);

    /**
     * Merges {@code incoming} into {@code existing}.
     *
     * @param existing    dataset already in the store, or empty on the first run
     * @param incoming    newly ingested dataset
     * @param variables   variables to carry; empty selects
     *                    {@link VariableSelection#defaultVariables(Dataset, Optional)}
     * @param orderingDim name of the ordering dimension
     * @return a new dataset whose ordering coordinate is non-decreasing
     * @throws SelectionException    if a requested variable is absent from {@code incoming}
     * @throws AxisMismatchException if the two datasets disagree outside the ordering dimension
     */
    public Dataset merge(Optional<Dataset> existing, Dataset incoming, List<String> variables, String orderingDim) {
        List<String> selected = VariableSelection.resolve(variables, incoming, existing);
        log.info("Subselecting variables: {}", selected);

        Dataset combined = incoming.select(selected);
        if (existing.isPresent()) {
            // Fail before concatenating so the message names the ordering dimension
            OrderingCoordinates.find(existing.get(), orderingDim);
            combined = existing.get().concat(combined, orderingDim);
            log.info("Concatenated datasets: {}", combined);
        }
        return sortBy(combined, orderingDim);
    }

    /**
     * Stably sorts a dataset ascending by its ordering coordinate.
     *
     * @param dataset     dataset to sort
     * @param orderingDim name of the ordering dimension
     * @return the sorted dataset ({@code dataset} itself if already sorted)
     */
    public static Dataset sortBy(Dataset dataset, String orderingDim) {
        long[] ordinals = OrderingCoordinates.find(dataset, orderingDim).getOrdinals();
        if (isSorted(ordinals)) {
            return dataset;
        }
        int[] order = new int[ordinals.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        IntArrays.mergeSort(order, (a, b) -> Long.compare(ordinals[a], ordinals[b]));
        return dataset.take(orderingDim, order);
    }

    static boolean isSorted(long[] ordinals) {
        for (int i = 1; i < ordinals.length; i++) {
            if (ordinals[i] < ordinals[i - 1]) {
                return false;
            }
        }
        return true;
    }
}
