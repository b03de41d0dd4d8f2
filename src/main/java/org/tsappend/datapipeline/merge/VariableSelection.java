package org.tsappend.datapipeline.merge;

import java.util.List;
import java.util.Optional;

import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.dataset.SelectionException;

/**
 * Decides which variables an append run carries when the caller names none.
 */
public final class VariableSelection {

    private VariableSelection() {
    }

    /**
     * Returns the default variable selection.
     * <ul>
     *   <li>No existing dataset: the first-declared variable of {@code incoming}.</li>
     *   <li>Existing dataset: all of its variables, in declaration order, so the store keeps
     *       its layout across appends.</li>
     *   <li>Existing dataset without variables: falls back to the first rule.</li>
     * </ul>
     *
     * @param incoming newly ingested dataset
     * @param existing dataset already in the store, if any
     * @return the variables to carry
     * @throws SelectionException if the first rule applies and {@code incoming} has no variables
     */
    public static List<String> defaultVariables(Dataset incoming, Optional<Dataset> existing) {
        if (existing.isPresent() && !existing.get().getVariableNames().isEmpty()) {
            return existing.get().getVariableNames();
        }
        List<String> names = incoming.getVariableNames();
        if (names.isEmpty()) {
            throw new SelectionException("Incoming dataset has no variables to select");
        }
        return List.of(names.get(0));
    }

    /**
     * Resolves the requested variables: the request itself when non-empty, otherwise
     * {@link #defaultVariables(Dataset, Optional)}.
     */
    public static List<String> resolve(List<String> requested, Dataset incoming, Optional<Dataset> existing) {
        if (requested == null || requested.isEmpty()) {
            return defaultVariables(incoming, existing);
        }
        return requested.stream().distinct().toList();
    }
}
