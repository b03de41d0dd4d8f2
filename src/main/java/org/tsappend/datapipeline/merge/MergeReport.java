package org.tsappend.datapipeline.merge;

import java.util.List;

/**
 * What one pipeline run did to the data, for operator visibility.
 *
 * @param variables         variables carried into the output
 * @param duplicateIndices  positions dropped as duplicates (in the merged, sorted dataset)
 * @param trimmedCount      samples dropped by the retention window
 * @param outputLength      samples along the ordering dimension in the output
 */
public record MergeReport(List<String> variables, int[] duplicateIndices, int trimmedCount, int outputLength) {

    public MergeReport {
        variables = List.copyOf(variables);
        duplicateIndices = duplicateIndices.clone();
    }

    @Override
    public int[] duplicateIndices() {
        return duplicateIndices.clone();
    }

    public int duplicateCount() {
        return duplicateIndices.length;
    }
}
