package org.tsappend.datapipeline.services;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Parameters of one append run.
 *
 * @param inputUrl       prefix URL of the input files to stage
 * @param existingUrl    URL of the existing store, empty for a first run
 * @param existingAccess how the existing store is accessed
 * @param orderingDim    name of the ordering dimension
 * @param pattern        glob selecting input files inside the staged input
 * @param maxDuration    retention window, empty for unbounded
 * @param output         name of the output store
 * @param variables      variables to carry, empty for the default selection
 */
public record AppendRequest(String inputUrl, Optional<String> existingUrl, ExistingStoreAccess existingAccess,
                            String orderingDim, String pattern, Optional<Duration> maxDuration, String output,
                            List<String> variables) {

    public AppendRequest {
        if (inputUrl == null || inputUrl.isBlank()) {
            throw new IllegalArgumentException("inputUrl is required");
        }
        if (output == null || output.isBlank()) {
            throw new IllegalArgumentException("output is required");
        }
        existingUrl = existingUrl.filter(u -> !u.isBlank() && !"none".equalsIgnoreCase(u));
        variables = variables == null ? List.of() : List.copyOf(variables);
    }
}
