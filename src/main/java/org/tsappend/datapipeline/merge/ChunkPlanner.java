package org.tsappend.datapipeline.merge;

import java.util.Arrays;
import java.util.List;

import org.tsappend.datapipeline.api.dataset.ChunkShape;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.dataset.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds a fixed chunk geometry to every variable of a dataset.
 * <p>
 * The first size of the {@link ChunkShape} goes to the ordering dimension wherever it appears
 * in a variable, so all variables share one chunk length along it. The other sizes go to the
 * remaining dimensions in declaration order; dimensions left over when the tuple runs out are
 * stored whole. Only metadata changes.
 */
public class ChunkPlanner {

    private static final Logger log = LoggerFactory.getLogger(ChunkPlanner.class);

    /**
     * Rebinds the chunk geometry of every variable.
     *
     * @param dataset     dataset to plan
     * @param orderingDim name of the ordering dimension
     * @param chunkShape  configured chunk sizes
     * @return the dataset with chunk metadata set
     */
    public Dataset plan(Dataset dataset, String orderingDim, ChunkShape chunkShape) {
        log.info("Setting chunk config: {}", chunkShape);
        return dataset.mapVariables(v -> {
            int[] chunks = chunksFor(v, orderingDim, chunkShape);
            log.debug("Variable '{}' {} -> chunks {}", v.getName(), v.getDimensions(), Arrays.toString(chunks));
            return v.withChunks(chunks);
        });
    }

    static int[] chunksFor(Variable variable, String orderingDim, ChunkShape chunkShape) {
        List<String> dimensions = variable.getDimensions();
        int[] shape = variable.getShape();
        int[] chunks = new int[dimensions.size()];
        int next = 1;
        for (int i = 0; i < chunks.length; i++) {
            if (dimensions.get(i).equals(orderingDim)) {
                chunks[i] = chunkShape.orderingSize();
            } else if (next < chunkShape.length()) {
                chunks[i] = chunkShape.get(next++);
            } else {
                chunks[i] = Math.max(1, shape[i]);
            }
        }
        return chunks;
    }
}
