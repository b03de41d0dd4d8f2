package org.tsappend.datapipeline.merge;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.tsappend.datapipeline.api.dataset.ChunkShape;
import org.tsappend.datapipeline.api.dataset.CompressionSpec;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.dataset.EncodedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the merge-and-normalize stages in order: merge, deduplicate, trim, plan chunks, encode.
 * <p>
 * Each stage fully consumes the output of the previous one. Any failure propagates before an
 * {@link EncodedDataset} exists, so nothing reaches the store writer.
 * <p>
 * <strong>Thread Safety:</strong> Stateless apart from its stage instances, which are stateless
 * themselves. One instance can serve any number of sequential or concurrent runs.
 */
public class MergePipeline {

    private static final Logger log = LoggerFactory.getLogger(MergePipeline.class);

    private final DatasetMerger merger;
    private final AxisDeduplicator deduplicator;
    private final WindowTrimmer trimmer;
    private final ChunkPlanner planner;
    private final StoreEncoder encoder;

    public MergePipeline() {
        this(new DatasetMerger(), new AxisDeduplicator(), new WindowTrimmer(), new ChunkPlanner(), new StoreEncoder());
    }

    public MergePipeline(DatasetMerger merger, AxisDeduplicator deduplicator, WindowTrimmer trimmer,
                         ChunkPlanner planner, StoreEncoder encoder) {
        this.merger = merger;
        this.deduplicator = deduplicator;
        this.trimmer = trimmer;
        this.planner = planner;
        this.encoder = encoder;
    }

    /**
     * Result of one run.
     *
     * @param encoded dataset ready for the store writer
     * @param report  what the run dropped and kept
     */
    public record MergeResult(EncodedDataset encoded, MergeReport report) {
    }

    /**
     * Produces the dataset to store from the existing and incoming datasets.
     *
     * @param existing    dataset already in the store, or empty on the first run
     * @param incoming    newly ingested dataset
     * @param variables   variables to carry; empty applies the default selection
     * @param orderingDim name of the ordering dimension
     * @param maxDuration retention window; empty keeps everything
     * @param chunkShape  chunk sizes for the store
     * @param codec       compressor for every variable
     * @return the encoded dataset and a report of the run
     */
    public MergeResult run(Optional<Dataset> existing, Dataset incoming, List<String> variables, String orderingDim,
                           Optional<Duration> maxDuration, ChunkShape chunkShape, CompressionSpec codec) {
        Dataset merged = merger.merge(existing, incoming, variables, orderingDim);
        AxisDeduplicator.DeduplicationResult deduplicated = deduplicator.deduplicate(merged, orderingDim);
        WindowTrimmer.TrimResult trimmed = trimmer.trim(deduplicated.dataset(), orderingDim, maxDuration);
        Dataset planned = planner.plan(trimmed.dataset(), orderingDim, chunkShape);
        EncodedDataset encoded = encoder.encode(planned, codec);

        MergeReport report = new MergeReport(merged.getVariableNames(), deduplicated.droppedIndices(),
                trimmed.trimmed(), planned.sizeOf(orderingDim));
        log.info("Merge complete: {} sample(s) along '{}', {} duplicate(s) dropped, {} trimmed",
                report.outputLength(), orderingDim, report.duplicateCount(), report.trimmedCount());
        return new MergeResult(encoded, report);
    }
}
