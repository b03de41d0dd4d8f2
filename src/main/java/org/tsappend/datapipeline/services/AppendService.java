package org.tsappend.datapipeline.services;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;

import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.resources.storage.CreateMode;
import org.tsappend.datapipeline.api.resources.storage.IDatasetStoreRead;
import org.tsappend.datapipeline.api.resources.storage.IDatasetStoreWrite;
import org.tsappend.datapipeline.api.resources.storage.IIncomingDatasetReader;
import org.tsappend.datapipeline.merge.MergePipeline;
import org.tsappend.datapipeline.merge.MergeReport;
import org.tsappend.datapipeline.staging.RunContext;
import org.tsappend.datapipeline.staging.StagingClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs one append run end to end: stage the existing store and the input files, merge,
 * and write the result as a new store.
 * <p>
 * All staging areas are released when the run ends, successfully or not. The output store is
 * created exclusively, so an existing store at the output location is never overwritten.
 */
public class AppendService {

    private static final Logger log = LoggerFactory.getLogger(AppendService.class);

    private final AppendSettings settings;
    private final StagingClients stagingClients;
    private final Function<Path, IDatasetStoreRead> storeReaders;
    private final IIncomingDatasetReader incomingReader;
    private final MergePipeline pipeline;
    private final IDatasetStoreWrite outputStore;

    /**
     * @param settings       chunking, compression and directory settings
     * @param stagingClients staging clients by URL scheme
     * @param storeReaders   opens a store reader rooted at a staging directory
     * @param incomingReader reads staged input files
     * @param pipeline       merge pipeline
     * @param outputStore    writer for the output store
     */
    public AppendService(AppendSettings settings, StagingClients stagingClients,
                         Function<Path, IDatasetStoreRead> storeReaders, IIncomingDatasetReader incomingReader,
                         MergePipeline pipeline, IDatasetStoreWrite outputStore) {
        this.settings = settings;
        this.stagingClients = stagingClients;
        this.storeReaders = storeReaders;
        this.incomingReader = incomingReader;
        this.pipeline = pipeline;
        this.outputStore = outputStore;
    }

    /**
     * Runs one append.
     *
     * @param request run parameters
     * @return what the run dropped and kept
     * @throws IOException if staging, reading or writing fails
     */
    public MergeReport append(AppendRequest request) throws IOException {
        try (RunContext context = new RunContext(stagingClients, settings.stagingRoot())) {
            Optional<Dataset> existing = openExisting(request, context);

            Path inputDir = context.stage(request.inputUrl());
            Dataset incoming = incomingReader.read(inputDir, request.pattern(), request.orderingDim());
            log.info("Opened new dataset from input files: {}", incoming);

            MergePipeline.MergeResult result = pipeline.run(existing, incoming, request.variables(),
                    request.orderingDim(), request.maxDuration(), settings.chunkShape(), settings.compression());

            log.info("Writing to store: {}", settings.outputDirectory().resolve(request.output()));
            outputStore.write(result.encoded(), request.output(), CreateMode.EXCLUSIVE);
            return result.report();
        }
    }

    private Optional<Dataset> openExisting(AppendRequest request, RunContext context) throws IOException {
        if (request.existingUrl().isEmpty()) {
            log.info("No existing store, starting a new one");
            return Optional.empty();
        }
        String url = request.existingUrl().get();
        if (request.existingAccess() == ExistingStoreAccess.MOUNT) {
            throw new UnsupportedOperationException("Mounting existing stores is not supported; use stage");
        }
        log.info("Staging existing store to local: {}", url);
        Path stagedDir = context.stage(url);
        String name = baseName(url);
        Dataset existing = storeReaders.apply(stagedDir).load(name)
                .orElseThrow(() -> new IOException("No store named '" + name + "' found under " + url));
        log.info("Opened existing store: {}", existing);
        return Optional.of(existing);
    }

    static String baseName(String url) {
        String trimmed = url.replaceAll("/+$", "");
        int slash = trimmed.lastIndexOf('/');
        return slash == -1 ? trimmed : trimmed.substring(slash + 1);
    }
}
