package org.tsappend.datapipeline.resources.storage;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

import org.tsappend.datapipeline.api.dataset.CompressionSpec;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.dataset.EncodedDataset;
import org.tsappend.datapipeline.api.dataset.Variable;
import org.tsappend.datapipeline.api.resources.storage.CreateMode;
import org.tsappend.datapipeline.api.resources.storage.IDatasetStoreRead;
import org.tsappend.datapipeline.api.resources.storage.IDatasetStoreWrite;
import org.tsappend.datapipeline.api.resources.storage.WriteConflictException;
import org.tsappend.datapipeline.resources.storage.json.DatasetDocument;
import org.tsappend.datapipeline.resources.storage.json.DatasetDocument.VariableDocument;
import org.tsappend.datapipeline.resources.storage.json.DatasetJson;
import org.tsappend.datapipeline.utils.compression.CompressionCodecFactory;
import org.tsappend.datapipeline.utils.compression.ICompressionCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chunked, compressed dataset stores on the local file system.
 * <p>
 * Layout of a store named {@code name} under the root directory:
 * <pre>
 * {root}/{name}/dataset.json          metadata: coordinates (with values), variables (no values)
 * {root}/{name}/{variable}/{i.j.k}    one compressed chunk of little-endian doubles
 * </pre>
 * Chunks that hold only the fill value are omitted when the dataset says so; the reader fills
 * missing chunks with the fill value.
 * <p>
 * Writes are atomic: the store is assembled in a temporary sibling directory and published with
 * a single rename.
 */
public class FileSystemDatasetStore implements IDatasetStoreRead, IDatasetStoreWrite {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDatasetStore.class);

    static final String METADATA_FILE = "dataset.json";

    private final Path rootDirectory;

    /**
     * @param rootDirectory directory holding the stores; created on first write if missing
     */
    public FileSystemDatasetStore(Path rootDirectory) {
        if (rootDirectory == null) {
            throw new IllegalArgumentException("rootDirectory is required for FileSystemDatasetStore");
        }
        this.rootDirectory = rootDirectory.toAbsolutePath().normalize();
    }

    public Path getRootDirectory() {
        return rootDirectory;
    }

    @Override
    public Optional<Dataset> load(String locator) throws IOException {
        Path storeDir = resolve(locator);
        if (!Files.exists(storeDir)) {
            return Optional.empty();
        }
        Path metadataFile = storeDir.resolve(METADATA_FILE);
        if (!Files.isRegularFile(metadataFile)) {
            throw new IOException("Not a dataset store (missing " + METADATA_FILE + "): " + storeDir);
        }
        DatasetDocument document;
        try (Reader reader = Files.newBufferedReader(metadataFile, StandardCharsets.UTF_8)) {
            document = DatasetJson.read(reader);
        }
        if (!DatasetJson.FORMAT.equals(document.format())) {
            throw new IOException("Unsupported store format '" + document.format() + "' in " + metadataFile);
        }
        Dataset dataset = DatasetJson.toDataset(document, (v, fill) -> readVariable(storeDir, v, fill));
        log.debug("Loaded store {}: {}", storeDir, dataset);
        return Optional.of(dataset);
    }

    @Override
    public void write(EncodedDataset encoded, String locator, CreateMode mode) throws IOException {
        Path target = resolve(locator);
        if (mode == CreateMode.EXCLUSIVE && Files.exists(target)) {
            throw new WriteConflictException("Destination already exists: " + target);
        }
        Files.createDirectories(target.getParent());

        Path tempDir = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectory(tempDir);
            int written = writeStore(encoded, tempDir);
            publish(tempDir, target, mode);
            log.info("Wrote store {} ({} chunk file(s))", target, written);
        } catch (IOException | RuntimeException e) {
            try {
                deleteRecursively(tempDir);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp directory after write failure: {}", tempDir, cleanupEx);
            }
            throw e;
        }
    }

    private int writeStore(EncodedDataset encoded, Path storeDir) throws IOException {
        Dataset dataset = encoded.dataset();
        int written = 0;
        for (Variable variable : dataset.getVariables()) {
            int[] chunks = variable.getChunks();
            CompressionSpec compressor = variable.getCompressor();
            if (chunks == null || compressor == null) {
                throw new IllegalStateException("Variable '" + variable.getName()
                        + "' is not encoded (chunks=" + Arrays.toString(chunks) + ", compressor=" + compressor + ")");
            }
            validateKey(variable.getName());
            ICompressionCodec codec = CompressionCodecFactory.create(compressor);
            ChunkGrid grid = new ChunkGrid(variable.getShape(), chunks);
            double[] data = variable.getData();
            double fill = variable.getFillValue();
            Path variableDir = Files.createDirectory(storeDir.resolve(variable.getName()));
            int skipped = 0;
            for (int[] chunkIndex : grid.chunkIndices()) {
                double[] block = grid.extract(data, chunkIndex);
                if (!encoded.writeEmptyChunks() && isEmpty(block, fill)) {
                    skipped++;
                    continue;
                }
                Files.write(variableDir.resolve(ChunkGrid.key(chunkIndex)), compress(codec, block));
                written++;
            }
            log.debug("Variable '{}': skipped {} empty chunk(s)", variable.getName(), skipped);
        }
        try (Writer writer = Files.newBufferedWriter(storeDir.resolve(METADATA_FILE), StandardCharsets.UTF_8)) {
            DatasetJson.write(DatasetJson.toDocument(dataset, false), writer);
        }
        return written;
    }

    /**
     * Moves a fully written store from {@code tempDir} to {@code target}. In exclusive mode the
     * target is first claimed with {@link Files#createDirectory}, so a directory that appeared
     * after the initial existence check is reported as a conflict instead of being replaced.
     */
    void publish(Path tempDir, Path target, CreateMode mode) throws IOException {
        if (mode == CreateMode.OVERWRITE && Files.exists(target)) {
            Path previous = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".old");
            Files.move(target, previous, StandardCopyOption.ATOMIC_MOVE);
            try {
                Files.move(tempDir, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                Files.move(previous, target, StandardCopyOption.ATOMIC_MOVE);
                throw e;
            }
            try {
                deleteRecursively(previous);
            } catch (IOException e) {
                log.warn("Failed to remove replaced store: {}", previous, e);
            }
            return;
        }
        try {
            Files.createDirectory(target);
        } catch (FileAlreadyExistsException e) {
            throw new WriteConflictException("Destination appeared during write: " + target);
        }
        try {
            moveOntoClaim(tempDir, target);
        } catch (IOException | RuntimeException e) {
            releaseClaim(target);
            throw e;
        }
    }

    private static void moveOntoClaim(Path tempDir, Path target) throws IOException {
        try {
            // rename(2) replaces the empty claimed directory in one step
            Files.move(tempDir, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (FileAlreadyExistsException | DirectoryNotEmptyException e) {
            if (!isEmptyDirectory(target)) {
                throw new WriteConflictException("Destination was written concurrently: " + target);
            }
            // Platforms whose rename does not replace an existing directory
            Files.delete(target);
            try {
                Files.move(tempDir, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (FileAlreadyExistsException | DirectoryNotEmptyException again) {
                throw new WriteConflictException("Destination appeared during write: " + target);
            }
        }
    }

    private static void releaseClaim(Path target) {
        try {
            if (isEmptyDirectory(target)) {
                Files.delete(target);
            }
        } catch (IOException e) {
            log.warn("Failed to release claimed destination: {}", target, e);
        }
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    private double[] readVariable(Path storeDir, VariableDocument document, double fill) throws IOException {
        if (document.chunks() == null || document.compressor() == null) {
            throw new IOException("Variable '" + document.name() + "' has no chunk or compressor metadata");
        }
        ICompressionCodec codec = CompressionCodecFactory.create(
                new CompressionSpec(document.compressor().codec(), document.compressor().level()));
        int[] shape = document.shape();
        int size = 1;
        for (int d : shape) {
            size *= d;
        }
        double[] data = new double[size];
        Arrays.fill(data, fill);
        ChunkGrid grid = new ChunkGrid(shape, document.chunks());
        Path variableDir = storeDir.resolve(document.name());
        for (int[] chunkIndex : grid.chunkIndices()) {
            Path chunkFile = variableDir.resolve(ChunkGrid.key(chunkIndex));
            byte[] compressed;
            try {
                compressed = Files.readAllBytes(chunkFile);
            } catch (NoSuchFileException e) {
                continue;
            }
            grid.insert(data, chunkIndex, decompress(codec, compressed, chunkFile));
        }
        return data;
    }

    static byte[] compress(ICompressionCodec codec, double[] block) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(block.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asDoubleBuffer().put(block);
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (OutputStream out = codec.wrapOutputStream(bos)) {
            out.write(buffer.array());
        }
        return bos.toByteArray();
    }

    static double[] decompress(ICompressionCodec codec, byte[] compressed, Path source) throws IOException {
        byte[] raw;
        try (InputStream in = codec.wrapInputStream(new ByteArrayInputStream(compressed))) {
            raw = in.readAllBytes();
        }
        if (raw.length % Double.BYTES != 0) {
            throw new IOException("Corrupt chunk " + source + ": " + raw.length + " bytes is not a whole number of doubles");
        }
        double[] block = new double[raw.length / Double.BYTES];
        ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN).asDoubleBuffer().get(block);
        return block;
    }

    static boolean isEmpty(double[] block, double fill) {
        for (double v : block) {
            if (Double.compare(v, fill) != 0 && v != fill) {
                return false;
            }
        }
        return true;
    }

    private Path resolve(String locator) {
        validateKey(locator);
        Path path = rootDirectory.resolve(locator).normalize();
        if (!path.startsWith(rootDirectory) || path.equals(rootDirectory)) {
            throw new IllegalArgumentException("Locator escapes the store root: " + locator);
        }
        return path;
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }

    private static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }

        // Prevent path traversal attacks
        if (key.contains("..")) {
            throw new IllegalArgumentException("Key cannot contain '..' (path traversal attempt): " + key);
        }

        // Prevent absolute paths
        if (key.startsWith("/") || key.startsWith("\\")) {
            throw new IllegalArgumentException("Key cannot be an absolute path: " + key);
        }

        // Prevent control characters (0x00-0x1F)
        for (char c : key.toCharArray()) {
            if (c < 0x20) {
                throw new IllegalArgumentException("Key contains control character (0x" +
                        Integer.toHexString(c) + "): " + key);
            }
        }
    }
}
