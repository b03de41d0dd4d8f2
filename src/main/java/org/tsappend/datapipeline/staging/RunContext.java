package org.tsappend.datapipeline.staging;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the staging areas acquired during one append run.
 * <p>
 * Areas are released in reverse acquisition order when the context closes, whether the run
 * succeeded or failed. A failed release is logged and does not stop the others.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * try (RunContext context = new RunContext(clients, stagingRoot)) {
 *     Path input = context.stage(inputUrl);
 *     ...
 * }
 * }</pre>
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. One context per run.
 */
public class RunContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final StagingClients clients;
    private final Path stagingRoot;
    private final Deque<StagingArea> areas = new ArrayDeque<>();

    /**
     * @param clients     clients by URL scheme
     * @param stagingRoot parent of the staging directories, or {@code null} for the system temp directory
     */
    public RunContext(StagingClients clients, Path stagingRoot) {
        this.clients = clients;
        this.stagingRoot = stagingRoot;
    }

    /**
     * Stages everything under {@code url} into a new staging area owned by this context.
     *
     * @param url prefix URL
     * @return the staging directory
     */
    public Path stage(String url) throws IOException {
        IStagingClient client = clients.forUrl(url);
        StagingArea area = StagingArea.create(stagingRoot);
        areas.push(area);
        client.stage(url, area.getDirectory());
        return area.getDirectory();
    }

    /**
     * @return number of staging areas not yet released
     */
    public int openAreas() {
        return areas.size();
    }

    @Override
    public void close() {
        while (!areas.isEmpty()) {
            StagingArea area = areas.pop();
            try {
                area.close();
            } catch (IOException e) {
                log.warn("Failed to remove staging dir: {}", area.getDirectory(), e);
            }
        }
    }
}
