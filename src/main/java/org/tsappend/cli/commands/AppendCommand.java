package org.tsappend.cli.commands;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.tsappend.cli.CommandLineInterface;
import org.tsappend.datapipeline.api.DatasetPipelineException;
import org.tsappend.datapipeline.merge.MergePipeline;
import org.tsappend.datapipeline.merge.MergeReport;
import org.tsappend.datapipeline.resources.storage.FileSystemDatasetStore;
import org.tsappend.datapipeline.resources.storage.GlobDatasetReader;
import org.tsappend.datapipeline.resources.storage.JsonDatasetFileReader;
import org.tsappend.datapipeline.services.AppendRequest;
import org.tsappend.datapipeline.services.AppendService;
import org.tsappend.datapipeline.services.AppendSettings;
import org.tsappend.datapipeline.services.ExistingStoreAccess;
import org.tsappend.datapipeline.staging.LocalStagingClient;
import org.tsappend.datapipeline.staging.S3StagingClient;
import org.tsappend.datapipeline.staging.StagingClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * CLI command that appends staged input files onto an existing store and writes the result as
 * a new store.
 */
@Command(
    name = "append",
    mixinStandardHelpOptions = true,
    description = "Merge new input files into an existing store, deduplicate, trim and re-encode"
)
public class AppendCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AppendCommand.class);

    @Option(
        names = {"-i", "--input"},
        required = true,
        description = "URL prefix of input files to stage (s3://bucket/prefix, file:///dir/ or a local path)"
    )
    String input;

    @Option(
        names = {"-z", "--existing"},
        defaultValue = "",
        description = "URL of the existing store to append to (empty or 'none' to start a new one)"
    )
    String existing;

    @Option(
        names = {"--existing-access"},
        defaultValue = "stage",
        description = "stage: download the existing store to a staging directory; mount: not supported"
    )
    String existingAccess;

    @Option(
        names = {"-t", "--time-dim"},
        defaultValue = "time",
        description = "Name of the time dimension (default: ${DEFAULT-VALUE})"
    )
    String timeDim;

    @Option(
        names = {"-p", "--pattern"},
        defaultValue = "*.json",
        description = "Glob pattern selecting input files (default: ${DEFAULT-VALUE})"
    )
    String pattern;

    @Option(
        names = {"-d", "--duration"},
        converter = DurationConverter.class,
        description = "Maximum span between first and last time step of the output, e.g. P30D or 36h"
    )
    Duration duration;

    @Option(
        names = {"-o", "--output"},
        required = true,
        description = "Name of the output store (created under the configured output directory)"
    )
    String output;

    @Option(
        names = {"--variables"},
        arity = "0..*",
        description = "Variables to carry (default: all variables of the existing store, or the first input variable)"
    )
    List<String> variables;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private S3Client s3Client;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            AppendSettings settings = AppendSettings.fromConfig(config);
            AppendRequest request = new AppendRequest(input, Optional.of(existing),
                    ExistingStoreAccess.parse(existingAccess), timeDim, pattern, Optional.ofNullable(duration),
                    output, variables);
            log.info("Append request: {}", request);

            AppendService service = new AppendService(settings, stagingClients(config), FileSystemDatasetStore::new,
                    new GlobDatasetReader(new JsonDatasetFileReader()), new MergePipeline(),
                    new FileSystemDatasetStore(settings.outputDirectory()));

            MergeReport report = service.append(request);
            out.printf("Wrote %s: %d time step(s), variables %s, %d duplicate(s) dropped, %d trimmed%n",
                    settings.outputDirectory().resolve(output), report.outputLength(), report.variables(),
                    report.duplicateCount(), report.trimmedCount());
            return 0;

        } catch (DatasetPipelineException e) {
            log.error("Append failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Append failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            if (s3Client != null) {
                s3Client.close();
                s3Client = null;
            }
        }
    }

    private StagingClients stagingClients(Config config) {
        return new StagingClients()
                .register(LocalStagingClient.SCHEME, new LocalStagingClient())
                // S3 client is built on the first s3:// URL
                .register(S3StagingClient.SCHEME, (url, dir) -> new S3StagingClient(s3Client(config)).stage(url, dir));
    }

    private S3Client s3Client(Config config) {
        if (s3Client == null) {
            s3Client = createS3Client(config);
        }
        return s3Client;
    }

    static S3Client createS3Client(Config config) {
        S3ClientBuilder builder = S3Client.builder();
        String region = config.getString("tsappend.staging.s3.region");
        if (!region.isBlank()) {
            builder.region(Region.of(region));
        }
        return builder.build();
    }
}
