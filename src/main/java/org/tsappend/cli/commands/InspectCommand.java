package org.tsappend.cli.commands;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.tsappend.cli.CommandLineInterface;
import org.tsappend.datapipeline.api.dataset.Coordinate;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.dataset.Variable;
import org.tsappend.datapipeline.resources.storage.FileSystemDatasetStore;
import org.tsappend.datapipeline.resources.storage.json.DatasetJson;
import org.tsappend.datapipeline.services.AppendSettings;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "inspect",
    mixinStandardHelpOptions = true,
    description = "Show dimensions, coordinates and variables of a store for debugging purposes"
)
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Name of the store to inspect")
    String storeName;

    @Option(
        names = {"-r", "--root"},
        description = "Directory holding the store (default: the configured output directory)"
    )
    Path root;

    @Option(
        names = {"-f", "--format"},
        defaultValue = "summary",
        description = "Output format: summary, json (default: ${DEFAULT-VALUE})"
    )
    String format;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        try {
            Path storeRoot = root != null ? root : AppendSettings.fromConfig(parent.getConfig()).outputDirectory();
            Optional<Dataset> loaded = new FileSystemDatasetStore(storeRoot).load(storeName);
            if (loaded.isEmpty()) {
                err.println("No store named '" + storeName + "' under " + storeRoot.toAbsolutePath());
                return 1;
            }
            Dataset dataset = loaded.get();

            switch (format.toLowerCase(Locale.ROOT)) {
                case "json" -> {
                    StringWriter json = new StringWriter();
                    DatasetJson.write(DatasetJson.toDocument(dataset, false), json);
                    out.println(json);
                }
                case "summary" -> printSummary(dataset, out);
                default -> {
                    err.println("Unknown format: " + format + ". Supported formats: summary, json");
                    return 1;
                }
            }
            return 0;

        } catch (Exception e) {
            err.println("Error inspecting store: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(Dataset dataset, PrintWriter out) {
        out.println("Dimensions:");
        dataset.getSizes().forEach((dim, size) -> out.printf("  %-12s %d%n", dim, size));

        out.println("Coordinates:");
        for (Coordinate coordinate : dataset.getCoordinates()) {
            if (coordinate.isOrdinal() && coordinate.size() > 0) {
                out.printf("  %-12s %s %s .. %s%n", coordinate.getName(), coordinate.getDimensions(),
                        toInstant(coordinate, 0), toInstant(coordinate, coordinate.size() - 1));
            } else {
                out.printf("  %-12s %s (%d values)%n", coordinate.getName(), coordinate.getDimensions(),
                        coordinate.size());
            }
        }

        out.println("Variables:");
        for (Variable variable : dataset.getVariables()) {
            out.printf("  %-12s %s shape=%s chunks=%s compressor=%s%n", variable.getName(),
                    variable.getDimensions(), Arrays.toString(variable.getShape()),
                    Arrays.toString(variable.getChunks()),
                    variable.getCompressor() == null ? "none"
                            : variable.getCompressor().codec() + ":" + variable.getCompressor().level());
        }
    }

    private static Instant toInstant(Coordinate coordinate, int index) {
        return Instant.EPOCH.plus(coordinate.getUnit().getDuration().multipliedBy(coordinate.ordinalAt(index)));
    }
}
