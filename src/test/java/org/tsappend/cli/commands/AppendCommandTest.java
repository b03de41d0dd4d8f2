package org.tsappend.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tsappend.datapipeline.TestDatasets.TIME;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tsappend.cli.CommandLineInterface;
import org.tsappend.datapipeline.TestDatasets;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.resources.storage.FileSystemDatasetStore;
import org.tsappend.datapipeline.resources.storage.json.DatasetJson;

import picocli.CommandLine;

/**
 * Tests command parsing of the append command and a full local run through the CLI.
 */
@Tag("unit")
class AppendCommandTest {

    @TempDir
    Path tempDir;

    private Path inputDir;
    private Path outputDir;
    private Path configFile;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        inputDir = Files.createDirectories(tempDir.resolve("input"));
        outputDir = tempDir.resolve("output");
        configFile = tempDir.resolve("tsappend.conf");
        Files.writeString(configFile, """
                tsappend {
                  pipeline.chunk-shape = [2, 2, 2]
                  output.directory = "%s"
                  staging.directory = "%s"
                  logging.level = WARN
                }
                """.formatted(escape(outputDir), escape(tempDir.resolve("staging"))), StandardCharsets.UTF_8);
        out = new StringWriter();
        err = new StringWriter();
    }

    private static String escape(Path path) {
        return path.toString().replace("\\", "\\\\");
    }

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    private void writeInput(String name, Dataset dataset) throws IOException {
        StringWriter json = new StringWriter();
        DatasetJson.write(DatasetJson.toDocument(dataset, true), json);
        Files.writeString(inputDir.resolve(name), json.toString(), StandardCharsets.UTF_8);
    }

    @Test
    void testCommandParses() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands()).containsKey("append");
    }

    @Test
    void testHelpOutput() {
        execute("append", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("append");
        assertThat(output).contains("--input");
        assertThat(output).contains("--existing");
        assertThat(output).contains("--time-dim");
        assertThat(output).contains("--duration");
        assertThat(output).contains("--output");
    }

    @Test
    void testRequiresInputAndOutput() {
        int exitCode = execute("append", "-o", "v1");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("--input");
    }

    @Test
    void testRejectsMalformedDuration() {
        int exitCode = execute("append", "-i", inputDir.toString(), "-o", "v1", "-d", "soon");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("soon");
    }

    @Test
    @DisplayName("two runs through the CLI chain v1 into v2 on the local filesystem")
    void testLocalAppendRuns() throws IOException {
        writeInput("day1.json", TestDatasets.grid("t2m", new long[]{0, 1, 2}, 2, 2));

        int first = execute("-c", configFile.toString(), "append", "-i", inputDir + "/", "-o", "v1");

        assertThat(first).as(err.toString()).isEqualTo(0);
        assertThat(out.toString()).contains("3 time step(s)");

        Files.delete(inputDir.resolve("day1.json"));
        writeInput("day2.json", TestDatasets.grid("t2m", new long[]{2, 3}, 2, 2));

        int second = execute("-c", configFile.toString(), "append", "-i", inputDir + "/",
                "-z", outputDir.resolve("v1").toString(), "-t", TIME, "-d", "2h", "-o", "v2");

        assertThat(second).as(err.toString()).isEqualTo(0);
        assertThat(out.toString()).contains("1 duplicate(s) dropped, 1 trimmed");
        Dataset v2 = new FileSystemDatasetStore(outputDir).load("v2").orElseThrow();
        assertThat(TestDatasets.ordinals(v2)).containsExactly(1, 2, 3);
    }

    @Test
    void testExistingOutputFails() throws IOException {
        writeInput("day1.json", TestDatasets.grid("t2m", new long[]{0}, 2, 2));
        assertThat(execute("-c", configFile.toString(), "append", "-i", inputDir + "/", "-o", "v1")).isEqualTo(0);

        int exitCode = execute("-c", configFile.toString(), "append", "-i", inputDir + "/", "-o", "v1");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error:");
    }

    @Test
    void testMissingConfigFileFails() {
        int exitCode = execute("-c", tempDir.resolve("missing.conf").toString(),
                "append", "-i", inputDir + "/", "-o", "v1");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("missing.conf");
    }
}
