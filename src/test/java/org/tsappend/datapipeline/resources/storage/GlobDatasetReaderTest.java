package org.tsappend.datapipeline.resources.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tsappend.datapipeline.TestDatasets.TIME;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tsappend.datapipeline.TestDatasets;
import org.tsappend.datapipeline.api.dataset.Dataset;
import org.tsappend.datapipeline.api.resources.storage.NoMatchException;

@Tag("unit")
class GlobDatasetReaderTest {

    @TempDir
    Path tempDir;

    private final GlobDatasetReader reader = new GlobDatasetReader(new JsonDatasetFileReader());

    private static String inputFile(String... instants) {
        StringBuilder times = new StringBuilder();
        StringBuilder values = new StringBuilder();
        for (int i = 0; i < instants.length; i++) {
            times.append(i > 0 ? "," : "").append('"').append(instants[i]).append('"');
            values.append(i > 0 ? "," : "").append(Integer.parseInt(instants[i].substring(11, 13)));
        }
        return """
                {
                  "coordinates": [
                    {"name": "time", "dimensions": ["time"], "unit": "HOURS", "instants": [%s]}
                  ],
                  "variables": [
                    {"name": "t2m", "dimensions": ["time"], "shape": [%d], "data": [%s]}
                  ]
                }
                """.formatted(times, instants.length, values);
    }

    private void write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("matching files are concatenated and sorted by time")
    void concatenatesAndSorts() throws IOException {
        write("b.json", inputFile("2024-01-01T03:00:00Z", "2024-01-01T01:00:00Z"));
        write("a.json", inputFile("2024-01-01T02:00:00Z"));
        write("notes.txt", "ignored");

        Dataset ds = reader.read(tempDir, "*.json", TIME);

        long first = ChronoUnit.HOURS.between(Instant.EPOCH,
                Instant.parse("2024-01-01T01:00:00Z"));
        assertThat(TestDatasets.ordinals(ds)).containsExactly(first, first + 1, first + 2);
        assertThat(ds.getVariable("t2m").getData()).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void globIsRelativeToTheDirectory() throws IOException {
        write("2024/jan.json", inputFile("2024-01-01T05:00:00Z"));
        write("top.json", inputFile("2024-01-01T06:00:00Z"));

        assertThat(reader.read(tempDir, "2024/*.json", TIME).sizeOf(TIME)).isEqualTo(1);
        assertThat(reader.read(tempDir, "**.json", TIME).sizeOf(TIME)).isEqualTo(2);
    }

    @Test
    void noMatchFails() throws IOException {
        write("a.nc", "binary");

        assertThatThrownBy(() -> reader.read(tempDir, "*.json", TIME))
                .isInstanceOf(NoMatchException.class)
                .hasMessageContaining("*.json");
    }

    @Test
    void missingDirectoryFails() {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("absent"), "*.json", TIME))
                .isInstanceOf(NoMatchException.class);
    }

    @Test
    void malformedFileNamesTheFile() throws IOException {
        write("bad.json", "{ not json");

        assertThatThrownBy(() -> reader.read(tempDir, "*.json", TIME))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("bad.json");
    }
}
