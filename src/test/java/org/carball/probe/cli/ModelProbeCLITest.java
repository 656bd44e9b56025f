package org.carball.probe.cli;

import org.carball.probe.config.OutputFormat;
import org.carball.probe.config.ProbeConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ModelProbeCLITest {

    @TempDir
    Path tempDir;

    @Test
    void shouldParseQueryCommand() {
        // When
        ProbeConfig config = ModelProbeCLI.parseArgs(new String[]{
                "query", "jdbc:olap:test", "EVALUATE INFO.TABLES()", "--max-rows", "50", "--bypass-cache", "-v"});

        // Then
        assertThat(config.getCommand()).isEqualTo("query");
        assertThat(config.getConnectionString()).isEqualTo("jdbc:olap:test");
        assertThat(config.getQuery()).isEqualTo("EVALUATE INFO.TABLES()");
        assertThat(config.getMaxRows()).isEqualTo(50);
        assertThat(config.isBypassCache()).isTrue();
        assertThat(config.isVerbose()).isTrue();
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
    }

    @Test
    void shouldParseProfileCommandWithFiles() throws IOException {
        // Given
        Path modelFile = Files.writeString(tempDir.resolve("model.bim"), "{\"model\": {\"tables\": []}}");
        Path traceFile = Files.writeString(tempDir.resolve("trace.jsonl"), "");

        // When
        ProbeConfig config = ModelProbeCLI.parseArgs(new String[]{
                "PROFILE", "jdbc:olap:test", "EVALUATE 'Sales'",
                "--model-file", modelFile.toString(),
                "--trace-file", traceFile.toString(),
                "--runs", "5",
                "--no-clear-cache",
                "--settings.event-timeout", "10",
                "-f", "both"});

        // Then
        assertThat(config.getCommand()).isEqualTo("profile");
        assertThat(config.getModelFile()).isEqualTo(modelFile);
        assertThat(config.getTraceFile()).isEqualTo(traceFile);
        assertThat(config.getRuns()).isEqualTo(5);
        assertThat(config.isClearCacheFirst()).isFalse();
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.BOTH);
    }

    @Test
    void shouldRejectUnknownCommand() {
        assertThatThrownBy(() -> ModelProbeCLI.parseArgs(new String[]{"explain", "jdbc:olap:test", "x"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown command");
    }

    @Test
    void shouldRejectInvalidOptions() {
        assertThatThrownBy(() -> ModelProbeCLI.parseArgs(new String[]{"query", "c", "q", "--runs", "0"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--runs must be at least 1");
        assertThatThrownBy(() -> ModelProbeCLI.parseArgs(new String[]{"query", "c", "q", "--max-rows", "ten"}))
                .hasMessage("Invalid number for --max-rows: ten");
        assertThatThrownBy(() -> ModelProbeCLI.parseArgs(new String[]{"query", "c", "q", "--format", "xml"}))
                .hasMessageContaining("Invalid output format");
        assertThatThrownBy(() -> ModelProbeCLI.parseArgs(new String[]{"query", "c", "q", "--output"}))
                .hasMessage("Output file not specified");
        assertThatThrownBy(() -> ModelProbeCLI.parseArgs(new String[]{"query", "c", "q", "--color"}))
                .hasMessage("Unknown option: --color");
    }

    @Test
    void shouldRejectMissingFiles() {
        String missing = tempDir.resolve("missing.bim").toString();

        assertThatThrownBy(() -> ModelProbeCLI.parseArgs(new String[]{"query", "c", "q", "--model-file", missing}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Model definition file not found");
    }

    @Test
    void shouldRemoveFileExtension() {
        assertThat(ModelProbeCLI.removeFileExtension("report.json")).isEqualTo("report");
        assertThat(ModelProbeCLI.removeFileExtension("out/report")).isEqualTo("out/report");
        assertThat(ModelProbeCLI.removeFileExtension("out.d/report")).isEqualTo("out.d/report");
        assertThat(ModelProbeCLI.removeFileExtension(".hidden")).isEqualTo(".hidden");
    }
}
