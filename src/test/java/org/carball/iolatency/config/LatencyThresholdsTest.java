package org.carball.iolatency.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LatencyThresholdsTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldUseDefaultsWithoutFile() {
        LatencyThresholds thresholds = LatencyThresholds.load(null);

        assertThat(thresholds.getDataReadLatencyMs()).isEqualTo(20.0);
        assertThat(thresholds.getDataWriteLatencyMs()).isEqualTo(10.0);
        assertThat(thresholds.getLogWriteLatencyMs()).isEqualTo(5.0);
    }

    @Test
    void shouldFallBackToDefaultsForMissingFile() {
        LatencyThresholds thresholds = LatencyThresholds.load(tempDir.resolve("missing.yml").toString());

        assertThat(thresholds).isEqualTo(LatencyThresholds.defaults());
    }

    @Test
    void shouldLoadYamlAndKeepDefaultsForOmittedKeys() throws IOException {
        // Given
        Path file = tempDir.resolve("thresholds.yml");
        Files.writeString(file, "data_read_latency_ms: 15\nlog_write_latency_ms: 2.5\n");

        // When
        LatencyThresholds thresholds = LatencyThresholds.load(file.toString());

        // Then
        assertThat(thresholds.getDataReadLatencyMs()).isEqualTo(15.0);
        assertThat(thresholds.getLogWriteLatencyMs()).isEqualTo(2.5);
        assertThat(thresholds.getDataWriteLatencyMs()).isEqualTo(10.0);
        assertThat(thresholds.getDescription()).contains("dataRead=15.0ms", "logWrite=2.5ms");
    }

    @Test
    void shouldFallBackToDefaultsForMalformedYaml() throws IOException {
        // Given
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "data_read_latency_ms: [not, a, number\n");

        // When
        LatencyThresholds thresholds = LatencyThresholds.load(file.toString());

        // Then
        assertThat(thresholds).isEqualTo(LatencyThresholds.defaults());
    }
}
