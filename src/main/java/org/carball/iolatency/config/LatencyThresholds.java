package org.carball.iolatency.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

@Data
@Slf4j
public class LatencyThresholds {

    @JsonProperty("data_read_latency_ms")
    private double dataReadLatencyMs = 20.0;

    @JsonProperty("data_write_latency_ms")
    private double dataWriteLatencyMs = 10.0;

    @JsonProperty("log_write_latency_ms")
    private double logWriteLatencyMs = 5.0;

    public static LatencyThresholds defaults() {
        return new LatencyThresholds();
    }

    static final String BUNDLED_RESOURCE = "/latency-thresholds.yml";

    /**
     * Loads thresholds from a YAML file, falling back to defaults when the file is absent or unreadable.
     * Without a path the bundled {@code latency-thresholds.yml} is used.
     */
    public static LatencyThresholds load(String configPath) {
        if (configPath == null || configPath.trim().isEmpty()) {
            return loadBundled();
        }

        File configFile = new File(configPath);
        if (!configFile.exists()) {
            log.warn("Latency threshold file not found: {}, using defaults", configPath);
            return defaults();
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            LatencyThresholds thresholds = mapper.readValue(configFile, LatencyThresholds.class);
            log.info("Loaded latency thresholds from: {}", configPath);
            return thresholds;
        } catch (IOException e) {
            log.warn("Failed to load latency thresholds from {}: {}, using defaults", configPath, e.getMessage());
            return defaults();
        }
    }

    private static LatencyThresholds loadBundled() {
        try (InputStream in = LatencyThresholds.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                log.info("No latency threshold file provided, using defaults");
                return defaults();
            }
            return new ObjectMapper(new YAMLFactory()).readValue(in, LatencyThresholds.class);
        } catch (IOException e) {
            log.warn("Failed to load bundled latency thresholds: {}, using defaults", e.getMessage());
            return defaults();
        }
    }

    public String getDescription() {
        return String.format(Locale.ROOT, "Thresholds: dataRead=%.1fms, dataWrite=%.1fms, logWrite=%.1fms",
                dataReadLatencyMs, dataWriteLatencyMs, logWriteLatencyMs);
    }
}
