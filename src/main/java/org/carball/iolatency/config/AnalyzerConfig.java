package org.carball.iolatency.config;

import lombok.Data;

@Data
public class AnalyzerConfig {
    private String command;
    private String connectionString;
    private String snapshotFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private String thresholdsFile;
    private boolean verbose;
    private AnalyzerSettings settings;
}
