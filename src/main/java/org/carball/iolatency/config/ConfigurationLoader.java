package org.carball.iolatency.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > defaults
     */
    public AnalyzerSettings loadSettings(String[] args) {
        log.debug("Loading analyzer settings");

        AnalyzerSettings.AnalyzerSettingsBuilder builder = AnalyzerSettings.defaults().toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        AnalyzerSettings settings = builder.build();
        settings.validate();

        log.info("Settings loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    private void applyEnvironmentVariables(AnalyzerSettings.AnalyzerSettingsBuilder builder) {
        if (environment.containsKey("IOLAT_PAGE_SIZE")) {
            builder.pageSizeBytes(parseInt("IOLAT_PAGE_SIZE", environment.get("IOLAT_PAGE_SIZE")));
        }
        if (environment.containsKey("IOLAT_LOOKBACK_HOURS")) {
            builder.defaultLookbackHours(parseInt("IOLAT_LOOKBACK_HOURS", environment.get("IOLAT_LOOKBACK_HOURS")));
        }
        if (environment.containsKey("IOLAT_DROP_ON_HANDLE_CHANGE")) {
            builder.dropOnFileHandleChange(Boolean.parseBoolean(environment.get("IOLAT_DROP_ON_HANDLE_CHANGE")));
        }
        if (environment.containsKey("IOLAT_INCLUDE_SYSTEM_DATABASES")) {
            builder.includeSystemDatabases(Boolean.parseBoolean(environment.get("IOLAT_INCLUDE_SYSTEM_DATABASES")));
        }
    }

    private void applyCLIArguments(AnalyzerSettings.AnalyzerSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--settings.page-size":
                    builder.pageSizeBytes(parseInt(arg, value));
                    break;
                case "--settings.lookback-hours":
                    builder.defaultLookbackHours(parseInt(arg, value));
                    break;
                case "--settings.drop-on-handle-change":
                    builder.dropOnFileHandleChange(Boolean.parseBoolean(value));
                    break;
                case "--settings.include-system-databases":
                    builder.includeSystemDatabases(Boolean.parseBoolean(value));
                    break;
            }
        }
    }

    private static int parseInt(String source, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + source + ": " + value);
        }
    }

    /**
     * Returns help text for settings options.
     */
    public static String getSettingsHelp() {
        return """
            Settings Options:

            CLI Arguments:
              --settings.page-size <bytes>                  Page size used for page counts (default 8192)
              --settings.lookback-hours <num>               Lookback used when --hours is omitted (default 24)
              --settings.drop-on-handle-change <bool>       Skip intervals where the file handle changed (default true)
              --settings.include-system-databases <bool>    Include master, model and msdb in live reads (default false)

            Environment Variables:
              IOLAT_PAGE_SIZE                      Same as --settings.page-size
              IOLAT_LOOKBACK_HOURS                 Same as --settings.lookback-hours
              IOLAT_DROP_ON_HANDLE_CHANGE          Same as --settings.drop-on-handle-change
              IOLAT_INCLUDE_SYSTEM_DATABASES       Same as --settings.include-system-databases

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Built-in defaults
            """;
    }
}
