package org.carball.iolatency.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class AnalyzerSettings {

    public static final int ENGINE_PAGE_SIZE_BYTES = 8192;

    // Page size of the monitored engine; only used for the bytes-to-pages conversion
    @Builder.Default
    private int pageSizeBytes = ENGINE_PAGE_SIZE_BYTES;

    @Builder.Default
    private int defaultLookbackHours = 24;

    // A different file handle between two snapshots means the file was reattached
    @Builder.Default
    private boolean dropOnFileHandleChange = true;

    // master, model and msdb are skipped by the live read unless set
    @Builder.Default
    private boolean includeSystemDatabases = false;

    public static AnalyzerSettings defaults() {
        return AnalyzerSettings.builder().build();
    }

    /**
     * Rejects values the engine cannot work with and logs warnings for unusual ones.
     */
    public void validate() {
        if (pageSizeBytes <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSizeBytes);
        }
        if (defaultLookbackHours <= 0) {
            throw new IllegalArgumentException("Default lookback hours must be positive: " + defaultLookbackHours);
        }
        if (pageSizeBytes != ENGINE_PAGE_SIZE_BYTES) {
            log.warn("Page size {} differs from the engine's {} byte pages, page counts will not match engine pages",
                    pageSizeBytes, ENGINE_PAGE_SIZE_BYTES);
        }

        log.debug("Using settings - page size: {}, lookback: {}h, drop on handle change: {}, system databases: {}",
                pageSizeBytes, defaultLookbackHours, dropOnFileHandleChange, includeSystemDatabases);
    }

    public String getConfigurationSummary() {
        return String.format("Page size: %d | Lookback: %dh | Drop on handle change: %s | System databases: %s",
                pageSizeBytes, defaultLookbackHours, dropOnFileHandleChange, includeSystemDatabases);
    }
}
