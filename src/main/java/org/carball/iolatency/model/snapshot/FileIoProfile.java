package org.carball.iolatency.model.snapshot;

import lombok.Builder;
import lombok.Data;

/**
 * Per-file I/O characteristics derived from counters accumulated since engine start.
 */
@Data
@Builder
public class FileIoProfile {
    private String databaseName;
    private int fileId;
    private String physicalPath;
    private FileRole fileRole;

    private double readGB;
    private double writeGB;
    private double readPercentage;
    private double writePercentage;
    private long readCount;
    private long writeCount;
    private double avgReadSizeKB;
    private double avgWriteSizeKB;

    private double avgReadLatencyMs;
    private double avgWriteLatencyMs;
    private double avgTotalLatencyMs;
    private long totalReadStallMs;
    private long totalWriteStallMs;
    private long totalStallMs;

    private double avgIops;
    private double estimatedPeakIops;
    private PerformanceStatus performanceStatus;
}
