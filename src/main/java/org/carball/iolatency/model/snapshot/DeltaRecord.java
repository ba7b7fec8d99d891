package org.carball.iolatency.model.snapshot;

import java.time.LocalDateTime;

/**
 * Counter differences between two adjacent snapshots of the same file. All counters are non-negative.
 */
public record DeltaRecord(
        LocalDateTime intervalEnd,
        LocalDateTime intervalStart,
        String databaseName,
        FileRole fileRole,
        long reads,
        long writes,
        long readStallMs,
        long writeStallMs,
        long totalStallMs,
        long bytesRead,
        long bytesWritten
) {

    public DimensionKey dimensionKey() {
        return new DimensionKey(databaseName, fileRole);
    }

    public boolean hasNegativeCounter() {
        return reads < 0 || writes < 0
                || readStallMs < 0 || writeStallMs < 0 || totalStallMs < 0
                || bytesRead < 0 || bytesWritten < 0;
    }

    /**
     * Subtracts {@code earlier} from {@code later}. The result may contain negative counters.
     */
    public static DeltaRecord between(SnapshotRecord earlier, SnapshotRecord later) {
        return new DeltaRecord(
                later.capturedAt(),
                earlier.capturedAt(),
                later.databaseName(),
                later.fileRole(),
                later.reads() - earlier.reads(),
                later.writes() - earlier.writes(),
                later.readStallMs() - earlier.readStallMs(),
                later.writeStallMs() - earlier.writeStallMs(),
                later.totalStallMs() - earlier.totalStallMs(),
                later.bytesRead() - earlier.bytesRead(),
                later.bytesWritten() - earlier.bytesWritten()
        );
    }

    /**
     * Treats cumulative counters of a live read as activity since engine start.
     */
    public static DeltaRecord sinceStartup(SnapshotRecord current) {
        return new DeltaRecord(
                current.capturedAt(),
                null,
                current.databaseName(),
                current.fileRole(),
                current.reads(),
                current.writes(),
                current.readStallMs(),
                current.writeStallMs(),
                current.totalStallMs(),
                current.bytesRead(),
                current.bytesWritten()
        );
    }
}
