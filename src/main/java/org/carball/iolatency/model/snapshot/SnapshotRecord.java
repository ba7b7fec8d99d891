package org.carball.iolatency.model.snapshot;

import java.time.LocalDateTime;

/**
 * Cumulative I/O counters of one database file at one capture time.
 * Identity is (capturedAt, databaseId, fileId); counters only grow between captures
 * unless the instance restarted or the file was reattached.
 */
public record SnapshotRecord(
        LocalDateTime capturedAt,
        int databaseId,
        String databaseName,
        int fileId,
        String drive,
        String fileType,
        String physicalPath,
        long reads,
        long writes,
        long readStallMs,
        long writeStallMs,
        long totalStallMs,
        long bytesRead,
        long bytesWritten,
        String fileHandle
) {

    public FileRole fileRole() {
        return FileRole.fromTypeDesc(fileType);
    }

    public FileKey fileKey() {
        return new FileKey(databaseId, fileId);
    }

    public DimensionKey dimensionKey() {
        return new DimensionKey(databaseName, fileRole());
    }

    /**
     * Identifies one physical file across snapshots.
     */
    public record FileKey(int databaseId, int fileId) {}
}
