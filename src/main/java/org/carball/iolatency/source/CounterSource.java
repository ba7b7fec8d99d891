package org.carball.iolatency.source;

import org.carball.iolatency.model.snapshot.SnapshotRecord;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Supplies cumulative per-file I/O counters, either from stored snapshots or from a live read.
 */
public interface CounterSource {

    /**
     * Reads the stored snapshots captured between {@code from} and {@code to} (both inclusive),
     * together with the most recent snapshot captured before {@code from} of at least every file
     * that has a snapshot in the window.
     */
    SnapshotWindow readWindow(LocalDateTime from, LocalDateTime to) throws CounterSourceException;

    /**
     * Reads the counters accumulated since engine start, one record per file.
     */
    List<SnapshotRecord> readCurrent() throws CounterSourceException;

    /**
     * Returns when the engine last started, or null when the source does not know.
     */
    LocalDateTime readEngineStartTime() throws CounterSourceException;

    /**
     * Returns "now" on the clock the snapshot times were taken with, or null when the source does not know.
     */
    LocalDateTime readCurrentTime() throws CounterSourceException;
}
