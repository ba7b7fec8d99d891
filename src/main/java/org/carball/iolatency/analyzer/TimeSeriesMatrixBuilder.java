package org.carball.iolatency.analyzer;

import org.carball.iolatency.model.snapshot.DimensionKey;
import org.carball.iolatency.model.snapshot.MatrixCell;
import org.carball.iolatency.model.snapshot.SnapshotRecord;
import org.carball.iolatency.source.SnapshotWindow;

import java.time.LocalDateTime;
import java.util.*;

/**
 * Builds every (snapshot time, database and file role) combination observed in a window, so inactive
 * files show up as zero rows instead of disappearing from the report.
 */
public class TimeSeriesMatrixBuilder {

    /**
     * Crosses the distinct capture times of the in-window snapshots with their distinct dimension keys.
     * Baselines captured before the window contribute neither times nor keys.
     */
    public List<MatrixCell> build(SnapshotWindow window) {
        SortedSet<LocalDateTime> timestamps = new TreeSet<>();
        SortedSet<DimensionKey> keys = new TreeSet<>();
        for (SnapshotRecord snapshot : window.inWindow()) {
            timestamps.add(snapshot.capturedAt());
            keys.add(snapshot.dimensionKey());
        }
        return build(timestamps, keys);
    }

    public List<MatrixCell> build(Collection<LocalDateTime> timestamps, Collection<DimensionKey> keys) {
        SortedSet<LocalDateTime> orderedTimes = new TreeSet<>(timestamps);
        SortedSet<DimensionKey> orderedKeys = new TreeSet<>(keys);

        List<MatrixCell> cells = new ArrayList<>(orderedTimes.size() * orderedKeys.size());
        for (LocalDateTime timestamp : orderedTimes) {
            for (DimensionKey key : orderedKeys) {
                cells.add(new MatrixCell(timestamp, key));
            }
        }
        return cells;
    }
}
