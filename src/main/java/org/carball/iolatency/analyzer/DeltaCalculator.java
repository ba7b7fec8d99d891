package org.carball.iolatency.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.iolatency.config.AnalyzerSettings;
import org.carball.iolatency.model.snapshot.DeltaRecord;
import org.carball.iolatency.model.snapshot.SnapshotRecord;
import org.carball.iolatency.source.SnapshotWindow;

import java.util.*;

/**
 * Pairs every snapshot inside a window with the previous snapshot of the same file and keeps the
 * counter differences of pairs whose counters did not go backwards.
 *
 * <p>The previous snapshot may lie before the window start, so the first capture inside the window
 * still yields an interval. A snapshot without any earlier capture of its file yields nothing. A pair
 * where any counter decreased is dropped as a whole: the instance restarted or the file was replaced.
 */
@Slf4j
public class DeltaCalculator {

    private static final Comparator<SnapshotRecord> CAPTURE_ORDER = Comparator
            .comparing(SnapshotRecord::capturedAt)
            .thenComparingInt(SnapshotRecord::databaseId)
            .thenComparingInt(SnapshotRecord::fileId);

    private final AnalyzerSettings settings;

    public DeltaCalculator(AnalyzerSettings settings) {
        this.settings = settings;
    }

    public List<DeltaRecord> calculate(SnapshotWindow window) {
        List<SnapshotRecord> ordered = new ArrayList<>(window.allRecords());
        ordered.sort(CAPTURE_ORDER);

        Map<SnapshotRecord.FileKey, SnapshotRecord> lastSeen = new HashMap<>();
        List<DeltaRecord> deltas = new ArrayList<>();
        int withoutPredecessor = 0;
        int resets = 0;

        for (SnapshotRecord current : ordered) {
            SnapshotRecord previous = lastSeen.get(current.fileKey());

            if (previous != null && !previous.capturedAt().isBefore(current.capturedAt())) {
                log.debug("Ignoring duplicate snapshot of file {} at {}", current.fileKey(), current.capturedAt());
                continue;
            }
            lastSeen.put(current.fileKey(), current);

            if (!window.contains(current.capturedAt())) {
                continue;
            }
            if (previous == null) {
                withoutPredecessor++;
                continue;
            }

            DeltaRecord delta = DeltaRecord.between(previous, current);
            if (delta.hasNegativeCounter()) {
                resets++;
                log.debug("Counter reset for file {} between {} and {}, interval skipped",
                        current.fileKey(), previous.capturedAt(), current.capturedAt());
                continue;
            }
            if (isReattached(previous, current)) {
                resets++;
                log.debug("File handle of {} changed between {} and {}, interval skipped",
                        current.fileKey(), previous.capturedAt(), current.capturedAt());
                continue;
            }
            deltas.add(delta);
        }

        log.debug("Computed {} deltas ({} snapshots without predecessor, {} intervals skipped after a reset)",
                deltas.size(), withoutPredecessor, resets);
        return deltas;
    }

    private boolean isReattached(SnapshotRecord previous, SnapshotRecord current) {
        return settings.isDropOnFileHandleChange()
                && previous.fileHandle() != null
                && current.fileHandle() != null
                && !previous.fileHandle().equalsIgnoreCase(current.fileHandle());
    }
}
