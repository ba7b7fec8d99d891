package org.carball.iolatency.source;

import org.carball.iolatency.model.snapshot.SnapshotRecord;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshots captured inside [from, to] plus, for every file, the last snapshot captured before {@code from}.
 */
public record SnapshotWindow(
        LocalDateTime from,
        LocalDateTime to,
        List<SnapshotRecord> inWindow,
        List<SnapshotRecord> predecessors
) {

    public SnapshotWindow {
        inWindow = List.copyOf(inWindow);
        predecessors = List.copyOf(predecessors);
    }

    public boolean contains(LocalDateTime time) {
        return !time.isBefore(from) && !time.isAfter(to);
    }

    public List<SnapshotRecord> allRecords() {
        List<SnapshotRecord> all = new ArrayList<>(predecessors.size() + inWindow.size());
        all.addAll(predecessors);
        all.addAll(inWindow);
        return all;
    }
}
