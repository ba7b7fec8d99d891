package org.carball.iolatency.model.snapshot;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * One (time, dimension) position of the dense report.
 */
public record MatrixCell(LocalDateTime timestamp, DimensionKey key) implements Comparable<MatrixCell> {

    private static final Comparator<MatrixCell> ORDER = Comparator
            .comparing(MatrixCell::timestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(MatrixCell::key);

    @Override
    public int compareTo(MatrixCell other) {
        return ORDER.compare(this, other);
    }
}
