package org.carball.iolatency.model.snapshot;

import java.util.Comparator;

/**
 * Reporting column group: one database and one file role.
 */
public record DimensionKey(String databaseName, FileRole fileRole) implements Comparable<DimensionKey> {

    private static final Comparator<DimensionKey> ORDER = Comparator
            .comparing(DimensionKey::databaseName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(DimensionKey::fileRole);

    @Override
    public int compareTo(DimensionKey other) {
        return ORDER.compare(this, other);
    }
}
