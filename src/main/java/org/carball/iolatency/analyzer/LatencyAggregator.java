package org.carball.iolatency.analyzer;

import org.carball.iolatency.config.AnalyzerSettings;
import org.carball.iolatency.model.snapshot.*;

import java.time.LocalDateTime;
import java.util.*;

/**
 * Sums counters per time and dimension and derives latency averages, KB and page counts.
 *
 * <p>Averages are stall time divided by operation count, rounded to whole milliseconds, and 0 when
 * there were no operations. The total average divides the combined stall by reads plus writes.
 */
public class LatencyAggregator {

    private final AnalyzerSettings settings;

    public LatencyAggregator(AnalyzerSettings settings) {
        this.settings = settings;
    }

    /**
     * Aggregates interval deltas by interval end and dimension.
     */
    public Map<MatrixCell, AggregatedMetric> aggregateIntervals(List<DeltaRecord> deltas) {
        Map<MatrixCell, Accumulator> groups = new TreeMap<>();
        for (DeltaRecord delta : deltas) {
            groups.computeIfAbsent(new MatrixCell(delta.intervalEnd(), delta.dimensionKey()), cell -> new Accumulator())
                    .add(delta);
        }
        return toMetrics(groups, CounterBasis.INTERVAL);
    }

    /**
     * Aggregates a live read by dimension, treating the cumulative counters as activity since engine start.
     * All rows carry {@code readTime} as their timestamp.
     */
    public Map<MatrixCell, AggregatedMetric> aggregateCumulative(List<SnapshotRecord> current, LocalDateTime readTime) {
        Map<MatrixCell, Accumulator> groups = new TreeMap<>();
        for (SnapshotRecord snapshot : current) {
            groups.computeIfAbsent(new MatrixCell(readTime, snapshot.dimensionKey()), cell -> new Accumulator())
                    .add(DeltaRecord.sinceStartup(snapshot));
        }
        return toMetrics(groups, CounterBasis.CUMULATIVE_SINCE_STARTUP);
    }

    private Map<MatrixCell, AggregatedMetric> toMetrics(Map<MatrixCell, Accumulator> groups, CounterBasis basis) {
        Map<MatrixCell, AggregatedMetric> metrics = new LinkedHashMap<>();
        groups.forEach((cell, acc) -> metrics.put(cell, acc.toMetric(cell, basis, settings.getPageSizeBytes())));
        return metrics;
    }

    static long averageMs(long stallMs, long operations) {
        return operations == 0 ? 0 : Math.round((double) stallMs / operations);
    }

    static long divideRounded(long bytes, long unit) {
        return Math.round((double) bytes / unit);
    }

    private static final class Accumulator {
        private long reads;
        private long writes;
        private long readStallMs;
        private long writeStallMs;
        private long totalStallMs;
        private long bytesRead;
        private long bytesWritten;
        private int fileCount;

        void add(DeltaRecord delta) {
            reads += delta.reads();
            writes += delta.writes();
            readStallMs += delta.readStallMs();
            writeStallMs += delta.writeStallMs();
            totalStallMs += delta.totalStallMs();
            bytesRead += delta.bytesRead();
            bytesWritten += delta.bytesWritten();
            fileCount++;
        }

        AggregatedMetric toMetric(MatrixCell cell, CounterBasis basis, int pageSizeBytes) {
            return AggregatedMetric.builder()
                    .timestamp(cell.timestamp())
                    .databaseName(cell.key().databaseName())
                    .fileRole(cell.key().fileRole())
                    .counterBasis(basis)
                    .avgReadLatencyMs(averageMs(readStallMs, reads))
                    .avgWriteLatencyMs(averageMs(writeStallMs, writes))
                    .avgTotalLatencyMs(averageMs(totalStallMs, reads + writes))
                    .totalReads(reads)
                    .totalWrites(writes)
                    .totalReadKB(divideRounded(bytesRead, 1024))
                    .totalWriteKB(divideRounded(bytesWritten, 1024))
                    .totalReadPages(divideRounded(bytesRead, pageSizeBytes))
                    .totalWritePages(divideRounded(bytesWritten, pageSizeBytes))
                    .fileCount(fileCount)
                    .build();
        }
    }
}
