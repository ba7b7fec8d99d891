package org.carball.iolatency.analyzer;

import org.carball.iolatency.config.AnalyzerSettings;
import org.carball.iolatency.model.snapshot.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.iolatency.TestSnapshots.*;

class LatencyAggregatorTest {

    private LatencyAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new LatencyAggregator(AnalyzerSettings.defaults());
    }

    private static DeltaRecord delta(LocalDateTime end, String database, FileRole role,
                                     long reads, long readStall, long writes, long writeStall,
                                     long bytesRead, long bytesWritten) {
        return new DeltaRecord(end, end.minusHours(1), database, role,
                reads, writes, readStall, writeStall, readStall + writeStall, bytesRead, bytesWritten);
    }

    @Test
    void shouldSumFilesOfSameDimensionAndCountThem() {
        // Given - two data files of Sales in the same interval
        List<DeltaRecord> deltas = List.of(
                delta(T1, "Sales", FileRole.DATA, 80, 400, 10, 50, 80 * 8192, 10 * 8192),
                delta(T1, "Sales", FileRole.DATA, 20, 200, 0, 0, 20 * 8192, 0));

        // When
        Map<MatrixCell, AggregatedMetric> metrics = aggregator.aggregateIntervals(deltas);

        // Then
        AggregatedMetric metric = metrics.get(new MatrixCell(T1, new DimensionKey("Sales", FileRole.DATA)));
        assertThat(metrics).hasSize(1);
        assertThat(metric.getTotalReads()).isEqualTo(100);
        assertThat(metric.getTotalWrites()).isEqualTo(10);
        assertThat(metric.getAvgReadLatencyMs()).isEqualTo(6);
        assertThat(metric.getAvgWriteLatencyMs()).isEqualTo(5);
        assertThat(metric.getTotalReadKB()).isEqualTo(800);
        assertThat(metric.getTotalReadPages()).isEqualTo(100);
        assertThat(metric.getTotalWritePages()).isEqualTo(10);
        assertThat(metric.getFileCount()).isEqualTo(2);
        assertThat(metric.getCounterBasis()).isEqualTo(CounterBasis.INTERVAL);
    }

    @Test
    void shouldReportZeroLatencyWhenThereWereNoOperations() {
        // Given
        List<DeltaRecord> deltas = List.of(delta(T1, "Sales", FileRole.LOG, 0, 0, 0, 0, 0, 0));

        // When
        AggregatedMetric metric = aggregator.aggregateIntervals(deltas).values().iterator().next();

        // Then
        assertThat(metric.getAvgReadLatencyMs()).isZero();
        assertThat(metric.getAvgWriteLatencyMs()).isZero();
        assertThat(metric.getAvgTotalLatencyMs()).isZero();
        assertThat(metric.getFileCount()).isEqualTo(1);
    }

    @Test
    void shouldWeightTotalLatencyByOperationVolume() {
        // Given - 100 reads at 1 ms, 1 write at 100 ms
        List<DeltaRecord> deltas = List.of(delta(T1, "Sales", FileRole.DATA, 100, 100, 1, 100, 0, 0));

        // When
        AggregatedMetric metric = aggregator.aggregateIntervals(deltas).values().iterator().next();

        // Then - 200 ms over 101 operations, not the 50.5 ms mean of both averages
        assertThat(metric.getAvgReadLatencyMs()).isEqualTo(1);
        assertThat(metric.getAvgWriteLatencyMs()).isEqualTo(100);
        assertThat(metric.getAvgTotalLatencyMs()).isEqualTo(2);
    }

    @Test
    void shouldRoundKilobytesAndPagesToNearestWhole() {
        // Given - 3 pages plus 5000 bytes read
        long bytesRead = 3 * 8192 + 5000;
        List<DeltaRecord> deltas = List.of(delta(T1, "Sales", FileRole.DATA, 4, 4, 0, 0, bytesRead, 0));

        // When
        AggregatedMetric metric = aggregator.aggregateIntervals(deltas).values().iterator().next();

        // Then
        assertThat(metric.getTotalReadKB()).isEqualTo(29);
        assertThat(metric.getTotalReadPages()).isEqualTo(4);
    }

    @Test
    void shouldUseConfiguredPageSize() {
        // Given
        LatencyAggregator smallPages = new LatencyAggregator(AnalyzerSettings.builder().pageSizeBytes(4096).build());
        List<DeltaRecord> deltas = List.of(delta(T1, "Sales", FileRole.DATA, 1, 1, 0, 0, 8192, 0));

        // When
        AggregatedMetric metric = smallPages.aggregateIntervals(deltas).values().iterator().next();

        // Then
        assertThat(metric.getTotalReadPages()).isEqualTo(2);
        assertThat(metric.getTotalReadKB()).isEqualTo(8);
    }

    @Test
    void shouldKeepIntervalsAndDimensionsSeparate() {
        // Given
        List<DeltaRecord> deltas = List.of(
                delta(T1, "Sales", FileRole.DATA, 10, 10, 0, 0, 0, 0),
                delta(T2, "Sales", FileRole.DATA, 20, 20, 0, 0, 0, 0),
                delta(T2, "Sales", FileRole.LOG, 0, 0, 30, 30, 0, 0));

        // When
        Map<MatrixCell, AggregatedMetric> metrics = aggregator.aggregateIntervals(deltas);

        // Then
        assertThat(metrics.keySet()).containsExactly(
                new MatrixCell(T1, new DimensionKey("Sales", FileRole.DATA)),
                new MatrixCell(T2, new DimensionKey("Sales", FileRole.DATA)),
                new MatrixCell(T2, new DimensionKey("Sales", FileRole.LOG)));
    }

    @Test
    void shouldAggregateCumulativeCountersUnderReadTime() {
        // Given
        LocalDateTime readTime = T2.plusMinutes(5);
        List<SnapshotRecord> current = List.of(
                snapshot(T2, 5, "Sales", 1, "ROWS", 1000, 5000, 200, 400),
                snapshot(T2, 5, "Sales", 3, "ROWS", 500, 500, 0, 0),
                logFile(T2, 5, "Sales", 300, 600));

        // When
        Map<MatrixCell, AggregatedMetric> metrics = aggregator.aggregateCumulative(current, readTime);

        // Then
        AggregatedMetric data = metrics.get(new MatrixCell(readTime, new DimensionKey("Sales", FileRole.DATA)));
        assertThat(data.getCounterBasis()).isEqualTo(CounterBasis.CUMULATIVE_SINCE_STARTUP);
        assertThat(data.getTimestamp()).isEqualTo(readTime);
        assertThat(data.getTotalReads()).isEqualTo(1500);
        assertThat(data.getAvgReadLatencyMs()).isEqualTo(4);
        assertThat(data.getAvgTotalLatencyMs()).isEqualTo(3);
        assertThat(data.getFileCount()).isEqualTo(2);

        AggregatedMetric log = metrics.get(new MatrixCell(readTime, new DimensionKey("Sales", FileRole.LOG)));
        assertThat(log.getAvgWriteLatencyMs()).isEqualTo(2);
        assertThat(log.getFileCount()).isEqualTo(1);
    }
}
