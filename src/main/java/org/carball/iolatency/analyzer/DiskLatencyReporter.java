package org.carball.iolatency.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.iolatency.config.AnalyzerSettings;
import org.carball.iolatency.model.snapshot.*;
import org.carball.iolatency.source.CounterSource;
import org.carball.iolatency.source.CounterSourceException;
import org.carball.iolatency.source.SnapshotWindow;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Entry point for disk latency reports.
 *
 * <p>Historical mode rebuilds per-interval statistics from stored snapshots over the last
 * {@code lookbackHours} and returns one row per snapshot time, database and file role, zero-filled where
 * a file had no usable interval. Current mode aggregates the live counters accumulated since engine start.
 * The two modes measure different things; each row carries its {@link CounterBasis}.
 */
@Slf4j
public class DiskLatencyReporter {

    private static final Comparator<AggregatedMetric> HISTORICAL_ORDER = Comparator
            .comparing(AggregatedMetric::getTimestamp)
            .thenComparing(AggregatedMetric::dimensionKey);

    private static final Comparator<AggregatedMetric> CURRENT_ORDER = Comparator
            .comparing(AggregatedMetric::dimensionKey);

    private final CounterSource counterSource;
    private final AnalyzerSettings settings;
    private final Clock clock;
    private final DeltaCalculator deltaCalculator;
    private final TimeSeriesMatrixBuilder matrixBuilder;
    private final LatencyAggregator aggregator;

    public DiskLatencyReporter(CounterSource counterSource, AnalyzerSettings settings) {
        this(counterSource, settings, Clock.systemDefaultZone());
    }

    public DiskLatencyReporter(CounterSource counterSource, AnalyzerSettings settings, Clock clock) {
        this.counterSource = counterSource;
        this.settings = settings != null ? settings : AnalyzerSettings.defaults();
        this.clock = clock;
        this.deltaCalculator = new DeltaCalculator(this.settings);
        this.matrixBuilder = new TimeSeriesMatrixBuilder();
        this.aggregator = new LatencyAggregator(this.settings);
    }

    /**
     * Builds a report from raw request values as they arrive from a caller.
     *
     * @param mode          {@code historical} or {@code current}
     * @param lookbackHours hours to look back in historical mode, null for the configured default
     * @param databaseName  exact database name, null for all databases
     * @param fileType      {@code data}, {@code log}, {@code all} or null
     */
    public LatencyReportResult report(String mode, Integer lookbackHours, String databaseName, String fileType)
            throws CounterSourceException {
        ReportRequest request = ReportRequest.builder()
                .mode(AnalysisMode.fromName(mode))
                .lookbackHours(lookbackHours)
                .databaseName(databaseName)
                .roleFilter(RoleFilter.fromName(fileType))
                .build();
        return report(request);
    }

    public LatencyReportResult report(ReportRequest request) throws CounterSourceException {
        if (request != null && request.getRoleFilter() == null) {
            request = request.toBuilder().roleFilter(RoleFilter.ALL).build();
        }
        validate(request);

        return switch (request.getMode()) {
            case HISTORICAL -> historicalReport(request);
            case CURRENT -> currentReport(request);
        };
    }

    private LatencyReportResult historicalReport(ReportRequest request) throws CounterSourceException {
        int hours = request.getLookbackHours() != null ? request.getLookbackHours() : settings.getDefaultLookbackHours();
        LocalDateTime windowEnd = currentTime();
        LocalDateTime windowStart = windowEnd.minusHours(hours);

        log.info("Building historical report for {} to {}", windowStart, windowEnd);
        SnapshotWindow window = counterSource.readWindow(windowStart, windowEnd);

        List<DeltaRecord> deltas = deltaCalculator.calculate(window);
        Map<MatrixCell, AggregatedMetric> aggregated = aggregator.aggregateIntervals(deltas);
        List<MatrixCell> matrix = matrixBuilder.build(window);

        List<AggregatedMetric> rows = new ArrayList<>();
        for (MatrixCell cell : matrix) {
            if (!request.matches(cell.key())) {
                continue;
            }
            AggregatedMetric metric = aggregated.get(cell);
            rows.add(metric != null ? metric : AggregatedMetric.empty(cell.timestamp(), cell.key(), CounterBasis.INTERVAL));
        }
        rows.sort(HISTORICAL_ORDER);

        log.info("Historical report: {} rows from {} snapshots and {} intervals", rows.size(),
                window.inWindow().size(), deltas.size());
        return new LatencyReportResult(AnalysisMode.HISTORICAL, request.getDatabaseName(), request.getRoleFilter(),
                windowStart, windowEnd, rows);
    }

    private LatencyReportResult currentReport(ReportRequest request) throws CounterSourceException {
        LocalDateTime readTime = currentTime();

        log.info("Building current-state report from live counters");
        List<SnapshotRecord> current = counterSource.readCurrent();

        List<AggregatedMetric> rows = new ArrayList<>();
        for (AggregatedMetric metric : aggregator.aggregateCumulative(current, readTime).values()) {
            if (request.matches(metric.dimensionKey())) {
                rows.add(metric);
            }
        }
        rows.sort(CURRENT_ORDER);

        log.info("Current-state report: {} rows from {} files", rows.size(), current.size());
        return new LatencyReportResult(AnalysisMode.CURRENT, request.getDatabaseName(), request.getRoleFilter(),
                null, readTime, rows);
    }

    /**
     * "Now" on the clock the snapshots were stamped with; the local clock only when the source cannot tell.
     */
    private LocalDateTime currentTime() throws CounterSourceException {
        LocalDateTime sourceTime = counterSource.readCurrentTime();
        if (sourceTime == null) {
            log.debug("Counter source has no clock, using local time");
            return LocalDateTime.now(clock);
        }
        return sourceTime;
    }

    private void validate(ReportRequest request) {
        if (request == null || request.getMode() == null) {
            throw new IllegalArgumentException("Analysis mode is required. Use: historical or current");
        }
        if (counterSource == null) {
            throw new IllegalArgumentException(request.getMode() == AnalysisMode.HISTORICAL
                    ? "A snapshot store is required for historical analysis"
                    : "A counter source is required for current-state analysis");
        }
        if (request.getMode() == AnalysisMode.HISTORICAL
                && request.getLookbackHours() != null && request.getLookbackHours() <= 0) {
            throw new IllegalArgumentException("Lookback hours must be a positive number: " + request.getLookbackHours());
        }
    }
}
