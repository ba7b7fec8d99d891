package org.carball.iolatency.model.snapshot;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Ordered report rows together with the resolved request and analysis window.
 * {@code windowStart} is null for current-state reports.
 */
public record LatencyReportResult(
        AnalysisMode mode,
        String databaseFilter,
        RoleFilter roleFilter,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime windowStart,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime windowEnd,
        List<AggregatedMetric> rows
) {

    public CounterBasis counterBasis() {
        return mode == AnalysisMode.CURRENT ? CounterBasis.CUMULATIVE_SINCE_STARTUP : CounterBasis.INTERVAL;
    }
}
