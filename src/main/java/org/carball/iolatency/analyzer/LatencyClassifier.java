package org.carball.iolatency.analyzer;

import org.carball.iolatency.config.LatencyThresholds;
import org.carball.iolatency.model.snapshot.AggregatedMetric;
import org.carball.iolatency.model.snapshot.FileRole;
import org.carball.iolatency.model.snapshot.PerformanceStatus;

/**
 * Labels latencies against the configured limits. Data files are checked for reads first, then writes;
 * log files only for writes.
 */
public class LatencyClassifier {

    private final LatencyThresholds thresholds;

    public LatencyClassifier(LatencyThresholds thresholds) {
        this.thresholds = thresholds != null ? thresholds : LatencyThresholds.defaults();
    }

    public PerformanceStatus classify(FileRole role, double avgReadLatencyMs, double avgWriteLatencyMs) {
        if (role == FileRole.DATA && avgReadLatencyMs > thresholds.getDataReadLatencyMs()) {
            return PerformanceStatus.HIGH_READ_LATENCY;
        }
        if (role == FileRole.DATA && avgWriteLatencyMs > thresholds.getDataWriteLatencyMs()) {
            return PerformanceStatus.HIGH_WRITE_LATENCY;
        }
        if (role == FileRole.LOG && avgWriteLatencyMs > thresholds.getLogWriteLatencyMs()) {
            return PerformanceStatus.HIGH_LOG_WRITE_LATENCY;
        }
        return PerformanceStatus.OK;
    }

    public PerformanceStatus classify(AggregatedMetric metric) {
        return classify(metric.getFileRole(), metric.getAvgReadLatencyMs(), metric.getAvgWriteLatencyMs());
    }
}
