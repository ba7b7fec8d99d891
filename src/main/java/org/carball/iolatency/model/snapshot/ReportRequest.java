package org.carball.iolatency.model.snapshot;

import lombok.Builder;
import lombok.Data;

/**
 * Parameters of one latency report.
 */
@Data
@Builder(toBuilder = true)
public class ReportRequest {

    @Builder.Default
    private AnalysisMode mode = AnalysisMode.HISTORICAL;

    // Only meaningful for historical mode; null falls back to the configured default.
    private Integer lookbackHours;

    private String databaseName;

    @Builder.Default
    private RoleFilter roleFilter = RoleFilter.ALL;

    public boolean matches(DimensionKey key) {
        return (databaseName == null || databaseName.equals(key.databaseName()))
                && (roleFilter == null || roleFilter.accepts(key.fileRole()));
    }
}
