package org.carball.iolatency.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.iolatency.model.snapshot.AggregatedMetric;
import org.carball.iolatency.model.snapshot.AnalysisMode;
import org.carball.iolatency.model.snapshot.LatencyReportResult;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Slf4j
public class LatencyReport {

    static final DateTimeFormatter ROW_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final LatencyReportResult result;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public LatencyReport(LatencyReportResult result) {
        this.result = result;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(new ReportData(timestamp, result.counterBasis().name(), result));
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Disk Latency Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Mode:** ").append(result.mode() == AnalysisMode.HISTORICAL ? "Historical" : "Current state").append("  \n");
        if (result.windowStart() != null) {
            md.append("**Window:** ").append(result.windowStart().format(ROW_TIME))
                    .append(" to ").append(result.windowEnd().format(ROW_TIME)).append("  \n");
        }
        md.append("**Database:** ").append(result.databaseFilter() != null ? result.databaseFilter() : "all").append("  \n");
        md.append("**File type:** ").append(result.roleFilter().name().toLowerCase()).append("  \n\n");

        if (result.mode() == AnalysisMode.CURRENT) {
            md.append("> Values are cumulative since the last engine start, not per interval.\n\n");
        }

        List<AggregatedMetric> rows = result.rows();
        if (rows.isEmpty()) {
            md.append("**No snapshot data matched the request.**\n");
            return md.toString();
        }

        md.append("| DateTime | Database | FileType | AvgRead ms | AvgWrite ms | AvgTotal ms | Reads | Writes | Read KB | Write KB | Read Pages | Write Pages | Files |\n");
        md.append("|----------|----------|----------|-----------:|------------:|------------:|------:|-------:|--------:|---------:|-----------:|------------:|------:|\n");
        for (AggregatedMetric row : rows) {
            md.append("| ").append(row.getTimestamp() != null ? row.getTimestamp().format(ROW_TIME) : "")
                    .append(" | ").append(row.getDatabaseName())
                    .append(" | ").append(row.getFileRole().getDisplayName())
                    .append(" | ").append(row.getAvgReadLatencyMs())
                    .append(" | ").append(row.getAvgWriteLatencyMs())
                    .append(" | ").append(row.getAvgTotalLatencyMs())
                    .append(" | ").append(row.getTotalReads())
                    .append(" | ").append(row.getTotalWrites())
                    .append(" | ").append(row.getTotalReadKB())
                    .append(" | ").append(row.getTotalWriteKB())
                    .append(" | ").append(row.getTotalReadPages())
                    .append(" | ").append(row.getTotalWritePages())
                    .append(" | ").append(row.getFileCount())
                    .append(" |\n");
        }

        return md.toString();
    }

    record ReportData(LocalDateTime generatedAt, String counterBasis, LatencyReportResult report) {}
}
