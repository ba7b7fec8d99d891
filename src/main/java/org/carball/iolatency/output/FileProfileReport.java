package org.carball.iolatency.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.carball.iolatency.model.snapshot.FileIoProfile;
import org.carball.iolatency.model.snapshot.PerformanceStatus;

import java.util.List;

@Slf4j
public class FileProfileReport {

    private final List<FileIoProfile> profiles;
    private final ObjectMapper objectMapper;

    public FileProfileReport(List<FileIoProfile> profiles) {
        this.profiles = profiles;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(profiles);
        } catch (Exception e) {
            log.error("Error generating JSON file profile", e);
            throw new RuntimeException("Failed to generate JSON file profile", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        md.append("# Database File I/O Profile\n\n");

        long flagged = profiles.stream()
                .filter(p -> p.getPerformanceStatus() != PerformanceStatus.OK)
                .count();
        md.append("**Files with I/O:** ").append(profiles.size()).append("  \n");
        md.append("**Files above latency thresholds:** ").append(flagged).append("\n\n");

        md.append("| Database | File | Type | Read % | Write % | Avg Read KB | Avg Write KB | Read ms | Write ms | Total ms | Avg IOPS | Peak IOPS | Status |\n");
        md.append("|----------|------|------|-------:|--------:|------------:|-------------:|--------:|---------:|---------:|---------:|----------:|--------|\n");
        for (FileIoProfile p : profiles) {
            md.append(String.format("| %s | %s | %s | %.0f | %.0f | %.2f | %.2f | %.2f | %.2f | %.2f | %.2f | %.2f | %s |\n",
                    p.getDatabaseName(), p.getPhysicalPath(), p.getFileRole().getDisplayName(),
                    p.getReadPercentage(), p.getWritePercentage(),
                    p.getAvgReadSizeKB(), p.getAvgWriteSizeKB(),
                    p.getAvgReadLatencyMs(), p.getAvgWriteLatencyMs(), p.getAvgTotalLatencyMs(),
                    p.getAvgIops(), p.getEstimatedPeakIops(),
                    p.getPerformanceStatus().getDisplayName()));
        }
        return md.toString();
    }
}
