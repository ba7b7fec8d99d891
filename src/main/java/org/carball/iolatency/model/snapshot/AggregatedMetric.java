package org.carball.iolatency.model.snapshot;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One report row: the I/O activity of one database and file role at one point in time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AggregatedMetric {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime timestamp;
    private String databaseName;
    private FileRole fileRole;
    private CounterBasis counterBasis;

    private long avgReadLatencyMs;
    private long avgWriteLatencyMs;
    private long avgTotalLatencyMs;
    private long totalReads;
    private long totalWrites;
    private long totalReadKB;
    private long totalWriteKB;
    private long totalReadPages;
    private long totalWritePages;
    private int fileCount;

    public DimensionKey dimensionKey() {
        return new DimensionKey(databaseName, fileRole);
    }

    /**
     * A row with every numeric field at zero, used where a matrix cell has no delta.
     */
    public static AggregatedMetric empty(LocalDateTime timestamp, DimensionKey key, CounterBasis basis) {
        return AggregatedMetric.builder()
                .timestamp(timestamp)
                .databaseName(key.databaseName())
                .fileRole(key.fileRole())
                .counterBasis(basis)
                .build();
    }
}
