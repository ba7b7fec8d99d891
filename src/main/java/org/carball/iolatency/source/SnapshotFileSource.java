package org.carball.iolatency.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.iolatency.model.snapshot.SnapshotRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Reads snapshot history from an exported JSON file instead of connecting to the archive database.
 */
@Slf4j
public class SnapshotFileSource implements CounterSource {

    private final List<SnapshotRecord> snapshots;
    private final List<SnapshotRecord> current;
    private final ExportMetadata metadata;

    public SnapshotFileSource(String filePath) throws CounterSourceException {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            throw new CounterSourceException("Snapshot export file not found: " + filePath);
        }

        try {
            JsonNode exportData = new ObjectMapper().readTree(Files.readString(path));
            validateExportFormat(exportData);

            this.metadata = parseMetadata(exportData.get("export_metadata"));
            this.snapshots = parseSnapshots(exportData.get("snapshots"));
            this.current = exportData.has("current") ? parseSnapshots(exportData.get("current")) : null;
        } catch (IOException | IllegalStateException | DateTimeParseException e) {
            throw new CounterSourceException("Invalid snapshot export file " + filePath + ": " + e.getMessage(), e);
        }

        log.info("Loaded {} snapshots from {}", snapshots.size(), filePath);
    }

    @Override
    public SnapshotWindow readWindow(LocalDateTime from, LocalDateTime to) {
        List<SnapshotRecord> inWindow = new ArrayList<>();
        Map<SnapshotRecord.FileKey, SnapshotRecord> latestBefore = new HashMap<>();

        for (SnapshotRecord snapshot : snapshots) {
            LocalDateTime capturedAt = snapshot.capturedAt();
            if (capturedAt.isBefore(from)) {
                latestBefore.merge(snapshot.fileKey(), snapshot,
                        (a, b) -> a.capturedAt().isAfter(b.capturedAt()) ? a : b);
            } else if (!capturedAt.isAfter(to)) {
                inWindow.add(snapshot);
            }
        }

        return new SnapshotWindow(from, to, inWindow, new ArrayList<>(latestBefore.values()));
    }

    /**
     * Returns the exported live read when the file has one, otherwise each file's latest snapshot.
     */
    @Override
    public List<SnapshotRecord> readCurrent() {
        if (current != null) {
            return current;
        }

        Map<SnapshotRecord.FileKey, SnapshotRecord> latest = new LinkedHashMap<>();
        for (SnapshotRecord snapshot : snapshots) {
            latest.merge(snapshot.fileKey(), snapshot,
                    (a, b) -> a.capturedAt().isAfter(b.capturedAt()) ? a : b);
        }
        return new ArrayList<>(latest.values());
    }

    @Override
    public LocalDateTime readEngineStartTime() {
        return metadata.engineStartTime();
    }

    /**
     * Returns the end of the exported window, falling back to the export timestamp, so reports over an
     * export are anchored at the time it was taken.
     */
    @Override
    public LocalDateTime readCurrentTime() {
        if (metadata.windowEnd() != null) {
            return metadata.windowEnd();
        }
        try {
            return LocalDateTime.parse(metadata.exportTimestamp());
        } catch (DateTimeParseException e) {
            log.debug("Export timestamp {} is not a local date-time, no source time available", metadata.exportTimestamp());
            return null;
        }
    }

    public ExportMetadata getExportMetadata() {
        return metadata;
    }

    public int getSnapshotCount() {
        return snapshots.size();
    }

    private static void validateExportFormat(JsonNode exportData) {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in export file");
        }

        JsonNode metadata = exportData.get("export_metadata");
        if (metadata == null) {
            throw new IllegalStateException("Missing export_metadata section in export file");
        }

        JsonNode snapshots = exportData.get("snapshots");
        if (snapshots == null || !snapshots.isArray()) {
            throw new IllegalStateException("Missing or invalid snapshots section in export file");
        }

        String[] requiredFields = {"database_name", "export_timestamp"};
        for (String field : requiredFields) {
            if (!metadata.has(field)) {
                throw new IllegalStateException("Missing required metadata field: " + field);
            }
        }
    }

    private static ExportMetadata parseMetadata(JsonNode metadata) {
        JsonNode version = metadata.get("sql_server_version");
        return new ExportMetadata(
                metadata.get("database_name").asText(),
                metadata.get("export_timestamp").asText(),
                version != null ? version.asText() : null,
                optionalTime(metadata, "engine_start_time"),
                optionalTime(metadata, "window_end")
        );
    }

    private static LocalDateTime optionalTime(JsonNode node, String field) {
        String value = text(node, field);
        return value != null ? LocalDateTime.parse(value) : null;
    }

    private static List<SnapshotRecord> parseSnapshots(JsonNode array) {
        List<SnapshotRecord> results = new ArrayList<>();
        for (JsonNode node : array) {
            results.add(parseSnapshotFromJson(node));
        }
        return results;
    }

    private static SnapshotRecord parseSnapshotFromJson(JsonNode node) {
        return new SnapshotRecord(
                LocalDateTime.parse(required(node, "snapshot_time").asText()),
                required(node, "database_id").asInt(),
                required(node, "database_name").asText(),
                required(node, "file_id").asInt(),
                text(node, "drive"),
                required(node, "file_type").asText(),
                text(node, "physical_name"),
                required(node, "num_of_reads").asLong(),
                required(node, "num_of_writes").asLong(),
                required(node, "io_stall_read_ms").asLong(),
                required(node, "io_stall_write_ms").asLong(),
                required(node, "io_stall_total_ms").asLong(),
                required(node, "num_of_bytes_read").asLong(),
                required(node, "num_of_bytes_written").asLong(),
                text(node, "file_handle")
        );
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalStateException("Snapshot entry is missing field: " + field);
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    /**
     * Metadata about the snapshot export.
     */
    public record ExportMetadata(String databaseName, String exportTimestamp, String sqlServerVersion,
                                 LocalDateTime engineStartTime, LocalDateTime windowEnd) {

        @Override
        public String toString() {
            return String.format("ExportMetadata{database='%s', timestamp='%s', version='%s', engineStart=%s, windowEnd=%s}",
                    databaseName, exportTimestamp, sqlServerVersion, engineStartTime, windowEnd);
        }
    }
}
