package org.carball.iolatency.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.iolatency.model.snapshot.SnapshotRecord;

import java.io.File;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes snapshots to the JSON export format read by {@link SnapshotFileSource}.
 */
@Slf4j
public class SnapshotJsonExporter {

    private final ObjectMapper objectMapper;

    public SnapshotJsonExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Exports the snapshots of a window, baselines included, plus the live read when one is given.
     */
    public void exportToJson(SnapshotWindow window, List<SnapshotRecord> current, LocalDateTime engineStartTime,
                             String outputPath, String databaseName) throws IOException {
        ObjectNode exportData = objectMapper.createObjectNode();

        ObjectNode metadata = exportData.putObject("export_metadata");
        metadata.put("database_name", databaseName);
        metadata.put("export_timestamp", LocalDateTime.now().toString());
        metadata.put("window_start", window.from().toString());
        metadata.put("window_end", window.to().toString());
        metadata.put("engine_start_time", engineStartTime != null ? engineStartTime.toString() : null);
        metadata.put("total_snapshots", window.predecessors().size() + window.inWindow().size());

        writeSnapshots(exportData.putArray("snapshots"), window.allRecords());
        if (current != null) {
            writeSnapshots(exportData.putArray("current"), current);
        }

        objectMapper.writeValue(new File(outputPath), exportData);
        log.info("Exported {} snapshots to {}", metadata.get("total_snapshots").asInt(), outputPath);
    }

    private static void writeSnapshots(ArrayNode array, List<SnapshotRecord> snapshots) {
        for (SnapshotRecord snapshot : snapshots) {
            ObjectNode node = array.addObject();
            node.put("snapshot_time", snapshot.capturedAt().toString());
            node.put("database_id", snapshot.databaseId());
            node.put("database_name", snapshot.databaseName());
            node.put("file_id", snapshot.fileId());
            node.put("drive", snapshot.drive());
            node.put("file_type", snapshot.fileType());
            node.put("physical_name", snapshot.physicalPath());
            node.put("num_of_reads", snapshot.reads());
            node.put("num_of_writes", snapshot.writes());
            node.put("io_stall_read_ms", snapshot.readStallMs());
            node.put("io_stall_write_ms", snapshot.writeStallMs());
            node.put("io_stall_total_ms", snapshot.totalStallMs());
            node.put("num_of_bytes_read", snapshot.bytesRead());
            node.put("num_of_bytes_written", snapshot.bytesWritten());
            node.put("file_handle", snapshot.fileHandle());
        }
    }
}
