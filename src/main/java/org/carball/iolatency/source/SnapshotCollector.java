package org.carball.iolatency.source;

import lombok.extern.slf4j.Slf4j;
import org.carball.iolatency.config.AnalyzerSettings;
import org.carball.iolatency.model.snapshot.CaptureReceipt;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.*;
import java.time.LocalDateTime;

/**
 * Appends the current per-file counters of a SQL Server instance to {@code dbo.reportDiskLatency}.
 * Meant to run from a scheduler at intervals of an hour or more so each interval carries enough I/O.
 */
@Slf4j
public class SnapshotCollector {

    static final String SCHEMA_RESOURCE = "/schema/report-disk-latency.sql";

    private static final String INSERT_SNAPSHOT = """
        INSERT INTO dbo.reportDiskLatency (
            snapshot_time, database_id, database_name, file_id, drive, file_type, physical_name,
            num_of_reads, num_of_writes, io_stall_read_ms, io_stall_write_ms, io_stall_total_ms,
            num_of_bytes_read, num_of_bytes_written, file_handle
        )
        SELECT
            ?,
            vfs.database_id,
            DB_NAME(vfs.database_id),
            vfs.file_id,
            LEFT(mf.physical_name, 2),
            mf.type_desc,
            mf.physical_name,
            vfs.num_of_reads,
            vfs.num_of_writes,
            vfs.io_stall_read_ms,
            vfs.io_stall_write_ms,
            vfs.io_stall,
            vfs.num_of_bytes_read,
            vfs.num_of_bytes_written,
            vfs.file_handle
        FROM sys.dm_io_virtual_file_stats(NULL, NULL) AS vfs
        INNER JOIN sys.master_files AS mf ON vfs.database_id = mf.database_id
                                         AND vfs.file_id     = mf.file_id
        WHERE (? = 1 OR vfs.database_id = 2 OR vfs.database_id > 4)
          AND DB_NAME(vfs.database_id) IS NOT NULL
    """;

    private final String connectionString;
    private final AnalyzerSettings settings;

    public SnapshotCollector(String connectionString, AnalyzerSettings settings) {
        this.connectionString = connectionString;
        this.settings = settings;
    }

    /**
     * Captures one snapshot round, creating the snapshot table first if it does not exist.
     */
    public CaptureReceipt collect() throws CounterSourceException {
        try (Connection conn = DriverManager.getConnection(connectionString)) {
            ensureSchema(conn);

            LocalDateTime capturedAt = currentServerTime(conn);
            int inserted;
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_SNAPSHOT)) {
                stmt.setTimestamp(1, Timestamp.valueOf(capturedAt));
                stmt.setInt(2, settings.isIncludeSystemDatabases() ? 1 : 0);
                inserted = stmt.executeUpdate();
            }

            log.info("Inserted {} file snapshots captured at {}", inserted, capturedAt);
            return new CaptureReceipt(capturedAt, inserted);
        } catch (SQLException | IOException e) {
            log.error("Snapshot collection failed", e);
            throw new CounterSourceException("Snapshot collection failed: " + e.getMessage(), e);
        }
    }

    private void ensureSchema(Connection conn) throws SQLException, IOException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(loadSchemaScript());
        }
    }

    private static LocalDateTime currentServerTime(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT GETDATE()");
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("Server time query returned no rows");
            }
            return rs.getTimestamp(1).toLocalDateTime();
        }
    }

    static String loadSchemaScript() throws IOException {
        try (InputStream in = SnapshotCollector.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IOException("Schema script not found on classpath: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
