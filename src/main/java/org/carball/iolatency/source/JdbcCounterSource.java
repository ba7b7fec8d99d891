package org.carball.iolatency.source;

import lombok.extern.slf4j.Slf4j;
import org.carball.iolatency.config.AnalyzerSettings;
import org.carball.iolatency.model.snapshot.SnapshotRecord;

import java.sql.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Reads snapshot history from the {@code dbo.reportDiskLatency} table and live counters from
 * {@code sys.dm_io_virtual_file_stats} of a SQL Server instance.
 */
@Slf4j
public class JdbcCounterSource implements CounterSource {

    static final String SNAPSHOT_COLUMNS = """
            snapshot_time, database_id, database_name, file_id, drive, file_type, physical_name,
            num_of_reads, num_of_writes, io_stall_read_ms, io_stall_write_ms, io_stall_total_ms,
            num_of_bytes_read, num_of_bytes_written, file_handle""";

    private static final String WINDOW_SNAPSHOTS = """
        SELECT %s
        FROM dbo.reportDiskLatency
        WHERE snapshot_time BETWEEN ? AND ?
        ORDER BY database_id, file_id, snapshot_time
    """.formatted(SNAPSHOT_COLUMNS);

    // Baselines only for files with a snapshot in the window, one seek on IX_reportDiskLatency_File_Time each
    static final String PREDECESSOR_SNAPSHOTS = """
        SELECT baseline.*
        FROM (
            SELECT DISTINCT database_id, file_id
            FROM dbo.reportDiskLatency
            WHERE snapshot_time BETWEEN ? AND ?
        ) AS windowed
        CROSS APPLY (
            SELECT TOP (1) %s
            FROM dbo.reportDiskLatency AS earlier
            WHERE earlier.database_id = windowed.database_id
              AND earlier.file_id = windowed.file_id
              AND earlier.snapshot_time < ?
            ORDER BY earlier.snapshot_time DESC
        ) AS baseline
    """.formatted(SNAPSHOT_COLUMNS);

    static final String LIVE_FILE_STATS = """
        SELECT
            GETDATE()                       AS snapshot_time,
            vfs.database_id,
            DB_NAME(vfs.database_id)        AS database_name,
            vfs.file_id,
            LEFT(mf.physical_name, 2)       AS drive,
            mf.type_desc                    AS file_type,
            mf.physical_name,
            vfs.num_of_reads,
            vfs.num_of_writes,
            vfs.io_stall_read_ms,
            vfs.io_stall_write_ms,
            vfs.io_stall                    AS io_stall_total_ms,
            vfs.num_of_bytes_read,
            vfs.num_of_bytes_written,
            vfs.file_handle
        FROM sys.dm_io_virtual_file_stats(NULL, NULL) AS vfs
        INNER JOIN sys.master_files AS mf ON vfs.database_id = mf.database_id
                                         AND vfs.file_id     = mf.file_id
        WHERE (? = 1 OR vfs.database_id = 2 OR vfs.database_id > 4)
          AND DB_NAME(vfs.database_id) IS NOT NULL
    """;

    private static final String ENGINE_START_TIME = "SELECT sqlserver_start_time FROM sys.dm_os_sys_info";

    private static final String SERVER_TIME = "SELECT GETDATE()";

    private final String connectionString;
    private final AnalyzerSettings settings;

    public JdbcCounterSource(String connectionString, AnalyzerSettings settings) {
        this.connectionString = connectionString;
        this.settings = settings;
    }

    @Override
    public SnapshotWindow readWindow(LocalDateTime from, LocalDateTime to) throws CounterSourceException {
        try (Connection conn = DriverManager.getConnection(connectionString)) {
            List<SnapshotRecord> inWindow;
            try (PreparedStatement stmt = conn.prepareStatement(WINDOW_SNAPSHOTS)) {
                stmt.setTimestamp(1, Timestamp.valueOf(from));
                stmt.setTimestamp(2, Timestamp.valueOf(to));
                inWindow = readSnapshots(stmt);
            }

            List<SnapshotRecord> predecessors;
            try (PreparedStatement stmt = conn.prepareStatement(PREDECESSOR_SNAPSHOTS)) {
                stmt.setTimestamp(1, Timestamp.valueOf(from));
                stmt.setTimestamp(2, Timestamp.valueOf(to));
                stmt.setTimestamp(3, Timestamp.valueOf(from));
                predecessors = readSnapshots(stmt);
            }

            log.info("Read {} snapshots between {} and {} ({} earlier baselines)",
                    inWindow.size(), from, to, predecessors.size());
            return new SnapshotWindow(from, to, inWindow, predecessors);
        } catch (SQLException e) {
            log.error("Failed to read snapshot history", e);
            throw new CounterSourceException("Snapshot history read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<SnapshotRecord> readCurrent() throws CounterSourceException {
        try (Connection conn = DriverManager.getConnection(connectionString);
             PreparedStatement stmt = conn.prepareStatement(LIVE_FILE_STATS)) {

            stmt.setInt(1, settings.isIncludeSystemDatabases() ? 1 : 0);
            List<SnapshotRecord> records = readSnapshots(stmt);
            log.info("Read live counters for {} files", records.size());
            return records;
        } catch (SQLException e) {
            log.error("Failed to read live file statistics", e);
            throw new CounterSourceException("Live file statistics read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public LocalDateTime readEngineStartTime() throws CounterSourceException {
        try (Connection conn = DriverManager.getConnection(connectionString);
             PreparedStatement stmt = conn.prepareStatement(ENGINE_START_TIME);
             ResultSet rs = stmt.executeQuery()) {

            return rs.next() ? rs.getTimestamp(1).toLocalDateTime() : null;
        } catch (SQLException e) {
            throw new CounterSourceException("Engine start time read failed: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the server's {@code GETDATE()}, the clock the collector stamps snapshots with.
     */
    @Override
    public LocalDateTime readCurrentTime() throws CounterSourceException {
        try (Connection conn = DriverManager.getConnection(connectionString);
             PreparedStatement stmt = conn.prepareStatement(SERVER_TIME);
             ResultSet rs = stmt.executeQuery()) {

            return rs.next() ? rs.getTimestamp(1).toLocalDateTime() : null;
        } catch (SQLException e) {
            throw new CounterSourceException("Server time read failed: " + e.getMessage(), e);
        }
    }

    /**
     * Tests whether the snapshot table is reachable with the configured connection.
     */
    public boolean isSnapshotTableAvailable() throws SQLException {
        String checkQuery = "SELECT CASE WHEN OBJECT_ID(N'dbo.reportDiskLatency', N'U') IS NULL THEN 0 ELSE 1 END";

        try (Connection conn = DriverManager.getConnection(connectionString);
             PreparedStatement stmt = conn.prepareStatement(checkQuery);
             ResultSet rs = stmt.executeQuery()) {

            return rs.next() && rs.getInt(1) == 1;
        }
    }

    private static List<SnapshotRecord> readSnapshots(PreparedStatement stmt) throws SQLException {
        List<SnapshotRecord> results = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                results.add(mapSnapshot(rs));
            }
        }
        return results;
    }

    static SnapshotRecord mapSnapshot(ResultSet rs) throws SQLException {
        byte[] handle = rs.getBytes("file_handle");
        return new SnapshotRecord(
                rs.getTimestamp("snapshot_time").toLocalDateTime(),
                rs.getInt("database_id"),
                rs.getString("database_name"),
                rs.getInt("file_id"),
                rs.getString("drive"),
                rs.getString("file_type"),
                rs.getString("physical_name"),
                rs.getLong("num_of_reads"),
                rs.getLong("num_of_writes"),
                rs.getLong("io_stall_read_ms"),
                rs.getLong("io_stall_write_ms"),
                rs.getLong("io_stall_total_ms"),
                rs.getLong("num_of_bytes_read"),
                rs.getLong("num_of_bytes_written"),
                handle != null ? "0x" + HexFormat.of().withUpperCase().formatHex(handle) : null
        );
    }

    /**
     * Creates a connection string for the local Docker SQL Server archive database.
     */
    public static String createLocalConnectionString() {
        return "jdbc:sqlserver://localhost:1433;databaseName=SqlDba;user=sa;password=TestPassword123!;trustServerCertificate=true;encrypt=false;loginTimeout=30;";
    }
}
