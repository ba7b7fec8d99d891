package org.carball.iolatency.source;

import org.carball.iolatency.config.AnalyzerSettings;
import org.carball.iolatency.model.snapshot.SnapshotRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for JdbcCounterSource.
 * Note: the database tests require the Docker SQL Server with the SqlDba archive database running.
 */
class JdbcCounterSourceTest {

    private JdbcCounterSource source;

    @BeforeEach
    void setUp() {
        source = new JdbcCounterSource(JdbcCounterSource.createLocalConnectionString(), AnalyzerSettings.defaults());
    }

    @Test
    void shouldWrapConnectionFailures() {
        JdbcCounterSource unreachable = new JdbcCounterSource("jdbc:unknown://nowhere", AnalyzerSettings.defaults());

        assertThatThrownBy(() -> unreachable.readWindow(LocalDateTime.now().minusHours(1), LocalDateTime.now()))
                .isInstanceOf(CounterSourceException.class)
                .hasMessageStartingWith("Snapshot history read failed")
                .hasCauseInstanceOf(SQLException.class);
        assertThatThrownBy(unreachable::readCurrent)
                .isInstanceOf(CounterSourceException.class)
                .hasMessageStartingWith("Live file statistics read failed");
        assertThatThrownBy(unreachable::readCurrentTime)
                .isInstanceOf(CounterSourceException.class)
                .hasMessageStartingWith("Server time read failed");
    }

    @Test
    void shouldExcludeSystemDatabasesUnlessRequested() {
        assertThat(JdbcCounterSource.LIVE_FILE_STATS)
                .contains("sys.dm_io_virtual_file_stats(NULL, NULL)")
                .contains("(? = 1 OR vfs.database_id = 2 OR vfs.database_id > 4)");
    }

    @Test
    void shouldLookUpBaselinesPerWindowedFile() {
        assertThat(JdbcCounterSource.PREDECESSOR_SNAPSHOTS)
                .contains("CROSS APPLY")
                .contains("SELECT TOP (1)")
                .contains("ORDER BY earlier.snapshot_time DESC")
                .doesNotContain("ROW_NUMBER");
    }

    @Test
    @EnabledIf("isDatabaseAvailable")
    void shouldReadServerTime() throws CounterSourceException {
        assertThat(source.readCurrentTime()).isAfter(source.readEngineStartTime());
    }

    @Test
    @EnabledIf("isDatabaseAvailable")
    void shouldReadLiveCounters() throws CounterSourceException {
        List<SnapshotRecord> current = source.readCurrent();

        assertThat(current).isNotEmpty();
        assertThat(current).allSatisfy(file -> {
            assertThat(file.databaseId()).isNotIn(1, 3, 4);
            assertThat(file.reads()).isNotNegative();
            assertThat(file.fileHandle()).startsWith("0x");
        });
    }

    @Test
    @EnabledIf("isDatabaseAvailable")
    void shouldReadSnapshotWindow() throws CounterSourceException {
        LocalDateTime now = LocalDateTime.now();

        SnapshotWindow window = source.readWindow(now.minusHours(24), now);

        assertThat(window.inWindow()).allSatisfy(s -> assertThat(window.contains(s.capturedAt())).isTrue());
        assertThat(window.predecessors()).allSatisfy(s -> assertThat(s.capturedAt()).isBefore(window.from()));
    }

    @Test
    @EnabledIf("isDatabaseAvailable")
    void shouldReadEngineStartTime() throws CounterSourceException {
        assertThat(source.readEngineStartTime()).isBefore(LocalDateTime.now());
    }

    static boolean isDatabaseAvailable() {
        try {
            JdbcCounterSource testSource = new JdbcCounterSource(
                    JdbcCounterSource.createLocalConnectionString(), AnalyzerSettings.defaults());
            return testSource.isSnapshotTableAvailable();
        } catch (Exception e) {
            System.out.println("Docker SQL Server not available for testing: " + e.getMessage());
            return false;
        }
    }
}
