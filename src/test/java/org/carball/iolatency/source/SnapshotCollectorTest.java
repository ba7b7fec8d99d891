package org.carball.iolatency.source;

import org.carball.iolatency.config.AnalyzerSettings;
import org.carball.iolatency.model.snapshot.CaptureReceipt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;

import java.io.IOException;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotCollectorTest {

    @Test
    void shouldLoadIdempotentSchemaScript() throws IOException {
        String script = SnapshotCollector.loadSchemaScript();

        assertThat(script)
                .startsWith("IF OBJECT_ID(N'dbo.reportDiskLatency', N'U') IS NULL")
                .contains("CREATE TABLE dbo.reportDiskLatency")
                .contains("IX_reportDiskLatency_Database_Type_Time");
    }

    @Test
    void shouldWrapConnectionFailures() {
        SnapshotCollector collector = new SnapshotCollector("jdbc:unknown://nowhere", AnalyzerSettings.defaults());

        assertThatThrownBy(collector::collect)
                .isInstanceOf(CounterSourceException.class)
                .hasMessageStartingWith("Snapshot collection failed");
    }

    @Test
    @EnabledIf("org.carball.iolatency.source.JdbcCounterSourceTest#isDatabaseAvailable")
    void shouldAppendSnapshotRound() throws CounterSourceException {
        // Given
        String connectionString = JdbcCounterSource.createLocalConnectionString();
        SnapshotCollector collector = new SnapshotCollector(connectionString, AnalyzerSettings.defaults());

        // When
        CaptureReceipt receipt = collector.collect();

        // Then
        assertThat(receipt.rowsInserted()).isPositive();
        SnapshotWindow window = new JdbcCounterSource(connectionString, AnalyzerSettings.defaults())
                .readWindow(receipt.capturedAt(), receipt.capturedAt());
        assertThat(window.inWindow()).hasSize(receipt.rowsInserted());
        assertThat(receipt.capturedAt()).isBefore(LocalDateTime.now().plusMinutes(5));
    }
}
