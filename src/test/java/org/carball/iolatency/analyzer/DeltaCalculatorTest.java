package org.carball.iolatency.analyzer;

import org.carball.iolatency.config.AnalyzerSettings;
import org.carball.iolatency.model.snapshot.DeltaRecord;
import org.carball.iolatency.model.snapshot.FileRole;
import org.carball.iolatency.model.snapshot.SnapshotRecord;
import org.carball.iolatency.source.SnapshotWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;
import static org.carball.iolatency.TestSnapshots.*;

class DeltaCalculatorTest {

    private DeltaCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new DeltaCalculator(AnalyzerSettings.defaults());
    }

    @Test
    void shouldComputeDeltaBetweenConsecutiveSnapshots() {
        // Given
        SnapshotWindow window = new SnapshotWindow(T0, T1,
                List.of(dataFile(T0, 5, "Sales", 100, 500), dataFile(T1, 5, "Sales", 180, 900)),
                List.of());

        // When
        List<DeltaRecord> deltas = calculator.calculate(window);

        // Then
        assertThat(deltas).hasSize(1);
        DeltaRecord delta = deltas.get(0);
        assertThat(delta.intervalEnd()).isEqualTo(T1);
        assertThat(delta.intervalStart()).isEqualTo(T0);
        assertThat(delta.databaseName()).isEqualTo("Sales");
        assertThat(delta.fileRole()).isEqualTo(FileRole.DATA);
        assertThat(delta.reads()).isEqualTo(80);
        assertThat(delta.readStallMs()).isEqualTo(400);
        assertThat(delta.bytesRead()).isEqualTo(80 * 8192);
    }

    @Test
    void shouldPairFirstSnapshotInWindowWithEarlierBaseline() {
        // Given - T0 lies before the window, T1 is the first capture inside it
        SnapshotWindow window = new SnapshotWindow(T1, T2,
                List.of(dataFile(T1, 5, "Sales", 180, 900)),
                List.of(dataFile(T0, 5, "Sales", 100, 500)));

        // When
        List<DeltaRecord> deltas = calculator.calculate(window);

        // Then
        assertThat(deltas).hasSize(1);
        assertThat(deltas.get(0).intervalEnd()).isEqualTo(T1);
        assertThat(deltas.get(0).reads()).isEqualTo(80);
    }

    @Test
    void shouldNotProduceDeltaForFirstEverSnapshot() {
        // Given
        SnapshotWindow window = new SnapshotWindow(T0, T2,
                List.of(dataFile(T0, 5, "Sales", 100, 500)),
                List.of());

        // When / Then
        assertThat(calculator.calculate(window)).isEmpty();
    }

    @Test
    void shouldDropWholePairWhenCounterGoesBackwards() {
        // Given - Sales restarts at T2, Inventory keeps growing
        SnapshotWindow window = new SnapshotWindow(T0, T2,
                List.of(
                        dataFile(T0, 5, "Sales", 100, 500),
                        dataFile(T1, 5, "Sales", 180, 900),
                        dataFile(T2, 5, "Sales", 50, 950),
                        dataFile(T1, 6, "Inventory", 10, 20),
                        dataFile(T2, 6, "Inventory", 30, 60)),
                List.of());

        // When
        List<DeltaRecord> deltas = calculator.calculate(window);

        // Then
        assertThat(deltas).extracting(DeltaRecord::databaseName, DeltaRecord::intervalEnd)
                .containsExactlyInAnyOrder(
                        tuple("Sales", T1),
                        tuple("Inventory", T2));
        assertThat(deltas).noneMatch(DeltaRecord::hasNegativeCounter);
    }

    @Test
    void shouldDropPairWhenOnlyByteCounterDecreases() {
        // Given
        SnapshotRecord earlier = dataFile(T0, 5, "Sales", 100, 500);
        SnapshotRecord later = withBytesWritten(dataFile(T1, 5, "Sales", 180, 900), -1);
        SnapshotWindow window = new SnapshotWindow(T0, T1, List.of(earlier, later), List.of());

        // When / Then
        assertThat(calculator.calculate(window)).isEmpty();
    }

    @Test
    void shouldSkipIntervalWhenFileHandleChanges() {
        // Given
        SnapshotRecord earlier = withHandle(dataFile(T0, 5, "Sales", 100, 500), "0x00000000000001A4");
        SnapshotRecord later = withHandle(dataFile(T1, 5, "Sales", 180, 900), "0x00000000000002B8");
        SnapshotWindow window = new SnapshotWindow(T0, T1, List.of(earlier, later), List.of());

        // When / Then
        assertThat(calculator.calculate(window)).isEmpty();
    }

    @Test
    void shouldKeepIntervalWithChangedHandleWhenCheckDisabled() {
        // Given
        DeltaCalculator lenient = new DeltaCalculator(AnalyzerSettings.builder().dropOnFileHandleChange(false).build());
        SnapshotRecord earlier = withHandle(dataFile(T0, 5, "Sales", 100, 500), "0x00000000000001A4");
        SnapshotRecord later = withHandle(dataFile(T1, 5, "Sales", 180, 900), "0x00000000000002B8");
        SnapshotWindow window = new SnapshotWindow(T0, T1, List.of(earlier, later), List.of());

        // When / Then
        assertThat(lenient.calculate(window)).hasSize(1);
    }

    @Test
    void shouldUseNearestPredecessorRegardlessOfInputOrder() {
        // Given - shuffled input, three captures of the same file
        SnapshotWindow window = new SnapshotWindow(T0, T2,
                List.of(
                        dataFile(T2, 5, "Sales", 300, 1500),
                        dataFile(T0, 5, "Sales", 100, 500),
                        dataFile(T1, 5, "Sales", 180, 900)),
                List.of());

        // When
        List<DeltaRecord> deltas = calculator.calculate(window);

        // Then
        assertThat(deltas).hasSize(2);
        assertThat(deltas).filteredOn(d -> d.intervalEnd().equals(T2))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.intervalStart()).isEqualTo(T1);
                    assertThat(d.reads()).isEqualTo(120);
                    assertThat(d.readStallMs()).isEqualTo(600);
                });
    }

    @Test
    void shouldKeepFilesOfDifferentDatabasesApart() {
        // Given - same file id in two databases
        SnapshotWindow window = new SnapshotWindow(T0, T1,
                List.of(
                        dataFile(T0, 5, "Sales", 100, 500),
                        dataFile(T0, 6, "Inventory", 1000, 1000),
                        dataFile(T1, 5, "Sales", 110, 520),
                        dataFile(T1, 6, "Inventory", 1500, 1600)),
                List.of());

        // When
        List<DeltaRecord> deltas = calculator.calculate(window);

        // Then
        assertThat(deltas).extracting(DeltaRecord::databaseName, DeltaRecord::reads)
                .containsExactlyInAnyOrder(
                        tuple("Sales", 10L),
                        tuple("Inventory", 500L));
    }
}
