package org.carball.iolatency.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.iolatency.model.snapshot.FileIoProfile;
import org.carball.iolatency.model.snapshot.SnapshotRecord;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-file I/O breakdown of a live read: volumes in whole GB, read/write mix, average I/O sizes, latencies
 * and IOPS since engine start. Files without any operation are left out.
 */
@Slf4j
public class FileIoProfiler {

    private static final double BYTES_PER_GB = 1024.0 * 1024.0 * 1024.0;

    // Rough peak-to-average factor for OLTP workloads
    private static final double PEAK_IOPS_FACTOR = 3.0;

    private final LatencyClassifier classifier;

    public FileIoProfiler(LatencyClassifier classifier) {
        this.classifier = classifier;
    }

    public List<FileIoProfile> profile(List<SnapshotRecord> current, LocalDateTime engineStartTime,
                                       LocalDateTime readTime) {
        long uptimeSeconds = engineStartTime != null
                ? Math.max(0, Duration.between(engineStartTime, readTime).getSeconds())
                : 0;
        if (engineStartTime == null) {
            log.warn("Engine start time unknown, IOPS figures will be 0");
        }

        List<FileIoProfile> profiles = new ArrayList<>();
        for (SnapshotRecord file : current) {
            long operations = file.reads() + file.writes();
            if (operations == 0) {
                continue;
            }
            profiles.add(profileFile(file, operations, uptimeSeconds));
        }

        profiles.sort(Comparator.comparing(FileIoProfile::getDatabaseName, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparingInt(FileIoProfile::getFileId));
        log.info("Profiled {} of {} files", profiles.size(), current.size());
        return profiles;
    }

    private FileIoProfile profileFile(SnapshotRecord file, long operations, long uptimeSeconds) {
        double avgRead = round2(ratio(file.readStallMs(), file.reads()));
        double avgWrite = round2(ratio(file.writeStallMs(), file.writes()));
        double iops = ratio(operations, uptimeSeconds);

        return FileIoProfile.builder()
                .databaseName(file.databaseName())
                .fileId(file.fileId())
                .physicalPath(file.physicalPath())
                .fileRole(file.fileRole())
                .readGB(Math.round(file.bytesRead() / BYTES_PER_GB))
                .writeGB(Math.round(file.bytesWritten() / BYTES_PER_GB))
                .readPercentage(Math.round(file.reads() * 100.0 / operations))
                .writePercentage(Math.round(file.writes() * 100.0 / operations))
                .readCount(file.reads())
                .writeCount(file.writes())
                .avgReadSizeKB(round2(ratio(file.bytesRead(), file.reads()) / 1024.0))
                .avgWriteSizeKB(round2(ratio(file.bytesWritten(), file.writes()) / 1024.0))
                .avgReadLatencyMs(avgRead)
                .avgWriteLatencyMs(avgWrite)
                .avgTotalLatencyMs(round2(ratio(file.totalStallMs(), operations)))
                .totalReadStallMs(file.readStallMs())
                .totalWriteStallMs(file.writeStallMs())
                .totalStallMs(file.totalStallMs())
                .avgIops(round2(iops))
                .estimatedPeakIops(round2(iops * PEAK_IOPS_FACTOR))
                .performanceStatus(classifier.classify(file.fileRole(), avgRead, avgWrite))
                .build();
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0 : (double) numerator / denominator;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
