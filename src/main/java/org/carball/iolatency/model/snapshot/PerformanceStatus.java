package org.carball.iolatency.model.snapshot;

public enum PerformanceStatus {
    OK("OK"),
    HIGH_READ_LATENCY("High Read Latency"),
    HIGH_WRITE_LATENCY("High Write Latency"),
    HIGH_LOG_WRITE_LATENCY("High Log Write Latency");

    private final String displayName;

    PerformanceStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
