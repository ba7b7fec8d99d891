package org.carball.iolatency.model.snapshot;

public enum AnalysisMode {
    HISTORICAL,
    CURRENT;

    public static AnalysisMode fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Analysis mode not specified. Use: historical or current");
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid analysis mode: " + name + ". Use: historical or current");
        }
    }
}
