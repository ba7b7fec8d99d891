package org.carball.iolatency.model.snapshot;

/**
 * File role restriction of a report request.
 */
public enum RoleFilter {
    DATA,
    LOG,
    ALL;

    /**
     * Parses a filter value. {@code null} or blank means no filter; anything outside data, log and all is rejected.
     */
    public static RoleFilter fromName(String name) {
        if (name == null || name.isBlank()) {
            return ALL;
        }
        String normalized = name.trim().toUpperCase();
        for (RoleFilter filter : values()) {
            if (filter.name().equals(normalized)) {
                return filter;
            }
        }
        throw new IllegalArgumentException("File type filter must be 'data', 'log' or absent. Invalid value: " + name);
    }

    public boolean accepts(FileRole role) {
        return switch (this) {
            case DATA -> role == FileRole.DATA;
            case LOG -> role == FileRole.LOG;
            case ALL -> true;
        };
    }
}
