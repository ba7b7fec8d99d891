package org.carball.iolatency.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
