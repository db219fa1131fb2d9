package org.carball.slowq.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
