package com.logpipeline.processor.parser;

/**
 * Log formats the parser recognizes. {@link #value()} is what gets stored in {@code logs.log_type}.
 */
public enum LogType {
    FIREWALL("firewall"),
    DNS("dns"),
    AUTH("auth");

    private final String value;

    LogType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
