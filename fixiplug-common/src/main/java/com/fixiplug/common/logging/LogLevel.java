package com.fixiplug.common.logging;

/**
 * Log levels understood by {@link SubsystemLogger}.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
