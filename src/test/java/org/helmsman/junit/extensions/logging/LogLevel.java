package org.helmsman.junit.extensions.logging;

/**
 * Levels the {@link LogWatchExtension} annotations refer to.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
