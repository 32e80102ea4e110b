package org.helmsman.runtime.model;

/**
 * Level of a LOG action. Mapped onto the SLF4J level of the same name.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    /**
     * Parses a level name, accepting {@code "warning"} as an alias of WARN.
     *
     * @param text The level name, case-insensitive. Null yields INFO.
     * @return The level.
     */
    public static LogLevel parse(String text) {
        if (text == null || text.isBlank()) {
            return INFO;
        }
        String normalized = text.trim().toUpperCase(java.util.Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        return valueOf(normalized);
    }
}
