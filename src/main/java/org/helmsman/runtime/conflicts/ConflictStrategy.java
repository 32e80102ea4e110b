package org.helmsman.runtime.conflicts;

import java.util.Locale;

/**
 * How competing writes to one path within a tick are settled.
 */
public enum ConflictStrategy {
    /** The higher-priority rule wins; on equal priority the earlier write stays. */
    PRIORITY,
    /** The most recent write wins. */
    LAST_WRITE_WINS,
    /** CLAMP ranges intersect, numeric writes combine through a {@link MergeFunction}. */
    MERGE,
    /** The path returns to its pre-conflict value and is left for human review. */
    MANUAL_REVIEW;

    /**
     * Parses a strategy name, ignoring case and accepting dashes for underscores.
     *
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static ConflictStrategy parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Conflict strategy must not be empty");
        }
        String normalized = text.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ConflictStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown conflict strategy: " + text);
    }
}
