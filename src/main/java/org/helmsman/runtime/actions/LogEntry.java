package org.helmsman.runtime.actions;

import org.helmsman.runtime.model.LogLevel;
import org.helmsman.runtime.model.Value;

/**
 * Structured entry produced by a LOG action.
 *
 * @param tick The tick.
 * @param ruleId The logging rule.
 * @param level The level.
 * @param message The rendered message.
 * @param target The inspected path, or null.
 * @param targetValue The value at {@code target} when the entry was written, or null.
 */
public record LogEntry(long tick, String ruleId, LogLevel level, String message, String target, Value targetValue) {

    @Override
    public String toString() {
        return "[" + level + "] " + message;
    }
}
