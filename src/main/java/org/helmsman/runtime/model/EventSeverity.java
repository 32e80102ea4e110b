package org.helmsman.runtime.model;

/**
 * Severity attached to a spawned event.
 */
public enum EventSeverity {
    NORMAL,
    WARNING,
    CRITICAL
}
