package org.helmsman.runtime.events;

/**
 * How long a spawned event stays visible under {@code events.*}.
 */
public enum EventPersistence {
    /** Events are cleared at the start of every tick. */
    TICK,
    /**
     * Events survive ticks until a triggered rule reads them; consumed events are removed at the
     * start of the following tick.
     */
    UNTIL_CONSUMED
}
