package org.helmsman.runtime.spi;

import org.helmsman.runtime.history.StateSnapshot;

/**
 * Callback for consumers of committed ticks, such as a rendering front end or an explanation panel.
 * <p>
 * Listeners are called on the engine thread, in registration order, after the snapshot has been
 * appended to the history. A listener that throws is logged and skipped; it cannot affect the tick
 * or other listeners.
 */
@FunctionalInterface
public interface ITickListener {

    /**
     * @param snapshot The committed snapshot of the tick that just completed.
     */
    void onTickCommitted(StateSnapshot snapshot);
}
