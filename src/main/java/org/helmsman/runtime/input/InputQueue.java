package org.helmsman.runtime.input;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Buffer for inputs arriving between ticks.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe and lock-free. Any thread may submit; the engine
 * drains the buffer at the start of each tick, so an input never lands in the middle of a tick.
 */
public class InputQueue {

    private final ConcurrentLinkedQueue<InputCommand> pending = new ConcurrentLinkedQueue<>();

    public void submit(InputCommand command) {
        pending.add(command);
    }

    /**
     * Removes and returns everything submitted so far, in submission order.
     */
    public List<InputCommand> drain() {
        List<InputCommand> out = new ArrayList<>();
        InputCommand command;
        while ((command = pending.poll()) != null) {
            out.add(command);
        }
        return out;
    }

    public int size() {
        return pending.size();
    }
}
