package org.helmsman.runtime.history;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Steps forward and backward through a {@link StateHistory} without re-executing anything.
 * <p>
 * A cursor starts before the first snapshot; the first {@link #next()} moves it onto the first
 * committed tick. Snapshots appended after the cursor was created are reachable too.
 */
public class ReplayCursor {

    private final StateHistory history;
    private long position = -1;

    ReplayCursor(StateHistory history) {
        this.history = history;
    }

    /**
     * @return the snapshot under the cursor, or empty before the first {@link #next()}.
     */
    public Optional<StateSnapshot> current() {
        return position < 0 ? Optional.empty() : history.get(position);
    }

    public boolean hasNext() {
        if (position < 0) {
            return !history.isEmpty();
        }
        return history.get(position + 1).isPresent();
    }

    public boolean hasPrevious() {
        return position >= 0 && history.get(position - 1).isPresent();
    }

    /**
     * Moves one tick forward.
     *
     * @throws NoSuchElementException if there is no later snapshot.
     */
    public StateSnapshot next() {
        long target = position < 0 ? history.firstTick() : position + 1;
        return moveTo(target);
    }

    /**
     * Moves one tick back.
     *
     * @throws NoSuchElementException if there is no earlier snapshot.
     */
    public StateSnapshot previous() {
        if (position < 0) {
            throw new NoSuchElementException("Cursor is before the first snapshot");
        }
        return moveTo(position - 1);
    }

    /**
     * Jumps to a tick.
     *
     * @throws NoSuchElementException if the history holds no snapshot for that tick.
     */
    public StateSnapshot seek(long tick) {
        return moveTo(tick);
    }

    private StateSnapshot moveTo(long tick) {
        StateSnapshot snapshot = history.get(tick)
                .orElseThrow(() -> new NoSuchElementException("No snapshot for tick " + tick));
        position = tick;
        return snapshot;
    }
}
