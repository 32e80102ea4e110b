package org.helmsman.runtime.history;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only sequence of committed snapshots, indexed by tick.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe. The engine appends from its tick thread while other
 * threads replay or inspect earlier ticks.
 */
public class StateHistory {

    private final List<StateSnapshot> snapshots = new ArrayList<>();

    /**
     * Appends the snapshot of the tick that follows the last appended one.
     *
     * @throws IllegalStateException if the snapshot's tick does not directly follow the last one.
     */
    public synchronized void append(StateSnapshot snapshot) {
        if (!snapshots.isEmpty()) {
            long expected = snapshots.get(snapshots.size() - 1).tick() + 1;
            if (snapshot.tick() != expected) {
                throw new IllegalStateException("Expected snapshot for tick " + expected + ", got " + snapshot.tick());
            }
        }
        snapshots.add(snapshot);
    }

    /**
     * @param tick The tick number.
     * @return the snapshot committed at that tick, or empty if it is not in the history.
     */
    public synchronized Optional<StateSnapshot> get(long tick) {
        if (snapshots.isEmpty()) {
            return Optional.empty();
        }
        long index = tick - snapshots.get(0).tick();
        if (index < 0 || index >= snapshots.size()) {
            return Optional.empty();
        }
        return Optional.of(snapshots.get((int) index));
    }

    public synchronized Optional<StateSnapshot> latest() {
        return snapshots.isEmpty() ? Optional.empty() : Optional.of(snapshots.get(snapshots.size() - 1));
    }

    /**
     * @return the first tick in the history, or -1 if it is empty.
     */
    public synchronized long firstTick() {
        return snapshots.isEmpty() ? -1 : snapshots.get(0).tick();
    }

    public synchronized int size() {
        return snapshots.size();
    }

    public synchronized boolean isEmpty() {
        return snapshots.isEmpty();
    }

    /**
     * @return a copy of all snapshots in tick order.
     */
    public synchronized List<StateSnapshot> all() {
        return List.copyOf(snapshots);
    }

    /**
     * @return a cursor positioned before the first snapshot.
     */
    public ReplayCursor cursor() {
        return new ReplayCursor(this);
    }
}
