package org.helmsman.runtime.events;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.helmsman.runtime.model.Event;
import org.helmsman.runtime.model.EventSeverity;
import org.helmsman.runtime.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the events visible to conditions as {@code events.*}.
 * <p>
 * One event per type: spawning a type that is already present replaces it. Spawned events are
 * visible immediately, so a rule evaluated later in the same tick can react to them.
 * <p>
 * Each engine owns its own bus. <strong>Thread Safety:</strong> Not thread-safe; only the engine
 * thread running a tick touches it.
 */
public class EventBus {

    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, Event> events = new LinkedHashMap<>();
    private final Set<String> consumed = new HashSet<>();
    private long tick;
    private int sequence;

    /**
     * Prepares the bus for a new tick.
     *
     * @param tick The tick about to run.
     * @param persistence Which events survive from the previous tick.
     */
    public void beginTick(long tick, EventPersistence persistence) {
        this.tick = tick;
        this.sequence = 0;
        if (persistence == EventPersistence.TICK) {
            events.clear();
        } else {
            events.keySet().removeAll(consumed);
        }
        consumed.clear();
    }

    /**
     * Inserts or replaces the event of the given type.
     *
     * @param sourceRule The spawning rule.
     * @param eventType The event type.
     * @param payload The resolved payload.
     * @param severity The severity.
     * @return the spawned event.
     */
    public Event spawn(String sourceRule, String eventType, Map<String, Value> payload, EventSeverity severity) {
        String id = "evt-" + tick + "-" + sequence++;
        Event event = new Event(id, sourceRule, tick, eventType, payload, severity);
        Event replaced = events.remove(eventType);
        events.put(eventType, event);
        consumed.remove(eventType);
        if (replaced != null) {
            LOG.debug("Event '{}' from rule '{}' replaces {}", eventType, sourceRule, replaced.id());
        }
        return event;
    }

    public Optional<Event> get(String eventType) {
        return Optional.ofNullable(events.get(eventType));
    }

    /**
     * Marks an event as read by a triggered rule. Only relevant under
     * {@link EventPersistence#UNTIL_CONSUMED}.
     */
    public void markConsumed(String eventType) {
        if (events.containsKey(eventType)) {
            consumed.add(eventType);
        }
    }

    public boolean isConsumed(String eventType) {
        return consumed.contains(eventType);
    }

    /**
     * @return an immutable copy of the visible events, in spawn order.
     */
    public Map<String, Event> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(events));
    }

    /**
     * Replaces the visible events, e.g. when a state is rebuilt from a snapshot.
     */
    public void restore(Map<String, Event> restored) {
        events.clear();
        consumed.clear();
        events.putAll(restored);
    }

    public int size() {
        return events.size();
    }
}
