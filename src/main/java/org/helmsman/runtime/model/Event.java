package org.helmsman.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event spawned by a rule.
 * <p>
 * Identifiers are derived from the tick and a per-tick sequence number ({@code evt-3-0},
 * {@code evt-3-1}, ...), so two runs with the same inputs spawn events with the same ids.
 *
 * @param id Deterministic identifier.
 * @param sourceRule The rule whose SPAWN_EVENT action created the event.
 * @param timestamp The tick in which the event was spawned.
 * @param eventType The event type; also the key under {@code events.*}.
 * @param payload Opaque payload, readable as {@code events.{type}.{key}}.
 * @param severity Event severity.
 */
public record Event(
        String id,
        String sourceRule,
        long timestamp,
        String eventType,
        Map<String, Value> payload,
        EventSeverity severity) {

    public Event {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        severity = severity == null ? EventSeverity.NORMAL : severity;
    }
}
