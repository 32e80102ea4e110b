package org.helmsman.runtime.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A single agent of the simulation: a stable identifier plus a schema-less bag of scalar fields.
 * <p>
 * Fields are created on first write. The identifier is fixed at construction and is exposed under
 * the reserved field name {@value #ID_FIELD}, which cannot be written.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Only the owning engine mutates an agent, and only
 * while a tick is running.
 */
public final class AgentState {

    /**
     * Reserved field that reads as the agent identifier.
     */
    public static final String ID_FIELD = "id";

    private final String id;
    private final TreeMap<String, Value> fields = new TreeMap<>();

    /**
     * @param id The agent identifier, never null.
     * @param fields Initial field values (plain Java objects or {@link Value}s).
     */
    public AgentState(String id, Map<String, ?> fields) {
        this.id = Objects.requireNonNull(id, "id");
        if (fields != null) {
            fields.forEach((name, raw) -> this.fields.put(name, Value.of(raw)));
        }
    }

    public AgentState(String id) {
        this(id, Map.of());
    }

    public String getId() {
        return id;
    }

    /**
     * @param name The field name.
     * @return the field value, or empty if the field was never written.
     */
    public Optional<Value> get(String name) {
        if (ID_FIELD.equals(name)) {
            return Optional.of(Value.text(id));
        }
        return Optional.ofNullable(fields.get(name));
    }

    public boolean has(String name) {
        return ID_FIELD.equals(name) || fields.containsKey(name);
    }

    public void put(String name, Value value) {
        fields.put(name, value);
    }

    public void remove(String name) {
        fields.remove(name);
    }

    /**
     * @return a read-only, name-sorted view of the fields (without the identifier).
     */
    public Map<String, Value> fields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * @return an independent copy of this agent.
     */
    public AgentState copy() {
        return new AgentState(id, fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AgentState other)) return false;
        return id.equals(other.id) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fields);
    }

    @Override
    public String toString() {
        return "AgentState{" + id + ", " + fields + "}";
    }
}
