package org.helmsman.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.helmsman.runtime.events.EventBus;
import org.helmsman.runtime.history.StateHistory;
import org.helmsman.runtime.path.IStateReader;

/**
 * The authoritative, mutable state of one simulation.
 * <p>
 * Agents, environment fields and metrics are kept in name-sorted maps so that iteration order, and
 * therefore every derived snapshot, is independent of insertion order. The state also owns the
 * event bus and the snapshot history of its engine.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. The decision engine is the single writer and
 * mutates the state only inside a tick. Other threads read committed snapshots from
 * {@link #history()} instead.
 */
public class SystemState implements IStateReader {

    private final TreeMap<String, AgentState> agents = new TreeMap<>();
    private final TreeMap<String, Value> environment = new TreeMap<>();
    private final TreeMap<String, Value> metrics = new TreeMap<>();
    private final EventBus events = new EventBus();
    private final StateHistory history = new StateHistory();
    private long timeStep;

    /**
     * Creates an empty state at time step 0.
     */
    public SystemState() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<AgentState> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    /**
     * @return a read-only view of the agents, sorted by id.
     */
    public Map<String, AgentState> agents() {
        return Collections.unmodifiableMap(agents);
    }

    /**
     * Declares an agent. Rules can never create agents, only inputs and scenario setup can.
     *
     * @throws IllegalArgumentException if an agent with the same id already exists.
     */
    public void addAgent(AgentState agent) {
        if (agents.putIfAbsent(agent.getId(), agent) != null) {
            throw new IllegalArgumentException("Duplicate agent id: " + agent.getId());
        }
    }

    public Map<String, Value> environmentFields() {
        return Collections.unmodifiableMap(environment);
    }

    public Map<String, Value> metrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public void putEnvironment(String name, Value value) {
        environment.put(name, value);
    }

    public void removeEnvironment(String name) {
        environment.remove(name);
    }

    public void putMetric(String name, Value value) {
        metrics.put(name, value);
    }

    public void removeMetric(String name) {
        metrics.remove(name);
    }

    public EventBus events() {
        return events;
    }

    public StateHistory history() {
        return history;
    }

    @Override
    public long getTimeStep() {
        return timeStep;
    }

    /**
     * Moves to the next time step. Called once per committed tick.
     */
    public void advanceTimeStep() {
        timeStep++;
    }

    @Override
    public Set<String> agentIds() {
        return Collections.unmodifiableSet(agents.keySet());
    }

    @Override
    public boolean hasAgent(String agentId) {
        return agents.containsKey(agentId);
    }

    @Override
    public Optional<Value> agentField(String agentId, String field) {
        AgentState agent = agents.get(agentId);
        return agent == null ? Optional.empty() : agent.get(field);
    }

    @Override
    public Optional<Value> environment(String name) {
        return Optional.ofNullable(environment.get(name));
    }

    @Override
    public Optional<Value> metric(String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    @Override
    public Optional<Event> event(String eventType) {
        return events.get(eventType);
    }

    /**
     * Fluent builder for initial states.
     */
    public static final class Builder {
        private final Map<String, Map<String, Object>> agents = new LinkedHashMap<>();
        private final Map<String, Object> environment = new LinkedHashMap<>();
        private final Map<String, Object> metrics = new LinkedHashMap<>();
        private final Map<String, Event> events = new LinkedHashMap<>();
        private long timeStep;

        private Builder() {
        }

        public Builder agent(String id, Map<String, ?> fields) {
            this.agents.put(id, new LinkedHashMap<>(fields));
            return this;
        }

        public Builder environment(String name, Object value) {
            this.environment.put(name, value);
            return this;
        }

        public Builder metric(String name, Number value) {
            this.metrics.put(name, value);
            return this;
        }

        /**
         * Pre-populates the event bus; used when rebuilding a state from a snapshot.
         */
        public Builder events(Map<String, Event> events) {
            this.events.putAll(events);
            return this;
        }

        public Builder timeStep(long timeStep) {
            if (timeStep < 0) {
                throw new IllegalArgumentException("timeStep must be >= 0, got " + timeStep);
            }
            this.timeStep = timeStep;
            return this;
        }

        public SystemState build() {
            SystemState state = new SystemState();
            agents.forEach((id, fields) -> state.addAgent(new AgentState(id, fields)));
            environment.forEach((name, raw) -> state.putEnvironment(name, requireScalar(name, Value.of(raw))));
            metrics.forEach((name, raw) -> state.putMetric(name, Value.of(raw)));
            state.events.restore(events);
            state.timeStep = timeStep;
            return state;
        }

        private static Value requireScalar(String name, Value value) {
            if (!value.isScalar()) {
                throw new IllegalArgumentException("Environment field '" + name + "' must be a scalar");
            }
            return value;
        }
    }
}
