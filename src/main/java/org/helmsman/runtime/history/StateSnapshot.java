package org.helmsman.runtime.history;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.helmsman.runtime.conflicts.ConflictRecord;
import org.helmsman.runtime.explain.Explanation;
import org.helmsman.runtime.explain.TickReport;
import org.helmsman.runtime.model.AgentState;
import org.helmsman.runtime.model.Event;
import org.helmsman.runtime.model.SystemState;
import org.helmsman.runtime.model.Value;
import org.helmsman.runtime.path.IStateReader;
import org.helmsman.runtime.path.PathResolver;

/**
 * Immutable copy of a {@link SystemState} as committed at the end of a tick, together with the
 * tick's report.
 * <p>
 * Snapshots are full copies, so replaying or rewinding never re-executes rules. Two runs with the
 * same initial state and the same inputs produce equal snapshots.
 *
 * @param tick The tick this snapshot concludes.
 * @param timeStep The state's time step after the tick ({@code tick + 1}).
 * @param agents Agent fields by agent id, both levels sorted by name.
 * @param environment Environment fields, sorted by name.
 * @param metrics Global metrics, sorted by name.
 * @param events Events visible at the end of the tick, in spawn order.
 * @param report Explanations, conflicts and diagnostics of the tick.
 */
public record StateSnapshot(
        long tick,
        long timeStep,
        Map<String, Map<String, Value>> agents,
        Map<String, Value> environment,
        Map<String, Value> metrics,
        Map<String, Event> events,
        TickReport report) implements IStateReader {

    public StateSnapshot {
        TreeMap<String, Map<String, Value>> agentCopy = new TreeMap<>();
        agents.forEach((id, fields) -> agentCopy.put(id, Collections.unmodifiableMap(new TreeMap<>(fields))));
        agents = Collections.unmodifiableMap(agentCopy);
        environment = Collections.unmodifiableMap(new TreeMap<>(environment));
        metrics = Collections.unmodifiableMap(new TreeMap<>(metrics));
        events = Collections.unmodifiableMap(new LinkedHashMap<>(events));
    }

    /**
     * Copies the current content of a live state.
     *
     * @param state The state after the tick, with its time step already advanced.
     * @param tick The tick that just completed.
     * @param report The tick's report.
     */
    public static StateSnapshot capture(SystemState state, long tick, TickReport report) {
        Map<String, Map<String, Value>> agents = new TreeMap<>();
        for (AgentState agent : state.agents().values()) {
            agents.put(agent.getId(), agent.fields());
        }
        return new StateSnapshot(tick, state.getTimeStep(), agents, state.environmentFields(), state.metrics(),
                state.events().snapshot(), report);
    }

    /**
     * @param path A field path.
     * @return the value at the path in this snapshot.
     * @throws org.helmsman.runtime.errors.UnknownPathException if nothing exists there.
     */
    public Value valueAt(String path) {
        return PathResolver.resolve(this, path);
    }

    public List<Explanation> explanations() {
        return report.explanations();
    }

    public List<ConflictRecord> conflicts() {
        return report.conflicts();
    }

    /**
     * Rebuilds a live state from this snapshot. The new state starts with an empty history.
     */
    public SystemState toState() {
        SystemState.Builder builder = SystemState.builder().timeStep(timeStep).events(events);
        agents.forEach(builder::agent);
        environment.forEach(builder::environment);
        metrics.forEach((name, value) -> builder.metric(name, ((Value.NumberValue) value).value()));
        return builder.build();
    }

    @Override
    public long getTimeStep() {
        return timeStep;
    }

    @Override
    public Set<String> agentIds() {
        return agents.keySet();
    }

    @Override
    public boolean hasAgent(String agentId) {
        return agents.containsKey(agentId);
    }

    @Override
    public Optional<Value> agentField(String agentId, String field) {
        Map<String, Value> fields = agents.get(agentId);
        if (fields == null) {
            return Optional.empty();
        }
        if (AgentState.ID_FIELD.equals(field)) {
            return Optional.of(Value.text(agentId));
        }
        return Optional.ofNullable(fields.get(field));
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
        return Optional.ofNullable(events.get(eventType));
    }
}
