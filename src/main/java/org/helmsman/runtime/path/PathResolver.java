package org.helmsman.runtime.path;

import java.util.Optional;

import org.helmsman.runtime.errors.ReadOnlyPathException;
import org.helmsman.runtime.errors.TypeMismatchException;
import org.helmsman.runtime.errors.UnknownAgentException;
import org.helmsman.runtime.errors.UnknownPathException;
import org.helmsman.runtime.model.AgentState;
import org.helmsman.runtime.model.Event;
import org.helmsman.runtime.model.SystemState;
import org.helmsman.runtime.model.Value;

/**
 * Maps field paths to and from state locations.
 * <p>
 * Reads go through {@link IStateReader}, so they work on the live state as well as on committed
 * snapshots. Writes only ever target the live {@link SystemState}.
 * <p>
 * Event paths behave differently from the other containers: an event that is not present reads as
 * {@link Value.AbsentValue absent} instead of failing, and a present event reads as {@code true}.
 */
public final class PathResolver {

    private PathResolver() {
    }

    /**
     * Resolves a path to its current value.
     *
     * @param reader The state to read.
     * @param path The path text.
     * @return the value at the path, never null.
     * @throws UnknownPathException if the path is malformed or does not exist.
     */
    public static Value resolve(IStateReader reader, String path) {
        return resolve(reader, FieldPath.parse(path));
    }

    public static Value resolve(IStateReader reader, FieldPath path) {
        return switch (path.container()) {
            case AGENTS -> {
                if (!reader.hasAgent(path.key())) {
                    throw new UnknownPathException("Unknown agent in path '" + path + "'");
                }
                yield reader.agentField(path.key(), path.field())
                        .orElseThrow(() -> new UnknownPathException("Unknown agent field '" + path + "'"));
            }
            case ENVIRONMENT -> reader.environment(path.key())
                    .orElseThrow(() -> new UnknownPathException("Unknown environment field '" + path + "'"));
            case GLOBAL_METRICS -> reader.metric(path.key())
                    .orElseThrow(() -> new UnknownPathException("Unknown metric '" + path + "'"));
            case EVENTS -> resolveEvent(reader, path);
        };
    }

    /**
     * Resolves a path without failing on missing locations.
     *
     * @return the value, or empty if the path is malformed or nothing is stored there.
     */
    public static Optional<Value> tryResolve(IStateReader reader, String path) {
        Optional<FieldPath> parsed = FieldPath.tryParse(path);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        try {
            Value value = resolve(reader, parsed.get());
            return value.isAbsent() ? Optional.empty() : Optional.of(value);
        } catch (UnknownPathException e) {
            return Optional.empty();
        }
    }

    /**
     * Writes a scalar value, creating the field if it does not exist yet.
     *
     * @param state The live state.
     * @param path The path text.
     * @param value The value to write.
     * @throws UnknownPathException if the path is malformed.
     * @throws UnknownAgentException if the path names an agent that was never declared.
     * @throws ReadOnlyPathException if the path is under {@code events} or is an agent id.
     * @throws TypeMismatchException if the value is not a scalar, or a metric value is not a number.
     */
    public static void write(SystemState state, String path, Value value) {
        FieldPath parsed = FieldPath.parse(path);
        if (!value.isScalar()) {
            throw new TypeMismatchException("Cannot write " + value.typeName() + " to '" + path + "'");
        }
        switch (parsed.container()) {
            case AGENTS -> requireWritableAgentField(state, parsed).put(parsed.field(), value);
            case ENVIRONMENT -> state.putEnvironment(parsed.key(), value);
            case GLOBAL_METRICS -> {
                if (!(value instanceof Value.NumberValue)) {
                    throw new TypeMismatchException("Metric '" + path + "' only accepts numbers, got "
                            + value.typeName());
                }
                state.putMetric(parsed.key(), value);
            }
            case EVENTS -> throw new ReadOnlyPathException("Event paths are read-only: '" + path + "'");
        }
    }

    /**
     * Removes the value at a path. Used to restore a location that was unset before the tick.
     */
    public static void remove(SystemState state, String path) {
        FieldPath parsed = FieldPath.parse(path);
        switch (parsed.container()) {
            case AGENTS -> requireWritableAgentField(state, parsed).remove(parsed.field());
            case ENVIRONMENT -> state.removeEnvironment(parsed.key());
            case GLOBAL_METRICS -> state.removeMetric(parsed.key());
            case EVENTS -> throw new ReadOnlyPathException("Event paths are read-only: '" + path + "'");
        }
    }

    private static AgentState requireWritableAgentField(SystemState state, FieldPath path) {
        AgentState agent = state.getAgent(path.key())
                .orElseThrow(() -> new UnknownAgentException("Unknown agent '" + path.key()
                        + "' in path '" + path + "'"));
        if (AgentState.ID_FIELD.equals(path.field())) {
            throw new ReadOnlyPathException("Agent identifiers are read-only: '" + path + "'");
        }
        return agent;
    }

    private static Value resolveEvent(IStateReader reader, FieldPath path) {
        Optional<Event> event = reader.event(path.key());
        if (event.isEmpty()) {
            return Value.absent();
        }
        if (path.field() == null) {
            return Value.bool(true);
        }
        Value payloadValue = event.get().payload().get(path.field());
        return payloadValue == null ? Value.absent() : payloadValue;
    }
}
