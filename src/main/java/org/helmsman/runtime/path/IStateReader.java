package org.helmsman.runtime.path;

import java.util.Optional;
import java.util.Set;

import org.helmsman.runtime.model.Event;
import org.helmsman.runtime.model.Value;

/**
 * Read-only view of a simulation state.
 * <p>
 * Implemented by the live working state of an engine and by committed snapshots, so that paths,
 * conditions and templates resolve the same way against both.
 */
public interface IStateReader {

    /**
     * @return the current time step.
     */
    long getTimeStep();

    /**
     * @return the ids of all declared agents, sorted.
     */
    Set<String> agentIds();

    boolean hasAgent(String agentId);

    /**
     * @param agentId The agent id.
     * @param field The field name ({@code id} reads the identifier).
     * @return the field value, or empty if the agent or the field does not exist.
     */
    Optional<Value> agentField(String agentId, String field);

    Optional<Value> environment(String name);

    Optional<Value> metric(String name);

    /**
     * @param eventType The event type.
     * @return the event currently visible under that type, or empty.
     */
    Optional<Event> event(String eventType);
}
