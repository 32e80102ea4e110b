package org.helmsman.runtime.model;

/**
 * The kinds of action a rule can take.
 */
public enum ActionType {
    /** Overwrite the target with a value. */
    SET(true),
    /** Add a number to the target (0 when unset). */
    ADD(true),
    /** Bound the target into [min, max]. */
    CLAMP(true),
    /** Suggest a value for the target without writing it. */
    RECOMMEND(false),
    /** Evaluate another rule right away, within the same tick. */
    TRIGGER_RULE(false),
    /** Publish an event visible to later rules of the same tick. */
    SPAWN_EVENT(false),
    /** Append an entry to the audit trail. */
    LOG(false);

    private final boolean mutating;

    ActionType(boolean mutating) {
        this.mutating = mutating;
    }

    /**
     * @return true when the action writes its target path.
     */
    public boolean isMutating() {
        return mutating;
    }
}
