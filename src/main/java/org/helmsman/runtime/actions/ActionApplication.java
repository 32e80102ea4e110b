package org.helmsman.runtime.actions;

import org.helmsman.runtime.conflicts.ConflictRecord;
import org.helmsman.runtime.model.Action;
import org.helmsman.runtime.model.Event;
import org.helmsman.runtime.model.Value;

/**
 * The concrete effect of one applied action.
 * <p>
 * Only the fields relevant to the action type are set; the others are null.
 *
 * @param action The declared action.
 * @param target The written or inspected path, or null.
 * @param before The value at {@code target} before the action, or null if it was unset.
 * @param after The value at {@code target} after the action and any conflict resolution.
 * @param applied False if the write lost a conflict or a TRIGGER_RULE request was a no-op.
 * @param message Human readable account of the effect.
 * @param conflict The conflict the write ran into, or null.
 * @param event The spawned event, or null.
 * @param logEntry The LOG entry, or null.
 * @param triggerRequest The rule id queued by TRIGGER_RULE, or null.
 * @param recommendation The RECOMMEND record, or null.
 */
public record ActionApplication(
        Action action,
        String target,
        Value before,
        Value after,
        boolean applied,
        String message,
        ConflictRecord conflict,
        Event event,
        LogEntry logEntry,
        String triggerRequest,
        Recommendation recommendation) {

    static ActionApplication write(Action action, String target, Value before, Value after, boolean applied,
                                   String message, ConflictRecord conflict) {
        return new ActionApplication(action, target, before, after, applied, message, conflict, null, null, null, null);
    }

    /**
     * @return true if the action was one of the state-mutating types.
     */
    public boolean isWrite() {
        return action.type().isMutating();
    }
}
