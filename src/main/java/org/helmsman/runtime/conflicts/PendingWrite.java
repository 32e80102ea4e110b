package org.helmsman.runtime.conflicts;

import org.helmsman.runtime.model.Action;
import org.helmsman.runtime.model.Rule;
import org.helmsman.runtime.model.Value;

/**
 * A write an action wants to commit, before conflict resolution.
 *
 * @param path The target path.
 * @param rule The writing rule.
 * @param action The writing action.
 * @param proposed The value the action computed against the current state.
 * @param range The CLAMP range, or null for SET and ADD.
 */
public record PendingWrite(String path, Rule rule, Action action, Value proposed, ClampRange range) {

    public String ruleId() {
        return rule.id();
    }

    public int priority() {
        return rule.priority();
    }
}
