package org.helmsman.runtime.conflicts;

import org.helmsman.runtime.model.Value;

/**
 * What became of a {@link PendingWrite}.
 *
 * @param finalValue The value at the path after resolution; absent if the path is unset.
 * @param applied Whether the proposed value (or a merge including it) now stands.
 * @param conflict The conflict record, or null if the write did not collide.
 */
public record WriteOutcome(Value finalValue, boolean applied, ConflictRecord conflict) {

    public boolean conflicted() {
        return conflict != null;
    }
}
