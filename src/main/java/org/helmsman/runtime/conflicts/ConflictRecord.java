package org.helmsman.runtime.conflicts;

import java.util.List;

import org.helmsman.runtime.model.Value;

/**
 * Audit record of one conflict resolution.
 *
 * @param id Deterministic identifier, {@code conflict-{tick}-{sequence}}.
 * @param timestamp The tick.
 * @param path The contested path.
 * @param conflictingRules Rule ids that wrote the path this tick, in evaluation order.
 * @param conflictingActions The corresponding actions, rendered.
 * @param strategy The strategy that was actually applied.
 * @param resolution The outcome.
 * @param resolved False only under manual review.
 */
public record ConflictRecord(
        String id,
        long timestamp,
        String path,
        List<String> conflictingRules,
        List<String> conflictingActions,
        ConflictStrategy strategy,
        ResolutionResult resolution,
        boolean resolved) {

    public ConflictRecord {
        conflictingRules = List.copyOf(conflictingRules);
        conflictingActions = List.copyOf(conflictingActions);
    }

    /**
     * @param finalValue The value the path holds after resolution.
     * @param winningRule The rule whose write was kept, or null for merges and manual review.
     * @param mergedRules The rules whose writes were merged, empty otherwise.
     * @param requestedStrategy The strategy selected before any escalation or fallback.
     * @param note Why the applied strategy differs from the requested one, or null.
     */
    public record ResolutionResult(
            Value finalValue,
            String winningRule,
            List<String> mergedRules,
            ConflictStrategy requestedStrategy,
            String note) {

        public ResolutionResult {
            mergedRules = List.copyOf(mergedRules);
        }
    }
}
