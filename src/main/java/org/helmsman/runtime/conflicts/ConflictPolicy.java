package org.helmsman.runtime.conflicts;

import java.util.Optional;
import java.util.Set;

/**
 * Configured conflict handling, plus the lookup that picks a strategy for one conflict.
 * <p>
 * Resolution order for a conflict between the write currently standing (the keeper) and an
 * incoming write:
 * <ol>
 *   <li>{@code conflict_strategy} metadata of the incoming action</li>
 *   <li>{@code conflict_strategy} metadata of the incoming rule</li>
 *   <li>{@code conflict_strategy} metadata of the keeper's rule</li>
 *   <li>configured rule lists: {@code manual-review-rules}, then {@code merge-rules}, matching
 *       either rule id</li>
 *   <li>the configured default strategy</li>
 * </ol>
 *
 * @param defaultStrategy Strategy used when nothing more specific applies.
 * @param mergeFunction How MERGE combines two numeric writes.
 * @param priorityThreshold Priority gaps below this value escalate PRIORITY to MANUAL_REVIEW;
 *                          0 disables escalation.
 * @param mergeRules Rule ids whose conflicts are merged.
 * @param manualReviewRules Rule ids whose conflicts go to manual review.
 */
public record ConflictPolicy(
        ConflictStrategy defaultStrategy,
        MergeFunction mergeFunction,
        int priorityThreshold,
        Set<String> mergeRules,
        Set<String> manualReviewRules) {

    public ConflictPolicy {
        if (priorityThreshold < 0) {
            throw new IllegalArgumentException("priorityThreshold must be >= 0, got " + priorityThreshold);
        }
        mergeRules = Set.copyOf(mergeRules);
        manualReviewRules = Set.copyOf(manualReviewRules);
    }

    /**
     * @return PRIORITY with AVERAGE merging and no escalation.
     */
    public static ConflictPolicy defaults() {
        return new ConflictPolicy(ConflictStrategy.PRIORITY, MergeFunction.AVERAGE, 0, Set.of(), Set.of());
    }

    public ConflictPolicy withDefaultStrategy(ConflictStrategy strategy) {
        return new ConflictPolicy(strategy, mergeFunction, priorityThreshold, mergeRules, manualReviewRules);
    }

    /**
     * Picks the strategy for a conflict.
     *
     * @param keeper The write currently standing.
     * @param incoming The write that collides with it.
     * @return the requested strategy, before threshold escalation.
     */
    public ConflictStrategy select(PendingWrite keeper, PendingWrite incoming) {
        return hint(incoming.action().conflictStrategyHint())
                .or(() -> hint(incoming.rule().conflictStrategyHint()))
                .or(() -> hint(keeper.rule().conflictStrategyHint()))
                .or(() -> listed(manualReviewRules, keeper, incoming, ConflictStrategy.MANUAL_REVIEW))
                .or(() -> listed(mergeRules, keeper, incoming, ConflictStrategy.MERGE))
                .orElse(defaultStrategy);
    }

    /**
     * @return true if a PRIORITY conflict between these priorities must go to manual review.
     */
    public boolean escalates(int keeperPriority, int incomingPriority) {
        return priorityThreshold > 0 && Math.abs(keeperPriority - incomingPriority) < priorityThreshold;
    }

    private static Optional<ConflictStrategy> hint(String text) {
        return text == null ? Optional.empty() : Optional.of(ConflictStrategy.parse(text));
    }

    private static Optional<ConflictStrategy> listed(Set<String> rules, PendingWrite keeper, PendingWrite incoming,
                                                     ConflictStrategy strategy) {
        return rules.contains(keeper.ruleId()) || rules.contains(incoming.ruleId())
                ? Optional.of(strategy) : Optional.empty();
    }
}
