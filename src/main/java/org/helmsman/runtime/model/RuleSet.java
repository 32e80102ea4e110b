package org.helmsman.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.helmsman.runtime.conflicts.ConflictStrategy;

/**
 * An ordered, validated collection of rules.
 * <p>
 * Declaration order is kept, because it breaks priority ties. Construction rejects the errors
 * that concern the set as a whole (duplicate ids, TRIGGER_RULE targets that do not exist, unknown
 * {@code conflict_strategy} names) so that they surface before any tick runs. Incomplete actions
 * are reported per rule at execution time.
 */
public final class RuleSet {

    private final List<Rule> declared;
    private final Map<String, Rule> byId;
    private final Map<String, Integer> declarationIndex;
    private final List<Rule> evaluationOrder;

    /**
     * @param rules Rules in declaration order.
     * @throws IllegalArgumentException on any structural error.
     */
    public RuleSet(List<Rule> rules) {
        this.declared = List.copyOf(rules);
        Map<String, Rule> ids = new LinkedHashMap<>();
        Map<String, Integer> index = new LinkedHashMap<>();
        for (Rule rule : declared) {
            if (ids.putIfAbsent(rule.id(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
            index.put(rule.id(), index.size());
        }
        this.byId = Collections.unmodifiableMap(ids);
        this.declarationIndex = Collections.unmodifiableMap(index);
        for (Rule rule : declared) {
            validate(rule);
        }

        List<Rule> sorted = new ArrayList<>(declared);
        // List.sort is stable, so equal priorities keep declaration order
        sorted.sort(Comparator.comparingInt(Rule::priority).reversed());
        this.evaluationOrder = Collections.unmodifiableList(sorted);
    }

    public static RuleSet of(Rule... rules) {
        return new RuleSet(List.of(rules));
    }

    /**
     * @return rules in declaration order.
     */
    public List<Rule> rules() {
        return declared;
    }

    /**
     * @return rules by descending priority, ties in declaration order.
     */
    public List<Rule> evaluationOrder() {
        return evaluationOrder;
    }

    public Optional<Rule> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    /**
     * @return the position of the rule in declaration order, or -1.
     */
    public int declarationIndexOf(String id) {
        Integer index = declarationIndex.get(id);
        return index == null ? -1 : index;
    }

    public int size() {
        return declared.size();
    }

    /**
     * Lightweight per-rule overview for debugging and UI listings.
     *
     * @return one summary per rule, in evaluation order.
     */
    public List<RuleSummary> summary() {
        List<RuleSummary> out = new ArrayList<>(evaluationOrder.size());
        for (Rule rule : evaluationOrder) {
            Object category = rule.metadata().get("category");
            Object tags = rule.metadata().get("tags");
            List<String> tagList = new ArrayList<>();
            if (tags instanceof Iterable<?> iterable) {
                for (Object tag : iterable) {
                    tagList.add(String.valueOf(tag));
                }
            }
            out.add(new RuleSummary(rule.id(), rule.priority(), rule.logic(), rule.conditions().size(),
                    rule.actions().size(), category == null ? "" : category.toString(), tagList));
        }
        return out;
    }

    private void validate(Rule rule) {
        validateStrategy(rule.id(), rule.conflictStrategyHint());
        for (Action action : rule.actions()) {
            validateStrategy(rule.id(), action.conflictStrategyHint());
            if (action.type() == ActionType.TRIGGER_RULE && action.ruleId() != null
                    && !byId.containsKey(action.ruleId())) {
                throw new IllegalArgumentException("Rule '" + rule.id()
                        + "' triggers unknown rule '" + action.ruleId() + "'");
            }
        }
    }

    private static void validateStrategy(String ruleId, String hint) {
        if (hint == null) {
            return;
        }
        try {
            ConflictStrategy.parse(hint);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Rule '" + ruleId + "': " + e.getMessage(), e);
        }
    }

    /**
     * Overview of a single rule.
     */
    public record RuleSummary(String id, int priority, ConditionLogic logic, int conditionCount,
                              int actionCount, String category, List<String> tags) {
        public RuleSummary {
            tags = List.copyOf(tags);
        }
    }
}
