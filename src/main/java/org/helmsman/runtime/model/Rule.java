package org.helmsman.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A prioritized condition/action rule.
 *
 * @param id Unique, stable identifier.
 * @param priority Higher priorities are evaluated first; ties keep declaration order.
 * @param conditions Conditions, evaluated in order.
 * @param logic How the condition results combine.
 * @param actions Actions, applied in order when the rule triggers.
 * @param explanationTemplate Message template with {@code {{placeholder}}} substitution.
 * @param metadata Opaque key/value bag. {@code conflict_strategy} selects the conflict strategy
 *                 for this rule's writes; {@code category} and {@code tags} appear in summaries.
 */
public record Rule(
        String id,
        int priority,
        List<Condition> conditions,
        ConditionLogic logic,
        List<Action> actions,
        String explanationTemplate,
        Map<String, Object> metadata) {

    public Rule {
        Objects.requireNonNull(id, "id");
        conditions = List.copyOf(conditions);
        logic = logic == null ? ConditionLogic.AND : logic;
        actions = List.copyOf(actions);
        explanationTemplate = explanationTemplate == null ? "" : explanationTemplate;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * @return the {@code conflict_strategy} metadata entry, or null.
     */
    public String conflictStrategyHint() {
        Object hint = metadata.get("conflict_strategy");
        return hint == null ? null : hint.toString();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Fluent builder for rules.
     */
    public static final class Builder {
        private final String id;
        private int priority;
        private final List<Condition> conditions = new ArrayList<>();
        private ConditionLogic logic = ConditionLogic.AND;
        private final List<Action> actions = new ArrayList<>();
        private String template = "";
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder when(Condition condition) {
            this.conditions.add(condition);
            return this;
        }

        public Builder when(Object left, String operator, Object right) {
            return when(Condition.of(left, operator, right));
        }

        public Builder logic(ConditionLogic logic) {
            this.logic = logic;
            return this;
        }

        public Builder then(Action action) {
            this.actions.add(action);
            return this;
        }

        public Builder explain(String template) {
            this.template = template;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Rule build() {
            return new Rule(id, priority, conditions, logic, actions, template, metadata);
        }
    }
}
