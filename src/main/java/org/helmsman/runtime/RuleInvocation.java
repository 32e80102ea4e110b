package org.helmsman.runtime;

import org.helmsman.runtime.model.Rule;

/**
 * One scheduled evaluation of a rule within a tick.
 *
 * @param rule The rule.
 * @param depth Chain depth: 0 for the priority pass, one more per TRIGGER_RULE link.
 * @param triggeredBy The rule whose TRIGGER_RULE action queued this evaluation, or null.
 */
public record RuleInvocation(Rule rule, int depth, String triggeredBy) {

    /**
     * @return an invocation from the normal priority pass.
     */
    public static RuleInvocation scheduled(Rule rule) {
        return new RuleInvocation(rule, 0, null);
    }

    /**
     * @return an invocation of {@code target} requested by this invocation's rule, one level deeper.
     */
    public RuleInvocation chained(Rule target) {
        return new RuleInvocation(target, depth + 1, rule.id());
    }

    public String ruleId() {
        return rule.id();
    }
}
