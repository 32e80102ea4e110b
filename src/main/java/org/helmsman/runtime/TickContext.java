package org.helmsman.runtime;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.helmsman.runtime.conflicts.ConflictResolver;
import org.helmsman.runtime.model.RuleSet;
import org.helmsman.runtime.model.SystemState;

/**
 * Working context of the tick in progress.
 * <p>
 * Created by the engine at the start of every tick and handed to the action executor. It exists
 * only while the tick runs and is never visible outside the engine thread.
 */
public class TickContext {

    private final long tick;
    private final SystemState state;
    private final RuleSet rules;
    private final ConflictResolver resolver;
    private final int maxChainDepth;
    private final Set<String> evaluated = new LinkedHashSet<>();
    private boolean chainingHalted;

    public TickContext(long tick, SystemState state, RuleSet rules, ConflictResolver resolver, int maxChainDepth) {
        this.tick = tick;
        this.state = state;
        this.rules = rules;
        this.resolver = resolver;
        this.maxChainDepth = maxChainDepth;
    }

    public long getTick() {
        return tick;
    }

    public SystemState getState() {
        return state;
    }

    public RuleSet getRules() {
        return rules;
    }

    public ConflictResolver getResolver() {
        return resolver;
    }

    public int getMaxChainDepth() {
        return maxChainDepth;
    }

    /**
     * Marks a rule as evaluated for this tick.
     *
     * @return false if it had already been evaluated.
     */
    public boolean markEvaluated(String ruleId) {
        return evaluated.add(ruleId);
    }

    public boolean isEvaluated(String ruleId) {
        return evaluated.contains(ruleId);
    }

    /**
     * Refuses TRIGGER_RULE requests for the rest of the tick, after a chain overflow.
     */
    public void haltChaining() {
        chainingHalted = true;
    }

    public boolean isChainingHalted() {
        return chainingHalted;
    }

    /**
     * @return the rule ids evaluated so far, in evaluation order.
     */
    public Set<String> evaluatedRules() {
        return Collections.unmodifiableSet(evaluated);
    }
}
