package org.helmsman.runtime.errors;

/**
 * Thrown when a TRIGGER_RULE request would push a chain deeper than the configured maximum.
 * <p>
 * This is the only failure that halts the rest of the tick. State changes committed before the
 * overflow are kept, and the tick report carries a diagnostic naming the chain.
 */
public class RuleChainOverflowException extends EngineException {

    private final String requestedRuleId;
    private final int depth;
    private final int maxDepth;

    /**
     * @param requestedRuleId The rule the overflowing TRIGGER_RULE asked for
     * @param depth The chain depth the request would have reached
     * @param maxDepth The configured maximum chain depth
     */
    public RuleChainOverflowException(String requestedRuleId, int depth, int maxDepth) {
        super("Rule chain depth " + depth + " exceeds maximum " + maxDepth
                + " while triggering '" + requestedRuleId + "'");
        this.requestedRuleId = requestedRuleId;
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public String getRequestedRuleId() {
        return requestedRuleId;
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RULE_CHAIN_OVERFLOW;
    }
}
