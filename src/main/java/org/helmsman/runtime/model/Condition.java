package org.helmsman.runtime.model;

import java.util.Objects;

/**
 * A single comparison of a rule.
 * <p>
 * Either side may be a field path (text such as {@code "agents.tugboat.speed"}) or a literal. A
 * path on both sides compares two agents, or an agent with the environment.
 *
 * @param left The left operand.
 * @param operator The comparison.
 * @param right The right operand.
 */
public record Condition(Value left, Operator operator, Value right) {

    public Condition {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    /**
     * Convenience factory taking plain Java operands.
     *
     * @param left A path or literal (Number, String, Boolean).
     * @param operator The operator symbol, e.g. {@code ">"} or {@code "in"}.
     * @param right A path or literal; a Collection for {@code in}.
     * @return The condition.
     */
    public static Condition of(Object left, String operator, Object right) {
        return new Condition(Value.of(left), Operator.fromSymbol(operator), Value.of(right));
    }

    public static Condition of(Object left, Operator operator, Object right) {
        return new Condition(Value.of(left), operator, Value.of(right));
    }

    @Override
    public String toString() {
        return left.render() + " " + operator.symbol() + " " + right.render();
    }
}
