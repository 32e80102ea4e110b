package org.helmsman.runtime.conditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.helmsman.runtime.errors.EngineException;
import org.helmsman.runtime.errors.Failure;
import org.helmsman.runtime.errors.TypeMismatchException;
import org.helmsman.runtime.model.Condition;
import org.helmsman.runtime.model.ConditionLogic;
import org.helmsman.runtime.model.Operator;
import org.helmsman.runtime.model.Value;
import org.helmsman.runtime.path.IStateReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates conditions against a state.
 * <p>
 * Operator semantics:
 * <ul>
 *   <li>{@code < > <= >=}: both sides must coerce to numbers (numbers, or text holding a number),
 *       otherwise {@link TypeMismatchException}.</li>
 *   <li>{@code == !=}: typed equality, no coercion across types. {@code absent} equals {@code false}
 *       and {@code absent}, which lets {@code events.x == false} hold while no event is present.</li>
 *   <li>{@code in}: the right side must be a sequence; membership uses typed equality.</li>
 * </ul>
 * Failures never escape: they are captured in the returned {@link ConditionEvaluation}.
 */
public class ConditionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionEvaluator.class);

    /**
     * Evaluates a single condition.
     *
     * @param condition The condition.
     * @param reader The state to read.
     * @return the evaluation, never null.
     */
    public ConditionEvaluation evaluate(Condition condition, IStateReader reader) {
        Value left = null;
        Value right = null;
        List<String> observed = new ArrayList<>();
        try {
            left = OperandResolver.resolve(condition.left(), reader);
            noteEvent(condition.left(), left, observed);
            right = OperandResolver.resolve(condition.right(), reader);
            noteEvent(condition.right(), right, observed);
            boolean result = compare(left, condition.operator(), right);
            String message = describe(condition, left, right) + " -> " + result;
            return new ConditionEvaluation(condition, left, right, result, message, null, observed);
        } catch (EngineException e) {
            String message = describe(condition, left, right) + " -> error: " + e.getMessage();
            return new ConditionEvaluation(condition, left, right, false, message, Failure.of(e), observed);
        }
    }

    /**
     * Evaluates every condition and combines the results.
     * <p>
     * All conditions are evaluated and recorded even when the outcome is already decided, so the
     * explanation shows the full list. An empty list is satisfied. If any condition failed the set
     * is not satisfied, whatever the logic says.
     *
     * @param conditions The conditions in declaration order.
     * @param logic AND or OR.
     * @param reader The state to read.
     * @return the combined evaluation.
     */
    public ConditionSetEvaluation evaluateAll(List<Condition> conditions, ConditionLogic logic, IStateReader reader) {
        List<ConditionEvaluation> evaluations = new ArrayList<>(conditions.size());
        Failure failure = null;
        for (Condition condition : conditions) {
            ConditionEvaluation evaluation = evaluate(condition, reader);
            evaluations.add(evaluation);
            if (failure == null && evaluation.failed()) {
                failure = evaluation.failure();
            }
        }
        boolean satisfied;
        if (failure != null) {
            satisfied = false;
        } else if (evaluations.isEmpty()) {
            satisfied = true;
        } else if (logic == ConditionLogic.OR) {
            satisfied = evaluations.stream().anyMatch(ConditionEvaluation::result);
        } else {
            satisfied = evaluations.stream().allMatch(ConditionEvaluation::result);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Evaluated {} condition(s) with {}: {}", evaluations.size(), logic, satisfied);
        }
        return new ConditionSetEvaluation(evaluations, logic, satisfied, failure);
    }

    /**
     * Applies an operator to two resolved values.
     *
     * @throws TypeMismatchException if the operand types do not fit the operator.
     */
    public static boolean compare(Value left, Operator operator, Value right) {
        return switch (operator) {
            case LT -> toNumber(left, operator) < toNumber(right, operator);
            case GT -> toNumber(left, operator) > toNumber(right, operator);
            case LE -> toNumber(left, operator) <= toNumber(right, operator);
            case GE -> toNumber(left, operator) >= toNumber(right, operator);
            case EQ -> typedEquals(left, right);
            case NE -> !typedEquals(left, right);
            case IN -> {
                if (!(right instanceof Value.ListValue list)) {
                    throw new TypeMismatchException("Operator 'in' requires a sequence on the right, got "
                            + right.typeName());
                }
                yield list.elements().stream().anyMatch(element -> typedEquals(left, element));
            }
        };
    }

    /**
     * Typed equality: numbers compare numerically, other types only equal values of the same type.
     * {@code absent} equals {@code absent} and {@code false}.
     */
    public static boolean typedEquals(Value left, Value right) {
        if (left.isAbsent() || right.isAbsent()) {
            Value other = left.isAbsent() ? right : left;
            return other.isAbsent() || other.equals(Value.bool(false));
        }
        if (left instanceof Value.NumberValue a && right instanceof Value.NumberValue b) {
            return a.value() == b.value();
        }
        if (left instanceof Value.ListValue a && right instanceof Value.ListValue b) {
            if (a.elements().size() != b.elements().size()) {
                return false;
            }
            for (int i = 0; i < a.elements().size(); i++) {
                if (!typedEquals(a.elements().get(i), b.elements().get(i))) {
                    return false;
                }
            }
            return true;
        }
        return left.equals(right);
    }

    /**
     * Coerces a value to a number for the numeric operators.
     *
     * @throws TypeMismatchException if the value is neither a number nor numeric text.
     */
    public static double toNumber(Value value, Operator operator) {
        if (value instanceof Value.NumberValue number) {
            return number.value();
        }
        if (value instanceof Value.TextValue text) {
            Optional<Double> parsed = parseNumber(text.value());
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        throw new TypeMismatchException("Operator '" + operator + "' requires numbers, got "
                + value.typeName() + " '" + value.render() + "'");
    }

    private static Optional<Double> parseNumber(String text) {
        try {
            double parsed = Double.parseDouble(text.trim());
            return Double.isNaN(parsed) ? Optional.empty() : Optional.of(parsed);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static void noteEvent(Value operand, Value resolved, List<String> observed) {
        if (resolved.isAbsent()) {
            return;
        }
        OperandResolver.eventTypeOf(operand).ifPresent(type -> {
            if (!observed.contains(type)) {
                observed.add(type);
            }
        });
    }

    private static String describe(Condition condition, Value left, Value right) {
        return side(condition.left(), left) + " " + condition.operator() + " " + side(condition.right(), right);
    }

    private static String side(Value declared, Value resolved) {
        if (resolved == null) {
            return declared.render();
        }
        if (declared.equals(resolved)) {
            return resolved.render();
        }
        return declared.render() + " (" + resolved.render() + ")";
    }
}
