package org.helmsman.runtime.conditions;

import java.util.List;

import org.helmsman.runtime.errors.Failure;
import org.helmsman.runtime.model.Condition;
import org.helmsman.runtime.model.Value;

/**
 * Outcome of evaluating one condition, as recorded in explanations.
 *
 * @param condition The declared condition.
 * @param leftValue The resolved left side, or null if it could not be resolved.
 * @param rightValue The resolved right side, or null if it could not be resolved.
 * @param result The boolean outcome; false when the evaluation failed.
 * @param message Human readable account, e.g. {@code agents.tugboat_1.speed (8) > 7 -> true}.
 * @param failure The failure, or null.
 * @param observedEvents Event types this condition read while they were present.
 */
public record ConditionEvaluation(
        Condition condition,
        Value leftValue,
        Value rightValue,
        boolean result,
        String message,
        Failure failure,
        List<String> observedEvents) {

    public ConditionEvaluation {
        observedEvents = List.copyOf(observedEvents);
    }

    public boolean failed() {
        return failure != null;
    }
}
