package org.helmsman.runtime.conditions;

import java.util.ArrayList;
import java.util.List;

import org.helmsman.runtime.errors.Failure;
import org.helmsman.runtime.model.ConditionLogic;

/**
 * Outcome of evaluating all conditions of a rule.
 *
 * @param evaluations Every condition's evaluation, in declaration order.
 * @param logic The combining logic.
 * @param satisfied Whether the rule triggers.
 * @param failure The first failure among the evaluations, or null.
 */
public record ConditionSetEvaluation(
        List<ConditionEvaluation> evaluations,
        ConditionLogic logic,
        boolean satisfied,
        Failure failure) {

    public ConditionSetEvaluation {
        evaluations = List.copyOf(evaluations);
    }

    /**
     * @return the conditions that evaluated to true, rendered as messages.
     */
    public List<String> conditionsMet() {
        List<String> out = new ArrayList<>();
        for (ConditionEvaluation evaluation : evaluations) {
            if (evaluation.result()) {
                out.add(evaluation.message());
            }
        }
        return out;
    }

    /**
     * @return the distinct event types read by any condition, in first-seen order.
     */
    public List<String> observedEvents() {
        List<String> out = new ArrayList<>();
        for (ConditionEvaluation evaluation : evaluations) {
            for (String type : evaluation.observedEvents()) {
                if (!out.contains(type)) {
                    out.add(type);
                }
            }
        }
        return out;
    }
}
