package org.helmsman.runtime.explain;

import java.util.List;

import org.helmsman.runtime.actions.ActionApplication;
import org.helmsman.runtime.actions.Recommendation;
import org.helmsman.runtime.conditions.ConditionEvaluation;
import org.helmsman.runtime.errors.Failure;
import org.helmsman.runtime.model.ActionType;
import org.helmsman.runtime.model.ConditionLogic;
import org.helmsman.runtime.model.Event;
import org.helmsman.runtime.model.Value;

/**
 * Causal record of one rule evaluation.
 * <p>
 * One explanation exists per rule evaluated in a tick, whether it triggered or not. An event
 * that caused a rule to trigger shows up in {@link Cause#eventsObserved()} and in the condition
 * evaluations; {@link #triggeredBy()} is only set for evaluations queued by TRIGGER_RULE.
 *
 * @param ruleId The rule.
 * @param priority The rule priority.
 * @param triggered Whether the conditions held and the actions ran.
 * @param timestamp The tick.
 * @param chainDepth 0 for the priority pass, otherwise the TRIGGER_RULE chain depth.
 * @param conditionsEvaluated Every condition with its resolved operands and result.
 * @param logicUsed AND or OR.
 * @param actionsApplied Every action that ran, with its concrete effect.
 * @param sideEffects Human readable effects that are not state changes, and failures.
 * @param eventsGenerated Events spawned by this rule.
 * @param conflictsEncountered Ids of conflicts this rule's writes ran into.
 * @param triggeredBy The rule whose TRIGGER_RULE queued this evaluation, or null.
 * @param triggeredRules Rules this evaluation queued through TRIGGER_RULE.
 * @param message The expanded explanation template.
 * @param cause Structured cause summary.
 * @param effect Structured effect summary.
 * @param failure The error that aborted the rule, or null.
 */
public record Explanation(
        String ruleId,
        int priority,
        boolean triggered,
        long timestamp,
        int chainDepth,
        List<ConditionEvaluation> conditionsEvaluated,
        ConditionLogic logicUsed,
        List<ActionApplication> actionsApplied,
        List<String> sideEffects,
        List<Event> eventsGenerated,
        List<String> conflictsEncountered,
        String triggeredBy,
        List<String> triggeredRules,
        String message,
        Cause cause,
        Effect effect,
        Failure failure) {

    public Explanation {
        conditionsEvaluated = List.copyOf(conditionsEvaluated);
        actionsApplied = List.copyOf(actionsApplied);
        sideEffects = List.copyOf(sideEffects);
        eventsGenerated = List.copyOf(eventsGenerated);
        conflictsEncountered = List.copyOf(conflictsEncountered);
        triggeredRules = List.copyOf(triggeredRules);
    }

    public boolean failed() {
        return failure != null;
    }

    /**
     * Why a rule ran.
     *
     * @param conditionsMet The conditions that held, rendered.
     * @param eventsObserved Event types the conditions read while present.
     * @param triggeredBy The requesting rule for TRIGGER_RULE chains, or null.
     */
    public record Cause(List<String> conditionsMet, List<String> eventsObserved, String triggeredBy) {
        public Cause {
            conditionsMet = List.copyOf(conditionsMet);
            eventsObserved = List.copyOf(eventsObserved);
        }
    }

    /**
     * What a rule did.
     *
     * @param changes Committed writes.
     * @param recommendations Values recommended without writing.
     * @param eventsSpawned Event types spawned.
     * @param rulesTriggered Rules queued through TRIGGER_RULE.
     */
    public record Effect(
            List<StateChange> changes,
            List<Recommendation> recommendations,
            List<String> eventsSpawned,
            List<String> rulesTriggered) {
        public Effect {
            changes = List.copyOf(changes);
            recommendations = List.copyOf(recommendations);
            eventsSpawned = List.copyOf(eventsSpawned);
            rulesTriggered = List.copyOf(rulesTriggered);
        }
    }

    /**
     * One write and the values around it.
     *
     * @param type SET, ADD or CLAMP.
     * @param target The path.
     * @param from The value before, absent if the path was unset.
     * @param to The value after conflict resolution.
     */
    public record StateChange(ActionType type, String target, Value from, Value to) {
    }
}
