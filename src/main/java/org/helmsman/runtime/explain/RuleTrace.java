package org.helmsman.runtime.explain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.helmsman.runtime.RuleInvocation;
import org.helmsman.runtime.actions.ActionApplication;
import org.helmsman.runtime.actions.Recommendation;
import org.helmsman.runtime.conditions.ConditionEvaluation;
import org.helmsman.runtime.conditions.ConditionSetEvaluation;
import org.helmsman.runtime.errors.Failure;
import org.helmsman.runtime.model.Event;
import org.helmsman.runtime.model.Rule;
import org.helmsman.runtime.model.Value;
import org.helmsman.runtime.path.FieldPath;
import org.helmsman.runtime.path.IStateReader;

/**
 * Collects the causal record of one rule evaluation while it happens.
 * <p>
 * The engine feeds the trace as it evaluates conditions and applies actions, then calls
 * {@link #finish(IStateReader)} once. Values seen along the way are captured for template
 * placeholders, so an explanation reports what the rule saw rather than what the state holds after
 * later rules ran.
 */
public class RuleTrace {

    private final long tick;
    private final RuleInvocation invocation;
    private final Map<String, Value> captured = new LinkedHashMap<>();
    private final List<ActionApplication> applications = new ArrayList<>();
    private final List<String> sideEffects = new ArrayList<>();
    private final List<Event> events = new ArrayList<>();
    private final List<String> conflicts = new ArrayList<>();
    private final List<String> triggeredRules = new ArrayList<>();
    private ConditionSetEvaluation conditions;
    private boolean triggered;
    private Failure failure;

    RuleTrace(long tick, RuleInvocation invocation) {
        this.tick = tick;
        this.invocation = invocation;
        Rule rule = invocation.rule();
        captured.put("rule_id", Value.text(rule.id()));
        captured.put("priority", Value.number(rule.priority()));
        captured.put("tick", Value.number(tick));
        captured.put("logic", Value.text(rule.logic().name()));
        captured.put("chain_depth", Value.number(invocation.depth()));
        if (invocation.triggeredBy() != null) {
            captured.put("triggered_by", Value.text(invocation.triggeredBy()));
        }
    }

    public String ruleId() {
        return invocation.ruleId();
    }

    /**
     * Records the condition evaluation and decides whether the rule triggers.
     */
    public void conditions(ConditionSetEvaluation evaluation) {
        this.conditions = evaluation;
        this.triggered = evaluation.satisfied();
        for (ConditionEvaluation condition : evaluation.evaluations()) {
            capture(condition.condition().left(), condition.leftValue());
            capture(condition.condition().right(), condition.rightValue());
        }
        if (evaluation.failure() != null) {
            fail(evaluation.failure());
        }
    }

    /**
     * Records one applied action.
     */
    public void record(ActionApplication application) {
        applications.add(application);
        switch (application.action().type()) {
            case SET, ADD, CLAMP -> {
                captured.put(application.target(), application.after());
                if (application.before() != null) {
                    captured.put(application.target() + ".before", application.before());
                }
                if (application.conflict() != null) {
                    conflicts.add(application.conflict().id());
                    sideEffects.add("Conflict " + application.conflict().id() + " on " + application.target()
                            + " resolved by " + application.conflict().strategy());
                }
            }
            case RECOMMEND -> {
                Recommendation recommendation = application.recommendation();
                captured.put("recommended." + recommendation.target(), recommendation.value());
                sideEffects.add(application.message());
            }
            case TRIGGER_RULE -> {
                String requested = application.triggerRequest();
                if (requested != null && triggeredRules.contains(requested)) {
                    sideEffects.add("Rule '" + requested + "' already requested by this rule; duplicate ignored");
                } else {
                    if (requested != null) {
                        triggeredRules.add(requested);
                    }
                    sideEffects.add(application.message());
                }
            }
            case SPAWN_EVENT -> {
                events.add(application.event());
                captured.put("event." + application.event().eventType(), Value.text(application.event().id()));
                sideEffects.add(application.message());
            }
            case LOG -> sideEffects.add(application.message());
        }
    }

    /**
     * Records the error that aborted the rule.
     */
    public void fail(Failure failure) {
        if (this.failure == null) {
            this.failure = failure;
            sideEffects.add("Error: " + failure);
        }
    }

    public boolean isTriggered() {
        return triggered;
    }

    public Failure getFailure() {
        return failure;
    }

    /**
     * Builds the explanation.
     *
     * @param state The state after the rule's actions, for placeholders that were not captured.
     */
    public Explanation finish(IStateReader state) {
        Rule rule = invocation.rule();
        String message;
        if (failure != null) {
            message = "Rule '" + rule.id() + "' failed: " + failure;
        } else if (!triggered) {
            message = "Rule '" + rule.id() + "' not triggered: conditions not met";
        } else if (rule.explanationTemplate().isBlank()) {
            message = "Rule '" + rule.id() + "' triggered";
        } else {
            TemplateRenderer.Rendered rendered = TemplateRenderer.render(rule.explanationTemplate(), captured, state);
            message = rendered.text();
            for (String placeholder : rendered.unresolved()) {
                sideEffects.add("Unresolved placeholder: " + placeholder);
            }
        }

        List<Explanation.StateChange> changes = new ArrayList<>();
        List<Recommendation> recommendations = new ArrayList<>();
        List<String> spawned = new ArrayList<>();
        for (ActionApplication application : applications) {
            if (application.isWrite()) {
                changes.add(new Explanation.StateChange(application.action().type(), application.target(),
                        application.before() == null ? Value.absent() : application.before(), application.after()));
            } else if (application.recommendation() != null) {
                recommendations.add(application.recommendation());
            } else if (application.event() != null) {
                spawned.add(application.event().eventType());
            }
        }

        ConditionSetEvaluation evaluation = conditions;
        List<ConditionEvaluation> evaluations = evaluation == null ? List.of() : evaluation.evaluations();
        Explanation.Cause cause = new Explanation.Cause(
                evaluation == null ? List.of() : evaluation.conditionsMet(),
                evaluation == null ? List.of() : evaluation.observedEvents(),
                invocation.triggeredBy());
        Explanation.Effect effect = new Explanation.Effect(changes, recommendations, spawned, triggeredRules);
        return new Explanation(rule.id(), rule.priority(), triggered, tick, invocation.depth(), evaluations,
                rule.logic(), applications, sideEffects, events, conflicts, invocation.triggeredBy(), triggeredRules,
                message, cause, effect, failure);
    }

    private void capture(Value declared, Value resolved) {
        if (resolved != null && declared instanceof Value.TextValue text && FieldPath.isPath(text.value())) {
            captured.put(text.value(), resolved);
        }
    }
}
