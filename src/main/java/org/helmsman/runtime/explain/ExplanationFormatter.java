package org.helmsman.runtime.explain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.helmsman.runtime.actions.ActionApplication;
import org.helmsman.runtime.conditions.ConditionEvaluation;
import org.helmsman.runtime.conflicts.ConflictRecord;
import org.helmsman.runtime.history.StateSnapshot;
import org.helmsman.runtime.model.Event;
import org.helmsman.runtime.model.Value;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Renders explanations for display and export.
 * <p>
 * The educational format groups an explanation into <em>when</em>, <em>why</em>,
 * <em>what happened</em> and the <em>causal chain</em>. JSON export goes through Gson over plain
 * maps and lists, so the output does not depend on the shape of the Java records.
 */
public final class ExplanationFormatter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    private ExplanationFormatter() {
    }

    /**
     * @return the explanation in the educational layout.
     */
    public static Map<String, Object> educational(Explanation explanation) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("rule_id", explanation.ruleId());
        out.put("priority", explanation.priority());
        out.put("triggered", explanation.triggered());
        out.put("when", "Time step " + explanation.timestamp());

        List<Map<String, Object>> conditions = new ArrayList<>();
        for (ConditionEvaluation evaluation : explanation.conditionsEvaluated()) {
            Map<String, Object> condition = new LinkedHashMap<>();
            condition.put("condition", evaluation.condition().toString());
            condition.put("actual_values", render(evaluation.leftValue()) + " vs " + render(evaluation.rightValue()));
            condition.put("result", evaluation.result());
            condition.put("explanation", evaluation.message());
            conditions.add(condition);
        }
        Map<String, Object> why = new LinkedHashMap<>();
        why.put("conditions", conditions);
        why.put("logic", explanation.logicUsed().name());
        out.put("why", why);

        List<Map<String, Object>> actions = new ArrayList<>();
        for (ActionApplication application : explanation.actionsApplied()) {
            Map<String, Object> action = new LinkedHashMap<>();
            action.put("action", application.action().type().name());
            action.put("target", application.target());
            action.put("changed_from", plain(application.before()));
            action.put("changed_to", plain(application.after()));
            action.put("explanation", application.message());
            actions.add(action);
        }
        out.put("what_happened", Map.of("actions", actions));
        out.put("side_effects", explanation.sideEffects());

        Map<String, Object> chain = new LinkedHashMap<>();
        chain.put("triggered_by", explanation.triggeredBy());
        chain.put("triggered_rules", explanation.triggeredRules());
        chain.put("events", explanation.eventsGenerated().stream().map(Event::id).toList());
        out.put("causal_chain", chain);
        out.put("message", explanation.message());
        if (explanation.failure() != null) {
            out.put("error", explanation.failure().toString());
        }
        return out;
    }

    /**
     * @return the report as nested maps: educational explanations plus conflicts and diagnostics.
     */
    public static Map<String, Object> report(TickReport report) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tick", report.tick());
        out.put("explanations", report.explanations().stream().map(ExplanationFormatter::educational).toList());
        List<Map<String, Object>> conflicts = new ArrayList<>();
        for (ConflictRecord record : report.conflicts()) {
            Map<String, Object> conflict = new LinkedHashMap<>();
            conflict.put("id", record.id());
            conflict.put("path", record.path());
            conflict.put("conflicting_rules", record.conflictingRules());
            conflict.put("conflicting_actions", record.conflictingActions());
            conflict.put("resolution_strategy", record.strategy().name());
            conflict.put("final_value", plain(record.resolution().finalValue()));
            conflict.put("winning_rule", record.resolution().winningRule());
            conflict.put("merged_rules", record.resolution().mergedRules());
            conflict.put("note", record.resolution().note());
            conflict.put("resolved", record.resolved());
            conflicts.add(conflict);
        }
        out.put("conflicts", conflicts);
        out.put("recommendations", report.recommendations().stream()
                .map(r -> Map.of("rule_id", r.ruleId(), "target", r.target(), "value", r.value().render()))
                .toList());
        out.put("log_entries", report.logEntries().stream().map(Object::toString).toList());
        out.put("skipped_rules", report.skippedRules());
        out.put("diagnostics", report.diagnostics());
        out.put("halted", report.halted());
        return out;
    }

    /**
     * @return the committed state of a snapshot as nested maps, without the report.
     */
    public static Map<String, Object> state(StateSnapshot snapshot) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("time_step", snapshot.timeStep());
        Map<String, Object> agents = new LinkedHashMap<>();
        snapshot.agents().forEach((id, fields) -> agents.put(id, plainMap(fields)));
        out.put("agents", agents);
        out.put("environment", plainMap(snapshot.environment()));
        out.put("global_metrics", plainMap(snapshot.metrics()));
        Map<String, Object> events = new LinkedHashMap<>();
        snapshot.events().forEach((type, event) -> {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("id", event.id());
            e.put("source_rule", event.sourceRule());
            e.put("timestamp", event.timestamp());
            e.put("severity", event.severity().name().toLowerCase(Locale.ROOT));
            e.put("payload", plainMap(event.payload()));
            events.put(type, e);
        });
        out.put("events", events);
        return out;
    }

    /**
     * @return a pretty-printed JSON document of the snapshot's state and report.
     */
    public static String toJson(StateSnapshot snapshot) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("state", state(snapshot));
        out.put("report", report(snapshot.report()));
        return GSON.toJson(out);
    }

    public static String toJson(Explanation explanation) {
        return GSON.toJson(educational(explanation));
    }

    private static Map<String, Object> plainMap(Map<String, Value> values) {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, plain(v)));
        return out;
    }

    private static Object plain(Value value) {
        return value == null ? null : value.toJava();
    }

    private static String render(Value value) {
        return value == null ? "?" : value.render();
    }
}
