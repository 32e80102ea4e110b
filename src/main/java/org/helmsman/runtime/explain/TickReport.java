package org.helmsman.runtime.explain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.helmsman.runtime.actions.LogEntry;
import org.helmsman.runtime.actions.Recommendation;
import org.helmsman.runtime.conflicts.ConflictRecord;
import org.helmsman.runtime.input.InputRecord;

/**
 * Everything a tick produced besides the state itself.
 *
 * @param tick The tick.
 * @param inputs Inputs applied at the start of the tick.
 * @param explanations One per evaluated rule, in evaluation order.
 * @param conflicts Conflict records, in the order they occurred.
 * @param recommendations Recommendations of all rules.
 * @param logEntries LOG entries of all rules.
 * @param skippedRules Chained evaluations dropped when a chain overflow halted chaining.
 * @param diagnostics Tick-level problems, e.g. a chain overflow.
 * @param halted True if a chain overflow halted rule chaining this tick.
 */
public record TickReport(
        long tick,
        List<InputRecord> inputs,
        List<Explanation> explanations,
        List<ConflictRecord> conflicts,
        List<Recommendation> recommendations,
        List<LogEntry> logEntries,
        List<String> skippedRules,
        List<String> diagnostics,
        boolean halted) {

    public TickReport {
        inputs = List.copyOf(inputs);
        explanations = List.copyOf(explanations);
        conflicts = List.copyOf(conflicts);
        recommendations = List.copyOf(recommendations);
        logEntries = List.copyOf(logEntries);
        skippedRules = List.copyOf(skippedRules);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return the explanation of a rule, or empty if it was not evaluated this tick.
     */
    public Optional<Explanation> explanation(String ruleId) {
        return explanations.stream().filter(e -> e.ruleId().equals(ruleId)).findFirst();
    }

    /**
     * @return ids of the rules that triggered, in evaluation order.
     */
    public List<String> triggeredRules() {
        List<String> out = new ArrayList<>();
        for (Explanation explanation : explanations) {
            if (explanation.triggered()) {
                out.add(explanation.ruleId());
            }
        }
        return out;
    }

    /**
     * @return ids of the rules in evaluation order.
     */
    public List<String> evaluationOrder() {
        return explanations.stream().map(Explanation::ruleId).toList();
    }
}
