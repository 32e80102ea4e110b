package org.helmsman.runtime.explain;

import java.util.ArrayList;
import java.util.List;

import org.helmsman.runtime.RuleInvocation;
import org.helmsman.runtime.actions.ActionApplication;
import org.helmsman.runtime.actions.LogEntry;
import org.helmsman.runtime.actions.Recommendation;
import org.helmsman.runtime.conflicts.ConflictRecord;
import org.helmsman.runtime.input.InputRecord;
import org.helmsman.runtime.path.IStateReader;

/**
 * Assembles the {@link TickReport} of one tick.
 * <p>
 * Explanations are appended in the order rules are evaluated, each one completed before the next
 * rule starts, so {@code triggered_by} and {@code triggered_rules} links always point at
 * explanations of the same report.
 */
public class ExplanationBuilder {

    private final long tick;
    private final List<InputRecord> inputs = new ArrayList<>();
    private final List<Explanation> explanations = new ArrayList<>();
    private final List<String> diagnostics = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();
    private boolean halted;

    public ExplanationBuilder(long tick) {
        this.tick = tick;
    }

    /**
     * Starts the trace of a rule evaluation.
     */
    public RuleTrace begin(RuleInvocation invocation) {
        return new RuleTrace(tick, invocation);
    }

    /**
     * Finishes a trace and appends its explanation.
     *
     * @param trace The trace.
     * @param state The state after the rule's actions.
     * @return the explanation.
     */
    public Explanation complete(RuleTrace trace, IStateReader state) {
        Explanation explanation = trace.finish(state);
        explanations.add(explanation);
        return explanation;
    }

    public void recordInput(InputRecord input) {
        inputs.add(input);
    }

    public void diagnostic(String message) {
        diagnostics.add(message);
    }

    /**
     * Marks rule chaining of the tick as halted.
     *
     * @param skippedRules Chained evaluations that were dropped.
     */
    public void halt(List<String> skippedRules) {
        this.halted = true;
        this.skipped.addAll(skippedRules);
    }

    /**
     * @param conflicts The conflict records of the tick.
     * @return the finished report.
     */
    public TickReport build(List<ConflictRecord> conflicts) {
        List<Recommendation> recommendations = new ArrayList<>();
        List<LogEntry> logEntries = new ArrayList<>();
        for (Explanation explanation : explanations) {
            for (ActionApplication application : explanation.actionsApplied()) {
                if (application.recommendation() != null) {
                    recommendations.add(application.recommendation());
                }
                if (application.logEntry() != null) {
                    logEntries.add(application.logEntry());
                }
            }
        }
        return new TickReport(tick, inputs, explanations, conflicts, recommendations, logEntries, skipped,
                diagnostics, halted);
    }
}
