package org.helmsman.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.helmsman.runtime.actions.ActionApplication;
import org.helmsman.runtime.actions.ActionExecutor;
import org.helmsman.runtime.conditions.ConditionEvaluator;
import org.helmsman.runtime.conditions.ConditionSetEvaluation;
import org.helmsman.runtime.conflicts.ConflictResolver;
import org.helmsman.runtime.errors.EngineException;
import org.helmsman.runtime.errors.Failure;
import org.helmsman.runtime.errors.RuleChainOverflowException;
import org.helmsman.runtime.explain.Explanation;
import org.helmsman.runtime.explain.ExplanationBuilder;
import org.helmsman.runtime.explain.RuleTrace;
import org.helmsman.runtime.explain.TickReport;
import org.helmsman.runtime.history.StateHistory;
import org.helmsman.runtime.history.StateSnapshot;
import org.helmsman.runtime.input.InputCommand;
import org.helmsman.runtime.input.InputQueue;
import org.helmsman.runtime.input.InputRecord;
import org.helmsman.runtime.input.InputTranslator;
import org.helmsman.runtime.input.PathWrite;
import org.helmsman.runtime.model.Action;
import org.helmsman.runtime.model.Rule;
import org.helmsman.runtime.model.RuleSet;
import org.helmsman.runtime.model.SystemState;
import org.helmsman.runtime.model.Value;
import org.helmsman.runtime.path.PathResolver;
import org.helmsman.runtime.spi.ITickListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the rule set against the simulation state, one tick at a time.
 * <p>
 * A tick proceeds as follows:
 * <ol>
 *   <li>Buffered inputs are translated and written to the state.</li>
 *   <li>The event bus starts the tick (cleared, or consumed events dropped).</li>
 *   <li>All rules are queued by descending priority, ties in declaration order.</li>
 *   <li>Rules are taken from the front of the queue and evaluated at most once each. A triggered
 *       rule applies its actions in order; writes go through the tick's {@link ConflictResolver}.</li>
 *   <li>TRIGGER_RULE requests are pushed to the front of the queue in declared order, one chain
 *       level deeper. A request beyond the maximum chain depth fails the requesting rule and halts
 *       chaining for the rest of the tick: queued chained evaluations are dropped and later
 *       requests are ignored, while the scheduled priority pass continues. Changes made so far
 *       are kept.</li>
 *   <li>The state advances its time step and an immutable snapshot with the tick report is
 *       appended to the history, then tick listeners are notified.</li>
 * </ol>
 * A failure inside one rule aborts only that rule's remaining actions and is recorded on its
 * explanation; {@link #tick()} itself does not throw for rule failures.
 * <p>
 * <strong>Thread Safety:</strong> {@link #tick()} is serialized per engine. {@link #submit} may be
 * called from any thread. Readers only ever see committed snapshots through
 * {@link #latestSnapshot()} and {@link #history()}. Engines share nothing, so independent
 * simulations can run side by side.
 */
public class DecisionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DecisionEngine.class);

    /**
     * Metric counting triggered rules, maintained when decision tracking is on.
     */
    public static final String RULES_TRIGGERED_METRIC = "rules_triggered_count";

    /**
     * Metric counting applied actions, maintained when decision tracking is on.
     */
    public static final String DECISION_COUNT_METRIC = "decision_count";

    private final RuleSet rules;
    private final SystemState state;
    private final EngineSettings settings;
    private final InputTranslator translator;
    private final ConditionEvaluator evaluator = new ConditionEvaluator();
    private final ActionExecutor executor = new ActionExecutor();
    private final InputQueue inputs = new InputQueue();
    private final List<ITickListener> listeners = new CopyOnWriteArrayList<>();
    private volatile StateSnapshot latest;

    /**
     * @param rules The rules.
     * @param state The initial state; the engine becomes its only writer.
     * @param settings Engine tuning.
     */
    public DecisionEngine(RuleSet rules, SystemState state, EngineSettings settings) {
        this(rules, state, settings, new InputTranslator());
    }

    /**
     * @param rules The rules.
     * @param state The initial state; the engine becomes its only writer.
     * @param settings Engine tuning.
     * @param translator Input types the engine accepts.
     */
    public DecisionEngine(RuleSet rules, SystemState state, EngineSettings settings, InputTranslator translator) {
        this.rules = rules;
        this.state = state;
        this.settings = settings;
        this.translator = translator;
        LOG.info("Decision engine created: {} rules, {} agents, max chain depth {}, conflict default {}",
                rules.size(), state.agents().size(), settings.maxChainDepth(),
                settings.conflictPolicy().defaultStrategy());
    }

    /**
     * Buffers an input for the next tick.
     */
    public void submit(InputCommand command) {
        inputs.submit(command);
    }

    /**
     * Adds a listener notified after every committed tick.
     */
    public void addTickListener(ITickListener listener) {
        listeners.add(listener);
    }

    /**
     * Runs one tick.
     *
     * @return the committed snapshot.
     */
    public synchronized StateSnapshot tick() {
        long tick = state.getTimeStep();
        ExplanationBuilder report = new ExplanationBuilder(tick);

        applyInputs(tick, report);
        state.events().beginTick(tick, settings.eventPersistence());

        ConflictResolver resolver = new ConflictResolver(tick, settings.conflictPolicy());
        TickContext context = new TickContext(tick, state, rules, resolver, settings.maxChainDepth());
        Deque<RuleInvocation> queue = new ArrayDeque<>();
        for (Rule rule : rules.evaluationOrder()) {
            queue.addLast(RuleInvocation.scheduled(rule));
        }

        while (!queue.isEmpty()) {
            RuleInvocation invocation = queue.pollFirst();
            if (!context.markEvaluated(invocation.ruleId())) {
                continue;
            }
            RuleTrace trace = report.begin(invocation);
            List<RuleInvocation> chained = new ArrayList<>();
            RuleChainOverflowException overflow = evaluate(invocation, trace, context, chained);
            report.complete(trace, state);
            if (overflow != null) {
                halt(report, queue, context, invocation, chained, overflow);
                continue;
            }
            for (int i = chained.size() - 1; i >= 0; i--) {
                queue.addFirst(chained.get(i));
            }
        }

        TickReport tickReport = report.build(resolver.records());
        if (settings.trackDecisions()) {
            trackDecisions(tickReport);
        }
        state.advanceTimeStep();
        StateSnapshot snapshot = StateSnapshot.capture(state, tick, tickReport);
        state.history().append(snapshot);
        latest = snapshot;
        LOG.debug("Tick {} committed: {} rule(s) evaluated, {} triggered, {} conflict(s)", tick,
                tickReport.explanations().size(), tickReport.triggeredRules().size(), tickReport.conflicts().size());
        notifyListeners(snapshot);
        return snapshot;
    }

    /**
     * Runs several ticks.
     *
     * @return the committed snapshots, in order.
     */
    public List<StateSnapshot> run(int ticks) {
        List<StateSnapshot> out = new ArrayList<>(ticks);
        for (int i = 0; i < ticks; i++) {
            out.add(tick());
        }
        return out;
    }

    /**
     * @return the snapshot of the last committed tick, or empty before the first tick.
     */
    public Optional<StateSnapshot> latestSnapshot() {
        return Optional.ofNullable(latest);
    }

    public StateHistory history() {
        return state.history();
    }

    /**
     * @return the number of the next tick to run.
     */
    public long nextTick() {
        StateSnapshot snapshot = latest;
        return snapshot == null ? initialTimeStep() : snapshot.timeStep();
    }

    public RuleSet rules() {
        return rules;
    }

    public EngineSettings settings() {
        return settings;
    }

    private synchronized long initialTimeStep() {
        return state.getTimeStep();
    }

    private RuleChainOverflowException evaluate(RuleInvocation invocation, RuleTrace trace, TickContext context,
                                                List<RuleInvocation> chained) {
        Rule rule = invocation.rule();
        ConditionSetEvaluation conditions = evaluator.evaluateAll(rule.conditions(), rule.logic(), state);
        trace.conditions(conditions);
        if (conditions.failure() != null) {
            LOG.warn("Rule '{}' failed at tick {}: {}", rule.id(), context.getTick(), conditions.failure());
            return null;
        }
        if (!conditions.satisfied()) {
            LOG.debug("Rule '{}' not triggered at tick {}", rule.id(), context.getTick());
            return null;
        }
        for (String eventType : conditions.observedEvents()) {
            state.events().markConsumed(eventType);
        }

        for (Action action : rule.actions()) {
            try {
                ActionApplication application = executor.apply(action, invocation, context);
                trace.record(application);
                String requested = application.triggerRequest();
                if (requested != null && chained.stream().noneMatch(c -> c.ruleId().equals(requested))) {
                    chained.add(invocation.chained(rules.find(requested).orElseThrow()));
                }
            } catch (RuleChainOverflowException e) {
                trace.fail(Failure.of(e));
                LOG.warn("Rule chain overflow at tick {} in rule '{}': {}", context.getTick(), rule.id(),
                        e.getMessage());
                return e;
            } catch (EngineException e) {
                trace.fail(Failure.of(e));
                LOG.warn("Rule '{}' failed at tick {}: {}", rule.id(), context.getTick(), e.getMessage());
                return null;
            }
        }
        LOG.debug("Rule '{}' triggered at tick {} (depth {}, triggered by {})", rule.id(), context.getTick(),
                invocation.depth(), invocation.triggeredBy());
        return null;
    }

    private void halt(ExplanationBuilder report, Deque<RuleInvocation> queue, TickContext context,
                      RuleInvocation failed, List<RuleInvocation> requested, RuleChainOverflowException overflow) {
        context.haltChaining();
        List<String> skipped = new ArrayList<>();
        List<RuleInvocation> dropped = new ArrayList<>(requested);
        Iterator<RuleInvocation> pending = queue.iterator();
        while (pending.hasNext()) {
            RuleInvocation next = pending.next();
            if (next.depth() > 0) {
                dropped.add(next);
                pending.remove();
            }
        }
        for (RuleInvocation invocation : dropped) {
            if (!context.isEvaluated(invocation.ruleId()) && !skipped.contains(invocation.ruleId())) {
                skipped.add(invocation.ruleId());
            }
        }
        report.halt(skipped);
        report.diagnostic("Rule chain overflow in rule '" + failed.ruleId() + "' at depth " + failed.depth()
                + ": " + overflow.getMessage() + "; " + skipped.size() + " chained rule(s) skipped");
    }

    private void applyInputs(long tick, ExplanationBuilder report) {
        for (InputCommand command : inputs.drain()) {
            Map<String, Optional<Value>> previous = new LinkedHashMap<>();
            try {
                List<PathWrite> writes = translator.translate(command, state);
                for (PathWrite write : writes) {
                    previous.putIfAbsent(write.path(), PathResolver.tryResolve(state, write.path()));
                    PathResolver.write(state, write.path(), write.value());
                }
                report.recordInput(new InputRecord(command, List.copyOf(previous.keySet()), true, "applied"));
            } catch (EngineException | IllegalArgumentException e) {
                rollback(previous);
                LOG.warn("Input '{}' rejected at tick {}: {}", command, tick, e.getMessage());
                report.recordInput(new InputRecord(command, List.of(), false, e.getMessage()));
            }
        }
    }

    private void rollback(Map<String, Optional<Value>> previous) {
        previous.forEach((path, value) -> {
            if (value.isPresent()) {
                PathResolver.write(state, path, value.get());
            } else {
                PathResolver.remove(state, path);
            }
        });
    }

    private void trackDecisions(TickReport report) {
        int triggered = 0;
        int actions = 0;
        for (Explanation explanation : report.explanations()) {
            if (explanation.triggered()) {
                triggered++;
            }
            actions += explanation.actionsApplied().size();
        }
        increment(RULES_TRIGGERED_METRIC, triggered);
        increment(DECISION_COUNT_METRIC, actions);
    }

    private void increment(String metric, int amount) {
        double current = state.metric(metric)
                .filter(Value.NumberValue.class::isInstance)
                .map(v -> ((Value.NumberValue) v).value())
                .orElse(0.0);
        state.putMetric(metric, Value.number(current + amount));
    }

    private void notifyListeners(StateSnapshot snapshot) {
        for (ITickListener listener : listeners) {
            try {
                listener.onTickCommitted(snapshot);
            } catch (Exception e) {
                LOG.warn("Tick listener '{}' failed at tick {}: {}",
                        listener.getClass().getSimpleName(), snapshot.tick(), e.getMessage());
            }
        }
    }
}
