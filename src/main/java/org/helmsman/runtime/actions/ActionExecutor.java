package org.helmsman.runtime.actions;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.helmsman.runtime.RuleInvocation;
import org.helmsman.runtime.TickContext;
import org.helmsman.runtime.conditions.OperandResolver;
import org.helmsman.runtime.conflicts.ClampRange;
import org.helmsman.runtime.conflicts.PendingWrite;
import org.helmsman.runtime.conflicts.WriteOutcome;
import org.helmsman.runtime.errors.InvalidActionException;
import org.helmsman.runtime.errors.RuleChainOverflowException;
import org.helmsman.runtime.errors.TypeMismatchException;
import org.helmsman.runtime.explain.TemplateRenderer;
import org.helmsman.runtime.model.Action;
import org.helmsman.runtime.model.Event;
import org.helmsman.runtime.model.SystemState;
import org.helmsman.runtime.model.Value;
import org.helmsman.runtime.path.FieldPath;
import org.helmsman.runtime.path.PathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies single actions to the live state of a tick.
 * <p>
 * Mutating actions (SET, ADD, CLAMP) compute their value against the current state and commit it
 * through the tick's {@link org.helmsman.runtime.conflicts.ConflictResolver}. The other types only
 * produce records: a recommendation, a trigger request, an event on the bus, or a log entry.
 * <p>
 * Any failure is thrown as an {@link org.helmsman.runtime.errors.EngineException}; the engine stops
 * the remaining actions of the rule and records it.
 */
public class ActionExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ActionExecutor.class);

    /**
     * Logger that LOG actions write to.
     */
    public static final String RULE_LOGGER = "org.helmsman.rules";

    private static final Logger RULE_LOG = LoggerFactory.getLogger(RULE_LOGGER);

    /**
     * Applies one action.
     *
     * @param action The action.
     * @param invocation The rule invocation the action belongs to.
     * @param context The running tick.
     * @return the concrete effect.
     * @throws InvalidActionException if a required field is missing or inconsistent.
     * @throws RuleChainOverflowException if a TRIGGER_RULE request exceeds the chain depth.
     * @throws org.helmsman.runtime.errors.EngineException for path and type failures.
     */
    public ActionApplication apply(Action action, RuleInvocation invocation, TickContext context) {
        ActionApplication application = switch (action.type()) {
            case SET -> applySet(action, invocation, context);
            case ADD -> applyAdd(action, invocation, context);
            case CLAMP -> applyClamp(action, invocation, context);
            case RECOMMEND -> applyRecommend(action, invocation, context);
            case TRIGGER_RULE -> applyTrigger(action, invocation, context);
            case SPAWN_EVENT -> applySpawn(action, invocation, context);
            case LOG -> applyLog(action, invocation, context);
        };
        LOG.debug("Rule '{}' applied {}: {}", invocation.ruleId(), action, application.message());
        return application;
    }

    private ActionApplication applySet(Action action, RuleInvocation invocation, TickContext context) {
        String target = requireTarget(action);
        Value value = OperandResolver.resolve(requireValue(action), context.getState());
        return commit(action, invocation, context, target, value, null);
    }

    private ActionApplication applyAdd(Action action, RuleInvocation invocation, TickContext context) {
        String target = requireTarget(action);
        Value delta = OperandResolver.resolve(requireValue(action), context.getState());
        Optional<Value> current = PathResolver.tryResolve(context.getState(), target);
        double base = current.isPresent() ? number(current.get(), "ADD on '" + target + "'") : 0.0;
        double sum = base + number(delta, "ADD value for '" + target + "'");
        return commit(action, invocation, context, target, Value.number(sum), null);
    }

    private ActionApplication applyClamp(Action action, RuleInvocation invocation, TickContext context) {
        String target = requireTarget(action);
        if (action.minValue() == null || action.maxValue() == null) {
            throw new InvalidActionException("CLAMP on '" + target + "' requires min_value and max_value");
        }
        if (action.minValue() > action.maxValue()) {
            throw new InvalidActionException("CLAMP on '" + target + "' has min_value " + action.minValue()
                    + " > max_value " + action.maxValue());
        }
        ClampRange range = new ClampRange(action.minValue(), action.maxValue());
        Value current = PathResolver.resolve(context.getState(), target);
        double clamped = range.clamp(number(current, "CLAMP on '" + target + "'"));
        return commit(action, invocation, context, target, Value.number(clamped), range);
    }

    private ActionApplication applyRecommend(Action action, RuleInvocation invocation, TickContext context) {
        String target = requireTarget(action);
        FieldPath.parse(target);
        Value value = OperandResolver.resolve(requireValue(action), context.getState());
        Recommendation recommendation = new Recommendation(context.getTick(), invocation.ruleId(), target, value);
        String message = "Recommended " + target + " = " + value.render();
        Value current = PathResolver.tryResolve(context.getState(), target).orElse(null);
        return new ActionApplication(action, target, current, current, true, message, null, null, null, null,
                recommendation);
    }

    private ActionApplication applyTrigger(Action action, RuleInvocation invocation, TickContext context) {
        String ruleId = action.ruleId();
        if (ruleId == null || ruleId.isBlank()) {
            throw new InvalidActionException("TRIGGER_RULE requires rule_id");
        }
        if (!context.getRules().contains(ruleId)) {
            throw new InvalidActionException("TRIGGER_RULE names unknown rule '" + ruleId + "'");
        }
        if (context.isEvaluated(ruleId)) {
            String message = "Rule '" + ruleId + "' already evaluated this tick; re-trigger ignored";
            return new ActionApplication(action, null, null, null, false, message, null, null, null, null, null);
        }
        if (context.isChainingHalted()) {
            String message = "Rule chaining halted this tick; request for '" + ruleId + "' ignored";
            return new ActionApplication(action, null, null, null, false, message, null, null, null, null, null);
        }
        int depth = invocation.depth() + 1;
        if (depth > context.getMaxChainDepth()) {
            throw new RuleChainOverflowException(ruleId, depth, context.getMaxChainDepth());
        }
        return new ActionApplication(action, null, null, null, true, "Triggered rule: " + ruleId, null, null, null,
                ruleId, null);
    }

    private ActionApplication applySpawn(Action action, RuleInvocation invocation, TickContext context) {
        String eventType = action.eventType();
        if (eventType == null || eventType.isBlank()) {
            throw new InvalidActionException("SPAWN_EVENT requires event_type");
        }
        if (eventType.contains(".")) {
            throw new InvalidActionException("Event type '" + eventType + "' must not contain '.'");
        }
        Map<String, Value> payload = new LinkedHashMap<>();
        action.eventPayload().forEach((key, raw) -> payload.put(key, resolvePayload(raw, context.getState())));
        Event event = context.getState().events().spawn(invocation.ruleId(), eventType, payload,
                action.eventSeverity());
        return new ActionApplication(action, null, null, null, true, "Spawned event: " + eventType, null, event,
                null, null, null);
    }

    private ActionApplication applyLog(Action action, RuleInvocation invocation, TickContext context) {
        if (action.logMessage() == null || action.logMessage().isBlank()) {
            throw new InvalidActionException("LOG requires log_message");
        }
        SystemState state = context.getState();
        String message = TemplateRenderer.render(action.logMessage(), Map.of(), state).text();
        Value targetValue = action.target() == null ? null
                : PathResolver.tryResolve(state, action.target()).orElse(null);
        LogEntry entry = new LogEntry(context.getTick(), invocation.ruleId(), action.logLevel(), message,
                action.target(), targetValue);
        emit(entry);
        return new ActionApplication(action, action.target(), targetValue, targetValue, true, entry.toString(), null,
                null, entry, null, null);
    }

    private ActionApplication commit(Action action, RuleInvocation invocation, TickContext context, String target,
                                     Value proposed, ClampRange range) {
        Value before = PathResolver.tryResolve(context.getState(), target).orElse(null);
        PendingWrite write = new PendingWrite(target, invocation.rule(), action, proposed, range);
        WriteOutcome outcome = context.getResolver().submit(write, context.getState());
        String message;
        if (!outcome.conflicted()) {
            message = action.type() + " " + target + ": " + render(before) + " -> " + outcome.finalValue().render();
        } else {
            message = action.type() + " " + target + " conflicted (" + outcome.conflict().strategy() + "): "
                    + render(before) + " -> " + outcome.finalValue().render()
                    + (outcome.applied() ? "" : ", write not applied");
        }
        return ActionApplication.write(action, target, before, outcome.finalValue(), outcome.applied(), message,
                outcome.conflict());
    }

    private static Value resolvePayload(Value raw, SystemState state) {
        if (raw instanceof Value.TextValue text && OperandResolver.expressionOf(text.value()).isPresent()) {
            return OperandResolver.resolve(raw, state);
        }
        return raw;
    }

    private static void emit(LogEntry entry) {
        switch (entry.level()) {
            case DEBUG -> RULE_LOG.debug("[{}] {}", entry.ruleId(), entry.message());
            case INFO -> RULE_LOG.info("[{}] {}", entry.ruleId(), entry.message());
            case WARN -> RULE_LOG.warn("[{}] {}", entry.ruleId(), entry.message());
            case ERROR -> RULE_LOG.error("[{}] {}", entry.ruleId(), entry.message());
        }
    }

    private static String requireTarget(Action action) {
        if (action.target() == null || action.target().isBlank()) {
            throw new InvalidActionException(action.type() + " requires a target");
        }
        return action.target();
    }

    private static Value requireValue(Action action) {
        if (action.value() == null) {
            throw new InvalidActionException(action.type() + " on '" + action.target() + "' requires a value");
        }
        return action.value();
    }

    private static double number(Value value, String what) {
        if (value instanceof Value.NumberValue number) {
            return number.value();
        }
        throw new TypeMismatchException(what + " requires a number, got " + value.typeName() + " '"
                + value.render() + "'");
    }

    private static String render(Value value) {
        return value == null ? "unset" : value.render();
    }
}
