package org.helmsman.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a rule's consequence.
 * <p>
 * Which fields are meaningful depends on {@link #type()}:
 * <ul>
 *   <li>SET, ADD: {@code target}, {@code value}</li>
 *   <li>CLAMP: {@code target}, {@code minValue}, {@code maxValue}</li>
 *   <li>RECOMMEND: {@code target}, {@code value}</li>
 *   <li>TRIGGER_RULE: {@code ruleId}</li>
 *   <li>SPAWN_EVENT: {@code eventType}, optional {@code eventPayload} and {@code eventSeverity}</li>
 *   <li>LOG: {@code logMessage}, optional {@code logLevel} and {@code target}</li>
 * </ul>
 * Missing required fields are not rejected here; the action executor reports them as an
 * invalid action when the rule fires.
 *
 * @param type The action type.
 * @param target Field path written or inspected, may be null.
 * @param value Value for SET/ADD/RECOMMEND (literal, path or {@code {{expression}}}), may be null.
 * @param minValue Lower bound for CLAMP, may be null.
 * @param maxValue Upper bound for CLAMP, may be null.
 * @param ruleId Rule to evaluate for TRIGGER_RULE, may be null.
 * @param eventType Event type for SPAWN_EVENT, may be null.
 * @param eventPayload Payload for SPAWN_EVENT, never null.
 * @param eventSeverity Severity for SPAWN_EVENT, never null.
 * @param logLevel Level for LOG, never null.
 * @param logMessage Message for LOG, may be null.
 * @param metadata Opaque key/value bag, never null. The key {@code conflict_strategy} selects
 *                 the conflict strategy for writes of this action.
 */
public record Action(
        ActionType type,
        String target,
        Value value,
        Double minValue,
        Double maxValue,
        String ruleId,
        String eventType,
        Map<String, Value> eventPayload,
        EventSeverity eventSeverity,
        LogLevel logLevel,
        String logMessage,
        Map<String, Object> metadata) {

    public Action {
        Objects.requireNonNull(type, "type");
        eventPayload = eventPayload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(eventPayload));
        eventSeverity = eventSeverity == null ? EventSeverity.NORMAL : eventSeverity;
        logLevel = logLevel == null ? LogLevel.INFO : logLevel;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Action set(String target, Object value) {
        return builder(ActionType.SET).target(target).value(value).build();
    }

    public static Action add(String target, Object value) {
        return builder(ActionType.ADD).target(target).value(value).build();
    }

    public static Action clamp(String target, double min, double max) {
        return builder(ActionType.CLAMP).target(target).min(min).max(max).build();
    }

    public static Action recommend(String target, Object value) {
        return builder(ActionType.RECOMMEND).target(target).value(value).build();
    }

    public static Action triggerRule(String ruleId) {
        return builder(ActionType.TRIGGER_RULE).ruleId(ruleId).build();
    }

    public static Action spawnEvent(String eventType) {
        return builder(ActionType.SPAWN_EVENT).eventType(eventType).build();
    }

    public static Action spawnEvent(String eventType, EventSeverity severity, Map<String, ?> payload) {
        Builder builder = builder(ActionType.SPAWN_EVENT).eventType(eventType).severity(severity);
        payload.forEach(builder::payload);
        return builder.build();
    }

    public static Action log(LogLevel level, String message) {
        return builder(ActionType.LOG).logLevel(level).logMessage(message).build();
    }

    /**
     * @return the {@code conflict_strategy} metadata entry, or null.
     */
    public String conflictStrategyHint() {
        Object hint = metadata.get("conflict_strategy");
        return hint == null ? null : hint.toString();
    }

    @Override
    public String toString() {
        return switch (type) {
            case SET, ADD, RECOMMEND -> type + " " + target + " " + (value == null ? "?" : value.render());
            case CLAMP -> type + " " + target + " [" + minValue + ", " + maxValue + "]";
            case TRIGGER_RULE -> type + " " + ruleId;
            case SPAWN_EVENT -> type + " " + eventType;
            case LOG -> type + " [" + logLevel + "] " + logMessage;
        };
    }

    public static Builder builder(ActionType type) {
        return new Builder(type);
    }

    /**
     * Fluent builder for actions with optional fields.
     */
    public static final class Builder {
        private final ActionType type;
        private String target;
        private Value value;
        private Double min;
        private Double max;
        private String ruleId;
        private String eventType;
        private final Map<String, Value> payload = new LinkedHashMap<>();
        private EventSeverity severity;
        private LogLevel logLevel;
        private String logMessage;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(ActionType type) {
            this.type = type;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder value(Object value) {
            this.value = value == null ? null : Value.of(value);
            return this;
        }

        public Builder min(double min) {
            this.min = min;
            return this;
        }

        public Builder max(double max) {
            this.max = max;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder payload(String key, Object value) {
            this.payload.put(key, Value.of(value));
            return this;
        }

        public Builder severity(EventSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder logMessage(String logMessage) {
            this.logMessage = logMessage;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Action build() {
            return new Action(type, target, value, min, max, ruleId, eventType, payload, severity,
                    logLevel, logMessage, metadata);
        }
    }
}
