package org.helmsman.runtime;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import org.helmsman.runtime.conflicts.ConflictPolicy;
import org.helmsman.runtime.conflicts.ConflictStrategy;
import org.helmsman.runtime.conflicts.MergeFunction;
import org.helmsman.runtime.events.EventPersistence;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Tuning of a {@link DecisionEngine}, read from the {@code helmsman.engine} configuration block.
 *
 * @param maxChainDepth Maximum TRIGGER_RULE chain depth within a tick, at least 1.
 * @param conflictPolicy Conflict strategy selection and merge settings.
 * @param eventPersistence How long spawned events stay visible.
 * @param trackDecisions Whether the engine maintains {@code global_metrics.rules_triggered_count}
 *                       and {@code global_metrics.decision_count}.
 */
public record EngineSettings(
        int maxChainDepth,
        ConflictPolicy conflictPolicy,
        EventPersistence eventPersistence,
        boolean trackDecisions) {

    public static final int DEFAULT_MAX_CHAIN_DEPTH = 32;

    public EngineSettings {
        if (maxChainDepth < 1) {
            throw new IllegalArgumentException("max-chain-depth must be >= 1, got " + maxChainDepth);
        }
        if (conflictPolicy == null) {
            throw new IllegalArgumentException("conflictPolicy must not be null");
        }
        if (eventPersistence == null) {
            throw new IllegalArgumentException("eventPersistence must not be null");
        }
    }

    /**
     * @return the built-in defaults, equal to what {@code reference.conf} declares.
     */
    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_MAX_CHAIN_DEPTH, ConflictPolicy.defaults(), EventPersistence.TICK, false);
    }

    /**
     * Reads settings from the {@code helmsman.engine} block.
     * <p>
     * Example:
     * <pre>
     * max-chain-depth = 32
     * conflict {
     *   default-strategy = "PRIORITY"
     *   merge-function = "AVERAGE"
     *   priority-threshold = 0
     *   merge-rules = []
     *   manual-review-rules = []
     * }
     * events.persistence = "TICK"
     * metrics.track-decisions = false
     * </pre>
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The {@code helmsman.engine} block.
     * @return the settings.
     * @throws IllegalArgumentException if a value is out of range or names an unknown constant.
     */
    public static EngineSettings fromConfig(Config config) {
        try {
            int maxChainDepth = config.hasPath("max-chain-depth")
                    ? config.getInt("max-chain-depth") : DEFAULT_MAX_CHAIN_DEPTH;

            ConflictPolicy defaults = ConflictPolicy.defaults();
            ConflictStrategy strategy = config.hasPath("conflict.default-strategy")
                    ? ConflictStrategy.parse(config.getString("conflict.default-strategy"))
                    : defaults.defaultStrategy();
            MergeFunction mergeFunction = config.hasPath("conflict.merge-function")
                    ? MergeFunction.parse(config.getString("conflict.merge-function"))
                    : defaults.mergeFunction();
            int threshold = config.hasPath("conflict.priority-threshold")
                    ? config.getInt("conflict.priority-threshold") : 0;
            Set<String> mergeRules = config.hasPath("conflict.merge-rules")
                    ? new HashSet<>(config.getStringList("conflict.merge-rules")) : Set.of();
            Set<String> reviewRules = config.hasPath("conflict.manual-review-rules")
                    ? new HashSet<>(config.getStringList("conflict.manual-review-rules")) : Set.of();

            EventPersistence persistence = config.hasPath("events.persistence")
                    ? parsePersistence(config.getString("events.persistence")) : EventPersistence.TICK;
            boolean trackDecisions = config.hasPath("metrics.track-decisions")
                    && config.getBoolean("metrics.track-decisions");

            return new EngineSettings(maxChainDepth,
                    new ConflictPolicy(strategy, mergeFunction, threshold, mergeRules, reviewRules),
                    persistence, trackDecisions);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    public EngineSettings withMaxChainDepth(int depth) {
        return new EngineSettings(depth, conflictPolicy, eventPersistence, trackDecisions);
    }

    public EngineSettings withConflictPolicy(ConflictPolicy policy) {
        return new EngineSettings(maxChainDepth, policy, eventPersistence, trackDecisions);
    }

    public EngineSettings withEventPersistence(EventPersistence persistence) {
        return new EngineSettings(maxChainDepth, conflictPolicy, persistence, trackDecisions);
    }

    public EngineSettings withTrackDecisions(boolean track) {
        return new EngineSettings(maxChainDepth, conflictPolicy, eventPersistence, track);
    }

    private static EventPersistence parsePersistence(String text) {
        String normalized = text.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return EventPersistence.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event persistence: " + text, e);
        }
    }
}
