package org.helmsman.testutil;

import java.util.Map;

import org.helmsman.runtime.DecisionEngine;
import org.helmsman.runtime.EngineSettings;
import org.helmsman.runtime.model.Rule;
import org.helmsman.runtime.model.RuleSet;
import org.helmsman.runtime.model.SystemState;

/**
 * Small states and engines shared by the runtime tests.
 */
public final class HarborFixtures {

    private HarborFixtures() {
    }

    /**
     * A tugboat at 8 knots escorting a cargo ship at 6 knots in the harbour entry.
     */
    public static SystemState twoVessels() {
        return SystemState.builder()
                .agent("tugboat", Map.of("type", "tugboat", "speed", 8.0, "heading", 90.0))
                .agent("cargo_ship", Map.of("type", "cargo_ship", "speed", 6.0, "heading", 90.0))
                .environment("zone", "harbour_entry")
                .environment("visibility", 1.5)
                .environment("wind_speed", 10.0)
                .metric("tugboat_cargo_distance", 50)
                .build();
    }

    public static DecisionEngine engine(SystemState state, Rule... rules) {
        return new DecisionEngine(RuleSet.of(rules), state, EngineSettings.defaults());
    }

    public static DecisionEngine engine(SystemState state, EngineSettings settings, Rule... rules) {
        return new DecisionEngine(RuleSet.of(rules), state, settings);
    }
}
