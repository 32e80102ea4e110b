package org.helmsman.scenarios;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.helmsman.runtime.model.SystemState;

/**
 * Initial states of the harbour exhibit.
 * <p>
 * Two agents, a tugboat and the cargo ship it escorts, move through the zones
 * {@code open_water -> escort_corridor -> harbour_entry -> no_wake_zone -> docking_zone}.
 * The variants differ from {@code default} only in the values that make their rules fire:
 * <ul>
 *   <li>{@code fog}: visibility 0.2 in the harbour entry</li>
 *   <li>{@code docking}: misaligned tugboat three metres from the berth</li>
 *   <li>{@code emergency}: tugboat engine failure at 10 knots</li>
 * </ul>
 */
public final class HarborScenarios {

    public static final String DEFAULT = "default";
    public static final String FOG = "fog";
    public static final String DOCKING = "docking";
    public static final String EMERGENCY = "emergency";

    private static final Map<String, Supplier<SystemState>> FACTORIES = new LinkedHashMap<>();

    static {
        FACTORIES.put(DEFAULT, () -> base().build());
        FACTORIES.put(FOG, () -> base()
                .environment("visibility", 0.2)
                .environment("zone", "harbour_entry")
                .build());
        FACTORIES.put(DOCKING, () -> base()
                .agent("tugboat", tugboat(4.0, 65.0))
                .environment("zone", "docking_zone")
                .environment("berth_heading", 0.0)
                .metric("heading_error", 25.0)
                .metric("distance_to_berth", 3.0)
                .build());
        FACTORIES.put(EMERGENCY, () -> base()
                .agent("tugboat", tugboat(10.0, 90.0))
                .metric("engine_status", 0.0)
                .build());
    }

    private HarborScenarios() {
    }

    /**
     * @return the scenario names, in catalog order.
     */
    public static Set<String> names() {
        return FACTORIES.keySet();
    }

    public static boolean exists(String name) {
        return FACTORIES.containsKey(name);
    }

    /**
     * Builds a fresh initial state.
     *
     * @param name The scenario name.
     * @return a new state at time step 0.
     * @throws IllegalArgumentException if the scenario is unknown.
     */
    public static SystemState create(String name) {
        Supplier<SystemState> factory = FACTORIES.get(name);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown scenario '" + name + "'. Available: " + names());
        }
        return factory.get();
    }

    private static SystemState.Builder base() {
        Map<String, Object> cargoShip = new LinkedHashMap<>();
        cargoShip.put("type", "cargo_ship");
        cargoShip.put("name", "MV Fraser Spirit");
        cargoShip.put("position_x", 50.0);
        cargoShip.put("position_y", 0.0);
        cargoShip.put("speed", 6.0);
        cargoShip.put("heading", 90.0);
        cargoShip.put("tonnage", 12000);

        return SystemState.builder()
                .agent("tugboat", tugboat(8.0, 90.0))
                .agent("cargo_ship", cargoShip)
                .environment("wind_speed", 10.0)
                .environment("wind_direction", 45.0)
                .environment("visibility", 1.5)
                .environment("zone", "open_water")
                .environment("berth_heading", 0.0)
                .metric("tugboat_cargo_distance", 50.0)
                .metric("collision_risk", 0.0)
                .metric("anchor_deployed", 0.0)
                .metric("engine_status", 1.0)
                .metric("guidance_requested", 0.0)
                .metric("heading_error", 0.0)
                .metric("distance_to_berth", 500.0)
                .metric("rules_triggered_count", 0.0)
                .metric("decision_count", 0.0);
    }

    private static Map<String, Object> tugboat(double speed, double heading) {
        Map<String, Object> tugboat = new LinkedHashMap<>();
        tugboat.put("type", "tugboat");
        tugboat.put("name", "MV Pacific Highlander");
        tugboat.put("position_x", 0.0);
        tugboat.put("position_y", 0.0);
        tugboat.put("speed", speed);
        tugboat.put("heading", heading);
        return tugboat;
    }
}
