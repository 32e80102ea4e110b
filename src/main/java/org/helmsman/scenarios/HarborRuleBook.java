package org.helmsman.scenarios;

import java.util.List;
import java.util.Map;

import org.helmsman.runtime.model.Action;
import org.helmsman.runtime.model.ActionType;
import org.helmsman.runtime.model.ConditionLogic;
import org.helmsman.runtime.model.EventSeverity;
import org.helmsman.runtime.model.LogLevel;
import org.helmsman.runtime.model.Rule;
import org.helmsman.runtime.model.RuleSet;

/**
 * The navigation rules of the harbour exhibit.
 * <p>
 * Rules are grouped by category: emergency, safety, weather, regulation, docking, escort and
 * advisory. Together they use every action type, event chaining through {@code events.*},
 * explicit TRIGGER_RULE chains and a MERGE conflict between the two docking speed rules.
 */
public final class HarborRuleBook {

    public static final String EMERGENCY_ENGINE_FAILURE = "emergency_engine_failure";
    public static final String EMERGENCY_ANCHOR = "emergency_anchor";
    public static final String COLLISION_RISK_DETECTION = "collision_risk_detection";
    public static final String COLLISION_AVOIDANCE = "collision_avoidance";
    public static final String LOW_VISIBILITY_SPEED_REDUCTION = "low_visibility_speed_reduction";
    public static final String FOG_EVENT_RESPONSE = "fog_event_response";
    public static final String REQUEST_HARBOUR_GUIDANCE = "request_harbour_guidance";
    public static final String NO_WAKE_ZONE_LIMIT = "no_wake_zone_limit";
    public static final String HARBOUR_ENTRY_SPEED = "harbour_entry_speed";
    public static final String DOCKING_APPROACH_SPEED = "docking_approach_speed";
    public static final String DOCKING_HEADING_ALIGNMENT = "docking_heading_alignment";
    public static final String DOCKING_FINAL_STOP = "docking_final_stop";
    public static final String ESCORT_SPEED_MATCH = "escort_speed_match";
    public static final String HIGH_WIND_ADVISORY = "high_wind_advisory";

    private HarborRuleBook() {
    }

    /**
     * @return the standard rule set.
     */
    public static RuleSet standard() {
        return new RuleSet(rules());
    }

    /**
     * @return the standard rules in declaration order.
     */
    public static List<Rule> rules() {
        return List.of(
                Rule.builder(EMERGENCY_ENGINE_FAILURE)
                        .priority(100)
                        .when("global_metrics.engine_status", "==", 0)
                        .then(Action.set("agents.tugboat.speed", 0))
                        .then(Action.builder(ActionType.SPAWN_EVENT).eventType("engine_failure")
                                .severity(EventSeverity.CRITICAL)
                                .payload("vessel", "tugboat")
                                .build())
                        .then(Action.triggerRule(EMERGENCY_ANCHOR))
                        .then(Action.log(LogLevel.WARN, "Engine failure on {{agents.tugboat.name}}, vessel stopped"))
                        .explain("Engine failure detected: {{agents.tugboat.name}} stopped from "
                                + "{{agents.tugboat.speed.before}} to {{agents.tugboat.speed}} knots.")
                        .metadata("category", "emergency")
                        .metadata("tags", List.of("engine", "stop"))
                        .build(),
                Rule.builder(EMERGENCY_ANCHOR)
                        .priority(95)
                        .when("events.engine_failure", "==", true)
                        .then(Action.set("global_metrics.anchor_deployed", 1))
                        .explain("Anchor deployed after {{triggered_by}} (chain depth {{chain_depth}}).")
                        .metadata("category", "emergency")
                        .build(),
                Rule.builder(COLLISION_RISK_DETECTION)
                        .priority(90)
                        .when("global_metrics.tugboat_cargo_distance", "<", 20)
                        .then(Action.set("global_metrics.collision_risk", 1))
                        .then(Action.spawnEvent("collision_risk", EventSeverity.WARNING,
                                Map.of("distance", "{{global_metrics.tugboat_cargo_distance}}")))
                        .explain("Tugboat within {{global_metrics.tugboat_cargo_distance}} m of the cargo ship; "
                                + "collision risk raised.")
                        .metadata("category", "safety")
                        .metadata("tags", List.of("collision"))
                        .build(),
                Rule.builder(COLLISION_AVOIDANCE)
                        .priority(85)
                        .when("events.collision_risk", "==", true)
                        .then(Action.set("agents.tugboat.speed", 3))
                        .then(Action.recommend("agents.tugboat.heading", "{{agents.tugboat.heading + 15}}"))
                        .explain("Collision risk: speed cut from {{agents.tugboat.speed.before}} to "
                                + "{{agents.tugboat.speed}} knots, heading {{recommended.agents.tugboat.heading}} advised.")
                        .metadata("category", "safety")
                        .metadata("tags", List.of("collision"))
                        .build(),
                Rule.builder(LOW_VISIBILITY_SPEED_REDUCTION)
                        .priority(80)
                        .when("environment.visibility", "<", 0.5)
                        .then(Action.clamp("agents.tugboat.speed", 0, 5))
                        .then(Action.spawnEvent("fog_detected", EventSeverity.WARNING,
                                Map.of("visibility", "{{environment.visibility}}")))
                        .explain("Visibility {{environment.visibility}} nm: tugboat speed limited from "
                                + "{{agents.tugboat.speed.before}} to {{agents.tugboat.speed}} knots.")
                        .metadata("category", "weather")
                        .metadata("tags", List.of("fog", "speed"))
                        .build(),
                Rule.builder(FOG_EVENT_RESPONSE)
                        .priority(75)
                        .when("events.fog_detected", "==", true)
                        .then(Action.clamp("agents.cargo_ship.speed", 0, 4))
                        .then(Action.triggerRule(REQUEST_HARBOUR_GUIDANCE))
                        .explain("Fog reported: cargo ship slowed to {{agents.cargo_ship.speed}} knots.")
                        .metadata("category", "weather")
                        .metadata("tags", List.of("fog"))
                        .build(),
                Rule.builder(REQUEST_HARBOUR_GUIDANCE)
                        .priority(70)
                        .when("environment.visibility", "<", 1.0)
                        .then(Action.set("global_metrics.guidance_requested", 1))
                        .then(Action.log(LogLevel.INFO, "Harbour guidance requested at visibility {{environment.visibility}}"))
                        .explain("Harbour guidance requested (visibility {{environment.visibility}} nm).")
                        .metadata("category", "weather")
                        .build(),
                Rule.builder(NO_WAKE_ZONE_LIMIT)
                        .priority(60)
                        .when("environment.zone", "==", "no_wake_zone")
                        .then(Action.clamp("agents.tugboat.speed", 0, 5))
                        .explain("No-wake zone: tugboat speed held at {{agents.tugboat.speed}} knots.")
                        .metadata("category", "regulation")
                        .build(),
                Rule.builder(HARBOUR_ENTRY_SPEED)
                        .priority(55)
                        .when("environment.zone", "in", List.of("harbour_entry", "no_wake_zone"))
                        .when("agents.tugboat.speed", ">", 6)
                        .then(Action.set("agents.tugboat.speed", 6))
                        .explain("Harbour entry limit: speed reduced from {{agents.tugboat.speed.before}} "
                                + "to {{agents.tugboat.speed}} knots.")
                        .metadata("category", "regulation")
                        .build(),
                Rule.builder(DOCKING_APPROACH_SPEED)
                        .priority(50)
                        .when("environment.zone", "==", "docking_zone")
                        .then(Action.clamp("agents.tugboat.speed", 0, 2))
                        .explain("Docking approach: speed limited to {{agents.tugboat.speed}} knots.")
                        .metadata("category", "docking")
                        .metadata("conflict_strategy", "merge")
                        .build(),
                Rule.builder(DOCKING_HEADING_ALIGNMENT)
                        .priority(45)
                        .when("environment.zone", "==", "docking_zone")
                        .when("global_metrics.heading_error", ">", 10)
                        .then(Action.recommend("agents.tugboat.heading", "environment.berth_heading"))
                        .then(Action.log(LogLevel.INFO, "Heading error {{global_metrics.heading_error}} deg, "
                                + "align to {{environment.berth_heading}}"))
                        .explain("Heading off by {{global_metrics.heading_error}} degrees; align to berth heading "
                                + "{{recommended.agents.tugboat.heading}}.")
                        .metadata("category", "docking")
                        .build(),
                Rule.builder(DOCKING_FINAL_STOP)
                        .priority(40)
                        .when("environment.zone", "==", "docking_zone")
                        .when("global_metrics.distance_to_berth", "<", 5)
                        .then(Action.set("agents.tugboat.speed", 0))
                        .explain("Within {{global_metrics.distance_to_berth}} m of the berth: tugboat stopped.")
                        .metadata("category", "docking")
                        .build(),
                Rule.builder(ESCORT_SPEED_MATCH)
                        .priority(30)
                        .when("environment.zone", "==", "escort_corridor")
                        .when("agents.tugboat.speed", ">", "agents.cargo_ship.speed")
                        .then(Action.set("agents.tugboat.speed", "agents.cargo_ship.speed"))
                        .explain("Escort: tugboat matched the cargo ship at {{agents.tugboat.speed}} knots.")
                        .metadata("category", "escort")
                        .build(),
                Rule.builder(HIGH_WIND_ADVISORY)
                        .priority(20)
                        .logic(ConditionLogic.OR)
                        .when("environment.wind_speed", ">", 25)
                        .when("environment.visibility", "<", 0.3)
                        .then(Action.builder(ActionType.SPAWN_EVENT).eventType("weather_advisory")
                                .payload("wind_speed", "{{environment.wind_speed}}")
                                .payload("visibility", "{{environment.visibility}}")
                                .build())
                        .then(Action.log(LogLevel.INFO, "Weather advisory: wind {{environment.wind_speed}} kn, "
                                + "visibility {{environment.visibility}} nm"))
                        .explain("Weather advisory issued (wind {{environment.wind_speed}} kn, visibility "
                                + "{{environment.visibility}} nm).")
                        .metadata("category", "advisory")
                        .build());
    }
}
