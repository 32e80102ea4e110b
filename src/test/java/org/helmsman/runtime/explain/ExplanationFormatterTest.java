package org.helmsman.runtime.explain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.helmsman.junit.extensions.logging.LogWatchExtension;
import org.helmsman.runtime.DecisionEngine;
import org.helmsman.runtime.history.StateSnapshot;
import org.helmsman.runtime.model.Action;
import org.helmsman.runtime.model.Rule;
import org.helmsman.testutil.HarborFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * Unit tests for {@link ExplanationFormatter}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ExplanationFormatterTest {

    private StateSnapshot snapshot;

    @BeforeEach
    void setUp() {
        Rule rule = Rule.builder("harbour_entry_speed")
                .priority(55)
                .when("environment.zone", "==", "harbour_entry")
                .then(Action.set("agents.tugboat.speed", 5))
                .then(Action.spawnEvent("speed_reduced"))
                .explain("Speed reduced from {{agents.tugboat.speed.before}} to {{agents.tugboat.speed}} knots")
                .build();
        DecisionEngine engine = HarborFixtures.engine(HarborFixtures.twoVessels(), rule);
        snapshot = engine.tick();
    }

    @Test
    @SuppressWarnings("unchecked")
    void educationalLayout() {
        Explanation explanation = snapshot.report().explanation("harbour_entry_speed").orElseThrow();

        Map<String, Object> view = ExplanationFormatter.educational(explanation);

        assertThat(view).containsEntry("rule_id", "harbour_entry_speed")
                .containsEntry("triggered", true)
                .containsEntry("when", "Time step 0")
                .containsEntry("message", "Speed reduced from 8 to 5 knots")
                .doesNotContainKey("error");
        Map<String, Object> why = (Map<String, Object>) view.get("why");
        assertThat(why).containsEntry("logic", "AND");
        List<Map<String, Object>> conditions = (List<Map<String, Object>>) why.get("conditions");
        assertThat(conditions).hasSize(1);
        assertThat(conditions.get(0)).containsEntry("result", true);
        Map<String, Object> chain = (Map<String, Object>) view.get("causal_chain");
        assertThat(chain.get("triggered_by")).isNull();
        assertThat((List<String>) chain.get("events")).containsExactly("evt-0-0");
        List<Map<String, Object>> actions = (List<Map<String, Object>>) ((Map<String, Object>) view
                .get("what_happened")).get("actions");
        assertThat(actions.get(0)).containsEntry("changed_from", 8.0).containsEntry("changed_to", 5.0);
    }

    @Test
    void snapshotJsonCarriesStateAndReport() {
        JsonObject json = JsonParser.parseString(ExplanationFormatter.toJson(snapshot)).getAsJsonObject();

        JsonObject state = json.getAsJsonObject("state");
        assertThat(state.get("time_step").getAsLong()).isEqualTo(1);
        assertThat(state.getAsJsonObject("agents").getAsJsonObject("tugboat").get("speed").getAsDouble())
                .isEqualTo(5.0);
        assertThat(state.getAsJsonObject("events").getAsJsonObject("speed_reduced").get("source_rule")
                .getAsString()).isEqualTo("harbour_entry_speed");
        JsonObject report = json.getAsJsonObject("report");
        assertThat(report.get("tick").getAsLong()).isZero();
        assertThat(report.get("halted").getAsBoolean()).isFalse();
        assertThat(report.getAsJsonArray("explanations")).hasSize(1);
    }

    @Test
    void explanationJsonIsPrettyPrinted() {
        Explanation explanation = snapshot.explanations().get(0);

        String json = ExplanationFormatter.toJson(explanation);

        assertThat(json).contains("\n").contains("\"rule_id\": \"harbour_entry_speed\"");
    }
}
