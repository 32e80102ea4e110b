package org.helmsman.runtime.explain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.helmsman.junit.extensions.logging.LogWatchExtension;
import org.helmsman.runtime.model.SystemState;
import org.helmsman.runtime.model.Value;
import org.helmsman.testutil.HarborFixtures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for {@link TemplateRenderer}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TemplateRendererTest {

    private final SystemState state = HarborFixtures.twoVessels();

    @Test
    void capturedValuesTakePrecedenceOverState() {
        TemplateRenderer.Rendered rendered = TemplateRenderer.render(
                "Speed {{agents.tugboat.speed.before}} -> {{ agents.tugboat.speed }}",
                Map.of("agents.tugboat.speed.before", Value.number(8), "agents.tugboat.speed", Value.number(5)),
                state);

        assertThat(rendered.text()).isEqualTo("Speed 8 -> 5");
        assertThat(rendered.unresolved()).isEmpty();
    }

    @Test
    void fallsBackToStateAndExpressions() {
        TemplateRenderer.Rendered rendered = TemplateRenderer.render(
                "Zone {{environment.zone}}, gap {{agents.tugboat.speed - agents.cargo_ship.speed}} kn",
                Map.of(), state);

        assertThat(rendered.text()).isEqualTo("Zone harbour_entry, gap 2 kn");
    }

    @Test
    void unresolvedPlaceholdersStayVerbatim() {
        TemplateRenderer.Rendered rendered = TemplateRenderer.render(
                "Rule {{rule_id}} saw {{agents.pilot.speed}} and {{events.fog_detected}}", Map.of(), state);

        assertThat(rendered.text()).isEqualTo("Rule {{rule_id}} saw {{agents.pilot.speed}} and {{events.fog_detected}}");
        assertThat(rendered.unresolved())
                .containsExactly("{{rule_id}}", "{{agents.pilot.speed}}", "{{events.fog_detected}}");
    }

    @Test
    void rendersNumbersWithoutTrailingZeros() {
        TemplateRenderer.Rendered rendered = TemplateRenderer.render("{{v}} {{w}}",
                Map.of("v", Value.number(5.0), "w", Value.number(0.25)), state);

        assertThat(rendered.text()).isEqualTo("5 0.25");
    }

    @Test
    void textWithoutPlaceholdersIsUnchanged() {
        assertThat(TemplateRenderer.render("Plain $1 text", Map.of(), state).text()).isEqualTo("Plain $1 text");
    }
}
