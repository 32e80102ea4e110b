package org.helmsman.runtime.path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.helmsman.junit.extensions.logging.LogWatchExtension;
import org.helmsman.runtime.errors.ReadOnlyPathException;
import org.helmsman.runtime.errors.TypeMismatchException;
import org.helmsman.runtime.errors.UnknownAgentException;
import org.helmsman.runtime.errors.UnknownPathException;
import org.helmsman.runtime.model.EventSeverity;
import org.helmsman.runtime.model.SystemState;
import org.helmsman.runtime.model.Value;
import org.helmsman.testutil.HarborFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for {@link PathResolver}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PathResolverTest {

    private SystemState state;

    @BeforeEach
    void setUp() {
        state = HarborFixtures.twoVessels();
    }

    @Test
    void resolvesEveryContainer() {
        assertThat(PathResolver.resolve(state, "agents.tugboat.speed")).isEqualTo(Value.number(8));
        assertThat(PathResolver.resolve(state, "agents.tugboat.id")).isEqualTo(Value.text("tugboat"));
        assertThat(PathResolver.resolve(state, "environment.zone")).isEqualTo(Value.text("harbour_entry"));
        assertThat(PathResolver.resolve(state, "global_metrics.tugboat_cargo_distance")).isEqualTo(Value.number(50));
    }

    @Test
    void missingLocationsFail() {
        assertThatThrownBy(() -> PathResolver.resolve(state, "agents.pilot_boat.speed"))
                .isInstanceOf(UnknownPathException.class);
        assertThatThrownBy(() -> PathResolver.resolve(state, "agents.tugboat.draft"))
                .isInstanceOf(UnknownPathException.class);
        assertThatThrownBy(() -> PathResolver.resolve(state, "environment.tide"))
                .isInstanceOf(UnknownPathException.class);
        assertThatThrownBy(() -> PathResolver.resolve(state, "global_metrics.fuel"))
                .isInstanceOf(UnknownPathException.class);
    }

    @Test
    void missingEventReadsAsAbsent() {
        assertThat(PathResolver.resolve(state, "events.fog_detected").isAbsent()).isTrue();
        assertThat(PathResolver.tryResolve(state, "events.fog_detected")).isEmpty();
    }

    @Test
    void presentEventReadsAsTrueAndExposesPayload() {
        state.events().spawn("fog_rule", "fog_detected", Map.of("visibility", Value.number(0.2)),
                EventSeverity.WARNING);

        assertThat(PathResolver.resolve(state, "events.fog_detected")).isEqualTo(Value.bool(true));
        assertThat(PathResolver.resolve(state, "events.fog_detected.visibility")).isEqualTo(Value.number(0.2));
        assertThat(PathResolver.resolve(state, "events.fog_detected.missing").isAbsent()).isTrue();
    }

    @Test
    void writeCreatesFieldsOnKnownAgentsAndContainers() {
        PathResolver.write(state, "agents.tugboat.mode", Value.text("docking"));
        PathResolver.write(state, "environment.tide", Value.number(1.2));
        PathResolver.write(state, "global_metrics.collision_risk", Value.number(1));

        assertThat(PathResolver.resolve(state, "agents.tugboat.mode")).isEqualTo(Value.text("docking"));
        assertThat(PathResolver.resolve(state, "environment.tide")).isEqualTo(Value.number(1.2));
        assertThat(PathResolver.resolve(state, "global_metrics.collision_risk")).isEqualTo(Value.number(1));
    }

    @Test
    void writeToUndeclaredAgentFails() {
        assertThatThrownBy(() -> PathResolver.write(state, "agents.pilot_boat.speed", Value.number(3)))
                .isInstanceOf(UnknownAgentException.class)
                .hasMessageContaining("pilot_boat");
    }

    @Test
    void eventsAndAgentIdsAreReadOnly() {
        assertThatThrownBy(() -> PathResolver.write(state, "events.fog_detected", Value.bool(true)))
                .isInstanceOf(ReadOnlyPathException.class);
        assertThatThrownBy(() -> PathResolver.write(state, "agents.tugboat.id", Value.text("other")))
                .isInstanceOf(ReadOnlyPathException.class);
    }

    @Test
    void metricsOnlyAcceptNumbers() {
        assertThatThrownBy(() -> PathResolver.write(state, "global_metrics.collision_risk", Value.text("high")))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    void sequencesCannotBeStored() {
        assertThatThrownBy(() -> PathResolver.write(state, "environment.zone", Value.of(List.of("a"))))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    void removeDeletesField() {
        PathResolver.write(state, "environment.tide", Value.number(1.2));
        PathResolver.remove(state, "environment.tide");

        assertThat(PathResolver.tryResolve(state, "environment.tide")).isEmpty();
    }
}
