package org.helmsman.runtime.input;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.helmsman.junit.extensions.logging.LogWatchExtension;
import org.helmsman.runtime.model.SystemState;
import org.helmsman.runtime.model.Value;
import org.helmsman.runtime.path.IStateReader;
import org.helmsman.testutil.HarborFixtures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for {@link InputTranslator} and {@link InputQueue}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class InputTranslatorTest {

    private final InputTranslator translator = new InputTranslator();
    private final SystemState state = HarborFixtures.twoVessels();

    @Test
    void builtInTypesAreRegistered() {
        assertThat(translator.types()).containsExactly(
                InputTranslator.SET_FIELD,
                InputTranslator.ADJUST_SPEED,
                InputTranslator.CHANGE_ANGLE,
                InputTranslator.ACTIVATE_DOCKING_MODE,
                InputTranslator.SENSOR_UPDATE_DISTANCE,
                InputTranslator.EMERGENCY_STOP);
    }

    @Test
    void translatesVesselControls() {
        assertThat(translator.translate(InputCommand.of("adjust_speed", "tugboat", 4), state))
                .containsExactly(new PathWrite("agents.tugboat.speed", Value.number(4)));
        assertThat(translator.translate(InputCommand.of("change_angle", "cargo_ship", 75), state))
                .containsExactly(new PathWrite("agents.cargo_ship.heading", Value.number(75)));
        assertThat(translator.translate(InputCommand.of("activate_docking_mode", null, null), state))
                .containsExactly(new PathWrite("environment.docking_mode", Value.bool(true)));
    }

    @Test
    void sensorUpdateDefaultsToTugboatCargoDistance() {
        assertThat(translator.translate(InputCommand.of("sensor_update_distance", null, 12), state))
                .containsExactly(new PathWrite("global_metrics.tugboat_cargo_distance", Value.number(12)));
        assertThat(translator.translate(InputCommand.of("sensor_update_distance", "distance_to_berth", 40), state))
                .containsExactly(new PathWrite("global_metrics.distance_to_berth", Value.number(40)));
    }

    @Test
    void emergencyStopWithoutSubjectStopsEveryAgent() {
        assertThat(translator.translate(InputCommand.of("emergency_stop", null, null), state))
                .containsExactly(
                        new PathWrite("agents.cargo_ship.speed", Value.number(0)),
                        new PathWrite("agents.tugboat.speed", Value.number(0)));
    }

    @Test
    void setFieldWritesRawPath() {
        assertThat(translator.translate(InputCommand.setField("environment.visibility", 0.3), state))
                .containsExactly(new PathWrite("environment.visibility", Value.number(0.3)));
    }

    @Test
    void rejectsMalformedInputs() {
        assertThatThrownBy(() -> translator.translate(InputCommand.of("warp_drive", "tugboat", 1), state))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown input type");
        assertThatThrownBy(() -> translator.translate(InputCommand.of("adjust_speed", null, 1), state))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires a subject");
        assertThatThrownBy(() -> translator.translate(InputCommand.of("adjust_speed", "tugboat", "fast"), state))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("numeric");
    }

    @Test
    void customHandlersCanBeRegistered() {
        IInputHandler handler = mock(IInputHandler.class);
        when(handler.type()).thenReturn("tide_update");
        when(handler.translate(any(InputCommand.class), any(IStateReader.class)))
                .thenReturn(List.of(new PathWrite("environment.tide", Value.number(2))));
        translator.register(handler);

        List<PathWrite> writes = translator.translate(InputCommand.of("tide_update", null, 2), state);

        assertThat(writes).containsExactly(new PathWrite("environment.tide", Value.number(2)));
        verify(handler).translate(any(InputCommand.class), any(IStateReader.class));
    }

    @Test
    void queueDrainsInSubmissionOrder() {
        InputQueue queue = new InputQueue();
        queue.submit(InputCommand.of("adjust_speed", "tugboat", 4));
        queue.submit(InputCommand.of("change_angle", "tugboat", 80));

        List<InputCommand> drained = queue.drain();

        assertThat(drained).extracting(InputCommand::type).containsExactly("adjust_speed", "change_angle");
        assertThat(queue.size()).isZero();
    }
}
