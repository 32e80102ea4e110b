package org.helmsman.runtime.history;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.NoSuchElementException;

import org.helmsman.junit.extensions.logging.LogWatchExtension;
import org.helmsman.runtime.explain.TickReport;
import org.helmsman.runtime.model.SystemState;
import org.helmsman.runtime.model.Value;
import org.helmsman.testutil.HarborFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for {@link StateHistory}, {@link ReplayCursor} and {@link StateSnapshot}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class StateHistoryTest {

    private SystemState state;
    private StateHistory history;

    @BeforeEach
    void setUp() {
        state = HarborFixtures.twoVessels();
        history = new StateHistory();
    }

    @Test
    void appendsConsecutiveTicksOnly() {
        history.append(commit(0, 8));
        history.append(commit(1, 7));

        assertThatThrownBy(() -> history.append(commit(3, 6)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Expected snapshot for tick 2");
        assertThat(history.size()).isEqualTo(2);
        assertThat(history.firstTick()).isZero();
        assertThat(history.latest().map(StateSnapshot::tick)).contains(1L);
    }

    @Test
    void getByTick() {
        history.append(commit(0, 8));
        history.append(commit(1, 7));

        assertThat(history.get(1).map(s -> s.valueAt("agents.tugboat.speed"))).contains(Value.number(7));
        assertThat(history.get(2)).isEmpty();
        assertThat(history.get(-1)).isEmpty();
    }

    @Test
    void cursorReplaysForwardAndRewinds() {
        history.append(commit(0, 8));
        history.append(commit(1, 7));
        history.append(commit(2, 6));
        ReplayCursor cursor = history.cursor();

        assertThat(cursor.current()).isEmpty();
        assertThat(cursor.hasPrevious()).isFalse();
        assertThat(cursor.next().tick()).isZero();
        assertThat(cursor.next().tick()).isEqualTo(1);
        assertThat(cursor.next().tick()).isEqualTo(2);
        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.previous().valueAt("agents.tugboat.speed")).isEqualTo(Value.number(7));
        assertThat(cursor.seek(0).tick()).isZero();
        assertThat(cursor.hasPrevious()).isFalse();
        assertThatThrownBy(cursor::previous).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> cursor.seek(9)).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void cursorSeesSnapshotsAppendedLater() {
        ReplayCursor cursor = history.cursor();
        assertThat(cursor.hasNext()).isFalse();

        history.append(commit(0, 8));

        assertThat(cursor.hasNext()).isTrue();
    }

    @Test
    void snapshotIsDetachedFromLiveState() {
        StateSnapshot snapshot = commit(0, 8);

        state.getAgent("tugboat").orElseThrow().put("speed", Value.number(1));

        assertThat(snapshot.valueAt("agents.tugboat.speed")).isEqualTo(Value.number(8));
        assertThat(snapshot.agentIds()).containsExactly("cargo_ship", "tugboat");
    }

    @Test
    void snapshotRebuildsAnEqualState() {
        StateSnapshot snapshot = commit(0, 8);

        SystemState rebuilt = snapshot.toState();

        assertThat(rebuilt.getTimeStep()).isEqualTo(snapshot.timeStep());
        assertThat(rebuilt.agents()).isEqualTo(state.agents());
        assertThat(rebuilt.environmentFields()).isEqualTo(state.environmentFields());
        assertThat(rebuilt.metrics()).isEqualTo(state.metrics());
        assertThat(rebuilt.history().isEmpty()).isTrue();
    }

    private StateSnapshot commit(long tick, double tugSpeed) {
        state.getAgent("tugboat").orElseThrow().put("speed", Value.number(tugSpeed));
        return StateSnapshot.capture(state, tick, emptyReport(tick));
    }

    private static TickReport emptyReport(long tick) {
        return new TickReport(tick, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), false);
    }
}
