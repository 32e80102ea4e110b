package org.helmsman.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.helmsman.junit.extensions.logging.LogWatchExtension;
import org.helmsman.runtime.conflicts.ConflictStrategy;
import org.helmsman.runtime.conflicts.MergeFunction;
import org.helmsman.runtime.events.EventPersistence;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link EngineSettings}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class EngineSettingsTest {

    @Test
    void readsEveryKey() {
        EngineSettings settings = EngineSettings.fromConfig(ConfigFactory.parseString("""
                max-chain-depth = 8
                conflict {
                  default-strategy = "last_write_wins"
                  merge-function = "min"
                  priority-threshold = 5
                  merge-rules = ["docking_approach_speed"]
                  manual-review-rules = ["escort_speed_match"]
                }
                events.persistence = "UNTIL_CONSUMED"
                metrics.track-decisions = true
                """));

        assertThat(settings.maxChainDepth()).isEqualTo(8);
        assertThat(settings.conflictPolicy().defaultStrategy()).isEqualTo(ConflictStrategy.LAST_WRITE_WINS);
        assertThat(settings.conflictPolicy().mergeFunction()).isEqualTo(MergeFunction.MIN);
        assertThat(settings.conflictPolicy().priorityThreshold()).isEqualTo(5);
        assertThat(settings.conflictPolicy().mergeRules()).containsExactly("docking_approach_speed");
        assertThat(settings.conflictPolicy().manualReviewRules()).containsExactly("escort_speed_match");
        assertThat(settings.eventPersistence()).isEqualTo(EventPersistence.UNTIL_CONSUMED);
        assertThat(settings.trackDecisions()).isTrue();
    }

    @Test
    void missingKeysUseDefaults() {
        assertThat(EngineSettings.fromConfig(ConfigFactory.empty())).isEqualTo(EngineSettings.defaults());
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> EngineSettings.fromConfig(ConfigFactory.parseString("max-chain-depth = 0")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineSettings.fromConfig(
                ConfigFactory.parseString("conflict.default-strategy = \"vote\"")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineSettings.fromConfig(ConfigFactory.parseString("events.persistence = \"forever\"")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineSettings.fromConfig(ConfigFactory.parseString("max-chain-depth = \"deep\"")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid engine configuration");
    }

    @Test
    void withersReplaceSingleSetting() {
        EngineSettings settings = EngineSettings.defaults().withMaxChainDepth(3).withTrackDecisions(true);

        assertThat(settings.maxChainDepth()).isEqualTo(3);
        assertThat(settings.trackDecisions()).isTrue();
        assertThat(settings.eventPersistence()).isEqualTo(EventPersistence.TICK);
    }
}
