package org.helmsman.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.helmsman.junit.extensions.logging.ExpectLog;
import org.helmsman.junit.extensions.logging.LogLevel;
import org.helmsman.junit.extensions.logging.LogWatchExtension;
import org.helmsman.runtime.EngineSettings;
import org.helmsman.runtime.conflicts.ConflictStrategy;
import org.helmsman.runtime.events.EventPersistence;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link ConfigLoader}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsMatchBuiltInSettings() {
        Config config = ConfigLoader.loadDefaults();

        assertThat(ConfigLoader.engineSettings(config)).isEqualTo(EngineSettings.defaults());
        assertThat(config.getString("helmsman.sessions.default-scenario")).isEqualTo("default");
    }

    @Test
    void explicitFileOverridesReferenceConf() throws IOException {
        File file = tempDir.resolve("helmsman.conf").toFile();
        Files.writeString(file.toPath(), String.join("\n",
                "helmsman.engine.max-chain-depth = 4",
                "helmsman.engine.conflict.default-strategy = \"merge\"",
                "helmsman.engine.events.persistence = \"until-consumed\""), StandardCharsets.UTF_8);
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(file, (level, message) -> messages.add(level + " " + message));
        EngineSettings settings = ConfigLoader.engineSettings(config);

        assertThat(settings.maxChainDepth()).isEqualTo(4);
        assertThat(settings.conflictPolicy().defaultStrategy()).isEqualTo(ConflictStrategy.MERGE);
        assertThat(settings.eventPersistence()).isEqualTo(EventPersistence.UNTIL_CONSUMED);
        assertThat(settings.trackDecisions()).isFalse();
        assertThat(messages).hasSize(1);
        assertThat(messages.get(0)).startsWith("INFO Using configuration file");
    }

    @Test
    void missingExplicitFileFails() {
        File missing = tempDir.resolve("absent.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, (level, message) -> { }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("absent.conf");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ConfigLoader",
            messagePattern = "No 'config/helmsman\\.conf' found in current directory\\..*")
    void autoDiscoveryWithoutFileWarnsAndUsesDefaults() {
        Config config = ConfigLoader.resolve(null);

        assertThat(ConfigLoader.engineSettings(config)).isEqualTo(EngineSettings.defaults());
    }

    @Test
    void missingEngineBlockFallsBackToDefaults() {
        assertThat(ConfigLoader.engineSettings(ConfigFactory.empty())).isEqualTo(EngineSettings.defaults());
    }
}
