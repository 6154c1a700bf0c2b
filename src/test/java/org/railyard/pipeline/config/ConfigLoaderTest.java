package org.railyard.pipeline.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.railyard.junit.extensions.logging.ExpectLog;
import org.railyard.junit.extensions.logging.LogLevel;
import org.railyard.junit.extensions.logging.LogWatchExtension;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperties() {
        System.clearProperty("pipeline.workers");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void defaultsComeFromReferenceConf() {
        Config config = ConfigLoader.loadDefaults();

        assertThat(config.getInt("pipeline.workers")).isEqualTo(1);
        assertThat(config.getBoolean("pipeline.allowOverwrite")).isFalse();
        assertThat(config.getString("pipeline.models.compression.codec")).isEqualTo("zstd");
        assertThat(config.getStringList("pipeline.stageSequence")).isEmpty();
    }

    @Test
    void userValuesOverrideDefaults() {
        Config config = ConfigLoader.loadFromString("pipeline { workers = 4, stageSequence = [\"a\"] }");

        assertThat(config.getInt("pipeline.workers")).isEqualTo(4);
        assertThat(config.getStringList("pipeline.stageSequence")).containsExactly("a");
        assertThat(config.getInt("pipeline.models.compression.level")).isEqualTo(3);
    }

    @Test
    void systemPropertiesOverrideTheFile() {
        System.setProperty("pipeline.workers", "3");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromString("pipeline { workers = 4 }");

        assertThat(config.getInt("pipeline.workers")).isEqualTo(3);
    }

    @Test
    void resolve_loadsAnExplicitFile() throws Exception {
        Path file = tempDir.resolve("run.conf");
        Files.writeString(file, "pipeline { outputDirectory = \"results\" }", StandardCharsets.UTF_8);

        Config config = ConfigLoader.resolve(file.toFile());

        assertThat(config.getString("pipeline.outputDirectory")).isEqualTo("results");
    }

    @Test
    void resolve_rejectsMissingExplicitFile() {
        File missing = tempDir.resolve("nope.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.resolve(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope.conf");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "No 'config/railyard.conf' found in the current directory\\..*")
    void resolve_fallsBackToDefaults() {
        Config config = ConfigLoader.resolve(null);

        assertThat(config.hasPath("pipeline.outputDirectory")).isTrue();
    }
}
