package io.pipe.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pipe.core.config.model.PipeConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        PipeConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.sessions().path()).isEqualTo("sessions");
        assertThat(config.sessions().lockTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.cache().updateThreshold()).isEqualTo(20000);
        assertThat(config.history().toolResponseLimit()).isEqualTo(3);
    }

    @Test
    void shouldMergeFileValuesOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "sessions": {
                "lock_timeout_seconds": 30
              },
              "cache": {
                "model": "gemini-2.5-pro"
              }
            }
            """);

        PipeConfig config = service.load(configPath);

        assertThat(config.sessions().lockTimeoutSeconds()).isEqualTo(30);
        assertThat(config.sessions().path()).isEqualTo("sessions");
        assertThat(config.cache().model()).isEqualTo("gemini-2.5-pro");
        assertThat(config.cache().ttl()).isEqualTo(Duration.ofHours(1));
        assertThat(config.history().referenceTtl()).isEqualTo(3);
    }

    @Test
    void shouldRejectExpirationThresholdBelowOne() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "history": {
                "tool_response_expiration": 0
              }
            }
            """);

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("tool_response_expiration must be >= 1");
    }

    @Test
    void shouldSaveAndReloadConfig() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".pipe/config.json");

        service.save(configPath, PipeConfig.defaults());

        assertThat(Files.readString(configPath)).contains("\"update_threshold\" : 20000");
        assertThat(service.load(configPath)).isEqualTo(PipeConfig.defaults());
    }

    @Test
    void shouldResolveRelativePathsAgainstProjectRoot() {
        assertThat(ConfigPaths.resolve(tempDir, "sessions")).isEqualTo(tempDir.resolve("sessions"));
        assertThat(ConfigPaths.resolve(tempDir, tempDir.resolve("abs").toString())).isEqualTo(tempDir.resolve("abs"));
        assertThat(ConfigPaths.resolve(tempDir, "~/x")).isEqualTo(Path.of(System.getProperty("user.home"), "x"));
    }
}
