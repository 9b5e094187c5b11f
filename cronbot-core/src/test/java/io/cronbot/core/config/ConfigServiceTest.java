package io.cronbot.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cronbot.core.config.model.CronbotConfig;
import io.cronbot.core.scheduler.OverlapPolicy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        CronbotConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.scheduler().zoneId()).isEqualTo(ZoneId.of("UTC"));
        assertThat(config.scheduler().workerThreads()).isEqualTo(4);
        assertThat(config.scheduler().overlapPolicy()).isEqualTo(OverlapPolicy.ALLOW);
        assertThat(config.store().path()).isEqualTo("~/.cronbot/cronbot.db");
    }

    @Test
    void shouldMergeFileValuesOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "scheduler": {
                "timezone": "Europe/Berlin",
                "overlapPolicy": "SKIP"
              }
            }
            """);

        CronbotConfig config = service.load(configPath);

        assertThat(config.scheduler().zoneId()).isEqualTo(ZoneId.of("Europe/Berlin"));
        assertThat(config.scheduler().overlapPolicy()).isEqualTo(OverlapPolicy.SKIP);
        assertThat(config.scheduler().executionTimeoutSeconds()).isEqualTo(300);
        assertThat(config.scheduler().toOptions().executionTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.store().path()).isEqualTo("~/.cronbot/cronbot.db");
    }

    @Test
    void shouldRejectUnknownTimezone() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{\"scheduler\": {\"timezone\": \"Mars/Olympus\"}}");

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Mars/Olympus");
    }

    @Test
    void onboardShouldWriteDefaultsAndKeepExistingValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".cronbot/config.json");

        OnboardResult first = service.onboard(configPath, false);
        assertThat(first.createdConfig()).isTrue();
        assertThat(Files.exists(configPath)).isTrue();

        Files.writeString(configPath, "{\"store\": {\"path\": \"" + tempDir.resolve("jobs.db").toString().replace("\\", "\\\\") + "\"}}");
        OnboardResult second = service.onboard(configPath, false);

        assertThat(second.createdConfig()).isFalse();
        assertThat(second.databasePath()).isEqualTo(tempDir.resolve("jobs.db"));
        assertThat(service.load(configPath).scheduler().workerThreads()).isEqualTo(4);

        OnboardResult reset = service.onboard(configPath, true);
        assertThat(reset.overwrittenConfig()).isTrue();
    }
}
