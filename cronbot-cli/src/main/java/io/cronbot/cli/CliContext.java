package io.cronbot.cli;

import io.cronbot.core.config.ConfigPaths;
import io.cronbot.core.config.ConfigService;
import io.cronbot.core.config.model.CronbotConfig;
import io.cronbot.core.store.JdbcExecutionLog;
import io.cronbot.core.store.JdbcJobStore;
import io.cronbot.core.store.SqliteDatabase;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Clock clock,
    SchedulerRunner schedulerRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, Clock.systemUTC(), () -> {
            throw new UnsupportedOperationException("scheduler runner is not configured");
        });
    }

    public CronbotConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    public JobRepository openRepository(CronbotConfig config) throws IOException {
        SqliteDatabase database = new SqliteDatabase(ConfigPaths.resolveDatabase(config.store().path()));
        return new JobRepository(new JdbcJobStore(database, clock), new JdbcExecutionLog(database));
    }
}
