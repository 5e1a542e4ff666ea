package io.cronhub.cli;

import io.cronhub.core.CronhubRuntime;
import io.cronhub.core.config.ConfigService;
import io.cronhub.core.config.model.CronhubConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Clock clock,
    ServeRunner serveRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, Clock.systemUTC(), (port, host) -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }

    public CronhubConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    /**
     * Opens the store and runner without arming anything.
     */
    public CronhubRuntime openRuntime() throws IOException {
        return CronhubRuntime.open(loadConfig(), clock);
    }
}
