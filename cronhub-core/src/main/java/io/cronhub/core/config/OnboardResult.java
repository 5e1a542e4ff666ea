package io.cronhub.core.config;

import java.nio.file.Path;

public record OnboardResult(
    Path configPath,
    Path databasePath,
    Path logDirectory,
    boolean createdConfig,
    boolean overwrittenConfig
) {
}
