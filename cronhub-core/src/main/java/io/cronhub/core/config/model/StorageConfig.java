package io.cronhub.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(String databasePath, String logDirectory) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.cronhub/cronhub.db", "~/.cronhub/logs/cron");
    }
}
