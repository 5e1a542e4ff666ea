package io.cronhub.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronhubConfig(
    StorageConfig storage,
    SchedulerConfig scheduler,
    ExecutionConfig execution,
    GatewayConfig gateway
) {

    public static CronhubConfig defaults() {
        return new CronhubConfig(
            StorageConfig.defaults(),
            SchedulerConfig.defaults(),
            ExecutionConfig.defaults(),
            GatewayConfig.defaults()
        );
    }
}
