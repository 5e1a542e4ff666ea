package io.cronhub.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.ZoneId;

/**
 * An empty {@code timezone} means the system default zone.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(String timezone) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig("");
    }

    @JsonIgnore
    public ZoneId zone() {
        return timezone == null || timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone.trim());
    }
}
