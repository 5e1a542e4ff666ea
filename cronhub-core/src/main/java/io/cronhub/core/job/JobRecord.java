package io.cronhub.core.job;

import java.time.Instant;

/**
 * Persisted job definition. {@code lastRun} is {@code null} until the first run completes.
 */
public record JobRecord(
    long id,
    String name,
    String command,
    String recurrence,
    boolean enabled,
    Instant createdAt,
    Instant lastRun
) {
}
