package io.cronhub.core.sync;

import io.cronhub.core.job.JobRecord;
import java.time.Instant;

/**
 * A persisted job together with its live scheduling state. {@code nextFireAt} is {@code null} when unarmed.
 */
public record JobView(
    JobRecord job,
    boolean armed,
    boolean running,
    Instant nextFireAt
) {
}
