package io.cronhub.core.schedule;

import java.time.Instant;

@FunctionalInterface
public interface FireListener {
    void onFire(long jobId, Instant scheduledAt);
}
