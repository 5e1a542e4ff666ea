package io.cronhub.core.schedule;

import io.cronhub.core.recurrence.CronExpression;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * One armed timer. Guarded by the owning registry's lock.
 */
final class ScheduleHandle {
    private final long jobId;
    private final CronExpression rule;
    private final FireListener listener;
    private ScheduledFuture<?> future;
    private Instant nextFireAt;
    private boolean cancelled;

    ScheduleHandle(long jobId, CronExpression rule, FireListener listener) {
        this.jobId = jobId;
        this.rule = rule;
        this.listener = listener;
    }

    long jobId() {
        return jobId;
    }

    CronExpression rule() {
        return rule;
    }

    FireListener listener() {
        return listener;
    }

    Instant nextFireAt() {
        return nextFireAt;
    }

    boolean cancelled() {
        return cancelled;
    }

    void schedule(ScheduledFuture<?> future, Instant nextFireAt) {
        this.future = future;
        this.nextFireAt = nextFireAt;
    }

    void cancel() {
        cancelled = true;
        nextFireAt = null;
        if (future != null) {
            future.cancel(false);
        }
    }
}
