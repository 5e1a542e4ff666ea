package io.cronhub.core.schedule;

import io.cronhub.core.recurrence.CronExpression;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of armed job timers. Each armed job owns one timer that fires at the next minute matching its rule
 * and re-arms itself from there. The registry does no I/O; firing only notifies the {@link FireListener}.
 */
public final class ScheduleRegistry implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleRegistry.class);

    private final ScheduledExecutorService timer;
    private final Clock clock;
    private final ZoneId zone;
    private final Map<Long, ScheduleHandle> handles = new HashMap<>();
    private boolean closed;

    public ScheduleRegistry(Clock clock, ZoneId zone) {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cronhub-timer");
            thread.setDaemon(true);
            return thread;
        }), clock, zone);
    }

    public ScheduleRegistry(ScheduledExecutorService timer, Clock clock, ZoneId zone) {
        this.timer = Objects.requireNonNull(timer, "timer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * Arms the job, replacing any handle it already has.
     */
    public synchronized void arm(long jobId, CronExpression rule, FireListener listener) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        if (closed) {
            throw new IllegalStateException("schedule registry is closed");
        }
        ScheduleHandle previous = handles.remove(jobId);
        if (previous != null) {
            previous.cancel();
        }
        ScheduleHandle handle = new ScheduleHandle(jobId, rule, listener);
        handles.put(jobId, handle);
        scheduleNext(handle, clock.instant());
        LOG.info("Armed job {} with '{}', next fire at {}", jobId, rule, handle.nextFireAt());
    }

    /**
     * Returns {@code false} when the job was not armed.
     */
    public synchronized boolean disarm(long jobId) {
        ScheduleHandle handle = handles.remove(jobId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        LOG.info("Disarmed job {}", jobId);
        return true;
    }

    public synchronized boolean isArmed(long jobId) {
        return handles.containsKey(jobId);
    }

    public synchronized Optional<CronExpression> armedRule(long jobId) {
        ScheduleHandle handle = handles.get(jobId);
        return handle == null ? Optional.empty() : Optional.of(handle.rule());
    }

    public synchronized Optional<Instant> nextFireAt(long jobId) {
        ScheduleHandle handle = handles.get(jobId);
        return handle == null ? Optional.empty() : Optional.ofNullable(handle.nextFireAt());
    }

    public synchronized Set<Long> armedJobIds() {
        return new TreeSet<>(handles.keySet());
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            handles.values().forEach(ScheduleHandle::cancel);
            handles.clear();
        }
        timer.shutdownNow();
    }

    private void scheduleNext(ScheduleHandle handle, Instant reference) {
        Optional<Instant> next = handle.rule().nextFireAfter(reference, zone);
        if (next.isEmpty()) {
            LOG.warn("Rule '{}' of job {} has no future fire time; job stays armed but idle", handle.rule(), handle.jobId());
            handle.schedule(null, null);
            return;
        }
        Instant fireAt = next.get();
        long delayMs = Math.max(0, Duration.between(clock.instant(), fireAt).toMillis());
        try {
            handle.schedule(timer.schedule(() -> onTimer(handle, fireAt), delayMs, TimeUnit.MILLISECONDS), fireAt);
            LOG.debug("Job {} next fire at {} (in {} ms)", handle.jobId(), fireAt, delayMs);
        } catch (RejectedExecutionException e) {
            LOG.warn("Timer rejected job {}; it stays armed but idle", handle.jobId(), e);
            handle.schedule(null, null);
        }
    }

    private void onTimer(ScheduleHandle handle, Instant scheduledAt) {
        synchronized (this) {
            if (handle.cancelled() || handles.get(handle.jobId()) != handle) {
                return;
            }
            Instant now = clock.instant();
            scheduleNext(handle, now.isAfter(scheduledAt) ? now : scheduledAt);
        }
        try {
            handle.listener().onFire(handle.jobId(), scheduledAt);
        } catch (RuntimeException e) {
            LOG.error("Fire listener failed for job {}", handle.jobId(), e);
        }
    }
}
