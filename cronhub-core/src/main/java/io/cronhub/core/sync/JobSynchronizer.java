package io.cronhub.core.sync;

import io.cronhub.core.execution.ExecutionLog;
import io.cronhub.core.execution.ExecutionLogEntry;
import io.cronhub.core.execution.ExecutionRunner;
import io.cronhub.core.execution.ExecutionRunner.DispatchStatus;
import io.cronhub.core.job.JobDraft;
import io.cronhub.core.job.JobNotFoundException;
import io.cronhub.core.job.JobPatch;
import io.cronhub.core.job.JobRecord;
import io.cronhub.core.job.JobStore;
import io.cronhub.core.job.JobValidator;
import io.cronhub.core.recurrence.CronExpression;
import io.cronhub.core.schedule.ScheduleRegistry;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the {@link ScheduleRegistry} consistent with the {@link JobStore}.
 *
 * <p>Every mutation writes the store and reconciles the registry under one lock, so after each call a job is
 * armed exactly when its record exists and is enabled, with the persisted rule. Timer fires arrive as
 * messages on a single mailbox thread; each one re-reads the record before dispatching, so a job changed or
 * removed after it was armed never runs with stale data.
 */
public final class JobSynchronizer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobSynchronizer.class);

    private final JobStore store;
    private final ScheduleRegistry registry;
    private final ExecutionRunner runner;
    private final ExecutionLog executionLog;
    private final ExecutorService mailbox;
    private volatile boolean started;

    public JobSynchronizer(JobStore store, ScheduleRegistry registry, ExecutionRunner runner, ExecutionLog executionLog) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.executionLog = Objects.requireNonNull(executionLog, "executionLog must not be null");
        this.mailbox = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cronhub-sync");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Arms every enabled job. A job whose stored rule cannot be armed is logged and skipped.
     *
     * @return the number of jobs armed
     */
    public synchronized int start() throws IOException {
        if (started) {
            return registry.armedJobIds().size();
        }
        int armed = 0;
        int skipped = 0;
        for (JobRecord job : store.listEnabled()) {
            try {
                arm(job);
                armed++;
            } catch (RuntimeException e) {
                skipped++;
                LOG.warn("Skipping job {} ({}) at startup: {}", job.id(), job.name(), e.getMessage());
            }
        }
        started = true;
        LOG.info("Scheduler started: {} job(s) armed, {} skipped", armed, skipped);
        return armed;
    }

    public boolean isStarted() {
        return started;
    }

    public synchronized JobRecord create(JobDraft draft) throws IOException {
        JobDraft valid = JobValidator.validate(draft);
        JobRecord created = store.create(valid);
        LOG.info("Created job {} ({}) '{}' enabled={}", created.id(), created.name(), created.recurrence(), created.enabled());
        reconcile(created);
        return created;
    }

    /**
     * Rows written before validation existed may hold a rule that no longer parses. Such a job can be
     * disabled or given a new rule, but any change that would leave it enabled is rejected before the store
     * is touched.
     */
    public synchronized JobRecord update(long id, JobPatch patch) throws IOException {
        JobPatch valid = JobValidator.validate(patch);
        JobRecord current = store.get(id).orElseThrow(() -> new JobNotFoundException(id));
        boolean enabled = valid.enabled() != null ? valid.enabled() : current.enabled();
        if (enabled && valid.recurrence() == null) {
            CronExpression.parse(current.recurrence());
        }
        JobRecord updated = store.update(id, valid).orElseThrow(() -> new JobNotFoundException(id));
        LOG.info("Updated job {} ({}) '{}' enabled={}", updated.id(), updated.name(), updated.recurrence(), updated.enabled());
        reconcile(updated);
        return updated;
    }

    public JobRecord enable(long id) throws IOException {
        return update(id, JobPatch.enabled(true));
    }

    public JobRecord disable(long id) throws IOException {
        return update(id, JobPatch.enabled(false));
    }

    /**
     * Disarms before deleting so no timer can fire against a removed record.
     */
    public synchronized void delete(long id) throws IOException {
        registry.disarm(id);
        if (!store.delete(id)) {
            throw new JobNotFoundException(id);
        }
        LOG.info("Deleted job {}", id);
    }

    /**
     * Runs the job now regardless of its rule or enabled flag. The registry is not touched.
     */
    public DispatchStatus executeNow(long id) throws IOException {
        JobRecord job = store.get(id).orElseThrow(() -> new JobNotFoundException(id));
        LOG.info("Manual run of job {} ({}) requested", job.id(), job.name());
        return runner.dispatch(job);
    }

    public JobView get(long id) throws IOException {
        JobRecord job = store.get(id).orElseThrow(() -> new JobNotFoundException(id));
        return view(job);
    }

    /**
     * Newest jobs first.
     */
    public List<JobView> list() throws IOException {
        List<JobView> views = new ArrayList<>();
        for (JobRecord job : store.list()) {
            views.add(view(job));
        }
        return views;
    }

    public List<ExecutionLogEntry> recentRuns(long id, int limit) throws IOException {
        if (store.get(id).isEmpty()) {
            throw new JobNotFoundException(id);
        }
        return executionLog.recent(id, limit);
    }

    @Override
    public void close() {
        registry.close();
        mailbox.shutdown();
        try {
            if (!mailbox.awaitTermination(5, TimeUnit.SECONDS)) {
                mailbox.shutdownNow();
            }
        } catch (InterruptedException e) {
            mailbox.shutdownNow();
            Thread.currentThread().interrupt();
        }
        runner.close();
    }

    void post(long jobId, Instant scheduledAt) {
        try {
            mailbox.execute(() -> fire(jobId, scheduledAt));
        } catch (RejectedExecutionException e) {
            LOG.debug("Ignoring fire of job {} at {}: synchronizer is shut down", jobId, scheduledAt);
        }
    }

    synchronized void fire(long jobId, Instant scheduledAt) {
        Optional<JobRecord> current;
        try {
            current = store.get(jobId);
        } catch (IOException e) {
            LOG.warn("Skipping fire of job {} at {}: lookup failed", jobId, scheduledAt, e);
            return;
        }
        if (current.isEmpty() || !current.get().enabled()) {
            LOG.info("Job {} fired at {} but is {}; disarming", jobId, scheduledAt,
                current.isEmpty() ? "gone" : "disabled");
            registry.disarm(jobId);
            return;
        }
        JobRecord job = current.get();
        LOG.debug("Job {} ({}) fired for {}", job.id(), job.name(), scheduledAt);
        runner.dispatch(job);
    }

    private void reconcile(JobRecord job) {
        if (!started) {
            return;
        }
        if (job.enabled()) {
            arm(job);
        } else {
            registry.disarm(job.id());
        }
    }

    private void arm(JobRecord job) {
        registry.arm(job.id(), CronExpression.parse(job.recurrence()), this::post);
    }

    private JobView view(JobRecord job) {
        boolean armed = registry.isArmed(job.id());
        return new JobView(
            job,
            armed,
            runner.isRunning(job.id()),
            registry.nextFireAt(job.id()).orElse(null)
        );
    }
}
