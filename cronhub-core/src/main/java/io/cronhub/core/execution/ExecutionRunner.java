package io.cronhub.core.execution;

import io.cronhub.core.job.JobRecord;
import io.cronhub.core.job.JobStore;
import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs job commands, records each outcome in the execution log and stamps {@code lastRun} on completion.
 *
 * <p>Runs of the same job never overlap. A dispatch that arrives while the job is running is queued and
 * starts as soon as the current run finishes; while one follow-up is already queued, further dispatches
 * are coalesced into it. A queued follow-up re-reads the job first and is dropped if the job was deleted.
 * Failures of the command, the log or the store are logged, never thrown.
 */
public final class ExecutionRunner implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionRunner.class);

    public enum DispatchStatus {
        STARTED,
        QUEUED,
        COALESCED,
        REJECTED
    }

    private final CommandExecutor executor;
    private final ExecutionLog executionLog;
    private final JobStore store;
    private final Clock clock;
    private final ExecutorService workers;
    private final Duration shutdownGrace;
    private final Map<Long, Lane> lanes = new HashMap<>();
    private boolean closed;

    public ExecutionRunner(
        CommandExecutor executor,
        ExecutionLog executionLog,
        JobStore store,
        Clock clock,
        int workerThreads,
        Duration shutdownGrace
    ) {
        this(executor, executionLog, store, clock, newWorkerPool(workerThreads), shutdownGrace);
    }

    public ExecutionRunner(
        CommandExecutor executor,
        ExecutionLog executionLog,
        JobStore store,
        Clock clock,
        ExecutorService workers,
        Duration shutdownGrace
    ) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.executionLog = Objects.requireNonNull(executionLog, "executionLog must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.shutdownGrace = shutdownGrace == null ? Duration.ZERO : shutdownGrace;
    }

    /**
     * Hands the job to the worker pool and returns immediately.
     */
    public synchronized DispatchStatus dispatch(JobRecord job) {
        if (closed) {
            LOG.warn("Rejecting run of job {} ({}): runner is shut down", job.id(), job.name());
            return DispatchStatus.REJECTED;
        }
        Lane lane = lanes.get(job.id());
        if (lane != null) {
            if (lane.queued) {
                LOG.info("Skipping run of job {} ({}): a run is in progress and another is already queued",
                    job.id(), job.name());
                return DispatchStatus.COALESCED;
            }
            lane.queued = true;
            LOG.info("Queued run of job {} ({}) behind the run in progress", job.id(), job.name());
            return DispatchStatus.QUEUED;
        }

        lanes.put(job.id(), new Lane());
        try {
            workers.execute(() -> drain(job));
        } catch (RejectedExecutionException e) {
            lanes.remove(job.id());
            LOG.warn("Worker pool rejected run of job {} ({})", job.id(), job.name(), e);
            return DispatchStatus.REJECTED;
        }
        return DispatchStatus.STARTED;
    }

    public synchronized boolean isRunning(long jobId) {
        return lanes.containsKey(jobId);
    }

    /**
     * Runs the job on the calling thread. Does not take part in the overlap bookkeeping of {@link #dispatch}.
     */
    public ExecutionResult run(JobRecord job) {
        Instant startedAt = clock.instant();
        LOG.info("Running job {} ({}): {}", job.id(), job.name(), job.command());

        ExecutionResult result;
        boolean interrupted = false;
        try {
            result = classify(job, startedAt, executor.execute(job.command()));
        } catch (IOException e) {
            result = new ExecutionResult(job.id(), job.command(), startedAt, clock.instant(),
                ExecutionOutcome.SPAWN_ERROR, null, "Error: " + e.getMessage(), "");
        } catch (InterruptedException e) {
            interrupted = true;
            result = new ExecutionResult(job.id(), job.command(), startedAt, clock.instant(),
                ExecutionOutcome.INCOMPLETE, null, "", "run interrupted before completion");
        } catch (RuntimeException e) {
            result = new ExecutionResult(job.id(), job.command(), startedAt, clock.instant(),
                ExecutionOutcome.SPAWN_ERROR, null, "Error: " + e, "");
        }

        // A shutdown interrupt must not cost a finished run its log record; it is restored afterwards.
        interrupted |= Thread.interrupted();
        try {
            interrupted |= record(job, result);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        return result;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Interrupting job runs still in progress after {}s shutdown grace", shutdownGrace.toSeconds());
                workers.shutdownNow();
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    LOG.warn("Some job runs did not stop after interruption");
                }
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ExecutionResult classify(JobRecord job, Instant startedAt, CommandOutput output) {
        Instant finishedAt = clock.instant();
        int exitCode = output.exitCode();
        if (exitCode == 0) {
            return new ExecutionResult(job.id(), job.command(), startedAt, finishedAt,
                ExecutionOutcome.SUCCESS, exitCode, output.stdout(), output.stderr());
        }
        // 126: found but not executable, 127: not found
        if (exitCode == 126 || exitCode == 127) {
            String message = output.stderr().isBlank()
                ? "Error: command could not be started (exit " + exitCode + ")"
                : output.stderr().strip();
            // sh -c may have run part of the command line before failing; keep what it printed
            if (!output.stdout().isBlank()) {
                return new ExecutionResult(job.id(), job.command(), startedAt, finishedAt,
                    ExecutionOutcome.SPAWN_ERROR, exitCode, output.stdout(),
                    output.stderr().isBlank() ? message : output.stderr());
            }
            return new ExecutionResult(job.id(), job.command(), startedAt, finishedAt,
                ExecutionOutcome.SPAWN_ERROR, exitCode, message, output.stderr());
        }
        return new ExecutionResult(job.id(), job.command(), startedAt, finishedAt,
            ExecutionOutcome.FAILURE, exitCode, output.stdout(), output.stderr());
    }

    /**
     * Returns {@code true} when an interrupt arrived while recording and was cleared to finish the write.
     */
    private boolean record(JobRecord job, ExecutionResult result) {
        if (result.outcome() == ExecutionOutcome.SUCCESS) {
            LOG.info("Job {} ({}) succeeded in {} ms", job.id(), job.name(), result.duration().toMillis());
        } else {
            LOG.warn("Job {} ({}) finished with {} (exit {}) in {} ms", job.id(), job.name(),
                result.outcome().tag(), result.exitCode(), result.duration().toMillis());
        }

        boolean interrupted = false;
        try {
            executionLog.append(result);
        } catch (ClosedByInterruptException e) {
            interrupted = Thread.interrupted();
            appendAfterInterrupt(job, result);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to write execution log for job {}", job.id(), e);
        }

        if (result.outcome() == ExecutionOutcome.INCOMPLETE) {
            return interrupted;
        }
        try {
            if (!store.setLastRun(job.id(), result.finishedAt())) {
                LOG.debug("Last run of job {} not updated: job gone or holds a later timestamp", job.id());
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to record last run of job {}", job.id(), e);
        }
        return interrupted;
    }

    private void appendAfterInterrupt(JobRecord job, ExecutionResult result) {
        try {
            executionLog.append(result);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to write execution log for job {} after interrupt", job.id(), e);
        }
    }

    private void drain(JobRecord first) {
        JobRecord job = first;
        try {
            while (job != null) {
                run(job);
                job = Thread.currentThread().isInterrupted() ? abandon(job.id()) : nextQueued(job.id());
            }
        } catch (RuntimeException e) {
            LOG.error("Run loop of job {} failed", first.id(), e);
            abandon(first.id());
        }
    }

    private JobRecord nextQueued(long jobId) {
        while (true) {
            synchronized (this) {
                Lane lane = lanes.get(jobId);
                if (lane == null || !lane.queued || closed) {
                    if (lane != null && lane.queued) {
                        LOG.info("Dropping queued run of job {}: runner is shutting down", jobId);
                    }
                    lanes.remove(jobId);
                    return null;
                }
                lane.queued = false;
            }

            try {
                Optional<JobRecord> current = store.get(jobId);
                if (current.isPresent()) {
                    return current.get();
                }
                LOG.info("Dropping queued run of job {}: job no longer exists", jobId);
            } catch (IOException e) {
                LOG.warn("Dropping queued run of job {}: lookup failed", jobId, e);
            }
        }
    }

    private synchronized JobRecord abandon(long jobId) {
        lanes.remove(jobId);
        return null;
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), runnable -> {
            Thread thread = new Thread(runnable, "cronhub-run-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private static final class Lane {
        private boolean queued;
    }
}
