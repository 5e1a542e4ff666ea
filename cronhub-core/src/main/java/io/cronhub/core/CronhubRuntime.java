package io.cronhub.core;

import io.cronhub.core.config.ConfigPaths;
import io.cronhub.core.config.model.CronhubConfig;
import io.cronhub.core.config.model.ExecutionConfig;
import io.cronhub.core.execution.ExecutionLog;
import io.cronhub.core.execution.ExecutionRunner;
import io.cronhub.core.execution.FileExecutionLog;
import io.cronhub.core.execution.ShellCommandExecutor;
import io.cronhub.core.job.JobStore;
import io.cronhub.core.job.SqliteJobStore;
import io.cronhub.core.schedule.ScheduleRegistry;
import io.cronhub.core.sync.JobSynchronizer;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * The scheduler components built from one configuration. Nothing is armed until
 * {@code synchronizer().start()} is called.
 */
public final class CronhubRuntime implements AutoCloseable {
    private final JobStore store;
    private final ExecutionLog executionLog;
    private final ExecutionRunner runner;
    private final JobSynchronizer synchronizer;

    private CronhubRuntime(JobStore store, ExecutionLog executionLog, ExecutionRunner runner, JobSynchronizer synchronizer) {
        this.store = store;
        this.executionLog = executionLog;
        this.runner = runner;
        this.synchronizer = synchronizer;
    }

    public static CronhubRuntime open(CronhubConfig config, Clock clock) throws IOException {
        ExecutionConfig execution = config.execution();
        JobStore store = new SqliteJobStore(ConfigPaths.resolve(config.storage().databasePath()), clock);
        ExecutionLog executionLog = new FileExecutionLog(
            ConfigPaths.resolve(config.storage().logDirectory()),
            execution.maxLogsPerJob()
        );
        ExecutionRunner runner = new ExecutionRunner(
            new ShellCommandExecutor(
                execution.shell(),
                ConfigPaths.resolveOrNull(execution.workingDirectory()),
                execution.maxOutputChars()
            ),
            executionLog,
            store,
            clock,
            execution.workerThreads(),
            Duration.ofSeconds(execution.shutdownGraceSeconds())
        );
        ScheduleRegistry registry = new ScheduleRegistry(clock, config.scheduler().zone());
        return new CronhubRuntime(store, executionLog, runner, new JobSynchronizer(store, registry, runner, executionLog));
    }

    public JobStore store() {
        return store;
    }

    public ExecutionLog executionLog() {
        return executionLog;
    }

    public ExecutionRunner runner() {
        return runner;
    }

    public JobSynchronizer synchronizer() {
        return synchronizer;
    }

    @Override
    public void close() {
        synchronizer.close();
    }
}
