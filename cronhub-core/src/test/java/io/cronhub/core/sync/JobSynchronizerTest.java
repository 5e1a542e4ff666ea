package io.cronhub.core.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cronhub.core.MutableClock;
import io.cronhub.core.execution.CommandOutput;
import io.cronhub.core.execution.ExecutionLogEntry;
import io.cronhub.core.execution.ExecutionOutcome;
import io.cronhub.core.execution.ExecutionRunner;
import io.cronhub.core.execution.ExecutionRunner.DispatchStatus;
import io.cronhub.core.execution.FileExecutionLog;
import io.cronhub.core.execution.ShellCommandExecutor;
import io.cronhub.core.job.JobDraft;
import io.cronhub.core.job.JobNotFoundException;
import io.cronhub.core.job.JobPatch;
import io.cronhub.core.job.JobRecord;
import io.cronhub.core.job.JobValidationException;
import io.cronhub.core.job.SqliteJobStore;
import io.cronhub.core.recurrence.CronExpression;
import io.cronhub.core.schedule.ScheduleRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobSynchronizerTest {
    private static final Instant NOW = Instant.parse("2026-01-01T08:30:30Z");

    @TempDir
    Path tempDir;

    private final List<String> executed = new CopyOnWriteArrayList<>();
    private SqliteJobStore store;
    private FileExecutionLog executionLog;
    private ScheduleRegistry registry;
    private JobSynchronizer synchronizer;

    @AfterEach
    void tearDown() {
        if (synchronizer != null) {
            synchronizer.close();
        }
    }

    private JobSynchronizer synchronizer(Clock registryClock, Clock runnerClock) throws Exception {
        store = new SqliteJobStore(tempDir.resolve("cronhub.db"), new MutableClock(NOW));
        executionLog = new FileExecutionLog(tempDir.resolve("logs"), 50);
        registry = new ScheduleRegistry(registryClock, ZoneOffset.UTC);
        ExecutionRunner runner = new ExecutionRunner(
            command -> {
                executed.add(command);
                return new CommandOutput(0, "ran " + command, "");
            },
            executionLog,
            store,
            runnerClock,
            2,
            Duration.ofSeconds(2)
        );
        synchronizer = new JobSynchronizer(store, registry, runner, executionLog);
        return synchronizer;
    }

    private JobSynchronizer started() throws Exception {
        JobSynchronizer synchronizer = synchronizer(Clock.fixed(NOW, ZoneOffset.UTC), new MutableClock(NOW));
        synchronizer.start();
        return synchronizer;
    }

    @Test
    void shouldArmEnabledJobOnCreate() throws Exception {
        JobSynchronizer synchronizer = started();

        JobRecord job = synchronizer.create(new JobDraft("report", "echo report", " 0  9 * * * ", true));

        assertThat(job.recurrence()).isEqualTo("0 9 * * *");
        assertThat(registry.armedRule(job.id())).contains(CronExpression.parse("0 9 * * *"));
        JobView view = synchronizer.get(job.id());
        assertThat(view.armed()).isTrue();
        assertThat(view.nextFireAt()).isEqualTo(Instant.parse("2026-01-01T09:00:00Z"));
    }

    @Test
    void shouldNotArmDisabledJobOnCreate() throws Exception {
        JobSynchronizer synchronizer = started();

        JobRecord job = synchronizer.create(new JobDraft("paused", "true", "* * * * *", false));

        assertThat(registry.isArmed(job.id())).isFalse();
        assertThat(synchronizer.get(job.id()).nextFireAt()).isNull();
    }

    @Test
    void shouldNotPersistJobWithInvalidRecurrence() throws Exception {
        JobSynchronizer synchronizer = started();

        assertThatThrownBy(() -> synchronizer.create(new JobDraft("bad", "true", "99 * * * *", true)))
            .isInstanceOf(JobValidationException.class);

        assertThat(store.list()).isEmpty();
        assertThat(registry.armedJobIds()).isEmpty();
    }

    @Test
    void shouldRearmWithUpdatedRule() throws Exception {
        JobSynchronizer synchronizer = started();
        JobRecord job = synchronizer.create(new JobDraft("report", "echo report", "0 9 * * *", true));

        JobRecord updated = synchronizer.update(job.id(), new JobPatch(null, null, "*/15 * * * *", null));

        assertThat(updated.recurrence()).isEqualTo("*/15 * * * *");
        assertThat(registry.armedRule(job.id())).contains(CronExpression.parse("*/15 * * * *"));
        assertThat(registry.nextFireAt(job.id())).contains(Instant.parse("2026-01-01T08:45:00Z"));
    }

    @Test
    void shouldKeepRuleWhenUpdateIsRejected() throws Exception {
        JobSynchronizer synchronizer = started();
        JobRecord job = synchronizer.create(new JobDraft("report", "echo report", "0 9 * * *", true));

        assertThatThrownBy(() -> synchronizer.update(job.id(), new JobPatch(null, null, "61 * * * *", null)))
            .isInstanceOf(JobValidationException.class);

        assertThat(store.get(job.id()).orElseThrow().recurrence()).isEqualTo("0 9 * * *");
        assertThat(registry.armedRule(job.id())).contains(CronExpression.parse("0 9 * * *"));
    }

    @Test
    void shouldDisarmOnDisableAndRearmOnEnable() throws Exception {
        JobSynchronizer synchronizer = started();
        JobRecord job = synchronizer.create(new JobDraft("toggle", "true", "0 9 * * *", true));

        assertThat(synchronizer.disable(job.id()).enabled()).isFalse();
        assertThat(registry.isArmed(job.id())).isFalse();

        assertThat(synchronizer.enable(job.id()).enabled()).isTrue();
        assertThat(registry.isArmed(job.id())).isTrue();
    }

    @Test
    void shouldRejectOperationsOnMissingJobs() throws Exception {
        JobSynchronizer synchronizer = started();
        JobRecord job = synchronizer.create(new JobDraft("gone", "true", "0 9 * * *", true));

        synchronizer.delete(job.id());

        assertThat(registry.isArmed(job.id())).isFalse();
        assertThat(store.get(job.id())).isEmpty();
        assertThatThrownBy(() -> synchronizer.executeNow(job.id())).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> synchronizer.delete(job.id())).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> synchronizer.get(job.id())).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> synchronizer.update(job.id(), JobPatch.enabled(true)))
            .isInstanceOf(JobNotFoundException.class)
            .hasMessage("Job " + job.id() + " does not exist");
        assertThatThrownBy(() -> synchronizer.recentRuns(job.id(), 5)).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void shouldRunManuallyRegardlessOfEnabledFlag() throws Exception {
        JobSynchronizer synchronizer = started();
        JobRecord job = synchronizer.create(new JobDraft("manual", "echo manual", "0 0 1 1 *", false));

        DispatchStatus status = synchronizer.executeNow(job.id());

        assertThat(status).isEqualTo(DispatchStatus.STARTED);
        awaitCondition(() -> !executed.isEmpty() && !synchronizer.get(job.id()).running());
        assertThat(executed).containsExactly("echo manual");
        assertThat(registry.isArmed(job.id())).isFalse();
        awaitCondition(() -> !synchronizer.recentRuns(job.id(), 5).isEmpty());
        ExecutionLogEntry entry = synchronizer.recentRuns(job.id(), 5).get(0);
        assertThat(entry.outcome()).isEqualTo(ExecutionOutcome.SUCCESS);
        assertThat(entry.stdout()).isEqualTo("ran echo manual");
    }

    @Test
    void shouldDisarmWhenFiredJobWasDeletedBehindItsBack() throws Exception {
        JobSynchronizer synchronizer = started();
        JobRecord job = synchronizer.create(new JobDraft("ghost", "echo ghost", "0 9 * * *", true));
        store.delete(job.id());

        synchronizer.fire(job.id(), Instant.parse("2026-01-01T09:00:00Z"));

        assertThat(registry.isArmed(job.id())).isFalse();
        Thread.sleep(100);
        assertThat(executed).isEmpty();
    }

    @Test
    void shouldDisarmWhenFiredJobWasDisabledBehindItsBack() throws Exception {
        JobSynchronizer synchronizer = started();
        JobRecord job = synchronizer.create(new JobDraft("quiet", "echo quiet", "0 9 * * *", true));
        store.update(job.id(), JobPatch.enabled(false));

        synchronizer.fire(job.id(), Instant.parse("2026-01-01T09:00:00Z"));

        assertThat(registry.isArmed(job.id())).isFalse();
        Thread.sleep(100);
        assertThat(executed).isEmpty();
    }

    @Test
    void shouldDispatchFireWithCurrentRecord() throws Exception {
        JobSynchronizer synchronizer = started();
        JobRecord job = synchronizer.create(new JobDraft("fresh", "echo old", "0 9 * * *", true));
        store.update(job.id(), new JobPatch(null, "echo new", null, null));

        synchronizer.fire(job.id(), Instant.parse("2026-01-01T09:00:00Z"));

        awaitCondition(() -> !executed.isEmpty());
        assertThat(executed).containsExactly("echo new");
    }

    @Test
    void shouldArmOnlyValidEnabledJobsAtStartup() throws Exception {
        JobSynchronizer synchronizer = synchronizer(Clock.fixed(NOW, ZoneOffset.UTC), new MutableClock(NOW));
        JobRecord valid = store.create(new JobDraft("valid", "true", "0 9 * * *", true));
        JobRecord broken = store.create(new JobDraft("broken", "true", "not a rule", true));
        JobRecord disabled = store.create(new JobDraft("disabled", "true", "0 9 * * *", false));
        JobRecord beforeStart = synchronizer.create(new JobDraft("early", "true", "0 10 * * *", true));
        assertThat(registry.isArmed(beforeStart.id())).isFalse();

        int armed = synchronizer.start();

        assertThat(armed).isEqualTo(2);
        assertThat(synchronizer.isStarted()).isTrue();
        assertThat(registry.armedJobIds()).containsExactly(valid.id(), beforeStart.id());
        assertThat(registry.isArmed(broken.id())).isFalse();
        assertThat(registry.isArmed(disabled.id())).isFalse();
    }

    @Test
    void shouldRefuseToEnableJobWithUnparsableStoredRule() throws Exception {
        JobSynchronizer synchronizer = started();
        JobRecord legacy = store.create(new JobDraft("legacy", "true", "not a rule", false));

        assertThatThrownBy(() -> synchronizer.enable(legacy.id())).isInstanceOf(JobValidationException.class);

        assertThat(store.get(legacy.id()).orElseThrow().enabled()).isFalse();
        assertThat(registry.isArmed(legacy.id())).isFalse();
    }

    @Test
    void shouldNotPersistEditsOfEnabledJobWithUnparsableStoredRule() throws Exception {
        JobSynchronizer synchronizer = started();
        JobRecord legacy = store.create(new JobDraft("legacy", "true", "not a rule", true));

        assertThatThrownBy(() -> synchronizer.update(legacy.id(), new JobPatch("renamed", null, null, null)))
            .isInstanceOf(JobValidationException.class);

        assertThat(store.get(legacy.id()).orElseThrow().name()).isEqualTo("legacy");
    }

    @Test
    void shouldRepairJobWithUnparsableStoredRule() throws Exception {
        JobSynchronizer synchronizer = started();
        JobRecord legacy = store.create(new JobDraft("legacy", "true", "not a rule", true));

        JobRecord disabled = synchronizer.disable(legacy.id());
        assertThat(disabled.enabled()).isFalse();
        assertThat(registry.isArmed(legacy.id())).isFalse();

        JobRecord repaired = synchronizer.update(legacy.id(), new JobPatch(null, null, "0 9 * * *", true));
        assertThat(repaired.recurrence()).isEqualTo("0 9 * * *");
        assertThat(registry.armedRule(legacy.id())).contains(CronExpression.parse("0 9 * * *"));
    }

    @Test
    void shouldRunCleanupJobAtFiveMinuteBoundary() throws Exception {
        Instant boundary = Instant.parse("2026-01-01T12:00:00Z");
        store = new SqliteJobStore(tempDir.resolve("cronhub.db"), new MutableClock(NOW));
        executionLog = new FileExecutionLog(tempDir.resolve("logs"), 50);
        registry = new ScheduleRegistry(Clock.fixed(boundary.minusMillis(200), ZoneOffset.UTC), ZoneOffset.UTC);
        ExecutionRunner runner = new ExecutionRunner(
            new ShellCommandExecutor("/bin/sh", tempDir, 4096),
            executionLog,
            store,
            Clock.fixed(boundary, ZoneOffset.UTC),
            1,
            Duration.ofSeconds(2)
        );
        synchronizer = new JobSynchronizer(store, registry, runner, executionLog);
        synchronizer.start();

        JobRecord job = synchronizer.create(new JobDraft("cleanup", "echo hi", "*/5 * * * *", true));
        assertThat(synchronizer.list()).singleElement().satisfies(view -> assertThat(view.armed()).isTrue());

        awaitCondition(() -> boundary.equals(store.get(job.id()).orElseThrow().lastRun()));
        Thread.sleep(200);
        List<ExecutionLogEntry> runs = synchronizer.recentRuns(job.id(), 10);
        assertThat(runs).hasSize(1);
        ExecutionLogEntry entry = runs.get(0);
        assertThat(entry.outcome()).isEqualTo(ExecutionOutcome.SUCCESS);
        assertThat(entry.firedAt()).isEqualTo(boundary);
        assertThat(entry.stdout()).contains("hi");
        assertThat(entry.stderr()).isEqualTo("none");
        assertThat(registry.nextFireAt(job.id())).contains(Instant.parse("2026-01-01T12:05:00Z"));
    }

    @FunctionalInterface
    private interface Check {
        boolean holds() throws Exception;
    }

    private static void awaitCondition(Check check) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!check.holds()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
