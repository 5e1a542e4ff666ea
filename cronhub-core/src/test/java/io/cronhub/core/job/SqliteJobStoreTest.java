package io.cronhub.core.job;

import static org.assertj.core.api.Assertions.assertThat;

import io.cronhub.core.MutableClock;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteJobStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteJobStore store;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new SqliteJobStore(tempDir.resolve("data/cronhub.db"), clock);
    }

    @Test
    void shouldCreateAndReadBackJob() throws Exception {
        JobRecord created = store.create(new JobDraft("cleanup", "rm -f /tmp/x", "*/5 * * * *", true));

        assertThat(created.id()).isPositive();
        assertThat(created.createdAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        assertThat(created.lastRun()).isNull();
        assertThat(store.get(created.id())).contains(created);
    }

    @Test
    void shouldPersistAcrossInstances() throws Exception {
        JobRecord created = store.create(new JobDraft("backup", "tar cf b.tar .", "0 3 * * *", false));

        SqliteJobStore reopened = new SqliteJobStore(tempDir.resolve("data/cronhub.db"), clock);

        assertThat(reopened.get(created.id())).contains(created);
    }

    @Test
    void shouldListNewestFirstAndEnabledById() throws Exception {
        JobRecord first = store.create(new JobDraft("first", "true", "* * * * *", true));
        clock.advance(Duration.ofMinutes(1));
        JobRecord second = store.create(new JobDraft("second", "true", "* * * * *", false));
        clock.advance(Duration.ofMinutes(1));
        JobRecord third = store.create(new JobDraft("third", "true", "* * * * *", true));

        assertThat(store.list()).extracting(JobRecord::id).containsExactly(third.id(), second.id(), first.id());
        assertThat(store.listEnabled()).extracting(JobRecord::id).containsExactly(first.id(), third.id());
    }

    @Test
    void shouldApplyOnlyPatchedFields() throws Exception {
        JobRecord created = store.create(new JobDraft("report", "echo hi", "0 9 * * *", true));

        JobRecord updated = store.update(created.id(), new JobPatch(null, "echo bye", null, false)).orElseThrow();

        assertThat(updated.name()).isEqualTo("report");
        assertThat(updated.command()).isEqualTo("echo bye");
        assertThat(updated.recurrence()).isEqualTo("0 9 * * *");
        assertThat(updated.enabled()).isFalse();
        assertThat(updated.createdAt()).isEqualTo(created.createdAt());
        assertThat(store.get(created.id())).contains(updated);
    }

    @Test
    void shouldReportMissingJobs() throws Exception {
        assertThat(store.get(42)).isEmpty();
        assertThat(store.update(42, JobPatch.enabled(false))).isEmpty();
        assertThat(store.delete(42)).isFalse();
        assertThat(store.setLastRun(42, Instant.now())).isFalse();
    }

    @Test
    void shouldDeleteJob() throws Exception {
        JobRecord created = store.create(new JobDraft("gone", "true", "* * * * *", true));

        assertThat(store.delete(created.id())).isTrue();
        assertThat(store.get(created.id())).isEmpty();
        assertThat(store.delete(created.id())).isFalse();
        assertThat(store.list()).isEmpty();
    }

    @Test
    void shouldOnlyMoveLastRunForward() throws Exception {
        JobRecord created = store.create(new JobDraft("tick", "true", "* * * * *", true));
        Instant later = Instant.parse("2026-01-01T00:10:00Z");
        Instant earlier = Instant.parse("2026-01-01T00:05:00Z");

        assertThat(store.setLastRun(created.id(), later)).isTrue();
        assertThat(store.setLastRun(created.id(), earlier)).isFalse();

        assertThat(store.get(created.id()).orElseThrow().lastRun()).isEqualTo(later);
    }

    @Test
    void shouldStoreCommandsVerbatim() throws Exception {
        String command = "echo \"it's $HOME\" | tr a-z A-Z; exit 0";

        JobRecord created = store.create(new JobDraft("quote", command, "* * * * *", true));

        List<JobRecord> jobs = store.list();
        assertThat(jobs).hasSize(1);
        assertThat(jobs.get(0).command()).isEqualTo(command);
        assertThat(store.get(created.id()).orElseThrow().command()).isEqualTo(command);
    }
}
