package io.cronhub.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileExecutionLogTest {

    @TempDir
    Path tempDir;

    private static ExecutionResult result(long jobId, String firedAt, ExecutionOutcome outcome, String stdout, String stderr) {
        Instant started = Instant.parse(firedAt);
        return new ExecutionResult(jobId, "echo hi", started, started.plusMillis(25), outcome,
            outcome == ExecutionOutcome.SUCCESS ? 0 : 1, stdout, stderr);
    }

    @Test
    void shouldWriteOneFilePerRun() throws Exception {
        Path dir = tempDir.resolve("logs/cron");
        FileExecutionLog log = new FileExecutionLog(dir, 10);

        log.append(result(7, "2026-01-01T12:00:00Z", ExecutionOutcome.SUCCESS, "hi\n", ""));

        Path expected = dir.resolve("7-" + Instant.parse("2026-01-01T12:00:00Z").toEpochMilli() + ".json");
        assertThat(expected).exists();
        String json = Files.readString(expected);
        assertThat(json).contains("\"outcome\" : \"success\"");
        assertThat(json).contains("\"firedAt\" : \"2026-01-01T12:00:00Z\"");
        assertThat(json).contains("\"stderr\" : \"none\"");
    }

    @Test
    void shouldLeaveNoPartialFileWhenWriteIsInterrupted() throws Exception {
        Path dir = tempDir.resolve("logs");
        FileExecutionLog log = new FileExecutionLog(dir, 10);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> log.append(result(3, "2026-01-01T12:00:00Z", ExecutionOutcome.SUCCESS, "hi", "")))
                .isInstanceOf(IOException.class);
        } finally {
            Thread.interrupted();
        }

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).isEmpty();
        }
        log.append(result(3, "2026-01-01T12:00:00Z", ExecutionOutcome.SUCCESS, "hi", ""));
        assertThat(log.recent(3, 10)).hasSize(1);
    }

    @Test
    void shouldReturnRecentEntriesNewestFirst() throws Exception {
        FileExecutionLog log = new FileExecutionLog(tempDir, 10);
        log.append(result(1, "2026-01-01T12:00:00Z", ExecutionOutcome.SUCCESS, "a", ""));
        log.append(result(1, "2026-01-01T12:05:00Z", ExecutionOutcome.FAILURE, "b", "boom"));
        log.append(result(1, "2026-01-01T12:10:00Z", ExecutionOutcome.SUCCESS, "c", ""));
        log.append(result(2, "2026-01-01T12:15:00Z", ExecutionOutcome.SUCCESS, "other", ""));

        List<ExecutionLogEntry> recent = log.recent(1, 2);

        assertThat(recent).extracting(ExecutionLogEntry::stdout).containsExactly("c", "b");
        assertThat(recent.get(1).outcome()).isEqualTo(ExecutionOutcome.FAILURE);
        assertThat(recent.get(1).stderr()).isEqualTo("boom");
        assertThat(log.recent(2, 10)).hasSize(1);
        assertThat(log.recent(3, 10)).isEmpty();
    }

    @Test
    void shouldKeepRunsFiredInTheSameMillisecond() throws Exception {
        FileExecutionLog log = new FileExecutionLog(tempDir, 10);
        log.append(result(1, "2026-01-01T12:00:00Z", ExecutionOutcome.SUCCESS, "first", ""));
        log.append(result(1, "2026-01-01T12:00:00Z", ExecutionOutcome.SUCCESS, "second", ""));

        assertThat(log.recent(1, 10)).extracting(ExecutionLogEntry::stdout).containsExactly("second", "first");
    }

    @Test
    void shouldPruneOldestEntriesBeyondRetention() throws Exception {
        FileExecutionLog log = new FileExecutionLog(tempDir, 2);
        log.append(result(1, "2026-01-01T12:00:00Z", ExecutionOutcome.SUCCESS, "a", ""));
        log.append(result(1, "2026-01-01T12:01:00Z", ExecutionOutcome.SUCCESS, "b", ""));
        log.append(result(1, "2026-01-01T12:02:00Z", ExecutionOutcome.SUCCESS, "c", ""));

        assertThat(log.recent(1, 10)).extracting(ExecutionLogEntry::stdout).containsExactly("c", "b");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.count()).isEqualTo(2);
        }
    }

    @Test
    void shouldSkipUnreadableFiles() throws Exception {
        FileExecutionLog log = new FileExecutionLog(tempDir, 10);
        log.append(result(1, "2026-01-01T12:00:00Z", ExecutionOutcome.SUCCESS, "ok", ""));
        Files.writeString(tempDir.resolve("1-" + Instant.parse("2026-01-01T13:00:00Z").toEpochMilli() + ".json"), "{not json");
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        assertThat(log.recent(1, 10)).extracting(ExecutionLogEntry::stdout).containsExactly("ok");
    }
}
