package io.cronhub.core.execution;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one run. {@code exitCode} is {@code null} when the process never produced one.
 */
public record ExecutionResult(
    long jobId,
    String command,
    Instant startedAt,
    Instant finishedAt,
    ExecutionOutcome outcome,
    Integer exitCode,
    String stdout,
    String stderr
) {
    public ExecutionResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
