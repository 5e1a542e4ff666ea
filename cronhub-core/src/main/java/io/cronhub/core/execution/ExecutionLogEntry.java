package io.cronhub.core.execution;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionLogEntry(
    long jobId,
    Instant firedAt,
    Instant finishedAt,
    String command,
    ExecutionOutcome outcome,
    Integer exitCode,
    String stdout,
    String stderr
) {
    static final String NO_STDERR = "none";

    public static ExecutionLogEntry from(ExecutionResult result) {
        return new ExecutionLogEntry(
            result.jobId(),
            result.startedAt(),
            result.finishedAt(),
            result.command(),
            result.outcome(),
            result.exitCode(),
            result.stdout(),
            result.stderr().isBlank() ? NO_STDERR : result.stderr()
        );
    }
}
