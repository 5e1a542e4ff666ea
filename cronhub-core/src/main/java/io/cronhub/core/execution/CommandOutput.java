package io.cronhub.core.execution;

public record CommandOutput(int exitCode, String stdout, String stderr) {
    public CommandOutput {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }
}
