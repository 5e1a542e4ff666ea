package io.cronhub.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionConfig(
    String shell,
    String workingDirectory,
    int workerThreads,
    int maxOutputChars,
    int maxLogsPerJob,
    int shutdownGraceSeconds
) {

    public static ExecutionConfig defaults() {
        return new ExecutionConfig("/bin/sh", "", 4, 65_536, 200, 30);
    }
}
