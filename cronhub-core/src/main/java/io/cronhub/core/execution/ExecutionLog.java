package io.cronhub.core.execution;

import java.io.IOException;
import java.util.List;

public interface ExecutionLog {
    void append(ExecutionResult result) throws IOException;

    /**
     * Newest first.
     */
    List<ExecutionLogEntry> recent(long jobId, int limit) throws IOException;
}
