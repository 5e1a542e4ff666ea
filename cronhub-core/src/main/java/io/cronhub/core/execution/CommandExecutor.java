package io.cronhub.core.execution;

import java.io.IOException;

/**
 * Runs one command to completion. Implementations throw {@link IOException} when the process cannot be started.
 */
@FunctionalInterface
public interface CommandExecutor {
    CommandOutput execute(String command) throws IOException, InterruptedException;
}
