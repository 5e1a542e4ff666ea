package io.cronhub.cli;

@FunctionalInterface
public interface ServeRunner {
    /**
     * Blocks until shutdown. {@code null} arguments fall back to the configured values.
     */
    int run(Integer portOverride, String hostOverride) throws Exception;
}
