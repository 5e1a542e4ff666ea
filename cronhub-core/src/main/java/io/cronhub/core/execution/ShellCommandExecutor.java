package io.cronhub.core.execution;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Runs commands through {@code <shell> -c}, capturing stdout and stderr separately.
 * No timeout is applied; an interrupted caller kills the process.
 */
public final class ShellCommandExecutor implements CommandExecutor {
    private static final String TRUNCATED = "\n[truncated]";

    private final String shell;
    private final Path workingDirectory;
    private final int maxOutputChars;

    public ShellCommandExecutor(String shell, Path workingDirectory, int maxOutputChars) {
        if (shell == null || shell.isBlank()) {
            throw new IllegalArgumentException("shell must not be blank");
        }
        if (maxOutputChars <= 0) {
            throw new IllegalArgumentException("maxOutputChars must be > 0");
        }
        this.shell = shell;
        this.workingDirectory = workingDirectory;
        this.maxOutputChars = maxOutputChars;
    }

    @Override
    public CommandOutput execute(String command) throws IOException, InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(shell, "-c", command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        Process process = builder.start();
        process.getOutputStream().close();

        StreamCollector stdout = new StreamCollector(process.getInputStream(), maxOutputChars, "stdout");
        StreamCollector stderr = new StreamCollector(process.getErrorStream(), maxOutputChars, "stderr");
        stdout.start();
        stderr.start();
        try {
            int exitCode = process.waitFor();
            return new CommandOutput(exitCode, stdout.await(), stderr.await());
        } catch (InterruptedException e) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            throw e;
        }
    }

    private static final class StreamCollector extends Thread {
        private final InputStream stream;
        private final int limit;
        private final StringBuilder text = new StringBuilder();
        private boolean truncated;
        private IOException failure;

        StreamCollector(InputStream stream, int limit, String name) {
            super("cronhub-" + name + "-reader");
            setDaemon(true);
            this.stream = stream;
            this.limit = limit;
        }

        @Override
        public void run() {
            char[] buffer = new char[4096];
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                int read;
                while ((read = reader.read(buffer)) != -1) {
                    int room = limit - text.length();
                    if (room >= read) {
                        text.append(buffer, 0, read);
                    } else {
                        if (room > 0) {
                            text.append(buffer, 0, room);
                        }
                        truncated = true;
                    }
                }
            } catch (IOException e) {
                failure = e;
            }
        }

        String await() throws InterruptedException, IOException {
            join();
            if (failure != null) {
                throw new IOException("Failed to read " + getName(), failure);
            }
            return truncated ? text + TRUNCATED : text.toString();
        }
    }
}
