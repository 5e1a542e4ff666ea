package io.cronhub.core.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One JSON file per run, named {@code <jobId>-<firedAtMillis>.json}. Records are written to a temp file
 * and moved into place so a crash never leaves a partial record behind.
 */
public final class FileExecutionLog implements ExecutionLog {
    private static final Logger LOG = LoggerFactory.getLogger(FileExecutionLog.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final int maxEntriesPerJob;
    private final ObjectMapper mapper;

    public FileExecutionLog(Path directory, int maxEntriesPerJob) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        if (maxEntriesPerJob <= 0) {
            throw new IllegalArgumentException("maxEntriesPerJob must be > 0");
        }
        this.directory = directory;
        this.maxEntriesPerJob = maxEntriesPerJob;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void append(ExecutionResult result) throws IOException {
        Files.createDirectories(directory);
        ExecutionLogEntry entry = ExecutionLogEntry.from(result);
        Path target = uniqueTarget(result.jobId(), result.startedAt().toEpochMilli());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(entry);
        try {
            Files.writeString(tmp, json + System.lineSeparator());
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        prune(result.jobId());
    }

    @Override
    public synchronized List<ExecutionLogEntry> recent(long jobId, int limit) throws IOException {
        int safe = Math.max(1, limit);
        List<ExecutionLogEntry> entries = new ArrayList<>();
        for (LogFile file : files(jobId)) {
            if (entries.size() >= safe) {
                break;
            }
            try {
                entries.add(mapper.readValue(file.path().toFile(), ExecutionLogEntry.class));
            } catch (IOException e) {
                LOG.warn("Skipping unreadable execution log {}: {}", file.path(), e.getMessage());
            }
        }
        return entries;
    }

    private Path uniqueTarget(long jobId, long firedAtMillis) {
        Path target = directory.resolve(jobId + "-" + firedAtMillis + SUFFIX);
        int attempt = 1;
        while (Files.exists(target)) {
            target = directory.resolve(jobId + "-" + firedAtMillis + "-" + attempt++ + SUFFIX);
        }
        return target;
    }

    private void prune(long jobId) throws IOException {
        List<LogFile> files = files(jobId);
        for (LogFile stale : files.subList(Math.min(files.size(), maxEntriesPerJob), files.size())) {
            Files.deleteIfExists(stale.path());
        }
    }

    /**
     * Log files of one job, newest first.
     */
    private List<LogFile> files(long jobId) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        String prefix = jobId + "-";
        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                .map(path -> LogFile.parse(path, prefix))
                .filter(file -> file != null)
                .sorted(Comparator.comparingLong(LogFile::firedAtMillis)
                    .thenComparingInt(LogFile::sequence)
                    .reversed())
                .toList();
        }
    }

    private record LogFile(Path path, long firedAtMillis, int sequence) {
        static LogFile parse(Path path, String prefix) {
            String name = path.getFileName().toString();
            if (!name.startsWith(prefix) || !name.endsWith(SUFFIX)) {
                return null;
            }
            String[] parts = name.substring(prefix.length(), name.length() - SUFFIX.length()).split("-");
            try {
                long firedAt = Long.parseLong(parts[0]);
                int sequence = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
                return parts.length > 2 ? null : new LogFile(path, firedAt, sequence);
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
