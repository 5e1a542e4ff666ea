package io.cronhub.core.job;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteJobStore implements JobStore {
    private static final String COLUMNS = "id, name, command, schedule, enabled, created_at, last_run";

    private final String jdbcUrl;
    private final Clock clock;

    public SqliteJobStore(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.clock = clock;
        init();
    }

    @Override
    public synchronized JobRecord create(JobDraft draft) throws IOException {
        String sql = """
            INSERT INTO cron_jobs (name, command, schedule, enabled, created_at)
            VALUES (?, ?, ?, ?, ?)
            """;
        Instant createdAt = clock.instant();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            statement.setString(1, draft.name());
            statement.setString(2, draft.command());
            statement.setString(3, draft.recurrence());
            statement.setInt(4, draft.enabled() ? 1 : 0);
            statement.setLong(5, createdAt.toEpochMilli());
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new IOException("No id generated for job " + draft.name());
                }
                return new JobRecord(
                    keys.getLong(1),
                    draft.name(),
                    draft.command(),
                    draft.recurrence(),
                    draft.enabled(),
                    Instant.ofEpochMilli(createdAt.toEpochMilli()),
                    null
                );
            }
        } catch (SQLException e) {
            throw new IOException("Failed to create job " + draft.name(), e);
        }
    }

    @Override
    public synchronized Optional<JobRecord> get(long id) throws IOException {
        try (Connection connection = openConnection()) {
            return find(connection, id);
        } catch (SQLException e) {
            throw new IOException("Failed to load job " + id, e);
        }
    }

    @Override
    public synchronized List<JobRecord> list() throws IOException {
        return query("SELECT " + COLUMNS + " FROM cron_jobs ORDER BY created_at DESC, id DESC", "list jobs");
    }

    @Override
    public synchronized List<JobRecord> listEnabled() throws IOException {
        return query("SELECT " + COLUMNS + " FROM cron_jobs WHERE enabled = 1 ORDER BY id ASC", "list enabled jobs");
    }

    @Override
    public synchronized Optional<JobRecord> update(long id, JobPatch patch) throws IOException {
        List<String> assignments = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (patch.name() != null) {
            assignments.add("name = ?");
            params.add(patch.name());
        }
        if (patch.command() != null) {
            assignments.add("command = ?");
            params.add(patch.command());
        }
        if (patch.recurrence() != null) {
            assignments.add("schedule = ?");
            params.add(patch.recurrence());
        }
        if (patch.enabled() != null) {
            assignments.add("enabled = ?");
            params.add(patch.enabled() ? 1 : 0);
        }

        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                if (!assignments.isEmpty()) {
                    String sql = "UPDATE cron_jobs SET " + String.join(", ", assignments) + " WHERE id = ?";
                    try (PreparedStatement statement = connection.prepareStatement(sql)) {
                        int index = 1;
                        for (Object param : params) {
                            statement.setObject(index++, param);
                        }
                        statement.setLong(index, id);
                        statement.executeUpdate();
                    }
                }
                Optional<JobRecord> updated = find(connection, id);
                connection.commit();
                return updated;
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update job " + id, e);
        }
    }

    @Override
    public synchronized boolean delete(long id) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM cron_jobs WHERE id = ?")) {
            statement.setLong(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete job " + id, e);
        }
    }

    @Override
    public synchronized boolean setLastRun(long id, Instant completedAt) throws IOException {
        String sql = """
            UPDATE cron_jobs SET last_run = ?
            WHERE id = ? AND (last_run IS NULL OR last_run <= ?)
            """;
        long millis = completedAt.toEpochMilli();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, millis);
            statement.setLong(2, id);
            statement.setLong(3, millis);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to record last run of job " + id, e);
        }
    }

    private Optional<JobRecord> find(Connection connection, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT " + COLUMNS + " FROM cron_jobs WHERE id = ?")) {
            statement.setLong(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(map(resultSet)) : Optional.empty();
            }
        }
    }

    private List<JobRecord> query(String sql, String action) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<JobRecord> jobs = new ArrayList<>();
            while (resultSet.next()) {
                jobs.add(map(resultSet));
            }
            return jobs;
        } catch (SQLException e) {
            throw new IOException("Failed to " + action, e);
        }
    }

    private JobRecord map(ResultSet resultSet) throws SQLException {
        long lastRun = resultSet.getLong("last_run");
        boolean neverRun = resultSet.wasNull();
        return new JobRecord(
            resultSet.getLong("id"),
            resultSet.getString("name"),
            resultSet.getString("command"),
            resultSet.getString("schedule"),
            resultSet.getInt("enabled") != 0,
            Instant.ofEpochMilli(resultSet.getLong("created_at")),
            neverRun ? null : Instant.ofEpochMilli(lastRun)
        );
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS cron_jobs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL,
                command TEXT NOT NULL,
                schedule TEXT NOT NULL,
                enabled INTEGER NOT NULL DEFAULT 1,
                created_at INTEGER NOT NULL,
                last_run INTEGER
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_cron_jobs_enabled
            ON cron_jobs(enabled)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite job store", e);
        }
    }
}
