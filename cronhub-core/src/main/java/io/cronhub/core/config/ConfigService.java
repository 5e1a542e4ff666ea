package io.cronhub.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cronhub.core.config.model.CronhubConfig;
import io.cronhub.core.config.model.ExecutionConfig;
import io.cronhub.core.config.model.GatewayConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Reads the config file layered over {@link CronhubConfig#defaults()}, so missing keys keep their defaults.
     */
    public CronhubConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return CronhubConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(CronhubConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return validate(mapper.treeToValue(merged, CronhubConfig.class));
    }

    public void save(Path configPath, CronhubConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        CronhubConfig config;
        if (created || overwrite) {
            config = CronhubConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path databasePath = ConfigPaths.resolve(config.storage().databasePath());
        Path logDirectory = ConfigPaths.resolve(config.storage().logDirectory());
        Files.createDirectories(databasePath.toAbsolutePath().getParent());
        Files.createDirectories(logDirectory);
        return new OnboardResult(configPath, databasePath, logDirectory, created, overwritten);
    }

    public String toPrettyJson(CronhubConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private CronhubConfig validate(CronhubConfig config) {
        ExecutionConfig execution = config.execution();
        if (execution.workerThreads() <= 0) {
            throw new IllegalArgumentException("execution.workerThreads must be > 0");
        }
        if (execution.maxOutputChars() <= 0) {
            throw new IllegalArgumentException("execution.maxOutputChars must be > 0");
        }
        if (execution.maxLogsPerJob() <= 0) {
            throw new IllegalArgumentException("execution.maxLogsPerJob must be > 0");
        }
        if (execution.shutdownGraceSeconds() < 0) {
            throw new IllegalArgumentException("execution.shutdownGraceSeconds must be >= 0");
        }
        GatewayConfig gateway = config.gateway();
        if (gateway.port() < 0 || gateway.port() > 65_535) {
            throw new IllegalArgumentException("gateway.port must be between 0 and 65535");
        }
        try {
            config.scheduler().zone();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("scheduler.timezone is not a valid zone: " + config.scheduler().timezone(), e);
        }
        return config;
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
