package io.cronhub.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cronhub.core.execution.ExecutionLogEntry;
import io.cronhub.core.execution.ExecutionRunner.DispatchStatus;
import io.cronhub.core.job.JobDraft;
import io.cronhub.core.job.JobNotFoundException;
import io.cronhub.core.job.JobPatch;
import io.cronhub.core.job.JobRecord;
import io.cronhub.core.job.JobValidationException;
import io.cronhub.core.sync.JobSynchronizer;
import io.cronhub.core.sync.JobView;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON over HTTP for the job catalog:
 * <ul>
 *   <li>{@code GET /healthz}</li>
 *   <li>{@code GET|POST /jobs}</li>
 *   <li>{@code GET|PUT|PATCH|DELETE /jobs/{id}}</li>
 *   <li>{@code POST /jobs/{id}/execute}</li>
 *   <li>{@code GET /jobs/{id}/runs?limit=n}</li>
 * </ul>
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final int DEFAULT_RUNS_LIMIT = 20;

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final JobSynchronizer synchronizer;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(int port, String host, JobSynchronizer synchronizer) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addPrefixPath("/jobs", this::handleJobs);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on http://{}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleHealth(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendError(exchange, 405, "method_not_allowed", "use GET");
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok", "scheduler_started", synchronizer.isStarted()));
    }

    private void handleJobs(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleJobs(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        String method = exchange.getRequestMethod().toString().toUpperCase(Locale.ROOT);
        List<String> segments = segments(exchange.getRelativePath());
        try {
            if (segments.isEmpty()) {
                handleCollection(exchange, method);
                return;
            }
            long id = parseId(segments.get(0));
            if (segments.size() == 1) {
                handleJob(exchange, method, id);
            } else if (segments.size() == 2 && "execute".equals(segments.get(1))) {
                handleExecute(exchange, method, id);
            } else if (segments.size() == 2 && "runs".equals(segments.get(1))) {
                handleRuns(exchange, method, id);
            } else {
                sendError(exchange, 404, "not_found", "no route for " + exchange.getRequestPath());
            }
        } catch (JobValidationException e) {
            sendError(exchange, 400, "validation_failed", e.getMessage());
        } catch (JobNotFoundException e) {
            sendError(exchange, 404, "not_found", e.getMessage());
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "invalid_json", e.getOriginalMessage());
        } catch (IOException e) {
            LOG.warn("Storage failure while handling {} {}", method, exchange.getRequestPath(), e);
            sendError(exchange, 500, "storage_unavailable", e.getMessage());
        }
    }

    private void handleCollection(HttpServerExchange exchange, String method) throws IOException {
        switch (method) {
            case "GET" -> {
                List<Map<String, Object>> jobs = new ArrayList<>();
                for (JobView view : synchronizer.list()) {
                    jobs.add(toJobResponse(view));
                }
                sendJson(exchange, 200, Map.of("jobs", jobs));
            }
            case "POST" -> {
                JsonNode body = readJsonBody(exchange);
                JobDraft draft = new JobDraft(
                    readString(body, "name"),
                    readString(body, "command"),
                    readSchedule(body),
                    readBoolean(body, "enabled", true)
                );
                JobRecord created = synchronizer.create(draft);
                sendJson(exchange, 201, Map.of("job", toJobResponse(synchronizer.get(created.id()))));
            }
            default -> sendError(exchange, 405, "method_not_allowed", "use GET or POST");
        }
    }

    private void handleJob(HttpServerExchange exchange, String method, long id) throws IOException {
        switch (method) {
            case "GET" -> sendJson(exchange, 200, Map.of("job", toJobResponse(synchronizer.get(id))));
            case "PUT", "PATCH" -> {
                JsonNode body = readJsonBody(exchange);
                JobPatch patch = new JobPatch(
                    readString(body, "name"),
                    readString(body, "command"),
                    readSchedule(body),
                    body.has("enabled") ? readBoolean(body, "enabled", null) : null
                );
                JobRecord updated = synchronizer.update(id, patch);
                sendJson(exchange, 200, Map.of("job", toJobResponse(synchronizer.get(updated.id()))));
            }
            case "DELETE" -> {
                synchronizer.delete(id);
                sendJson(exchange, 200, Map.of("deleted", id));
            }
            default -> sendError(exchange, 405, "method_not_allowed", "use GET, PUT, PATCH or DELETE");
        }
    }

    private void handleExecute(HttpServerExchange exchange, String method, long id) throws IOException {
        if (!"POST".equals(method)) {
            sendError(exchange, 405, "method_not_allowed", "use POST");
            return;
        }
        DispatchStatus status = synchronizer.executeNow(id);
        sendJson(exchange, 202, Map.of("id", id, "dispatch", status.name().toLowerCase(Locale.ROOT)));
    }

    private void handleRuns(HttpServerExchange exchange, String method, long id) throws IOException {
        if (!"GET".equals(method)) {
            sendError(exchange, 405, "method_not_allowed", "use GET");
            return;
        }
        int limit = parseQueryInt(exchange, "limit", DEFAULT_RUNS_LIMIT, 1, 500);
        List<ExecutionLogEntry> runs = synchronizer.recentRuns(id, limit);
        sendJson(exchange, 200, Map.of("runs", runs));
    }

    private Map<String, Object> toJobResponse(JobView view) {
        JobRecord job = view.job();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", job.id());
        payload.put("name", job.name());
        payload.put("command", job.command());
        payload.put("schedule", job.recurrence());
        payload.put("enabled", job.enabled());
        payload.put("created_at", job.createdAt());
        payload.put("last_run", job.lastRun());
        payload.put("armed", view.armed());
        payload.put("running", view.running());
        payload.put("next_fire_at", view.nextFireAt());
        return payload;
    }

    private List<String> segments(String relativePath) {
        List<String> segments = new ArrayList<>();
        for (String part : relativePath.split("/")) {
            if (!part.isBlank()) {
                segments.add(part);
            }
        }
        return segments;
    }

    private long parseId(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new JobValidationException("job id must be numeric: " + raw);
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendError(HttpServerExchange exchange, int status, String code, String message) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", code);
        payload.put("message", message == null ? code : message);
        sendJson(exchange, status, payload);
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.error("Unhandled gateway error on {}", exchange.getRequestPath(), error);
        try {
            sendError(exchange, 500, "internal_error", error.getMessage());
        } catch (IOException e) {
            LOG.debug("Could not send error response: {}", e.getMessage());
        }
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        JsonNode body = mapper.readTree(bytes);
        if (body == null || !body.isObject()) {
            throw new JobValidationException("request body must be a JSON object");
        }
        return body;
    }

    private String readString(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new JobValidationException(field + " must be a string");
        }
        return node.asText();
    }

    private String readSchedule(JsonNode body) {
        String schedule = readString(body, "schedule");
        return schedule != null ? schedule : readString(body, "recurrence");
    }

    /**
     * Accepts JSON booleans and the 0/1 integers older clients send.
     */
    private Boolean readBoolean(JsonNode body, String field, Boolean fallback) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isInt() || node.isLong()) {
            long value = node.longValue();
            if (value == 0 || value == 1) {
                return value == 1;
            }
        }
        if (node.isTextual()) {
            String text = node.asText().trim().toLowerCase(Locale.ROOT);
            if ("true".equals(text) || "1".equals(text)) {
                return true;
            }
            if ("false".equals(text) || "0".equals(text)) {
                return false;
            }
        }
        throw new JobValidationException(field + " must be a boolean");
    }

    private int parseQueryInt(HttpServerExchange exchange, String key, int fallback, int min, int max) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(values.peekFirst().trim());
            return Math.max(min, Math.min(max, parsed));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
