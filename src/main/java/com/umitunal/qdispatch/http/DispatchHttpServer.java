package com.umitunal.qdispatch.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.qdispatch.core.EnqueueOptions;
import com.umitunal.qdispatch.core.Job;
import com.umitunal.qdispatch.core.JobQueue;
import com.umitunal.qdispatch.exception.QueueDrainingException;
import com.umitunal.qdispatch.exception.QueueException;
import com.umitunal.qdispatch.monitor.HealthStatus;
import com.umitunal.qdispatch.monitor.QueueMonitor;
import com.umitunal.qdispatch.serialization.JsonCodec;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * JSON-over-HTTP surface for submitters and operators.
 *
 * <pre>
 * POST /jobs               {payload, maxAttempts?, delayMs?, timeoutMs?} -> 202 {jobId}
 * GET  /jobs/{id}          -> {id, state, attempts, maxAttempts, lastError}
 * GET  /jobs/{id}/records  -> execution records in attempt order
 * GET  /health/live        -> 200 or 503 {coordinator, queue}
 * GET  /health/ready       -> 200 ACCEPTING or 503 DRAINING
 * GET  /monitor            -> monitor report
 * </pre>
 *
 * @param <T> the type of job payload; request payloads are converted to it with Jackson
 */
public class DispatchHttpServer<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DispatchHttpServer.class);

    static final int RECENT_EXECUTIONS = 50;
    private static final String JOBS_PREFIX = "/jobs/";
    private static final String RECORDS_SUFFIX = "/records";

    private final JobQueue<T> queue;
    private final QueueMonitor monitor;
    private final Class<T> payloadType;
    private final ObjectMapper mapper;
    private final int port;
    private HttpServer server;
    private ExecutorService executor;

    public DispatchHttpServer(JobQueue<T> queue, QueueMonitor monitor, Class<T> payloadType, int port) {
        this.queue = queue;
        this.monitor = monitor;
        this.payloadType = payloadType;
        this.mapper = JsonCodec.createDefaultMapper();
        this.port = port;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/jobs", this::handleJobs);
        server.createContext("/health/live", this::handleLive);
        server.createContext("/health/ready", this::handleReady);
        server.createContext("/monitor", this::handleMonitor);

        executor = Executors.newFixedThreadPool(4);
        server.setExecutor(executor);
        server.start();
        log.info("HTTP server listening on port {}", getPort());
    }

    /**
     * The bound port, which differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(1);
            executor.shutdownNow();
            server = null;
            log.info("HTTP server stopped");
        }
    }

    private void handleJobs(HttpExchange exchange) throws IOException {
        try {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            if (path.equals("/jobs") || path.equals(JOBS_PREFIX)) {
                if (!"POST".equalsIgnoreCase(method)) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }
                submit(exchange);
                return;
            }

            if (!path.startsWith(JOBS_PREFIX)) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            if (!"GET".equalsIgnoreCase(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            String rest = path.substring(JOBS_PREFIX.length());
            if (rest.endsWith(RECORDS_SUFFIX)) {
                String jobId = rest.substring(0, rest.length() - RECORDS_SUFFIX.length());
                if (queue.getJob(jobId).isEmpty()) {
                    sendError(exchange, 404, "Job not found: " + jobId);
                    return;
                }
                sendJson(exchange, 200, monitor.records(jobId));
            } else if (!rest.isEmpty() && rest.indexOf('/') < 0) {
                describe(exchange, rest);
            } else {
                sendError(exchange, 404, "Not Found");
            }
        } catch (QueueException e) {
            log.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            sendError(exchange, 500, "Internal Server Error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error handling {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            sendError(exchange, 500, "Internal Server Error");
        }
    }

    private void submit(HttpExchange exchange) throws IOException, QueueException {
        JsonNode body;
        try (InputStream in = exchange.getRequestBody()) {
            body = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "Malformed JSON: " + e.getOriginalMessage());
            return;
        }
        if (body == null || !body.isObject() || !body.has("payload")) {
            sendError(exchange, 400, "Body must be an object with a payload field");
            return;
        }

        T payload;
        EnqueueOptions options;
        try {
            payload = mapper.treeToValue(body.get("payload"), payloadType);
            options = readOptions(body);
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "Invalid payload: " + e.getOriginalMessage());
            return;
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage());
            return;
        }

        try {
            String jobId = queue.enqueue(payload, options);
            sendJson(exchange, 202, Map.of("jobId", jobId));
        } catch (QueueDrainingException e) {
            sendError(exchange, 503, e.getMessage());
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage());
        }
    }

    private static EnqueueOptions readOptions(JsonNode body) {
        EnqueueOptions.Builder options = EnqueueOptions.newBuilder();
        if (body.hasNonNull("maxAttempts")) {
            JsonNode value = requireInteger(body, "maxAttempts");
            if (!value.canConvertToInt()) {
                throw new IllegalArgumentException("maxAttempts is out of range: " + value.asText());
            }
            options.withMaxAttempts(value.intValue());
        }
        if (body.hasNonNull("delayMs")) {
            options.withDelay(requireLong(body, "delayMs"));
        }
        if (body.hasNonNull("timeoutMs")) {
            options.withTimeout(requireLong(body, "timeoutMs"));
        }
        return options.build();
    }

    private static JsonNode requireInteger(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (!value.isIntegralNumber()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return value;
    }

    private static long requireLong(JsonNode body, String field) {
        JsonNode value = requireInteger(body, field);
        if (!value.canConvertToLong()) {
            throw new IllegalArgumentException(field + " is out of range: " + value.asText());
        }
        return value.longValue();
    }

    private void describe(HttpExchange exchange, String jobId) throws IOException, QueueException {
        Optional<Job<T>> found = queue.getJob(jobId);
        if (found.isEmpty()) {
            sendError(exchange, 404, "Job not found: " + jobId);
            return;
        }
        Job<T> job = found.get();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", job.getId());
        view.put("state", job.getState());
        view.put("attempts", job.getAttempts());
        view.put("maxAttempts", job.getMaxAttempts());
        view.put("lastError", job.getLastError());
        sendJson(exchange, 200, view);
    }

    private void handleLive(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method Not Allowed");
            return;
        }
        HealthStatus health = monitor.liveness();
        sendJson(exchange, health.isLive() ? 200 : 503,
                Map.of("coordinator", health.coordinator(), "queue", health.queue()));
    }

    private void handleReady(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method Not Allowed");
            return;
        }
        HealthStatus.Readiness readiness = monitor.readiness();
        sendJson(exchange, readiness == HealthStatus.Readiness.ACCEPTING ? 200 : 503,
                Map.of("status", readiness));
    }

    private void handleMonitor(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method Not Allowed");
            return;
        }
        try {
            sendJson(exchange, 200, monitor.report(RECENT_EXECUTIONS));
        } catch (QueueException e) {
            log.error("Failed to build monitor report", e);
            sendError(exchange, 500, "Internal Server Error: " + e.getMessage());
        }
    }

    private void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] response = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("error", message);
        sendJson(exchange, status, error);
    }
}
