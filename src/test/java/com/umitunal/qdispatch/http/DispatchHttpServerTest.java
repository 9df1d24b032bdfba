package com.umitunal.qdispatch.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.qdispatch.config.EngineConfig;
import com.umitunal.qdispatch.config.StorageConfig;
import com.umitunal.qdispatch.coordinator.WorkerCoordinator;
import com.umitunal.qdispatch.core.Job;
import com.umitunal.qdispatch.core.JobState;
import com.umitunal.qdispatch.core.ExecutionRecord;
import com.umitunal.qdispatch.monitor.QueueMonitor;
import com.umitunal.qdispatch.serialization.JsonCodec;
import com.umitunal.qdispatch.storage.RocksJobQueue;
import com.umitunal.qdispatch.storage.RocksJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class DispatchHttpServerTest {

    @TempDir
    Path tempDir;

    private RocksJobStore<JsonNode> store;
    private RocksJobQueue<JsonNode> queue;
    private WorkerCoordinator<JsonNode> coordinator;
    private DispatchHttpServer<JsonNode> server;
    private HttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws Exception {
        EngineConfig config = EngineConfig.defaults();
        store = new RocksJobStore<>(StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build(), new JsonCodec<>(JsonNode.class));
        queue = new RocksJobQueue<>(store, config);
        coordinator = new WorkerCoordinator<>(queue, config.getLivenessWindow(), Clock.systemUTC());
        QueueMonitor monitor = new QueueMonitor(queue, store, coordinator, () -> true, Clock.systemUTC());

        server = new DispatchHttpServer<>(queue, monitor, JsonNode.class, 0);
        server.start();
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        server.close();
        store.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    @Test
    @DisplayName("Should accept a job and expose its state")
    void testSubmitAndDescribe() throws Exception {
        // Given
        HttpResponse<String> submitted = post("/jobs",
                "{\"payload\": {\"orderId\": 42}, \"maxAttempts\": 5, \"timeoutMs\": 1000}");
        assertThat(submitted.statusCode()).isEqualTo(202);
        String jobId = mapper.readTree(submitted.body()).get("jobId").asText();

        // When
        HttpResponse<String> described = get("/jobs/" + jobId);

        // Then
        assertThat(described.statusCode()).isEqualTo(200);
        JsonNode view = mapper.readTree(described.body());
        assertThat(view.get("id").asText()).isEqualTo(jobId);
        assertThat(view.get("state").asText()).isEqualTo("WAITING");
        assertThat(view.get("attempts").asInt()).isZero();
        assertThat(view.get("maxAttempts").asInt()).isEqualTo(5);

        Job<JsonNode> stored = queue.getJob(jobId).orElseThrow();
        assertThat(stored.getPayload().get("orderId").asInt()).isEqualTo(42);
        assertThat(stored.getTimeoutMillis()).isEqualTo(1000);
    }

    @Test
    @DisplayName("Should park a job submitted with a delay")
    void testSubmitDelayed() throws Exception {
        HttpResponse<String> submitted = post("/jobs", "{\"payload\": \"later\", \"delayMs\": 60000}");

        String jobId = mapper.readTree(submitted.body()).get("jobId").asText();
        assertThat(queue.getJob(jobId).orElseThrow().getState()).isEqualTo(JobState.DELAYED);
    }

    @Test
    @DisplayName("Should reject malformed submissions with 400")
    void testBadRequests() throws Exception {
        assertThat(post("/jobs", "{not json").statusCode()).isEqualTo(400);
        assertThat(post("/jobs", "{\"maxAttempts\": 2}").statusCode()).isEqualTo(400);
        assertThat(post("/jobs", "{\"payload\": 1, \"maxAttempts\": 0}").statusCode()).isEqualTo(400);
        assertThat(post("/jobs", "{\"payload\": 1, \"delayMs\": \"soon\"}").statusCode()).isEqualTo(400);

        HttpResponse<String> negative = post("/jobs", "{\"payload\": 1, \"timeoutMs\": -5}");
        assertThat(negative.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(negative.body()).has("error")).isTrue();
        assertThat(queue.getMetrics().getTotalJobs()).isZero();
    }

    @Test
    @DisplayName("Should reject numeric options that do not fit instead of truncating them")
    void testOutOfRangeOptions() throws Exception {
        HttpResponse<String> attempts = post("/jobs", "{\"payload\": 1, \"maxAttempts\": 4294967297}");
        HttpResponse<String> hugeDelay = post("/jobs", "{\"payload\": 1, \"delayMs\": 99999999999999999999}");
        HttpResponse<String> overflowingDelay = post("/jobs",
                "{\"payload\": 1, \"delayMs\": " + Long.MAX_VALUE + "}");

        assertThat(attempts.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(attempts.body()).get("error").asText()).contains("maxAttempts");
        assertThat(hugeDelay.statusCode()).isEqualTo(400);
        assertThat(overflowingDelay.statusCode()).isEqualTo(400);
        assertThat(queue.getMetrics().getTotalJobs()).isZero();
    }

    @Test
    @DisplayName("Should answer 404 for unknown jobs and 405 for wrong methods")
    void testNotFoundAndMethod() throws Exception {
        assertThat(get("/jobs/missing").statusCode()).isEqualTo(404);
        assertThat(get("/jobs/missing/records").statusCode()).isEqualTo(404);
        assertThat(get("/jobs").statusCode()).isEqualTo(405);
        assertThat(post("/monitor", "{}").statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Should list execution records of a job")
    void testRecords() throws Exception {
        // Given
        coordinator.register("worker-1");
        String jobId = mapper.readTree(post("/jobs", "{\"payload\": \"x\"}").body()).get("jobId").asText();
        coordinator.claim("worker-1", 30_000);
        queue.nack(jobId, "worker-1", "boom", ExecutionRecord.Outcome.FAILURE);

        // When
        HttpResponse<String> response = get("/jobs/" + jobId + "/records");

        // Then
        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode records = mapper.readTree(response.body());
        assertThat(records.size()).isEqualTo(1);
        assertThat(records.get(0).get("attempt").asInt()).isEqualTo(1);
        assertThat(records.get(0).get("workerId").asText()).isEqualTo("worker-1");
        assertThat(records.get(0).get("outcome").asText()).isEqualTo("FAILURE");
        assertThat(records.get(0).get("resultOrError").asText()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Should refuse submissions with 503 while draining")
    void testDraining() throws Exception {
        // Given
        assertThat(get("/health/ready").statusCode()).isEqualTo(200);

        // When
        queue.drain();

        // Then
        HttpResponse<String> ready = get("/health/ready");
        assertThat(ready.statusCode()).isEqualTo(503);
        assertThat(mapper.readTree(ready.body()).get("status").asText()).isEqualTo("DRAINING");
        assertThat(post("/jobs", "{\"payload\": 1}").statusCode()).isEqualTo(503);
    }

    @Test
    @DisplayName("Should serve liveness and the monitor report")
    void testLiveAndMonitor() throws Exception {
        // Given
        coordinator.register("worker-1");
        post("/jobs", "{\"payload\": 1}");

        // When
        HttpResponse<String> live = get("/health/live");
        HttpResponse<String> report = get("/monitor");

        // Then
        assertThat(live.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(live.body()).get("queue").asBoolean()).isTrue();
        assertThat(report.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(report.body());
        assertThat(body.get("depth").get("WAITING").asLong()).isEqualTo(1);
        assertThat(body.get("liveWorkers").asLong()).isEqualTo(1);
        assertThat(body.get("readiness").asText()).isEqualTo("ACCEPTING");
    }
}
