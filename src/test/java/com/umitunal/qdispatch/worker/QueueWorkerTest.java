package com.umitunal.qdispatch.worker;

import com.umitunal.qdispatch.config.EngineConfig;
import com.umitunal.qdispatch.config.StorageConfig;
import com.umitunal.qdispatch.coordinator.WorkerCoordinator;
import com.umitunal.qdispatch.coordinator.WorkerStatus;
import com.umitunal.qdispatch.core.EnqueueOptions;
import com.umitunal.qdispatch.core.ExecutionRecord;
import com.umitunal.qdispatch.core.JobState;
import com.umitunal.qdispatch.serialization.StringCodec;
import com.umitunal.qdispatch.storage.RocksJobQueue;
import com.umitunal.qdispatch.storage.RocksJobStore;
import com.umitunal.qdispatch.supervisor.ExecutionSupervisor;
import com.umitunal.qdispatch.supervisor.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class QueueWorkerTest {

    @TempDir
    Path tempDir;

    private RocksJobStore<String> store;
    private RocksJobQueue<String> queue;
    private WorkerCoordinator<String> coordinator;
    private ExecutionSupervisor<String> supervisor;
    private QueueWorker<String> worker;

    @BeforeEach
    void setUp() throws Exception {
        EngineConfig config = EngineConfig.newBuilder().withDefaultMaxAttempts(3).build();
        store = new RocksJobStore<>(StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build(), new StringCodec());
        queue = new RocksJobQueue<>(store, config, RetryPolicy.withoutJitter(50, 200), Clock.systemUTC());
        coordinator = new WorkerCoordinator<>(queue, config.getLivenessWindow(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop(5_000);
        }
        if (supervisor != null) {
            supervisor.close();
        }
        store.close();
    }

    private void newWorker(JobHandler<String> handler, long jobTimeout) {
        supervisor = new ExecutionSupervisor<>(handler, jobTimeout, 200, Clock.systemUTC());
        worker = QueueWorker.builder("worker-1", queue, coordinator, supervisor)
                .withLeaseDuration(30_000)
                .withPollInterval(20)
                .build();
        coordinator.register("worker-1");
    }

    @Test
    @DisplayName("Should process a job and acknowledge it")
    void testProcessOneSuccess() throws Exception {
        // Given
        newWorker(ctx -> JobHandler.ProcessingResult.success("ok"), 5_000);
        queue.enqueue("job-1", "payload", EnqueueOptions.defaults());

        // When
        boolean processed = worker.processOne();

        // Then
        assertThat(processed).isTrue();
        assertThat(worker.getProcessedCount()).isEqualTo(1);
        assertThat(worker.getCurrentJobId()).isNull();
        assertThat(queue.getJob("job-1").orElseThrow().getState()).isEqualTo(JobState.COMPLETED);
        assertThat(coordinator.getWorker("worker-1").orElseThrow().status()).isEqualTo(WorkerStatus.IDLE);
        assertThat(worker.processOne()).isFalse();
    }

    @Test
    @DisplayName("Should nack a failed job so it is retried later")
    void testProcessOneFailure() throws Exception {
        // Given
        newWorker(ctx -> {
            throw new IllegalStateException("downstream unavailable");
        }, 5_000);
        queue.enqueue("job-1", "payload", EnqueueOptions.defaults());

        // When
        worker.processOne();

        // Then
        assertThat(worker.getFailedCount()).isEqualTo(1);
        assertThat(queue.getJob("job-1").orElseThrow().getState()).isEqualTo(JobState.DELAYED);
        assertThat(queue.getJob("job-1").orElseThrow().getLastError())
                .isEqualTo("IllegalStateException: downstream unavailable");
    }

    @Test
    @DisplayName("Should settle a timed-out execution with a TIMEOUT record")
    void testProcessOneTimeout() throws Exception {
        // Given
        newWorker(ctx -> {
            Thread.sleep(5_000);
            return JobHandler.ProcessingResult.success();
        }, 100);
        queue.enqueue("job-1", "payload", EnqueueOptions.defaults());

        // When
        worker.processOne();

        // Then
        assertThat(store.listRecords("job-1")).singleElement()
                .satisfies(record -> assertThat(record.outcome()).isEqualTo(ExecutionRecord.Outcome.TIMEOUT));
        assertThat(queue.getJob("job-1").orElseThrow().getAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop the result of a job whose lease was revoked mid-run")
    void testLostLease() throws Exception {
        // Given
        newWorker(ctx -> {
            queue.revokeLeases(ctx.workerId());
            return JobHandler.ProcessingResult.success("too late");
        }, 5_000);
        queue.enqueue("job-1", "payload", EnqueueOptions.defaults());

        // When
        boolean processed = worker.processOne();

        // Then
        assertThat(processed).isTrue();
        assertThat(worker.getProcessedCount()).isZero();
        assertThat(worker.getFailedCount()).isEqualTo(1);
        assertThat(queue.getJob("job-1").orElseThrow().getState()).isEqualTo(JobState.WAITING);
        assertThat(store.listRecords("job-1"))
                .extracting(ExecutionRecord::outcome)
                .containsExactly(ExecutionRecord.Outcome.TIMEOUT);
    }

    @Test
    @DisplayName("Should keep polling in the background until every job is done")
    void testBackgroundLoop() throws Exception {
        // Given
        newWorker(ctx -> JobHandler.ProcessingResult.success(), 5_000);
        for (int i = 0; i < 20; i++) {
            queue.enqueue("job-" + i, "payload-" + i, EnqueueOptions.defaults());
        }

        // When
        worker.start();

        // Then
        await().atMost(10, TimeUnit.SECONDS)
                .until(() -> queue.getMetrics().getCompletedJobs() == 20);
        assertThat(worker.getProcessedCount()).isEqualTo(20);
        assertThat(worker.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should register again after being declared dead")
    void testReRegisterAfterDeath() throws Exception {
        // Given
        WorkerCoordinator<String> strict = new WorkerCoordinator<>(queue, 1, Clock.systemUTC());
        supervisor = new ExecutionSupervisor<>(ctx -> JobHandler.ProcessingResult.success(), 5_000, 200,
                Clock.systemUTC());
        worker = QueueWorker.builder("worker-1", queue, strict, supervisor).withPollInterval(20).build();
        worker.start();
        await().atMost(5, TimeUnit.SECONDS).until(() -> !strict.detectDeadWorkers().isEmpty());

        // When
        queue.enqueue("job-1", "payload", EnqueueOptions.defaults());

        // Then
        await().atMost(10, TimeUnit.SECONDS).until(() -> worker.getProcessedCount() == 1);
        assertThat(strict.getWorker("worker-1").orElseThrow().isLive()).isTrue();
    }
}
