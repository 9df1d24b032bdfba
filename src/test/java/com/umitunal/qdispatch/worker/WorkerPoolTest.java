package com.umitunal.qdispatch.worker;

import com.umitunal.qdispatch.config.EngineConfig;
import com.umitunal.qdispatch.config.StorageConfig;
import com.umitunal.qdispatch.coordinator.WorkerCoordinator;
import com.umitunal.qdispatch.core.EnqueueOptions;
import com.umitunal.qdispatch.core.ExecutionRecord;
import com.umitunal.qdispatch.engine.MaintenanceScheduler;
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
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class WorkerPoolTest {

    @TempDir
    Path tempDir;

    private EngineConfig config;
    private RocksJobStore<String> store;
    private RocksJobQueue<String> queue;
    private WorkerCoordinator<String> coordinator;
    private ExecutionSupervisor<String> supervisor;
    private WorkerPool<String> pool;
    private MaintenanceScheduler maintenance;

    @BeforeEach
    void setUp() throws Exception {
        config = EngineConfig.newBuilder()
                .withWorkerCount(3)
                .withLeaseDuration(1_200)
                .withHeartbeatInterval(100)
                .withLivenessWindow(800)
                .withReaperInterval(100)
                .withDelayedSweepInterval(50)
                .withPollInterval(20)
                .withDefaultJobTimeout(5_000)
                .withCancellationGrace(200)
                .build();
        store = new RocksJobStore<>(StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build(), new StringCodec());
        queue = new RocksJobQueue<>(store, config, RetryPolicy.withoutJitter(50, 200), Clock.systemUTC());
        coordinator = new WorkerCoordinator<>(queue, config.getLivenessWindow(), Clock.systemUTC());
        maintenance = new MaintenanceScheduler(queue, coordinator, config);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.stop(5_000);
        }
        maintenance.close();
        if (supervisor != null) {
            supervisor.close();
        }
        store.close();
    }

    private void startPool(JobHandler<String> handler) {
        supervisor = new ExecutionSupervisor<>(handler, config, Clock.systemUTC());
        pool = new WorkerPool<>("pool", queue, coordinator, supervisor, config);
        maintenance.start();
        pool.start();
    }

    @Test
    @DisplayName("Should run every job exactly once across the pool")
    void testEachJobRunsOnce() throws Exception {
        // Given
        Set<String> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        for (int i = 0; i < 30; i++) {
            queue.enqueue("job-" + i, "payload-" + i, EnqueueOptions.defaults());
        }

        // When
        startPool(ctx -> {
            if (!seen.add(ctx.jobId())) {
                duplicates.incrementAndGet();
            }
            Thread.sleep(5);
            return JobHandler.ProcessingResult.success();
        });

        // Then
        await().atMost(15, TimeUnit.SECONDS)
                .until(() -> queue.getMetrics().getCompletedJobs() == 30);
        assertThat(duplicates.get()).isZero();
        assertThat(pool.getProcessedCount()).isEqualTo(30);
        assertThat(coordinator.listLiveWorkers()).containsExactlyInAnyOrder("pool-0", "pool-1", "pool-2");
    }

    @Test
    @DisplayName("Should keep extending the lease of a job that outlives it")
    void testHeartbeatExtendsLease() throws Exception {
        // Given
        queue.enqueue("long-job", "payload", EnqueueOptions.defaults());

        // When: the job runs for about three lease durations
        startPool(ctx -> {
            Thread.sleep(3_500);
            return JobHandler.ProcessingResult.success("finished");
        });

        // Then
        await().atMost(15, TimeUnit.SECONDS)
                .until(() -> queue.getMetrics().getCompletedJobs() == 1);
        assertThat(store.listRecords("long-job")).singleElement().satisfies(record -> {
            assertThat(record.attempt()).isEqualTo(1);
            assertThat(record.outcome()).isEqualTo(ExecutionRecord.Outcome.SUCCESS);
        });
    }

    @Test
    @DisplayName("Should deregister every slot on stop")
    void testStop() {
        // Given
        startPool(ctx -> JobHandler.ProcessingResult.success());
        await().atMost(5, TimeUnit.SECONDS).until(() -> coordinator.listLiveWorkers().size() == 3);

        // When
        pool.stop(5_000);

        // Then
        assertThat(pool.isRunning()).isFalse();
        assertThat(coordinator.listWorkers()).isEmpty();
        assertThat(pool.getWorkers()).noneMatch(QueueWorker::isRunning);
    }
}
