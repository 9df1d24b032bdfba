package com.umitunal.qdispatch.engine;

import com.umitunal.qdispatch.config.EngineConfig;
import com.umitunal.qdispatch.config.StorageConfig;
import com.umitunal.qdispatch.coordinator.WorkerCoordinator;
import com.umitunal.qdispatch.core.JobQueue;
import com.umitunal.qdispatch.exception.QueueException;
import com.umitunal.qdispatch.monitor.QueueMonitor;
import com.umitunal.qdispatch.serialization.PayloadCodec;
import com.umitunal.qdispatch.storage.JobStore;
import com.umitunal.qdispatch.storage.RocksJobQueue;
import com.umitunal.qdispatch.storage.RocksJobStore;
import com.umitunal.qdispatch.supervisor.ExecutionSupervisor;
import com.umitunal.qdispatch.supervisor.RetryPolicy;
import com.umitunal.qdispatch.worker.JobHandler;
import com.umitunal.qdispatch.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the store, queue, coordinator, supervisor, worker pool and maintenance timers into one
 * engine. Opening an engine runs restart recovery before anything can claim.
 *
 * @param <T> the type of job payload
 */
public class DispatchEngine<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DispatchEngine.class);

    private final EngineConfig config;
    private final RocksJobStore<T> store;
    private final RocksJobQueue<T> queue;
    private final WorkerCoordinator<T> coordinator;
    private final ExecutionSupervisor<T> supervisor;
    private final WorkerPool<T> pool;
    private final MaintenanceScheduler maintenance;
    private final QueueMonitor monitor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private DispatchEngine(Builder<T> builder) throws QueueException {
        this.config = builder.engineConfig;
        this.store = new RocksJobStore<>(builder.storageConfig, builder.codec);
        try {
            this.queue = new RocksJobQueue<>(store, config, RetryPolicy.from(config), builder.clock);
            queue.recover();
        } catch (QueueException | RuntimeException e) {
            store.close();
            throw e;
        }
        this.coordinator = new WorkerCoordinator<>(queue, config.getLivenessWindow(), builder.clock);
        this.supervisor = new ExecutionSupervisor<>(builder.handler, config, builder.clock);
        this.pool = new WorkerPool<>(builder.poolName, queue, coordinator, supervisor, config);
        this.maintenance = new MaintenanceScheduler(queue, coordinator, config);
        this.monitor = new QueueMonitor(queue, store, coordinator, maintenance::isRunning, builder.clock);
    }

    /**
     * Start maintenance timers and worker slots.
     */
    public void start() {
        maintenance.start();
        pool.start();
        log.info("Dispatch engine started on {} with {}", store.getDataDirectory(), config);
    }

    /**
     * Stop accepting new jobs. Workers keep draining what is already queued.
     */
    public void drain() {
        queue.drain();
    }

    public boolean isDraining() {
        return queue.isDraining();
    }

    public JobQueue<T> getQueue() {
        return queue;
    }

    public JobStore<T> getStore() {
        return store;
    }

    public WorkerCoordinator<T> getCoordinator() {
        return coordinator;
    }

    public WorkerPool<T> getWorkerPool() {
        return pool;
    }

    public QueueMonitor getMonitor() {
        return monitor;
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Stop workers (letting running attempts settle), stop maintenance and close the store.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        queue.drain();
        pool.stop(config.getDefaultJobTimeout() + config.getCancellationGrace());
        maintenance.close();
        supervisor.close();
        store.close();
        log.info("Dispatch engine stopped ({} transaction conflicts retried)", queue.getTransactionConflictCount());
    }

    public static <T> Builder<T> newBuilder(StorageConfig storageConfig, PayloadCodec<T> codec, JobHandler<T> handler) {
        return new Builder<>(storageConfig, codec, handler);
    }

    public static class Builder<T> {
        private final StorageConfig storageConfig;
        private final PayloadCodec<T> codec;
        private final JobHandler<T> handler;
        private EngineConfig engineConfig = EngineConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private String poolName = "worker";

        private Builder(StorageConfig storageConfig, PayloadCodec<T> codec, JobHandler<T> handler) {
            this.storageConfig = storageConfig;
            this.codec = codec;
            this.handler = handler;
        }

        public Builder<T> withEngineConfig(EngineConfig engineConfig) {
            this.engineConfig = engineConfig;
            return this;
        }

        public Builder<T> withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Prefix for worker ids. Default: "worker"
         */
        public Builder<T> withPoolName(String poolName) {
            this.poolName = poolName;
            return this;
        }

        /**
         * Open the store and run restart recovery.
         */
        public DispatchEngine<T> open() throws QueueException {
            return new DispatchEngine<>(this);
        }
    }
}
