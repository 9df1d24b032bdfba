package com.umitunal.qdispatch.supervisor;

import com.umitunal.qdispatch.config.EngineConfig;
import com.umitunal.qdispatch.core.ExecutionRecord;
import com.umitunal.qdispatch.core.Job;
import com.umitunal.qdispatch.worker.JobContext;
import com.umitunal.qdispatch.worker.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one attempt of a job under a deadline and reports how it ended.
 *
 * <p>The handler runs on a separate thread so the deadline can be enforced. When it passes, the
 * supervisor raises the context's cancellation flag, interrupts the thread and waits up to the
 * cancellation grace for the handler to return. After that it stops waiting: the handler may still
 * be running, but the attempt is reported as timed out and the job becomes reclaimable.
 *
 * @param <T> the type of job payload
 */
public class ExecutionSupervisor<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutionSupervisor.class);

    private final JobHandler<T> handler;
    private final Clock clock;
    private final long defaultTimeout;
    private final long cancellationGrace;
    private final ExecutorService executor;

    public ExecutionSupervisor(JobHandler<T> handler, EngineConfig config, Clock clock) {
        this(handler, config.getDefaultJobTimeout(), config.getCancellationGrace(), clock);
    }

    public ExecutionSupervisor(JobHandler<T> handler, long defaultTimeout, long cancellationGrace, Clock clock) {
        this.handler = handler;
        this.defaultTimeout = defaultTimeout;
        this.cancellationGrace = cancellationGrace;
        this.clock = clock;
        this.executor = Executors.newCachedThreadPool(new ExecutionThreadFactory());
    }

    /**
     * Run one attempt of the job on behalf of a worker.
     *
     * @return the attempt's record; never null
     */
    public ExecutionRecord run(Job<T> job, String workerId) {
        JobContext<T> context = new JobContext<>(job, workerId);
        Attempt attempt = new Attempt(job.getId(), context.attempt());
        long timeout = job.getTimeoutMillis() > 0 ? job.getTimeoutMillis() : defaultTimeout;
        long startedAt = clock.millis();
        CountDownLatch finished = new CountDownLatch(1);

        attempt.transition(AttemptState.RUNNING);
        Future<JobHandler.ProcessingResult> future = executor.submit(() -> {
            try {
                return handler.process(context);
            } finally {
                finished.countDown();
            }
        });

        String message;
        try {
            JobHandler.ProcessingResult result = future.get(timeout, TimeUnit.MILLISECONDS);
            if (result == null || result.isSuccess()) {
                attempt.transition(AttemptState.SUCCEEDED);
                message = result != null ? result.getMessage() : null;
            } else {
                attempt.transition(AttemptState.FAILED);
                message = result.getMessage() != null ? result.getMessage() : "handler reported failure";
            }
        } catch (TimeoutException e) {
            attempt.transition(AttemptState.TIMED_OUT);
            message = "execution exceeded " + timeout + " ms";
            cancel(context, future, finished);
        } catch (ExecutionException e) {
            attempt.transition(AttemptState.FAILED);
            message = describe(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            attempt.transition(AttemptState.FAILED);
            message = "supervisor interrupted";
            context.cancel();
            future.cancel(true);
        }

        return new ExecutionRecord(job.getId(), context.attempt(), workerId, startedAt, clock.millis(),
                attempt.state.toOutcome(), message);
    }

    /**
     * Signal cancellation and give the handler a bounded chance to stop.
     */
    private void cancel(JobContext<T> context, Future<?> future, CountDownLatch finished) {
        context.cancel();
        future.cancel(true);
        try {
            if (!finished.await(cancellationGrace, TimeUnit.MILLISECONDS)) {
                log.warn("Job {} did not stop within {} ms of cancellation, abandoning it",
                        context.jobId(), cancellationGrace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank()
                ? error.getClass().getSimpleName()
                : error.getClass().getSimpleName() + ": " + message;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(cancellationGrace, TimeUnit.MILLISECONDS)) {
                log.warn("Execution threads still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Per-attempt state holder that enforces legal transitions.
     */
    private static final class Attempt {
        private final String jobId;
        private final int number;
        private AttemptState state = AttemptState.START;

        private Attempt(String jobId, int number) {
            this.jobId = jobId;
            this.number = number;
        }

        void transition(AttemptState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException(
                        "Illegal attempt transition " + state + " -> " + next + " for job " + jobId);
            }
            log.debug("Job {} attempt {}: {} -> {}", jobId, number, state, next);
            state = next;
        }
    }

    private static final class ExecutionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "qdispatch-exec-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
