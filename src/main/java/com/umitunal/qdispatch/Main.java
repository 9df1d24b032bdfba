package com.umitunal.qdispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.umitunal.qdispatch.config.EngineConfig;
import com.umitunal.qdispatch.config.StorageConfig;
import com.umitunal.qdispatch.engine.DispatchEngine;
import com.umitunal.qdispatch.http.DispatchHttpServer;
import com.umitunal.qdispatch.serialization.JsonCodec;
import com.umitunal.qdispatch.worker.JobContext;
import com.umitunal.qdispatch.worker.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Runs a dispatch engine with its HTTP surface.
 *
 * <pre>
 * java -jar qdispatch.jar [dataDirectory] [port]
 * </pre>
 *
 * The bundled handler logs each JSON payload. A payload of {@code {"fail": true}} fails its
 * attempt, and {@code {"sleepMs": n}} holds the worker for n milliseconds.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        String dataDirectory = args.length > 0 ? args[0] : "./qdispatch-data";
        int port = args.length > 1 ? Integer.parseInt(args[1]) : EngineConfig.defaults().getHttpPort();

        EngineConfig config = EngineConfig.newBuilder().withHttpPort(port).build();
        DispatchEngine<JsonNode> engine = DispatchEngine
                .newBuilder(StorageConfig.newBuilder(dataDirectory).build(),
                        new JsonCodec<>(JsonNode.class), Main::handle)
                .withEngineConfig(config)
                .open();
        DispatchHttpServer<JsonNode> http = new DispatchHttpServer<>(
                engine.getQueue(), engine.getMonitor(), JsonNode.class, config.getHttpPort());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            engine.drain();
            http.close();
            engine.close();
            stopped.countDown();
        }, "qdispatch-shutdown"));

        engine.start();
        http.start();
        stopped.await();
    }

    private static JobHandler.ProcessingResult handle(JobContext<JsonNode> context) throws InterruptedException {
        JsonNode payload = context.payload();
        log.info("Job {} attempt {} on {}: {}", context.jobId(), context.attempt(), context.workerId(), payload);

        long sleepMs = payload != null ? payload.path("sleepMs").asLong(0) : 0;
        if (sleepMs > 0) {
            Thread.sleep(sleepMs);
        }
        if (payload != null && payload.path("fail").asBoolean(false)) {
            return JobHandler.ProcessingResult.failure("payload requested failure");
        }
        return JobHandler.ProcessingResult.success();
    }
}
