/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.server.engine;

import com.mqworker.common.exception.ConfigurationException;
import com.mqworker.common.model.ConsumerPoolConfig;
import com.mqworker.messaging.core.ChannelGateway;
import com.mqworker.server.actor.ConsumerSupervisor;
import com.mqworker.server.actor.RestartPolicy;
import com.mqworker.server.consumer.ConsumerSettings;
import com.mqworker.server.handler.HandlerFactory;
import com.mqworker.server.handler.MessageHandler;
import com.mqworker.server.metrics.ConsumerMetrics;
import org.apache.pekko.actor.typed.ActorSystem;
import org.apache.pekko.actor.typed.javadsl.AskPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges application code with the Pekko actor system running the workers.
 *
 * Flow:
 *   1. Build the handler and validated settings for a pool
 *   2. Ask the {@link ConsumerSupervisor} to start the pool's workers
 *   3. Workers process deliveries on the shared processing executor
 */
public class ConsumerEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConsumerEngine.class);

    private final ActorSystem<ConsumerSupervisor.Command> actorSystem;
    private final ExecutorService processingExecutor;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * @param processingThreads size of the processing pool; 0 or less for an unbounded cached pool
     */
    public ConsumerEngine(ChannelGateway gateway, ConsumerMetrics metrics, RestartPolicy restartPolicy,
                          int processingThreads) {
        this.processingExecutor = newProcessingExecutor(processingThreads);
        this.actorSystem = ActorSystem.create(
                ConsumerSupervisor.create(gateway, processingExecutor, metrics, restartPolicy), "mqworker");
        log.info("ConsumerEngine initialized with Pekko actor system (processing threads: {})",
                processingThreads > 0 ? processingThreads : "unbounded");
    }

    public void startPool(ConsumerPoolConfig config) {
        if (config.getWorkerCount() <= 0) {
            throw new ConfigurationException("worker_count must be positive for pool " + config.getPoolName());
        }
        MessageHandler handler = HandlerFactory.create(config.getHandlerClass(), config.getHandlerConfig());
        startPool(ConsumerSettings.fromPoolConfig(config, handler), config.getWorkerCount());
    }

    public void startPool(ConsumerSettings settings, int workerCount) {
        actorSystem.tell(new ConsumerSupervisor.StartPool(settings, workerCount));
    }

    public CompletionStage<List<ConsumerSupervisor.WorkerInfo>> listWorkers(Duration timeout) {
        return AskPattern.ask(actorSystem, ConsumerSupervisor.ListWorkers::new, timeout, actorSystem.scheduler());
    }

    /**
     * Stops every worker. In-flight processing tasks are neither awaited nor
     * cancelled; their commits fail against closed channels and are logged.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        log.info("Shutting down ConsumerEngine");
        actorSystem.terminate();
        try {
            actorSystem.getWhenTerminated().toCompletableFuture().get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Actor system did not terminate cleanly", e);
        }
        processingExecutor.shutdown();
    }

    private static ExecutorService newProcessingExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return threads > 0
                ? Executors.newFixedThreadPool(threads, r -> processingThread(r, counter))
                : Executors.newCachedThreadPool(r -> processingThread(r, counter));
    }

    private static Thread processingThread(Runnable r, AtomicInteger counter) {
        Thread t = new Thread(r, "msg-processor-" + counter.incrementAndGet());
        t.setDaemon(true);
        return t;
    }
}
