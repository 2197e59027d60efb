/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.metrics;

import com.mqworker.server.consumer.CommitAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Micrometer instrumentation for queue workers.
 *
 * <h3>Metric Catalogue</h3>
 * <table>
 *   <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   <tr><td>mqworker.messages.committed</td><td>Counter</td><td>action (ack, requeue, discard)</td></tr>
 *   <tr><td>mqworker.handler.errors</td><td>Counter</td><td></td></tr>
 *   <tr><td>mqworker.handler.duration</td><td>Timer</td><td></td></tr>
 *   <tr><td>mqworker.commit.failures</td><td>Counter</td><td></td></tr>
 *   <tr><td>mqworker.channel.request.failures</td><td>Counter</td><td></td></tr>
 *   <tr><td>mqworker.workers.restarts</td><td>Counter</td><td>pool</td></tr>
 * </table>
 */
public class ConsumerMetrics {

    private final MeterRegistry registry;
    private final Counter acked;
    private final Counter requeued;
    private final Counter discarded;
    private final Counter handlerErrors;
    private final Counter commitFailures;
    private final Counter channelRequestFailures;
    private final Timer handlerDuration;

    public ConsumerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.acked = committedCounter("ack");
        this.requeued = committedCounter("requeue");
        this.discarded = committedCounter("discard");
        this.handlerErrors = Counter.builder("mqworker.handler.errors")
                .description("Handler invocations that threw an exception")
                .register(registry);
        this.commitFailures = Counter.builder("mqworker.commit.failures")
                .description("Acks or rejects the broker could not accept")
                .register(registry);
        this.channelRequestFailures = Counter.builder("mqworker.channel.request.failures")
                .description("Failed channel requests (each one schedules a retry)")
                .register(registry);
        this.handlerDuration = Timer.builder("mqworker.handler.duration")
                .description("Time spent inside MessageHandler.process")
                .register(registry);
    }

    /** Metrics backed by a private in-memory registry, for code paths without Spring. */
    public static ConsumerMetrics inMemory() {
        return new ConsumerMetrics(new SimpleMeterRegistry());
    }

    private Counter committedCounter(String action) {
        return Counter.builder("mqworker.messages.committed")
                .description("Messages settled with the broker")
                .tag("action", action)
                .register(registry);
    }

    public void committed(CommitAction action) {
        if (action instanceof CommitAction.Ack) {
            acked.increment();
        } else if (action instanceof CommitAction.Reject reject && reject.requeue()) {
            requeued.increment();
        } else {
            discarded.increment();
        }
    }

    public void handlerError() { handlerErrors.increment(); }

    public void commitFailed() { commitFailures.increment(); }

    public void channelRequestFailed() { channelRequestFailures.increment(); }

    public void workerRestarted(String poolName) {
        registry.counter("mqworker.workers.restarts", "pool", poolName).increment();
    }

    public Timer.Sample startHandlerTimer() { return Timer.start(registry); }

    public void stopHandlerTimer(Timer.Sample sample) { sample.stop(handlerDuration); }

    public MeterRegistry getRegistry() { return registry; }
}
