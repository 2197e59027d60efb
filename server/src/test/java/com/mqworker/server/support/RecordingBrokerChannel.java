/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.server.support;

import com.mqworker.common.exception.CommitException;
import com.mqworker.common.exception.RegistrationException;
import com.mqworker.messaging.core.BrokerChannel;
import com.mqworker.messaging.core.DeliveryListener;
import com.mqworker.messaging.core.DeliveryMeta;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * In-memory {@link BrokerChannel} that records every broker call as a string:
 * {@code prefetch:<n>}, {@code consume:<queue>}, {@code ack:<tag>},
 * {@code reject:<tag>:<requeue>}, {@code close}.
 */
public class RecordingBrokerChannel implements BrokerChannel {

    private final String name;
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final BlockingQueue<String> pending = new LinkedBlockingQueue<>();
    private volatile DeliveryListener listener;
    private volatile Consumer<Throwable> terminationCallback;
    private volatile Throwable connectionDeath;
    private volatile boolean open = true;
    private volatile RuntimeException prefetchFailure;
    private volatile RuntimeException consumeFailure;

    public RecordingBrokerChannel(String name) {
        this.name = name;
    }

    public RecordingBrokerChannel failPrefetchWith(RuntimeException failure) {
        this.prefetchFailure = failure;
        return this;
    }

    public RecordingBrokerChannel failConsumeWith(RuntimeException failure) {
        this.consumeFailure = failure;
        return this;
    }

    /** The connection is dead before anyone subscribes to its termination. */
    public RecordingBrokerChannel withDeadConnection(Throwable reason) {
        this.connectionDeath = reason;
        this.open = false;
        return this;
    }

    @Override
    public void setPrefetch(int prefetchCount) {
        record("prefetch:" + prefetchCount);
        if (prefetchFailure != null) throw new RegistrationException("qos failed", prefetchFailure);
    }

    @Override
    public String consume(String queueName, DeliveryListener listener) {
        record("consume:" + queueName);
        if (consumeFailure != null) throw new RegistrationException("consume failed", consumeFailure);
        this.listener = listener;
        return consumerTag();
    }

    @Override
    public void ack(long deliveryTag) {
        record("ack:" + deliveryTag);
        if (!open) throw new CommitException(deliveryTag, "channel " + name + " is closed", null);
    }

    @Override
    public void reject(long deliveryTag, boolean requeue) {
        record("reject:" + deliveryTag + ":" + requeue);
        if (!open) throw new CommitException(deliveryTag, "channel " + name + " is closed", null);
    }

    @Override
    public void onConnectionTerminated(Consumer<Throwable> callback) {
        this.terminationCallback = callback;
        if (connectionDeath != null) callback.accept(connectionDeath);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (!open) return;
        open = false;
        record("close");
    }

    @Override
    public String describe() {
        return name;
    }

    // ─── Broker-side simulation ─────────────────────────────────────

    public String consumerTag() {
        return "ctag-" + name;
    }

    public void confirmConsume() {
        listener.onConsumeOk(consumerTag());
    }

    public void deliver(String payload, long deliveryTag, boolean redelivered) {
        listener.onDelivery(payload.getBytes(StandardCharsets.UTF_8),
                new DeliveryMeta(consumerTag(), deliveryTag, redelivered));
    }

    public void terminateConnection(Throwable reason) {
        open = false;
        connectionDeath = reason;
        Consumer<Throwable> callback = terminationCallback;
        if (callback != null) callback.accept(reason);
    }

    public boolean isConsuming() {
        return listener != null;
    }

    // ─── Assertions support ─────────────────────────────────────────

    public List<String> calls() {
        return List.copyOf(calls);
    }

    /** Next recorded call not yet taken, or {@code null} after the timeout. */
    public String nextCall(Duration timeout) throws InterruptedException {
        return pending.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void record(String call) {
        calls.add(call);
        pending.add(call);
    }
}
