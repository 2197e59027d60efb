/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.messaging.core;

import com.mqworker.common.exception.CommitException;
import com.mqworker.common.exception.RegistrationException;

import java.util.function.Consumer;

/**
 * One broker channel, owned by exactly one worker.
 *
 * <p>Registration calls ({@link #setPrefetch}, {@link #consume}) throw
 * {@link RegistrationException}; commit calls ({@link #ack}, {@link #reject})
 * throw {@link CommitException}. Both may be thrown after the underlying
 * connection died.</p>
 */
public interface BrokerChannel {

    /** Limit the number of unacknowledged messages the broker pushes to this channel. */
    void setPrefetch(int prefetchCount);

    /**
     * Register a manual-ack consumer on the queue.
     *
     * @return the broker-issued consumer tag
     */
    String consume(String queueName, DeliveryListener listener);

    void ack(long deliveryTag);

    void reject(long deliveryTag, boolean requeue);

    /**
     * Register a callback fired once when the connection carrying this channel
     * terminates. If the connection is already gone the callback fires immediately.
     */
    void onConnectionTerminated(Consumer<Throwable> callback);

    boolean isOpen();

    /** Close the channel if it is still open. Never throws. */
    void close();

    /** Human-readable identifier for logs, e.g. {@code "worker-1@broker:5672#3"}. */
    String describe();
}
