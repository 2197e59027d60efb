/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.handler;

import com.mqworker.messaging.core.DeliveryMeta;
import java.util.Map;

/**
 * Business logic plugged into a queue worker.
 *
 * <p>One handler instance serves every worker of a pool, and each message is
 * processed on its own task, so {@link #process} is called concurrently from
 * arbitrary threads. Implementations must be thread-safe and must not rely on
 * thread affinity.</p>
 *
 * <p>Any exception thrown from {@link #process} is treated as
 * {@link Outcome#retryOnce()}.</p>
 */
public interface MessageHandler {

    /**
     * Called once after instantiation with the pool's {@code handler_config}.
     */
    default void construct(Map<String, Object> config) {}

    Outcome process(byte[] payload, DeliveryMeta meta) throws Exception;
}
