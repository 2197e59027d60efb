/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.consumer;

import com.mqworker.common.config.WorkerProperties;
import com.mqworker.common.exception.ConfigurationException;
import com.mqworker.common.model.ConsumerPoolConfig;
import com.mqworker.server.handler.MessageHandler;

import java.time.Duration;

/**
 * Immutable startup configuration of a queue worker. Shared unchanged by every
 * instance the supervisor starts for the same pool.
 *
 * @param poolName          pool name, prefix of worker identities
 * @param handler           message handler
 * @param queueName         queue to consume
 * @param prefetchCount     maximum unacknowledged deliveries per channel
 * @param retryChannelAfter fixed delay between channel requests
 */
public record ConsumerSettings(
        String poolName,
        MessageHandler handler,
        String queueName,
        int prefetchCount,
        Duration retryChannelAfter
) {

    public static final String RETRY_PROPERTY = "mqworker.consumer.retry-channel-after";
    public static final Duration DEFAULT_RETRY_CHANNEL_AFTER =
            Duration.ofMillis(ConsumerPoolConfig.DEFAULT_RETRY_CHANNEL_AFTER_MS);

    public ConsumerSettings {
        require(poolName, "pool name");
        require(queueName, "queue name");
        if (handler == null) throw new ConfigurationException("handler is required");
        if (prefetchCount <= 0) {
            throw new ConfigurationException("prefetch count must be positive, was " + prefetchCount);
        }
        if (retryChannelAfter == null || retryChannelAfter.isNegative()) {
            throw new ConfigurationException("retry delay must be zero or positive, was " + retryChannelAfter);
        }
    }

    /**
     * Settings with the retry delay taken from {@code mqworker.consumer.retry-channel-after},
     * or 2750 ms when not configured.
     */
    public static ConsumerSettings of(String poolName, MessageHandler handler, String queueName, int prefetchCount) {
        return new ConsumerSettings(poolName, handler, queueName, prefetchCount, defaultRetryDelay());
    }

    /**
     * Settings for a configured pool. Without {@code retry_channel_after_ms} the
     * delay falls back to {@code mqworker.consumer.retry-channel-after}.
     */
    public static ConsumerSettings fromPoolConfig(ConsumerPoolConfig config, MessageHandler handler) {
        if (config.getPrefetchCount() == null) {
            throw new ConfigurationException("prefetch_count is required for pool " + config.getPoolName());
        }
        Duration retry = config.getRetryChannelAfterMs() != null
                ? Duration.ofMillis(config.getRetryChannelAfterMs())
                : defaultRetryDelay();
        return new ConsumerSettings(config.getPoolName(), handler, config.getQueue(),
                config.getPrefetchCount(), retry);
    }

    static Duration defaultRetryDelay() {
        if (!WorkerProperties.isInitialized()) return DEFAULT_RETRY_CHANNEL_AFTER;
        return WorkerProperties.get().getDuration(RETRY_PROPERTY, DEFAULT_RETRY_CHANNEL_AFTER);
    }

    private static void require(String value, String what) {
        if (value == null || value.isBlank()) throw new ConfigurationException(what + " is required");
    }
}
