/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.consumer;

/**
 * Point-in-time view of one worker, for diagnostics.
 */
public record ConsumerStatus(
        String workerIdentity,
        String poolName,
        String queueName,
        ConsumerPhase phase,
        String consumerTag,
        String channel
) {}
