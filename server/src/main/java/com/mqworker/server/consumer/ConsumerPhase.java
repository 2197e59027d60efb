/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.consumer;

/**
 * Lifecycle phase of a queue worker. Termination is not a phase: a terminated
 * worker no longer exists and is replaced by a fresh instance.
 */
public enum ConsumerPhase {
    UNINITIALIZED,
    REQUESTING_CHANNEL,
    REGISTERING,
    CONSUMING
}
