/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.common.exception;

/**
 * Thrown when the channel gateway cannot grant a channel to a worker.
 * Treated as transient: the worker retries after a fixed delay.
 */
public class ChannelUnavailableException extends MqWorkerException {
    public ChannelUnavailableException(String workerIdentity, Throwable cause) {
        super("MQW_CHANNEL_UNAVAILABLE",
                "No channel available for worker '" + workerIdentity + "': "
                        + (cause != null ? cause.getMessage() : "unknown cause"), cause);
    }
}
