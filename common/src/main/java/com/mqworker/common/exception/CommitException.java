/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.common.exception;

/**
 * Thrown when an ack or reject cannot be delivered to the broker,
 * typically because the channel was closed underneath an in-flight task.
 */
public class CommitException extends MqWorkerException {
    private final long deliveryTag;

    public CommitException(long deliveryTag, String message, Throwable cause) {
        super("MQW_COMMIT_FAILED", message, cause);
        this.deliveryTag = deliveryTag;
    }

    public long getDeliveryTag() { return deliveryTag; }
}
