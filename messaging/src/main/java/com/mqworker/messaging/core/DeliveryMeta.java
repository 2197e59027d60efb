/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.messaging.core;

/**
 * Broker metadata carried with every delivered message.
 *
 * @param consumerTag tag of the consumer the message was delivered to
 * @param deliveryTag channel-scoped identifier used to ack or reject this message
 * @param redelivered true if the broker delivered this message before and it was requeued
 * @param exchange    exchange the message was published to, may be empty
 * @param routingKey  routing key the message was published with, may be empty
 */
public record DeliveryMeta(
        String consumerTag,
        long deliveryTag,
        boolean redelivered,
        String exchange,
        String routingKey
) {
    public DeliveryMeta(String consumerTag, long deliveryTag, boolean redelivered) {
        this(consumerTag, deliveryTag, redelivered, "", "");
    }
}
