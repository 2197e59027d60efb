/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.messaging.core;

/**
 * Receives the asynchronous events of one consumer registration.
 * Callbacks arrive on broker client threads; implementations must be thread-safe.
 */
public interface DeliveryListener {

    /** The broker confirmed that consumption has begun. */
    void onConsumeOk(String consumerTag);

    /** A message was delivered and awaits an ack or reject. */
    void onDelivery(byte[] payload, DeliveryMeta meta);
}
