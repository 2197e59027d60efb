/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.consumer;

/**
 * Broker settlement chosen for one delivery.
 */
public sealed interface CommitAction permits CommitAction.Ack, CommitAction.Reject {

    long deliveryTag();

    record Ack(long deliveryTag) implements CommitAction {}

    record Reject(long deliveryTag, boolean requeue) implements CommitAction {}
}
