/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.consumer;

import com.mqworker.messaging.core.DeliveryMeta;
import com.mqworker.server.handler.Outcome;

/**
 * Maps a handler outcome to a broker settlement.
 *
 * <pre>
 *   Success                       → ack
 *   RetryOnce, first delivery     → reject, requeue
 *   RetryOnce, redelivered        → reject, no requeue
 *   Other (or no outcome)         → reject, no requeue
 * </pre>
 *
 * A message is therefore requeued at most once, whatever the failure cause.
 * The action always carries the delivery tag of {@code meta}.
 */
public final class CommitPolicy {

    private CommitPolicy() {}

    public static CommitAction decide(Outcome outcome, DeliveryMeta meta) {
        long tag = meta.deliveryTag();
        if (outcome instanceof Outcome.Success) {
            return new CommitAction.Ack(tag);
        }
        if (outcome instanceof Outcome.RetryOnce) {
            return new CommitAction.Reject(tag, !meta.redelivered());
        }
        return new CommitAction.Reject(tag, false);
    }
}
