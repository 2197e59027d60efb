/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.server.consumer;

import com.mqworker.messaging.core.DeliveryMeta;
import com.mqworker.server.handler.Outcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommitPolicyTest {

    private static DeliveryMeta meta(long tag, boolean redelivered) {
        return new DeliveryMeta("ctag-1", tag, redelivered);
    }

    @Test
    void successIsAcknowledged() {
        assertThat(CommitPolicy.decide(Outcome.success(), meta(1, false)))
                .isEqualTo(new CommitAction.Ack(1));
    }

    @Test
    void successOnRedeliveryIsStillAcknowledged() {
        assertThat(CommitPolicy.decide(Outcome.success(), meta(3, true)))
                .isEqualTo(new CommitAction.Ack(3));
    }

    @Test
    void retryOnceOnFirstDeliveryRequeues() {
        assertThat(CommitPolicy.decide(Outcome.retryOnce(), meta(5, false)))
                .isEqualTo(new CommitAction.Reject(5, true));
    }

    @Test
    void retryOnceOnRedeliveryDiscards() {
        assertThat(CommitPolicy.decide(Outcome.retryOnce(), meta(5, true)))
                .isEqualTo(new CommitAction.Reject(5, false));
    }

    @Test
    void otherOutcomeIsNeverRequeued() {
        assertThat(CommitPolicy.decide(Outcome.other("bad_input"), meta(9, false)))
                .isEqualTo(new CommitAction.Reject(9, false));
        assertThat(CommitPolicy.decide(Outcome.other("bad_input"), meta(9, true)))
                .isEqualTo(new CommitAction.Reject(9, false));
    }

    @Test
    void missingOutcomeIsDiscarded() {
        assertThat(CommitPolicy.decide(null, meta(11, false)))
                .isEqualTo(new CommitAction.Reject(11, false));
    }

    @Test
    void actionCarriesTheTriggeringDeliveryTag() {
        long tag = Long.MAX_VALUE - 1;
        assertThat(CommitPolicy.decide(Outcome.retryOnce(), meta(tag, false)).deliveryTag()).isEqualTo(tag);
    }
}
