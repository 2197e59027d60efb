/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.consumer;

import com.mqworker.messaging.core.BrokerChannel;

/**
 * Mutable state of one worker instance. Owned and mutated by a single actor,
 * so it needs no synchronization.
 *
 * <p>The channel is set at most once and never swapped; the consumer tag is
 * set only after the channel.</p>
 */
public class ConsumerState {

    private final String workerIdentity;
    private final ConsumerSettings settings;
    private BrokerChannel channel;
    private String consumerTag;
    private ConsumerPhase phase = ConsumerPhase.UNINITIALIZED;

    public ConsumerState(String workerIdentity, ConsumerSettings settings) {
        this.workerIdentity = workerIdentity;
        this.settings = settings;
    }

    public String workerIdentity() { return workerIdentity; }
    public ConsumerSettings settings() { return settings; }
    public BrokerChannel channel() { return channel; }
    public String consumerTag() { return consumerTag; }
    public ConsumerPhase phase() { return phase; }
    public boolean hasChannel() { return channel != null; }

    public void setChannel(BrokerChannel channel) {
        if (this.channel != null) {
            throw new IllegalStateException("Worker " + workerIdentity + " already owns channel "
                    + this.channel.describe());
        }
        this.channel = channel;
    }

    public void setConsumerTag(String consumerTag) {
        if (channel == null) {
            throw new IllegalStateException("Worker " + workerIdentity + " has no channel to register on");
        }
        this.consumerTag = consumerTag;
    }

    public void setPhase(ConsumerPhase phase) { this.phase = phase; }

    public ConsumerStatus snapshot() {
        return new ConsumerStatus(workerIdentity, settings.poolName(), settings.queueName(), phase,
                consumerTag, channel != null ? channel.describe() : null);
    }
}
