/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.consumer;

import com.mqworker.common.exception.CommitException;
import com.mqworker.messaging.core.BrokerChannel;
import com.mqworker.messaging.core.DeliveryMeta;
import com.mqworker.server.handler.MessageHandler;
import com.mqworker.server.handler.Outcome;
import com.mqworker.server.metrics.ConsumerMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one delivery through its handler and settles it with the broker.
 * Executed on a processing task, never on the worker actor itself.
 */
public class DeliveryProcessor {

    private static final Logger log = LoggerFactory.getLogger(DeliveryProcessor.class);

    private final ConsumerMetrics metrics;

    public DeliveryProcessor(ConsumerMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * @return the settlement that was attempted; a failed attempt is logged and
     *         counted, not rethrown
     * @throws VirtualMachineError if the handler raised one, after the message was settled
     */
    public CommitAction process(String workerIdentity, MessageHandler handler, BrokerChannel channel,
                                byte[] payload, DeliveryMeta meta) {
        log.debug("[{}] Begin message processing (consumerTag={}, deliveryTag={})",
                workerIdentity, meta.consumerTag(), meta.deliveryTag());

        Outcome outcome;
        VirtualMachineError fatal = null;
        Timer.Sample sample = metrics.startHandlerTimer();
        try {
            outcome = handler.process(payload, meta);
        } catch (Throwable t) {
            // Errors too: an unsettled delivery would hold a prefetch slot until the connection dies.
            log.error("[{}] Uncaught exception processing message (deliveryTag={}, redelivered={})",
                    workerIdentity, meta.deliveryTag(), meta.redelivered(), t);
            metrics.handlerError();
            outcome = Outcome.retryOnce();
            if (t instanceof VirtualMachineError vmError) fatal = vmError;
        } finally {
            metrics.stopHandlerTimer(sample);
        }

        CommitAction action = CommitPolicy.decide(outcome, meta);
        if (outcome instanceof Outcome.Other other) {
            log.warn("[{}] Discarding message deliveryTag={}: {}", workerIdentity, meta.deliveryTag(), other.reason());
        }
        try {
            commit(channel, action);
            metrics.committed(action);
            log.debug("[{}] Committed {}", workerIdentity, action);
        } catch (CommitException e) {
            // The channel may already be gone if the worker terminated while this task ran.
            metrics.commitFailed();
            log.error("[{}] Could not commit {} (channel open={}): {}",
                    workerIdentity, action, channel.isOpen(), e.getMessage(), e);
        }
        if (fatal != null) throw fatal;
        return action;
    }

    private static void commit(BrokerChannel channel, CommitAction action) {
        if (action instanceof CommitAction.Ack ack) {
            channel.ack(ack.deliveryTag());
        } else if (action instanceof CommitAction.Reject reject) {
            channel.reject(reject.deliveryTag(), reject.requeue());
        }
    }
}
