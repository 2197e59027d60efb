/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.app.lifecycle;

import com.mqworker.messaging.rabbitmq.RabbitMQChannelGateway;
import com.mqworker.server.engine.ConsumerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Tears the workers down when the Spring context closes.
 *
 * <pre>
 * Phase 1: Stop the consumer engine (all worker actors, their channels)
 * Phase 2: Close the broker connection
 * </pre>
 *
 * In-flight processing tasks are not drained. Their acks and rejects fail
 * against closed channels and the broker redelivers those messages.
 */
@Component
public class ShutdownOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownOrchestrator.class);

    private final ConsumerEngine consumerEngine;
    private final RabbitMQChannelGateway channelGateway;

    public ShutdownOrchestrator(ConsumerEngine consumerEngine, RabbitMQChannelGateway channelGateway) {
        this.consumerEngine = consumerEngine;
        this.channelGateway = channelGateway;
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        Instant start = Instant.now();
        log.info("SHUTDOWN INITIATED");

        log.info("Phase 1: Stopping consumer engine");
        try {
            consumerEngine.close();
        } catch (Exception e) {
            log.warn("  ⚠ Consumer engine shutdown issue: {}", e.getMessage());
        }

        log.info("Phase 2: Closing broker connection");
        try {
            channelGateway.close();
        } catch (Exception e) {
            log.warn("  ⚠ Broker connection shutdown issue: {}", e.getMessage());
        }

        log.info("SHUTDOWN COMPLETE in {} ms", Duration.between(start, Instant.now()).toMillis());
    }
}
