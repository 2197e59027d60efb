/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.app.config;

import com.mqworker.messaging.rabbitmq.RabbitMQChannelGateway;
import com.mqworker.messaging.rabbitmq.RabbitMQSettings;
import com.mqworker.server.actor.RestartPolicy;
import com.mqworker.server.config.ConsumerPoolRegistry;
import com.mqworker.server.engine.ConsumerEngine;
import com.mqworker.server.metrics.ConsumerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.net.InetAddress;
import java.time.Duration;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Value("${mqworker.config.consumers-dir:config/consumers}")
    private String consumersDir;

    // --- RabbitMQ ---
    @Value("${mqworker.rabbitmq.host:localhost}")
    private String rabbitHost;

    @Value("${mqworker.rabbitmq.port:5672}")
    private int rabbitPort;

    @Value("${mqworker.rabbitmq.virtual-host:/}")
    private String rabbitVirtualHost;

    @Value("${mqworker.rabbitmq.username:guest}")
    private String rabbitUsername;

    @Value("${mqworker.rabbitmq.password:guest}")
    private String rabbitPassword;

    @Value("${mqworker.rabbitmq.connection-timeout-ms:10000}")
    private int rabbitConnectionTimeoutMs;

    @Value("${mqworker.rabbitmq.heartbeat-seconds:30}")
    private int rabbitHeartbeatSeconds;

    // --- Workers ---
    @Value("${mqworker.processing.threads:0}")
    private int processingThreads;

    @Value("${mqworker.supervisor.restart-delay-ms:0}")
    private long restartDelayMs;

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public ConsumerMetrics consumerMetrics(MeterRegistry meterRegistry) {
        return new ConsumerMetrics(meterRegistry);
    }

    @Bean
    public ConsumerPoolRegistry consumerPoolRegistry() {
        return new ConsumerPoolRegistry(consumersDir);
    }

    @Bean
    public RabbitMQChannelGateway channelGateway() {
        RabbitMQSettings settings = new RabbitMQSettings(rabbitHost, rabbitPort, rabbitVirtualHost,
                rabbitUsername, rabbitPassword, rabbitConnectionTimeoutMs, rabbitHeartbeatSeconds,
                "mqworker@" + hostname());
        log.info("RabbitMQ gateway targets {}:{} vhost '{}'", rabbitHost, rabbitPort, rabbitVirtualHost);
        return new RabbitMQChannelGateway(settings);
    }

    @Bean
    @DependsOn("workerPropertiesInitializer")
    public ConsumerEngine consumerEngine(RabbitMQChannelGateway channelGateway, ConsumerMetrics consumerMetrics) {
        return new ConsumerEngine(channelGateway, consumerMetrics,
                RestartPolicy.always(Duration.ofMillis(restartDelayMs)), processingThreads);
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            return "localhost";
        }
    }
}
