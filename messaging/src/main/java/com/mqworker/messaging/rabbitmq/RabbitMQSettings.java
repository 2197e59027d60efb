/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.messaging.rabbitmq;

import com.rabbitmq.client.ConnectionFactory;

/**
 * Connection settings for {@link RabbitMQChannelGateway}.
 */
public record RabbitMQSettings(
        String host,
        int port,
        String virtualHost,
        String username,
        String password,
        int connectionTimeoutMs,
        int heartbeatSeconds,
        String connectionName
) {

    public static RabbitMQSettings defaults() {
        return new RabbitMQSettings("localhost", 5672, "/", "guest", "guest", 30000, 60, "mqworker");
    }

    /**
     * Automatic recovery is disabled: a lost connection has to terminate the
     * workers using it, and they re-acquire channels on a fresh connection.
     */
    public ConnectionFactory toConnectionFactory() {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(host);
        factory.setPort(port);
        factory.setVirtualHost(virtualHost);
        factory.setUsername(username);
        factory.setPassword(password);
        factory.setConnectionTimeout(connectionTimeoutMs);
        factory.setRequestedHeartbeat(heartbeatSeconds);
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        return factory;
    }

    @Override
    public String toString() {
        return "RabbitMQSettings{" + username + "@" + host + ":" + port + virtualHost + "}";
    }
}
