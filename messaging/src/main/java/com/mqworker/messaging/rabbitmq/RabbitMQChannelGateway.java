/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.messaging.rabbitmq;

import com.mqworker.common.exception.ChannelUnavailableException;
import com.mqworker.messaging.core.BrokerChannel;
import com.mqworker.messaging.core.ChannelGateway;
import com.mqworker.messaging.core.ConnectionState;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;

/**
 * Channel gateway over a single RabbitMQ connection.
 *
 * <p>The connection is opened lazily on the first channel request and re-opened
 * on the next request after it was lost. Each request opens a new channel on it.
 * Blocking client calls run on a dedicated I/O thread so that callers (actors)
 * never block.</p>
 */
public class RabbitMQChannelGateway implements ChannelGateway, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQChannelGateway.class);

    private final ConnectionFactory factory;
    private final String connectionName;
    private final ExecutorService ioExecutor;
    private volatile Connection connection;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    public RabbitMQChannelGateway(RabbitMQSettings settings) {
        this(settings.toConnectionFactory(), settings.connectionName());
        log.info("RabbitMQ channel gateway configured: {}", settings);
    }

    public RabbitMQChannelGateway(ConnectionFactory factory, String connectionName) {
        this.factory = factory;
        this.connectionName = connectionName;
        this.ioExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "gateway-io");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletionStage<BrokerChannel> requestChannel(String workerIdentity) {
        return CompletableFuture.supplyAsync(() -> openChannel(workerIdentity), ioExecutor);
    }

    BrokerChannel openChannel(String workerIdentity) {
        if (state == ConnectionState.CLOSING || state == ConnectionState.CLOSED) {
            throw new ChannelUnavailableException(workerIdentity, new IllegalStateException("gateway is closed"));
        }
        try {
            Channel channel = ensureConnection().createChannel();
            if (channel == null) {
                throw new ChannelUnavailableException(workerIdentity,
                        new IllegalStateException("channel limit reached on connection " + connectionName));
            }
            log.debug("Opened channel #{} for worker {}", channel.getChannelNumber(), workerIdentity);
            return new RabbitMQBrokerChannel(channel, workerIdentity);
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            state = ConnectionState.ERROR;
            throw new ChannelUnavailableException(workerIdentity, e);
        }
    }

    private Connection ensureConnection() throws IOException, TimeoutException {
        Connection current = connection;
        if (current != null && current.isOpen()) return current;

        state = ConnectionState.CONNECTING;
        Connection fresh = factory.newConnection(connectionName);
        fresh.addShutdownListener(cause -> {
            if (!cause.isInitiatedByApplication()) {
                log.error("RabbitMQ connection '{}' lost: {}", connectionName, cause.getMessage());
            }
            if (state == ConnectionState.CONNECTED) state = ConnectionState.DISCONNECTED;
        });
        connection = fresh;
        state = ConnectionState.CONNECTED;
        log.info("RabbitMQ gateway connected to {}:{}{}",
                factory.getHost(), factory.getPort(), factory.getVirtualHost());
        return fresh;
    }

    public ConnectionState getState() { return state; }

    @Override
    public synchronized void close() {
        if (state == ConnectionState.CLOSED) return;
        state = ConnectionState.CLOSING;
        ioExecutor.shutdownNow();
        Connection current = connection;
        if (current != null && current.isOpen()) {
            try {
                current.close();
            } catch (IOException | ShutdownSignalException e) {
                log.warn("Error closing RabbitMQ connection '{}'", connectionName, e);
            }
        }
        state = ConnectionState.CLOSED;
        log.info("RabbitMQ channel gateway closed");
    }
}
