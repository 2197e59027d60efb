/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.messaging.rabbitmq;

import com.mqworker.common.exception.CommitException;
import com.mqworker.common.exception.RegistrationException;
import com.mqworker.messaging.core.BrokerChannel;
import com.mqworker.messaging.core.DeliveryListener;
import com.mqworker.messaging.core.DeliveryMeta;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * {@link BrokerChannel} over an AMQP 0-9-1 channel of the RabbitMQ Java client.
 * Consumers are always registered with manual acknowledgement.
 */
public class RabbitMQBrokerChannel implements BrokerChannel {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQBrokerChannel.class);

    private final Channel channel;
    private final String owner;
    private volatile ShutdownListener connectionListener;

    public RabbitMQBrokerChannel(Channel channel, String owner) {
        this.channel = channel;
        this.owner = owner;
    }

    @Override
    public void setPrefetch(int prefetchCount) {
        try {
            channel.basicQos(prefetchCount);
        } catch (IOException | ShutdownSignalException e) {
            throw new RegistrationException("basic.qos(" + prefetchCount + ") failed on " + describe(), e);
        }
    }

    @Override
    public String consume(String queueName, DeliveryListener listener) {
        try {
            return channel.basicConsume(queueName, false, new DefaultConsumer(channel) {
                @Override
                public void handleConsumeOk(String consumerTag) {
                    super.handleConsumeOk(consumerTag);
                    listener.onConsumeOk(consumerTag);
                }

                @Override
                public void handleDelivery(String consumerTag, Envelope envelope,
                                           AMQP.BasicProperties properties, byte[] body) {
                    listener.onDelivery(body, new DeliveryMeta(consumerTag, envelope.getDeliveryTag(),
                            envelope.isRedeliver(), envelope.getExchange(), envelope.getRoutingKey()));
                }

                @Override
                public void handleCancel(String consumerTag) {
                    log.warn("Consumer {} on queue '{}' was cancelled by the broker", consumerTag, queueName);
                }
            });
        } catch (IOException | ShutdownSignalException e) {
            throw new RegistrationException("basic.consume on queue '" + queueName + "' failed on " + describe(), e);
        }
    }

    @Override
    public void ack(long deliveryTag) {
        try {
            channel.basicAck(deliveryTag, false);
        } catch (IOException | ShutdownSignalException e) {
            throw new CommitException(deliveryTag, "basic.ack(" + deliveryTag + ") failed on " + describe(), e);
        }
    }

    @Override
    public void reject(long deliveryTag, boolean requeue) {
        try {
            channel.basicReject(deliveryTag, requeue);
        } catch (IOException | ShutdownSignalException e) {
            throw new CommitException(deliveryTag,
                    "basic.reject(" + deliveryTag + ", requeue=" + requeue + ") failed on " + describe(), e);
        }
    }

    @Override
    public void onConnectionTerminated(Consumer<Throwable> callback) {
        ShutdownListener listener = callback::accept;
        connectionListener = listener;
        channel.getConnection().addShutdownListener(listener);
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        // The connection is shared by every worker; its listener must go even if the channel is already closed.
        ShutdownListener listener = connectionListener;
        if (listener != null) {
            connectionListener = null;
            Connection connection = channel.getConnection();
            if (connection != null) connection.removeShutdownListener(listener);
        }
        if (!channel.isOpen()) return;
        try {
            channel.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.warn("Error closing channel {}", describe(), e);
        }
    }

    @Override
    public String describe() {
        Connection connection = channel.getConnection();
        String address = connection != null && connection.getAddress() != null
                ? connection.getAddress().getHostAddress() + ":" + connection.getPort()
                : "?";
        return owner + "@" + address + "#" + channel.getChannelNumber();
    }
}
