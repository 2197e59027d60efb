/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.messaging.rabbitmq;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mqworker.common.exception.ChannelUnavailableException;
import com.mqworker.messaging.core.BrokerChannel;
import com.mqworker.messaging.core.ConnectionState;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RabbitMQChannelGatewayTest {

    @Mock ConnectionFactory factory;
    @Mock Connection connection;
    @Mock Channel channel;

    private RabbitMQChannelGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new RabbitMQChannelGateway(factory, "mqworker-test");
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    void requestChannelShouldOpenConnectionOnceAndAChannelPerRequest() throws Exception {
        when(factory.newConnection("mqworker-test")).thenReturn(connection);
        when(connection.isOpen()).thenReturn(true);
        when(connection.createChannel()).thenReturn(channel);

        BrokerChannel first = gateway.requestChannel("orders-1").toCompletableFuture().get(5, TimeUnit.SECONDS);
        BrokerChannel second = gateway.requestChannel("orders-2").toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertThat(first).isInstanceOf(RabbitMQBrokerChannel.class);
        assertThat(second).isNotSameAs(first);
        verify(factory, times(1)).newConnection("mqworker-test");
        verify(connection, times(2)).createChannel();
        assertThat(gateway.getState()).isEqualTo(ConnectionState.CONNECTED);
    }

    @Test
    void requestChannelShouldFailWithChannelUnavailableWhenBrokerIsDown() throws Exception {
        when(factory.newConnection("mqworker-test")).thenThrow(new ConnectException("Connection refused"));

        assertThatThrownBy(() -> gateway.requestChannel("orders-1").toCompletableFuture().get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ChannelUnavailableException.class);
        assertThat(gateway.getState()).isEqualTo(ConnectionState.ERROR);
    }

    @Test
    void requestChannelShouldReconnectAfterConnectionWasLost() throws Exception {
        Connection replacement = org.mockito.Mockito.mock(Connection.class);
        when(factory.newConnection("mqworker-test")).thenReturn(connection, replacement);
        when(connection.isOpen()).thenReturn(false);
        when(connection.createChannel()).thenReturn(channel);
        when(replacement.createChannel()).thenReturn(channel);

        gateway.openChannel("orders-1");
        gateway.openChannel("orders-1");

        verify(factory, times(2)).newConnection("mqworker-test");
        verify(replacement).createChannel();
    }

    @Test
    void requestChannelShouldFailWhenChannelLimitIsReached() throws Exception {
        when(factory.newConnection("mqworker-test")).thenReturn(connection);
        when(connection.createChannel()).thenReturn(null);

        assertThatThrownBy(() -> gateway.openChannel("orders-1"))
                .isInstanceOf(ChannelUnavailableException.class)
                .hasMessageContaining("channel limit");
    }

    @Test
    void closedGatewayShouldRefuseChannels() throws IOException {
        gateway.close();

        assertThatThrownBy(() -> gateway.openChannel("orders-1"))
                .isInstanceOf(ChannelUnavailableException.class);
        assertThat(gateway.getState()).isEqualTo(ConnectionState.CLOSED);
    }
}
