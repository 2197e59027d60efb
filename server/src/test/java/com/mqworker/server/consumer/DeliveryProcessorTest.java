/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.server.consumer;

import com.mqworker.messaging.core.DeliveryMeta;
import com.mqworker.server.handler.MessageHandler;
import com.mqworker.server.handler.Outcome;
import com.mqworker.server.metrics.ConsumerMetrics;
import com.mqworker.server.support.RecordingBrokerChannel;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeliveryProcessorTest {

    private static final byte[] PAYLOAD = "{\"id\":42}".getBytes(StandardCharsets.UTF_8);

    private MeterRegistry registry;
    private DeliveryProcessor processor;
    private RecordingBrokerChannel channel;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        processor = new DeliveryProcessor(new ConsumerMetrics(registry));
        channel = new RecordingBrokerChannel("orders-1");
    }

    private CommitAction run(MessageHandler handler, long tag, boolean redelivered) {
        return processor.process("orders-1", handler, channel, PAYLOAD, new DeliveryMeta("ctag", tag, redelivered));
    }

    private double committed(String action) {
        return registry.counter("mqworker.messages.committed", "action", action).count();
    }

    @Test
    void successfulMessageIsAcknowledgedWithItsOwnTag() {
        CommitAction action = run((payload, meta) -> Outcome.success(), 1, false);

        assertThat(action).isEqualTo(new CommitAction.Ack(1));
        assertThat(channel.calls()).containsExactly("ack:1");
        assertThat(committed("ack")).isEqualTo(1.0);
    }

    @Test
    void crashingHandlerOnFirstDeliveryIsRequeued() {
        run((payload, meta) -> { throw new IllegalStateException("boom"); }, 5, false);

        assertThat(channel.calls()).containsExactly("reject:5:true");
        assertThat(registry.counter("mqworker.handler.errors").count()).isEqualTo(1.0);
        assertThat(committed("requeue")).isEqualTo(1.0);
    }

    @Test
    void crashingHandlerOnRedeliveryIsDiscarded() {
        run((payload, meta) -> { throw new Exception("boom again"); }, 5, true);

        assertThat(channel.calls()).containsExactly("reject:5:false");
        assertThat(committed("discard")).isEqualTo(1.0);
    }

    @Test
    void handlerErrorIsTreatedAsRetryOnce() {
        CommitAction action = run((payload, meta) -> { throw new AssertionError("boom"); }, 5, false);

        assertThat(action).isEqualTo(new CommitAction.Reject(5, true));
        assertThat(channel.calls()).containsExactly("reject:5:true");
        assertThat(registry.counter("mqworker.handler.errors").count()).isEqualTo(1.0);
    }

    @Test
    void virtualMachineErrorIsRethrownAfterSettlement() {
        assertThatThrownBy(() -> run((payload, meta) -> { throw new StackOverflowError(); }, 6, true))
                .isInstanceOf(StackOverflowError.class);

        assertThat(channel.calls()).containsExactly("reject:6:false");
        assertThat(committed("discard")).isEqualTo(1.0);
    }

    @Test
    void otherOutcomeIsDiscardedWithoutRequeue() {
        run((payload, meta) -> Outcome.other("bad_input"), 9, false);

        assertThat(channel.calls()).containsExactly("reject:9:false");
    }

    @Test
    void nullOutcomeIsDiscarded() {
        run((payload, meta) -> null, 12, false);

        assertThat(channel.calls()).containsExactly("reject:12:false");
    }

    @Test
    void handlerSeesPayloadAndMetadata() {
        run((payload, meta) -> {
            assertThat(new String(payload, StandardCharsets.UTF_8)).isEqualTo("{\"id\":42}");
            assertThat(meta.deliveryTag()).isEqualTo(7);
            assertThat(meta.redelivered()).isTrue();
            return Outcome.success();
        }, 7, true);

        assertThat(channel.calls()).containsExactly("ack:7");
        assertThat(registry.timer("mqworker.handler.duration").count()).isEqualTo(1);
    }

    @Test
    void commitOnDeadChannelIsCountedNotThrown() {
        channel.terminateConnection(new RuntimeException("connection reset"));

        CommitAction action = run((payload, meta) -> Outcome.success(), 3, false);

        assertThat(action).isEqualTo(new CommitAction.Ack(3));
        assertThat(channel.calls()).containsExactly("ack:3");
        assertThat(registry.counter("mqworker.commit.failures").count()).isEqualTo(1.0);
        assertThat(committed("ack")).isZero();
    }
}
