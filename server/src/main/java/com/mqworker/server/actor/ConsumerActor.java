/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.actor;

import com.mqworker.common.exception.ConnectionLostException;
import com.mqworker.messaging.core.BrokerChannel;
import com.mqworker.messaging.core.ChannelGateway;
import com.mqworker.messaging.core.DeliveryListener;
import com.mqworker.messaging.core.DeliveryMeta;
import com.mqworker.server.consumer.ConsumerPhase;
import com.mqworker.server.consumer.ConsumerSettings;
import com.mqworker.server.consumer.ConsumerState;
import com.mqworker.server.consumer.ConsumerStatus;
import com.mqworker.server.consumer.DeliveryProcessor;
import com.mqworker.server.handler.MessageHandler;
import com.mqworker.server.metrics.ConsumerMetrics;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.javadsl.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Pekko typed actor that owns one queue subscription:
 *   1. Requests a channel from the {@link ChannelGateway}, retrying after a fixed delay on failure
 *   2. Watches the channel's connection and sets prefetch, then registers as consumer
 *   3. Hands every delivery to a processing task that runs the handler and settles the message
 *   4. Fails with {@link ConnectionLostException} as soon as the connection dies
 *
 * Registration errors also fail the actor. Recovery is always a fresh instance
 * started by {@link ConsumerSupervisor}; a channel is never repaired in place.
 */
public class ConsumerActor extends AbstractBehavior<ConsumerActor.Command> {

    private static final Logger log = LoggerFactory.getLogger(ConsumerActor.class);
    private static final String RETRY_TIMER_KEY = "request-channel";

    public sealed interface Command {}
    private record RequestChannel() implements Command {}
    private record ChannelGranted(BrokerChannel channel) implements Command {}
    private record ChannelRequestFailed(Throwable cause) implements Command {}
    private record RegisterConsumer() implements Command {}
    private record ConsumeOk(String consumerTag) implements Command {}
    private record Deliver(byte[] payload, DeliveryMeta meta) implements Command {}
    private record ConnectionLost(Throwable reason) implements Command {}
    public record GetStatus(ActorRef<ConsumerStatus> replyTo) implements Command {}

    private final TimerScheduler<Command> timers;
    private final ConsumerState state;
    private final ChannelGateway gateway;
    private final DeliveryProcessor processor;
    private final Executor processingExecutor;
    private final ConsumerMetrics metrics;

    private ConsumerActor(ActorContext<Command> context, TimerScheduler<Command> timers, String workerIdentity,
                          ConsumerSettings settings, ChannelGateway gateway, DeliveryProcessor processor,
                          Executor processingExecutor, ConsumerMetrics metrics) {
        super(context);
        this.timers = timers;
        this.state = new ConsumerState(workerIdentity, settings);
        this.gateway = gateway;
        this.processor = processor;
        this.processingExecutor = processingExecutor;
        this.metrics = metrics;
        log.info("[{}] Starting consumer on queue '{}' (prefetch={})",
                workerIdentity, settings.queueName(), settings.prefetchCount());
        context.getSelf().tell(new RequestChannel());
    }

    public static Behavior<Command> create(String workerIdentity, ConsumerSettings settings, ChannelGateway gateway,
                                           DeliveryProcessor processor, Executor processingExecutor,
                                           ConsumerMetrics metrics) {
        return Behaviors.setup(ctx -> Behaviors.withTimers(timers -> new ConsumerActor(
                ctx, timers, workerIdentity, settings, gateway, processor, processingExecutor, metrics)));
    }

    @Override
    public Receive<Command> createReceive() {
        return newReceiveBuilder()
                .onMessage(RequestChannel.class, this::onRequestChannel)
                .onMessage(ChannelGranted.class, this::onChannelGranted)
                .onMessage(ChannelRequestFailed.class, this::onChannelRequestFailed)
                .onMessage(RegisterConsumer.class, this::onRegisterConsumer)
                .onMessage(ConsumeOk.class, this::onConsumeOk)
                .onMessage(Deliver.class, this::onDeliver)
                .onMessage(ConnectionLost.class, this::onConnectionLost)
                .onMessage(GetStatus.class, this::onGetStatus)
                .onSignal(PostStop.class, signal -> onPostStop())
                .build();
    }

    // ─── Channel acquisition ────────────────────────────────────────

    private Behavior<Command> onRequestChannel(RequestChannel cmd) {
        if (state.hasChannel()) {
            log.debug("[{}] Channel already acquired, ignoring request", state.workerIdentity());
            return this;
        }
        state.setPhase(ConsumerPhase.REQUESTING_CHANNEL);
        CompletionStage<BrokerChannel> request;
        try {
            request = gateway.requestChannel(state.workerIdentity());
        } catch (RuntimeException e) {
            getContext().getSelf().tell(new ChannelRequestFailed(e));
            return this;
        }
        getContext().pipeToSelf(request, (channel, error) -> {
            if (error != null) return new ChannelRequestFailed(unwrap(error));
            if (channel == null) return new ChannelRequestFailed(new IllegalStateException("gateway granted no channel"));
            return new ChannelGranted(channel);
        });
        return this;
    }

    private Behavior<Command> onChannelRequestFailed(ChannelRequestFailed msg) {
        metrics.channelRequestFailed();
        log.error("[{}] Cannot retrieve channel due to {}, retrying in {}ms.",
                state.workerIdentity(), msg.cause(), state.settings().retryChannelAfter().toMillis());
        timers.startSingleTimer(RETRY_TIMER_KEY, new RequestChannel(), state.settings().retryChannelAfter());
        return this;
    }

    private Behavior<Command> onChannelGranted(ChannelGranted msg) {
        BrokerChannel channel = msg.channel();
        state.setChannel(channel);
        ActorRef<Command> self = getContext().getSelf();
        // Fires immediately if the connection is already gone, ahead of registration.
        channel.onConnectionTerminated(reason -> self.tell(new ConnectionLost(reason)));
        state.setPhase(ConsumerPhase.REGISTERING);
        self.tell(new RegisterConsumer());
        log.debug("[{}] Channel acquired: {}", state.workerIdentity(), channel.describe());
        return this;
    }

    // ─── Registration ───────────────────────────────────────────────

    private Behavior<Command> onRegisterConsumer(RegisterConsumer cmd) {
        // Failures propagate and stop this instance; the supervisor starts a clean one.
        BrokerChannel channel = state.channel();
        ConsumerSettings settings = state.settings();
        channel.setPrefetch(settings.prefetchCount());
        String consumerTag = channel.consume(settings.queueName(), new ActorDeliveryListener(getContext().getSelf()));
        state.setConsumerTag(consumerTag);
        log.debug("[{}] Consume requested on '{}', broker returned tag {}",
                state.workerIdentity(), settings.queueName(), consumerTag);
        return this;
    }

    private Behavior<Command> onConsumeOk(ConsumeOk msg) {
        state.setPhase(ConsumerPhase.CONSUMING);
        log.info("[{}] Consumer successfully registered as {}.", state.workerIdentity(), msg.consumerTag());
        return this;
    }

    // ─── Message flow ───────────────────────────────────────────────

    private Behavior<Command> onDeliver(Deliver msg) {
        String workerIdentity = state.workerIdentity();
        MessageHandler handler = state.settings().handler();
        BrokerChannel channel = state.channel();
        processingExecutor.execute(() ->
                processor.process(workerIdentity, handler, channel, msg.payload(), msg.meta()));
        return this;
    }

    // ─── Termination ────────────────────────────────────────────────

    private Behavior<Command> onConnectionLost(ConnectionLost msg) {
        log.error("[{}] Connection lost due to {}.", state.workerIdentity(), msg.reason());
        throw new ConnectionLostException(state.workerIdentity(), msg.reason());
    }

    private Behavior<Command> onGetStatus(GetStatus msg) {
        msg.replyTo().tell(state.snapshot());
        return this;
    }

    private Behavior<Command> onPostStop() {
        BrokerChannel channel = state.channel();
        if (channel != null) channel.close();
        log.info("[{}] Consumer stopped", state.workerIdentity());
        return this;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /** Bridges broker client callbacks into actor messages. */
    private static final class ActorDeliveryListener implements DeliveryListener {
        private final ActorRef<Command> self;

        ActorDeliveryListener(ActorRef<Command> self) {
            this.self = self;
        }

        @Override
        public void onConsumeOk(String consumerTag) {
            self.tell(new ConsumeOk(consumerTag));
        }

        @Override
        public void onDelivery(byte[] payload, DeliveryMeta meta) {
            self.tell(new Deliver(payload, meta));
        }
    }
}
