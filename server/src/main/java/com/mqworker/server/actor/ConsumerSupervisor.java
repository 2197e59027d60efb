/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.actor;

import com.mqworker.common.exception.ConnectionLostException;
import com.mqworker.common.util.WorkerNames;
import com.mqworker.messaging.core.ChannelGateway;
import com.mqworker.server.consumer.ConsumerSettings;
import com.mqworker.server.consumer.DeliveryProcessor;
import com.mqworker.server.metrics.ConsumerMetrics;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.ChildFailed;
import org.apache.pekko.actor.typed.Terminated;
import org.apache.pekko.actor.typed.javadsl.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.Executor;

/**
 * Top-level Pekko actor that owns every queue worker.
 * Spawns {@link ConsumerActor} children per pool, keeps an explicit registry of
 * worker identity → actor, and replaces terminated workers according to its
 * {@link RestartPolicy}. Replacements get the same settings and a new identity.
 */
public class ConsumerSupervisor extends AbstractBehavior<ConsumerSupervisor.Command> {

    private static final Logger log = LoggerFactory.getLogger(ConsumerSupervisor.class);

    public sealed interface Command {}
    public record StartPool(ConsumerSettings settings, int workerCount) implements Command {}
    public record ListWorkers(ActorRef<List<WorkerInfo>> replyTo) implements Command {}
    private record RestartWorker(ConsumerSettings settings) implements Command {}

    /** Registry entry for one live worker. */
    public record WorkerInfo(String workerIdentity, String poolName, String queueName,
                             ActorRef<ConsumerActor.Command> ref) {}

    private final TimerScheduler<Command> timers;
    private final ChannelGateway gateway;
    private final DeliveryProcessor processor;
    private final Executor processingExecutor;
    private final ConsumerMetrics metrics;
    private final RestartPolicy restartPolicy;
    private final Map<ActorRef<ConsumerActor.Command>, WorkerEntry> workers = new HashMap<>();
    private final Map<String, ActorRef<ConsumerActor.Command>> registry = new LinkedHashMap<>();

    private record WorkerEntry(String workerIdentity, ConsumerSettings settings) {}

    private ConsumerSupervisor(ActorContext<Command> context, TimerScheduler<Command> timers, ChannelGateway gateway,
                               Executor processingExecutor, ConsumerMetrics metrics, RestartPolicy restartPolicy) {
        super(context);
        this.timers = timers;
        this.gateway = gateway;
        this.processingExecutor = processingExecutor;
        this.metrics = metrics;
        this.processor = new DeliveryProcessor(metrics);
        this.restartPolicy = restartPolicy;
        log.info("ConsumerSupervisor started (restart policy: {})", restartPolicy);
    }

    public static Behavior<Command> create(ChannelGateway gateway, Executor processingExecutor,
                                           ConsumerMetrics metrics, RestartPolicy restartPolicy) {
        return Behaviors.setup(ctx -> Behaviors.withTimers(timers ->
                new ConsumerSupervisor(ctx, timers, gateway, processingExecutor, metrics, restartPolicy)));
    }

    @Override
    public Receive<Command> createReceive() {
        return newReceiveBuilder()
                .onMessage(StartPool.class, this::onStartPool)
                .onMessage(ListWorkers.class, this::onListWorkers)
                .onMessage(RestartWorker.class, msg -> {
                    spawnWorker(msg.settings());
                    return this;
                })
                .onSignal(ChildFailed.class, signal -> onWorkerTerminated(signal.getRef(), signal.getCause()))
                .onSignal(Terminated.class, signal -> onWorkerTerminated(signal.getRef(), null))
                .build();
    }

    private Behavior<Command> onStartPool(StartPool cmd) {
        ConsumerSettings settings = cmd.settings();
        log.info("Starting pool '{}' with {} worker(s) on queue '{}'",
                settings.poolName(), cmd.workerCount(), settings.queueName());
        for (int i = 0; i < cmd.workerCount(); i++) {
            spawnWorker(settings);
        }
        return this;
    }

    private Behavior<Command> onListWorkers(ListWorkers cmd) {
        List<WorkerInfo> snapshot = new ArrayList<>();
        registry.forEach((identity, ref) -> {
            ConsumerSettings settings = workers.get(ref).settings();
            snapshot.add(new WorkerInfo(identity, settings.poolName(), settings.queueName(), ref));
        });
        cmd.replyTo().tell(List.copyOf(snapshot));
        return this;
    }

    private Behavior<Command> onWorkerTerminated(ActorRef<Void> ref, Throwable cause) {
        WorkerEntry entry = workers.remove(ref);
        if (entry == null) return this;
        registry.remove(entry.workerIdentity());

        if (cause instanceof ConnectionLostException) {
            log.warn("Worker {} terminated: connection lost", entry.workerIdentity());
        } else if (cause != null) {
            log.error("Worker {} crashed: {}", entry.workerIdentity(), cause.toString());
        } else {
            log.info("Worker {} stopped", entry.workerIdentity());
        }

        if (!restartPolicy.shouldRestart(entry.workerIdentity(), cause)) {
            log.info("Worker {} of pool '{}' will not be restarted", entry.workerIdentity(),
                    entry.settings().poolName());
            return this;
        }
        metrics.workerRestarted(entry.settings().poolName());
        if (restartPolicy.restartDelay().isZero()) {
            spawnWorker(entry.settings());
        } else {
            timers.startSingleTimer(new RestartWorker(entry.settings()), restartPolicy.restartDelay());
        }
        return this;
    }

    private void spawnWorker(ConsumerSettings settings) {
        String workerIdentity = WorkerNames.uniqueWorkerName(settings.poolName());
        ActorRef<ConsumerActor.Command> ref = getContext().spawn(
                ConsumerActor.create(workerIdentity, settings, gateway, processor, processingExecutor, metrics),
                workerIdentity);
        getContext().watch(ref);
        workers.put(ref, new WorkerEntry(workerIdentity, settings));
        registry.put(workerIdentity, ref);
        log.debug("Spawned worker {} for pool '{}'", workerIdentity, settings.poolName());
    }
}
