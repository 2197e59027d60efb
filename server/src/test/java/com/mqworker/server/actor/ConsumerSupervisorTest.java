/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqworker.server.actor;

import com.mqworker.server.consumer.ConsumerSettings;
import com.mqworker.server.handler.Outcome;
import com.mqworker.server.metrics.ConsumerMetrics;
import com.mqworker.server.support.RecordingBrokerChannel;
import com.mqworker.server.support.ScriptedChannelGateway;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.pekko.actor.testkit.typed.javadsl.ActorTestKit;
import org.apache.pekko.actor.testkit.typed.javadsl.TestProbe;
import org.apache.pekko.actor.typed.ActorRef;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.mqworker.server.support.TestUtils.waitAtMost;
import static org.assertj.core.api.Assertions.assertThat;

class ConsumerSupervisorTest {

    private static final ActorTestKit testKit = ActorTestKit.create();
    private static final Duration WAIT = Duration.ofSeconds(3);

    private MeterRegistry registry;
    private ConsumerMetrics metrics;
    private ScriptedChannelGateway gateway;

    @AfterAll
    static void cleanup() {
        testKit.shutdownTestKit();
    }

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ConsumerMetrics(registry);
        gateway = new ScriptedChannelGateway().autoGrant();
    }

    private ActorRef<ConsumerSupervisor.Command> supervisor(RestartPolicy policy) {
        return testKit.spawn(ConsumerSupervisor.create(gateway, Runnable::run, metrics, policy));
    }

    private static ConsumerSettings settings(String pool) {
        return new ConsumerSettings(pool, (payload, meta) -> Outcome.success(), pool + ".in", 4,
                Duration.ofMillis(2750));
    }

    private List<ConsumerSupervisor.WorkerInfo> listWorkers(ActorRef<ConsumerSupervisor.Command> supervisor) {
        TestProbe<List<ConsumerSupervisor.WorkerInfo>> probe = testKit.createTestProbe();
        supervisor.tell(new ConsumerSupervisor.ListWorkers(probe.getRef()));
        return probe.receiveMessage(WAIT);
    }

    private RecordingBrokerChannel awaitRegistered(String workerIdentity) throws InterruptedException {
        waitAtMost(WAIT, () -> gateway.channelOf(workerIdentity) != null);
        RecordingBrokerChannel channel = gateway.channelOf(workerIdentity);
        waitAtMost(WAIT, channel::isConsuming);
        return channel;
    }

    @Test
    void startPoolSpawnsTheRequestedNumberOfWorkers() throws Exception {
        ActorRef<ConsumerSupervisor.Command> supervisor = supervisor(RestartPolicy.always());

        supervisor.tell(new ConsumerSupervisor.StartPool(settings("orders"), 3));

        List<ConsumerSupervisor.WorkerInfo> workers = listWorkers(supervisor);
        assertThat(workers).hasSize(3);
        assertThat(workers).extracting(ConsumerSupervisor.WorkerInfo::workerIdentity)
                .doesNotHaveDuplicates()
                .allMatch(identity -> identity.startsWith("orders-"));
        assertThat(workers).extracting(ConsumerSupervisor.WorkerInfo::queueName).containsOnly("orders.in");
        for (ConsumerSupervisor.WorkerInfo worker : workers) {
            assertThat(awaitRegistered(worker.workerIdentity()).calls())
                    .containsExactly("prefetch:4", "consume:orders.in");
        }
    }

    @Test
    void workerIsReplacedWithFreshIdentityAfterConnectionLoss() throws Exception {
        ActorRef<ConsumerSupervisor.Command> supervisor = supervisor(RestartPolicy.always());
        supervisor.tell(new ConsumerSupervisor.StartPool(settings("billing"), 1));
        ConsumerSupervisor.WorkerInfo original = listWorkers(supervisor).get(0);
        RecordingBrokerChannel channel = awaitRegistered(original.workerIdentity());

        TestProbe<Object> probe = testKit.createTestProbe();
        channel.terminateConnection(new RuntimeException("heartbeat missed"));
        probe.expectTerminated(original.ref(), WAIT);

        waitAtMost(WAIT, () -> {
            List<ConsumerSupervisor.WorkerInfo> workers = listWorkers(supervisor);
            return workers.size() == 1 && !workers.get(0).workerIdentity().equals(original.workerIdentity());
        });
        ConsumerSupervisor.WorkerInfo replacement = listWorkers(supervisor).get(0);
        assertThat(replacement.poolName()).isEqualTo("billing");
        assertThat(replacement.queueName()).isEqualTo("billing.in");
        assertThat(awaitRegistered(replacement.workerIdentity()).calls())
                .containsExactly("prefetch:4", "consume:billing.in");
        assertThat(registry.counter("mqworker.workers.restarts", "pool", "billing").count()).isEqualTo(1.0);
    }

    @Test
    void workerIsReplacedAfterRegistrationFailure() throws Exception {
        RecordingBrokerChannel broken = new RecordingBrokerChannel("broken")
                .failConsumeWith(new IllegalStateException("queue not found"));
        gateway.grant(broken);
        ActorRef<ConsumerSupervisor.Command> supervisor = supervisor(RestartPolicy.always());

        supervisor.tell(new ConsumerSupervisor.StartPool(settings("audit"), 1));

        String first = gateway.nextRequest(WAIT);
        String second = gateway.nextRequest(WAIT);
        assertThat(second).isNotNull().isNotEqualTo(first).startsWith("audit-");
        awaitRegistered(second);
        assertThat(listWorkers(supervisor)).extracting(ConsumerSupervisor.WorkerInfo::workerIdentity)
                .containsExactly(second);
    }

    @Test
    void policyCanDeclineRestart() throws Exception {
        ActorRef<ConsumerSupervisor.Command> supervisor = supervisor((identity, cause) -> false);
        supervisor.tell(new ConsumerSupervisor.StartPool(settings("reports"), 1));
        ConsumerSupervisor.WorkerInfo worker = listWorkers(supervisor).get(0);
        RecordingBrokerChannel channel = awaitRegistered(worker.workerIdentity());

        TestProbe<Object> probe = testKit.createTestProbe();
        channel.terminateConnection(new RuntimeException("broker restarted"));
        probe.expectTerminated(worker.ref(), WAIT);

        waitAtMost(WAIT, () -> listWorkers(supervisor).isEmpty());
        assertThat(gateway.requestCount()).isEqualTo(1);
    }

    @Test
    void delayedRestartPolicyStillReplacesWorker() throws Exception {
        ActorRef<ConsumerSupervisor.Command> supervisor = supervisor(RestartPolicy.always(Duration.ofMillis(100)));
        supervisor.tell(new ConsumerSupervisor.StartPool(settings("delayed"), 1));
        ConsumerSupervisor.WorkerInfo original = listWorkers(supervisor).get(0);
        RecordingBrokerChannel channel = awaitRegistered(original.workerIdentity());

        channel.terminateConnection(new RuntimeException("gone"));

        waitAtMost(WAIT, () -> gateway.requestCount() == 2);
        waitAtMost(WAIT, () -> listWorkers(supervisor).size() == 1);
    }
}
