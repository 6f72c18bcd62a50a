package org.neuralchilli.swarmlink.core;

import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.swarmlink.config.HazelcastConfig;
import org.neuralchilli.swarmlink.domain.NodeStatus;
import org.neuralchilli.swarmlink.domain.SwarmNode;
import org.neuralchilli.swarmlink.domain.SwarmTask;
import org.neuralchilli.swarmlink.monitoring.SwarmMetrics;
import org.neuralchilli.swarmlink.worker.ExecutionSupervisor;
import org.neuralchilli.swarmlink.worker.TaskHandler;
import org.neuralchilli.swarmlink.worker.TaskHandlerRegistry;
import org.neuralchilli.swarmlink.worker.TaskProcessor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class HeartbeatServiceTest {

    private static HazelcastInstance hazelcast;

    private SwarmMetrics metrics;
    private NodeDirectory directory;
    private TaskStatusStore statusStore;
    private ExecutionSupervisor supervisor;
    private HeartbeatService heartbeat;

    @BeforeAll
    static void setupClass() {
        hazelcast = Hazelcast.newHazelcastInstance(HazelcastConfig.memberConfig(
                "test-heartbeat-" + System.currentTimeMillis(), List.of()));
    }

    @AfterAll
    static void teardownClass() {
        if (hazelcast != null) {
            hazelcast.shutdown();
        }
    }

    @BeforeEach
    void setup() {
        hazelcast.getMap(SwarmKeys.NODES).clear();
        hazelcast.getMap(SwarmKeys.TASK_STATUS).clear();
        hazelcast.getQueue(SwarmKeys.taskQueue("echo")).clear();
        metrics = new SwarmMetrics();
        directory = new NodeDirectory(hazelcast);
        statusStore = new TaskStatusStore(hazelcast, metrics, Duration.ofHours(1));
    }

    @AfterEach
    void teardown() {
        if (heartbeat != null) {
            heartbeat.stop();
        }
        if (supervisor != null) {
            supervisor.drain(Duration.ofSeconds(2));
        }
    }

    private HeartbeatService heartbeat(NodeDirectory nodes, int maxConcurrent, TaskHandler handler, Duration interval) {
        supervisor = new ExecutionSupervisor("node-a", maxConcurrent);
        TaskProcessor processor = new TaskProcessor(hazelcast, "node-a", Set.of("echo"), maxConcurrent,
                TaskHandlerRegistry.of(handler), statusStore, supervisor, metrics);
        heartbeat = new HeartbeatService(
                SwarmNode.create("node-a", "http://a:8001", Set.of("echo")),
                nodes, processor, metrics,
                interval, Duration.ofSeconds(90), Duration.ofMillis(100));
        return heartbeat;
    }

    private SwarmTask enqueueEcho() {
        SwarmTask task = SwarmTask.builder("echo", "requester").build();
        statusStore.initialize(task);
        hazelcast.<SwarmTask>getQueue(SwarmKeys.taskQueue("echo")).offer(task);
        return task;
    }

    @Test
    void shouldRegisterOnStart() {
        heartbeat(directory, 3, TaskHandler.of("echo", task -> Map.of()), Duration.ofSeconds(30)).start();

        assertThat(heartbeat.isRunning()).isTrue();
        assertThat(directory.get("node-a")).hasValueSatisfying(node -> {
            assertThat(node.status()).isEqualTo(NodeStatus.ACTIVE);
            assertThat(node.instanceUrl()).isEqualTo("http://a:8001");
        });
    }

    @Test
    void shouldRefreshSweepAndDrainInOneTick() throws Exception {
        // Given
        HeartbeatService service = heartbeat(directory, 3, TaskHandler.of("echo", task -> Map.of()), Duration.ofSeconds(30));
        service.start();
        Instant registeredAt = directory.get("node-a").orElseThrow().lastHeartbeat();
        directory.register(new SwarmNode("dead-peer", null, Set.of("echo"), 0.0,
                Instant.now().minusSeconds(300), NodeStatus.ACTIVE));
        SwarmTask task = enqueueEcho();
        Thread.sleep(5);

        // When
        service.tick();

        // Then
        assertThat(directory.get("node-a").orElseThrow().lastHeartbeat()).isAfter(registeredAt);
        assertThat(directory.get("dead-peer")).isEmpty();
        assertThat(metrics.getReport().nodesEvicted()).isEqualTo(1);
        assertThat(metrics.getReport().tasksClaimed()).isEqualTo(1);
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(statusStore.get(task.taskId()).orElseThrow().assignedTo()).isEqualTo("node-a"));
    }

    @Test
    void shouldPublishBusyWhenBudgetExhausted() {
        CountDownLatch release = new CountDownLatch(1);
        HeartbeatService service = heartbeat(directory, 1, TaskHandler.of("echo", task -> {
            release.await(10, TimeUnit.SECONDS);
            return Map.of();
        }), Duration.ofSeconds(30));
        service.start();
        enqueueEcho();

        service.tick();
        service.tick();

        SwarmNode published = directory.get("node-a").orElseThrow();
        assertThat(published.status()).isEqualTo(NodeStatus.BUSY);
        assertThat(published.loadFactor()).isEqualTo(1.0);
        release.countDown();
    }

    @Test
    void shouldReRegisterAfterBeingSwept() {
        HeartbeatService service = heartbeat(directory, 3, TaskHandler.of("echo", task -> Map.of()), Duration.ofSeconds(30));
        service.start();

        directory.unregister("node-a");
        service.tick();

        assertThat(directory.get("node-a")).isPresent();
    }

    @Test
    void shouldTickPeriodically() {
        heartbeat(directory, 3, TaskHandler.of("echo", task -> Map.of()), Duration.ofMillis(50)).start();

        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(metrics.getReport().heartbeatTicks()).isGreaterThanOrEqualTo(3));
    }

    @Test
    void shouldKeepLoopingAfterFailedTicks() {
        // Given: a store that fails the first two refreshes
        AtomicInteger failures = new AtomicInteger();
        NodeDirectory flaky = new NodeDirectory(hazelcast) {
            @Override
            public void refresh(SwarmNode node) {
                if (failures.getAndIncrement() < 2) {
                    throw new SwarmException("store unreachable");
                }
                super.refresh(node);
            }
        };

        // When
        heartbeat(flaky, 3, TaskHandler.of("echo", task -> Map.of()), Duration.ofMillis(50)).start();

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            assertThat(metrics.getReport().heartbeatFailures()).isEqualTo(2);
            assertThat(metrics.getReport().heartbeatTicks()).isGreaterThanOrEqualTo(1);
        });
    }

    @Test
    void shouldStopLoop() throws Exception {
        HeartbeatService service = heartbeat(directory, 3, TaskHandler.of("echo", task -> Map.of()), Duration.ofMillis(50));
        service.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> metrics.getReport().heartbeatTicks() >= 1);

        service.stop();
        long ticks = metrics.getReport().heartbeatTicks();
        Thread.sleep(200);

        assertThat(service.isRunning()).isFalse();
        assertThat(metrics.getReport().heartbeatTicks()).isEqualTo(ticks);
    }

    @Test
    void shouldMarkOffline() {
        HeartbeatService service = heartbeat(directory, 3, TaskHandler.of("echo", task -> Map.of()), Duration.ofSeconds(30));
        service.start();

        service.markOffline();

        assertThat(directory.get("node-a").orElseThrow().status()).isEqualTo(NodeStatus.OFFLINE);
        assertThat(service.self().status()).isEqualTo(NodeStatus.OFFLINE);
    }
}
