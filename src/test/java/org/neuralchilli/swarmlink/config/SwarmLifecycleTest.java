package org.neuralchilli.swarmlink.config;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.swarmlink.core.SwarmCoordinator;
import org.neuralchilli.swarmlink.worker.TaskHandlerRegistry;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@QuarkusTest
class SwarmLifecycleTest {

    @Inject
    SwarmSettings settings;

    @Inject
    TaskHandlerRegistry handlers;

    @Inject
    SwarmCoordinator coordinator;

    @Test
    void shouldBindSettingsFromConfig() {
        assertThat(settings.nodeId()).isEqualTo("lifecycle-test-node");
        assertThat(settings.capabilities()).containsExactly("echo");
        assertThat(settings.heartbeatInterval()).isEqualTo(Duration.ofMillis(200));
        assertThat(settings.nodeTimeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(settings.maxConcurrentTasks()).isEqualTo(3);
        assertThat(settings.clusterName()).isEqualTo("swarm-lifecycle-test");
        assertThat(settings.storeMode()).isEqualTo(StoreMode.EMBEDDED);
    }

    @Test
    void shouldCollectHandlerBeans() {
        assertThat(handlers.taskTypes()).containsExactly("echo");
    }

    @Test
    void shouldJoinSwarmOnStartup() {
        assertThat(coordinator.isAvailable()).isTrue();
        assertThat(coordinator.nodeId()).isEqualTo("lifecycle-test-node");

        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(coordinator.metrics().getReport().heartbeatTicks()).isPositive());
        assertThat(coordinator.syncState("lifecycle", Map.of("ready", true))).containsEntry("ready", true);
    }
}
