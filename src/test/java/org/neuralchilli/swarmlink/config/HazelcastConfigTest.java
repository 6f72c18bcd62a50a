package org.neuralchilli.swarmlink.config;

import com.hazelcast.client.config.ClientConfig;
import com.hazelcast.config.Config;
import com.hazelcast.core.HazelcastInstance;
import org.junit.jupiter.api.Test;
import org.neuralchilli.swarmlink.serializer.SwarmTaskSerializer;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HazelcastConfigTest {

    @Test
    void shouldBuildIsolatedMemberConfig() {
        Config config = HazelcastConfig.memberConfig("test-isolated", List.of());

        assertThat(config.getClusterName()).isEqualTo("test-isolated");
        assertThat(config.getNetworkConfig().getJoin().getMulticastConfig().isEnabled()).isFalse();
        assertThat(config.getNetworkConfig().getJoin().getTcpIpConfig().isEnabled()).isFalse();
        assertThat(config.getSerializationConfig().getSerializerConfigs())
                .anySatisfy(serializer -> assertThat(serializer.getImplementation())
                        .isInstanceOf(SwarmTaskSerializer.class));
    }

    @Test
    void shouldJoinListedMembers() {
        Config config = HazelcastConfig.memberConfig("test-join", List.of("10.0.0.1:5701", "10.0.0.2"));

        assertThat(config.getNetworkConfig().getJoin().getTcpIpConfig().isEnabled()).isTrue();
        assertThat(config.getNetworkConfig().getJoin().getTcpIpConfig().getMembers())
                .containsExactly("10.0.0.1:5701", "10.0.0.2");
    }

    @Test
    void shouldBuildClientConfig() {
        SwarmSettings settings = SwarmSettings.builder()
                .storeMode(StoreMode.CLIENT)
                .clusterName("prod-swarm")
                .storeAddresses(List.of("store-1:5701", "store-2:5701"))
                .connectTimeout(Duration.ofSeconds(3))
                .build();

        ClientConfig config = HazelcastConfig.clientConfig(settings);

        assertThat(config.getClusterName()).isEqualTo("prod-swarm");
        assertThat(config.getNetworkConfig().getAddresses()).containsExactly("store-1:5701", "store-2:5701");
        assertThat(config.getConnectionStrategyConfig().getConnectionRetryConfig().getClusterConnectTimeoutMillis())
                .isEqualTo(3000);
    }

    @Test
    void shouldStartEmbeddedMember() {
        SwarmSettings settings = SwarmSettings.builder()
                .clusterName("test-embedded-" + System.currentTimeMillis())
                .storeAddresses(List.of())
                .build();

        HazelcastConfig connector = new HazelcastConfig(settings);
        HazelcastInstance instance = connector.connect();
        try {
            assertThat(connector.ownsConnection()).isTrue();
            assertThat(instance.getLifecycleService().isRunning()).isTrue();
            assertThat(instance.getConfig().getClusterName()).isEqualTo(settings.clusterName());
        } finally {
            instance.shutdown();
        }
    }
}
