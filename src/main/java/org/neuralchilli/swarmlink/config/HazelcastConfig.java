package org.neuralchilli.swarmlink.config;

import com.hazelcast.client.HazelcastClient;
import com.hazelcast.client.config.ClientConfig;
import com.hazelcast.config.Config;
import com.hazelcast.config.JoinConfig;
import com.hazelcast.config.SerializationConfig;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import org.neuralchilli.swarmlink.core.StoreConnector;
import org.neuralchilli.swarmlink.serializer.JsonStreamSerializer;
import org.neuralchilli.swarmlink.serializer.SwarmNodeSerializer;
import org.neuralchilli.swarmlink.serializer.SwarmTaskSerializer;
import org.neuralchilli.swarmlink.serializer.TaskStatusRecordSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the Hazelcast connection used as the shared registry store.
 * <p>
 * Embedded mode starts a member that joins its peers over TCP-IP;
 * client mode connects to an existing cluster. Both register the JSON
 * serializers for the swarm domain records.
 */
public class HazelcastConfig implements StoreConnector {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    private final SwarmSettings settings;

    public HazelcastConfig(SwarmSettings settings) {
        this.settings = settings;
    }

    @Override
    public HazelcastInstance connect() {
        return switch (settings.storeMode()) {
            case EMBEDDED -> {
                log.info("Starting embedded Hazelcast member for cluster: {}", settings.clusterName());
                yield Hazelcast.newHazelcastInstance(
                        memberConfig(settings.clusterName(), settings.storeAddresses()));
            }
            case CLIENT -> {
                log.info("Connecting Hazelcast client to cluster {} at {}",
                        settings.clusterName(), settings.storeAddresses());
                yield HazelcastClient.newHazelcastClient(clientConfig(settings));
            }
        };
    }

    /**
     * Member configuration. An empty member list keeps the member isolated.
     */
    public static Config memberConfig(String clusterName, List<String> members) {
        Config config = new Config();
        config.setClusterName(clusterName);
        config.setProperty("hazelcast.phone.home.enabled", "false");

        JoinConfig join = config.getNetworkConfig().getJoin();
        join.getMulticastConfig().setEnabled(false);
        join.getAutoDetectionConfig().setEnabled(false);
        if (members == null || members.isEmpty()) {
            join.getTcpIpConfig().setEnabled(false);
        } else {
            join.getTcpIpConfig().setEnabled(true).setMembers(members);
        }

        registerCustomSerializers(config.getSerializationConfig());
        return config;
    }

    public static ClientConfig clientConfig(SwarmSettings settings) {
        ClientConfig config = new ClientConfig();
        config.setClusterName(settings.clusterName());
        config.setProperty("hazelcast.phone.home.enabled", "false");
        config.getNetworkConfig().setAddresses(settings.storeAddresses());
        config.getConnectionStrategyConfig()
                .getConnectionRetryConfig()
                .setClusterConnectTimeoutMillis(settings.connectTimeout().toMillis());

        registerCustomSerializers(config.getSerializationConfig());
        return config;
    }

    /**
     * Register JSON serializers for every record stored in Hazelcast.
     */
    public static void registerCustomSerializers(SerializationConfig serializationConfig) {
        register(serializationConfig, new SwarmTaskSerializer());
        register(serializationConfig, new SwarmNodeSerializer());
        register(serializationConfig, new TaskStatusRecordSerializer());
        log.debug("Registered swarm serializers: SwarmTask, SwarmNode, TaskStatusRecord");
    }

    private static void register(SerializationConfig serializationConfig, JsonStreamSerializer<?> serializer) {
        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(serializer.type())
                .setImplementation(serializer));
    }
}
