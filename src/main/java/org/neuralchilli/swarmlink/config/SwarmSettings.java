package org.neuralchilli.swarmlink.config;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Resolved settings for one swarm node.
 * Built from {@link SwarmConfig} under CDI, or directly through {@link #builder()}.
 */
public record SwarmSettings(
        String nodeId,
        String instanceUrl,
        Set<String> capabilities,
        Duration heartbeatInterval,
        Duration nodeTimeout,
        Duration selectionMaxAge,
        int maxConcurrentTasks,
        Duration failureBackoff,
        Duration pollInterval,
        Duration defaultTaskTimeout,
        Duration shutdownGracePeriod,
        Duration taskStatusRetention,
        StoreMode storeMode,
        String clusterName,
        List<String> storeAddresses,
        Duration connectTimeout
) {

    public SwarmSettings {
        if (nodeId == null || nodeId.isBlank()) {
            throw new SwarmConfigurationException("Node ID cannot be null or empty");
        }
        if (maxConcurrentTasks <= 0) {
            throw new SwarmConfigurationException("Max concurrent tasks must be > 0");
        }
        requirePositive("heartbeat interval", heartbeatInterval);
        requirePositive("node timeout", nodeTimeout);
        requirePositive("selection max age", selectionMaxAge);
        requirePositive("failure backoff", failureBackoff);
        requirePositive("poll interval", pollInterval);
        requirePositive("default task timeout", defaultTaskTimeout);
        if (defaultTaskTimeout.toSeconds() < 1) {
            // Task timeouts travel as whole seconds
            throw new SwarmConfigurationException("Setting 'default task timeout' must be at least 1s");
        }
        requirePositive("task status retention", taskStatusRetention);
        requirePositive("connect timeout", connectTimeout);
        if (shutdownGracePeriod == null || shutdownGracePeriod.isNegative()) {
            throw new SwarmConfigurationException("Shutdown grace period cannot be negative");
        }
        if (storeMode == null) {
            throw new SwarmConfigurationException("Store mode cannot be null");
        }
        if (clusterName == null || clusterName.isBlank()) {
            throw new SwarmConfigurationException("Cluster name cannot be null or empty");
        }

        // Defaults
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
        storeAddresses = storeAddresses != null ? List.copyOf(storeAddresses) : List.of();
        if (instanceUrl == null || instanceUrl.isBlank()) {
            instanceUrl = Builder.DEFAULT_INSTANCE_URL;
        }
        if (storeMode == StoreMode.CLIENT && storeAddresses.isEmpty()) {
            throw new SwarmConfigurationException("Client store mode needs at least one address");
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new SwarmConfigurationException("Setting '" + name + "' must be a positive duration");
        }
    }

    /**
     * Random node id in the form swarm-node-xxxxxxxx
     */
    public static String generateNodeId() {
        return "swarm-node-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .nodeId(nodeId)
                .instanceUrl(instanceUrl)
                .capabilities(capabilities)
                .heartbeatInterval(heartbeatInterval)
                .nodeTimeout(nodeTimeout)
                .selectionMaxAge(selectionMaxAge)
                .maxConcurrentTasks(maxConcurrentTasks)
                .failureBackoff(failureBackoff)
                .pollInterval(pollInterval)
                .defaultTaskTimeout(defaultTaskTimeout)
                .shutdownGracePeriod(shutdownGracePeriod)
                .taskStatusRetention(taskStatusRetention)
                .storeMode(storeMode)
                .clusterName(clusterName)
                .storeAddresses(storeAddresses)
                .connectTimeout(connectTimeout);
    }

    public static class Builder {
        static final String DEFAULT_INSTANCE_URL = "http://localhost:8001";

        private String nodeId;
        private String instanceUrl = DEFAULT_INSTANCE_URL;
        private Set<String> capabilities = Set.of();
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration nodeTimeout = Duration.ofSeconds(90);
        private Duration selectionMaxAge = Duration.ofSeconds(60);
        private int maxConcurrentTasks = 3;
        private Duration failureBackoff = Duration.ofSeconds(5);
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration defaultTaskTimeout = Duration.ofSeconds(300);
        private Duration shutdownGracePeriod = Duration.ofSeconds(30);
        private Duration taskStatusRetention = Duration.ofHours(1);
        private StoreMode storeMode = StoreMode.EMBEDDED;
        private String clusterName = "swarm";
        private List<String> storeAddresses = List.of("127.0.0.1:5701");
        private Duration connectTimeout = Duration.ofSeconds(10);

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder instanceUrl(String instanceUrl) {
            this.instanceUrl = instanceUrl;
            return this;
        }

        public Builder capabilities(Set<String> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder nodeTimeout(Duration nodeTimeout) {
            this.nodeTimeout = nodeTimeout;
            return this;
        }

        public Builder selectionMaxAge(Duration selectionMaxAge) {
            this.selectionMaxAge = selectionMaxAge;
            return this;
        }

        public Builder maxConcurrentTasks(int maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
            return this;
        }

        public Builder failureBackoff(Duration failureBackoff) {
            this.failureBackoff = failureBackoff;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder defaultTaskTimeout(Duration defaultTaskTimeout) {
            this.defaultTaskTimeout = defaultTaskTimeout;
            return this;
        }

        public Builder shutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
            return this;
        }

        public Builder taskStatusRetention(Duration taskStatusRetention) {
            this.taskStatusRetention = taskStatusRetention;
            return this;
        }

        public Builder storeMode(StoreMode storeMode) {
            this.storeMode = storeMode;
            return this;
        }

        public Builder clusterName(String clusterName) {
            this.clusterName = clusterName;
            return this;
        }

        public Builder storeAddresses(List<String> storeAddresses) {
            this.storeAddresses = storeAddresses;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public SwarmSettings build() {
            return new SwarmSettings(
                    nodeId != null ? nodeId : generateNodeId(),
                    instanceUrl,
                    capabilities,
                    heartbeatInterval,
                    nodeTimeout,
                    selectionMaxAge,
                    maxConcurrentTasks,
                    failureBackoff,
                    pollInterval,
                    defaultTaskTimeout,
                    shutdownGracePeriod,
                    taskStatusRetention,
                    storeMode,
                    clusterName,
                    storeAddresses,
                    connectTimeout
            );
        }
    }
}
