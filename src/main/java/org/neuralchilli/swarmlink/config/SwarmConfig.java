package org.neuralchilli.swarmlink.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration surface of a swarm node ({@code swarm.*}).
 */
@ConfigMapping(prefix = "swarm")
public interface SwarmConfig {

    /**
     * Node id; a random {@code swarm-node-xxxxxxxx} id is generated when absent.
     */
    Optional<String> nodeId();

    @WithDefault("http://localhost:8001")
    String instanceUrl();

    /**
     * Task types this node executes. Each one needs a registered handler.
     */
    Optional<List<String>> capabilities();

    @WithDefault("30s")
    Duration heartbeatInterval();

    @WithDefault("90s")
    Duration nodeTimeout();

    @WithDefault("60s")
    Duration selectionMaxAge();

    @WithDefault("3")
    int maxConcurrentTasks();

    @WithDefault("5s")
    Duration failureBackoff();

    @WithDefault("1s")
    Duration pollInterval();

    @WithDefault("300s")
    Duration defaultTaskTimeout();

    @WithDefault("30s")
    Duration shutdownGracePeriod();

    @WithDefault("1h")
    Duration taskStatusRetention();

    Store store();

    interface Store {

        @WithDefault("embedded")
        StoreMode mode();

        @WithDefault("swarm")
        String clusterName();

        /**
         * Member addresses: TCP-IP join list when embedded, connection list when a client.
         */
        @WithDefault("127.0.0.1:5701")
        List<String> addresses();

        @WithDefault("10s")
        Duration connectTimeout();
    }
}
