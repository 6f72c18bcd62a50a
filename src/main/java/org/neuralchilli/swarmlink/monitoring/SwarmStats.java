package org.neuralchilli.swarmlink.monitoring;

import java.util.Set;

/**
 * Point-in-time view of one node's participation in the swarm.
 */
public record SwarmStats(
        String nodeId,
        boolean available,
        Set<String> capabilities,
        int peerCount,
        int activeTasks,
        double loadFactor,
        SwarmMetrics.MetricsReport metrics
) {

    public SwarmStats {
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }

    /**
     * Stats of a node that never reached the store.
     */
    public static SwarmStats standalone(String nodeId, Set<String> capabilities, SwarmMetrics.MetricsReport metrics) {
        return new SwarmStats(nodeId, false, capabilities, 0, 0, 0.0, metrics);
    }
}
