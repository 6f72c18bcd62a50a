package org.neuralchilli.swarmlink.domain;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Directory entry for one peer.
 * Stored in the shared node map; only the owning node refreshes it.
 */
public record SwarmNode(
        String nodeId,
        String instanceUrl,
        Set<String> capabilities,
        double loadFactor,
        Instant lastHeartbeat,
        NodeStatus status
) implements Serializable {

    public SwarmNode {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("Node ID cannot be null or empty");
        }
        if (loadFactor < 0.0 || loadFactor > 1.0 || Double.isNaN(loadFactor)) {
            throw new IllegalArgumentException("Load factor must be within [0, 1], got: " + loadFactor);
        }
        if (lastHeartbeat == null) {
            throw new IllegalArgumentException("Last heartbeat cannot be null");
        }

        // Sorted so the serialized entry is byte-stable for compare-and-delete
        capabilities = capabilities != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(capabilities))
                : Collections.emptySortedSet();
        if (status == null) {
            status = NodeStatus.ACTIVE;
        }
    }

    /**
     * Create a fresh registration with zero load
     */
    public static SwarmNode create(String nodeId, String instanceUrl, Set<String> capabilities) {
        return new SwarmNode(nodeId, instanceUrl, capabilities, 0.0, Instant.now(), NodeStatus.ACTIVE);
    }

    /**
     * Refresh heartbeat with the current load
     */
    public SwarmNode heartbeat(Instant now, double newLoadFactor, NodeStatus newStatus) {
        return new SwarmNode(nodeId, instanceUrl, capabilities, newLoadFactor, now, newStatus);
    }

    public SwarmNode withStatus(NodeStatus newStatus) {
        return new SwarmNode(nodeId, instanceUrl, capabilities, loadFactor, lastHeartbeat, newStatus);
    }

    public boolean canHandle(String taskType) {
        return taskType != null && capabilities.contains(taskType);
    }

    /**
     * Time since the last self-report, never negative
     */
    public Duration heartbeatAge(Instant now) {
        Duration age = Duration.between(lastHeartbeat, now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    /**
     * A node is stale once its heartbeat is strictly older than the threshold
     */
    public boolean isStale(Instant now, Duration threshold) {
        return heartbeatAge(now).compareTo(threshold) > 0;
    }
}
