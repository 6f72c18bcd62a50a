package org.neuralchilli.swarmlink.core;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.neuralchilli.swarmlink.domain.SwarmNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * View of the peers in the swarm, backed by the shared node map.
 * <p>
 * A node only ever writes its own entry. Any node may delete an entry
 * whose heartbeat has gone stale.
 */
public class NodeDirectory {

    private static final Logger log = LoggerFactory.getLogger(NodeDirectory.class);

    private final IMap<String, SwarmNode> nodes;

    public NodeDirectory(HazelcastInstance hazelcast) {
        this.nodes = hazelcast.getMap(SwarmKeys.NODES);
    }

    /**
     * Upsert a node's entry. Visible to every peer once the call returns.
     */
    public void register(SwarmNode node) {
        nodes.set(node.nodeId(), node);
        log.info("Registered node {} ({}) with capabilities {}",
                node.nodeId(), node.instanceUrl(), node.capabilities());
    }

    /**
     * Write a refreshed entry for the owning node.
     */
    public void refresh(SwarmNode node) {
        nodes.set(node.nodeId(), node);
        log.trace("Heartbeat for node {}: load={}, status={}",
                node.nodeId(), node.loadFactor(), node.status());
    }

    public void unregister(String nodeId) {
        nodes.delete(nodeId);
        log.info("Unregistered node {}", nodeId);
    }

    public Optional<SwarmNode> get(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /**
     * Read every entry. An entry that cannot be read is skipped.
     */
    public List<SwarmNode> snapshot() {
        List<SwarmNode> snapshot = new ArrayList<>();
        for (String nodeId : nodes.keySet()) {
            readEntry(nodeId).ifPresent(snapshot::add);
        }
        return snapshot;
    }

    private Optional<SwarmNode> readEntry(String nodeId) {
        try {
            SwarmNode node = nodes.get(nodeId);
            return Optional.ofNullable(node);
        } catch (RuntimeException e) {
            log.warn("Skipping unreadable entry for node {}: {}", nodeId, e.getMessage());
            return Optional.empty();
        }
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Delete every entry whose heartbeat is older than the timeout.
     * An entry refreshed after it was read is left alone.
     *
     * @return ids of the evicted nodes
     */
    public List<String> sweepStale(Instant now, Duration nodeTimeout) {
        List<String> evicted = new ArrayList<>();

        for (String nodeId : nodes.keySet()) {
            Optional<SwarmNode> entry = readEntry(nodeId);
            if (entry.isEmpty() || !entry.get().isStale(now, nodeTimeout)) {
                continue;
            }

            SwarmNode node = entry.get();
            if (nodes.remove(nodeId, node)) {
                evicted.add(nodeId);
                log.info("Removed stale node: {} (last heartbeat {} ago)", nodeId, node.heartbeatAge(now));
            } else {
                log.debug("Node {} changed while sweeping, keeping it", nodeId);
            }
        }

        return evicted;
    }
}
