package org.neuralchilli.swarmlink.core;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.neuralchilli.swarmlink.monitoring.SwarmMetrics;
import org.neuralchilli.swarmlink.util.SwarmJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Best-effort sharing of per-node state snapshots.
 * <p>
 * Each node owns one JSON blob per state key. {@link #sync(String, Map)} folds
 * the peers' blobs into the caller's view with blob-level last-write-wins, then
 * publishes the caller's snapshot. One read and one write per call, no locking.
 */
public class StateSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(StateSynchronizer.class);

    public static final String TIMESTAMP_FIELD = "timestamp";
    public static final String NODE_ID_FIELD = "node_id";

    private final HazelcastInstance hazelcast;
    private final String nodeId;
    private final SwarmMetrics metrics;

    public StateSynchronizer(HazelcastInstance hazelcast, String nodeId, SwarmMetrics metrics) {
        this.hazelcast = hazelcast;
        this.nodeId = nodeId;
        this.metrics = metrics;
    }

    /**
     * Merge peer snapshots into the local one and publish the local snapshot.
     * <p>
     * A peer blob overwrites every field when its timestamp is newer than the
     * merged view's timestamp at the moment the blob is read; otherwise it
     * only contributes fields the merged view lacks. This node's own previous
     * blob is ignored. The caller's map is never modified.
     *
     * @return the merged view, or a copy of the local state when the store fails
     */
    public Map<String, Object> sync(String stateKey, Map<String, Object> localState) {
        Map<String, Object> merged = new LinkedHashMap<>(localState);

        try {
            IMap<String, String> shared = hazelcast.getMap(SwarmKeys.state(stateKey));

            for (Map.Entry<String, String> entry : shared.entrySet()) {
                if (nodeId.equals(entry.getKey())) {
                    continue;
                }
                mergeBlob(merged, entry.getKey(), entry.getValue());
            }

            Map<String, Object> published = new LinkedHashMap<>(localState);
            published.put(TIMESTAMP_FIELD, (double) System.currentTimeMillis());
            published.put(NODE_ID_FIELD, nodeId);
            shared.set(nodeId, SwarmJson.toJson(published));

            metrics.recordStateSync();
            return merged;

        } catch (Exception e) {
            log.error("Error syncing state '{}'", stateKey, e);
            return new LinkedHashMap<>(localState);
        }
    }

    private void mergeBlob(Map<String, Object> merged, String peerId, String blob) {
        Map<String, Object> peerState;
        try {
            peerState = SwarmJson.toMap(blob);
        } catch (Exception e) {
            log.warn("Skipping malformed state blob from node {}: {}", peerId, e.getMessage());
            return;
        }

        boolean newer = timestampOf(peerState) > timestampOf(merged);
        for (Map.Entry<String, Object> field : peerState.entrySet()) {
            if (newer || !merged.containsKey(field.getKey())) {
                merged.put(field.getKey(), field.getValue());
            }
        }
    }

    static double timestampOf(Map<String, Object> state) {
        Object value = state.get(TIMESTAMP_FIELD);
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }
}
