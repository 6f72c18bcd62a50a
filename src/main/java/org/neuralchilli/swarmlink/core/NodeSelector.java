package org.neuralchilli.swarmlink.core;

import org.neuralchilli.swarmlink.domain.SwarmNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Picks the peer that should receive a task.
 * <p>
 * Eligible peers declare the capability, are not the requester, and have a
 * heartbeat no older than the selection age. This bound is tighter than the
 * eviction timeout, so a peer can be too stale to pick before it is evicted.
 * The least loaded eligible peer wins; ties go to the first one seen.
 * <p>
 * Pure function of its inputs: no store access.
 */
public class NodeSelector {

    private final Duration selectionMaxAge;

    public NodeSelector(Duration selectionMaxAge) {
        if (selectionMaxAge == null || selectionMaxAge.isNegative()) {
            throw new IllegalArgumentException("Selection max age must be a non-negative duration");
        }
        this.selectionMaxAge = selectionMaxAge;
    }

    public Optional<String> select(
            String taskType,
            Collection<SwarmNode> directorySnapshot,
            String selfId,
            Instant now
    ) {
        SwarmNode best = null;

        for (SwarmNode node : directorySnapshot) {
            if (!isEligible(node, taskType, selfId, now)) {
                continue;
            }
            if (best == null || node.loadFactor() < best.loadFactor()) {
                best = node;
            }
        }

        return Optional.ofNullable(best).map(SwarmNode::nodeId);
    }

    public boolean isEligible(SwarmNode node, String taskType, String selfId, Instant now) {
        return node != null
                && !node.nodeId().equals(selfId)
                && node.canHandle(taskType)
                && !node.isStale(now, selectionMaxAge);
    }

    public Duration selectionMaxAge() {
        return selectionMaxAge;
    }
}
