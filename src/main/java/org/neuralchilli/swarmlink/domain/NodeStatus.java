package org.neuralchilli.swarmlink.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Self-reported status of a swarm node.
 * Informational only: eviction is driven by heartbeat age.
 */
public enum NodeStatus {
    /**
     * Node has spare capacity
     */
    ACTIVE,

    /**
     * Node's concurrency budget is exhausted
     */
    BUSY,

    /**
     * Node is leaving the swarm
     */
    OFFLINE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Node status cannot be null or empty");
        }
        return NodeStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
