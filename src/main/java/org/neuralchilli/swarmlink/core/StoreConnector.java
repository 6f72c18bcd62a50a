package org.neuralchilli.swarmlink.core;

import com.hazelcast.core.HazelcastInstance;

/**
 * Opens the connection to the shared registry store.
 */
@FunctionalInterface
public interface StoreConnector {

    /**
     * Connect to the store. May throw when the store is unreachable.
     */
    HazelcastInstance connect();

    /**
     * Whether the coordinator should shut the instance down when it stops.
     */
    default boolean ownsConnection() {
        return true;
    }

    /**
     * Reuse an instance owned by the host; the coordinator never shuts it down.
     */
    static StoreConnector shared(HazelcastInstance instance) {
        return new StoreConnector() {
            @Override
            public HazelcastInstance connect() {
                return instance;
            }

            @Override
            public boolean ownsConnection() {
                return false;
            }
        };
    }
}
