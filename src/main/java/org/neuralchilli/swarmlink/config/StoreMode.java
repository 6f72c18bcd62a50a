package org.neuralchilli.swarmlink.config;

/**
 * How a node reaches the shared Hazelcast store.
 */
public enum StoreMode {
    /**
     * Start a Hazelcast member inside this process
     */
    EMBEDDED,

    /**
     * Connect as a client to an existing cluster
     */
    CLIENT
}
