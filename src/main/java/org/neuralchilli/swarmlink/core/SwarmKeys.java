package org.neuralchilli.swarmlink.core;

/**
 * Names of the shared structures in the registry store.
 */
public final class SwarmKeys {

    /**
     * Map: node id to directory entry
     */
    public static final String NODES = "swarm:nodes";

    /**
     * Map: task id to status record
     */
    public static final String TASK_STATUS = "swarm:task_status";

    private static final String TASK_QUEUE_PREFIX = "swarm:tasks:";
    private static final String STATE_PREFIX = "swarm:state:";

    private SwarmKeys() {
    }

    /**
     * FIFO queue of tasks for one capability
     */
    public static String taskQueue(String taskType) {
        return TASK_QUEUE_PREFIX + requireName(taskType, "Task type");
    }

    /**
     * Map: node id to that node's JSON state blob
     */
    public static String state(String stateKey) {
        return STATE_PREFIX + requireName(stateKey, "State key");
    }

    private static String requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be null or empty");
        }
        return value;
    }
}
