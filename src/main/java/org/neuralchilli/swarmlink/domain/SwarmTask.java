package org.neuralchilli.swarmlink.domain;

import java.io.Serializable;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of work published to the swarm.
 * Identity, type, payload and requester never change once created.
 */
public record SwarmTask(
        String taskId,
        String taskType,
        Map<String, Object> payload,
        String requesterId,
        int priority,
        int timeoutSeconds,
        Instant createdAt,
        String assignedTo,
        TaskStatus status,
        Map<String, Object> result
) implements Serializable {

    private static final SecureRandom ID_SOURCE = new SecureRandom();

    public SwarmTask {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task ID cannot be null or empty");
        }
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("Task type cannot be null or empty");
        }
        if (requesterId == null || requesterId.isBlank()) {
            throw new IllegalArgumentException("Requester ID cannot be null or empty");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("Timeout must be > 0 seconds");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Created at cannot be null");
        }

        // Defaults
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        if (status == null) {
            status = TaskStatus.PENDING;
        }
        if (result != null) {
            result = Collections.unmodifiableMap(new LinkedHashMap<>(result));
        }
        if (result != null && !status.hasOutcome()) {
            throw new IllegalArgumentException("Result is only allowed once the task has an outcome");
        }
    }

    /**
     * Generate a random 128-bit hex task id
     */
    public static String newTaskId() {
        byte[] bytes = new byte[16];
        ID_SOURCE.nextBytes(bytes);
        return "task-" + HexFormat.of().formatHex(bytes);
    }

    public static Builder builder(String taskType, String requesterId) {
        return new Builder(taskType, requesterId);
    }

    /**
     * Mark as claimed by a peer
     */
    public SwarmTask assign(String nodeId) {
        if (!status.canTransitionTo(TaskStatus.ASSIGNED)) {
            throw new IllegalStateException("Cannot assign task " + taskId + " in status: " + status);
        }
        return new SwarmTask(
                taskId, taskType, payload, requesterId, priority, timeoutSeconds,
                createdAt, nodeId, TaskStatus.ASSIGNED, null
        );
    }

    public static class Builder {
        private final String taskType;
        private final String requesterId;
        private String taskId;
        private Map<String, Object> payload = Map.of();
        private int priority = 1;
        private int timeoutSeconds = 300;
        private Instant createdAt;

        public Builder(String taskType, String requesterId) {
            this.taskType = taskType;
            this.requesterId = requesterId;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public SwarmTask build() {
            return new SwarmTask(
                    taskId != null ? taskId : newTaskId(),
                    taskType,
                    payload,
                    requesterId,
                    priority,
                    timeoutSeconds,
                    createdAt != null ? createdAt : Instant.now(),
                    null,
                    TaskStatus.PENDING,
                    null
            );
        }
    }
}
