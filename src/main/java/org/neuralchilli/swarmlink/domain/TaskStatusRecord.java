package org.neuralchilli.swarmlink.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared status record of a delegated task, keyed by task id.
 * Written by the requester (pending, timeout) and by the claimant (assigned, completed, failed).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusRecord(
        TaskStatus status,
        String assignedTo,
        Map<String, Object> result,
        String error,
        Instant createdAt,
        Instant assignedAt,
        Instant completedAt,
        Instant failedAt,
        Instant retractedAt
) implements Serializable {

    public TaskStatusRecord {
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (result != null) {
            result = Collections.unmodifiableMap(new LinkedHashMap<>(result));
        }
    }

    /**
     * Initial record written when the task is enqueued
     */
    public static TaskStatusRecord pending(Instant createdAt) {
        return new TaskStatusRecord(TaskStatus.PENDING, null, null, null, createdAt, null, null, null, null);
    }

    public TaskStatusRecord claim(String nodeId, Instant now) {
        requireTransition(TaskStatus.ASSIGNED);
        return new TaskStatusRecord(TaskStatus.ASSIGNED, nodeId, null, null, createdAt, now, null, null, null);
    }

    public TaskStatusRecord complete(Map<String, Object> taskResult, Instant now) {
        requireTransition(TaskStatus.COMPLETED);
        return new TaskStatusRecord(
                TaskStatus.COMPLETED, assignedTo, taskResult != null ? taskResult : Map.of(), null,
                createdAt, assignedAt, now, null, null
        );
    }

    public TaskStatusRecord fail(String errorMessage, Instant now) {
        requireTransition(TaskStatus.FAILED);
        return new TaskStatusRecord(
                TaskStatus.FAILED, assignedTo, null, errorMessage,
                createdAt, assignedAt, null, now, null
        );
    }

    /**
     * Requester abandoned the task before anyone claimed it
     */
    public TaskStatusRecord retract(Instant now) {
        requireTransition(TaskStatus.TIMEOUT);
        return new TaskStatusRecord(TaskStatus.TIMEOUT, null, null, null, createdAt, null, null, null, now);
    }

    @JsonIgnore
    public boolean isClaimable() {
        return status == TaskStatus.PENDING;
    }

    private void requireTransition(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Cannot move status from " + status + " to " + next);
        }
    }
}
