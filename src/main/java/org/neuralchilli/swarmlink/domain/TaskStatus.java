package org.neuralchilli.swarmlink.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a delegated task.
 * Transitions only move forward; see {@link #canTransitionTo(TaskStatus)}.
 */
public enum TaskStatus {
    /**
     * Task enqueued, waiting for a peer to claim it
     */
    PENDING,

    /**
     * A peer claimed the task and is executing it
     */
    ASSIGNED,

    /**
     * Handler returned a result
     */
    COMPLETED,

    /**
     * Handler raised an error
     */
    FAILED,

    /**
     * Requester gave up before any peer claimed the task
     */
    TIMEOUT;

    /**
     * Check if this is a terminal state (no further transitions)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT;
    }

    /**
     * Check if the task produced an outcome the requester can read
     */
    public boolean hasOutcome() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == ASSIGNED || next == TIMEOUT;
            case ASSIGNED -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED, TIMEOUT -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task status cannot be null or empty");
        }
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
