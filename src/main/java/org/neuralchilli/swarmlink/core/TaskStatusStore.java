package org.neuralchilli.swarmlink.core;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.neuralchilli.swarmlink.domain.SwarmTask;
import org.neuralchilli.swarmlink.domain.TaskStatusRecord;
import org.neuralchilli.swarmlink.monitoring.SwarmMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Access to the shared task status map.
 * <p>
 * Every transition is a compare-and-swap on the whole record, so a status
 * can only move forward even when the requester and the claimant write at
 * the same time.
 * <p>
 * Records expire on their own. A live record is kept at least as long as its
 * requester can wait for it; a terminal record is kept for the retention period.
 */
public class TaskStatusStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStatusStore.class);
    private static final int MAX_OPTIMISTIC_LOCK_RETRIES = 10;

    private final IMap<String, TaskStatusRecord> statuses;
    private final SwarmMetrics metrics;
    private final long retentionSeconds;

    public TaskStatusStore(HazelcastInstance hazelcast, SwarmMetrics metrics, Duration retention) {
        this.statuses = hazelcast.getMap(SwarmKeys.TASK_STATUS);
        this.metrics = metrics;
        this.retentionSeconds = Math.max(1, retention.toSeconds());
    }

    /**
     * Write the initial pending record for a freshly created task.
     */
    public void initialize(SwarmTask task) {
        initialize(task.taskId(), task.createdAt(), task.timeoutSeconds());
    }

    public void initialize(String taskId, Instant createdAt, int timeoutSeconds) {
        statuses.set(taskId, TaskStatusRecord.pending(createdAt), expirySeconds(timeoutSeconds), TimeUnit.SECONDS);
    }

    /**
     * Lifetime of a record that is not terminal yet: the requester's whole
     * wait plus the retention period.
     */
    public long expirySeconds(int timeoutSeconds) {
        return timeoutSeconds + retentionSeconds;
    }

    public Optional<TaskStatusRecord> get(String taskId) {
        return Optional.ofNullable(statuses.get(taskId));
    }

    public Optional<TaskStatusRecord> complete(String taskId, Map<String, Object> result) {
        return transition(taskId, current -> current.complete(result, Instant.now()));
    }

    public Optional<TaskStatusRecord> fail(String taskId, String error) {
        return transition(taskId, current -> current.fail(error, Instant.now()));
    }

    /**
     * Mark an unclaimed task as abandoned by its requester.
     * Has no effect once a peer has claimed it.
     */
    public Optional<TaskStatusRecord> retract(String taskId) {
        return transition(taskId, current -> current.retract(Instant.now()));
    }

    /**
     * Apply a forward transition using optimistic locking.
     *
     * @return the written record, or empty when the record is missing or the
     * current status does not allow the transition
     */
    public Optional<TaskStatusRecord> transition(String taskId, UnaryOperator<TaskStatusRecord> step) {
        for (int attempt = 1; attempt <= MAX_OPTIMISTIC_LOCK_RETRIES; attempt++) {
            TaskStatusRecord current = statuses.get(taskId);
            if (current == null) {
                log.warn("Status record not found for task: {}", taskId);
                return Optional.empty();
            }

            TaskStatusRecord updated;
            try {
                updated = step.apply(current);
            } catch (IllegalStateException e) {
                log.debug("Skipping transition for task {}: {}", taskId, e.getMessage());
                return Optional.empty();
            }

            if (statuses.replace(taskId, current, updated)) {
                if (updated.status().isTerminal()) {
                    statuses.setTtl(taskId, retentionSeconds, TimeUnit.SECONDS);
                }
                log.trace("Task {} moved {} -> {}", taskId, current.status(), updated.status());
                return Optional.of(updated);
            }

            metrics.recordStatusWriteRetry();
            log.debug("Concurrent status update on task {}, retry {}/{}",
                    taskId, attempt, MAX_OPTIMISTIC_LOCK_RETRIES);
        }

        throw new SwarmException("Gave up updating status of task " + taskId
                + " after " + MAX_OPTIMISTIC_LOCK_RETRIES + " attempts");
    }
}
