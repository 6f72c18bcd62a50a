package org.neuralchilli.swarmlink.core;

import com.hazelcast.collection.IQueue;
import com.hazelcast.core.HazelcastInstance;
import org.neuralchilli.swarmlink.domain.SwarmTask;
import org.neuralchilli.swarmlink.domain.TaskStatus;
import org.neuralchilli.swarmlink.domain.TaskStatusRecord;
import org.neuralchilli.swarmlink.monitoring.SwarmMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Requester side of delegation.
 * <p>
 * Publishes a task on the queue of its type when a capable peer exists, then
 * blocks polling the status record until the task completes, fails or the
 * timeout passes. Every failure mode is reported as an empty result; nothing
 * is thrown to the caller and nothing is executed locally.
 */
public class TaskDelegator {

    private static final Logger log = LoggerFactory.getLogger(TaskDelegator.class);

    private final HazelcastInstance hazelcast;
    private final String nodeId;
    private final NodeDirectory directory;
    private final NodeSelector selector;
    private final TaskStatusStore statusStore;
    private final SwarmMetrics metrics;
    private final Duration pollInterval;

    public TaskDelegator(
            HazelcastInstance hazelcast,
            String nodeId,
            NodeDirectory directory,
            NodeSelector selector,
            TaskStatusStore statusStore,
            SwarmMetrics metrics,
            Duration pollInterval
    ) {
        this.hazelcast = hazelcast;
        this.nodeId = nodeId;
        this.directory = directory;
        this.selector = selector;
        this.statusStore = statusStore;
        this.metrics = metrics;
        this.pollInterval = pollInterval;
    }

    /**
     * Delegate a task to the least loaded capable peer and wait for its result.
     *
     * @return the result, or empty when no peer is available, the task failed,
     * the timeout passed, or the store could not be reached
     */
    public Optional<Map<String, Object>> delegate(
            String taskType,
            Map<String, Object> payload,
            int priority,
            int timeoutSeconds
    ) {
        try {
            SwarmTask task = SwarmTask.builder(taskType, nodeId)
                    .payload(payload)
                    .priority(priority)
                    .timeoutSeconds(timeoutSeconds)
                    .build();

            Optional<String> target = selector.select(taskType, directory.snapshot(), nodeId, Instant.now());
            if (target.isEmpty()) {
                metrics.recordDelegationWithoutPeer();
                log.info("No available node for task type: {}", taskType);
                return Optional.empty();
            }

            metrics.recordDelegationRequested();
            return publishAndAwait(task, target.get());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for delegated {} task", taskType);
            return Optional.empty();

        } catch (Exception e) {
            metrics.recordDelegationFailed();
            log.error("Error delegating task of type {}", taskType, e);
            return Optional.empty();
        }
    }

    private Optional<Map<String, Object>> publishAndAwait(SwarmTask task, String targetNode)
            throws InterruptedException {

        // Status first: a claimant must always find a record to lock
        statusStore.initialize(task);

        IQueue<SwarmTask> queue = hazelcast.getQueue(SwarmKeys.taskQueue(task.taskType()));
        if (!queue.offer(task)) {
            statusStore.retract(task.taskId());
            metrics.recordDelegationFailed();
            log.error("Queue {} rejected task {}", SwarmKeys.taskQueue(task.taskType()), task.taskId());
            return Optional.empty();
        }

        log.info("Delegated task {} ({}) to node {}", task.taskId(), task.taskType(), targetNode);

        Instant start = Instant.now();
        Instant deadline = start.plusSeconds(task.timeoutSeconds());

        while (true) {
            Optional<TaskStatusRecord> status = statusStore.get(task.taskId());

            if (status.isPresent() && status.get().status() == TaskStatus.COMPLETED) {
                metrics.recordDelegationCompleted(Duration.between(start, Instant.now()));
                log.debug("Task {} completed by {}", task.taskId(), status.get().assignedTo());
                return Optional.of(status.get().result() != null ? status.get().result() : Map.of());
            }

            if (status.isPresent() && status.get().status() == TaskStatus.FAILED) {
                metrics.recordDelegationFailed();
                log.error("Task {} failed on {}: {}",
                        task.taskId(), status.get().assignedTo(), status.get().error());
                return Optional.empty();
            }

            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                break;
            }

            Thread.sleep(Math.min(pollInterval.toMillis(), remaining.toMillis()));
        }

        metrics.recordDelegationTimedOut();
        log.warn("Task {} timed out after {}s", task.taskId(), task.timeoutSeconds());

        try {
            if (statusStore.retract(task.taskId()).isPresent()) {
                metrics.recordTaskRetracted();
                log.info("Retracted unclaimed task {}", task.taskId());
            }
        } catch (RuntimeException e) {
            log.warn("Could not retract timed out task {}: {}", task.taskId(), e.getMessage());
        }

        return Optional.empty();
    }
}
