package org.neuralchilli.swarmlink.worker;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.transaction.TransactionContext;
import com.hazelcast.transaction.TransactionOptions;
import com.hazelcast.transaction.TransactionalMap;
import com.hazelcast.transaction.TransactionalQueue;
import org.neuralchilli.swarmlink.core.SwarmKeys;
import org.neuralchilli.swarmlink.core.TaskStatusStore;
import org.neuralchilli.swarmlink.domain.SwarmTask;
import org.neuralchilli.swarmlink.domain.TaskStatusRecord;
import org.neuralchilli.swarmlink.monitoring.SwarmMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Consumer side of delegation: claims queued tasks this node can run and executes them.
 * <p>
 * A claim is one store transaction: pop the queue head, lock the task's status
 * record, move it from pending to assigned, commit. Two nodes can never both
 * claim a task, and a task retracted by its requester is dropped unexecuted.
 */
public class TaskProcessor {

    private static final Logger log = LoggerFactory.getLogger(TaskProcessor.class);

    static final TransactionOptions CLAIM_OPTIONS = new TransactionOptions()
            .setTransactionType(TransactionOptions.TransactionType.TWO_PHASE)
            .setTimeout(30, TimeUnit.SECONDS);

    private final HazelcastInstance hazelcast;
    private final String nodeId;
    private final Set<String> capabilities;
    private final int maxConcurrentTasks;
    private final TaskHandlerRegistry handlers;
    private final TaskStatusStore statusStore;
    private final ExecutionSupervisor supervisor;
    private final SwarmMetrics metrics;

    private final Set<String> activeTasks = ConcurrentHashMap.newKeySet();

    public TaskProcessor(
            HazelcastInstance hazelcast,
            String nodeId,
            Set<String> capabilities,
            int maxConcurrentTasks,
            TaskHandlerRegistry handlers,
            TaskStatusStore statusStore,
            ExecutionSupervisor supervisor,
            SwarmMetrics metrics
    ) {
        this.hazelcast = hazelcast;
        this.nodeId = nodeId;
        this.capabilities = new TreeSet<>(capabilities);
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.handlers = handlers;
        this.statusStore = statusStore;
        this.supervisor = supervisor;
        this.metrics = metrics;
    }

    /**
     * Claim at most one task per capability and start executing it.
     * Does nothing while the local budget is exhausted.
     *
     * @return number of tasks claimed
     */
    public int pollAndClaim() {
        if (!hasCapacity()) {
            log.debug("Node {} at capacity ({}/{}), skipping poll",
                    nodeId, activeTasks.size(), maxConcurrentTasks);
            return 0;
        }

        int claimed = 0;
        for (String capability : capabilities) {
            if (!hasCapacity()) {
                break;
            }

            try {
                Optional<SwarmTask> task = claimNext(capability);
                if (task.isPresent()) {
                    start(task.get());
                    claimed++;
                }
            } catch (Exception e) {
                log.error("Error claiming task from queue {}", SwarmKeys.taskQueue(capability), e);
            }
        }

        return claimed;
    }

    /**
     * Atomically pop and claim the next task of one capability.
     */
    Optional<SwarmTask> claimNext(String capability) {
        TransactionContext tx = hazelcast.newTransactionContext(CLAIM_OPTIONS);
        tx.beginTransaction();

        try {
            TransactionalQueue<SwarmTask> queue = tx.getQueue(SwarmKeys.taskQueue(capability));
            SwarmTask task = queue.poll();
            if (task == null) {
                tx.commitTransaction();
                return Optional.empty();
            }

            if (!handlers.supports(task.taskType())) {
                tx.rollbackTransaction();
                log.warn("Task {} of type {} found in queue {} has no handler here, leaving it queued",
                        task.taskId(), task.taskType(), SwarmKeys.taskQueue(capability));
                return Optional.empty();
            }

            TransactionalMap<String, TaskStatusRecord> statuses = tx.getMap(SwarmKeys.TASK_STATUS);
            TaskStatusRecord current = statuses.getForUpdate(task.taskId());

            if (current != null && !current.isClaimable()) {
                tx.commitTransaction();
                metrics.recordTaskDropped();
                log.info("Dropped task {}: status is already {}", task.taskId(), current.status());
                return Optional.empty();
            }

            TaskStatusRecord base = current != null ? current : TaskStatusRecord.pending(task.createdAt());
            statuses.put(task.taskId(), base.claim(nodeId, Instant.now()),
                    statusStore.expirySeconds(task.timeoutSeconds()), TimeUnit.SECONDS);
            tx.commitTransaction();

            metrics.recordTaskClaimed();
            log.info("Claimed task {} of type {} from {}", task.taskId(), task.taskType(), task.requesterId());
            return Optional.of(task.assign(nodeId));

        } catch (RuntimeException e) {
            tx.rollbackTransaction();
            throw e;
        }
    }

    private void start(SwarmTask task) {
        activeTasks.add(task.taskId());

        if (!supervisor.submit(task.taskId(), () -> execute(task))) {
            activeTasks.remove(task.taskId());
            statusStore.fail(task.taskId(), "Node " + nodeId + " is shutting down");
            metrics.recordTaskFailed();
        }
    }

    /**
     * Run the handler and record the terminal status.
     */
    void execute(SwarmTask task) {
        Instant start = Instant.now();
        log.info("Executing task {} of type {}", task.taskId(), task.taskType());

        try {
            TaskHandler handler = handlers.handlerFor(task.taskType())
                    .orElseThrow(() -> new IllegalStateException(
                            "No handler registered for task type: " + task.taskType()));

            Map<String, Object> result = handler.execute(task);
            statusStore.complete(task.taskId(), result);
            metrics.recordTaskCompleted();
            log.info("Completed task {} ({}ms)", task.taskId(), Duration.between(start, Instant.now()).toMillis());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(task, "Task interrupted");

        } catch (Exception e) {
            log.error("Task execution failed: {}", task.taskId(), e);
            recordFailure(task, e.getMessage() != null ? e.getMessage() : e.getClass().getName());

        } finally {
            activeTasks.remove(task.taskId());
        }
    }

    private void recordFailure(SwarmTask task, String error) {
        metrics.recordTaskFailed();
        try {
            statusStore.fail(task.taskId(), error);
        } catch (Exception e) {
            log.error("Could not record failure of task {}", task.taskId(), e);
        }
    }

    public boolean hasCapacity() {
        return activeTasks.size() < maxConcurrentTasks;
    }

    public int activeTaskCount() {
        return activeTasks.size();
    }

    /**
     * Fraction of the concurrency budget in use, within [0, 1]
     */
    public double loadFactor() {
        return Math.min(1.0, (double) activeTasks.size() / maxConcurrentTasks);
    }
}
