package org.neuralchilli.swarmlink.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns every task execution started on this node.
 * <p>
 * Executions run on a fixed pool sized to the node's concurrency budget.
 * {@link #drain(Duration)} stops intake, waits for in-flight work up to a
 * grace period, then interrupts whatever is left.
 */
public class ExecutionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ExecutionSupervisor.class);

    private final ExecutorService executorService;
    private final Map<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    public ExecutionSupervisor(String nodeId, int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be > 0");
        }
        this.executorService = Executors.newFixedThreadPool(threads, new WorkerThreadFactory(nodeId));
    }

    /**
     * Start an execution.
     *
     * @return false when the supervisor is draining and the work was not started
     */
    public boolean submit(String taskId, Runnable work) {
        if (!accepting) {
            return false;
        }

        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(work, executorService);
        } catch (RejectedExecutionException e) {
            log.warn("Execution of task {} rejected: supervisor is shutting down", taskId);
            return false;
        }

        inFlight.put(taskId, future);
        future.whenComplete((ignored, error) -> inFlight.remove(taskId, future));
        return true;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public Set<String> inFlightTaskIds() {
        return Set.copyOf(inFlight.keySet());
    }

    /**
     * Stop accepting work and wait for running executions.
     *
     * @return number of executions still running when the grace period ran out
     */
    public int drain(Duration gracePeriod) {
        accepting = false;
        executorService.shutdown();

        int pending = inFlight.size();
        if (pending > 0) {
            log.info("Waiting up to {}s for {} in-flight executions", gracePeriod.toSeconds(), pending);
        }

        try {
            if (executorService.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                return 0;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        int abandoned = inFlight.size();
        log.warn("Execution pool did not drain in {}s, interrupting {} executions: {}",
                gracePeriod.toSeconds(), abandoned, inFlight.keySet());
        executorService.shutdownNow();
        return abandoned;
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Thread factory for creating named execution threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);
        private final String nodeId;

        WorkerThreadFactory(String nodeId) {
            this.nodeId = nodeId;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(nodeId + "-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
