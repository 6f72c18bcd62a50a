package org.neuralchilli.swarmlink.core;

import org.neuralchilli.swarmlink.domain.NodeStatus;
import org.neuralchilli.swarmlink.domain.SwarmNode;
import org.neuralchilli.swarmlink.monitoring.SwarmMetrics;
import org.neuralchilli.swarmlink.worker.TaskProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Liveness loop of a node.
 * <p>
 * Each tick refreshes this node's directory entry, evicts peers whose
 * heartbeat is older than the node timeout, and runs one poll-and-claim
 * cycle. A failed tick is logged and retried after the failure backoff;
 * the loop only ends on {@link #stop()}.
 */
public class HeartbeatService {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatService.class);

    private final NodeDirectory directory;
    private final TaskProcessor processor;
    private final SwarmMetrics metrics;
    private final Duration heartbeatInterval;
    private final Duration nodeTimeout;
    private final Duration failureBackoff;

    private volatile SwarmNode self;
    private ExecutorService loop;
    private CountDownLatch stopSignal;
    private volatile boolean running = false;

    public HeartbeatService(
            SwarmNode self,
            NodeDirectory directory,
            TaskProcessor processor,
            SwarmMetrics metrics,
            Duration heartbeatInterval,
            Duration nodeTimeout,
            Duration failureBackoff
    ) {
        this.self = self;
        this.directory = directory;
        this.processor = processor;
        this.metrics = metrics;
        this.heartbeatInterval = heartbeatInterval;
        this.nodeTimeout = nodeTimeout;
        this.failureBackoff = failureBackoff;
    }

    /**
     * Register this node and start the periodic loop.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Heartbeat for node {} already running", self.nodeId());
            return;
        }

        self = self.heartbeat(Instant.now(), processor.loadFactor(), currentStatus());
        directory.register(self);

        stopSignal = new CountDownLatch(1);
        loop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "swarm-heartbeat-" + self.nodeId());
            t.setDaemon(true);
            return t;
        });
        running = true;
        loop.submit(this::runLoop);

        log.info("Heartbeat started for node {} (interval={}s, node timeout={}s)",
                self.nodeId(), heartbeatInterval.toSeconds(), nodeTimeout.toSeconds());
    }

    /**
     * One liveness cycle: refresh, sweep, drain.
     *
     * @throws RuntimeException when the store cannot be reached
     */
    public void tick() {
        Instant now = Instant.now();

        // Re-upsert: a peer may have swept this entry while we were paused
        self = self.heartbeat(now, processor.loadFactor(), currentStatus());
        directory.refresh(self);

        List<String> evicted = directory.sweepStale(now, nodeTimeout);
        if (!evicted.isEmpty()) {
            metrics.recordNodesEvicted(evicted.size());
        }

        processor.pollAndClaim();
        metrics.recordHeartbeatTick();
    }

    private void runLoop() {
        Duration wait = heartbeatInterval;

        while (running) {
            try {
                if (stopSignal.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                tick();
                wait = heartbeatInterval;
            } catch (Exception e) {
                metrics.recordHeartbeatFailure();
                log.error("Heartbeat error on node {}, retrying in {}s",
                        self.nodeId(), failureBackoff.toSeconds(), e);
                wait = failureBackoff;
            }
        }

        log.debug("Heartbeat loop for node {} exited", self.nodeId());
    }

    private NodeStatus currentStatus() {
        return processor.hasCapacity() ? NodeStatus.ACTIVE : NodeStatus.BUSY;
    }

    /**
     * Stop the loop. Does not unregister the node.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping heartbeat for node {}", self.nodeId());
        running = false;
        stopSignal.countDown();
        loop.shutdown();

        try {
            if (!loop.awaitTermination(10, TimeUnit.SECONDS)) {
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Publish this node as offline while it drains. Peers still see the entry until it is unregistered.
     */
    public void markOffline() {
        self = self.withStatus(NodeStatus.OFFLINE);
        directory.refresh(self);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Directory entry as last written by this node.
     */
    public SwarmNode self() {
        return self;
    }
}
