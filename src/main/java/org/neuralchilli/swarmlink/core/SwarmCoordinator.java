package org.neuralchilli.swarmlink.core;

import com.hazelcast.core.HazelcastInstance;
import org.neuralchilli.swarmlink.config.SwarmSettings;
import org.neuralchilli.swarmlink.domain.SwarmNode;
import org.neuralchilli.swarmlink.monitoring.SwarmMetrics;
import org.neuralchilli.swarmlink.monitoring.SwarmStats;
import org.neuralchilli.swarmlink.worker.ExecutionSupervisor;
import org.neuralchilli.swarmlink.worker.TaskHandlerRegistry;
import org.neuralchilli.swarmlink.worker.TaskProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point of a swarm node.
 * <p>
 * The host builds one coordinator and hands it to whatever needs delegation.
 * When the store cannot be reached, {@link #initialize()} returns false and
 * every operation degrades to its standalone result: no peers, empty
 * delegation results, state returned as given. No operation throws into the host.
 */
public class SwarmCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SwarmCoordinator.class);

    private final SwarmSettings settings;
    private final StoreConnector connector;
    private final TaskHandlerRegistry handlers;
    private final SwarmMetrics metrics = new SwarmMetrics();
    private final NodeSelector selector;

    private HazelcastInstance hazelcast;
    private NodeDirectory directory;
    private ExecutionSupervisor supervisor;
    private TaskProcessor processor;
    private HeartbeatService heartbeat;
    private TaskDelegator delegator;
    private StateSynchronizer synchronizer;
    private volatile boolean available = false;

    /**
     * @throws org.neuralchilli.swarmlink.config.SwarmConfigurationException when a
     *         declared capability has no handler
     */
    public SwarmCoordinator(SwarmSettings settings, StoreConnector connector, TaskHandlerRegistry handlers) {
        handlers.validate(settings.capabilities());
        this.settings = settings;
        this.connector = connector;
        this.handlers = handlers;
        this.selector = new NodeSelector(settings.selectionMaxAge());
    }

    /**
     * Connect to the store, register this node and start the heartbeat.
     *
     * @return false when the store is unreachable; the node then runs standalone
     */
    public synchronized boolean initialize() {
        if (available) {
            return true;
        }

        HazelcastInstance instance = null;
        try {
            instance = connector.connect();
            // Probe before wiring anything that depends on the store
            instance.getMap(SwarmKeys.NODES).size();

            wire(instance);
            heartbeat.start();
            available = true;

            log.info("Swarm node {} joined cluster '{}' with capabilities {}",
                    settings.nodeId(), settings.clusterName(), settings.capabilities());
            return true;

        } catch (Exception e) {
            log.warn("Swarm store unavailable, node {} running standalone: {}", settings.nodeId(), e.getMessage());
            log.debug("Store connection failure", e);
            if (supervisor != null) {
                supervisor.drain(Duration.ZERO);
            }
            release(instance);
            return false;
        }
    }

    private void wire(HazelcastInstance instance) {
        String nodeId = settings.nodeId();
        TaskStatusStore statusStore = new TaskStatusStore(instance, metrics, settings.taskStatusRetention());

        this.hazelcast = instance;
        this.directory = new NodeDirectory(instance);
        this.supervisor = new ExecutionSupervisor(nodeId, settings.maxConcurrentTasks());
        this.processor = new TaskProcessor(
                instance,
                nodeId,
                settings.capabilities(),
                settings.maxConcurrentTasks(),
                handlers,
                statusStore,
                supervisor,
                metrics
        );
        this.heartbeat = new HeartbeatService(
                SwarmNode.create(nodeId, settings.instanceUrl(), settings.capabilities()),
                directory,
                processor,
                metrics,
                settings.heartbeatInterval(),
                settings.nodeTimeout(),
                settings.failureBackoff()
        );
        this.delegator = new TaskDelegator(
                instance, nodeId, directory, selector, statusStore, metrics, settings.pollInterval());
        this.synchronizer = new StateSynchronizer(instance, nodeId, metrics);
    }

    /**
     * Delegate with priority 1 and the default task timeout.
     */
    public Optional<Map<String, Object>> delegate(String taskType, Map<String, Object> payload) {
        return delegate(taskType, payload, 1, (int) Math.min(Integer.MAX_VALUE, settings.defaultTaskTimeout().toSeconds()));
    }

    public Optional<Map<String, Object>> delegate(
            String taskType,
            Map<String, Object> payload,
            int priority,
            int timeoutSeconds
    ) {
        if (!available) {
            log.debug("Swarm unavailable, not delegating {} task", taskType);
            return Optional.empty();
        }
        return delegator.delegate(taskType, payload, priority, timeoutSeconds);
    }

    /**
     * Run one poll-and-claim cycle outside the heartbeat.
     *
     * @return number of tasks claimed
     */
    public int processDelegatedTasks() {
        if (!available) {
            return 0;
        }
        try {
            return processor.pollAndClaim();
        } catch (Exception e) {
            log.error("Error processing delegated tasks", e);
            return 0;
        }
    }

    /**
     * Run one liveness cycle outside the periodic loop.
     *
     * @return false when the node is standalone or the tick failed
     */
    public boolean heartbeatTick() {
        if (!available) {
            return false;
        }
        try {
            heartbeat.tick();
            return true;
        } catch (Exception e) {
            metrics.recordHeartbeatFailure();
            log.error("Heartbeat tick failed on node {}", settings.nodeId(), e);
            return false;
        }
    }

    public Map<String, Object> syncState(String stateKey, Map<String, Object> localState) {
        if (!available) {
            return new LinkedHashMap<>(localState);
        }
        return synchronizer.sync(stateKey, localState);
    }

    /**
     * Every other node currently in the directory.
     */
    public List<SwarmNode> peers() {
        if (!available) {
            return List.of();
        }
        try {
            return directory.snapshot().stream()
                    .filter(node -> !node.nodeId().equals(settings.nodeId()))
                    .collect(Collectors.toList());
        } catch (Exception e) {
            log.error("Error reading node directory", e);
            return List.of();
        }
    }

    public SwarmStats stats() {
        if (!available) {
            return SwarmStats.standalone(settings.nodeId(), settings.capabilities(), metrics.getReport());
        }
        return new SwarmStats(
                settings.nodeId(),
                true,
                settings.capabilities(),
                peers().size(),
                processor.activeTaskCount(),
                processor.loadFactor(),
                metrics.getReport()
        );
    }

    /**
     * Stop the heartbeat, drain running executions, unregister and release the store.
     */
    public synchronized void shutdown() {
        if (!available) {
            return;
        }
        available = false;
        log.info("Shutting down swarm node {}", settings.nodeId());

        heartbeat.stop();

        try {
            heartbeat.markOffline();
        } catch (Exception e) {
            log.warn("Could not publish offline status for node {}: {}", settings.nodeId(), e.getMessage());
        }

        int abandoned = supervisor.drain(settings.shutdownGracePeriod());
        if (abandoned > 0) {
            log.warn("{} executions were interrupted during shutdown", abandoned);
        }

        try {
            directory.unregister(settings.nodeId());
        } catch (Exception e) {
            log.warn("Could not unregister node {}: {}", settings.nodeId(), e.getMessage());
        }

        release(hazelcast);
        metrics.logReport();
    }

    private void release(HazelcastInstance instance) {
        if (instance == null || !connector.ownsConnection()) {
            return;
        }
        try {
            instance.shutdown();
        } catch (Exception e) {
            log.warn("Error shutting down store connection", e);
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isAvailable() {
        return available;
    }

    public String nodeId() {
        return settings.nodeId();
    }

    public SwarmMetrics metrics() {
        return metrics;
    }
}
