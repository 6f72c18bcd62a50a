package org.neuralchilli.swarmlink.monitoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters for one swarm node.
 *
 * Tracks:
 * - delegation outcomes on the requesting side
 * - claims and execution outcomes on the processing side
 * - liveness (ticks, failed ticks, evicted peers)
 * - optimistic status-write retries
 */
public class SwarmMetrics {

    private static final Logger log = LoggerFactory.getLogger(SwarmMetrics.class);

    // Requester side
    private final LongAdder delegationsRequested = new LongAdder();
    private final LongAdder delegationsCompleted = new LongAdder();
    private final LongAdder delegationsFailed = new LongAdder();
    private final LongAdder delegationsTimedOut = new LongAdder();
    private final LongAdder delegationsWithoutPeer = new LongAdder();
    private final LongAdder tasksRetracted = new LongAdder();

    // Processor side
    private final LongAdder tasksClaimed = new LongAdder();
    private final LongAdder tasksDropped = new LongAdder();
    private final LongAdder tasksCompleted = new LongAdder();
    private final LongAdder tasksFailed = new LongAdder();

    // Liveness
    private final LongAdder heartbeatTicks = new LongAdder();
    private final LongAdder heartbeatFailures = new LongAdder();
    private final LongAdder nodesEvicted = new LongAdder();

    // Status writes
    private final LongAdder statusWriteRetries = new LongAdder();
    private final LongAdder stateSyncs = new LongAdder();

    // Delegation round trip
    private final LongAdder roundTrips = new LongAdder();
    private final LongAdder roundTripNanos = new LongAdder();
    private final AtomicLong maxRoundTripNanos = new AtomicLong(0);

    public void recordDelegationRequested() {
        delegationsRequested.increment();
    }

    public void recordDelegationCompleted(Duration roundTrip) {
        delegationsCompleted.increment();
        long nanos = roundTrip.toNanos();
        roundTrips.increment();
        roundTripNanos.add(nanos);
        maxRoundTripNanos.updateAndGet(current -> Math.max(current, nanos));
    }

    public void recordDelegationFailed() {
        delegationsFailed.increment();
    }

    public void recordDelegationTimedOut() {
        delegationsTimedOut.increment();
    }

    public void recordDelegationWithoutPeer() {
        delegationsWithoutPeer.increment();
    }

    public void recordTaskRetracted() {
        tasksRetracted.increment();
    }

    public void recordTaskClaimed() {
        tasksClaimed.increment();
    }

    /**
     * Record a popped task that was no longer claimable (retracted by its requester).
     */
    public void recordTaskDropped() {
        tasksDropped.increment();
    }

    public void recordTaskCompleted() {
        tasksCompleted.increment();
    }

    public void recordTaskFailed() {
        tasksFailed.increment();
    }

    public void recordHeartbeatTick() {
        heartbeatTicks.increment();
    }

    public void recordHeartbeatFailure() {
        heartbeatFailures.increment();
    }

    public void recordNodesEvicted(int count) {
        nodesEvicted.add(count);
    }

    public void recordStatusWriteRetry() {
        statusWriteRetries.increment();
    }

    public void recordStateSync() {
        stateSyncs.increment();
    }

    public Duration averageRoundTrip() {
        long count = roundTrips.sum();
        return count > 0 ? Duration.ofNanos(roundTripNanos.sum() / count) : Duration.ZERO;
    }

    /**
     * Get execution success rate on this node, in percent.
     */
    public double getTaskSuccessRate() {
        long completed = tasksCompleted.sum();
        long failed = tasksFailed.sum();
        long total = completed + failed;
        return total > 0 ? (completed * 100.0) / total : 0.0;
    }

    public MetricsReport getReport() {
        return new MetricsReport(
                delegationsRequested.sum(),
                delegationsCompleted.sum(),
                delegationsFailed.sum(),
                delegationsTimedOut.sum(),
                delegationsWithoutPeer.sum(),
                tasksRetracted.sum(),
                tasksClaimed.sum(),
                tasksDropped.sum(),
                tasksCompleted.sum(),
                tasksFailed.sum(),
                getTaskSuccessRate(),
                heartbeatTicks.sum(),
                heartbeatFailures.sum(),
                nodesEvicted.sum(),
                statusWriteRetries.sum(),
                stateSyncs.sum(),
                averageRoundTrip(),
                Duration.ofNanos(maxRoundTripNanos.get())
        );
    }

    /**
     * Metrics snapshot.
     */
    public record MetricsReport(
            long delegationsRequested,
            long delegationsCompleted,
            long delegationsFailed,
            long delegationsTimedOut,
            long delegationsWithoutPeer,
            long tasksRetracted,
            long tasksClaimed,
            long tasksDropped,
            long tasksCompleted,
            long tasksFailed,
            double taskSuccessRate,
            long heartbeatTicks,
            long heartbeatFailures,
            long nodesEvicted,
            long statusWriteRetries,
            long stateSyncs,
            Duration averageRoundTrip,
            Duration maxRoundTrip
    ) {
        @Override
        public String toString() {
            return String.format("""
                Swarm Metrics:
                ==============
                Delegation:
                  Requested: %d, Completed: %d, Failed: %d, Timed out: %d, No peer: %d
                  Retracted: %d
                  Round trip: avg %dms, max %dms

                Processing:
                  Claimed: %d, Dropped: %d, Completed: %d, Failed: %d
                  Success Rate: %.1f%%

                Liveness:
                  Ticks: %d (%d failed), Evicted peers: %d

                Store:
                  Status write retries: %d, State syncs: %d
                """,
                    delegationsRequested, delegationsCompleted, delegationsFailed,
                    delegationsTimedOut, delegationsWithoutPeer,
                    tasksRetracted,
                    averageRoundTrip.toMillis(), maxRoundTrip.toMillis(),
                    tasksClaimed, tasksDropped, tasksCompleted, tasksFailed,
                    taskSuccessRate,
                    heartbeatTicks, heartbeatFailures, nodesEvicted,
                    statusWriteRetries, stateSyncs
            );
        }
    }

    /**
     * Reset all metrics (useful for testing).
     */
    public void reset() {
        delegationsRequested.reset();
        delegationsCompleted.reset();
        delegationsFailed.reset();
        delegationsTimedOut.reset();
        delegationsWithoutPeer.reset();
        tasksRetracted.reset();
        tasksClaimed.reset();
        tasksDropped.reset();
        tasksCompleted.reset();
        tasksFailed.reset();
        heartbeatTicks.reset();
        heartbeatFailures.reset();
        nodesEvicted.reset();
        statusWriteRetries.reset();
        stateSyncs.reset();
        roundTrips.reset();
        roundTripNanos.reset();
        maxRoundTripNanos.set(0);
        log.info("Swarm metrics reset");
    }

    /**
     * Log current metrics report.
     */
    public void logReport() {
        log.info("\n{}", getReport());
    }
}
