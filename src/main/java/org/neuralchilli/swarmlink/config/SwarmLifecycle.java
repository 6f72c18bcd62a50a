package org.neuralchilli.swarmlink.config;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.swarmlink.core.SwarmCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins the swarm when the application starts and leaves it on shutdown.
 */
@ApplicationScoped
public class SwarmLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SwarmLifecycle.class);

    @Inject
    SwarmCoordinator coordinator;

    void onStart(@Observes StartupEvent event) {
        if (!coordinator.initialize()) {
            log.warn("Swarm features disabled: node {} continues in standalone mode", coordinator.nodeId());
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        coordinator.shutdown();
    }
}
