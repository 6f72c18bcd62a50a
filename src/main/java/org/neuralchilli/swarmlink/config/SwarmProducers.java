package org.neuralchilli.swarmlink.config;

import io.quarkus.arc.All;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.neuralchilli.swarmlink.core.StoreConnector;
import org.neuralchilli.swarmlink.core.SwarmCoordinator;
import org.neuralchilli.swarmlink.worker.TaskHandler;
import org.neuralchilli.swarmlink.worker.TaskHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Wires one {@link SwarmCoordinator} per application from {@code swarm.*} config
 * and every {@link TaskHandler} bean.
 */
@ApplicationScoped
public class SwarmProducers {

    private static final Logger log = LoggerFactory.getLogger(SwarmProducers.class);

    @Produces
    @Singleton
    public SwarmSettings swarmSettings(SwarmConfig config) {
        SwarmConfig.Store store = config.store();

        SwarmSettings settings = SwarmSettings.builder()
                .nodeId(config.nodeId().orElseGet(SwarmSettings::generateNodeId))
                .instanceUrl(config.instanceUrl())
                .capabilities(new LinkedHashSet<>(config.capabilities().orElse(List.of())))
                .heartbeatInterval(config.heartbeatInterval())
                .nodeTimeout(config.nodeTimeout())
                .selectionMaxAge(config.selectionMaxAge())
                .maxConcurrentTasks(config.maxConcurrentTasks())
                .failureBackoff(config.failureBackoff())
                .pollInterval(config.pollInterval())
                .defaultTaskTimeout(config.defaultTaskTimeout())
                .shutdownGracePeriod(config.shutdownGracePeriod())
                .taskStatusRetention(config.taskStatusRetention())
                .storeMode(store.mode())
                .clusterName(store.clusterName())
                .storeAddresses(store.addresses())
                .connectTimeout(store.connectTimeout())
                .build();

        log.info("Swarm node {} configured: capabilities={}, store={} {}",
                settings.nodeId(), settings.capabilities(), settings.storeMode(), settings.storeAddresses());
        return settings;
    }

    @Produces
    @Singleton
    public TaskHandlerRegistry taskHandlerRegistry(@All List<TaskHandler> handlers) {
        return new TaskHandlerRegistry(handlers);
    }

    @Produces
    @Singleton
    public StoreConnector storeConnector(SwarmSettings settings) {
        return new HazelcastConfig(settings);
    }

    @Produces
    @Singleton
    public SwarmCoordinator swarmCoordinator(
            SwarmSettings settings,
            StoreConnector connector,
            TaskHandlerRegistry handlers
    ) {
        return new SwarmCoordinator(settings, connector, handlers);
    }
}
