package org.neuralchilli.swarmlink.config;

import com.hazelcast.core.Hazelcast;
import io.quarkus.test.Mock;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.neuralchilli.swarmlink.core.StoreConnector;

import java.util.List;

/**
 * Connects the application under test to an isolated embedded member.
 */
public class SwarmTestProducer {

    @Produces
    @Singleton
    @Mock
    public StoreConnector storeConnector(SwarmSettings settings) {
        return () -> Hazelcast.newHazelcastInstance(HazelcastConfig.memberConfig(
                settings.clusterName(), List.of()));
    }
}
