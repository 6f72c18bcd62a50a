package org.neuralchilli.swarmlink.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.swarmlink.domain.SwarmTask;
import org.neuralchilli.swarmlink.worker.TaskHandler;

import java.util.Map;

/**
 * Handler bean picked up by the CDI wiring under test.
 */
@ApplicationScoped
public class EchoTaskHandler implements TaskHandler {

    @Override
    public String taskType() {
        return "echo";
    }

    @Override
    public Map<String, Object> execute(SwarmTask task) {
        return task.payload();
    }
}
