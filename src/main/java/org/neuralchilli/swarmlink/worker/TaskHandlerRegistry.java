package org.neuralchilli.swarmlink.worker;

import org.neuralchilli.swarmlink.config.SwarmConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Typed mapping from task type to handler.
 * Checked against the node's declared capabilities before the node joins the swarm.
 */
public class TaskHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskHandlerRegistry.class);

    private final Map<String, TaskHandler> handlers;

    public TaskHandlerRegistry(Collection<? extends TaskHandler> handlers) {
        Map<String, TaskHandler> byType = new LinkedHashMap<>();
        for (TaskHandler handler : handlers) {
            String taskType = handler.taskType();
            if (taskType == null || taskType.isBlank()) {
                throw new SwarmConfigurationException("Handler " + handler + " declares no task type");
            }
            TaskHandler previous = byType.putIfAbsent(taskType, handler);
            if (previous != null) {
                throw new SwarmConfigurationException(
                        "Duplicate handlers for task type '" + taskType + "': " + previous + ", " + handler);
            }
        }
        this.handlers = Collections.unmodifiableMap(byType);
    }

    public static TaskHandlerRegistry of(TaskHandler... handlers) {
        return new TaskHandlerRegistry(List.of(handlers));
    }

    public static TaskHandlerRegistry empty() {
        return new TaskHandlerRegistry(List.of());
    }

    /**
     * Fail fast when a declared capability has no handler.
     * Handlers without a matching capability are allowed but never used.
     */
    public void validate(Set<String> capabilities) {
        Set<String> missing = new TreeSet<>(capabilities);
        missing.removeAll(handlers.keySet());
        if (!missing.isEmpty()) {
            throw new SwarmConfigurationException(
                    "Capabilities advertised without a registered handler: " + missing);
        }

        Set<String> unused = new TreeSet<>(handlers.keySet());
        unused.removeAll(capabilities);
        if (!unused.isEmpty()) {
            log.warn("Handlers registered for undeclared capabilities (never polled): {}", unused);
        }
    }

    public Optional<TaskHandler> handlerFor(String taskType) {
        return Optional.ofNullable(handlers.get(taskType));
    }

    public boolean supports(String taskType) {
        return handlers.containsKey(taskType);
    }

    public Set<String> taskTypes() {
        return handlers.keySet();
    }
}
