package org.neuralchilli.swarmlink.worker;

import org.neuralchilli.swarmlink.domain.SwarmTask;

import java.util.Map;

/**
 * Business logic for one task type, supplied by the host application.
 * <p>
 * Called on a worker thread of the claiming node. A returned map becomes the
 * task's result; a thrown exception marks the task failed with its message.
 */
public interface TaskHandler {

    /**
     * The capability this handler implements.
     */
    String taskType();

    Map<String, Object> execute(SwarmTask task) throws Exception;

    /**
     * Handler from a lambda.
     */
    static TaskHandler of(String taskType, Body body) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("Task type cannot be null or empty");
        }
        return new TaskHandler() {
            @Override
            public String taskType() {
                return taskType;
            }

            @Override
            public Map<String, Object> execute(SwarmTask task) throws Exception {
                return body.execute(task);
            }

            @Override
            public String toString() {
                return "TaskHandler[" + taskType + "]";
            }
        };
    }

    @FunctionalInterface
    interface Body {
        Map<String, Object> execute(SwarmTask task) throws Exception;
    }
}
