package org.neuralchilli.swarmlink.worker;

import org.junit.jupiter.api.Test;
import org.neuralchilli.swarmlink.config.SwarmConfigurationException;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskHandlerRegistryTest {

    private static TaskHandler handler(String taskType) {
        return TaskHandler.of(taskType, task -> Map.of("type", task.taskType()));
    }

    @Test
    void shouldLookUpHandlersByType() {
        TaskHandler calc = handler("calc");
        TaskHandlerRegistry registry = TaskHandlerRegistry.of(calc, handler("echo"));

        assertThat(registry.handlerFor("calc")).containsSame(calc);
        assertThat(registry.handlerFor("missing")).isEmpty();
        assertThat(registry.supports("echo")).isTrue();
        assertThat(registry.taskTypes()).containsExactly("calc", "echo");
    }

    @Test
    void shouldRejectDuplicateTypes() {
        assertThatThrownBy(() -> TaskHandlerRegistry.of(handler("calc"), handler("calc")))
                .isInstanceOf(SwarmConfigurationException.class)
                .hasMessageContaining("Duplicate handlers")
                .hasMessageContaining("calc");
    }

    @Test
    void shouldRejectCapabilityWithoutHandler() {
        TaskHandlerRegistry registry = TaskHandlerRegistry.of(handler("calc"));

        assertThatThrownBy(() -> registry.validate(Set.of("calc", "summarize")))
                .isInstanceOf(SwarmConfigurationException.class)
                .hasMessageContaining("summarize");
    }

    @Test
    void shouldAllowUnusedHandlers() {
        TaskHandlerRegistry registry = TaskHandlerRegistry.of(handler("calc"), handler("echo"));

        assertThatCode(() -> registry.validate(Set.of("calc"))).doesNotThrowAnyException();
        assertThatCode(() -> TaskHandlerRegistry.empty().validate(Set.of())).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectBlankLambdaType() {
        assertThatThrownBy(() -> TaskHandler.of(" ", task -> Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
