package org.neuralchilli.swarmlink.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskStatusTest {

    @Test
    void shouldOnlyMoveForward() {
        assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.ASSIGNED)).isTrue();
        assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.TIMEOUT)).isTrue();
        assertThat(TaskStatus.ASSIGNED.canTransitionTo(TaskStatus.COMPLETED)).isTrue();
        assertThat(TaskStatus.ASSIGNED.canTransitionTo(TaskStatus.FAILED)).isTrue();

        assertThat(TaskStatus.ASSIGNED.canTransitionTo(TaskStatus.PENDING)).isFalse();
        assertThat(TaskStatus.ASSIGNED.canTransitionTo(TaskStatus.TIMEOUT)).isFalse();
        assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.COMPLETED)).isFalse();
        assertThat(TaskStatus.PENDING.canTransitionTo(null)).isFalse();
    }

    @Test
    void shouldNotLeaveTerminalStates() {
        for (TaskStatus terminal : new TaskStatus[]{TaskStatus.COMPLETED, TaskStatus.FAILED, TaskStatus.TIMEOUT}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (TaskStatus next : TaskStatus.values()) {
                assertThat(terminal.canTransitionTo(next)).isFalse();
            }
        }
        assertThat(TaskStatus.PENDING.isTerminal()).isFalse();
        assertThat(TaskStatus.ASSIGNED.isTerminal()).isFalse();
    }

    @Test
    void shouldReportOutcomeOnlyForCompletedAndFailed() {
        assertThat(TaskStatus.COMPLETED.hasOutcome()).isTrue();
        assertThat(TaskStatus.FAILED.hasOutcome()).isTrue();
        assertThat(TaskStatus.TIMEOUT.hasOutcome()).isFalse();
        assertThat(TaskStatus.PENDING.hasOutcome()).isFalse();
    }

    @Test
    void shouldUseLowercaseWireNames() {
        assertThat(TaskStatus.ASSIGNED.wireName()).isEqualTo("assigned");
        assertThat(TaskStatus.fromWire("completed")).isEqualTo(TaskStatus.COMPLETED);
        assertThat(TaskStatus.fromWire(" Timeout ")).isEqualTo(TaskStatus.TIMEOUT);

        assertThatThrownBy(() -> TaskStatus.fromWire(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TaskStatus.fromWire("running"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldMapNodeStatusWireNames() {
        assertThat(NodeStatus.BUSY.wireName()).isEqualTo("busy");
        assertThat(NodeStatus.fromWire("offline")).isEqualTo(NodeStatus.OFFLINE);
    }
}
