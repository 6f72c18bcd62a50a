package org.neuralchilli.swarmlink.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskStatusRecordTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void shouldWalkHappyPath() {
        TaskStatusRecord pending = TaskStatusRecord.pending(CREATED);
        assertThat(pending.isClaimable()).isTrue();

        TaskStatusRecord assigned = pending.claim("node-a", CREATED.plusSeconds(1));
        assertThat(assigned.status()).isEqualTo(TaskStatus.ASSIGNED);
        assertThat(assigned.assignedTo()).isEqualTo("node-a");
        assertThat(assigned.assignedAt()).isEqualTo(CREATED.plusSeconds(1));
        assertThat(assigned.isClaimable()).isFalse();

        TaskStatusRecord completed = assigned.complete(Map.of("value", 4), CREATED.plusSeconds(2));
        assertThat(completed.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(completed.result()).containsEntry("value", 4);
        assertThat(completed.assignedTo()).isEqualTo("node-a");
        assertThat(completed.createdAt()).isEqualTo(CREATED);
        assertThat(completed.completedAt()).isEqualTo(CREATED.plusSeconds(2));
    }

    @Test
    void shouldRecordFailure() {
        TaskStatusRecord failed = TaskStatusRecord.pending(CREATED)
                .claim("node-a", CREATED)
                .fail("division by zero", CREATED.plusSeconds(3));

        assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(failed.error()).isEqualTo("division by zero");
        assertThat(failed.failedAt()).isEqualTo(CREATED.plusSeconds(3));
        assertThat(failed.result()).isNull();
    }

    @Test
    void shouldRetractOnlyUnclaimedTasks() {
        TaskStatusRecord retracted = TaskStatusRecord.pending(CREATED).retract(CREATED.plusSeconds(10));

        assertThat(retracted.status()).isEqualTo(TaskStatus.TIMEOUT);
        assertThat(retracted.retractedAt()).isEqualTo(CREATED.plusSeconds(10));
        assertThat(retracted.isClaimable()).isFalse();

        TaskStatusRecord assigned = TaskStatusRecord.pending(CREATED).claim("node-a", CREATED);
        assertThatThrownBy(() -> assigned.retract(CREATED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldNeverRegress() {
        TaskStatusRecord completed = TaskStatusRecord.pending(CREATED)
                .claim("node-a", CREATED)
                .complete(Map.of(), CREATED);

        assertThatThrownBy(() -> completed.claim("node-b", CREATED))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> completed.fail("late", CREATED))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> TaskStatusRecord.pending(CREATED).complete(Map.of(), CREATED))
                .isInstanceOf(IllegalStateException.class);
    }
}
