package taskchain.engine.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    @DisplayName("Only COMPLETED and FAILED are terminal")
    void terminalStates() {
        assertTrue(TaskStatus.COMPLETED.isTerminal());
        assertTrue(TaskStatus.FAILED.isTerminal());
        assertFalse(TaskStatus.QUEUED.isTerminal());
        assertFalse(TaskStatus.IN_PROGRESS.isTerminal());
        assertFalse(TaskStatus.BLOCKED.isTerminal());
    }

    @Test
    void queuedTransitions() {
        assertTrue(TaskStatus.QUEUED.canTransitionTo(TaskStatus.BLOCKED));
        assertTrue(TaskStatus.QUEUED.canTransitionTo(TaskStatus.FAILED));
        assertTrue(TaskStatus.QUEUED.canTransitionTo(TaskStatus.IN_PROGRESS));
        assertFalse(TaskStatus.QUEUED.canTransitionTo(TaskStatus.COMPLETED));
    }

    @Test
    void blockedCanBeRequeued() {
        assertTrue(TaskStatus.BLOCKED.canTransitionTo(TaskStatus.QUEUED));
        assertTrue(TaskStatus.BLOCKED.canTransitionTo(TaskStatus.IN_PROGRESS));
        assertTrue(TaskStatus.BLOCKED.canTransitionTo(TaskStatus.FAILED));
        assertFalse(TaskStatus.BLOCKED.canTransitionTo(TaskStatus.COMPLETED));
    }

    @Test
    void inProgressOnlyFinishes() {
        assertTrue(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.COMPLETED));
        assertTrue(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.FAILED));
        assertFalse(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.QUEUED));
        assertFalse(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.BLOCKED));
    }

    @Test
    @DisplayName("Terminal states have no outgoing transitions")
    void terminalStatesAreFinal() {
        for (TaskStatus next : TaskStatus.values()) {
            assertFalse(TaskStatus.COMPLETED.canTransitionTo(next));
            assertFalse(TaskStatus.FAILED.canTransitionTo(next));
        }
    }

    @Test
    @DisplayName("Task.transitionTo rejects an illegal move")
    void illegalTransitionThrows() {
        Task done = Task.builder()
                .id("t-1")
                .workflowId("wf-1")
                .stepNumber(1)
                .taskType("echo")
                .status(TaskStatus.COMPLETED)
                .createdAt(Instant.now())
                .build();

        IllegalTaskTransitionException e = assertThrows(IllegalTaskTransitionException.class,
                () -> done.transitionTo(TaskStatus.IN_PROGRESS));
        assertEquals(TaskStatus.COMPLETED, e.from());
        assertEquals(TaskStatus.IN_PROGRESS, e.to());
    }

    @Test
    void transitionKeepsOtherFields() {
        Task queued = Task.builder()
                .id("t-2")
                .workflowId("wf-1")
                .stepNumber(2)
                .taskType("echo")
                .dependsOn(1)
                .payload("hello")
                .build();

        Task blocked = queued.transitionTo(TaskStatus.BLOCKED).build();

        assertEquals(TaskStatus.BLOCKED, blocked.status());
        assertEquals(1, blocked.dependsOn());
        assertEquals("hello", blocked.payload());
        assertEquals(TaskStatus.QUEUED, queued.status());
    }
}
