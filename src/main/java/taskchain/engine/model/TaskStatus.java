package taskchain.engine.model;

/**
 * Task execution status.
 * <p>
 * Transitions:
 * <ul>
 * <li>QUEUED → BLOCKED, FAILED, IN_PROGRESS</li>
 * <li>BLOCKED → QUEUED (unblocked by the aggregator), FAILED, IN_PROGRESS</li>
 * <li>IN_PROGRESS → COMPLETED, FAILED</li>
 * </ul>
 * COMPLETED and FAILED are terminal.
 */
public enum TaskStatus {
    /** Ready to be picked up by a worker */
    QUEUED,
    /** Job is running */
    IN_PROGRESS,
    /** Job finished successfully */
    COMPLETED,
    /** Job failed, or the task was auto-failed by dependency resolution */
    FAILED,
    /** Waiting for its dependency to reach a terminal state */
    BLOCKED;

    public boolean isTerminal() {
        return switch (this) {
            case COMPLETED, FAILED -> true;
            case QUEUED, IN_PROGRESS, BLOCKED -> false;
        };
    }

    /** Whether a task in this status may move to {@code next}. */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case QUEUED -> next == BLOCKED || next == FAILED || next == IN_PROGRESS;
            case BLOCKED -> next == QUEUED || next == FAILED || next == IN_PROGRESS;
            case IN_PROGRESS -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
