package taskchain.engine.model;

/**
 * Aggregate status of a workflow.
 */
public enum WorkflowStatus {
    /** Created, no task evaluated yet */
    INITIAL,
    /** At least one task evaluated, not all tasks terminal */
    IN_PROGRESS,
    /** All tasks completed successfully */
    COMPLETED,
    /** All tasks terminal, at least one failed */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
