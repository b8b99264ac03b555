package taskchain.engine.model;

/**
 * Read-only projection of a task passed to a {@link taskchain.engine.job.Job}.
 */
public record TaskView(
        String taskId,
        String workflowId,
        int stepNumber,
        String taskType,
        String payload) {
}
