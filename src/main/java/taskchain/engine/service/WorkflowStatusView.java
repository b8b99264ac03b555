package taskchain.engine.service;

import taskchain.engine.model.WorkflowStatus;

/**
 * Progress of a workflow, as reported to clients.
 */
public record WorkflowStatusView(
        String workflowId,
        WorkflowStatus status,
        int completedTasks,
        int failedTasks,
        int totalTasks) {
}
