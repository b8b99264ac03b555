package taskchain.engine.service;

import taskchain.engine.model.TaskStatus;

/**
 * One task of a workflow with the output of its result, if any.
 */
public record TaskSummaryView(
        String taskId,
        int stepNumber,
        String taskType,
        TaskStatus status,
        Integer dependsOn,
        String progress,
        String output,
        boolean error) {
}
