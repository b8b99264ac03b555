package taskchain.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskchain.engine.service.WorkflowStatusView;

/**
 * Response DTO for workflow progress.
 * GET /api/v1/workflows/{id}/status
 */
public record WorkflowStatusResponse(
        @JsonProperty("workflowId") String workflowId,
        @JsonProperty("status") String status,
        @JsonProperty("completedTasks") int completedTasks,
        @JsonProperty("failedTasks") int failedTasks,
        @JsonProperty("totalTasks") int totalTasks) {

    public static WorkflowStatusResponse from(WorkflowStatusView view) {
        return new WorkflowStatusResponse(
                view.workflowId(),
                view.status().name(),
                view.completedTasks(),
                view.failedTasks(),
                view.totalTasks());
    }
}
