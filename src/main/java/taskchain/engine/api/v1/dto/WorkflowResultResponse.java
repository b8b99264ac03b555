package taskchain.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskchain.engine.service.WorkflowResultView;

/**
 * Response DTO for the final result of a finished workflow.
 * GET /api/v1/workflows/{id}/results
 */
public record WorkflowResultResponse(
        @JsonProperty("workflowId") String workflowId,
        @JsonProperty("status") String status,
        @JsonProperty("finalResult") String finalResult) {

    public static WorkflowResultResponse from(WorkflowResultView view) {
        return new WorkflowResultResponse(view.workflowId(), view.status().name(), view.finalResult());
    }
}
