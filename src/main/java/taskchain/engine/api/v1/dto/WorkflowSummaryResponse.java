package taskchain.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskchain.engine.model.Workflow;

import java.time.Instant;

/**
 * One entry of GET /api/v1/workflows.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowSummaryResponse(
        @JsonProperty("workflowId") String workflowId,
        @JsonProperty("name") String name,
        @JsonProperty("clientId") String clientId,
        @JsonProperty("status") String status,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static WorkflowSummaryResponse from(Workflow workflow) {
        return new WorkflowSummaryResponse(
                workflow.id(),
                workflow.name(),
                workflow.clientId(),
                workflow.status().name(),
                workflow.createdAt(),
                workflow.finishedAt());
    }
}
