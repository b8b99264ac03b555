package taskchain.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateWorkflowResponse(
        @JsonProperty("workflowId") String workflowId,
        @JsonProperty("totalTasks") int totalTasks) {
}
