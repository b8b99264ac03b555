package taskchain.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskchain.engine.service.TaskSummaryView;

/**
 * One task in GET /api/v1/workflows/{id}/tasks.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("stepNumber") int stepNumber,
        @JsonProperty("taskType") String taskType,
        @JsonProperty("status") String status,
        @JsonProperty("dependsOn") Integer dependsOn,
        @JsonProperty("progress") String progress,
        @JsonProperty("output") String output,
        @JsonProperty("error") boolean error) {

    public static TaskResponse from(TaskSummaryView view) {
        return new TaskResponse(
                view.taskId(),
                view.stepNumber(),
                view.taskType(),
                view.status().name(),
                view.dependsOn(),
                view.progress(),
                view.output(),
                view.error());
    }
}
