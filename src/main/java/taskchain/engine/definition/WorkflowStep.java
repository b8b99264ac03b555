package taskchain.engine.definition;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One step of a workflow definition.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowStep(
        @JsonProperty("taskType") String taskType,
        @JsonProperty("stepNumber") int stepNumber,
        @JsonProperty("dependsOn") Integer dependsOn) {
}
