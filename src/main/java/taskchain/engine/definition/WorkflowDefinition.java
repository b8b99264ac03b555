package taskchain.engine.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A named list of steps, as written in a workflow file:
 * 
 * <pre>
 * name: "example_workflow"
 * steps:
 *   - taskType: "polygon-area"
 *     stepNumber: 1
 *   - taskType: "report-generation"
 *     stepNumber: 2
 *     dependsOn: 1
 * </pre>
 * 
 * Dangling or cyclic {@code dependsOn} values are accepted here; dependency
 * resolution fails those tasks at run time.
 */
public record WorkflowDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("steps") List<WorkflowStep> steps) {

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("workflow name is required");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("workflow must have at least one step");
        }

        Set<Integer> seen = new HashSet<>();
        for (WorkflowStep step : steps) {
            if (step == null) {
                throw new IllegalArgumentException("workflow steps must not be null");
            }
            if (step.taskType() == null || step.taskType().isBlank()) {
                throw new IllegalArgumentException("step " + step.stepNumber() + " has no taskType");
            }
            if (!seen.add(step.stepNumber())) {
                throw new IllegalArgumentException("duplicate stepNumber " + step.stepNumber());
            }
        }
    }
}
