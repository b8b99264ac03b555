package taskchain.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskchain.engine.definition.WorkflowDefinition;
import taskchain.engine.definition.WorkflowDefinitionLoader;

/**
 * Request DTO for submitting a workflow.
 * POST /api/v1/workflows
 * <p>
 * The definition is given either inline as JSON ({@code definition}) or as
 * YAML text ({@code definitionYaml}), never both.
 */
public record CreateWorkflowRequest(
        @JsonProperty("clientId") String clientId,
        @JsonProperty("payload") String payload,
        @JsonProperty("definition") WorkflowDefinition definition,
        @JsonProperty("definitionYaml") String definitionYaml) {

    /** Resolve the workflow definition carried by this request */
    public WorkflowDefinition resolveDefinition() {
        WorkflowDefinition resolved = definition != null
                ? definition
                : WorkflowDefinitionLoader.fromYaml(definitionYaml);
        resolved.validate();
        return resolved;
    }

    /** Validate the request */
    public void validate() {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        boolean hasYaml = definitionYaml != null && !definitionYaml.isBlank();
        if (definition == null && !hasYaml) {
            throw new IllegalArgumentException("definition or definitionYaml is required");
        }
        if (definition != null && hasYaml) {
            throw new IllegalArgumentException("only one of definition and definitionYaml may be given");
        }
    }
}
