package taskchain.engine.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import taskchain.engine.definition.WorkflowDefinition;
import taskchain.engine.definition.WorkflowStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CreateWorkflowRequestTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final WorkflowDefinition DEFINITION = new WorkflowDefinition("wf",
            List.of(new WorkflowStep("echo", 1, null)));

    @Test
    void deserializeInlineDefinition() throws Exception {
        String json = """
                {
                  "clientId": "client-1",
                  "payload": "{\\"type\\":\\"Polygon\\"}",
                  "definition": {
                    "name": "wf",
                    "steps": [
                      {"taskType": "polygon-area", "stepNumber": 1},
                      {"taskType": "report-generation", "stepNumber": 2, "dependsOn": 1}
                    ]
                  }
                }
                """;

        CreateWorkflowRequest request = MAPPER.readValue(json, CreateWorkflowRequest.class);
        request.validate();

        assertEquals("client-1", request.clientId());
        assertEquals("{\"type\":\"Polygon\"}", request.payload());
        WorkflowDefinition definition = request.resolveDefinition();
        assertEquals(2, definition.steps().size());
        assertEquals(1, definition.steps().get(1).dependsOn());
    }

    @Test
    void resolvesYamlDefinition() {
        CreateWorkflowRequest request = new CreateWorkflowRequest("client-1", null, null, """
                name: from-yaml
                steps:
                  - taskType: echo
                    stepNumber: 1
                """);

        request.validate();
        assertEquals("from-yaml", request.resolveDefinition().name());
    }

    @Test
    void validateRequiresClientId() {
        CreateWorkflowRequest request = new CreateWorkflowRequest(" ", null, DEFINITION, null);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, request::validate);
        assertEquals("clientId is required", e.getMessage());
    }

    @Test
    void validateRequiresADefinition() {
        CreateWorkflowRequest request = new CreateWorkflowRequest("client-1", null, null, null);

        assertThrows(IllegalArgumentException.class, request::validate);
    }

    @Test
    void validateRejectsBothDefinitions() {
        CreateWorkflowRequest request = new CreateWorkflowRequest("client-1", null, DEFINITION, "name: x");

        assertThrows(IllegalArgumentException.class, request::validate);
    }

    @Test
    void resolveValidatesInlineDefinition() {
        CreateWorkflowRequest request = new CreateWorkflowRequest("client-1", null,
                new WorkflowDefinition("empty", List.of()), null);

        assertThrows(IllegalArgumentException.class, request::resolveDefinition);
    }
}
