package taskchain.engine.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads workflow definitions from YAML (JSON documents parse as well).
 */
public final class WorkflowDefinitionLoader {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private WorkflowDefinitionLoader() {
    }

    /**
     * Parse and validate a definition.
     *
     * @throws IllegalArgumentException if the text is not a valid definition
     */
    public static WorkflowDefinition fromYaml(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            throw new IllegalArgumentException("workflow definition is empty");
        }

        WorkflowDefinition definition;
        try {
            definition = YAML.readValue(yaml, WorkflowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid workflow definition: " + e.getOriginalMessage(), e);
        }
        if (definition == null) {
            throw new IllegalArgumentException("workflow definition is empty");
        }
        definition.validate();
        return definition;
    }

    /**
     * Read, parse and validate a definition file.
     */
    public static WorkflowDefinition fromFile(Path path) {
        try {
            return fromYaml(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read workflow definition " + path, e);
        }
    }
}
