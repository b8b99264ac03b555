package taskchain.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Body of {@link TaskResult#data()}.
 * Format: {"output":"...","error":false}
 */
public record ResultData(
        @JsonProperty("output") String output,
        @JsonProperty("error") boolean error) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static ResultData success(String output) {
        return new ResultData(output, false);
    }

    public static ResultData failure(String reason) {
        return new ResultData(reason, true);
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize result data", e);
        }
    }

    /**
     * Parse a stored result document.
     * A document that is not a JSON object is treated as a plain successful output.
     */
    public static ResultData parse(String json) {
        if (json == null || json.isBlank()) {
            return success(null);
        }
        try {
            JsonNode root = MAPPER.readTree(json);
            if (!root.isObject()) {
                return success(root.isTextual() ? root.asText() : root.toString());
            }
            JsonNode output = root.get("output");
            String text = output == null || output.isNull() ? null
                    : output.isTextual() ? output.asText() : output.toString();
            return new ResultData(text, root.path("error").asBoolean(false));
        } catch (JsonProcessingException e) {
            // Written by something other than the engine; keep it verbatim
            return success(json);
        }
    }
}
