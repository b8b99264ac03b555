package taskchain.engine.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskchain.engine.api.Controller.ControllerResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ControllerResponseTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("Error messages with quotes and control characters stay valid JSON")
    void errorBodyIsEscaped() throws Exception {
        String message = "bad \"value\"\tat\u0001line\n2 \\ end";

        ControllerResponse response = ControllerResponse.badRequest(message);

        assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
        assertEquals("application/json", response.contentType());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals(message, body.get("error").asText());
    }

    @Test
    void nullMessageGivesEmptyError() throws Exception {
        ControllerResponse response = ControllerResponse.error(null);

        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, response.status());
        assertEquals("", MAPPER.readTree(response.body()).get("error").asText());
    }

    @Test
    void notFound() throws Exception {
        ControllerResponse response = ControllerResponse.notFound("Workflow not found");

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertEquals("{\"error\":\"Workflow not found\"}", response.body());
    }
}
