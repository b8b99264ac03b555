package taskchain.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of every error response: {"error":"..."}
 */
public record ErrorResponse(@JsonProperty("error") String error) {

    public ErrorResponse {
        if (error == null) {
            error = "";
        }
    }
}
