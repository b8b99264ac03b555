package taskchain.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("queuedTasks") Integer queuedTasks,
        @JsonProperty("inProgressTasks") Integer inProgressTasks,
        @JsonProperty("jobTypes") Integer jobTypes) {

    public static HealthResponse healthy(String uptime, int queuedTasks, int inProgressTasks, int jobTypes) {
        return new HealthResponse("healthy", "ok", uptime, queuedTasks, inProgressTasks, jobTypes);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null);
    }
}
