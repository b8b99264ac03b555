package taskchain.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted outcome of one task execution attempt. Never updated once saved.
 *
 * @param id        result ID
 * @param taskId    owning task
 * @param data      JSON document {@code {"output": ..., "error": ...}}
 * @param createdAt creation time
 */
public record TaskResult(String id, String taskId, String data, Instant createdAt) {

    public TaskResult {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(taskId, "taskId is required");
        Objects.requireNonNull(data, "data is required");
    }
}
