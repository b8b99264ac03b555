package taskchain.engine.repository;

import taskchain.engine.model.TaskResult;

import java.util.Optional;

/**
 * Repository interface for task results. Results are insert-only.
 */
public interface ResultRepository {

    /**
     * Save a new result.
     * 
     * @param result the result to save
     */
    void save(TaskResult result);

    /**
     * Find a result by ID.
     * 
     * @param resultId the result ID
     * @return the result if found
     */
    Optional<TaskResult> findById(String resultId);

    /**
     * Find the most recent result written for a task.
     * 
     * @param taskId the task ID
     * @return the result if found
     */
    Optional<TaskResult> findByTaskId(String taskId);
}
