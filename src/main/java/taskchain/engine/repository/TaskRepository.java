package taskchain.engine.repository;

import taskchain.engine.model.Task;
import taskchain.engine.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Task persistence.
 * Every write is durable when the method returns.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     * 
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Save multiple tasks in a batch.
     * 
     * @param tasks the tasks to save
     */
    void saveAll(List<Task> tasks);

    /**
     * Overwrite the mutable state of an existing task (status, progress,
     * result, claim and timestamps).
     * 
     * @param task the task with its new state
     * @return true if a row was updated
     */
    boolean update(Task task);

    /**
     * Find a task by ID.
     * 
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Find all tasks of a workflow, ordered by step number.
     * 
     * @param workflowId the workflow ID
     * @return list of tasks
     */
    List<Task> findByWorkflowId(String workflowId);

    /**
     * Find the task holding a step number inside a workflow.
     * 
     * @param workflowId the workflow ID
     * @param stepNumber the step number
     * @return the task if found
     */
    Optional<Task> findByWorkflowIdAndStep(String workflowId, int stepNumber);

    /**
     * Atomically claim the oldest unclaimed QUEUED task for a worker.
     * The status stays QUEUED; only the claim columns change.
     * 
     * @param workerId the worker claiming the task
     * @return the claimed task, or empty if nothing is queued
     */
    Optional<Task> claimNext(String workerId);

    /**
     * Release claims on QUEUED tasks that were claimed before the cutoff.
     * Used by the reaper to recover tasks whose worker died before
     * writing a status.
     * 
     * @param claimedBefore claims older than this are considered stale
     * @return number of claims released
     */
    int releaseStaleClaims(Instant claimedBefore);

    /**
     * Move every BLOCKED task of a workflow back to QUEUED.
     * 
     * @param workflowId the workflow ID
     * @return number of tasks re-queued
     */
    int requeueBlocked(String workflowId);

    /**
     * Count tasks in a status across all workflows.
     * 
     * @param status the status
     * @return count
     */
    int countByStatus(TaskStatus status);
}
