package taskchain.engine.job;

import taskchain.engine.model.TaskView;

/**
 * A unit of business logic selected by task type.
 * <p>
 * A job reports failure either by throwing or by returning
 * {@link JobOutput#error(String)}; both end the task FAILED.
 */
public interface Job {

    /**
     * Run the job for one task.
     *
     * @param task the task being executed
     * @return the output to store in the task's result
     * @throws Exception if the job fails
     */
    JobOutput run(TaskView task) throws Exception;
}
