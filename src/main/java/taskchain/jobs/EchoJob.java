package taskchain.jobs;

import taskchain.engine.job.Job;
import taskchain.engine.job.JobOutput;
import taskchain.engine.model.TaskView;

/**
 * Returns the task payload unchanged.
 */
public class EchoJob implements Job {

    public static final String TASK_TYPE = "echo";

    @Override
    public JobOutput run(TaskView task) {
        return JobOutput.success(task.payload());
    }
}
