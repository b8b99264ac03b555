package taskchain.engine.job;

/**
 * No job is registered for a task type.
 */
public class UnknownJobTypeException extends RuntimeException {

    private final String taskType;

    public UnknownJobTypeException(String taskType) {
        super("No job found for task type: " + taskType);
        this.taskType = taskType;
    }

    public String taskType() {
        return taskType;
    }
}
