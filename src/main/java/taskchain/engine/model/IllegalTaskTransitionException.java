package taskchain.engine.model;

/**
 * Thrown when code attempts a task status change the state machine does not allow.
 */
public class IllegalTaskTransitionException extends IllegalStateException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalTaskTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("Task " + taskId + " cannot move from " + from + " to " + to);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String taskId() {
        return taskId;
    }

    public TaskStatus from() {
        return from;
    }

    public TaskStatus to() {
        return to;
    }
}
