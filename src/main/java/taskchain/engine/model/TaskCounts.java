package taskchain.engine.model;

import java.util.List;

/**
 * Per-status task counts of one workflow snapshot.
 */
public record TaskCounts(int total, int queued, int inProgress, int completed, int failed, int blocked) {

    public static TaskCounts of(List<Task> tasks) {
        int queued = 0, inProgress = 0, completed = 0, failed = 0, blocked = 0;
        for (Task task : tasks) {
            switch (task.status()) {
                case QUEUED -> queued++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case BLOCKED -> blocked++;
            }
        }
        return new TaskCounts(tasks.size(), queued, inProgress, completed, failed, blocked);
    }

    /** Every task is COMPLETED or FAILED */
    public boolean allTerminal() {
        return completed + failed == total;
    }

    /** Nothing is QUEUED or IN_PROGRESS and at least one task waits on a dependency */
    public boolean onlyBlockedRemain() {
        return blocked > 0 && blocked + completed + failed == total;
    }
}
