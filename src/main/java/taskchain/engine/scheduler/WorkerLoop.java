package taskchain.engine.scheduler;

import taskchain.engine.executor.TaskExecutor;
import taskchain.engine.model.Task;
import taskchain.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Polling consumer: claim one QUEUED task → execute → repeat.
 * Sleeps for the idle interval when the queue is empty.
 * Stops on {@link #stop()} or Thread.interrupt().
 */
public final class WorkerLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    private final String workerId;
    private final TaskRepository taskRepository;
    private final TaskExecutor executor;
    private final Duration idleSleep;

    private volatile boolean stopped = false;

    public WorkerLoop(String workerId, TaskRepository taskRepository, TaskExecutor executor, Duration idleSleep) {
        this.workerId = workerId;
        this.taskRepository = taskRepository;
        this.executor = executor;
        this.idleSleep = idleSleep;
    }

    /**
     * Claim and execute at most one task.
     *
     * @return true if a task was executed, false if nothing was queued
     */
    public boolean pollOnce() {
        Optional<Task> claimed = taskRepository.claimNext(workerId);
        if (claimed.isEmpty()) {
            return false;
        }

        Task task = claimed.get();
        log.debug("Worker {} executing task {}", workerId, task);
        executor.execute(task);
        return true;
    }

    @Override
    public void run() {
        log.info("Worker {} started", workerId);

        while (!stopped && !Thread.currentThread().isInterrupted()) {
            try {
                if (!pollOnce()) {
                    Thread.sleep(idleSleep.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Throwable e) {
                // A failed task must not end the loop
                log.error("Worker {} failed to process a task", workerId, e);
                try {
                    Thread.sleep(idleSleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("Worker {} stopped", workerId);
    }

    public void stop() {
        stopped = true;
    }
}
