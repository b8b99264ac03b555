package taskchain.engine.executor;

import taskchain.engine.aggregator.WorkflowAggregator;
import taskchain.engine.job.Job;
import taskchain.engine.job.JobExecutionException;
import taskchain.engine.job.JobOutput;
import taskchain.engine.job.JobRegistry;
import taskchain.engine.job.UnknownJobTypeException;
import taskchain.engine.model.ResultData;
import taskchain.engine.model.Task;
import taskchain.engine.model.TaskResult;
import taskchain.engine.model.TaskStatus;
import taskchain.engine.repository.ResultRepository;
import taskchain.engine.repository.TaskRepository;
import taskchain.engine.resolver.DependencyResolver;
import taskchain.engine.resolver.Resolution;
import taskchain.engine.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;

/**
 * Drives one task through dependency resolution, job invocation and result
 * persistence, then hands its workflow to the aggregator.
 * <p>
 * Task-level failures (auto-fail, unknown job type, job errors) are recorded
 * as a FAILED status plus an error result and never thrown. Store failures
 * are thrown as {@link StoreException}.
 */
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    static final String STARTING_PROGRESS = "starting job...";

    private final TaskRepository taskRepository;
    private final ResultRepository resultRepository;
    private final JobRegistry jobRegistry;
    private final DependencyResolver resolver;
    private final WorkflowAggregator aggregator;

    public TaskExecutor(TaskRepository taskRepository,
            ResultRepository resultRepository,
            JobRegistry jobRegistry,
            DependencyResolver resolver,
            WorkflowAggregator aggregator) {
        this.taskRepository = taskRepository;
        this.resultRepository = resultRepository;
        this.jobRegistry = jobRegistry;
        this.resolver = resolver;
        this.aggregator = aggregator;
    }

    /**
     * Execute a QUEUED (or BLOCKED) task.
     *
     * @param task the task, as last read from the store
     * @return the task as written by this execution
     * @throws StoreException if persistence fails; the task keeps whatever
     *                        status was last written
     */
    public Task execute(Task task) {
        if (task.isTerminal()) {
            log.warn("Task {} is already {}, nothing to execute", task.id(), task.status());
            return task;
        }

        Resolution resolution = resolver.resolve(task,
                step -> taskRepository.findByWorkflowIdAndStep(task.workflowId(), step));

        Task written;
        if (resolution instanceof Resolution.AutoFailed autoFailed) {
            written = autoFail(task, autoFailed);
        } else if (resolution instanceof Resolution.Blocked) {
            written = block(task);
        } else {
            written = run(task);
        }

        aggregator.recompute(task.workflowId());
        return written;
    }

    private Task autoFail(Task task, Resolution.AutoFailed autoFailed) {
        log.info("Task {} [{}] auto-failed ({}): {}", task.id(), task.stepNumber(), autoFailed.cause(),
                autoFailed.reason());

        TaskResult result = saveResult(task, ResultData.failure(autoFailed.reason()));
        Task failed = finish(task, TaskStatus.FAILED, result);
        taskRepository.update(failed);
        return failed;
    }

    private Task block(Task task) {
        Task blocked = task.transitionTo(TaskStatus.BLOCKED)
                .claimedBy(null)
                .claimedAt(null)
                .build();
        taskRepository.update(blocked);
        return blocked;
    }

    private Task run(Task task) {
        Task running = task.transitionTo(TaskStatus.IN_PROGRESS)
                .progress(STARTING_PROGRESS)
                .startedAt(Instant.now())
                .build();
        taskRepository.update(running);

        ResultData data;
        TaskStatus outcome;
        try {
            log.info("Starting job {} for task {}...", task.taskType(), task.id());
            data = ResultData.success(invoke(running));
            outcome = TaskStatus.COMPLETED;
            log.info("Job {} for task {} completed successfully.", task.taskType(), task.id());
        } catch (JobExecutionException e) {
            log.error("Error running job {} for task {}: {}", task.taskType(), task.id(), e.getMessage(),
                    e.getCause());
            data = ResultData.failure(e.getMessage());
            outcome = TaskStatus.FAILED;
        }

        TaskResult result = saveResult(running, data);
        Task finished = finish(running, outcome, result);
        taskRepository.update(finished);
        return finished;
    }

    /**
     * Look up and run the job of a task.
     *
     * @return the job's output
     * @throws JobExecutionException if the type is unknown or the job fails
     */
    private String invoke(Task task) throws JobExecutionException {
        Job job;
        try {
            job = jobRegistry.lookup(task.taskType());
        } catch (UnknownJobTypeException e) {
            throw new JobExecutionException(e.getMessage(), e);
        }

        JobOutput output;
        try {
            output = job.run(task.view());
        } catch (StoreException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobExecutionException("Job interrupted", e);
        } catch (Throwable e) {
            // Errors raised by job code fail the task like any other job failure
            throw new JobExecutionException(messageOf(e), e);
        }

        if (output == null) {
            return null;
        }
        if (output.error()) {
            throw new JobExecutionException(output.output());
        }
        return output.output();
    }

    private TaskResult saveResult(Task task, ResultData data) {
        TaskResult result = new TaskResult(UUID.randomUUID().toString(), task.id(), data.toJson(), Instant.now());
        resultRepository.save(result);
        return result;
    }

    private static Task finish(Task task, TaskStatus status, TaskResult result) {
        return task.transitionTo(status)
                .resultId(result.id())
                .progress(null)
                .claimedBy(null)
                .claimedAt(null)
                .finishedAt(Instant.now())
                .build();
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
