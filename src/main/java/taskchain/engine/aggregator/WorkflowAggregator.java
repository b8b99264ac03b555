package taskchain.engine.aggregator;

import taskchain.engine.model.ResultData;
import taskchain.engine.model.Task;
import taskchain.engine.model.TaskCounts;
import taskchain.engine.model.TaskStatus;
import taskchain.engine.model.Workflow;
import taskchain.engine.model.WorkflowStatus;
import taskchain.engine.repository.ResultRepository;
import taskchain.engine.repository.TaskRepository;
import taskchain.engine.repository.WorkflowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives a workflow's status and final result from its tasks, and puts
 * BLOCKED tasks back in the queue once nothing else in the workflow can
 * make progress.
 * <p>
 * A terminal workflow is never recomputed. A workflow with at least one
 * failed task ends FAILED.
 */
public class WorkflowAggregator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowAggregator.class);

    private final WorkflowRepository workflowRepository;
    private final TaskRepository taskRepository;
    private final ResultRepository resultRepository;

    public WorkflowAggregator(WorkflowRepository workflowRepository,
            TaskRepository taskRepository,
            ResultRepository resultRepository) {
        this.workflowRepository = workflowRepository;
        this.taskRepository = taskRepository;
        this.resultRepository = resultRepository;
    }

    /**
     * Recompute a workflow from the current snapshot of its tasks.
     * Serialized so that concurrent workers never interleave two recomputes.
     *
     * @param workflowId the workflow ID
     * @return the workflow as stored after recomputation, or empty if unknown
     */
    public synchronized Optional<Workflow> recompute(String workflowId) {
        Optional<Workflow> workflowOpt = workflowRepository.findById(workflowId);
        if (workflowOpt.isEmpty()) {
            log.warn("Cannot recompute unknown workflow {}", workflowId);
            return Optional.empty();
        }

        Workflow workflow = workflowOpt.get();
        if (workflow.isTerminal()) {
            return Optional.of(workflow);
        }

        List<Task> tasks = taskRepository.findByWorkflowId(workflowId);
        TaskCounts counts = TaskCounts.of(tasks);

        Workflow updated;
        if (counts.allTerminal()) {
            WorkflowStatus status = counts.failed() == 0 ? WorkflowStatus.COMPLETED : WorkflowStatus.FAILED;
            updated = workflow.toBuilder()
                    .status(status)
                    .finalResult(summarize(tasks, counts))
                    .finishedAt(Instant.now())
                    .build();
            log.info("Workflow {} finished with final result: {}", workflowId, updated.finalResult());
        } else {
            updated = workflow.toBuilder()
                    .status(WorkflowStatus.IN_PROGRESS)
                    .build();
        }

        if (updated.status() != workflow.status() || !Objects.equals(updated.finalResult(), workflow.finalResult())) {
            workflowRepository.update(updated);
        }

        if (updated.status() == WorkflowStatus.IN_PROGRESS && counts.onlyBlockedRemain()) {
            int requeued = taskRepository.requeueBlocked(workflowId);
            log.info("Workflow {}: every open task was blocked, re-queued {}", workflowId, requeued);
        }

        return Optional.of(updated);
    }

    private String summarize(List<Task> tasks, TaskCounts counts) {
        if (counts.failed() == 0) {
            return "Workflow finished with " + counts.completed() + " task(s) completed.";
        }

        StringBuilder summary = new StringBuilder()
                .append("Workflow finished with ").append(counts.completed()).append(" task(s) completed and ")
                .append(counts.failed()).append(" task(s) failed. Errors: ");

        // tasks arrive in step order, which keeps the text stable across recomputes
        for (Task task : tasks) {
            if (task.status() != TaskStatus.FAILED) {
                continue;
            }
            resultRepository.findByTaskId(task.id()).ifPresent(result -> summary
                    .append(" Task ").append(task.id())
                    .append(" failed with ").append(ResultData.parse(result.data()).output())
                    .append('.'));
        }
        return summary.toString();
    }
}
