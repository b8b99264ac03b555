package taskchain.engine.service;

import taskchain.engine.definition.WorkflowDefinition;
import taskchain.engine.definition.WorkflowStep;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Business logic for workflow submission and status queries.
 */
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final WorkflowRepository workflowRepository;
    private final TaskRepository taskRepository;
    private final ResultRepository resultRepository;

    public WorkflowService(WorkflowRepository workflowRepository, TaskRepository taskRepository,
            ResultRepository resultRepository) {
        this.workflowRepository = workflowRepository;
        this.taskRepository = taskRepository;
        this.resultRepository = resultRepository;
    }

    /**
     * Create a workflow and queue one task per step.
     *
     * @param definition the workflow definition
     * @param clientId   the submitting client
     * @param payload    job input copied to every task (may be null)
     * @return created workflow
     */
    public Workflow createWorkflow(WorkflowDefinition definition, String clientId, String payload) {
        definition.validate();

        Instant now = Instant.now();
        Workflow workflow = Workflow.builder()
                .id(UUID.randomUUID().toString())
                .clientId(clientId)
                .name(definition.name())
                .status(WorkflowStatus.INITIAL)
                .createdAt(now)
                .build();

        workflowRepository.save(workflow);

        List<Task> tasks = new ArrayList<>();
        for (WorkflowStep step : definition.steps()) {
            tasks.add(Task.builder()
                    .id(UUID.randomUUID().toString())
                    .workflowId(workflow.id())
                    .clientId(clientId)
                    .stepNumber(step.stepNumber())
                    .taskType(step.taskType())
                    .status(TaskStatus.QUEUED)
                    .dependsOn(step.dependsOn())
                    .payload(payload)
                    .createdAt(now)
                    .build());
        }
        taskRepository.saveAll(tasks);

        log.info("Created workflow {} '{}' with {} tasks for client {}",
                workflow.id(), workflow.name(), tasks.size(), clientId);
        return workflow;
    }

    public Optional<Workflow> findById(String workflowId) {
        return workflowRepository.findById(workflowId);
    }

    public List<Workflow> findRecent(int limit) {
        return workflowRepository.findRecent(limit);
    }

    /**
     * Tasks of a workflow in step order, each with its result output.
     *
     * @return empty if the workflow does not exist
     */
    public Optional<List<TaskSummaryView>> getTasks(String workflowId) {
        if (workflowRepository.findById(workflowId).isEmpty()) {
            return Optional.empty();
        }

        List<TaskSummaryView> views = new ArrayList<>();
        for (Task task : taskRepository.findByWorkflowId(workflowId)) {
            ResultData data = task.resultId() == null ? null
                    : resultRepository.findById(task.resultId())
                            .map(result -> ResultData.parse(result.data()))
                            .orElse(null);
            views.add(new TaskSummaryView(task.id(), task.stepNumber(), task.taskType(), task.status(),
                    task.dependsOn(), task.progress(),
                    data != null ? data.output() : null,
                    data != null && data.error()));
        }
        return Optional.of(views);
    }

    /**
     * Current status and task counts of a workflow.
     *
     * @return empty if the workflow does not exist
     */
    public Optional<WorkflowStatusView> getStatus(String workflowId) {
        return workflowRepository.findById(workflowId).map(workflow -> {
            TaskCounts counts = TaskCounts.of(taskRepository.findByWorkflowId(workflowId));
            return new WorkflowStatusView(workflow.id(), workflow.status(),
                    counts.completed(), counts.failed(), counts.total());
        });
    }

    /**
     * Final result of a workflow. Check {@link WorkflowResultView#isReady()}
     * before using the text.
     *
     * @return empty if the workflow does not exist
     */
    public Optional<WorkflowResultView> getResult(String workflowId) {
        return workflowRepository.findById(workflowId)
                .map(workflow -> new WorkflowResultView(workflow.id(), workflow.status(), workflow.finalResult()));
    }

    /**
     * Count tasks currently queued across all workflows.
     */
    public int countQueued() {
        return taskRepository.countByStatus(TaskStatus.QUEUED);
    }

    /**
     * Count tasks currently running across all workflows.
     */
    public int countInProgress() {
        return taskRepository.countByStatus(TaskStatus.IN_PROGRESS);
    }
}
