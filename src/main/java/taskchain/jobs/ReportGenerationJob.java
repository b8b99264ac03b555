package taskchain.jobs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import taskchain.engine.job.Job;
import taskchain.engine.job.JobOutput;
import taskchain.engine.model.ResultData;
import taskchain.engine.model.Task;
import taskchain.engine.model.TaskStatus;
import taskchain.engine.model.TaskView;
import taskchain.engine.repository.ResultRepository;
import taskchain.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the outputs of every earlier step of the workflow into one JSON
 * report. Reports an error if any earlier step is not COMPLETED.
 */
public class ReportGenerationJob implements Job {

    public static final String TASK_TYPE = "report-generation";

    private static final Logger log = LoggerFactory.getLogger(ReportGenerationJob.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TaskRepository taskRepository;
    private final ResultRepository resultRepository;

    public ReportGenerationJob(TaskRepository taskRepository, ResultRepository resultRepository) {
        this.taskRepository = taskRepository;
        this.resultRepository = resultRepository;
    }

    @Override
    public JobOutput run(TaskView task) throws Exception {
        log.info("Running report generation for task {}...", task.taskId());

        List<Task> preceding = taskRepository.findByWorkflowId(task.workflowId()).stream()
                .filter(t -> t.stepNumber() < task.stepNumber())
                .toList();

        List<Task> incomplete = preceding.stream()
                .filter(t -> t.status() != TaskStatus.COMPLETED)
                .toList();
        if (!incomplete.isEmpty()) {
            String ids = incomplete.stream()
                    .map(t -> t.id() + " (step " + t.stepNumber() + ", status: " + t.status() + ")")
                    .collect(Collectors.joining(", "));
            return JobOutput.error("Cannot generate report: " + incomplete.size()
                    + " preceding task(s) are not completed. Incomplete tasks: " + ids + ". "
                    + "Report generation requires all preceding tasks to be completed.");
        }

        ObjectNode report = MAPPER.createObjectNode();
        report.put("workflowId", task.workflowId());
        ArrayNode tasks = report.putArray("tasks");
        int withErrors = 0;
        for (Task t : preceding) {
            ResultData data = resultRepository.findByTaskId(t.id())
                    .map(result -> ResultData.parse(result.data()))
                    .orElse(ResultData.success(""));
            if (data.error()) {
                withErrors++;
            }
            tasks.addObject()
                    .put("taskId", t.id())
                    .put("type", t.taskType())
                    .put("output", data.output())
                    .put("error", data.error());
        }
        report.put("finalReport", "Tasks completed: " + (preceding.size() - withErrors)
                + ". Tasks with errors: " + withErrors + ". Total tasks: " + preceding.size() + ".");

        log.info("Report generated successfully for workflow {}", task.workflowId());
        return JobOutput.success(MAPPER.writeValueAsString(report));
    }
}
