package taskchain.engine.aggregator;

import taskchain.engine.config.EngineConfig;
import taskchain.engine.model.ResultData;
import taskchain.engine.model.Task;
import taskchain.engine.model.TaskResult;
import taskchain.engine.model.TaskStatus;
import taskchain.engine.model.Workflow;
import taskchain.engine.model.WorkflowStatus;
import taskchain.engine.store.Database;
import taskchain.engine.store.JdbcResultRepository;
import taskchain.engine.store.JdbcTaskRepository;
import taskchain.engine.store.JdbcWorkflowRepository;
import org.junit.jupiter.api.*;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowAggregatorTest {

    private static Database db;
    private static JdbcWorkflowRepository workflows;
    private static JdbcTaskRepository tasks;
    private static JdbcResultRepository results;
    private static WorkflowAggregator aggregator;

    @BeforeAll
    static void setup() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-aggregator;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        workflows = new JdbcWorkflowRepository(db);
        tasks = new JdbcTaskRepository(db);
        results = new JdbcResultRepository(db);
        aggregator = new WorkflowAggregator(workflows, tasks, results);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM results");
            st.execute("DELETE FROM tasks");
            st.execute("DELETE FROM workflows");
            conn.commit();
        }
        workflows.save(Workflow.builder()
                .id("wf-1")
                .clientId("client-1")
                .name("test")
                .createdAt(Instant.now())
                .build());
    }

    private static Task addTask(int step, TaskStatus status) {
        Task task = Task.builder()
                .id("task-" + step)
                .workflowId("wf-1")
                .stepNumber(step)
                .taskType("echo")
                .status(status)
                .createdAt(Instant.now())
                .build();
        tasks.save(task);
        return task;
    }

    private static void addResult(Task task, ResultData data) {
        results.save(new TaskResult("result-" + task.id(), task.id(), data.toJson(), Instant.now()));
    }

    @Test
    void unknownWorkflowIsEmpty() {
        assertTrue(aggregator.recompute("missing").isEmpty());
    }

    @Test
    @DisplayName("Open tasks move the workflow to IN_PROGRESS without a final result")
    void openTasksMeanInProgress() {
        addTask(1, TaskStatus.COMPLETED);
        addTask(2, TaskStatus.QUEUED);

        Workflow workflow = aggregator.recompute("wf-1").orElseThrow();

        assertEquals(WorkflowStatus.IN_PROGRESS, workflow.status());
        assertNull(workflow.finalResult());
        assertEquals(WorkflowStatus.IN_PROGRESS, workflows.findById("wf-1").orElseThrow().status());
    }

    @Test
    void allCompletedMeansCompleted() {
        addTask(1, TaskStatus.COMPLETED);
        addTask(2, TaskStatus.COMPLETED);

        Workflow workflow = aggregator.recompute("wf-1").orElseThrow();

        assertEquals(WorkflowStatus.COMPLETED, workflow.status());
        assertEquals("Workflow finished with 2 task(s) completed.", workflow.finalResult());
        assertNotNull(workflows.findById("wf-1").orElseThrow().finishedAt());
    }

    @Test
    @DisplayName("Any failed task fails the workflow and its error is listed")
    void failedTaskFailsWorkflow() {
        addTask(1, TaskStatus.COMPLETED);
        Task failed = addTask(2, TaskStatus.FAILED);
        addResult(failed, ResultData.failure("no polygon"));

        Workflow workflow = aggregator.recompute("wf-1").orElseThrow();

        assertEquals(WorkflowStatus.FAILED, workflow.status());
        assertEquals("Workflow finished with 1 task(s) completed and 1 task(s) failed. Errors:  Task task-2 "
                + "failed with no polygon.", workflow.finalResult());
    }

    @Test
    @DisplayName("Recompute is idempotent")
    void idempotent() {
        addTask(1, TaskStatus.COMPLETED);
        addTask(2, TaskStatus.IN_PROGRESS);

        Workflow first = aggregator.recompute("wf-1").orElseThrow();
        Workflow second = aggregator.recompute("wf-1").orElseThrow();

        assertEquals(first.status(), second.status());
        assertEquals(first.finalResult(), second.finalResult());
    }

    @Test
    @DisplayName("A terminal workflow is never recomputed")
    void terminalIsMonotonic() {
        Task task = addTask(1, TaskStatus.COMPLETED);
        assertEquals(WorkflowStatus.COMPLETED, aggregator.recompute("wf-1").orElseThrow().status());

        tasks.save(Task.builder()
                .id("late")
                .workflowId("wf-1")
                .stepNumber(2)
                .taskType("echo")
                .createdAt(Instant.now())
                .build());
        tasks.update(task.toBuilder().status(TaskStatus.FAILED).build());

        Workflow workflow = aggregator.recompute("wf-1").orElseThrow();
        assertEquals(WorkflowStatus.COMPLETED, workflow.status());
        assertEquals("Workflow finished with 1 task(s) completed.", workflow.finalResult());
    }

    @Test
    @DisplayName("Blocked tasks are re-queued when nothing else can make progress")
    void onlyBlockedRemainRequeues() {
        addTask(1, TaskStatus.COMPLETED);
        addTask(2, TaskStatus.BLOCKED);

        assertEquals(WorkflowStatus.IN_PROGRESS, aggregator.recompute("wf-1").orElseThrow().status());
        assertEquals(TaskStatus.QUEUED, tasks.findById("task-2").orElseThrow().status());
    }

    @Test
    void blockedTasksWaitWhileOthersRun() {
        addTask(1, TaskStatus.IN_PROGRESS);
        addTask(2, TaskStatus.BLOCKED);

        aggregator.recompute("wf-1");

        assertEquals(TaskStatus.BLOCKED, tasks.findById("task-2").orElseThrow().status());
    }
}
