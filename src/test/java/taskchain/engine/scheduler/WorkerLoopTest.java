package taskchain.engine.scheduler;

import taskchain.engine.config.Dependencies;
import taskchain.engine.config.EngineConfig;
import taskchain.engine.definition.WorkflowDefinition;
import taskchain.engine.definition.WorkflowStep;
import taskchain.engine.model.Workflow;
import taskchain.engine.model.WorkflowStatus;
import taskchain.engine.repository.TaskRepository;
import org.junit.jupiter.api.*;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerLoopTest {

    private Dependencies deps;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-worker-loop-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    /**
     * Delegates to the real repository, but the first claim throws an Error.
     */
    private TaskRepository failingFirstClaim(AtomicInteger claims) {
        TaskRepository delegate = deps.taskRepository();
        return (TaskRepository) Proxy.newProxyInstance(
                TaskRepository.class.getClassLoader(),
                new Class<?>[] { TaskRepository.class },
                (proxy, method, args) -> {
                    if (method.getName().equals("claimNext") && claims.incrementAndGet() == 1) {
                        throw new NoClassDefFoundError("taskchain/Missing");
                    }
                    try {
                        return method.invoke(delegate, args);
                    } catch (InvocationTargetException e) {
                        throw e.getCause();
                    }
                });
    }

    @Test
    @DisplayName("The loop logs an Error from a claim and keeps polling")
    void loopSurvivesError() throws Exception {
        Workflow workflow = deps.workflowService().createWorkflow(
                new WorkflowDefinition("echo", List.of(new WorkflowStep("echo", 1, null))), "client-1", "hi");
        AtomicInteger claims = new AtomicInteger();
        WorkerLoop worker = new WorkerLoop("loop-test", failingFirstClaim(claims), deps.taskExecutor(),
                Duration.ofMillis(10));

        Thread thread = new Thread(worker, "worker-loop-test");
        thread.start();
        try {
            long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
            WorkflowStatus status;
            do {
                Thread.sleep(20);
                status = deps.workflowService().getStatus(workflow.id()).orElseThrow().status();
            } while (!status.isTerminal() && System.nanoTime() < deadline);

            assertEquals(WorkflowStatus.COMPLETED, status);
            assertTrue(claims.get() >= 2);
            assertTrue(thread.isAlive());
        } finally {
            worker.stop();
            thread.join(2000);
        }
        assertFalse(thread.isAlive());
    }
}
