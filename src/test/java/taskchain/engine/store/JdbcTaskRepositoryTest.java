package taskchain.engine.store;

import taskchain.engine.config.EngineConfig;
import taskchain.engine.model.Task;
import taskchain.engine.model.TaskStatus;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskRepositoryTest {

    private static Database db;
    private static JdbcTaskRepository repo;

    @BeforeAll
    static void setup() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-tasks;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
    }

    private static Task task(String id, String workflowId, int step, Integer dependsOn, Instant createdAt) {
        return Task.builder()
                .id(id)
                .workflowId(workflowId)
                .clientId("client-1")
                .stepNumber(step)
                .taskType("echo")
                .dependsOn(dependsOn)
                .payload("{\"n\":" + step + "}")
                .createdAt(createdAt)
                .build();
    }

    @Test
    void saveAndFindById() {
        repo.save(task("task-1", "wf-1", 1, null, Instant.now()));

        Optional<Task> found = repo.findById("task-1");
        assertTrue(found.isPresent());
        assertEquals("wf-1", found.get().workflowId());
        assertEquals(TaskStatus.QUEUED, found.get().status());
        assertNull(found.get().dependsOn());
        assertEquals("{\"n\":1}", found.get().payload());
    }

    @Test
    void findByWorkflowIdReturnsStepOrder() {
        Instant now = Instant.now();
        repo.saveAll(List.of(
                task("t3", "wf-1", 3, 2, now),
                task("t1", "wf-1", 1, null, now),
                task("t2", "wf-1", 2, 1, now),
                task("other", "wf-2", 1, null, now)));

        List<Task> tasks = repo.findByWorkflowId("wf-1");

        assertEquals(List.of("t1", "t2", "t3"), tasks.stream().map(Task::id).toList());
        assertEquals(2, tasks.get(2).dependsOn());
    }

    @Test
    void findByWorkflowIdAndStep() {
        Instant now = Instant.now();
        repo.saveAll(List.of(task("t1", "wf-1", 1, null, now), task("t2", "wf-1", 2, 1, now)));

        assertEquals("t2", repo.findByWorkflowIdAndStep("wf-1", 2).orElseThrow().id());
        assertTrue(repo.findByWorkflowIdAndStep("wf-1", 9).isEmpty());
        assertTrue(repo.findByWorkflowIdAndStep("wf-2", 1).isEmpty());
    }

    @Test
    @DisplayName("Duplicate step numbers within a workflow are rejected by the store")
    void duplicateStepRejected() {
        Instant now = Instant.now();
        repo.save(task("t1", "wf-1", 1, null, now));

        assertThrows(StoreException.class, () -> repo.save(task("t1b", "wf-1", 1, null, now)));
    }

    @Test
    void updatePersistsStatusAndTimestamps() {
        Task saved = task("t1", "wf-1", 1, null, Instant.now());
        repo.save(saved);

        Instant started = Instant.now();
        assertTrue(repo.update(saved.transitionTo(TaskStatus.IN_PROGRESS)
                .progress("starting job...")
                .startedAt(started)
                .build()));

        Task found = repo.findById("t1").orElseThrow();
        assertEquals(TaskStatus.IN_PROGRESS, found.status());
        assertEquals("starting job...", found.progress());
        assertNotNull(found.startedAt());
    }

    @Test
    void updateOfUnknownTaskReturnsFalse() {
        assertFalse(repo.update(task("ghost", "wf-1", 1, null, Instant.now())));
    }

    @Test
    @DisplayName("Claims follow creation order, then workflow, then step")
    void claimOrder() {
        Instant now = Instant.now();
        repo.saveAll(List.of(
                task("t2", "wf-1", 2, 1, now),
                task("t1", "wf-1", 1, null, now),
                task("late", "wf-0", 1, null, now.plusSeconds(5))));

        assertEquals("t1", repo.claimNext("w1").orElseThrow().id());
        assertEquals("t2", repo.claimNext("w1").orElseThrow().id());
        assertEquals("late", repo.claimNext("w1").orElseThrow().id());
        assertTrue(repo.claimNext("w1").isEmpty());
    }

    @Test
    @DisplayName("A claimed task is not handed out again and stays QUEUED")
    void claimIsExclusive() {
        repo.save(task("t1", "wf-1", 1, null, Instant.now()));

        Task claimed = repo.claimNext("w1").orElseThrow();
        assertEquals("w1", claimed.claimedBy());
        assertNotNull(claimed.claimedAt());
        assertEquals(TaskStatus.QUEUED, claimed.status());

        assertTrue(repo.claimNext("w2").isEmpty());
    }

    @Test
    @DisplayName("Concurrent workers never claim the same task twice")
    void concurrentClaims() throws Exception {
        Instant now = Instant.now();
        for (int i = 1; i <= 20; i++) {
            repo.save(task("t" + i, "wf-1", i, null, now));
        }

        Set<String> claimed = java.util.Collections.synchronizedSet(new HashSet<>());
        List<String> duplicates = java.util.Collections.synchronizedList(new java.util.ArrayList<>());
        List<Thread> threads = new java.util.ArrayList<>();
        for (int w = 0; w < 4; w++) {
            String workerId = "w" + w;
            Thread t = new Thread(() -> {
                Optional<Task> next;
                while ((next = repo.claimNext(workerId)).isPresent()) {
                    if (!claimed.add(next.get().id())) {
                        duplicates.add(next.get().id());
                    }
                }
            });
            threads.add(t);
            t.start();
        }
        for (Thread t : threads) {
            t.join(10_000);
        }

        assertTrue(duplicates.isEmpty(), "duplicate claims: " + duplicates);
        assertEquals(20, claimed.size());
    }

    @Test
    void blockedTasksAreNotClaimed() {
        Task saved = task("t1", "wf-1", 1, null, Instant.now());
        repo.save(saved);
        repo.update(saved.transitionTo(TaskStatus.BLOCKED).build());

        assertTrue(repo.claimNext("w1").isEmpty());
    }

    @Test
    void requeueBlockedOnlyTouchesThatWorkflow() {
        Instant now = Instant.now();
        Task a = task("a", "wf-1", 1, null, now);
        Task b = task("b", "wf-2", 1, null, now);
        repo.saveAll(List.of(a, b));
        repo.update(a.transitionTo(TaskStatus.BLOCKED).build());
        repo.update(b.transitionTo(TaskStatus.BLOCKED).build());

        assertEquals(1, repo.requeueBlocked("wf-1"));

        assertEquals(TaskStatus.QUEUED, repo.findById("a").orElseThrow().status());
        assertEquals(TaskStatus.BLOCKED, repo.findById("b").orElseThrow().status());
        assertEquals("a", repo.claimNext("w1").orElseThrow().id());
    }

    @Test
    @DisplayName("Stale claims on QUEUED tasks are released, running tasks are left alone")
    void releaseStaleClaims() {
        Instant now = Instant.now();
        repo.saveAll(List.of(task("queued", "wf-1", 1, null, now), task("running", "wf-1", 2, null, now)));

        Task queued = repo.claimNext("w1").orElseThrow();
        Task running = repo.claimNext("w1").orElseThrow();
        repo.update(running.transitionTo(TaskStatus.IN_PROGRESS).startedAt(now).build());

        assertEquals(0, repo.releaseStaleClaims(now.minus(Duration.ofMinutes(1))));
        assertEquals(1, repo.releaseStaleClaims(now.plus(Duration.ofMinutes(1))));

        assertNull(repo.findById(queued.id()).orElseThrow().claimedBy());
        assertEquals("w1", repo.findById("running").orElseThrow().claimedBy());
        assertEquals(TaskStatus.IN_PROGRESS, repo.findById("running").orElseThrow().status());
    }

    @Test
    void countByStatus() {
        Instant now = Instant.now();
        Task a = task("a", "wf-1", 1, null, now);
        repo.saveAll(List.of(a, task("b", "wf-1", 2, null, now)));
        repo.update(a.transitionTo(TaskStatus.IN_PROGRESS).build());

        assertEquals(1, repo.countByStatus(TaskStatus.QUEUED));
        assertEquals(1, repo.countByStatus(TaskStatus.IN_PROGRESS));
        assertEquals(0, repo.countByStatus(TaskStatus.FAILED));
    }
}
