package taskchain.engine.store;

import taskchain.engine.model.Task;
import taskchain.engine.model.TaskStatus;
import taskchain.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Claims use a conditional update so two workers never hold the same task.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    /** How many candidates one claim attempt looks at before giving up */
    private static final int CLAIM_CANDIDATES = 5;

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, workflow_id, client_id, step_number, task_type, status, depends_on,
                                       payload, progress, result_id, claimed_by, claimed_at, created_at,
                                       started_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindInsert(ps, task);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public void saveAll(List<Task> tasks) {
        if (tasks.isEmpty())
            return;

        String sql = """
                    INSERT INTO tasks (id, workflow_id, client_id, step_number, task_type, status, depends_on,
                                       payload, progress, result_id, claimed_by, claimed_at, created_at,
                                       started_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (Task task : tasks) {
                    bindInsert(ps, task);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

            log.debug("Saved {} tasks in batch", tasks.size());
        } catch (SQLException e) {
            throw new StoreException("Failed to save tasks batch", e);
        }
    }

    @Override
    public boolean update(Task task) {
        String sql = """
                    UPDATE tasks
                    SET status = ?, progress = ?, result_id = ?, claimed_by = ?, claimed_at = ?,
                        started_at = ?, finished_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.status().name());
            ps.setString(2, task.progress());
            ps.setString(3, task.resultId());
            ps.setString(4, task.claimedBy());
            setTimestamp(ps, 5, task.claimedAt());
            setTimestamp(ps, 6, task.startedAt());
            setTimestamp(ps, 7, task.finishedAt());
            ps.setString(8, task.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new StoreException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findByWorkflowId(String workflowId) {
        String sql = "SELECT * FROM tasks WHERE workflow_id = ? ORDER BY step_number";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workflowId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find tasks for workflow: " + workflowId, e);
        }
    }

    @Override
    public Optional<Task> findByWorkflowIdAndStep(String workflowId, int stepNumber) {
        String sql = "SELECT * FROM tasks WHERE workflow_id = ? AND step_number = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workflowId);
            ps.setInt(2, stepNumber);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new StoreException("Failed to find step " + stepNumber + " of workflow: " + workflowId, e);
        }
    }

    @Override
    public Optional<Task> claimNext(String workerId) {
        String selectSql = """
                    SELECT id FROM tasks
                    WHERE status = 'QUEUED' AND claimed_by IS NULL
                    ORDER BY created_at, workflow_id, step_number
                    LIMIT ?
                """;

        // The WHERE clause makes the claim fail if another worker got there first
        String claimSql = """
                    UPDATE tasks
                    SET claimed_by = ?, claimed_at = ?
                    WHERE id = ? AND status = 'QUEUED' AND claimed_by IS NULL
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement claimPs = conn.prepareStatement(claimSql)) {

                List<String> candidates = new ArrayList<>();
                selectPs.setInt(1, CLAIM_CANDIDATES);
                try (ResultSet rs = selectPs.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getString("id"));
                    }
                }

                Timestamp now = Timestamp.from(Instant.now());
                for (String id : candidates) {
                    claimPs.setString(1, workerId);
                    claimPs.setTimestamp(2, now);
                    claimPs.setString(3, id);

                    if (claimPs.executeUpdate() == 1) {
                        conn.commit();
                        log.debug("Worker {} claimed task {}", workerId, id);
                        return findById(id);
                    }
                }

                conn.commit();
                return Optional.empty();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to claim task for worker: " + workerId, e);
        }
    }

    @Override
    public int releaseStaleClaims(Instant claimedBefore) {
        String sql = """
                    UPDATE tasks
                    SET claimed_by = NULL, claimed_at = NULL
                    WHERE status = 'QUEUED' AND claimed_by IS NOT NULL AND claimed_at < ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(claimedBefore));
            int released = ps.executeUpdate();
            conn.commit();

            if (released > 0) {
                log.info("Released {} stale claims", released);
            }

            return released;
        } catch (SQLException e) {
            throw new StoreException("Failed to release stale claims", e);
        }
    }

    @Override
    public int requeueBlocked(String workflowId) {
        String sql = """
                    UPDATE tasks
                    SET status = 'QUEUED', claimed_by = NULL, claimed_at = NULL
                    WHERE workflow_id = ? AND status = 'BLOCKED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workflowId);
            int requeued = ps.executeUpdate();
            conn.commit();

            if (requeued > 0) {
                log.debug("Re-queued {} blocked tasks of workflow {}", requeued, workflowId);
            }

            return requeued;
        } catch (SQLException e) {
            throw new StoreException("Failed to re-queue blocked tasks of workflow: " + workflowId, e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count tasks", e);
        }
    }

    // Helper methods

    private static void bindInsert(PreparedStatement ps, Task task) throws SQLException {
        ps.setString(1, task.id());
        ps.setString(2, task.workflowId());
        ps.setString(3, task.clientId());
        ps.setInt(4, task.stepNumber());
        ps.setString(5, task.taskType());
        ps.setString(6, task.status().name());
        setIntOrNull(ps, 7, task.dependsOn());
        ps.setString(8, task.payload());
        ps.setString(9, task.progress());
        ps.setString(10, task.resultId());
        ps.setString(11, task.claimedBy());
        setTimestamp(ps, 12, task.claimedAt());
        setTimestamp(ps, 13, task.createdAt() != null ? task.createdAt() : Instant.now());
        setTimestamp(ps, 14, task.startedAt());
        setTimestamp(ps, 15, task.finishedAt());
    }

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .workflowId(rs.getString("workflow_id"))
                .clientId(rs.getString("client_id"))
                .stepNumber(rs.getInt("step_number"))
                .taskType(rs.getString("task_type"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .dependsOn(getIntOrNull(rs, "depends_on"))
                .payload(rs.getString("payload"))
                .progress(rs.getString("progress"))
                .resultId(rs.getString("result_id"))
                .claimedBy(rs.getString("claimed_by"))
                .claimedAt(toInstant(rs.getTimestamp("claimed_at")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
