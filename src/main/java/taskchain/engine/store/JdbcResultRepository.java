package taskchain.engine.store;

import taskchain.engine.model.TaskResult;
import taskchain.engine.repository.ResultRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

import static taskchain.engine.store.JdbcTaskRepository.setTimestamp;
import static taskchain.engine.store.JdbcTaskRepository.toInstant;

/**
 * JDBC implementation of ResultRepository. Insert-only.
 */
public class JdbcResultRepository implements ResultRepository {

    private final Database db;

    public JdbcResultRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(TaskResult result) {
        String sql = "INSERT INTO results (id, task_id, data_json, created_at) VALUES (?, ?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result.id());
            ps.setString(2, result.taskId());
            ps.setString(3, result.data());
            setTimestamp(ps, 4, result.createdAt() != null ? result.createdAt() : Instant.now());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to save result for task: " + result.taskId(), e);
        }
    }

    @Override
    public Optional<TaskResult> findById(String resultId) {
        return findOne("SELECT * FROM results WHERE id = ?", resultId);
    }

    @Override
    public Optional<TaskResult> findByTaskId(String taskId) {
        return findOne("SELECT * FROM results WHERE task_id = ? ORDER BY created_at DESC LIMIT 1", taskId);
    }

    private Optional<TaskResult> findOne(String sql, String key) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new TaskResult(
                            rs.getString("id"),
                            rs.getString("task_id"),
                            rs.getString("data_json"),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find result: " + key, e);
        }
    }
}
