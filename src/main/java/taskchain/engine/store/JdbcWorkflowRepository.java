package taskchain.engine.store;

import taskchain.engine.model.Workflow;
import taskchain.engine.model.WorkflowStatus;
import taskchain.engine.repository.WorkflowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static taskchain.engine.store.JdbcTaskRepository.setTimestamp;
import static taskchain.engine.store.JdbcTaskRepository.toInstant;

/**
 * JDBC implementation of WorkflowRepository.
 */
public class JdbcWorkflowRepository implements WorkflowRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowRepository.class);

    private final Database db;

    public JdbcWorkflowRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Workflow workflow) {
        String sql = """
                    INSERT INTO workflows (id, client_id, name, status, final_result, created_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workflow.id());
            ps.setString(2, workflow.clientId());
            ps.setString(3, workflow.name());
            ps.setString(4, workflow.status().name());
            ps.setString(5, workflow.finalResult());
            setTimestamp(ps, 6, workflow.createdAt() != null ? workflow.createdAt() : Instant.now());
            setTimestamp(ps, 7, workflow.finishedAt());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved workflow {}", workflow.id());
        } catch (SQLException e) {
            throw new StoreException("Failed to save workflow: " + workflow.id(), e);
        }
    }

    @Override
    public boolean update(Workflow workflow) {
        String sql = "UPDATE workflows SET status = ?, final_result = ?, finished_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workflow.status().name());
            ps.setString(2, workflow.finalResult());
            setTimestamp(ps, 3, workflow.finishedAt());
            ps.setString(4, workflow.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update workflow: " + workflow.id(), e);
        }
    }

    @Override
    public Optional<Workflow> findById(String workflowId) {
        String sql = "SELECT * FROM workflows WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workflowId);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new StoreException("Failed to find workflow: " + workflowId, e);
        }
    }

    @Override
    public List<Workflow> findRecent(int limit) {
        String sql = "SELECT * FROM workflows ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find recent workflows", e);
        }
    }

    private List<Workflow> executeQuery(PreparedStatement ps) throws SQLException {
        List<Workflow> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(Workflow.builder()
                        .id(rs.getString("id"))
                        .clientId(rs.getString("client_id"))
                        .name(rs.getString("name"))
                        .status(WorkflowStatus.valueOf(rs.getString("status")))
                        .finalResult(rs.getString("final_result"))
                        .createdAt(toInstant(rs.getTimestamp("created_at")))
                        .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                        .build());
            }
        }
        return results;
    }
}
