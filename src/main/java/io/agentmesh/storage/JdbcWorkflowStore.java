package io.agentmesh.storage;

import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.model.WorkflowSummary;
import io.agentmesh.model.WorkflowView;
import io.agentmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed history. Each workflow is one row holding its JSON snapshot, so workflows
 * survive across CLI invocations. Retention matches {@link InMemoryWorkflowStore}.
 */
public final class JdbcWorkflowStore implements WorkflowStore {
    private static final String FINISHED_STATUSES = "('completed','failed','partial')";

    private final Database database;
    private final int capacity;

    public JdbcWorkflowStore(Database database, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.database = database;
        this.capacity = capacity;
    }

    @Override
    public synchronized void save(WorkflowView workflow) {
        String sql = """
                INSERT INTO workflows(workflow_id,status,original_request,snapshot_json,created_at_ms,completed_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?)
                ON CONFLICT(workflow_id) DO UPDATE SET
                    status=excluded.status,
                    snapshot_json=excluded.snapshot_json,
                    completed_at_ms=excluded.completed_at_ms,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, workflow.id());
                ps.setString(2, workflow.status().wire());
                ps.setString(3, workflow.originalRequest() == null ? "" : workflow.originalRequest());
                ps.setString(4, Jsons.toCompactJson(workflow));
                ps.setLong(5, workflow.createdAtMs());
                if (workflow.completedAtMs() == null) {
                    ps.setNull(6, Types.INTEGER);
                } else {
                    ps.setLong(6, workflow.completedAtMs());
                }
                ps.setLong(7, Instant.now().toEpochMilli());
                ps.executeUpdate();
                enforceRetention(c, workflow.id());
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save workflow: " + workflow.id(), e);
        }
    }

    @Override
    public Optional<WorkflowView> find(String workflowId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT snapshot_json FROM workflows WHERE workflow_id=?")) {
            ps.setString(1, workflowId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(Jsons.fromJson(rs.getString("snapshot_json"), WorkflowView.class));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read workflow: " + workflowId, e);
        }
    }

    @Override
    public List<WorkflowSummary> list(WorkflowStatus statusFilter) {
        String sql = statusFilter == null
                ? "SELECT snapshot_json FROM workflows ORDER BY created_at_ms DESC, rowid DESC"
                : "SELECT snapshot_json FROM workflows WHERE status=? ORDER BY created_at_ms DESC, rowid DESC";
        List<WorkflowSummary> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (statusFilter != null) {
                ps.setString(1, statusFilter.wire());
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(Jsons.fromJson(rs.getString("snapshot_json"), WorkflowView.class).summary());
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list workflows", e);
        }
    }

    private void enforceRetention(Connection c, String keepId) throws SQLException {
        int total;
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM workflows");
             ResultSet rs = ps.executeQuery()) {
            total = rs.next() ? rs.getInt(1) : 0;
        }
        int excess = total - capacity;
        if (excess <= 0) {
            return;
        }
        excess -= deleteOldest(c, keepId, excess, "status IN " + FINISHED_STATUSES + " AND ");
        if (excess > 0) {
            deleteOldest(c, keepId, excess, "");
        }
    }

    private int deleteOldest(Connection c, String keepId, int limit, String statusClause) throws SQLException {
        String sql = """
                DELETE FROM workflows WHERE workflow_id IN (
                    SELECT workflow_id FROM workflows
                    WHERE %s workflow_id<>?
                    ORDER BY created_at_ms ASC, rowid ASC
                    LIMIT ?
                )
                """.formatted(statusClause);
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, keepId);
            ps.setInt(2, limit);
            return ps.executeUpdate();
        }
    }
}
