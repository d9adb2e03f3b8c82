package io.rtmmirror.storage;

import io.rtmmirror.model.CheckpointKind;
import io.rtmmirror.model.SyncCheckpoint;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Per-project sync checkpoints and per-issue dirty flags.
 *
 * <p>Issue state machine: CLEAN to DIRTY on a local edit, DIRTY to CLEAN only through
 * {@link #clearDirty(long)} after a confirmed push. Pulls never set the flag.
 */
public final class SyncStateTracker {
    private final Database database;

    public SyncStateTracker(Database database) {
        this.database = database;
    }

    public SyncCheckpoint markSynced(long projectId, CheckpointKind kind) {
        return markSynced(projectId, kind, Instant.now().toEpochMilli());
    }

    public SyncCheckpoint markSynced(long projectId, CheckpointKind kind, long atMs) {
        String column = switch (kind) {
            case FULL_TREE -> "last_full_sync_at_ms";
            case TREE_STRUCTURE -> "last_tree_sync_at_ms";
            case SINGLE_ISSUE -> "last_issue_sync_at_ms";
        };
        String sql = "INSERT INTO sync_state(project_id," + column + ") VALUES(?,?) "
                + "ON CONFLICT(project_id) DO UPDATE SET " + column + "=excluded." + column;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, projectId);
            ps.setLong(2, atMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record sync checkpoint", e);
        }
        return checkpoint(projectId);
    }

    public SyncCheckpoint checkpoint(long projectId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT last_full_sync_at_ms,last_tree_sync_at_ms,last_issue_sync_at_ms FROM sync_state WHERE project_id=?")) {
            ps.setLong(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return SyncCheckpoint.never(projectId);
                }
                return new SyncCheckpoint(
                        projectId,
                        nullableLong(rs, "last_full_sync_at_ms"),
                        nullableLong(rs, "last_tree_sync_at_ms"),
                        nullableLong(rs, "last_issue_sync_at_ms")
                );
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read sync checkpoint", e);
        }
    }

    public boolean isDirty(long issueId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT dirty FROM issues WHERE id=?")) {
            ps.setLong(1, issueId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalArgumentException("Issue not found: " + issueId);
                }
                return rs.getInt(1) == 1;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read dirty flag", e);
        }
    }

    public void markDirty(long issueId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE issues SET dirty=1, updated_at_ms=? WHERE id=?")) {
            ps.setLong(1, Instant.now().toEpochMilli());
            ps.setLong(2, issueId);
            requireUpdated(ps.executeUpdate(), issueId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark issue dirty", e);
        }
    }

    public void clearDirty(long issueId) {
        long now = Instant.now().toEpochMilli();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE issues SET dirty=0, last_sync_at_ms=?, updated_at_ms=? WHERE id=?")) {
            ps.setLong(1, now);
            ps.setLong(2, now);
            ps.setLong(3, issueId);
            requireUpdated(ps.executeUpdate(), issueId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear dirty flag", e);
        }
    }

    private static void requireUpdated(int rows, long issueId) {
        if (rows == 0) {
            throw new IllegalArgumentException("Issue not found: " + issueId);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
