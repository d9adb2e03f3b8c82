package io.rtmmirror.storage;

import io.rtmmirror.model.IssueKind;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Owner-scoped replace of a child collection: every row owned by the owner is deleted and the
 * new rows are inserted in the same transaction, so readers see either the old set or the new one.
 */
public final class ChildReplacer {
    private final Database database;

    public ChildReplacer(Database database) {
        this.database = database;
    }

    public <R> ReplaceResult replaceChildren(long ownerId, ChildKind<R> kind, List<R> newRows) {
        Objects.requireNonNull(kind, "kind");
        List<R> rows = newRows == null ? List.of() : newRows;
        long nowMs = Instant.now().toEpochMilli();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                checkOwner(c, ownerId, kind);
                List<R> prepared = kind.carryForward(c, ownerId, rows, nowMs);
                ChildKind.Dependents dependents = kind.snapshotDependents(c, ownerId);
                int removed;
                try (PreparedStatement del = c.prepareStatement(kind.deleteSql())) {
                    del.setLong(1, ownerId);
                    removed = del.executeUpdate();
                }
                int inserted = 0;
                try (PreparedStatement ins = c.prepareStatement(kind.insertSql())) {
                    for (int i = 0; i < prepared.size(); i++) {
                        R row = prepared.get(i);
                        try {
                            kind.bind(ins, ownerId, row);
                            ins.executeUpdate();
                        } catch (SQLException e) {
                            throw new ReplaceChildrenException(ownerId, kind.name(), i, rows.get(i),
                                    "Failed to insert " + kind.name() + " row " + i + " for owner " + ownerId
                                            + ": " + e.getMessage(), e);
                        }
                        inserted++;
                    }
                }
                dependents.restore(c, ownerId);
                c.commit();
                return new ReplaceResult(removed, inserted);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (ReplaceChildrenException e) {
            throw e;
        } catch (SQLException e) {
            throw new ReplaceChildrenException(ownerId, kind.name(), -1, null,
                    "Failed to replace " + kind.name() + " for owner " + ownerId, e);
        }
    }

    private <R> void checkOwner(Connection c, long ownerId, ChildKind<R> kind) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(kind.ownerLookupSql())) {
            ps.setLong(1, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new ReplaceChildrenException(ownerId, kind.name(), -1, null,
                            "Owner " + ownerId + " of " + kind.name() + " does not exist", null);
                }
                IssueKind expected = kind.ownerKind();
                if (expected != null && !expected.name().equals(rs.getString(1))) {
                    throw new ReplaceChildrenException(ownerId, kind.name(), -1, null,
                            "Owner " + ownerId + " is a " + rs.getString(1) + ", " + kind.name()
                                    + " belong to " + expected, null);
                }
            }
        }
    }

    public record ReplaceResult(int removedCount, int insertedCount) {
    }
}
