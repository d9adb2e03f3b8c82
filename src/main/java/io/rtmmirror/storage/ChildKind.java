package io.rtmmirror.storage;

import io.rtmmirror.model.ExecutionDetail;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.model.PlanMember;
import io.rtmmirror.model.Relation;
import io.rtmmirror.model.Step;
import io.rtmmirror.model.StepExecution;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A child collection that is only ever written as a whole through {@link ChildReplacer}.
 *
 * <p>The owner id means different things per kind: an issue id for steps, plan members and
 * relations, a {@code testexecutions} row id for execution details and a
 * {@code testcase_executions} row id for step executions.
 */
public abstract class ChildKind<R> {
    public static final ChildKind<Step> STEPS = new StepsKind();
    public static final ChildKind<PlanMember> PLAN_MEMBERS = new PlanMembersKind();
    public static final ChildKind<Relation> RELATIONS = new RelationsKind();
    public static final ChildKind<ExecutionDetail> EXECUTION_DETAILS = new ExecutionDetailsKind();
    public static final ChildKind<StepExecution> STEP_EXECUTIONS = new StepExecutionsKind();

    private final String name;
    private final String table;
    private final String ownerColumn;

    private ChildKind(String name, String table, String ownerColumn) {
        this.name = name;
        this.table = table;
        this.ownerColumn = ownerColumn;
    }

    public String name() {
        return name;
    }

    String deleteSql() {
        return "DELETE FROM " + table + " WHERE " + ownerColumn + "=?";
    }

    String ownerLookupSql() {
        return "SELECT kind FROM issues WHERE id=?";
    }

    /** Issue kind the owner must have, or null when the owner is not an issue row. */
    IssueKind ownerKind() {
        return null;
    }

    /** Reads whatever the previous children carry forward into the new set. Runs before the delete. */
    List<R> carryForward(Connection c, long ownerId, List<R> rows, long nowMs) throws SQLException {
        return rows;
    }

    /**
     * Captures rows hanging off the current children that the delete would cascade away, so
     * they can be put back under the matching new children.
     */
    Dependents snapshotDependents(Connection c, long ownerId) throws SQLException {
        return Dependents.NONE;
    }

    abstract String insertSql();

    abstract void bind(PreparedStatement ps, long ownerId, R row) throws SQLException;

    interface Dependents {
        Dependents NONE = (c, ownerId) -> 0;

        int restore(Connection c, long ownerId) throws SQLException;
    }

    @Override
    public String toString() {
        return name;
    }

    private static final class StepsKind extends ChildKind<Step> {
        private StepsKind() {
            super("steps", "testcase_steps", "issue_id");
        }

        @Override
        IssueKind ownerKind() {
            return IssueKind.TEST_CASE;
        }

        @Override
        List<Step> carryForward(Connection c, long ownerId, List<Step> rows, long nowMs) throws SQLException {
            // Unchanged step text keeps its uid, whatever its new position.
            Map<String, Deque<String>> uidsByContent = new HashMap<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT action,input,expected,step_uid FROM testcase_steps WHERE issue_id=? ORDER BY group_no, order_no")) {
                ps.setLong(1, ownerId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String key = contentKey(rs.getString("action"), rs.getString("input"), rs.getString("expected"));
                        uidsByContent.computeIfAbsent(key, k -> new ArrayDeque<>()).add(rs.getString("step_uid"));
                    }
                }
            }
            Set<String> used = new HashSet<>();
            for (Step row : rows) {
                if (row.stepUid() != null && !row.stepUid().isBlank()) {
                    used.add(row.stepUid());
                }
            }
            List<Step> out = new ArrayList<>(rows.size());
            for (Step row : rows) {
                if (row.stepUid() != null && !row.stepUid().isBlank()) {
                    out.add(row);
                    continue;
                }
                Deque<String> candidates = uidsByContent.get(contentKey(row.action(), row.input(), row.expected()));
                String uid = null;
                while (candidates != null && !candidates.isEmpty() && uid == null) {
                    String next = candidates.poll();
                    if (used.add(next)) {
                        uid = next;
                    }
                }
                if (uid == null) {
                    uid = "stp_" + UUID.randomUUID().toString().replace("-", "");
                    used.add(uid);
                }
                out.add(row.withStepUid(uid));
            }
            return out;
        }

        @Override
        String insertSql() {
            return "INSERT INTO testcase_steps(issue_id,group_no,order_no,action,input,expected,step_uid) VALUES(?,?,?,?,?,?,?)";
        }

        @Override
        void bind(PreparedStatement ps, long ownerId, Step row) throws SQLException {
            ps.setLong(1, ownerId);
            ps.setInt(2, row.groupNo());
            ps.setInt(3, row.orderNo());
            ps.setString(4, row.action());
            ps.setString(5, row.input());
            ps.setString(6, row.expected());
            ps.setString(7, row.stepUid());
        }

        private static String contentKey(String action, String input, String expected) {
            return action + '\u0000' + input + '\u0000' + expected;
        }
    }

    private static final class PlanMembersKind extends ChildKind<PlanMember> {
        private PlanMembersKind() {
            super("plan-members", "testplan_testcases", "testplan_id");
        }

        @Override
        IssueKind ownerKind() {
            return IssueKind.TEST_PLAN;
        }

        @Override
        String insertSql() {
            return "INSERT INTO testplan_testcases(testplan_id,testcase_id,order_no) VALUES(?,?,?)";
        }

        @Override
        void bind(PreparedStatement ps, long ownerId, PlanMember row) throws SQLException {
            ps.setLong(1, ownerId);
            ps.setLong(2, row.testCaseId());
            ps.setInt(3, row.orderNo());
        }
    }

    private static final class RelationsKind extends ChildKind<Relation> {
        private RelationsKind() {
            super("relations", "relations", "src_issue_id");
        }

        @Override
        List<Relation> carryForward(Connection c, long ownerId, List<Relation> rows, long nowMs) throws SQLException {
            Map<String, Long> createdAt = new HashMap<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT dst_issue_id,relation_kind,created_at_ms FROM relations WHERE src_issue_id=?")) {
                ps.setLong(1, ownerId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        createdAt.put(rs.getLong("dst_issue_id") + "|" + rs.getString("relation_kind"),
                                rs.getLong("created_at_ms"));
                    }
                }
            }
            List<Relation> out = new ArrayList<>(rows.size());
            for (Relation row : rows) {
                if (row.createdAtMs() != null) {
                    out.add(row);
                    continue;
                }
                Long previous = createdAt.get(row.dstIssueId() + "|" + row.relationKind());
                out.add(row.withCreatedAtMs(previous == null ? nowMs : previous));
            }
            return out;
        }

        @Override
        String insertSql() {
            return "INSERT INTO relations(src_issue_id,dst_issue_id,relation_kind,created_at_ms) VALUES(?,?,?,?)";
        }

        @Override
        void bind(PreparedStatement ps, long ownerId, Relation row) throws SQLException {
            ps.setLong(1, ownerId);
            ps.setLong(2, row.dstIssueId());
            ps.setString(3, row.relationKind());
            ps.setLong(4, row.createdAtMs());
        }
    }

    private static final class ExecutionDetailsKind extends ChildKind<ExecutionDetail> {
        private ExecutionDetailsKind() {
            super("execution-details", "testcase_executions", "testexecution_id");
        }

        @Override
        String ownerLookupSql() {
            return "SELECT 'TEST_EXECUTION' FROM testexecutions WHERE id=?";
        }

        @Override
        Dependents snapshotDependents(Connection c, long ownerId) throws SQLException {
            Map<Long, List<StepExecution>> byTestCase = new HashMap<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT e.testcase_id, se.group_no, se.order_no, se.step_uid, se.status, se.actual_result, se.evidence
                    FROM testcase_step_executions se
                    JOIN testcase_executions e ON e.id = se.testcase_execution_id
                    WHERE e.testexecution_id=?
                    ORDER BY se.group_no, se.order_no
                    """)) {
                ps.setLong(1, ownerId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        byTestCase.computeIfAbsent(rs.getLong(1), k -> new ArrayList<>()).add(new StepExecution(
                                rs.getInt(2), rs.getInt(3), rs.getString(4), rs.getString(5), rs.getString(6), rs.getString(7)));
                    }
                }
            }
            if (byTestCase.isEmpty()) {
                return Dependents.NONE;
            }
            return (conn, owner) -> {
                int restored = 0;
                try (PreparedStatement find = conn.prepareStatement(
                        "SELECT id FROM testcase_executions WHERE testexecution_id=? AND testcase_id=?");
                     PreparedStatement ins = conn.prepareStatement(STEP_EXECUTIONS.insertSql())) {
                    for (Map.Entry<Long, List<StepExecution>> entry : byTestCase.entrySet()) {
                        find.setLong(1, owner);
                        find.setLong(2, entry.getKey());
                        try (ResultSet rs = find.executeQuery()) {
                            if (!rs.next()) {
                                continue;
                            }
                            long executionRowId = rs.getLong(1);
                            for (StepExecution row : entry.getValue()) {
                                STEP_EXECUTIONS.bind(ins, executionRowId, row);
                                ins.executeUpdate();
                                restored++;
                            }
                        }
                    }
                }
                return restored;
            };
        }

        @Override
        String insertSql() {
            return "INSERT INTO testcase_executions(testexecution_id,testcase_id,order_no,assignee,result,actual_time,environment,defects,remote_execution_key) VALUES(?,?,?,?,?,?,?,?,?)";
        }

        @Override
        void bind(PreparedStatement ps, long ownerId, ExecutionDetail row) throws SQLException {
            ps.setLong(1, ownerId);
            ps.setLong(2, row.testCaseId());
            ps.setInt(3, row.orderNo());
            ps.setString(4, row.assignee());
            ps.setString(5, row.result());
            if (row.actualTime() == null) {
                ps.setNull(6, Types.INTEGER);
            } else {
                ps.setLong(6, row.actualTime());
            }
            ps.setString(7, row.environment());
            ps.setString(8, row.defects());
            ps.setString(9, row.remoteExecutionKey());
        }
    }

    private static final class StepExecutionsKind extends ChildKind<StepExecution> {
        private StepExecutionsKind() {
            super("step-executions", "testcase_step_executions", "testcase_execution_id");
        }

        @Override
        String ownerLookupSql() {
            return "SELECT 'TEST_CASE' FROM testcase_executions WHERE id=?";
        }

        @Override
        List<StepExecution> carryForward(Connection c, long ownerId, List<StepExecution> rows, long nowMs) throws SQLException {
            // Rows without a uid are pinned to whatever step currently sits at their position.
            Map<String, String> uidByPosition = new HashMap<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT s.group_no, s.order_no, s.step_uid
                    FROM testcase_executions e
                    JOIN testcase_steps s ON s.issue_id = e.testcase_id
                    WHERE e.id=?
                    """)) {
                ps.setLong(1, ownerId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        uidByPosition.put(rs.getInt(1) + ":" + rs.getInt(2), rs.getString(3));
                    }
                }
            }
            List<StepExecution> out = new ArrayList<>(rows.size());
            for (StepExecution row : rows) {
                if (!row.stepUid().isBlank()) {
                    out.add(row);
                } else {
                    out.add(row.withStepUid(uidByPosition.getOrDefault(row.groupNo() + ":" + row.orderNo(), "")));
                }
            }
            return out;
        }

        @Override
        String insertSql() {
            return "INSERT INTO testcase_step_executions(testcase_execution_id,group_no,order_no,step_uid,status,actual_result,evidence) VALUES(?,?,?,?,?,?,?)";
        }

        @Override
        void bind(PreparedStatement ps, long ownerId, StepExecution row) throws SQLException {
            ps.setLong(1, ownerId);
            ps.setInt(2, row.groupNo());
            ps.setInt(3, row.orderNo());
            ps.setString(4, row.stepUid());
            ps.setString(5, row.status());
            ps.setString(6, row.actualResult());
            ps.setString(7, row.evidence());
        }
    }
}
