package io.rtmmirror.storage;

import io.rtmmirror.config.RtmMirrorConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "rtmmirror.schema.migration.v1";
    private final RtmMirrorConfig config;
    private final String jdbcUrl;

    public Database(RtmMirrorConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public RtmMirrorConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        // foreign_keys is per connection in SQLite, so every connection has to ask for it.
        Properties props = new Properties();
        props.setProperty("foreign_keys", "true");
        props.setProperty("busy_timeout", "5000");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS projects (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_key TEXT NOT NULL UNIQUE,
                        remote_id INTEGER NOT NULL,
                        name TEXT NOT NULL DEFAULT '',
                        base_url TEXT NOT NULL DEFAULT '',
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS folders (
                        id TEXT PRIMARY KEY,
                        project_id INTEGER NOT NULL REFERENCES projects(id) ON DELETE CASCADE,
                        remote_id TEXT,
                        parent_id TEXT REFERENCES folders(id),
                        name TEXT NOT NULL,
                        kind TEXT NOT NULL,
                        sort_order INTEGER NOT NULL DEFAULT 0,
                        remote_bound INTEGER NOT NULL DEFAULT 0,
                        is_deleted INTEGER NOT NULL DEFAULT 0,
                        deleted_at_ms INTEGER,
                        structure_fingerprint TEXT,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS issues (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_id INTEGER NOT NULL REFERENCES projects(id) ON DELETE CASCADE,
                        remote_key TEXT,
                        remote_id INTEGER,
                        kind TEXT NOT NULL,
                        folder_id TEXT REFERENCES folders(id),
                        summary TEXT NOT NULL DEFAULT '',
                        description TEXT NOT NULL DEFAULT '',
                        status TEXT NOT NULL DEFAULT '',
                        priority TEXT NOT NULL DEFAULT '',
                        assignee TEXT NOT NULL DEFAULT '',
                        reporter TEXT NOT NULL DEFAULT '',
                        labels TEXT NOT NULL DEFAULT '[]',
                        components TEXT NOT NULL DEFAULT '[]',
                        versions TEXT NOT NULL DEFAULT '[]',
                        environment TEXT NOT NULL DEFAULT '',
                        due_date TEXT NOT NULL DEFAULT '',
                        time_estimate TEXT NOT NULL DEFAULT '',
                        created TEXT NOT NULL DEFAULT '',
                        updated TEXT NOT NULL DEFAULT '',
                        is_deleted INTEGER NOT NULL DEFAULT 0,
                        dirty INTEGER NOT NULL DEFAULT 0,
                        last_sync_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        UNIQUE(project_id, kind, remote_key)
                    )
                    """);
            ensureIssueColumns(conn);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS testcase_steps (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        issue_id INTEGER NOT NULL REFERENCES issues(id) ON DELETE CASCADE,
                        group_no INTEGER NOT NULL DEFAULT 1,
                        order_no INTEGER NOT NULL,
                        action TEXT NOT NULL DEFAULT '',
                        input TEXT NOT NULL DEFAULT '',
                        expected TEXT NOT NULL DEFAULT '',
                        UNIQUE(issue_id, group_no, order_no)
                    )
                    """);
            ensureStepColumns(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS testplan_testcases (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        testplan_id INTEGER NOT NULL REFERENCES issues(id) ON DELETE CASCADE,
                        testcase_id INTEGER NOT NULL REFERENCES issues(id) ON DELETE CASCADE,
                        order_no INTEGER NOT NULL,
                        UNIQUE(testplan_id, testcase_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS testexecutions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        issue_id INTEGER NOT NULL UNIQUE REFERENCES issues(id) ON DELETE CASCADE,
                        environment TEXT NOT NULL DEFAULT '',
                        start_date TEXT NOT NULL DEFAULT '',
                        end_date TEXT NOT NULL DEFAULT '',
                        result TEXT NOT NULL DEFAULT '',
                        executed_by TEXT NOT NULL DEFAULT ''
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS testcase_executions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        testexecution_id INTEGER NOT NULL REFERENCES testexecutions(id) ON DELETE CASCADE,
                        testcase_id INTEGER NOT NULL REFERENCES issues(id) ON DELETE CASCADE,
                        order_no INTEGER NOT NULL DEFAULT 0,
                        assignee TEXT NOT NULL DEFAULT '',
                        result TEXT NOT NULL DEFAULT '',
                        actual_time INTEGER,
                        environment TEXT NOT NULL DEFAULT '',
                        defects TEXT NOT NULL DEFAULT '',
                        remote_execution_key TEXT NOT NULL DEFAULT '',
                        UNIQUE(testexecution_id, testcase_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS testcase_step_executions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        testcase_execution_id INTEGER NOT NULL REFERENCES testcase_executions(id) ON DELETE CASCADE,
                        group_no INTEGER NOT NULL DEFAULT 1,
                        order_no INTEGER NOT NULL,
                        step_uid TEXT NOT NULL DEFAULT '',
                        status TEXT NOT NULL DEFAULT '',
                        actual_result TEXT NOT NULL DEFAULT '',
                        evidence TEXT NOT NULL DEFAULT '',
                        UNIQUE(testcase_execution_id, group_no, order_no)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS relations (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        src_issue_id INTEGER NOT NULL REFERENCES issues(id) ON DELETE CASCADE,
                        dst_issue_id INTEGER NOT NULL REFERENCES issues(id) ON DELETE CASCADE,
                        relation_kind TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        UNIQUE(src_issue_id, dst_issue_id, relation_kind)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sync_state (
                        project_id INTEGER PRIMARY KEY REFERENCES projects(id) ON DELETE CASCADE,
                        last_full_sync_at_ms INTEGER,
                        last_tree_sync_at_ms INTEGER,
                        last_issue_sync_at_ms INTEGER
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_folders_project_kind ON folders(project_id, kind)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_folders_parent ON folders(parent_id)");
            st.execute("CREATE UNIQUE INDEX IF NOT EXISTS idx_folders_remote ON folders(project_id, kind, remote_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_issues_project_kind ON issues(project_id, kind)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_issues_folder ON issues(folder_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_testcase_steps_issue ON testcase_steps(issue_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tc_exec_te ON testcase_executions(testexecution_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_rel_src ON relations(src_issue_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_rel_dst ON relations(dst_issue_id)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private Set<String> columnsOf(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        return columns;
    }

    private void ensureIssueColumns(Connection conn) throws SQLException {
        Set<String> columns = columnsOf(conn, "issues");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("preconditions")) {
                st.execute("ALTER TABLE issues ADD COLUMN preconditions TEXT NOT NULL DEFAULT ''");
            }
            if (!columns.contains("epic_name")) {
                st.execute("ALTER TABLE issues ADD COLUMN epic_name TEXT NOT NULL DEFAULT ''");
            }
            if (!columns.contains("issue_type_id")) {
                st.execute("ALTER TABLE issues ADD COLUMN issue_type_id INTEGER");
            }
            if (!columns.contains("test_plan_key")) {
                st.execute("ALTER TABLE issues ADD COLUMN test_plan_key TEXT NOT NULL DEFAULT ''");
            }
            if (!columns.contains("execution_result")) {
                st.execute("ALTER TABLE issues ADD COLUMN execution_result TEXT NOT NULL DEFAULT ''");
            }
            if (!columns.contains("execute_transition")) {
                st.execute("ALTER TABLE issues ADD COLUMN execute_transition TEXT NOT NULL DEFAULT ''");
            }
            if (!columns.contains("deleted_at_ms")) {
                st.execute("ALTER TABLE issues ADD COLUMN deleted_at_ms INTEGER");
            }
            if (!columns.contains("structure_fingerprint")) {
                st.execute("ALTER TABLE issues ADD COLUMN structure_fingerprint TEXT");
            }
            if (!columns.contains("content_fingerprint")) {
                st.execute("ALTER TABLE issues ADD COLUMN content_fingerprint TEXT");
            }
        }
    }

    private void ensureStepColumns(Connection conn) throws SQLException {
        Set<String> columns = columnsOf(conn, "testcase_steps");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("step_uid")) {
                st.execute("ALTER TABLE testcase_steps ADD COLUMN step_uid TEXT NOT NULL DEFAULT ''");
            }
            st.execute("UPDATE testcase_steps SET step_uid='stp_' || id WHERE step_uid=''");
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_dirty_and_tombstone_indexes",
                "Index dirty and tombstoned issues for push and purge passes",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_issues_project_dirty ON issues(project_id, dirty)",
                        "CREATE INDEX IF NOT EXISTS idx_issues_project_deleted ON issues(project_id, is_deleted)"
                )
        ));
        steps.add(new MigrationStep(
                "20261001_002_step_uid_index",
                "Index step uids used by step execution alignment",
                List.of("CREATE INDEX IF NOT EXISTS idx_testcase_steps_uid ON testcase_steps(step_uid)")
        ));
        steps.add(new MigrationStep(
                "20261018_003_link_snapshots",
                "Remember the link keys each issue carried at its last pull",
                List.of("""
                        CREATE TABLE IF NOT EXISTS link_snapshots (
                            issue_id INTEGER NOT NULL REFERENCES issues(id) ON DELETE CASCADE,
                            link_field TEXT NOT NULL,
                            keys_json TEXT NOT NULL,
                            captured_at_ms INTEGER NOT NULL,
                            PRIMARY KEY(issue_id, link_field)
                        )
                        """)
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
