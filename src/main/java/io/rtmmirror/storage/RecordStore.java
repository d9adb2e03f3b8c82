package io.rtmmirror.storage;

import io.rtmmirror.model.DefectDetails;
import io.rtmmirror.model.ExecutionDetail;
import io.rtmmirror.model.ExecutionMeta;
import io.rtmmirror.model.Folder;
import io.rtmmirror.model.Issue;
import io.rtmmirror.model.IssueFields;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.model.KindDetails;
import io.rtmmirror.model.PlanMember;
import io.rtmmirror.model.Project;
import io.rtmmirror.model.RelationView;
import io.rtmmirror.model.RequirementDetails;
import io.rtmmirror.model.Step;
import io.rtmmirror.model.StepExecution;
import io.rtmmirror.model.TestCaseDetails;
import io.rtmmirror.model.TestExecutionDetails;
import io.rtmmirror.model.TestPlanDetails;
import io.rtmmirror.model.TreeNode;
import io.rtmmirror.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Normalized local store for projects, folders, issues of every kind and their owned rows.
 * Each public method runs on its own short-lived connection; multi-statement writes run in one
 * transaction. Owned collections (steps, plan members, relations, execution rows) are written
 * through {@link ChildReplacer} only.
 */
public final class RecordStore {
    private static final String ISSUE_COLUMNS = """
            id,project_id,remote_key,remote_id,kind,folder_id,summary,description,status,priority,assignee,reporter,
            labels,components,versions,environment,due_date,time_estimate,created,updated,
            preconditions,epic_name,issue_type_id,test_plan_key,execution_result,execute_transition,
            is_deleted,dirty,last_sync_at_ms,structure_fingerprint,content_fingerprint
            """;
    private static final String CONTENT_ASSIGNMENTS = """
            summary=?,description=?,status=?,priority=?,assignee=?,reporter=?,labels=?,components=?,versions=?,
            environment=?,due_date=?,time_estimate=?,created=?,updated=?,
            preconditions=?,epic_name=?,issue_type_id=?,test_plan_key=?,execution_result=?,execute_transition=?
            """;
    private static final String FOLDER_COLUMNS =
            "id,project_id,parent_id,name,kind,sort_order,remote_bound,is_deleted,structure_fingerprint";

    private final Database database;

    public RecordStore(Database database) {
        this.database = database;
    }

    // ---------------------------------------------------------------- projects

    public Project getOrCreateProject(String projectKey, long remoteId, String name, String baseUrl) {
        if (projectKey == null || projectKey.isBlank()) {
            throw new IllegalArgumentException("projectKey must not be blank");
        }
        String key = projectKey.trim();
        Optional<Project> existing = findProject(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT OR IGNORE INTO projects(project_key,remote_id,name,base_url,created_at_ms) VALUES(?,?,?,?,?)")) {
            ps.setString(1, key);
            ps.setLong(2, remoteId);
            ps.setString(3, name == null ? "" : name);
            ps.setString(4, baseUrl == null ? "" : baseUrl);
            ps.setLong(5, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create project", e);
        }
        return findProject(key).orElseThrow(() -> new IllegalStateException("Project vanished after insert: " + key));
    }

    public Project localProject() {
        return getOrCreateProject(Project.LOCAL_KEY, Project.LOCAL_REMOTE_ID, "Local", "");
    }

    public Optional<Project> findProject(String projectKey) {
        return queryProject("SELECT id,project_key,remote_id,name,base_url FROM projects WHERE project_key=?",
                ps -> ps.setString(1, projectKey));
    }

    public Optional<Project> findProject(long projectId) {
        return queryProject("SELECT id,project_key,remote_id,name,base_url FROM projects WHERE id=?",
                ps -> ps.setLong(1, projectId));
    }

    public List<Project> listProjects() {
        List<Project> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id,project_key,remote_id,name,base_url FROM projects ORDER BY project_key");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(toProject(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list projects", e);
        }
    }

    private Optional<Project> queryProject(String sql, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toProject(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read project", e);
        }
    }

    private static Project toProject(ResultSet rs) throws SQLException {
        return new Project(
                rs.getLong("id"),
                rs.getString("project_key"),
                rs.getLong("remote_id"),
                rs.getString("name"),
                rs.getString("base_url")
        );
    }

    // ---------------------------------------------------------------- folders

    public Optional<Folder> findFolder(String folderId) {
        if (folderId == null) {
            return Optional.empty();
        }
        try (Connection c = database.openConnection()) {
            return findFolder(c, folderId).map(StoredFolder::folder);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read folder", e);
        }
    }

    public Optional<StoredFolder> findRemoteFolder(long projectId, IssueKind kind, String remoteId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + FOLDER_COLUMNS + " FROM folders WHERE project_id=? AND kind=? AND remote_id=?")) {
            ps.setLong(1, projectId);
            ps.setString(2, kind.name());
            ps.setString(3, remoteId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toStoredFolder(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read folder by remote id", e);
        }
    }

    public Folder insertRemoteFolder(
            long projectId,
            IssueKind kind,
            String remoteId,
            String parentId,
            String name,
            int sortOrder,
            String fingerprint
    ) {
        String id = remoteFolderId(projectId, kind, remoteId);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     INSERT INTO folders(id,project_id,remote_id,parent_id,name,kind,sort_order,remote_bound,is_deleted,structure_fingerprint,updated_at_ms)
                     VALUES(?,?,?,?,?,?,?,1,0,?,?)
                     """)) {
            ps.setString(1, id);
            ps.setLong(2, projectId);
            ps.setString(3, remoteId);
            ps.setString(4, parentId);
            ps.setString(5, name == null ? "" : name);
            ps.setString(6, kind.name());
            ps.setInt(7, sortOrder);
            ps.setString(8, fingerprint);
            ps.setLong(9, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert remote folder " + remoteId, e);
        }
        return new Folder(id, projectId, parentId, name == null ? "" : name, kind, sortOrder, true, false);
    }

    /** Overwrites a remote-bound folder from the remote tree and revives it if it was tombstoned. */
    public void updateRemoteFolder(String folderId, String parentId, String name, int sortOrder, String fingerprint) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     UPDATE folders
                     SET parent_id=?, name=?, sort_order=?, structure_fingerprint=?, is_deleted=0, deleted_at_ms=NULL, updated_at_ms=?
                     WHERE id=?
                     """)) {
            ps.setString(1, parentId);
            ps.setString(2, name == null ? "" : name);
            ps.setInt(3, sortOrder);
            ps.setString(4, fingerprint);
            ps.setLong(5, Instant.now().toEpochMilli());
            ps.setString(6, folderId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update folder " + folderId, e);
        }
    }

    public int tombstoneFoldersNotIn(long projectId, IssueKind kind, Set<String> visitedIds) {
        List<String> stale = new ArrayList<>();
        try (Connection c = database.openConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id FROM folders WHERE project_id=? AND kind=? AND remote_bound=1 AND is_deleted=0")) {
                ps.setLong(1, projectId);
                ps.setString(2, kind.name());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String id = rs.getString(1);
                        if (!visitedIds.contains(id)) {
                            stale.add(id);
                        }
                    }
                }
            }
            if (stale.isEmpty()) {
                return 0;
            }
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement(
                    "UPDATE folders SET is_deleted=1, deleted_at_ms=?, updated_at_ms=? WHERE id=?")) {
                long now = Instant.now().toEpochMilli();
                for (String id : stale) {
                    up.setLong(1, now);
                    up.setLong(2, now);
                    up.setString(3, id);
                    up.executeUpdate();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
            return stale.size();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to tombstone folders", e);
        }
    }

    public Folder createLocalFolder(long projectId, IssueKind kind, String parentId, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Folder name must not be blank");
        }
        String id = "LF-" + UUID.randomUUID();
        try (Connection c = database.openConnection()) {
            requireFolderScope(c, parentId, projectId, kind);
            int sortOrder = nextSortOrder(c, projectId, kind, parentId);
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO folders(id,project_id,remote_id,parent_id,name,kind,sort_order,remote_bound,is_deleted,updated_at_ms)
                    VALUES(?,?,NULL,?,?,?,?,0,0,?)
                    """)) {
                ps.setString(1, id);
                ps.setLong(2, projectId);
                ps.setString(3, parentId);
                ps.setString(4, name.trim());
                ps.setString(5, kind.name());
                ps.setInt(6, sortOrder);
                ps.setLong(7, Instant.now().toEpochMilli());
                ps.executeUpdate();
            }
            return new Folder(id, projectId, parentId, name.trim(), kind, sortOrder, false, false);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create local folder", e);
        }
    }

    /**
     * Resolves a slash separated folder path below the kind root, creating missing segments as
     * local folders. Returns null for an empty path, meaning the root.
     */
    public String ensureFolderPath(long projectId, IssueKind kind, String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        String parentId = null;
        for (String raw : path.split("/")) {
            String segment = raw.trim();
            if (segment.isEmpty()) {
                continue;
            }
            Optional<String> existing = findChildFolderByName(projectId, kind, parentId, segment);
            parentId = existing.isPresent()
                    ? existing.get()
                    : createLocalFolder(projectId, kind, parentId, segment).id();
        }
        return parentId;
    }

    public String folderPath(String folderId) {
        List<String> names = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        try (Connection c = database.openConnection()) {
            String current = folderId;
            while (current != null && seen.add(current)) {
                Optional<StoredFolder> folder = findFolder(c, current);
                if (folder.isEmpty()) {
                    break;
                }
                names.add(0, folder.get().folder().name());
                current = folder.get().folder().parentId();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to resolve folder path", e);
        }
        return String.join("/", names);
    }

    public void moveFolder(String folderId, String newParentId) {
        try (Connection c = database.openConnection()) {
            Folder folder = findFolder(c, folderId)
                    .orElseThrow(() -> new IllegalArgumentException("Folder not found: " + folderId))
                    .folder();
            requireFolderScope(c, newParentId, folder.projectId(), folder.kind());
            String cursor = newParentId;
            Set<String> seen = new HashSet<>();
            while (cursor != null && seen.add(cursor)) {
                if (cursor.equals(folderId)) {
                    throw new IllegalArgumentException("Cannot move folder " + folderId + " below itself");
                }
                cursor = findFolder(c, cursor).map(f -> f.folder().parentId()).orElse(null);
            }
            int sortOrder = nextSortOrder(c, folder.projectId(), folder.kind(), newParentId);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE folders SET parent_id=?, sort_order=?, updated_at_ms=? WHERE id=?")) {
                ps.setString(1, newParentId);
                ps.setInt(2, sortOrder);
                ps.setLong(3, Instant.now().toEpochMilli());
                ps.setString(4, folderId);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to move folder", e);
        }
    }

    public boolean deleteFolderIfEmpty(String folderId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                if (countWhere(c, "SELECT COUNT(*) FROM folders WHERE parent_id=?", folderId) > 0
                        || countWhere(c, "SELECT COUNT(*) FROM issues WHERE folder_id=?", folderId) > 0) {
                    c.rollback();
                    return false;
                }
                int deleted;
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM folders WHERE id=?")) {
                    ps.setString(1, folderId);
                    deleted = ps.executeUpdate();
                }
                c.commit();
                return deleted > 0;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete folder", e);
        }
    }

    public List<Folder> listFolders(long projectId, IssueKind kind) {
        List<Folder> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + FOLDER_COLUMNS + " FROM folders WHERE project_id=? AND kind=? "
                             + "ORDER BY remote_bound DESC, sort_order ASC, name ASC")) {
            ps.setLong(1, projectId);
            ps.setString(2, kind.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(toStoredFolder(rs).folder());
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list folders", e);
        }
    }

    /** Remote folder id of a remote-bound folder; empty for local folders. */
    public Optional<String> folderRemoteId(String folderId) {
        if (folderId == null) {
            return Optional.empty();
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT remote_id FROM folders WHERE id=? AND remote_bound=1")) {
            ps.setString(1, folderId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read folder remote id", e);
        }
    }

    static String remoteFolderId(long projectId, IssueKind kind, String remoteId) {
        return "RF-" + projectId + "-" + kind.treeType() + "-" + remoteId;
    }

    private Optional<String> findChildFolderByName(long projectId, IssueKind kind, String parentId, String name) {
        String sql = "SELECT id FROM folders WHERE project_id=? AND kind=? AND name=? AND is_deleted=0 AND "
                + (parentId == null ? "parent_id IS NULL" : "parent_id=?")
                + " ORDER BY remote_bound DESC, sort_order ASC LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, projectId);
            ps.setString(2, kind.name());
            ps.setString(3, name);
            if (parentId != null) {
                ps.setString(4, parentId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up folder " + name, e);
        }
    }

    private Optional<StoredFolder> findFolder(Connection c, String folderId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + FOLDER_COLUMNS + " FROM folders WHERE id=?")) {
            ps.setString(1, folderId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toStoredFolder(rs)) : Optional.empty();
            }
        }
    }

    private void requireFolderScope(Connection c, String folderId, long projectId, IssueKind kind) throws SQLException {
        if (folderId == null) {
            return;
        }
        Folder folder = findFolder(c, folderId)
                .orElseThrow(() -> new IllegalArgumentException("Folder not found: " + folderId))
                .folder();
        if (folder.projectId() != projectId || folder.kind() != kind) {
            throw new IllegalArgumentException(
                    "Folder " + folderId + " belongs to " + folder.kind() + " of project " + folder.projectId()
                            + ", not " + kind + " of project " + projectId);
        }
    }

    private int nextSortOrder(Connection c, long projectId, IssueKind kind, String parentId) throws SQLException {
        String sql = "SELECT COALESCE(MAX(sort_order), -1) + 1 FROM folders WHERE project_id=? AND kind=? AND "
                + (parentId == null ? "parent_id IS NULL" : "parent_id=?");
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, projectId);
            ps.setString(2, kind.name());
            if (parentId != null) {
                ps.setString(3, parentId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private static StoredFolder toStoredFolder(ResultSet rs) throws SQLException {
        Folder folder = new Folder(
                rs.getString("id"),
                rs.getLong("project_id"),
                rs.getString("parent_id"),
                rs.getString("name"),
                IssueKind.valueOf(rs.getString("kind")),
                rs.getInt("sort_order"),
                rs.getInt("remote_bound") == 1,
                rs.getInt("is_deleted") == 1
        );
        return new StoredFolder(folder, rs.getString("structure_fingerprint"));
    }

    // ---------------------------------------------------------------- issues

    public Optional<Issue> findIssue(long issueId) {
        return queryIssue("SELECT " + ISSUE_COLUMNS + " FROM issues WHERE id=?", ps -> ps.setLong(1, issueId))
                .map(StoredIssue::issue);
    }

    public Optional<StoredIssue> findRemoteIssue(long projectId, IssueKind kind, String remoteKey) {
        return queryIssue("SELECT " + ISSUE_COLUMNS + " FROM issues WHERE project_id=? AND kind=? AND remote_key=?",
                ps -> {
                    ps.setLong(1, projectId);
                    ps.setString(2, kind.name());
                    ps.setString(3, remoteKey);
                });
    }

    /** Looks a remote key up across kinds; live records win over tombstoned ones. */
    public Optional<Issue> findIssueByRemoteKey(long projectId, String remoteKey) {
        return queryIssue("SELECT " + ISSUE_COLUMNS + " FROM issues WHERE project_id=? AND remote_key=? "
                        + "ORDER BY is_deleted ASC, id ASC LIMIT 1",
                ps -> {
                    ps.setLong(1, projectId);
                    ps.setString(2, remoteKey);
                }).map(StoredIssue::issue);
    }

    public long insertRemoteIssue(
            long projectId,
            IssueKind kind,
            String folderId,
            String remoteKey,
            Long remoteId,
            IssueFields fields,
            KindDetails details,
            String structureFingerprint,
            String contentFingerprint,
            long syncedAtMs
    ) {
        Issue candidate = new Issue(0L, projectId, remoteKey, remoteId, kind, folderId, fields, details,
                false, false, null);
        return insertIssue(candidate, structureFingerprint, contentFingerprint, syncedAtMs);
    }

    /** Full overwrite from a pulled payload: clears dirty and revives a tombstoned record. */
    public void overwriteFromRemote(
            long issueId,
            String folderId,
            Long remoteId,
            IssueFields fields,
            KindDetails details,
            String structureFingerprint,
            String contentFingerprint,
            long syncedAtMs
    ) {
        String sql = "UPDATE issues SET " + CONTENT_ASSIGNMENTS
                + ", folder_id=?, remote_id=?, structure_fingerprint=?, content_fingerprint=?, dirty=0, is_deleted=0,"
                + " deleted_at_ms=NULL, last_sync_at_ms=?, updated_at_ms=? WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = bindContent(ps, 1, fields, details);
            ps.setString(i++, folderId);
            setNullableLong(ps, i++, remoteId);
            ps.setString(i++, structureFingerprint);
            ps.setString(i++, contentFingerprint);
            ps.setLong(i++, syncedAtMs);
            ps.setLong(i++, syncedAtMs);
            ps.setLong(i, issueId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to overwrite issue " + issueId, e);
        }
    }

    /**
     * Structure-only pull: moves and renames the record and refreshes its remote id. Descriptive
     * content and the dirty flag are left as they are.
     */
    public void updateStructureFromRemote(
            long issueId,
            String folderId,
            Long remoteId,
            String summary,
            String structureFingerprint,
            long syncedAtMs
    ) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     UPDATE issues
                     SET folder_id=?, remote_id=?, summary=?, structure_fingerprint=?, is_deleted=0, deleted_at_ms=NULL,
                         last_sync_at_ms=?, updated_at_ms=?
                     WHERE id=?
                     """)) {
            ps.setString(1, folderId);
            setNullableLong(ps, 2, remoteId);
            ps.setString(3, summary == null ? "" : summary);
            ps.setString(4, structureFingerprint);
            ps.setLong(5, syncedAtMs);
            ps.setLong(6, syncedAtMs);
            ps.setLong(7, issueId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update issue structure " + issueId, e);
        }
    }

    public void markSeen(long issueId, long syncedAtMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE issues SET last_sync_at_ms=? WHERE id=?")) {
            ps.setLong(1, syncedAtMs);
            ps.setLong(2, issueId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to stamp issue " + issueId, e);
        }
    }

    /** Forgets the stored content fingerprint so the next full pull rewrites the record. */
    public void invalidateContentFingerprint(long issueId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE issues SET content_fingerprint=NULL WHERE id=?")) {
            ps.setLong(1, issueId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reset fingerprint of issue " + issueId, e);
        }
    }

    public int tombstoneIssuesNotIn(long projectId, IssueKind kind, Set<Long> visitedIds) {
        List<Long> stale = new ArrayList<>();
        try (Connection c = database.openConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id FROM issues WHERE project_id=? AND kind=? AND remote_key IS NOT NULL AND is_deleted=0")) {
                ps.setLong(1, projectId);
                ps.setString(2, kind.name());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        long id = rs.getLong(1);
                        if (!visitedIds.contains(id)) {
                            stale.add(id);
                        }
                    }
                }
            }
            if (stale.isEmpty()) {
                return 0;
            }
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement(
                    "UPDATE issues SET is_deleted=1, deleted_at_ms=?, updated_at_ms=? WHERE id=?")) {
                long now = Instant.now().toEpochMilli();
                for (Long id : stale) {
                    up.setLong(1, now);
                    up.setLong(2, now);
                    up.setLong(3, id);
                    up.executeUpdate();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
            return stale.size();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to tombstone issues", e);
        }
    }

    public Issue createLocalIssue(long projectId, IssueKind kind, String folderId, IssueFields fields, KindDetails details) {
        Issue candidate = new Issue(0L, projectId, null, null, kind, folderId, fields, details, true, false, null);
        try (Connection c = database.openConnection()) {
            requireFolderScope(c, folderId, projectId, kind);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to validate folder " + folderId, e);
        }
        long id = insertIssue(candidate, null, null, null);
        return findIssue(id).orElseThrow(() -> new IllegalStateException("Issue vanished after insert: " + id));
    }

    public Issue updateIssueFields(long issueId, IssueFields fields) {
        Issue current = requireLiveIssue(issueId);
        return writeLocalContent(current, fields, current.details());
    }

    public Issue updateIssueDetails(long issueId, KindDetails details) {
        Issue current = requireLiveIssue(issueId);
        if (details == null || details.kind() != current.kind()) {
            throw new IllegalArgumentException("Details do not match issue kind " + current.kind());
        }
        return writeLocalContent(current, current.fields(), details);
    }

    /** Local delete: tombstones the record and marks it dirty so the next push deletes it remotely. */
    public void softDeleteIssue(long issueId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE issues SET is_deleted=1, dirty=1, deleted_at_ms=?, updated_at_ms=? WHERE id=? AND is_deleted=0")) {
            long now = Instant.now().toEpochMilli();
            ps.setLong(1, now);
            ps.setLong(2, now);
            ps.setLong(3, issueId);
            if (ps.executeUpdate() == 0) {
                throw new IllegalArgumentException("Issue not found or already deleted: " + issueId);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete issue " + issueId, e);
        }
    }

    public void moveIssueToFolder(long issueId, String folderId) {
        Issue issue = requireLiveIssue(issueId);
        try (Connection c = database.openConnection()) {
            requireFolderScope(c, folderId, issue.projectId(), issue.kind());
            try (PreparedStatement ps = c.prepareStatement("UPDATE issues SET folder_id=?, updated_at_ms=? WHERE id=?")) {
                ps.setString(1, folderId);
                ps.setLong(2, Instant.now().toEpochMilli());
                ps.setLong(3, issueId);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to move issue " + issueId, e);
        }
    }

    /** Records the identity the remote service assigned to a pushed local-only issue. */
    public void bindRemoteIdentity(long issueId, String remoteKey, Long remoteId) {
        if (remoteKey == null || remoteKey.isBlank()) {
            throw new IllegalArgumentException("remoteKey must not be blank");
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE issues SET remote_key=?, remote_id=?, updated_at_ms=? WHERE id=?")) {
            ps.setString(1, remoteKey.trim());
            setNullableLong(ps, 2, remoteId);
            ps.setLong(3, Instant.now().toEpochMilli());
            ps.setLong(4, issueId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to bind remote identity " + remoteKey + " to issue " + issueId, e);
        }
    }

    public List<Issue> listIssues(long projectId, IssueKind kind, boolean includeDeleted) {
        String sql = "SELECT " + ISSUE_COLUMNS + " FROM issues WHERE project_id=? AND kind=?"
                + (includeDeleted ? "" : " AND is_deleted=0") + " ORDER BY id ASC";
        return queryIssues(sql, ps -> {
            ps.setLong(1, projectId);
            ps.setString(2, kind.name());
        });
    }

    public List<Issue> listDirtyIssues(long projectId) {
        return queryIssues("SELECT " + ISSUE_COLUMNS + " FROM issues WHERE project_id=? AND dirty=1 ORDER BY id ASC",
                ps -> ps.setLong(1, projectId));
    }

    /**
     * Identity rule shared with bulk transfer: a local id that exists wins, then the remote key,
     * otherwise the row becomes a new local-only issue.
     */
    public IdentityResolution resolveIdentity(long projectId, IssueKind kind, Long localId, String remoteKey) {
        if (localId != null) {
            Optional<Issue> local = findIssue(localId);
            if (local.isPresent() && local.get().projectId() == projectId) {
                if (local.get().kind() != kind) {
                    throw new IllegalArgumentException(
                            "Issue " + localId + " is a " + local.get().kind() + ", not a " + kind);
                }
                return IdentityResolution.existingLocal(localId);
            }
        }
        if (remoteKey != null && !remoteKey.isBlank()) {
            Optional<StoredIssue> remote = findRemoteIssue(projectId, kind, remoteKey.trim());
            if (remote.isPresent()) {
                return IdentityResolution.existingRemote(remote.get().issue().id());
            }
        }
        return IdentityResolution.createLocalOnly();
    }

    /**
     * Physically removes tombstoned records of a project. Tombstones still waiting to be pushed as
     * remote deletes are kept. Never called by a sync run.
     */
    public PurgeResult purgeTombstoned(long projectId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                int issues;
                try (PreparedStatement ps = c.prepareStatement(
                        "DELETE FROM issues WHERE project_id=? AND is_deleted=1 AND dirty=0")) {
                    ps.setLong(1, projectId);
                    issues = ps.executeUpdate();
                }
                int folders = 0;
                try (PreparedStatement ps = c.prepareStatement("""
                        DELETE FROM folders
                        WHERE project_id=? AND is_deleted=1
                          AND NOT EXISTS (SELECT 1 FROM folders child WHERE child.parent_id = folders.id)
                          AND NOT EXISTS (SELECT 1 FROM issues i WHERE i.folder_id = folders.id)
                        """)) {
                    // Leaves first: each pass can empty the next level up.
                    int removed;
                    do {
                        ps.setLong(1, projectId);
                        removed = ps.executeUpdate();
                        folders += removed;
                    } while (removed > 0);
                }
                c.commit();
                return new PurgeResult(issues, folders);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge tombstoned records", e);
        }
    }

    public StatusCounts statusCounts(long projectId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT COUNT(*) AS total,
                            COALESCE(SUM(CASE WHEN dirty=1 THEN 1 ELSE 0 END), 0) AS dirty,
                            COALESCE(SUM(CASE WHEN remote_key IS NULL THEN 1 ELSE 0 END), 0) AS local_only,
                            COALESCE(SUM(CASE WHEN is_deleted=1 THEN 1 ELSE 0 END), 0) AS tombstoned
                     FROM issues WHERE project_id=?
                     """)) {
            ps.setLong(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return new StatusCounts(rs.getLong("total"), rs.getLong("dirty"), rs.getLong("local_only"),
                        rs.getLong("tombstoned"));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count issues", e);
        }
    }

    /**
     * Nested folder/issue view of one kind scope. Tombstoned issues are left out; a tombstoned
     * folder only shows up while it still holds live content.
     */
    public List<TreeNode> fetchTree(long projectId, IssueKind kind) {
        List<Folder> folders = listFolders(projectId, kind);
        List<Issue> issues = listIssues(projectId, kind, false);
        Map<String, List<Folder>> foldersByParent = new LinkedHashMap<>();
        Set<String> knownFolders = new HashSet<>();
        for (Folder folder : folders) {
            knownFolders.add(folder.id());
        }
        for (Folder folder : folders) {
            String parent = folder.parentId() != null && knownFolders.contains(folder.parentId()) ? folder.parentId() : null;
            foldersByParent.computeIfAbsent(parent, k -> new ArrayList<>()).add(folder);
        }
        Map<String, List<Issue>> issuesByFolder = new LinkedHashMap<>();
        for (Issue issue : issues) {
            String folder = issue.folderId() != null && knownFolders.contains(issue.folderId()) ? issue.folderId() : null;
            issuesByFolder.computeIfAbsent(folder, k -> new ArrayList<>()).add(issue);
        }
        return buildLevel(null, foldersByParent, issuesByFolder, new HashSet<>());
    }

    private List<TreeNode> buildLevel(
            String parentId,
            Map<String, List<Folder>> foldersByParent,
            Map<String, List<Issue>> issuesByFolder,
            Set<String> seen
    ) {
        List<TreeNode> out = new ArrayList<>();
        for (Folder folder : foldersByParent.getOrDefault(parentId, List.of())) {
            if (!seen.add(folder.id())) {
                continue;
            }
            List<TreeNode> children = buildLevel(folder.id(), foldersByParent, issuesByFolder, seen);
            if (folder.deleted() && children.isEmpty()) {
                continue;
            }
            out.add(new TreeNode(folder.id(), null, folder.name(), null, false, children));
        }
        for (Issue issue : issuesByFolder.getOrDefault(parentId, List.of())) {
            String label = issue.remoteKey() == null
                    ? issue.fields().summary()
                    : issue.remoteKey() + " " + issue.fields().summary();
            out.add(new TreeNode(issue.folderId(), issue.id(), label.trim(), issue.remoteKey(), issue.dirty(), List.of()));
        }
        return out;
    }

    private Issue requireLiveIssue(long issueId) {
        Issue issue = findIssue(issueId).orElseThrow(() -> new IllegalArgumentException("Issue not found: " + issueId));
        if (issue.deleted()) {
            throw new IllegalStateException("Issue " + issueId + " is deleted");
        }
        return issue;
    }

    private Issue writeLocalContent(Issue current, IssueFields fields, KindDetails details) {
        String sql = "UPDATE issues SET " + CONTENT_ASSIGNMENTS + ", dirty=1, updated_at_ms=? WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = bindContent(ps, 1, fields, details);
            ps.setLong(i++, Instant.now().toEpochMilli());
            ps.setLong(i, current.id());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update issue " + current.id(), e);
        }
        return findIssue(current.id()).orElseThrow();
    }

    private long insertIssue(Issue issue, String structureFingerprint, String contentFingerprint, Long syncedAtMs) {
        String sql = """
                INSERT INTO issues(project_id,remote_key,remote_id,kind,folder_id,
                    summary,description,status,priority,assignee,reporter,labels,components,versions,
                    environment,due_date,time_estimate,created,updated,
                    preconditions,epic_name,issue_type_id,test_plan_key,execution_result,execute_transition,
                    is_deleted,dirty,last_sync_at_ms,structure_fingerprint,content_fingerprint,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?, ?,?,?,?,?,?,?,?,?, ?,?,?,?,?, ?,?,?,?,?,?, 0,?,?,?,?,?,?)
                """;
        long now = Instant.now().toEpochMilli();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, issue.projectId());
            ps.setString(2, issue.remoteKey());
            setNullableLong(ps, 3, issue.remoteId());
            ps.setString(4, issue.kind().name());
            ps.setString(5, issue.folderId());
            int i = bindContent(ps, 6, issue.fields(), issue.details());
            ps.setInt(i++, issue.dirty() ? 1 : 0);
            setNullableLong(ps, i++, syncedAtMs);
            ps.setString(i++, structureFingerprint);
            ps.setString(i++, contentFingerprint);
            ps.setLong(i++, now);
            ps.setLong(i, now);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for issue");
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert issue " + (issue.remoteKey() == null ? "" : issue.remoteKey()), e);
        }
    }

    private static int bindContent(PreparedStatement ps, int start, IssueFields f, KindDetails details) throws SQLException {
        int i = start;
        ps.setString(i++, f.summary());
        ps.setString(i++, f.description());
        ps.setString(i++, f.status());
        ps.setString(i++, f.priority());
        ps.setString(i++, f.assignee());
        ps.setString(i++, f.reporter());
        ps.setString(i++, Jsons.toCompactJson(f.labels()));
        ps.setString(i++, Jsons.toCompactJson(f.components()));
        ps.setString(i++, Jsons.toCompactJson(f.versions()));
        ps.setString(i++, f.environment());
        ps.setString(i++, f.dueDate());
        ps.setString(i++, f.timeEstimate());
        ps.setString(i++, f.created());
        ps.setString(i++, f.updated());

        String preconditions = "";
        String epicName = "";
        Integer issueTypeId = null;
        String testPlanKey = "";
        String result = "";
        String executeTransition = "";
        if (details instanceof RequirementDetails r) {
            epicName = r.epicName();
            issueTypeId = r.issueTypeId();
        } else if (details instanceof TestCaseDetails t) {
            preconditions = t.preconditions();
        } else if (details instanceof TestExecutionDetails t) {
            testPlanKey = t.testPlanKey();
            result = t.result();
            executeTransition = t.executeTransition();
        } else if (details instanceof DefectDetails d) {
            issueTypeId = d.issueTypeId();
        }
        ps.setString(i++, preconditions);
        ps.setString(i++, epicName);
        if (issueTypeId == null) {
            ps.setNull(i++, Types.INTEGER);
        } else {
            ps.setInt(i++, issueTypeId);
        }
        ps.setString(i++, testPlanKey);
        ps.setString(i++, result);
        ps.setString(i++, executeTransition);
        return i;
    }

    private Optional<StoredIssue> queryIssue(String sql, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toStoredIssue(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read issue", e);
        }
    }

    private List<Issue> queryIssues(String sql, Binder binder) {
        List<Issue> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(toStoredIssue(rs).issue());
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list issues", e);
        }
    }

    private static StoredIssue toStoredIssue(ResultSet rs) throws SQLException {
        IssueKind kind = IssueKind.valueOf(rs.getString("kind"));
        IssueFields fields = new IssueFields(
                rs.getString("summary"),
                rs.getString("description"),
                rs.getString("status"),
                rs.getString("priority"),
                rs.getString("assignee"),
                rs.getString("reporter"),
                Jsons.readStringList(rs.getString("labels")),
                Jsons.readStringList(rs.getString("components")),
                Jsons.readStringList(rs.getString("versions")),
                rs.getString("environment"),
                rs.getString("due_date"),
                rs.getString("time_estimate"),
                rs.getString("created"),
                rs.getString("updated")
        );
        int rawTypeId = rs.getInt("issue_type_id");
        Integer issueTypeId = rs.wasNull() ? null : rawTypeId;
        KindDetails details = switch (kind) {
            case REQUIREMENT -> new RequirementDetails(rs.getString("epic_name"), issueTypeId);
            case TEST_CASE -> new TestCaseDetails(rs.getString("preconditions"));
            case TEST_PLAN -> new TestPlanDetails();
            case TEST_EXECUTION -> new TestExecutionDetails(
                    rs.getString("test_plan_key"), rs.getString("execution_result"), rs.getString("execute_transition"));
            case DEFECT -> new DefectDetails(issueTypeId);
        };
        long rawRemoteId = rs.getLong("remote_id");
        Long remoteId = rs.wasNull() ? null : rawRemoteId;
        long rawSync = rs.getLong("last_sync_at_ms");
        Instant lastSyncAt = rs.wasNull() ? null : Instant.ofEpochMilli(rawSync);
        Issue issue = new Issue(
                rs.getLong("id"),
                rs.getLong("project_id"),
                rs.getString("remote_key"),
                remoteId,
                kind,
                rs.getString("folder_id"),
                fields,
                details,
                rs.getInt("dirty") == 1,
                rs.getInt("is_deleted") == 1,
                lastSyncAt
        );
        return new StoredIssue(issue, rs.getString("structure_fingerprint"), rs.getString("content_fingerprint"));
    }

    // ---------------------------------------------------------------- owned rows (read side)

    public List<Step> listSteps(long testCaseId) {
        List<Step> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT group_no,order_no,action,input,expected,step_uid FROM testcase_steps WHERE issue_id=? ORDER BY group_no, order_no")) {
            ps.setLong(1, testCaseId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Step(rs.getInt(1), rs.getInt(2), rs.getString(3), rs.getString(4), rs.getString(5),
                            rs.getString(6)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list steps", e);
        }
    }

    public List<PlanMember> listPlanMembers(long testPlanId) {
        List<PlanMember> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT testcase_id,order_no FROM testplan_testcases WHERE testplan_id=? ORDER BY order_no, id")) {
            ps.setLong(1, testPlanId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new PlanMember(rs.getLong(1), rs.getInt(2)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list plan members", e);
        }
    }

    public List<RelationView> listRelations(long srcIssueId) {
        List<RelationView> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT r.dst_issue_id, i.remote_key, i.kind, i.summary, r.relation_kind, r.created_at_ms
                     FROM relations r JOIN issues i ON i.id = r.dst_issue_id
                     WHERE r.src_issue_id=?
                     ORDER BY r.relation_kind, r.id
                     """)) {
            ps.setLong(1, srcIssueId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new RelationView(
                            rs.getLong(1),
                            rs.getString(2),
                            IssueKind.valueOf(rs.getString(3)),
                            rs.getString(4),
                            rs.getString(5),
                            rs.getLong(6)
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list relations", e);
        }
    }

    /**
     * Remembers the remote keys one link field carried when the issue was last pulled or pushed.
     * Push uses it to tell links the mirror never resolved from links removed locally.
     */
    public void saveLinkSnapshot(long issueId, String linkField, List<String> remoteKeys) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     INSERT INTO link_snapshots(issue_id,link_field,keys_json,captured_at_ms) VALUES(?,?,?,?)
                     ON CONFLICT(issue_id,link_field) DO UPDATE SET keys_json=excluded.keys_json,
                       captured_at_ms=excluded.captured_at_ms
                     """)) {
            ps.setLong(1, issueId);
            ps.setString(2, linkField);
            ps.setString(3, Jsons.toCompactJson(remoteKeys == null ? List.of() : remoteKeys));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save link snapshot", e);
        }
    }

    /** Link field name to the remote keys captured for it. Fields never captured are absent. */
    public Map<String, List<String>> linkSnapshots(long issueId) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT link_field,keys_json FROM link_snapshots WHERE issue_id=? ORDER BY link_field")) {
            ps.setLong(1, issueId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString(1), Jsons.readStringList(rs.getString(2)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read link snapshots", e);
        }
    }

    /** Creates or updates the execution meta row of a test execution issue and returns its row id. */
    public long upsertExecutionMeta(long testExecutionIssueId, ExecutionMeta meta) {
        ExecutionMeta m = meta == null ? ExecutionMeta.empty() : meta;
        try (Connection c = database.openConnection()) {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO testexecutions(issue_id,environment,start_date,end_date,result,executed_by)
                    VALUES(?,?,?,?,?,?)
                    ON CONFLICT(issue_id) DO UPDATE SET
                        environment=excluded.environment,
                        start_date=excluded.start_date,
                        end_date=excluded.end_date,
                        result=excluded.result,
                        executed_by=excluded.executed_by
                    """)) {
                ps.setLong(1, testExecutionIssueId);
                ps.setString(2, m.environment());
                ps.setString(3, m.startDate());
                ps.setString(4, m.endDate());
                ps.setString(5, m.result());
                ps.setString(6, m.executedBy());
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement("SELECT id FROM testexecutions WHERE issue_id=?")) {
                ps.setLong(1, testExecutionIssueId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new SQLException("Execution meta row missing after upsert");
                    }
                    return rs.getLong(1);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert execution meta for issue " + testExecutionIssueId, e);
        }
    }

    public Optional<ExecutionMetaRow> findExecutionMeta(long testExecutionIssueId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id,environment,start_date,end_date,result,executed_by FROM testexecutions WHERE issue_id=?")) {
            ps.setLong(1, testExecutionIssueId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new ExecutionMetaRow(
                        rs.getLong("id"),
                        new ExecutionMeta(rs.getString("environment"), rs.getString("start_date"),
                                rs.getString("end_date"), rs.getString("result"), rs.getString("executed_by"))
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read execution meta", e);
        }
    }

    public List<ExecutionDetailRow> listExecutionDetails(long executionRowId) {
        List<ExecutionDetailRow> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT id,testcase_id,order_no,assignee,result,actual_time,environment,defects,remote_execution_key
                     FROM testcase_executions WHERE testexecution_id=? ORDER BY order_no, id
                     """)) {
            ps.setLong(1, executionRowId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long rawTime = rs.getLong("actual_time");
                    Long actualTime = rs.wasNull() ? null : rawTime;
                    out.add(new ExecutionDetailRow(rs.getLong("id"), new ExecutionDetail(
                            rs.getLong("testcase_id"),
                            rs.getInt("order_no"),
                            rs.getString("assignee"),
                            rs.getString("result"),
                            rs.getString("environment"),
                            rs.getString("defects"),
                            actualTime,
                            rs.getString("remote_execution_key")
                    )));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list execution details", e);
        }
    }

    public List<StepExecution> listStepExecutions(long testcaseExecutionId) {
        List<StepExecution> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT group_no,order_no,step_uid,status,actual_result,evidence
                     FROM testcase_step_executions WHERE testcase_execution_id=? ORDER BY group_no, order_no
                     """)) {
            ps.setLong(1, testcaseExecutionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StepExecution(rs.getInt(1), rs.getInt(2), rs.getString(3), rs.getString(4),
                            rs.getString(5), rs.getString(6)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list step executions", e);
        }
    }

    /**
     * Step execution rows of a test case whose step uid no longer matches any current step,
     * i.e. history recorded against steps that were since edited or removed.
     */
    public List<MisalignedStepExecution> listMisalignedStepExecutions(long testCaseId) {
        List<MisalignedStepExecution> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT e.id AS execution_row_id, se.group_no, se.order_no, se.step_uid, se.status
                     FROM testcase_step_executions se
                     JOIN testcase_executions e ON e.id = se.testcase_execution_id
                     WHERE e.testcase_id=?
                       AND NOT EXISTS (
                           SELECT 1 FROM testcase_steps s WHERE s.issue_id = e.testcase_id AND s.step_uid = se.step_uid
                       )
                     ORDER BY e.id, se.group_no, se.order_no
                     """)) {
            ps.setLong(1, testCaseId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new MisalignedStepExecution(
                            rs.getLong("execution_row_id"),
                            rs.getInt("group_no"),
                            rs.getInt("order_no"),
                            rs.getString("step_uid"),
                            rs.getString("status")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list misaligned step executions", e);
        }
    }

    private static int countWhere(Connection c, String sql, String arg) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, arg);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    public record StoredFolder(Folder folder, String fingerprint) {
    }

    public record StoredIssue(Issue issue, String structureFingerprint, String contentFingerprint) {
    }

    public record ExecutionMetaRow(long rowId, ExecutionMeta meta) {
    }

    public record ExecutionDetailRow(long rowId, ExecutionDetail detail) {
    }

    public record MisalignedStepExecution(long executionRowId, int groupNo, int orderNo, String stepUid, String status) {
    }

    public record PurgeResult(int issuesPurged, int foldersPurged) {
    }

    public record StatusCounts(long total, long dirty, long localOnly, long tombstoned) {
    }
}
