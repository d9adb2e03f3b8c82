package io.rtmmirror.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.rtmmirror.mapping.FieldMapper;
import io.rtmmirror.mapping.MappedIssue;
import io.rtmmirror.model.Issue;
import io.rtmmirror.model.IssueFields;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.model.KindDetails;
import io.rtmmirror.storage.ChildKind;
import io.rtmmirror.storage.ChildReplacer;
import io.rtmmirror.storage.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Merges one remote kind-scope tree into the local store. The walk is depth-first; every node is
 * handled in its own store calls, so a failing node is reported and its siblings still run.
 * Remote-bound records the walk did not reach are tombstoned once the walk completes.
 */
public final class TreeReconciler {
    private static final Logger LOG = LoggerFactory.getLogger(TreeReconciler.class);

    private final RecordStore store;
    private final ChildReplacer replacer;
    private final FieldMapper mapper;

    public TreeReconciler(RecordStore store, ChildReplacer replacer, FieldMapper mapper) {
        this.store = store;
        this.replacer = replacer;
        this.mapper = mapper;
    }

    /** Full, remote-authoritative reconcile that maps the tree nodes themselves as issue payloads. */
    public ReconciliationResult reconcile(long projectId, IssueKind kind, JsonNode remoteTree) {
        return reconcile(projectId, kind, remoteTree, ReconcileMode.FULL, PullPolicy.OVERWRITE,
                PayloadSource.treeNodes(), CancellationSignal.none());
    }

    public ReconciliationResult reconcile(
            long projectId,
            IssueKind kind,
            JsonNode remoteTree,
            ReconcileMode mode,
            PullPolicy policy,
            PayloadSource payloads,
            CancellationSignal cancel
    ) {
        Walk walk = new Walk(projectId, kind, mode, policy, payloads, Instant.now().toEpochMilli());
        List<JsonNode> roots = rootNodes(remoteTree);
        for (int i = 0; i < roots.size(); i++) {
            if (cancel.isCancelled()) {
                walk.cancelled = true;
                LOG.info("Reconcile of {} cancelled after {} of {} top-level nodes", kind.treeType(), i, roots.size());
                break;
            }
            visit(walk, roots.get(i), null, i);
        }
        int tombstoned = 0;
        if (!walk.cancelled) {
            tombstoned = store.tombstoneIssuesNotIn(projectId, kind, walk.visitedIssues)
                    + store.tombstoneFoldersNotIn(projectId, kind, walk.visitedFolders);
        }
        LOG.debug("Reconciled {}: created={} updated={} tombstoned={} unchanged={} skippedDirty={} failed={}",
                kind.treeType(), walk.created, walk.updated, tombstoned, walk.unchanged, walk.skippedDirty,
                walk.failures.size());
        return new ReconciliationResult(
                kind,
                walk.created,
                walk.updated,
                tombstoned,
                walk.unchanged,
                walk.skippedDirty,
                walk.failures,
                walk.warnings,
                walk.cancelled,
                walk.pulled
        );
    }

    private void visit(Walk walk, JsonNode node, String parentFolderId, int order) {
        if (node == null || !node.isObject()) {
            walk.warnings.add(walk.kind.treeType() + ": ignored a tree entry that is not an object");
            return;
        }
        try {
            if (isFolder(node)) {
                visitFolder(walk, node, parentFolderId, order);
            } else {
                visitIssue(walk, node, parentFolderId);
            }
        } catch (IdentityConflictException e) {
            LOG.warn("Identity conflict in {} tree: {}", walk.kind.treeType(), e.getMessage());
            walk.failures.add(SyncFailure.of(e.remoteIdentity(), "identity", e));
            protectSubtree(walk, node, false);
        } catch (RuntimeException e) {
            String identity = identityOf(node);
            LOG.warn("Failed to reconcile {} node {}: {}", walk.kind.treeType(), identity, e.getMessage());
            walk.failures.add(SyncFailure.of(identity, "node", e));
            protectSubtree(walk, node, true);
        }
    }

    private void visitFolder(Walk walk, JsonNode node, String parentFolderId, int order) {
        String remoteId = text(node, "id");
        if (remoteId.isEmpty()) {
            throw new IllegalArgumentException("Folder node has no id");
        }
        if (!walk.seenFolderIds.add(remoteId)) {
            throw new IdentityConflictException("folder:" + remoteId,
                    "Folder " + remoteId + " appears twice in the " + walk.kind.treeType() + " tree");
        }
        String name = firstText(node, "name", "folderName", "summary");
        String fingerprint = Fingerprints.folder(parentFolderId, name, order);
        Optional<RecordStore.StoredFolder> existing = store.findRemoteFolder(walk.projectId, walk.kind, remoteId);
        String folderId;
        if (existing.isEmpty()) {
            folderId = store.insertRemoteFolder(walk.projectId, walk.kind, remoteId, parentFolderId, name, order,
                    fingerprint).id();
            walk.created++;
        } else {
            folderId = existing.get().folder().id();
            if (!fingerprint.equals(existing.get().fingerprint()) || existing.get().folder().deleted()) {
                store.updateRemoteFolder(folderId, parentFolderId, name, order, fingerprint);
                walk.updated++;
            } else {
                walk.unchanged++;
            }
        }
        walk.visitedFolders.add(folderId);
        JsonNode children = node.path("children");
        for (int i = 0; i < children.size(); i++) {
            visit(walk, children.get(i), folderId, i);
        }
    }

    private void visitIssue(Walk walk, JsonNode node, String folderId) {
        String key = issueKey(node);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Issue node has neither a key nor a folder type");
        }
        if (!walk.seenIssueKeys.add(key)) {
            throw new IdentityConflictException(key,
                    "Issue " + key + " appears twice in the " + walk.kind.treeType() + " tree");
        }
        Optional<RecordStore.StoredIssue> existing = store.findRemoteIssue(walk.projectId, walk.kind, key);
        existing.ifPresent(stored -> walk.visitedIssues.add(stored.issue().id()));
        Long treeRemoteId = longValue(node, "issueId", "jiraId");
        if (walk.mode == ReconcileMode.STRUCTURE_ONLY) {
            reconcileStructure(walk, node, folderId, key, treeRemoteId, existing);
        } else {
            reconcileContent(walk, node, folderId, key, treeRemoteId, existing);
        }
    }

    private void reconcileStructure(
            Walk walk,
            JsonNode node,
            String folderId,
            String key,
            Long treeRemoteId,
            Optional<RecordStore.StoredIssue> existing
    ) {
        String remoteSummary = firstText(node, "name", "summary");
        String fingerprint = Fingerprints.issueStructure(folderId, remoteSummary);
        if (existing.isEmpty()) {
            long id = store.insertRemoteIssue(walk.projectId, walk.kind, folderId, key, treeRemoteId,
                    IssueFields.ofSummary(remoteSummary), KindDetails.emptyFor(walk.kind), fingerprint, null, walk.nowMs);
            walk.visitedIssues.add(id);
            walk.created++;
            return;
        }
        Issue issue = existing.get().issue();
        if (!fingerprint.equals(existing.get().structureFingerprint()) || issue.deleted()) {
            // a dirty record keeps its local summary until it is pushed
            String summary = issue.dirty() ? issue.fields().summary() : remoteSummary;
            Long remoteId = treeRemoteId == null ? issue.remoteId() : treeRemoteId;
            store.updateStructureFromRemote(issue.id(), folderId, remoteId, summary, fingerprint, walk.nowMs);
            walk.updated++;
        } else {
            store.markSeen(issue.id(), walk.nowMs);
            walk.unchanged++;
        }
    }

    private void reconcileContent(
            Walk walk,
            JsonNode node,
            String folderId,
            String key,
            Long treeRemoteId,
            Optional<RecordStore.StoredIssue> existing
    ) {
        if (existing.isPresent() && existing.get().issue().dirty() && walk.policy == PullPolicy.SKIP_DIRTY) {
            walk.skippedDirty++;
            return;
        }
        MappedIssue mapped = mapper.toLocal(walk.kind, walk.payloads.payloadFor(walk.kind, key, node));
        for (String warning : mapped.warnings()) {
            walk.warnings.add(key + ": " + warning);
        }
        Long remoteId = mapped.remoteId() != null ? mapped.remoteId() : treeRemoteId;
        String structure = Fingerprints.issueStructure(folderId, mapped.fields().summary());
        String content = Fingerprints.content(mapped);
        long issueId;
        if (existing.isEmpty()) {
            issueId = store.insertRemoteIssue(walk.projectId, walk.kind, folderId, key, remoteId, mapped.fields(),
                    mapped.details(), structure, content, walk.nowMs);
            walk.visitedIssues.add(issueId);
            replaceSteps(walk, issueId, key, mapped);
            walk.created++;
        } else {
            RecordStore.StoredIssue stored = existing.get();
            issueId = stored.issue().id();
            boolean changed = !content.equals(stored.contentFingerprint())
                    || !structure.equals(stored.structureFingerprint())
                    || stored.issue().dirty()
                    || stored.issue().deleted();
            if (changed) {
                store.overwriteFromRemote(issueId, folderId, remoteId, mapped.fields(), mapped.details(),
                        structure, content, walk.nowMs);
                replaceSteps(walk, issueId, key, mapped);
                walk.updated++;
            } else {
                store.markSeen(issueId, walk.nowMs);
                walk.unchanged++;
            }
        }
        walk.pulled.add(new ReconciliationResult.PulledIssue(issueId, key, mapped));
    }

    private void replaceSteps(Walk walk, long issueId, String key, MappedIssue mapped) {
        if (walk.kind != IssueKind.TEST_CASE) {
            return;
        }
        try {
            replacer.replaceChildren(issueId, ChildKind.STEPS, mapped.steps());
        } catch (RuntimeException e) {
            store.invalidateContentFingerprint(issueId);
            LOG.warn("Steps of {} were not replaced: {}", key, e.getMessage());
            walk.failures.add(SyncFailure.of(key, "steps", e));
        }
    }

    /**
     * Marks the local records behind a skipped subtree as visited so a failed node does not get
     * its children tombstoned. With {@code includeRoot} false the root's slot belongs to another node.
     */
    private void protectSubtree(Walk walk, JsonNode node, boolean includeRoot) {
        if (node == null || !node.isObject()) {
            return;
        }
        if (isFolder(node)) {
            String remoteId = text(node, "id");
            if (includeRoot && !remoteId.isEmpty()) {
                store.findRemoteFolder(walk.projectId, walk.kind, remoteId)
                        .ifPresent(stored -> walk.visitedFolders.add(stored.folder().id()));
            }
            for (JsonNode child : node.path("children")) {
                protectSubtree(walk, child, true);
            }
        } else if (includeRoot) {
            String key = issueKey(node);
            if (!key.isEmpty()) {
                store.findRemoteIssue(walk.projectId, walk.kind, key)
                        .ifPresent(stored -> walk.visitedIssues.add(stored.issue().id()));
            }
        }
    }

    static List<JsonNode> rootNodes(JsonNode tree) {
        List<JsonNode> out = new ArrayList<>();
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            return out;
        }
        JsonNode roots = tree;
        if (tree.isObject()) {
            if (tree.path("roots").isArray()) {
                roots = tree.get("roots");
            } else if (tree.path("children").isArray() && !isFolder(tree)) {
                roots = tree.get("children");
            } else {
                out.add(tree);
                return out;
            }
        }
        roots.forEach(out::add);
        return out;
    }

    private static boolean isFolder(JsonNode node) {
        String type = text(node, "type");
        if (!type.isEmpty()) {
            return "FOLDER".equals(type.toUpperCase(Locale.ROOT));
        }
        return node.has("folderName") || (issueKey(node).isEmpty() && node.path("children").isArray());
    }

    private static String issueKey(JsonNode node) {
        return firstText(node, "testKey", "jiraKey", "key");
    }

    private static String identityOf(JsonNode node) {
        String key = issueKey(node);
        return key.isEmpty() ? "folder:" + text(node, "id") : key;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return "";
        }
        return value.asText("").trim();
    }

    private static Long longValue(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.canConvertToLong()) {
                return value.asLong();
            }
            if (value != null && value.isTextual() && value.asText().trim().matches("-?\\d+")) {
                return Long.parseLong(value.asText().trim());
            }
        }
        return null;
    }

    /** Supplies the payload that gets mapped for one issue node. */
    @FunctionalInterface
    public interface PayloadSource {
        JsonNode payloadFor(IssueKind kind, String remoteKey, JsonNode treeNode);

        static PayloadSource treeNodes() {
            return (kind, remoteKey, treeNode) -> treeNode;
        }
    }

    private static final class Walk {
        private final long projectId;
        private final IssueKind kind;
        private final ReconcileMode mode;
        private final PullPolicy policy;
        private final PayloadSource payloads;
        private final long nowMs;
        private final Set<String> seenFolderIds = new HashSet<>();
        private final Set<String> seenIssueKeys = new HashSet<>();
        private final Set<String> visitedFolders = new HashSet<>();
        private final Set<Long> visitedIssues = new HashSet<>();
        private final List<SyncFailure> failures = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<ReconciliationResult.PulledIssue> pulled = new ArrayList<>();
        private int created;
        private int updated;
        private int unchanged;
        private int skippedDirty;
        private boolean cancelled;

        private Walk(long projectId, IssueKind kind, ReconcileMode mode, PullPolicy policy, PayloadSource payloads, long nowMs) {
            this.projectId = projectId;
            this.kind = kind;
            this.mode = mode;
            this.policy = policy;
            this.payloads = payloads;
            this.nowMs = nowMs;
        }
    }
}
