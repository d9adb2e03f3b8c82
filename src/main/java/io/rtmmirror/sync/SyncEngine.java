package io.rtmmirror.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rtmmirror.mapping.ExecutionRef;
import io.rtmmirror.mapping.FieldMapper;
import io.rtmmirror.mapping.LinkField;
import io.rtmmirror.mapping.LinkUpdate;
import io.rtmmirror.mapping.LocalRecord;
import io.rtmmirror.mapping.MappedIssue;
import io.rtmmirror.model.CheckpointKind;
import io.rtmmirror.model.ExecutionDetail;
import io.rtmmirror.model.Issue;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.model.PlanMember;
import io.rtmmirror.model.Project;
import io.rtmmirror.model.Relation;
import io.rtmmirror.model.RelationView;
import io.rtmmirror.model.Step;
import io.rtmmirror.model.SyncCheckpoint;
import io.rtmmirror.observability.SyncAuditLog;
import io.rtmmirror.remote.RemoteIssueService;
import io.rtmmirror.remote.RemoteServiceException;
import io.rtmmirror.storage.ChildKind;
import io.rtmmirror.storage.ChildReplacer;
import io.rtmmirror.storage.RecordStore;
import io.rtmmirror.storage.SyncStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pull and push orchestration for one project. Runs are synchronous and assume no other run on
 * the same project is in flight. Per-record problems end up in the returned {@link SyncReport};
 * only misuse (unknown ids, local-only projects) throws.
 */
public final class SyncEngine {
    private static final Logger LOG = LoggerFactory.getLogger(SyncEngine.class);

    private final RecordStore store;
    private final ChildReplacer replacer;
    private final SyncStateTracker tracker;
    private final RemoteIssueService remote;
    private final FieldMapper mapper;
    private final TreeReconciler reconciler;
    private final SyncAuditLog auditLog;

    public SyncEngine(
            RecordStore store,
            ChildReplacer replacer,
            SyncStateTracker tracker,
            RemoteIssueService remote,
            FieldMapper mapper,
            SyncAuditLog auditLog
    ) {
        this.store = store;
        this.replacer = replacer;
        this.tracker = tracker;
        this.remote = remote;
        this.mapper = mapper;
        this.reconciler = new TreeReconciler(store, replacer, mapper);
        this.auditLog = auditLog;
    }

    public SyncReport pullAll(Project project, ReconcileMode mode, PullPolicy policy, CancellationSignal cancel) {
        return pull(project, Arrays.asList(IssueKind.values()), mode, policy, cancel);
    }

    /**
     * Reconciles each kind scope in turn, then resolves link fields and execution rows of every
     * pulled issue so references across scopes resolve in the same run. A cancelled run records
     * no checkpoint and tombstones nothing in the scope it stopped in.
     */
    public SyncReport pull(
            Project project,
            List<IssueKind> kinds,
            ReconcileMode mode,
            PullPolicy policy,
            CancellationSignal cancel
    ) {
        requireRemoteProject(project);
        Tally tally = new Tally();
        List<ReconciliationResult.PulledIssue> pulled = new ArrayList<>();
        TreeReconciler.PayloadSource payloads = mode == ReconcileMode.FULL
                ? (kind, remoteKey, treeNode) -> remote.getIssue(kind, remoteKey)
                : TreeReconciler.PayloadSource.treeNodes();
        for (IssueKind kind : kinds) {
            if (cancel.isCancelled()) {
                tally.cancelled = true;
                break;
            }
            JsonNode tree;
            try {
                tree = remote.getTree(project.remoteId(), kind);
            } catch (RuntimeException e) {
                LOG.warn("Tree fetch for {} of {} failed: {}", kind.treeType(), project.projectKey(), e.getMessage());
                tally.failures.add(SyncFailure.of(kind.treeType(), "tree", e));
                continue;
            }
            ReconciliationResult result = reconciler.reconcile(project.id(), kind, tree, mode, policy, payloads, cancel);
            tally.add(result);
            pulled.addAll(result.pulled());
            if (result.cancelled()) {
                tally.cancelled = true;
                break;
            }
        }
        for (ReconciliationResult.PulledIssue issue : pulled) {
            applyOwnedRows(project.id(), issue, tally);
        }
        SyncCheckpoint checkpoint = null;
        if (!tally.cancelled) {
            CheckpointKind checkpointKind = mode == ReconcileMode.FULL ? CheckpointKind.FULL_TREE : CheckpointKind.TREE_STRUCTURE;
            checkpoint = tracker.markSynced(project.id(), checkpointKind);
        }
        SyncReport report = tally.toReport("pull", project.projectKey(), mode.name(), checkpoint);
        finish(report);
        return report;
    }

    /** Re-fetches one remote-bound issue and overwrites it with its owned rows. */
    public SyncReport pullIssue(long issueId) {
        Issue issue = store.findIssue(issueId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown issue: " + issueId));
        if (issue.localOnly()) {
            throw new IllegalArgumentException("Issue " + issueId + " has no remote identity to pull");
        }
        Project project = store.findProject(issue.projectId())
                .orElseThrow(() -> new IllegalStateException("Issue " + issueId + " belongs to no project"));
        Tally tally = new Tally();
        SyncCheckpoint checkpoint = null;
        String key = issue.remoteKey();
        try {
            MappedIssue mapped = mapper.toLocal(issue.kind(), remote.getIssue(issue.kind(), key));
            mapped.warnings().forEach(w -> tally.warnings.add(key + ": " + w));
            Long remoteId = mapped.remoteId() != null ? mapped.remoteId() : issue.remoteId();
            store.overwriteFromRemote(issueId, issue.folderId(), remoteId, mapped.fields(), mapped.details(),
                    Fingerprints.issueStructure(issue.folderId(), mapped.fields().summary()),
                    Fingerprints.content(mapped), Instant.now().toEpochMilli());
            if (issue.kind() == IssueKind.TEST_CASE
                    && !replaceOwned(issueId, key, "steps", ChildKind.STEPS, mapped.steps(), tally)) {
                store.invalidateContentFingerprint(issueId);
            }
            applyOwnedRows(project.id(), new ReconciliationResult.PulledIssue(issueId, key, mapped), tally);
            tally.updated++;
            checkpoint = tracker.markSynced(project.id(), CheckpointKind.SINGLE_ISSUE);
        } catch (RuntimeException e) {
            LOG.warn("Pull of {} failed: {}", key, e.getMessage());
            tally.failures.add(SyncFailure.of(key, "pull-issue", e));
        }
        SyncReport report = tally.toReport("pull-issue", project.projectKey(), CheckpointKind.SINGLE_ISSUE.name(), checkpoint);
        finish(report);
        return report;
    }

    /**
     * Pushes every dirty record: local-only records are created, remote-bound ones updated and
     * remote-bound tombstones deleted. A record leaves the dirty state only after the remote call
     * succeeded. Kinds go in declaration order so link targets get their keys first.
     */
    public SyncReport pushDirty(Project project, CancellationSignal cancel) {
        requireRemoteProject(project);
        Tally tally = new Tally();
        List<Issue> dirty = new ArrayList<>(store.listDirtyIssues(project.id()));
        dirty.sort(Comparator.comparing(Issue::kind).thenComparingLong(Issue::id));
        for (Issue issue : dirty) {
            if (cancel.isCancelled()) {
                tally.cancelled = true;
                break;
            }
            String label = issue.remoteBound() ? issue.remoteKey() : "local:" + issue.id();
            try {
                pushOne(project, issue, tally);
            } catch (RuntimeException e) {
                LOG.warn("Push of {} failed: {}", label, e.getMessage());
                tally.failures.add(SyncFailure.of(label, "push", e));
            }
        }
        SyncReport report = tally.toReport("push", project.projectKey(), "DIRTY", null);
        finish(report);
        return report;
    }

    private void pushOne(Project project, Issue issue, Tally tally) {
        if (issue.deleted()) {
            if (issue.remoteBound()) {
                try {
                    remote.deleteIssue(issue.kind(), issue.remoteKey());
                } catch (RemoteServiceException e) {
                    if (e.status() != 404) {
                        throw e;
                    }
                    LOG.info("{} was already gone remotely", issue.remoteKey());
                }
            }
            tracker.clearDirty(issue.id());
            tally.deleted++;
            return;
        }
        PushView view = pushView(project, issue, tally.warnings);
        ObjectNode payload = mapper.toRemote(issue.kind(), view.record());
        if (issue.localOnly()) {
            RemoteIssueService.CreatedIssue created = remote.createIssue(issue.kind(), payload);
            store.bindRemoteIdentity(issue.id(), created.remoteKey(), created.remoteId());
            tally.created++;
            LOG.info("Created {} {} from local issue {}", issue.kind(), created.remoteKey(), issue.id());
        } else {
            remote.updateIssue(issue.kind(), issue.remoteKey(), payload);
            tally.updated++;
        }
        view.expectedLinks().forEach((field, keys) -> store.saveLinkSnapshot(issue.id(), field.jsonField(), keys));
        tracker.clearDirty(issue.id());
    }

    /**
     * Builds the write view of an issue. A link field is sent as a full {@code set} only when
     * every key it held at the last pull is still accounted for locally; otherwise the local
     * changes go out as {@code add}/{@code remove} against that capture, so remote links the
     * mirror never resolved survive. A field that was never captured only gets {@code add}.
     */
    PushView pushView(Project project, Issue issue, List<String> warnings) {
        IssueKind kind = issue.kind();
        List<Step> steps = kind == IssueKind.TEST_CASE ? store.listSteps(issue.id()) : List.of();
        Map<LinkField, List<String>> keys = new EnumMap<>(LinkField.class);
        for (LinkField field : LinkField.values()) {
            if (field.ownerKind() == kind) {
                keys.put(field, new ArrayList<>());
            }
        }
        Set<LinkField> missingKeys = EnumSet.noneOf(LinkField.class);
        String label = issue.remoteBound() ? issue.remoteKey() : "local:" + issue.id();
        if (kind == IssueKind.TEST_PLAN) {
            for (PlanMember member : store.listPlanMembers(issue.id())) {
                Optional<String> key = store.findIssue(member.testCaseId()).map(Issue::remoteKey);
                if (key.isPresent()) {
                    keys.get(LinkField.INCLUDED_TEST_CASES).add(key.get());
                } else {
                    missingKeys.add(LinkField.INCLUDED_TEST_CASES);
                    warnings.add(label + ": included test case " + member.testCaseId() + " has no remote key yet");
                }
            }
        }
        for (RelationView relation : store.listRelations(issue.id())) {
            LinkField field = LinkField.forRelationKind(kind, relation.relationKind());
            if (field == null) {
                continue;
            }
            if (relation.dstRemoteKey() == null) {
                missingKeys.add(field);
                warnings.add(label + ": " + field.jsonField() + " target " + relation.dstIssueId() + " has no remote key yet");
                continue;
            }
            keys.get(field).add(relation.dstRemoteKey());
        }
        Map<String, List<String>> captured = store.linkSnapshots(issue.id());
        List<LinkUpdate> links = new ArrayList<>();
        Map<LinkField, List<String>> expected = new EnumMap<>(LinkField.class);
        keys.forEach((field, current) -> {
            List<String> before = captured.get(field.jsonField());
            if (before == null) {
                if (!current.isEmpty()) {
                    links.add(LinkUpdate.add(field, current));
                }
                return;
            }
            List<String> unresolved = unresolvedKeys(issue.projectId(), field, before);
            if (unresolved.isEmpty() && !missingKeys.contains(field)) {
                links.add(LinkUpdate.set(field, current));
                expected.put(field, current);
                return;
            }
            if (!unresolved.isEmpty()) {
                warnings.add(label + ": " + field.jsonField() + " keeps " + unresolved.size()
                        + " remote link(s) the mirror has not resolved");
            }
            List<String> added = new ArrayList<>(current);
            added.removeAll(before);
            List<String> removed = new ArrayList<>(before);
            removed.removeAll(unresolved);
            removed.removeAll(current);
            if (!added.isEmpty()) {
                links.add(LinkUpdate.add(field, added));
            }
            if (!removed.isEmpty()) {
                links.add(LinkUpdate.remove(field, removed));
            }
            List<String> after = new ArrayList<>(before);
            after.removeAll(removed);
            after.addAll(added);
            expected.put(field, after);
        });

        List<ExecutionRef> executions = new ArrayList<>();
        Optional<RecordStore.ExecutionMetaRow> metaRow = kind == IssueKind.TEST_EXECUTION
                ? store.findExecutionMeta(issue.id())
                : Optional.empty();
        metaRow.ifPresent(meta -> {
            for (RecordStore.ExecutionDetailRow row : store.listExecutionDetails(meta.rowId())) {
                ExecutionDetail d = row.detail();
                Optional<String> key = store.findIssue(d.testCaseId()).map(Issue::remoteKey);
                if (key.isEmpty()) {
                    warnings.add(label + ": executed test case " + d.testCaseId() + " has no remote key yet");
                    continue;
                }
                executions.add(new ExecutionRef(key.get(), d.orderNo(), d.assignee(), d.result(),
                        d.environment(), d.defects(), d.actualTime(), d.remoteExecutionKey()));
            }
        });
        String parentTestKey = store.folderRemoteId(issue.folderId()).orElse(null);
        LocalRecord record = new LocalRecord(issue, steps, links, executions, project.projectKey(), parentTestKey,
                metaRow.map(RecordStore.ExecutionMetaRow::meta).orElse(null));
        return new PushView(record, expected);
    }

    /** Captured keys that do not name a live local issue of the field's target kind. */
    private List<String> unresolvedKeys(long projectId, LinkField field, List<String> capturedKeys) {
        List<String> out = new ArrayList<>();
        for (String key : capturedKeys) {
            Optional<Issue> target = store.findIssueByRemoteKey(projectId, key);
            if (target.isEmpty() || target.get().deleted() || target.get().kind() != field.targetKind()) {
                out.add(key);
            }
        }
        return out;
    }

    /** Write payload source plus the link keys the remote should hold once the write succeeds. */
    record PushView(LocalRecord record, Map<LinkField, List<String>> expectedLinks) {
    }

    private void applyOwnedRows(long projectId, ReconciliationResult.PulledIssue pulled, Tally tally) {
        MappedIssue mapped = pulled.mapped();
        String key = pulled.remoteKey();
        List<Relation> relations = new ArrayList<>();
        Set<String> pulledRelationKinds = new HashSet<>();
        for (Map.Entry<LinkField, List<String>> entry : mapped.links().entrySet()) {
            LinkField field = entry.getKey();
            try {
                store.saveLinkSnapshot(pulled.issueId(), field.jsonField(), entry.getValue());
            } catch (RuntimeException e) {
                LOG.warn("Link snapshot of {} for {} was not stored: {}", field.jsonField(), key, e.getMessage());
                tally.failures.add(SyncFailure.of(key, "links", e));
            }
            List<Long> targets = resolveTargets(projectId, key, field, entry.getValue(), tally.warnings);
            if (field.storedAsPlanMembership()) {
                List<PlanMember> members = new ArrayList<>();
                for (int i = 0; i < targets.size(); i++) {
                    members.add(new PlanMember(targets.get(i), i));
                }
                replaceOwned(pulled.issueId(), key, "plan-members", ChildKind.PLAN_MEMBERS, members, tally);
            } else {
                pulledRelationKinds.add(field.relationKind());
                targets.forEach(target -> relations.add(new Relation(target, field.relationKind())));
            }
        }
        if (!pulledRelationKinds.isEmpty()) {
            // relation kinds the payload did not mention are kept as they are
            for (RelationView existing : store.listRelations(pulled.issueId())) {
                if (!pulledRelationKinds.contains(existing.relationKind())) {
                    relations.add(new Relation(existing.dstIssueId(), existing.relationKind(), existing.createdAtMs()));
                }
            }
            replaceOwned(pulled.issueId(), key, "relations", ChildKind.RELATIONS, relations, tally);
        }
        if (mapped.kind() == IssueKind.TEST_EXECUTION) {
            try {
                long executionRowId = store.upsertExecutionMeta(pulled.issueId(), mapped.executionMeta());
                Map<Long, ExecutionDetail> details = new LinkedHashMap<>();
                for (ExecutionRef ref : mapped.executions()) {
                    List<Long> testCase = resolveTargets(projectId, key, IssueKind.TEST_CASE, "testCaseExecutions",
                            List.of(ref.testCaseKey()), tally.warnings);
                    if (testCase.isEmpty()) {
                        continue;
                    }
                    details.putIfAbsent(testCase.get(0), new ExecutionDetail(testCase.get(0), ref.orderNo(),
                            ref.assignee(), ref.result(), ref.environment(), ref.defects(), ref.actualTime(),
                            ref.remoteExecutionKey()));
                }
                replaceOwned(executionRowId, key, "executions", ChildKind.EXECUTION_DETAILS,
                        new ArrayList<>(details.values()), tally);
            } catch (RuntimeException e) {
                LOG.warn("Execution rows of {} were not stored: {}", key, e.getMessage());
                tally.failures.add(SyncFailure.of(key, "executions", e));
            }
        }
    }

    private List<Long> resolveTargets(long projectId, String ownerKey, LinkField field, List<String> remoteKeys, List<String> warnings) {
        return resolveTargets(projectId, ownerKey, field.targetKind(), field.jsonField(), remoteKeys, warnings);
    }

    private List<Long> resolveTargets(
            long projectId,
            String ownerKey,
            IssueKind targetKind,
            String fieldName,
            List<String> remoteKeys,
            List<String> warnings
    ) {
        Set<Long> out = new LinkedHashSet<>();
        for (String remoteKey : remoteKeys) {
            if (remoteKey == null || remoteKey.isBlank()) {
                continue;
            }
            Optional<Issue> target = store.findIssueByRemoteKey(projectId, remoteKey);
            if (target.isEmpty() || target.get().deleted()) {
                warnings.add(ownerKey + ": " + fieldName + " refers to unknown issue " + remoteKey);
            } else if (target.get().kind() != targetKind) {
                warnings.add(ownerKey + ": " + fieldName + " refers to " + remoteKey + ", a "
                        + target.get().kind() + " instead of a " + targetKind);
            } else {
                out.add(target.get().id());
            }
        }
        return new ArrayList<>(out);
    }

    private <R> boolean replaceOwned(long ownerId, String key, String stage, ChildKind<R> kind, List<R> rows, Tally tally) {
        try {
            replacer.replaceChildren(ownerId, kind, rows);
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Replacing {} of {} failed: {}", kind.name(), key, e.getMessage());
            tally.failures.add(SyncFailure.of(key, stage, e));
            return false;
        }
    }

    private static void requireRemoteProject(Project project) {
        if (project == null) {
            throw new IllegalArgumentException("project must not be null");
        }
        if (project.localOnly()) {
            throw new IllegalArgumentException("Project " + project.projectKey() + " is local-only and cannot sync");
        }
    }

    private void finish(SyncReport report) {
        LOG.info("{} {} finished: created={} updated={} tombstoned={} deleted={} unchanged={} skippedDirty={} failed={}{}",
                report.operation(), report.projectKey(), report.created(), report.updated(), report.tombstoned(),
                report.deleted(), report.unchanged(), report.skippedDirty(), report.failed(),
                report.cancelled() ? " (cancelled)" : "");
        if (auditLog == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mode", report.mode());
        details.put("created", report.created());
        details.put("updated", report.updated());
        details.put("tombstoned", report.tombstoned());
        details.put("deleted", report.deleted());
        details.put("unchanged", report.unchanged());
        details.put("skipped_dirty", report.skippedDirty());
        details.put("failed", report.failed());
        details.put("warnings", report.warnings().size());
        auditLog.log(SyncAuditLog.AuditEvent.of(
                "sync." + report.operation().replace('-', '_'),
                report.projectKey(),
                "project/" + report.projectKey(),
                report.resultLabel(),
                details
        ));
        for (SyncFailure failure : report.failures()) {
            auditLog.log(SyncAuditLog.AuditEvent.of(
                    "sync.failure",
                    report.projectKey(),
                    "issue/" + failure.remoteKey(),
                    "failed",
                    Map.of("stage", failure.stage(), "message", failure.message())
            ));
        }
    }

    private static final class Tally {
        private final List<SyncFailure> failures = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private int created;
        private int updated;
        private int tombstoned;
        private int deleted;
        private int unchanged;
        private int skippedDirty;
        private boolean cancelled;

        private void add(ReconciliationResult result) {
            created += result.created();
            updated += result.updated();
            tombstoned += result.tombstoned();
            unchanged += result.unchanged();
            skippedDirty += result.skippedDirty();
            failures.addAll(result.failures());
            warnings.addAll(result.warnings());
        }

        private SyncReport toReport(String operation, String projectKey, String mode, SyncCheckpoint checkpoint) {
            return new SyncReport(operation, projectKey, mode, created, updated, tombstoned, deleted, unchanged,
                    skippedDirty, failures.size(), failures, warnings, cancelled, checkpoint);
        }
    }
}
