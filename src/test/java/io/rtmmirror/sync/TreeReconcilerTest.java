package io.rtmmirror.sync;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rtmmirror.config.RtmMirrorConfig;
import io.rtmmirror.mapping.FieldMapper;
import io.rtmmirror.model.Folder;
import io.rtmmirror.model.Issue;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.model.Project;
import io.rtmmirror.model.Step;
import io.rtmmirror.remote.RemoteServiceException;
import io.rtmmirror.storage.ChildReplacer;
import io.rtmmirror.storage.Database;
import io.rtmmirror.storage.RecordStore;
import io.rtmmirror.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class TreeReconcilerTest {

    @Test
    void emptyStoreGetsFolderAndRequirementFromRemoteTree() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-reconcile-create-");
        try {
            Fixture f = new Fixture(root);
            ArrayNode tree = Jsons.mapper().createArrayNode();
            folder(tree, "10", "F1").add(issueNode("R-1", 1001L, "Login works"));

            ReconciliationResult result = f.reconciler.reconcile(f.project.id(), IssueKind.REQUIREMENT, tree);

            Assertions.assertEquals(2, result.created());
            Assertions.assertEquals(0, result.failed());
            List<Folder> folders = f.store.listFolders(f.project.id(), IssueKind.REQUIREMENT);
            Assertions.assertEquals(1, folders.size());
            Assertions.assertEquals("F1", folders.get(0).name());
            Assertions.assertTrue(folders.get(0).remoteBound());

            Issue issue = f.store.findRemoteIssue(f.project.id(), IssueKind.REQUIREMENT, "R-1").orElseThrow().issue();
            Assertions.assertEquals("R-1", issue.remoteKey());
            Assertions.assertEquals(1001L, issue.remoteId());
            Assertions.assertEquals("Login works", issue.fields().summary());
            Assertions.assertEquals(folders.get(0).id(), issue.folderId());
            Assertions.assertFalse(issue.dirty());
            Assertions.assertNotNull(issue.lastSyncAt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void secondRunAgainstUnchangedTreeChangesNothing() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-reconcile-idempotent-");
        try {
            Fixture f = new Fixture(root);
            ArrayNode tree = Jsons.mapper().createArrayNode();
            ArrayNode children = folder(tree, "10", "F1");
            children.add(issueNode("TC-1", 1L, "Open login page"));
            folder(children, "11", "Nested").add(issueNode("TC-2", 2L, "Submit form"));
            tree.add(issueNode("TC-3", 3L, "At root"));

            ReconciliationResult first = f.reconciler.reconcile(f.project.id(), IssueKind.TEST_CASE, tree);
            ReconciliationResult second = f.reconciler.reconcile(f.project.id(), IssueKind.TEST_CASE, tree);

            Assertions.assertEquals(5, first.created());
            Assertions.assertEquals(0, second.created());
            Assertions.assertEquals(0, second.updated());
            Assertions.assertEquals(0, second.tombstoned());
            Assertions.assertEquals(5, second.unchanged());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void recordsMissingFromRemoteAreTombstonedAndRevivedWhenTheyReturn() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-reconcile-tombstone-");
        try {
            Fixture f = new Fixture(root);
            ArrayNode full = Jsons.mapper().createArrayNode();
            ArrayNode children = folder(full, "10", "F1");
            children.add(issueNode("R-1", 1L, "Kept"));
            children.add(issueNode("R-2", 2L, "Removed remotely"));
            f.reconciler.reconcile(f.project.id(), IssueKind.REQUIREMENT, full);

            ArrayNode reduced = Jsons.mapper().createArrayNode();
            folder(reduced, "10", "F1").add(issueNode("R-1", 1L, "Kept"));
            ReconciliationResult result = f.reconciler.reconcile(f.project.id(), IssueKind.REQUIREMENT, reduced);

            Assertions.assertEquals(1, result.tombstoned());
            Issue removed = f.store.findRemoteIssue(f.project.id(), IssueKind.REQUIREMENT, "R-2").orElseThrow().issue();
            Assertions.assertTrue(removed.deleted());
            Assertions.assertEquals("Removed remotely", removed.fields().summary());
            Assertions.assertEquals(1, f.store.listIssues(f.project.id(), IssueKind.REQUIREMENT, false).size());
            Assertions.assertEquals(2, f.store.listIssues(f.project.id(), IssueKind.REQUIREMENT, true).size());

            ReconciliationResult revived = f.reconciler.reconcile(f.project.id(), IssueKind.REQUIREMENT, full);
            Assertions.assertEquals(1, revived.updated());
            Assertions.assertEquals(removed.id(),
                    f.store.findRemoteIssue(f.project.id(), IssueKind.REQUIREMENT, "R-2").orElseThrow().issue().id());
            Assertions.assertFalse(f.store.findIssue(removed.id()).orElseThrow().deleted());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void renamedRemoteNodeWithSameKeyIsAnUpdateInPlace() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-reconcile-rename-");
        try {
            Fixture f = new Fixture(root);
            ArrayNode before = Jsons.mapper().createArrayNode();
            before.add(issueNode("D-1", 1L, "Crash on save"));
            f.reconciler.reconcile(f.project.id(), IssueKind.DEFECT, before);
            long id = f.store.findRemoteIssue(f.project.id(), IssueKind.DEFECT, "D-1").orElseThrow().issue().id();

            ArrayNode after = Jsons.mapper().createArrayNode();
            after.add(issueNode("D-1", 1L, "Crash on save as"));
            ReconciliationResult result = f.reconciler.reconcile(f.project.id(), IssueKind.DEFECT, after);

            Assertions.assertEquals(1, result.updated());
            Assertions.assertEquals(0, result.created());
            Issue issue = f.store.findIssue(id).orElseThrow();
            Assertions.assertEquals("Crash on save as", issue.fields().summary());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pullOverwritesDirtyRecordAndClearsDirty() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-reconcile-lww-");
        try {
            Fixture f = new Fixture(root);
            ArrayNode tree = Jsons.mapper().createArrayNode();
            tree.add(issueNode("T-1", 1L, "Original step"));
            f.reconciler.reconcile(f.project.id(), IssueKind.TEST_CASE, tree);
            Issue issue = f.store.findRemoteIssue(f.project.id(), IssueKind.TEST_CASE, "T-1").orElseThrow().issue();
            f.store.updateIssueFields(issue.id(), issue.fields().withSummary("Updated step"));
            Assertions.assertTrue(f.store.findIssue(issue.id()).orElseThrow().dirty());

            ReconciliationResult result = f.reconciler.reconcile(f.project.id(), IssueKind.TEST_CASE, tree);

            Assertions.assertEquals(1, result.updated());
            Issue after = f.store.findIssue(issue.id()).orElseThrow();
            Assertions.assertEquals("Original step", after.fields().summary());
            Assertions.assertFalse(after.dirty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void skipDirtyPolicyLeavesLocalEditsAlone() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-reconcile-skip-dirty-");
        try {
            Fixture f = new Fixture(root);
            ArrayNode tree = Jsons.mapper().createArrayNode();
            tree.add(issueNode("T-1", 1L, "Original step"));
            f.reconciler.reconcile(f.project.id(), IssueKind.TEST_CASE, tree);
            Issue issue = f.store.findRemoteIssue(f.project.id(), IssueKind.TEST_CASE, "T-1").orElseThrow().issue();
            f.store.updateIssueFields(issue.id(), issue.fields().withSummary("Updated step"));

            ReconciliationResult result = f.reconciler.reconcile(f.project.id(), IssueKind.TEST_CASE, tree,
                    ReconcileMode.FULL, PullPolicy.SKIP_DIRTY, TreeReconciler.PayloadSource.treeNodes(),
                    CancellationSignal.none());

            Assertions.assertEquals(1, result.skippedDirty());
            Assertions.assertEquals(0, result.tombstoned());
            Issue after = f.store.findIssue(issue.id()).orElseThrow();
            Assertions.assertEquals("Updated step", after.fields().summary());
            Assertions.assertTrue(after.dirty());
            Assertions.assertFalse(after.deleted());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void structureOnlyPullMovesRecordsButKeepsContentAndDirtyFlag() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-reconcile-structure-");
        try {
            Fixture f = new Fixture(root);
            ArrayNode tree = Jsons.mapper().createArrayNode();
            ObjectNode node = issueNode("R-1", 1L, "Login works");
            node.put("description", "Remote description");
            folder(tree, "10", "F1").add(node);
            folder(tree, "20", "F2");
            f.reconciler.reconcile(f.project.id(), IssueKind.REQUIREMENT, tree);
            Issue issue = f.store.findRemoteIssue(f.project.id(), IssueKind.REQUIREMENT, "R-1").orElseThrow().issue();
            f.store.updateIssueFields(issue.id(), issue.fields().withDescription("Local description"));

            ArrayNode moved = Jsons.mapper().createArrayNode();
            folder(moved, "10", "F1");
            ObjectNode light = Jsons.mapper().createObjectNode();
            light.put("type", "REQUIREMENT");
            light.put("jiraKey", "R-1");
            light.put("jiraId", 1L);
            light.put("name", "Login works remotely");
            folder(moved, "20", "F2").add(light);
            ReconciliationResult result = f.reconciler.reconcile(f.project.id(), IssueKind.REQUIREMENT, moved,
                    ReconcileMode.STRUCTURE_ONLY, PullPolicy.OVERWRITE, TreeReconciler.PayloadSource.treeNodes(),
                    CancellationSignal.none());

            Assertions.assertEquals(1, result.updated());
            Issue after = f.store.findIssue(issue.id()).orElseThrow();
            String f2 = f.store.findRemoteFolder(f.project.id(), IssueKind.REQUIREMENT, "20").orElseThrow().folder().id();
            Assertions.assertEquals(f2, after.folderId());
            Assertions.assertEquals("Local description", after.fields().description());
            Assertions.assertEquals("Login works", after.fields().summary());
            Assertions.assertTrue(after.dirty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void duplicateRemoteIdentityFailsThatNodeOnlyAndSiblingsContinue() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-reconcile-conflict-");
        try {
            Fixture f = new Fixture(root);
            ArrayNode tree = Jsons.mapper().createArrayNode();
            folder(tree, "10", "A").add(issueNode("R-1", 1L, "First claim"));
            ArrayNode b = folder(tree, "11", "B");
            b.add(issueNode("R-1", 1L, "Second claim"));
            b.add(issueNode("R-3", 3L, "Sibling"));
            folder(tree, "10", "A again").add(issueNode("R-9", 9L, "Under duplicate folder"));

            ReconciliationResult result = f.reconciler.reconcile(f.project.id(), IssueKind.REQUIREMENT, tree);

            Assertions.assertEquals(2, result.failed());
            Assertions.assertTrue(result.failures().stream().allMatch(x -> x.stage().equals("identity")));
            Assertions.assertTrue(result.failures().stream().anyMatch(x -> x.remoteKey().equals("R-1")));
            Assertions.assertTrue(result.failures().stream().anyMatch(x -> x.remoteKey().equals("folder:10")));
            Issue first = f.store.findRemoteIssue(f.project.id(), IssueKind.REQUIREMENT, "R-1").orElseThrow().issue();
            Assertions.assertEquals("First claim", first.fields().summary());
            Assertions.assertTrue(f.store.findRemoteIssue(f.project.id(), IssueKind.REQUIREMENT, "R-3").isPresent());
            Assertions.assertTrue(f.store.findRemoteIssue(f.project.id(), IssueKind.REQUIREMENT, "R-9").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingNodeIsReportedWithoutTombstoningItsLocalRecord() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-reconcile-isolation-");
        try {
            Fixture f = new Fixture(root);
            ArrayNode tree = Jsons.mapper().createArrayNode();
            tree.add(issueNode("R-1", 1L, "One"));
            tree.add(issueNode("R-2", 2L, "Two"));
            tree.add(issueNode("R-3", 3L, "Three"));
            f.reconciler.reconcile(f.project.id(), IssueKind.REQUIREMENT, tree);
            ((ObjectNode) tree.get(0)).put("summary", "One changed");
            ((ObjectNode) tree.get(2)).put("summary", "Three changed");

            TreeReconciler.PayloadSource flaky = (kind, key, node) -> {
                if (key.equals("R-2")) {
                    throw new RemoteServiceException(key, 502, "GET R-2 failed status=502");
                }
                return node;
            };
            ReconciliationResult result = f.reconciler.reconcile(f.project.id(), IssueKind.REQUIREMENT, tree,
                    ReconcileMode.FULL, PullPolicy.OVERWRITE, flaky, CancellationSignal.none());

            Assertions.assertEquals(1, result.failed());
            Assertions.assertEquals("R-2", result.failures().get(0).remoteKey());
            Assertions.assertEquals(2, result.updated());
            Assertions.assertEquals(0, result.tombstoned());
            Assertions.assertFalse(f.store.findRemoteIssue(f.project.id(), IssueKind.REQUIREMENT, "R-2")
                    .orElseThrow().issue().deleted());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancellationStopsBetweenTopLevelNodesAndSkipsTombstoning() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-reconcile-cancel-");
        try {
            Fixture f = new Fixture(root);
            ArrayNode initial = Jsons.mapper().createArrayNode();
            folder(initial, "10", "A").add(issueNode("R-1", 1L, "One"));
            folder(initial, "20", "B").add(issueNode("R-2", 2L, "Two"));
            initial.add(issueNode("R-3", 3L, "Gone next time"));
            f.reconciler.reconcile(f.project.id(), IssueKind.REQUIREMENT, initial);

            ArrayNode next = Jsons.mapper().createArrayNode();
            ArrayNode a = folder(next, "10", "A");
            a.add(issueNode("R-1", 1L, "One changed"));
            a.add(issueNode("R-4", 4L, "New in A"));
            folder(next, "20", "B").add(issueNode("R-2", 2L, "Two changed"));

            CancellationSignal cancel = new CancellationSignal();
            TreeReconciler.PayloadSource cancelling = (kind, key, node) -> {
                cancel.cancel();
                return node;
            };
            ReconciliationResult result = f.reconciler.reconcile(f.project.id(), IssueKind.REQUIREMENT, next,
                    ReconcileMode.FULL, PullPolicy.OVERWRITE, cancelling, cancel);

            Assertions.assertTrue(result.cancelled());
            Assertions.assertEquals(0, result.tombstoned());
            Assertions.assertEquals("One changed", summaryOf(f, "R-1"));
            Assertions.assertTrue(f.store.findRemoteIssue(f.project.id(), IssueKind.REQUIREMENT, "R-4").isPresent());
            Assertions.assertEquals("Two", summaryOf(f, "R-2"));
            Assertions.assertFalse(f.store.findRemoteIssue(f.project.id(), IssueKind.REQUIREMENT, "R-3")
                    .orElseThrow().issue().deleted());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void testCaseStepsAreReplacedFromStepGroups() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-reconcile-steps-");
        try {
            Fixture f = new Fixture(root);
            ObjectNode tc = issueNode("TC-1", 1L, "Login");
            ObjectNode group = tc.putArray("stepGroups").addObject();
            ArrayNode steps = group.putArray("steps");
            addStep(steps, "<p>Open <b>login</b> page</p>", "", "Page shown");
            addStep(steps, "Enter credentials", "user/pass", "<p>Logged in</p>");
            ArrayNode tree = Jsons.mapper().createArrayNode();
            tree.add(tc);

            f.reconciler.reconcile(f.project.id(), IssueKind.TEST_CASE, tree);

            long id = f.store.findRemoteIssue(f.project.id(), IssueKind.TEST_CASE, "TC-1").orElseThrow().issue().id();
            List<Step> stored = f.store.listSteps(id);
            Assertions.assertEquals(2, stored.size());
            Assertions.assertEquals("Open login page", stored.get(0).action());
            Assertions.assertEquals(1, stored.get(0).groupNo());
            Assertions.assertEquals(2, stored.get(1).orderNo());
            Assertions.assertEquals("Logged in", stored.get(1).expected());
            Assertions.assertNotNull(stored.get(0).stepUid());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void wrappedRootsAreAccepted() {
        ObjectNode wrapped = Jsons.mapper().createObjectNode();
        ArrayNode roots = wrapped.putArray("roots");
        roots.add(issueNode("R-1", 1L, "a"));
        roots.add(issueNode("R-2", 2L, "b"));
        Assertions.assertEquals(2, TreeReconciler.rootNodes(wrapped).size());
        Assertions.assertEquals(0, TreeReconciler.rootNodes(null).size());

        ObjectNode single = Jsons.mapper().createObjectNode();
        single.put("type", "FOLDER");
        single.put("id", "1");
        single.putArray("children");
        Assertions.assertEquals(1, TreeReconciler.rootNodes(single).size());
    }

    private static String summaryOf(Fixture f, String key) {
        return f.store.findRemoteIssue(f.project.id(), IssueKind.REQUIREMENT, key).orElseThrow().issue().fields().summary();
    }

    private static ArrayNode folder(ArrayNode parent, String id, String name) {
        ObjectNode node = parent.addObject();
        node.put("type", "FOLDER");
        node.put("id", id);
        node.put("name", name);
        return node.putArray("children");
    }

    private static ObjectNode issueNode(String key, Long id, String summary) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("testKey", key);
        node.put("issueId", id);
        node.put("summary", summary);
        return node;
    }

    private static void addStep(ArrayNode steps, String action, String input, String expected) {
        ArrayNode columns = steps.addObject().putArray("stepColumns");
        columns.addObject().put("name", "Action").put("value", action);
        columns.addObject().put("name", "Input").put("value", input);
        columns.addObject().put("name", "Expected").put("value", expected);
    }

    private static final class Fixture {
        private final RecordStore store;
        private final TreeReconciler reconciler;
        private final Project project;

        private Fixture(Path root) {
            Database db = new Database(RtmMirrorConfig.fromRoot(root.toString()));
            db.init();
            this.store = new RecordStore(db);
            this.reconciler = new TreeReconciler(store, new ChildReplacer(db), new FieldMapper());
            this.project = store.getOrCreateProject("RTM", 10100L, "RTM demo", "https://jira.example.test");
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
