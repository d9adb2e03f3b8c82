package io.rtmmirror.storage;

import io.rtmmirror.config.RtmMirrorConfig;
import io.rtmmirror.model.ExecutionDetail;
import io.rtmmirror.model.ExecutionMeta;
import io.rtmmirror.model.IssueFields;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.model.PlanMember;
import io.rtmmirror.model.Project;
import io.rtmmirror.model.Relation;
import io.rtmmirror.model.Step;
import io.rtmmirror.model.StepExecution;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class ChildReplacerTest {

    @Test
    void planMembershipIsReplacedWholesaleInTheNewOrder() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-replace-plan-");
        try {
            Fixture f = new Fixture(root);
            long plan = f.issue(IssueKind.TEST_PLAN, "P-1");
            long tc1 = f.issue(IssueKind.TEST_CASE, "TC-1");
            long tc2 = f.issue(IssueKind.TEST_CASE, "TC-2");
            long tc3 = f.issue(IssueKind.TEST_CASE, "TC-3");
            f.replacer.replaceChildren(plan, ChildKind.PLAN_MEMBERS, List.of(new PlanMember(tc1, 0), new PlanMember(tc2, 1)));

            ChildReplacer.ReplaceResult result = f.replacer.replaceChildren(plan, ChildKind.PLAN_MEMBERS,
                    List.of(new PlanMember(tc2, 0), new PlanMember(tc3, 1)));

            Assertions.assertEquals(2, result.removedCount());
            Assertions.assertEquals(2, result.insertedCount());
            Assertions.assertEquals(List.of(new PlanMember(tc2, 0), new PlanMember(tc3, 1)), f.store.listPlanMembers(plan));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void emptyListClearsTheCollection() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-replace-empty-");
        try {
            Fixture f = new Fixture(root);
            long requirement = f.issue(IssueKind.REQUIREMENT, "R-1");
            long tc = f.issue(IssueKind.TEST_CASE, "TC-1");
            f.replacer.replaceChildren(requirement, ChildKind.RELATIONS, List.of(new Relation(tc, "covers")));

            ChildReplacer.ReplaceResult result = f.replacer.replaceChildren(requirement, ChildKind.RELATIONS, List.of());

            Assertions.assertEquals(1, result.removedCount());
            Assertions.assertEquals(0, result.insertedCount());
            Assertions.assertTrue(f.store.listRelations(requirement).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void duplicatePositionRollsBackAndNamesTheOffendingRow() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-replace-rollback-");
        try {
            Fixture f = new Fixture(root);
            long tc = f.issue(IssueKind.TEST_CASE, "TC-1");
            f.replacer.replaceChildren(tc, ChildKind.STEPS, List.of(new Step(1, 1, "Open app", "", "App opens")));
            List<Step> before = f.store.listSteps(tc);

            ReplaceChildrenException error = Assertions.assertThrows(ReplaceChildrenException.class,
                    () -> f.replacer.replaceChildren(tc, ChildKind.STEPS, List.of(
                            new Step(1, 1, "Open app", "", "App opens"),
                            new Step(1, 2, "Log in", "alice", "Dashboard"),
                            new Step(1, 2, "Log out", "", "Login page"))));

            Assertions.assertEquals(tc, error.ownerId());
            Assertions.assertEquals("steps", error.childKind());
            Assertions.assertEquals(2, error.rowIndex());
            Assertions.assertEquals("Log out", ((Step) error.row()).action());
            Assertions.assertEquals(before, f.store.listSteps(tc));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void replacingWithTheSameRowsLeavesTheSameState() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-replace-idempotent-");
        try {
            Fixture f = new Fixture(root);
            long tc = f.issue(IssueKind.TEST_CASE, "TC-1");
            List<Step> steps = List.of(new Step(1, 1, "Open app", "", "App opens"), new Step(1, 2, "Log in", "alice", "Dashboard"));
            f.replacer.replaceChildren(tc, ChildKind.STEPS, steps);
            List<Step> first = f.store.listSteps(tc);

            f.replacer.replaceChildren(tc, ChildKind.STEPS, steps);

            Assertions.assertEquals(first, f.store.listSteps(tc));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unchangedStepKeepsItsUidWhenMoved() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-replace-step-uid-");
        try {
            Fixture f = new Fixture(root);
            long tc = f.issue(IssueKind.TEST_CASE, "TC-1");
            f.replacer.replaceChildren(tc, ChildKind.STEPS, List.of(
                    new Step(1, 1, "Open app", "", "App opens"),
                    new Step(1, 2, "Log in", "alice", "Dashboard")));
            String loginUid = f.store.listSteps(tc).get(1).stepUid();
            Assertions.assertNotNull(loginUid);

            f.replacer.replaceChildren(tc, ChildKind.STEPS, List.of(
                    new Step(1, 1, "Log in", "alice", "Dashboard"),
                    new Step(1, 2, "Check banner", "", "Banner shown")));

            List<Step> after = f.store.listSteps(tc);
            Assertions.assertEquals(loginUid, after.get(0).stepUid());
            Assertions.assertNotEquals(loginUid, after.get(1).stepUid());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingOrWrongOwnerIsRejectedBeforeAnyWrite() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-replace-owner-");
        try {
            Fixture f = new Fixture(root);
            long requirement = f.issue(IssueKind.REQUIREMENT, "R-1");

            ReplaceChildrenException missing = Assertions.assertThrows(ReplaceChildrenException.class,
                    () -> f.replacer.replaceChildren(999_999L, ChildKind.PLAN_MEMBERS, List.of()));
            Assertions.assertEquals(-1, missing.rowIndex());

            ReplaceChildrenException wrongKind = Assertions.assertThrows(ReplaceChildrenException.class,
                    () -> f.replacer.replaceChildren(requirement, ChildKind.STEPS, List.of(new Step(1, 1, "a", "", ""))));
            Assertions.assertEquals(-1, wrongKind.rowIndex());
            Assertions.assertTrue(f.store.listSteps(requirement).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stepExecutionsSurviveReplacementOfExecutionRows() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-replace-step-exec-");
        try {
            Fixture f = new Fixture(root);
            long tc = f.issue(IssueKind.TEST_CASE, "TC-1");
            long te = f.issue(IssueKind.TEST_EXECUTION, "TE-1");
            f.replacer.replaceChildren(tc, ChildKind.STEPS, List.of(new Step(1, 1, "Open app", "", "App opens")));
            long executionRow = f.store.upsertExecutionMeta(te, ExecutionMeta.empty());
            f.replacer.replaceChildren(executionRow, ChildKind.EXECUTION_DETAILS,
                    List.of(new ExecutionDetail(tc, 0, "alice", "NOT_RUN", "", "", null, "")));
            long detailRow = f.store.listExecutionDetails(executionRow).get(0).rowId();
            f.replacer.replaceChildren(detailRow, ChildKind.STEP_EXECUTIONS,
                    List.of(new StepExecution(1, 1, null, "PASS", "opened", "")));
            String stepUid = f.store.listSteps(tc).get(0).stepUid();
            Assertions.assertEquals(stepUid, f.store.listStepExecutions(detailRow).get(0).stepUid());

            f.replacer.replaceChildren(executionRow, ChildKind.EXECUTION_DETAILS,
                    List.of(new ExecutionDetail(tc, 0, "alice", "PASS", "", "", 42L, "")));

            RecordStore.ExecutionDetailRow replaced = f.store.listExecutionDetails(executionRow).get(0);
            Assertions.assertEquals("PASS", replaced.detail().result());
            List<StepExecution> history = f.store.listStepExecutions(replaced.rowId());
            Assertions.assertEquals(1, history.size());
            Assertions.assertEquals("PASS", history.get(0).status());
            Assertions.assertEquals(stepUid, history.get(0).stepUid());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedStepLeavesItsExecutionHistoryMisaligned() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-replace-misaligned-");
        try {
            Fixture f = new Fixture(root);
            long tc = f.issue(IssueKind.TEST_CASE, "TC-1");
            long te = f.issue(IssueKind.TEST_EXECUTION, "TE-1");
            f.replacer.replaceChildren(tc, ChildKind.STEPS, List.of(new Step(1, 1, "Open app", "", "App opens")));
            long executionRow = f.store.upsertExecutionMeta(te, ExecutionMeta.empty());
            f.replacer.replaceChildren(executionRow, ChildKind.EXECUTION_DETAILS,
                    List.of(new ExecutionDetail(tc, 0, "", "PASS", "", "", null, "")));
            long detailRow = f.store.listExecutionDetails(executionRow).get(0).rowId();
            f.replacer.replaceChildren(detailRow, ChildKind.STEP_EXECUTIONS,
                    List.of(new StepExecution(1, 1, null, "PASS", "", "")));
            Assertions.assertTrue(f.store.listMisalignedStepExecutions(tc).isEmpty());

            f.replacer.replaceChildren(tc, ChildKind.STEPS, List.of(new Step(1, 1, "Launch app from dock", "", "App opens")));

            List<RecordStore.MisalignedStepExecution> misaligned = f.store.listMisalignedStepExecutions(tc);
            Assertions.assertEquals(1, misaligned.size());
            Assertions.assertEquals(detailRow, misaligned.get(0).executionRowId());
            Assertions.assertEquals("PASS", misaligned.get(0).status());
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class Fixture {
        private final RecordStore store;
        private final ChildReplacer replacer;
        private final Project project;

        private Fixture(Path root) {
            Database db = new Database(RtmMirrorConfig.fromRoot(root.toString()));
            db.init();
            this.store = new RecordStore(db);
            this.replacer = new ChildReplacer(db);
            this.project = store.getOrCreateProject("RTM", 10100L, "RTM demo", "");
        }

        private long issue(IssueKind kind, String key) {
            return store.insertRemoteIssue(project.id(), kind, null, key, null, IssueFields.ofSummary(key), null,
                    null, null, 0L);
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
