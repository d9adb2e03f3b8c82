package io.rtmmirror.model;

/**
 * Kind-specific payload of an {@link Issue}. Each issue kind has exactly one implementation,
 * so a field that only makes sense for one kind cannot be attached to another.
 */
public interface KindDetails {
    IssueKind kind();

    static KindDetails emptyFor(IssueKind kind) {
        return switch (kind) {
            case REQUIREMENT -> new RequirementDetails("", null);
            case TEST_CASE -> new TestCaseDetails("");
            case TEST_PLAN -> new TestPlanDetails();
            case TEST_EXECUTION -> new TestExecutionDetails("", "", "");
            case DEFECT -> new DefectDetails(null);
        };
    }
}
