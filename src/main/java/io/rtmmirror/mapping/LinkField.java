package io.rtmmirror.mapping;

import io.rtmmirror.model.IssueKind;

/**
 * Link-bearing remote fields, the issue kind that owns each of them and the relation kind tag
 * the link is stored under locally.
 */
public enum LinkField {
    TEST_CASES_COVERED("testCasesCovered", IssueKind.REQUIREMENT, IssueKind.TEST_CASE, "covers"),
    COVERED_REQUIREMENTS("coveredRequirements", IssueKind.TEST_CASE, IssueKind.REQUIREMENT, "covered-by"),
    INCLUDED_TEST_CASES("includedTestCases", IssueKind.TEST_PLAN, IssueKind.TEST_CASE, "includes"),
    EXECUTIONS("executions", IssueKind.TEST_PLAN, IssueKind.TEST_EXECUTION, "executed-by"),
    IDENTIFYING_TEST_CASES("identifyingTestCases", IssueKind.DEFECT, IssueKind.TEST_CASE, "identified-by"),
    DETECTING_EXECUTIONS("detectingExecutions", IssueKind.DEFECT, IssueKind.TEST_EXECUTION, "detected-by");

    private final String jsonField;
    private final IssueKind ownerKind;
    private final IssueKind targetKind;
    private final String relationKind;

    LinkField(String jsonField, IssueKind ownerKind, IssueKind targetKind, String relationKind) {
        this.jsonField = jsonField;
        this.ownerKind = ownerKind;
        this.targetKind = targetKind;
        this.relationKind = relationKind;
    }

    public String jsonField() {
        return jsonField;
    }

    public IssueKind ownerKind() {
        return ownerKind;
    }

    public IssueKind targetKind() {
        return targetKind;
    }

    public String relationKind() {
        return relationKind;
    }

    /** Included test cases are stored as ordered plan membership, not as relations. */
    public boolean storedAsPlanMembership() {
        return this == INCLUDED_TEST_CASES;
    }

    public static LinkField forRelationKind(IssueKind ownerKind, String relationKind) {
        for (LinkField field : values()) {
            if (field.ownerKind == ownerKind && field.relationKind.equals(relationKind)) {
                return field;
            }
        }
        return null;
    }
}
