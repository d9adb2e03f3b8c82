package io.rtmmirror.model;

// Test plans carry no scalar fields of their own; membership lives in plan member rows.
public record TestPlanDetails() implements KindDetails {
    @Override
    public IssueKind kind() {
        return IssueKind.TEST_PLAN;
    }
}
