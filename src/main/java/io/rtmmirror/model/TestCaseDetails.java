package io.rtmmirror.model;

public record TestCaseDetails(String preconditions) implements KindDetails {
    public TestCaseDetails {
        preconditions = preconditions == null ? "" : preconditions;
    }

    @Override
    public IssueKind kind() {
        return IssueKind.TEST_CASE;
    }
}
