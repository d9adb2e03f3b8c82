package io.rtmmirror.model;

public record TestExecutionDetails(String testPlanKey, String result, String executeTransition) implements KindDetails {
    public TestExecutionDetails {
        testPlanKey = testPlanKey == null ? "" : testPlanKey;
        result = result == null ? "" : result;
        executeTransition = executeTransition == null ? "" : executeTransition;
    }

    @Override
    public IssueKind kind() {
        return IssueKind.TEST_EXECUTION;
    }
}
