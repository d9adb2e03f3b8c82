package io.rtmmirror.mapping;

/**
 * A test case execution row as the remote service describes it, keyed by the test case's remote
 * key. It becomes an {@link io.rtmmirror.model.ExecutionDetail} once the key is resolved.
 */
public record ExecutionRef(
        String testCaseKey,
        int orderNo,
        String assignee,
        String result,
        String environment,
        String defects,
        Long actualTime,
        String remoteExecutionKey
) {
    public ExecutionRef {
        testCaseKey = testCaseKey == null ? "" : testCaseKey;
        assignee = assignee == null ? "" : assignee;
        result = result == null ? "" : result;
        environment = environment == null ? "" : environment;
        defects = defects == null ? "" : defects;
        remoteExecutionKey = remoteExecutionKey == null ? "" : remoteExecutionKey;
    }
}
