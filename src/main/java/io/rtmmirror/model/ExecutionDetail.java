package io.rtmmirror.model;

public record ExecutionDetail(
        long testCaseId,
        int orderNo,
        String assignee,
        String result,
        String environment,
        String defects,
        Long actualTime,
        String remoteExecutionKey
) {
    public ExecutionDetail {
        assignee = assignee == null ? "" : assignee;
        result = result == null ? "" : result;
        environment = environment == null ? "" : environment;
        defects = defects == null ? "" : defects;
        remoteExecutionKey = remoteExecutionKey == null ? "" : remoteExecutionKey;
    }
}
