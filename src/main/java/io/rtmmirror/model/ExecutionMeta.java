package io.rtmmirror.model;

public record ExecutionMeta(String environment, String startDate, String endDate, String result, String executedBy) {
    public ExecutionMeta {
        environment = environment == null ? "" : environment;
        startDate = startDate == null ? "" : startDate;
        endDate = endDate == null ? "" : endDate;
        result = result == null ? "" : result;
        executedBy = executedBy == null ? "" : executedBy;
    }

    public static ExecutionMeta empty() {
        return new ExecutionMeta("", "", "", "", "");
    }
}
