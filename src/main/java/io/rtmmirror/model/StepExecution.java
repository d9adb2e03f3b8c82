package io.rtmmirror.model;

public record StepExecution(int groupNo, int orderNo, String stepUid, String status, String actualResult, String evidence) {
    public StepExecution {
        stepUid = stepUid == null ? "" : stepUid;
        status = status == null ? "" : status;
        actualResult = actualResult == null ? "" : actualResult;
        evidence = evidence == null ? "" : evidence;
    }

    public StepExecution withStepUid(String value) {
        return new StepExecution(groupNo, orderNo, value, status, actualResult, evidence);
    }
}
