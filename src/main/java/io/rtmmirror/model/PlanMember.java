package io.rtmmirror.model;

public record PlanMember(long testCaseId, int orderNo) {
}
