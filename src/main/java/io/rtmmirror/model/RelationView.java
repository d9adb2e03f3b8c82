package io.rtmmirror.model;

public record RelationView(
        long dstIssueId,
        String dstRemoteKey,
        IssueKind dstKind,
        String dstSummary,
        String relationKind,
        long createdAtMs
) {
}
