package io.rtmmirror.model;

public record Folder(
        String id,
        long projectId,
        String parentId,
        String name,
        IssueKind kind,
        int sortOrder,
        boolean remoteBound,
        boolean deleted
) {
}
