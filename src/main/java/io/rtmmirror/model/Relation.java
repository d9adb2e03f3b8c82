package io.rtmmirror.model;

/**
 * Directed link from an owning issue to {@code dstIssueId}. {@code createdAtMs} is filled by the
 * store; a relation that survives a wholesale replace keeps its original timestamp.
 */
public record Relation(long dstIssueId, String relationKind, Long createdAtMs) {
    public Relation {
        if (relationKind == null || relationKind.isBlank()) {
            throw new IllegalArgumentException("relationKind must not be blank");
        }
    }

    public Relation(long dstIssueId, String relationKind) {
        this(dstIssueId, relationKind, null);
    }

    public Relation withCreatedAtMs(Long value) {
        return new Relation(dstIssueId, relationKind, value);
    }
}
