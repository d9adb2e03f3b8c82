package io.rtmmirror.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One local issue of any kind. The common header (identity, placement, sync state) is shared;
 * {@code details} holds the kind-specific payload and must match {@code kind}.
 *
 * <p>An issue with a {@code remoteKey} is remote-bound and may be pushed as an update. An issue
 * without one is local-only and can only be pushed as a create.
 */
public record Issue(
        long id,
        long projectId,
        String remoteKey,
        Long remoteId,
        IssueKind kind,
        String folderId,
        IssueFields fields,
        KindDetails details,
        boolean dirty,
        boolean deleted,
        Instant lastSyncAt
) {
    public Issue {
        Objects.requireNonNull(kind, "kind");
        fields = fields == null ? IssueFields.empty() : fields;
        details = details == null ? KindDetails.emptyFor(kind) : details;
        if (details.kind() != kind) {
            throw new IllegalArgumentException(
                    "Details of kind " + details.kind() + " cannot be attached to a " + kind + " issue");
        }
        remoteKey = remoteKey == null || remoteKey.isBlank() ? null : remoteKey;
    }

    public boolean remoteBound() {
        return remoteKey != null;
    }

    public boolean localOnly() {
        return remoteKey == null;
    }
}
