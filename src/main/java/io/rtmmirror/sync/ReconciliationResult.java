package io.rtmmirror.sync;

import io.rtmmirror.mapping.MappedIssue;
import io.rtmmirror.model.IssueKind;

import java.util.List;

/**
 * Outcome of reconciling one kind scope. Counts cover folders and issues. {@code pulled} lists
 * the issues whose payload was mapped during a full pull; their links and execution rows are
 * resolved after every scope has been reconciled.
 */
public record ReconciliationResult(
        IssueKind kind,
        int created,
        int updated,
        int tombstoned,
        int unchanged,
        int skippedDirty,
        List<SyncFailure> failures,
        List<String> warnings,
        boolean cancelled,
        List<PulledIssue> pulled
) {
    public ReconciliationResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        pulled = pulled == null ? List.of() : List.copyOf(pulled);
    }

    public int failed() {
        return failures.size();
    }

    public record PulledIssue(long issueId, String remoteKey, MappedIssue mapped) {
    }
}
