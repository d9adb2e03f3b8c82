package io.rtmmirror.sync;

import io.rtmmirror.model.SyncCheckpoint;

import java.util.List;

/**
 * Mixed-outcome summary of one sync invocation. For pulls {@code tombstoned} counts records
 * soft-deleted locally; for pushes {@code deleted} counts tombstones settled remotely.
 * {@code checkpoint} is the project checkpoint after the run, or null if none was recorded.
 */
public record SyncReport(
        String operation,
        String projectKey,
        String mode,
        int created,
        int updated,
        int tombstoned,
        int deleted,
        int unchanged,
        int skippedDirty,
        int failed,
        List<SyncFailure> failures,
        List<String> warnings,
        boolean cancelled,
        SyncCheckpoint checkpoint
) {
    public SyncReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public String resultLabel() {
        if (cancelled) {
            return "cancelled";
        }
        return failures.isEmpty() ? "ok" : "partial";
    }
}
