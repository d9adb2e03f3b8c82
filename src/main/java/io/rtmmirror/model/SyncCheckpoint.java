package io.rtmmirror.model;

public record SyncCheckpoint(long projectId, Long lastFullSyncAtMs, Long lastTreeSyncAtMs, Long lastIssueSyncAtMs) {
    public static SyncCheckpoint never(long projectId) {
        return new SyncCheckpoint(projectId, null, null, null);
    }
}
