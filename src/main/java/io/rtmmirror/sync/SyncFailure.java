package io.rtmmirror.sync;

/**
 * One record that could not be synced. {@code stage} names the step that failed, for example
 * {@code tree}, {@code node}, {@code steps}, {@code links}, {@code push}.
 */
public record SyncFailure(String remoteKey, String stage, String message) {
    public SyncFailure {
        remoteKey = remoteKey == null ? "" : remoteKey;
        message = message == null ? "" : message;
    }

    static SyncFailure of(String remoteKey, String stage, Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return new SyncFailure(remoteKey, stage, message);
    }
}
