package io.rtmmirror.sync;

/**
 * Two remote nodes in one tree claim the same local record. The reconciler skips the second
 * node's subtree and keeps going.
 */
public final class IdentityConflictException extends RuntimeException {
    private final String remoteIdentity;

    public IdentityConflictException(String remoteIdentity, String message) {
        super(message);
        this.remoteIdentity = remoteIdentity;
    }

    public String remoteIdentity() {
        return remoteIdentity;
    }
}
