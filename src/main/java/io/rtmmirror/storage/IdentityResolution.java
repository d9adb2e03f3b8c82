package io.rtmmirror.storage;

/**
 * Outcome of resolving an incoming record against the store: which existing issue it denotes,
 * or that it has to be created as a new local-only issue.
 */
public record IdentityResolution(Outcome outcome, Long issueId) {
    public enum Outcome {
        EXISTING_LOCAL,
        EXISTING_REMOTE,
        CREATE_LOCAL_ONLY
    }

    public static IdentityResolution existingLocal(long issueId) {
        return new IdentityResolution(Outcome.EXISTING_LOCAL, issueId);
    }

    public static IdentityResolution existingRemote(long issueId) {
        return new IdentityResolution(Outcome.EXISTING_REMOTE, issueId);
    }

    public static IdentityResolution createLocalOnly() {
        return new IdentityResolution(Outcome.CREATE_LOCAL_ONLY, null);
    }

    public boolean exists() {
        return outcome != Outcome.CREATE_LOCAL_ONLY;
    }
}
