package io.rtmmirror.sync;

/** What a full pull does with records that carry unpushed local edits. */
public enum PullPolicy {
    /** Remote wins; local edits are overwritten and the dirty flag is cleared. */
    OVERWRITE,
    /** Dirty records are left untouched and reported as skipped. */
    SKIP_DIRTY
}
