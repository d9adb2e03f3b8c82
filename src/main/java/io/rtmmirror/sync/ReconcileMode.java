package io.rtmmirror.sync;

public enum ReconcileMode {
    /** Fetches every issue's payload and overwrites fields, steps, links and execution rows. */
    FULL,
    /** Uses the tree only: placement, names and tombstones. Content and dirty flags are kept. */
    STRUCTURE_ONLY
}
