package io.rtmmirror.mapping;

import java.util.Locale;

/** Write protocol for link-bearing fields. */
public enum LinkVerb {
    /** Replace the remote list with exactly the given keys. An empty list clears it. */
    SET,
    /** Union the given keys into the remote list. */
    ADD,
    /** Subtract the given keys from the remote list. */
    REMOVE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
