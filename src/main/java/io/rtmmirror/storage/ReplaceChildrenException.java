package io.rtmmirror.storage;

/**
 * Raised when a wholesale child replacement could not be applied. The owner's previous children
 * are still in place when this is thrown.
 */
public final class ReplaceChildrenException extends RuntimeException {
    private final long ownerId;
    private final String childKind;
    private final int rowIndex;
    private final transient Object row;

    public ReplaceChildrenException(long ownerId, String childKind, int rowIndex, Object row, String message, Throwable cause) {
        super(message, cause);
        this.ownerId = ownerId;
        this.childKind = childKind;
        this.rowIndex = rowIndex;
        this.row = row;
    }

    public long ownerId() {
        return ownerId;
    }

    public String childKind() {
        return childKind;
    }

    /** Index of the offending row in the requested list, or -1 when the owner itself was rejected. */
    public int rowIndex() {
        return rowIndex;
    }

    public Object row() {
        return row;
    }
}
