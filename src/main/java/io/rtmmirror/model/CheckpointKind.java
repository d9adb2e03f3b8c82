package io.rtmmirror.model;

public enum CheckpointKind {
    FULL_TREE,
    TREE_STRUCTURE,
    SINGLE_ISSUE
}
