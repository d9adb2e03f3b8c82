package io.rtmmirror.model;

import java.util.List;

/**
 * Local read model of one node in a folder tree, for callers that render or export the tree.
 */
public record TreeNode(
        String folderId,
        Long issueId,
        String label,
        String remoteKey,
        boolean dirty,
        List<TreeNode> children
) {
    public boolean isFolder() {
        return folderId != null && issueId == null;
    }
}
