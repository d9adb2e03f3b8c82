package io.rtmmirror.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rtmmirror.model.IssueKind;

/**
 * The remote RTM service as the sync engine sees it: one tree per kind scope plus per-issue
 * CRUD keyed by the issue's textual key. Failures surface as {@link RemoteServiceException}.
 */
public interface RemoteIssueService {
    JsonNode getTree(long projectRemoteId, IssueKind kind);

    JsonNode getIssue(IssueKind kind, String remoteKey);

    CreatedIssue createIssue(IssueKind kind, ObjectNode payload);

    void updateIssue(IssueKind kind, String remoteKey, ObjectNode payload);

    void deleteIssue(IssueKind kind, String remoteKey);

    record CreatedIssue(String remoteKey, Long remoteId) {
    }
}
