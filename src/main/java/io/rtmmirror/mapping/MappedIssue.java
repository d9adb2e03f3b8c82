package io.rtmmirror.mapping;

import io.rtmmirror.model.ExecutionMeta;
import io.rtmmirror.model.IssueFields;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.model.KindDetails;
import io.rtmmirror.model.Step;

import java.util.List;
import java.util.Map;

/**
 * Result of mapping one remote payload. Links and execution rows still carry remote keys; they
 * are resolved against the store once every kind scope has been pulled.
 */
public record MappedIssue(
        IssueKind kind,
        String remoteKey,
        Long remoteId,
        String parentKey,
        IssueFields fields,
        KindDetails details,
        List<Step> steps,
        Map<LinkField, List<String>> links,
        ExecutionMeta executionMeta,
        List<ExecutionRef> executions,
        List<String> warnings
) {
    public MappedIssue {
        steps = steps == null ? List.of() : List.copyOf(steps);
        links = links == null ? Map.of() : Map.copyOf(links);
        executions = executions == null ? List.of() : List.copyOf(executions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        executionMeta = executionMeta == null ? ExecutionMeta.empty() : executionMeta;
    }
}
