package io.rtmmirror.mapping;

import io.rtmmirror.model.ExecutionMeta;
import io.rtmmirror.model.Issue;
import io.rtmmirror.model.Step;

import java.util.List;
import java.util.Objects;

/**
 * Everything {@link FieldMapper#toRemote} needs to build a write payload for one issue: the
 * record itself, its owned rows, link updates and placement on the remote side.
 */
public record LocalRecord(
        Issue issue,
        List<Step> steps,
        List<LinkUpdate> links,
        List<ExecutionRef> executions,
        String projectKey,
        String parentTestKey,
        ExecutionMeta executionMeta
) {
    public LocalRecord {
        Objects.requireNonNull(issue, "issue");
        steps = steps == null ? List.of() : List.copyOf(steps);
        links = links == null ? List.of() : List.copyOf(links);
        executions = executions == null ? List.of() : List.copyOf(executions);
        executionMeta = executionMeta == null ? ExecutionMeta.empty() : executionMeta;
    }

    public LocalRecord(
            Issue issue,
            List<Step> steps,
            List<LinkUpdate> links,
            List<ExecutionRef> executions,
            String projectKey,
            String parentTestKey
    ) {
        this(issue, steps, links, executions, projectKey, parentTestKey, null);
    }

    public static LocalRecord of(Issue issue) {
        return new LocalRecord(issue, List.of(), List.of(), List.of(), null, null);
    }
}
