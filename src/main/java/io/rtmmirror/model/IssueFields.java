package io.rtmmirror.model;

import java.util.List;

/**
 * Descriptive fields shared by every issue kind. Absent values are normalized to empty
 * strings and empty lists so that two payloads carrying the same content compare equal.
 */
public record IssueFields(
        String summary,
        String description,
        String status,
        String priority,
        String assignee,
        String reporter,
        List<String> labels,
        List<String> components,
        List<String> versions,
        String environment,
        String dueDate,
        String timeEstimate,
        String created,
        String updated
) {
    private static final IssueFields EMPTY = new IssueFields(
            "", "", "", "", "", "", List.of(), List.of(), List.of(), "", "", "", "", "");

    public IssueFields {
        summary = text(summary);
        description = text(description);
        status = text(status);
        priority = text(priority);
        assignee = text(assignee);
        reporter = text(reporter);
        labels = labels == null ? List.of() : List.copyOf(labels);
        components = components == null ? List.of() : List.copyOf(components);
        versions = versions == null ? List.of() : List.copyOf(versions);
        environment = text(environment);
        dueDate = text(dueDate);
        timeEstimate = text(timeEstimate);
        created = text(created);
        updated = text(updated);
    }

    public static IssueFields empty() {
        return EMPTY;
    }

    public static IssueFields ofSummary(String summary) {
        return EMPTY.withSummary(summary);
    }

    public IssueFields withSummary(String value) {
        return new IssueFields(value, description, status, priority, assignee, reporter, labels, components,
                versions, environment, dueDate, timeEstimate, created, updated);
    }

    public IssueFields withDescription(String value) {
        return new IssueFields(summary, value, status, priority, assignee, reporter, labels, components,
                versions, environment, dueDate, timeEstimate, created, updated);
    }

    public IssueFields withPriority(String value) {
        return new IssueFields(summary, description, status, value, assignee, reporter, labels, components,
                versions, environment, dueDate, timeEstimate, created, updated);
    }

    public IssueFields withStatus(String value) {
        return new IssueFields(summary, description, value, priority, assignee, reporter, labels, components,
                versions, environment, dueDate, timeEstimate, created, updated);
    }

    public IssueFields withLabels(List<String> value) {
        return new IssueFields(summary, description, status, priority, assignee, reporter, value, components,
                versions, environment, dueDate, timeEstimate, created, updated);
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }
}
