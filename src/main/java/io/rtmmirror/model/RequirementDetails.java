package io.rtmmirror.model;

public record RequirementDetails(String epicName, Integer issueTypeId) implements KindDetails {
    public RequirementDetails {
        epicName = epicName == null ? "" : epicName;
    }

    @Override
    public IssueKind kind() {
        return IssueKind.REQUIREMENT;
    }
}
