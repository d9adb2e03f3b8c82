package io.rtmmirror.model;

public record DefectDetails(Integer issueTypeId) implements KindDetails {
    @Override
    public IssueKind kind() {
        return IssueKind.DEFECT;
    }
}
