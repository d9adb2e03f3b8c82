package io.rtmmirror.model;

import java.util.Locale;

public enum IssueKind {
    REQUIREMENT("requirements", "requirement"),
    TEST_CASE("test-cases", "test-case"),
    TEST_PLAN("test-plans", "test-plan"),
    TEST_EXECUTION("test-executions", "test-execution"),
    DEFECT("defects", "defect");

    private final String treeType;
    private final String entityPath;

    IssueKind(String treeType, String entityPath) {
        this.treeType = treeType;
        this.entityPath = entityPath;
    }

    public String treeType() {
        return treeType;
    }

    public String entityPath() {
        return entityPath;
    }

    public static IssueKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Issue kind must not be blank");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (IssueKind value : values()) {
            if (value.name().equals(normalized)
                    || value.treeType.equalsIgnoreCase(raw.trim())
                    || value.entityPath.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown issue kind: " + raw);
    }
}
