package io.rtmmirror.sync;

import io.rtmmirror.mapping.LinkField;
import io.rtmmirror.mapping.MappedIssue;
import io.rtmmirror.model.Step;
import io.rtmmirror.util.Hashing;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 fingerprints the reconciler compares against the stored ones. Structure covers
 * placement and the display name; content covers every mapped field and owned row.
 */
final class Fingerprints {
    private Fingerprints() {
    }

    static String folder(String parentFolderId, String name, int sortOrder) {
        return Hashing.sha256Hex(nullToEmpty(parentFolderId) + "\n" + nullToEmpty(name) + "\n" + sortOrder);
    }

    static String issueStructure(String folderId, String summary) {
        return Hashing.sha256Hex(nullToEmpty(folderId) + "\n" + nullToEmpty(summary));
    }

    static String content(MappedIssue mapped) {
        StringBuilder sb = new StringBuilder();
        sb.append(mapped.fields()).append('\n');
        sb.append(mapped.details()).append('\n');
        for (Step step : mapped.steps()) {
            // uids are assigned locally and are not part of the remote content
            sb.append(step.withStepUid(null)).append('\n');
        }
        Map<String, List<String>> links = new TreeMap<>();
        for (Map.Entry<LinkField, List<String>> e : mapped.links().entrySet()) {
            links.put(e.getKey().jsonField(), e.getValue());
        }
        sb.append(links).append('\n');
        sb.append(mapped.executionMeta()).append('\n');
        mapped.executions().forEach(ref -> sb.append(ref).append('\n'));
        return Hashing.sha256Hex(sb.toString());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
