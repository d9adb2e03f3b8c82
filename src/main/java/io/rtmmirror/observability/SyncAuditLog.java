package io.rtmmirror.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.rtmmirror.security.SensitiveDataMasker;
import io.rtmmirror.util.Hashing;
import io.rtmmirror.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL trail of sync runs, pushes and failures. Each row carries the hash of the
 * previous row, so a truncated or edited file is detectable with {@link #verifyChain()}.
 */
public final class SyncAuditLog {
    private final Path auditFile;
    private String previousHash;

    public SyncAuditLog(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("project", event.project());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", SensitiveDataMasker.maskedDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public List<JsonNode> tail(int limit) {
        List<JsonNode> rows = readRows();
        int from = Math.max(0, rows.size() - Math.max(1, limit));
        return new ArrayList<>(rows.subList(from, rows.size()));
    }

    /** Recomputes every row hash and checks each row links to its predecessor. */
    public ChainVerification verifyChain() {
        List<JsonNode> rows = readRows();
        String expectedPrev = "";
        for (int i = 0; i < rows.size(); i++) {
            JsonNode node = rows.get(i);
            String prev = node.path("prev_hash").asText("");
            String hash = node.path("hash").asText("");
            if (!prev.equals(expectedPrev)) {
                return new ChainVerification(false, rows.size(), i, "prev_hash mismatch");
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("timestamp", node.path("timestamp").asText(""));
            body.put("action", node.path("action").asText(""));
            body.put("project", node.path("project").asText(""));
            body.put("resource", node.path("resource").asText(""));
            body.put("result", node.path("result").asText(""));
            body.put("details", node.path("details"));
            body.put("prev_hash", prev);
            if (!Hashing.sha256Hex(Jsons.toCompactJson(body)).equals(hash)) {
                return new ChainVerification(false, rows.size(), i, "hash mismatch");
            }
            expectedPrev = hash;
        }
        return new ChainVerification(true, rows.size(), -1, "");
    }

    private List<JsonNode> readRows() {
        List<JsonNode> out = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(Jsons.mapper().readTree(line));
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<JsonNode> rows = readRows();
        return rows.isEmpty() ? "" : rows.get(rows.size() - 1).path("hash").asText("");
    }

    public record AuditEvent(
            String action,
            String project,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String project, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(
                    action,
                    project == null ? "" : project,
                    resource == null ? "" : resource,
                    result,
                    details == null ? Map.of() : details
            );
        }
    }

    public record ChainVerification(boolean valid, int rows, int firstBadRow, String reason) {
    }
}
