package io.rtmmirror.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class SyncAuditLogTest {

    @Test
    void rowsAreHashChainedAndSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("sync-audit.log");
            SyncAuditLog log = new SyncAuditLog(file);
            log.log(SyncAuditLog.AuditEvent.of("sync.pull", "RTM", "project/RTM", "ok", Map.of("created", 3)));
            String afterFirst = log.currentHash();

            SyncAuditLog reopened = new SyncAuditLog(file);
            Assertions.assertEquals(afterFirst, reopened.currentHash());
            reopened.log(SyncAuditLog.AuditEvent.of("sync.push", "RTM", "project/RTM", "partial", null));

            List<JsonNode> rows = reopened.tail(10);
            Assertions.assertEquals(2, rows.size());
            Assertions.assertEquals("", rows.get(0).path("prev_hash").asText());
            Assertions.assertEquals(afterFirst, rows.get(1).path("prev_hash").asText());
            Assertions.assertEquals(3, rows.get(0).path("details").path("created").asInt());
            Assertions.assertEquals(1, reopened.tail(1).size());
            Assertions.assertEquals("sync.push", reopened.tail(1).get(0).path("action").asText());

            SyncAuditLog.ChainVerification verification = reopened.verifyChain();
            Assertions.assertTrue(verification.valid(), verification.reason());
            Assertions.assertEquals(2, verification.rows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-audit-tamper-");
        try {
            Path file = root.resolve("sync-audit.log");
            SyncAuditLog log = new SyncAuditLog(file);
            log.log(SyncAuditLog.AuditEvent.of("sync.pull", "RTM", "project/RTM", "ok", Map.of("failed", 0)));
            log.log(SyncAuditLog.AuditEvent.of("sync.push", "RTM", "project/RTM", "ok", Map.of("failed", 0)));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            lines.set(0, lines.get(0).replace("\"failed\":0", "\"failed\":7"));
            Files.write(file, lines, StandardCharsets.UTF_8);

            SyncAuditLog.ChainVerification verification = new SyncAuditLog(file).verifyChain();
            Assertions.assertFalse(verification.valid());
            Assertions.assertEquals(0, verification.firstBadRow());
            Assertions.assertEquals("hash mismatch", verification.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void credentialsInDetailsAreMasked() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-audit-mask-");
        try {
            SyncAuditLog log = new SyncAuditLog(root.resolve("sync-audit.log"));
            log.log(SyncAuditLog.AuditEvent.of("sync.failure", "RTM", "issue/TC-1", "failed", Map.of(
                    "message", "Bearer abc.def",
                    "api_token", "s3cr3t",
                    "stage", "push")));

            JsonNode details = log.tail(1).get(0).path("details");
            Assertions.assertEquals("***", details.path("message").asText());
            Assertions.assertEquals("***", details.path("api_token").asText());
            Assertions.assertEquals("push", details.path("stage").asText());
            Assertions.assertFalse(Files.readString(root.resolve("sync-audit.log")).contains("s3cr3t"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
