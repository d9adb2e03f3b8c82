package io.rtmmirror.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.rtmmirror.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class RtmMirrorCommandTest {

    @Test
    void pullFromRemoteThenInspectLocally() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-cli-pull-");
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", RtmMirrorCommandTest::serveRemote);
        server.start();
        try {
            String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
            Assertions.assertEquals(0, run(root, "init").code());
            Run added = run(root, "project-add", "--key", "RTM", "--remote-id", "10100", "--name", "RTM demo");
            Assertions.assertEquals(0, added.code());
            Assertions.assertEquals("RTM", added.json().path("projectKey").asText());

            Run pulled = run(root, "pull", "--project", "RTM", "--kind", "requirements", "--base-url", baseUrl);
            Assertions.assertEquals(0, pulled.code(), pulled.output());
            Assertions.assertEquals(2, pulled.json().path("created").asInt());

            Run tree = run(root, "tree", "--project", "RTM", "--kind", "requirements");
            JsonNode folder = tree.json().get(0);
            Assertions.assertEquals("Auth", folder.path("label").asText());
            Assertions.assertEquals("R-1 Login works", folder.path("children").get(0).path("label").asText());

            Run status = run(root, "status", "--project", "RTM");
            Assertions.assertEquals(1, status.json().path("counts").path("total").asInt());
            Assertions.assertFalse(status.json().path("checkpoint").path("lastFullSyncAtMs").isNull());

            Run verify = run(root, "audit-verify");
            Assertions.assertEquals(0, verify.code());
            Assertions.assertEquals(1, verify.json().path("rows").asInt());
        } finally {
            server.stop(0);
            deleteRecursively(root);
        }
    }

    @Test
    void failedRemoteScopeExitsWithPartialCode() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-cli-partial-");
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", RtmMirrorCommandTest::serveRemote);
        server.start();
        try {
            String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
            run(root, "project-add", "--key", "RTM", "--remote-id", "10100");

            Run pulled = run(root, "pull", "--project", "RTM", "--kind", "requirements,defects", "--base-url", baseUrl);

            Assertions.assertEquals(2, pulled.code(), pulled.output());
            Assertions.assertEquals("tree", pulled.json().path("failures").get(0).path("stage").asText());
        } finally {
            server.stop(0);
            deleteRecursively(root);
        }
    }

    @Test
    void unknownProjectAndEmptyPurge() throws Exception {
        Path root = Files.createTempDirectory("rtm-mirror-test-cli-local-");
        try {
            Assertions.assertEquals(1, run(root, "status", "--project", "NOPE").code());
            run(root, "project-add", "--key", "RTM", "--remote-id", "10100");

            Run purge = run(root, "purge-tombstones", "--project", "RTM");
            Assertions.assertEquals(0, purge.code());
            Assertions.assertEquals(0, purge.json().path("issuesPurged").asInt());

            Run tail = run(root, "audit-tail", "--limit", "5");
            Assertions.assertEquals("store.purge", tail.json().get(0).path("action").asText());

            Run migrations = run(root, "schema-migrations");
            Assertions.assertEquals(3, migrations.json().size());
        } finally {
            deleteRecursively(root);
        }
    }

    // Requirements: folder Auth holding R-1. Every other tree answers 500.
    private static void serveRemote(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getRawPath();
        String query = exchange.getRequestURI().getRawQuery();
        int status = 200;
        String body;
        if (path.equals("/rest/rtm/1.0/api/tree/10100") && "treeType=requirements".equals(query)) {
            body = "[{\"type\":\"FOLDER\",\"id\":\"7\",\"name\":\"Auth\",\"children\":[{\"testKey\":\"R-1\"}]}]";
        } else if (path.equals("/rest/rtm/1.0/api/requirement/R-1")) {
            body = "{\"testKey\":\"R-1\",\"issueId\":501,\"summary\":\"Login works\"}";
        } else {
            status = 500;
            body = "{\"message\":\"unavailable\"}";
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static Run run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
            code = new CommandLine(new RtmMirrorCommand()).execute(full);
        } finally {
            System.setOut(original);
        }
        return new Run(code, buffer.toString(StandardCharsets.UTF_8));
    }

    private record Run(int code, String output) {
        JsonNode json() {
            try {
                return Jsons.mapper().readTree(output);
            } catch (IOException e) {
                throw new IllegalStateException("Command output is not JSON: " + output, e);
            }
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
