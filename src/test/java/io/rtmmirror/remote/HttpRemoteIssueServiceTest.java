package io.rtmmirror.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.rtmmirror.config.RemoteSettings;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class HttpRemoteIssueServiceTest {
    private HttpServer server;
    private final Deque<Reply> replies = new ArrayDeque<>();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void treeReadIsRetriedAfterServerError() {
        replies.add(new Reply(503, "busy"));
        replies.add(new Reply(200, "[{\"type\":\"FOLDER\",\"id\":\"1\",\"name\":\"Root\",\"children\":[]}]"));

        JsonNode tree = service(settings().withBearerToken("tok-1")).getTree(10100L, IssueKind.TEST_CASE);

        Assertions.assertEquals("Root", tree.get(0).path("name").asText());
        Assertions.assertEquals(2, requests.size());
        Recorded last = requests.get(1);
        Assertions.assertEquals("GET", last.method());
        Assertions.assertEquals("/rest/rtm/1.0/api/tree/10100?treeType=test-cases", last.pathAndQuery());
        Assertions.assertEquals("Bearer tok-1", last.authorization());
    }

    @Test
    void clientErrorIsNotRetriedAndCarriesStatus() {
        replies.add(new Reply(404, "{\"message\":\"no such issue\"}"));

        RemoteServiceException error = Assertions.assertThrows(RemoteServiceException.class,
                () -> service(settings()).getIssue(IssueKind.DEFECT, "D-404"));

        Assertions.assertEquals(404, error.status());
        Assertions.assertEquals("D-404", error.remoteKey());
        Assertions.assertFalse(error.retryable());
        Assertions.assertTrue(error.getMessage().contains("no such issue"));
        Assertions.assertEquals(1, requests.size());
        Assertions.assertEquals("/rest/rtm/1.0/api/defect/D-404", requests.get(0).pathAndQuery());
    }

    @Test
    void writesAreSentOnceWithBasicAuth() {
        replies.add(new Reply(500, "boom"));
        RemoteSettings basic = new RemoteSettings(baseUrl(), "", "alice", "secret", null, null, null);
        ObjectNode payload = Jsons.mapper().createObjectNode().put("summary", "Edited");

        Assertions.assertThrows(RemoteServiceException.class,
                () -> service(basic).updateIssue(IssueKind.TEST_CASE, "TC-1", payload));

        Assertions.assertEquals(1, requests.size());
        Recorded put = requests.get(0);
        Assertions.assertEquals("PUT", put.method());
        Assertions.assertEquals("/rest/rtm/1.0/api/test-case/TC-1", put.pathAndQuery());
        Assertions.assertEquals("Basic YWxpY2U6c2VjcmV0", put.authorization());
        Assertions.assertEquals("{\"summary\":\"Edited\"}", put.body());
    }

    @Test
    void createReturnsTheAssignedIdentity() {
        replies.add(new Reply(201, "{\"testKey\":\"RTM-77\",\"id\":7700}"));
        replies.add(new Reply(201, "{\"id\":7701}"));
        RemoteIssueService service = service(settings());

        RemoteIssueService.CreatedIssue created = service.createIssue(IssueKind.REQUIREMENT,
                Jsons.mapper().createObjectNode().put("summary", "New"));

        Assertions.assertEquals(new RemoteIssueService.CreatedIssue("RTM-77", 7700L), created);
        Assertions.assertEquals("POST", requests.get(0).method());
        Assertions.assertEquals("/rest/rtm/1.0/api/requirement", requests.get(0).pathAndQuery());
        Assertions.assertThrows(RemoteServiceException.class,
                () -> service.createIssue(IssueKind.REQUIREMENT, Jsons.mapper().createObjectNode()));
    }

    @Test
    void deleteAndUnconfiguredSettings() {
        replies.add(new Reply(204, ""));

        service(settings()).deleteIssue(IssueKind.TEST_EXECUTION, "TE 1");

        Assertions.assertEquals("DELETE", requests.get(0).method());
        Assertions.assertEquals("/rest/rtm/1.0/api/test-execution/TE+1", requests.get(0).pathAndQuery());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new HttpRemoteIssueService(RemoteSettings.defaults()));
    }

    private RemoteSettings settings() {
        return RemoteSettings.defaults().withBaseUrl(baseUrl());
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private static HttpRemoteIssueService service(RemoteSettings settings) {
        return new HttpRemoteIssueService(settings);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        String query = exchange.getRequestURI().getRawQuery();
        requests.add(new Recorded(
                exchange.getRequestMethod(),
                exchange.getRequestURI().getRawPath() + (query == null ? "" : "?" + query),
                exchange.getRequestHeaders().getFirst("Authorization"),
                body
        ));
        Reply reply;
        synchronized (replies) {
            reply = replies.isEmpty() ? new Reply(500, "no reply queued") : replies.poll();
        }
        byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(reply.status(), bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private record Reply(int status, String body) {
    }

    private record Recorded(String method, String pathAndQuery, String authorization, String body) {
    }
}
