package io.rtmmirror.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rtmmirror.config.RemoteSettings;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * {@link RemoteIssueService} over the RTM REST API. Reads are retried on transport errors and
 * 429/5xx answers; writes are sent once.
 */
public final class HttpRemoteIssueService implements RemoteIssueService {
    private static final Logger LOG = LoggerFactory.getLogger(HttpRemoteIssueService.class);
    private static final String API_ROOT = "/rest/rtm/1.0/api";
    private static final int READ_ATTEMPTS = 3;
    private static final long RETRY_BACKOFF_MS = 500L;

    private final RemoteSettings settings;
    private final HttpClient http;

    public HttpRemoteIssueService(RemoteSettings settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(settings.connectTimeout()).build());
    }

    HttpRemoteIssueService(RemoteSettings settings, HttpClient http) {
        if (!settings.configured()) {
            throw new IllegalArgumentException("Remote base URL is not configured");
        }
        this.settings = settings;
        this.http = http;
    }

    @Override
    public JsonNode getTree(long projectRemoteId, IssueKind kind) {
        String path = API_ROOT + "/tree/" + projectRemoteId + "?treeType=" + kind.treeType();
        return readJson(kind.treeType(), send(kind.treeType(), request(path).GET(), true));
    }

    @Override
    public JsonNode getIssue(IssueKind kind, String remoteKey) {
        return readJson(remoteKey, send(remoteKey, request(entityPath(kind, remoteKey)).GET(), true));
    }

    @Override
    public CreatedIssue createIssue(IssueKind kind, ObjectNode payload) {
        String path = API_ROOT + "/" + kind.entityPath();
        HttpResponse<String> response = send("", request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(payload), StandardCharsets.UTF_8)), false);
        JsonNode body = readJson("", response);
        String key = body.path("testKey").asText(body.path("key").asText(""));
        if (key.isBlank()) {
            throw new RemoteServiceException("", response.statusCode(), "Create response carries no issue key");
        }
        JsonNode id = body.has("id") ? body.get("id") : body.path("issueId");
        return new CreatedIssue(key, id.canConvertToLong() ? id.asLong() : null);
    }

    @Override
    public void updateIssue(IssueKind kind, String remoteKey, ObjectNode payload) {
        send(remoteKey, request(entityPath(kind, remoteKey))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(payload), StandardCharsets.UTF_8)), false);
    }

    @Override
    public void deleteIssue(IssueKind kind, String remoteKey) {
        send(remoteKey, request(entityPath(kind, remoteKey)).DELETE(), false);
    }

    private static String entityPath(IssueKind kind, String remoteKey) {
        return API_ROOT + "/" + kind.entityPath() + "/" + URLEncoder.encode(remoteKey, StandardCharsets.UTF_8);
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(settings.baseUrl() + path))
                .timeout(settings.requestTimeout())
                .header("Accept", "application/json");
        if (settings.usesBearerToken()) {
            builder.header("Authorization", "Bearer " + settings.bearerToken());
        } else if (!settings.username().isBlank()) {
            String raw = settings.username() + ":" + settings.password();
            builder.header("Authorization",
                    "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8)));
        }
        return builder;
    }

    private HttpResponse<String> send(String remoteKey, HttpRequest.Builder builder, boolean idempotent) {
        HttpRequest request = builder.build();
        int attempts = idempotent ? READ_ATTEMPTS : 1;
        RemoteServiceException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                LOG.debug("{} {} -> {}", request.method(), request.uri().getPath(), response.statusCode());
                if (response.statusCode() / 100 == 2) {
                    return response;
                }
                last = new RemoteServiceException(remoteKey, response.statusCode(),
                        request.method() + " " + request.uri().getPath() + " failed status=" + response.statusCode()
                                + bodySnippet(response.body()));
            } catch (IOException e) {
                last = new RemoteServiceException(remoteKey, 0,
                        request.method() + " " + request.uri().getPath() + " failed: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteServiceException(remoteKey, 0, "Interrupted while calling remote service", e);
            }
            if (!last.retryable() || attempt == attempts) {
                break;
            }
            LOG.warn("Remote call {} {} failed (attempt {}/{}), retrying: {}",
                    request.method(), request.uri().getPath(), attempt, attempts, last.getMessage());
            try {
                Thread.sleep(RETRY_BACKOFF_MS * attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteServiceException(remoteKey, 0, "Interrupted while waiting to retry", e);
            }
        }
        throw last;
    }

    private static JsonNode readJson(String remoteKey, HttpResponse<String> response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return Jsons.mapper().createObjectNode();
        }
        try {
            return Jsons.mapper().readTree(body);
        } catch (IOException e) {
            throw new RemoteServiceException(remoteKey, response.statusCode(), "Response is not valid JSON", e);
        }
    }

    private static String bodySnippet(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String flat = body.replaceAll("\\s+", " ").trim();
        return ": " + (flat.length() > 200 ? flat.substring(0, 200) + "..." : flat);
    }
}
