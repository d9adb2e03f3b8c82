package io.rtmmirror.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Endpoint and credentials for the remote issue service. Loaded once by the caller and handed
 * to the remote client's constructor.
 */
public record RemoteSettings(
        String baseUrl,
        String bearerToken,
        String username,
        String password,
        Duration connectTimeout,
        Duration requestTimeout,
        List<IssueKind> treeKinds
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public RemoteSettings {
        baseUrl = trimTrailingSlash(baseUrl == null ? "" : baseUrl.trim());
        bearerToken = bearerToken == null ? "" : bearerToken.trim();
        username = username == null ? "" : username.trim();
        password = password == null ? "" : password;
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        treeKinds = treeKinds == null || treeKinds.isEmpty() ? List.of(IssueKind.values()) : List.copyOf(treeKinds);
    }

    public static RemoteSettings defaults() {
        return new RemoteSettings("", "", "", "", null, null, null);
    }

    public static RemoteSettings load(Path file) {
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load remote settings: " + file, e);
        }
    }

    public boolean configured() {
        return !baseUrl.isBlank();
    }

    public boolean usesBearerToken() {
        return !bearerToken.isBlank();
    }

    public RemoteSettings withBaseUrl(String value) {
        return new RemoteSettings(value, bearerToken, username, password, connectTimeout, requestTimeout, treeKinds);
    }

    public RemoteSettings withBearerToken(String value) {
        return new RemoteSettings(baseUrl, value, username, password, connectTimeout, requestTimeout, treeKinds);
    }

    @Override
    public String toString() {
        return "RemoteSettings[baseUrl=" + baseUrl
                + ", auth=" + (usesBearerToken() ? "bearer" : username.isBlank() ? "none" : "basic")
                + ", connectTimeout=" + connectTimeout
                + ", requestTimeout=" + requestTimeout
                + ", treeKinds=" + treeKinds + "]";
    }

    private static RemoteSettings fromFile(SettingsFile raw) {
        List<IssueKind> kinds = new ArrayList<>();
        if (raw.treeKinds() != null) {
            for (String kind : raw.treeKinds()) {
                kinds.add(IssueKind.fromString(kind));
            }
        }
        return new RemoteSettings(
                raw.baseUrl(),
                raw.bearerToken(),
                raw.username(),
                raw.password(),
                raw.connectTimeoutMs() == null ? null : Duration.ofMillis(Math.max(1L, raw.connectTimeoutMs())),
                raw.requestTimeoutMs() == null ? null : Duration.ofMillis(Math.max(1L, raw.requestTimeoutMs())),
                kinds
        );
    }

    private static String trimTrailingSlash(String value) {
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SettingsFile(
            String baseUrl,
            String bearerToken,
            String username,
            String password,
            Long connectTimeoutMs,
            Long requestTimeoutMs,
            List<String> treeKinds
    ) {
    }
}
