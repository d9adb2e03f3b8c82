package io.rtmmirror.model;

public record Project(long id, String projectKey, long remoteId, String name, String baseUrl) {
    public static final String LOCAL_KEY = "LOCAL";
    public static final long LOCAL_REMOTE_ID = -1L;

    public boolean localOnly() {
        return LOCAL_KEY.equals(projectKey) || remoteId == LOCAL_REMOTE_ID;
    }
}
