package io.rtmmirror.remote;

/**
 * A remote call failed: transport error, non-2xx status or an unreadable response body.
 * {@code status} is 0 when no HTTP response was received.
 */
public final class RemoteServiceException extends RuntimeException {
    private final String remoteKey;
    private final int status;

    public RemoteServiceException(String remoteKey, int status, String message) {
        this(remoteKey, status, message, null);
    }

    public RemoteServiceException(String remoteKey, int status, String message, Throwable cause) {
        super(message, cause);
        this.remoteKey = remoteKey == null ? "" : remoteKey;
        this.status = status;
    }

    public String remoteKey() {
        return remoteKey;
    }

    public int status() {
        return status;
    }

    public boolean retryable() {
        return status == 0 || status == 429 || status >= 500;
    }
}
