package com.osa.aggregator.backend;

public class BackendException extends RuntimeException {
    private final String backendId;
    private final BackendErrorKind kind;
    private final Integer statusCode;

    public BackendException(String backendId, BackendErrorKind kind, String message) {
        this(backendId, kind, null, message, null);
    }

    public BackendException(String backendId, BackendErrorKind kind, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.backendId = backendId;
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static BackendException timeout(String backendId, long timeoutMs) {
        return new BackendException(backendId, BackendErrorKind.TIMEOUT, "Backend timeout after " + timeoutMs + "ms");
    }

    public String getBackendId() {
        return backendId;
    }

    public BackendErrorKind getKind() {
        return kind;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
