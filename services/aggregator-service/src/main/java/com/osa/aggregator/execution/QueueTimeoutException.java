package com.osa.aggregator.execution;

public class QueueTimeoutException extends RuntimeException {
    private final String requestId;

    public QueueTimeoutException(String requestId, long timeoutMs) {
        super("request " + requestId + " timed out after " + timeoutMs + "ms in queue");
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
