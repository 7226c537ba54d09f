package com.osa.aggregator.event;

public enum DispatchEventType {
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded"),
    BACKEND_FAILED("backend_failed"),
    BACKEND_RECOVERED("backend_recovered"),
    REQUEST_QUEUED("request_queued"),
    REQUEST_COMPLETED("request_completed");

    private final String code;

    DispatchEventType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
