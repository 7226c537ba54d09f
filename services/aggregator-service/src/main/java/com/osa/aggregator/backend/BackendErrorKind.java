package com.osa.aggregator.backend;

public enum BackendErrorKind {
    NETWORK,
    RATE_LIMITED,
    TIMEOUT,
    INVALID_RESPONSE,
    HTTP_ERROR
}
