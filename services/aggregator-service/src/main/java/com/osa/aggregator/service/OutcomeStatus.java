package com.osa.aggregator.service;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OutcomeStatus {
    OK("ok"),
    FAILED("failed"),
    SKIPPED("skipped"),
    TIMED_OUT("timed_out"),
    CANCELLED("cancelled");

    private final String code;

    OutcomeStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
