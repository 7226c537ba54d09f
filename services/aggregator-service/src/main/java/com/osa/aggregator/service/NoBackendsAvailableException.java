package com.osa.aggregator.service;

public class NoBackendsAvailableException extends RuntimeException {
    public NoBackendsAvailableException(String message) {
        super(message);
    }
}
