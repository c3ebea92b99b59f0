package com.kmg.grading.service;

import java.time.Duration;

public record CallOutcome<T>(Kind kind, T payload, String message, int attempts, Duration waited) {

    public enum Kind {
        SUCCESS,
        RATE_LIMIT_EXHAUSTED,
        SERVICE_ERROR,
        CANCELLED
    }

    static <T> CallOutcome<T> success(T payload, int attempts, Duration waited) {
        return new CallOutcome<>(Kind.SUCCESS, payload, null, attempts, waited);
    }

    static <T> CallOutcome<T> failure(Kind kind, String message, int attempts, Duration waited) {
        return new CallOutcome<>(kind, null, message, attempts, waited);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}
