package com.kmg.grading.model;

import java.util.Objects;

public record JobFailure(FailureKind kind, String message) {
    public JobFailure {
        Objects.requireNonNull(kind, "kind");
    }

    public static JobFailure of(FailureKind kind, String message) {
        return new JobFailure(kind, message);
    }

    public boolean isCancellation() {
        return kind == FailureKind.CANCELLED;
    }
}
