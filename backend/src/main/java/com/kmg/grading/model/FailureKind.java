package com.kmg.grading.model;

public enum FailureKind {
    SUBMISSION_FAILURE,
    RATE_LIMIT_EXHAUSTED,
    POLLING_FAILURE,
    CANCELLED,
    AGGREGATION_ERROR
}
