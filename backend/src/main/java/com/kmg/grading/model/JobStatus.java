package com.kmg.grading.model;

public enum JobStatus {
    WAITING,
    UPLOADING,
    EXTRACTING,
    GRADING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isInFlight() {
        return this == UPLOADING || this == EXTRACTING || this == GRADING;
    }
}
