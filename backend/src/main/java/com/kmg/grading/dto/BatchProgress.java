package com.kmg.grading.dto;

public record BatchProgress(
        int total,
        int waiting,
        int inFlight,
        int completed,
        int failed,
        int cancelled,
        int processed,
        double percentComplete,
        Integer currentJobId,
        String currentDocument,
        String statusText
) {
}
