package com.kmg.grading.model;

import java.time.OffsetDateTime;
import java.util.List;

public record BatchSnapshot(
        String id,
        MasterDocuments masterDocuments,
        ScoringMode mode,
        OffsetDateTime createdAt,
        boolean started,
        boolean processing,
        boolean cancelled,
        Integer cursor,
        List<DocumentRef> pendingSubmissions,
        List<JobRecord> jobs
) {
    public BatchSnapshot {
        pendingSubmissions = List.copyOf(pendingSubmissions);
        jobs = List.copyOf(jobs);
    }

    public JobRecord currentJob() {
        if (cursor == null || cursor < 0 || cursor >= jobs.size()) {
            return null;
        }
        return jobs.get(cursor);
    }
}
