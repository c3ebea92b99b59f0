package com.kmg.grading.model;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Immutable snapshot of one student's evaluation. Every transition returns a new record, so readers
 * never see a half-updated job.
 */
public record JobRecord(
        int id,
        DocumentRef document,
        String externalJobId,
        JobStatus status,
        String stageDetail,
        AggregatedResult result,
        JobFailure failure,
        int attempt,
        Duration rateLimitDelay,
        OffsetDateTime startedAt,
        OffsetDateTime endedAt
) {
    public JobRecord {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(status, "status");
        rateLimitDelay = rateLimitDelay == null ? Duration.ZERO : rateLimitDelay;
    }

    public static JobRecord waiting(int id, DocumentRef document) {
        return new JobRecord(id, document, null, JobStatus.WAITING, null, null, null, 1, Duration.ZERO, null, null);
    }

    public String sourceDocument() {
        return document.name();
    }

    public JobRecord uploading(OffsetDateTime now) {
        requireStatus(JobStatus.WAITING);
        return new JobRecord(id, document, null, JobStatus.UPLOADING, "Uploading files...", null, null,
                attempt, Duration.ZERO, now, null);
    }

    public JobRecord submitted(String assignedJobId, String detail) {
        requireStatus(JobStatus.UPLOADING);
        return new JobRecord(id, document, assignedJobId, JobStatus.EXTRACTING, detail, null, null,
                attempt, rateLimitDelay, startedAt, null);
    }

    public JobRecord advancedTo(JobStatus phase, String detail) {
        if (phase != JobStatus.EXTRACTING && phase != JobStatus.GRADING) {
            throw new IllegalArgumentException("Not a processing phase: " + phase);
        }
        requireOpen();
        if (phase.ordinal() < status.ordinal()) {
            throw new IllegalStateException("Job " + id + " cannot move back from " + status + " to " + phase);
        }
        return new JobRecord(id, document, externalJobId, phase, detail, null, null,
                attempt, rateLimitDelay, startedAt, null);
    }

    public JobRecord withStageDetail(String detail) {
        requireOpen();
        return new JobRecord(id, document, externalJobId, status, detail, null, null,
                attempt, rateLimitDelay, startedAt, null);
    }

    public JobRecord withAddedDelay(Duration delay) {
        if (delay == null || delay.isZero()) {
            return this;
        }
        return new JobRecord(id, document, externalJobId, status, stageDetail, result, failure,
                attempt, rateLimitDelay.plus(delay), startedAt, endedAt);
    }

    public JobRecord completed(AggregatedResult aggregated, OffsetDateTime now) {
        requireOpen();
        if (status == JobStatus.WAITING) {
            throw new IllegalStateException("Job " + id + " was never dispatched");
        }
        Objects.requireNonNull(aggregated, "result");
        return new JobRecord(id, document, externalJobId, JobStatus.COMPLETED, "Evaluation complete", aggregated,
                null, attempt, rateLimitDelay, startedAt, now);
    }

    public JobRecord failed(JobFailure reason, OffsetDateTime now) {
        requireOpen();
        Objects.requireNonNull(reason, "failure");
        return new JobRecord(id, document, externalJobId, JobStatus.FAILED, stageDetail, null, reason,
                attempt, rateLimitDelay, startedAt, now);
    }

    /**
     * Starts a manual retry: same id and document, fresh lifecycle.
     */
    public JobRecord nextAttempt() {
        requireStatus(JobStatus.FAILED);
        return new JobRecord(id, document, null, JobStatus.WAITING, "Queued for retry", null, null,
                attempt + 1, Duration.ZERO, null, null);
    }

    private void requireOpen() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + status);
        }
    }

    private void requireStatus(JobStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Job " + id + " is " + status + ", expected " + expected);
        }
    }
}
