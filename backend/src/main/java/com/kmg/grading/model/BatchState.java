package com.kmg.grading.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * One evaluation session: shared master documents plus the ordered student jobs.
 *
 * <p>Submissions can be added and removed until {@link #start()} freezes them into jobs. From then on
 * the job list keeps its length and order and only the orchestrator replaces records; any thread may
 * take a {@link #snapshot()}.
 */
public class BatchState {
    private final String id;
    private final MasterDocuments masterDocuments;
    private final ScoringMode mode;
    private final OffsetDateTime createdAt;
    private final int maxSubmissions;
    private final List<DocumentRef> submissions = new ArrayList<>();
    private final CancellationToken cancellation = new CancellationToken();
    private final List<CancellationToken> retryTokens = new CopyOnWriteArrayList<>();

    private volatile AtomicReferenceArray<JobRecord> jobs;
    private volatile Integer cursor;
    private volatile boolean processing;

    public BatchState(String id, MasterDocuments masterDocuments, ScoringMode mode, OffsetDateTime createdAt,
                      int maxSubmissions) {
        this.id = Objects.requireNonNull(id, "id");
        this.masterDocuments = Objects.requireNonNull(masterDocuments, "masterDocuments");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.createdAt = createdAt;
        this.maxSubmissions = maxSubmissions;
    }

    public String id() {
        return id;
    }

    public MasterDocuments masterDocuments() {
        return masterDocuments;
    }

    public ScoringMode mode() {
        return mode;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    /**
     * Queues a student document. Duplicates by name and anything past the submission cap are ignored.
     *
     * @return whether the document was queued
     */
    public synchronized boolean addSubmission(DocumentRef document) {
        requireNotStarted();
        if (submissions.size() >= maxSubmissions) {
            return false;
        }
        boolean duplicate = submissions.stream().anyMatch(existing -> existing.name().equals(document.name()));
        if (duplicate) {
            return false;
        }
        submissions.add(document);
        return true;
    }

    public synchronized DocumentRef removeSubmission(int index) {
        requireNotStarted();
        if (index < 0 || index >= submissions.size()) {
            throw new NoSuchElementException("No submission at index " + index + " in batch " + id);
        }
        return submissions.remove(index);
    }

    /**
     * Freezes the pending submissions into one waiting job each.
     */
    public synchronized void start() {
        requireNotStarted();
        if (cancellation.isCancellationRequested()) {
            throw new IllegalStateException("Batch " + id + " was cancelled before it started.");
        }
        if (submissions.isEmpty()) {
            throw new IllegalStateException("Batch " + id + " has no student submissions.");
        }
        AtomicReferenceArray<JobRecord> created = new AtomicReferenceArray<>(submissions.size());
        for (int i = 0; i < submissions.size(); i++) {
            created.set(i, JobRecord.waiting(i, submissions.get(i)));
        }
        submissions.clear();
        processing = true;
        jobs = created;
    }

    public boolean isStarted() {
        return jobs != null;
    }

    public int size() {
        AtomicReferenceArray<JobRecord> current = jobs;
        return current == null ? 0 : current.length();
    }

    public JobRecord job(int jobId) {
        AtomicReferenceArray<JobRecord> current = jobs;
        if (current == null || jobId < 0 || jobId >= current.length()) {
            throw new NoSuchElementException("Job not found: " + jobId + " in batch " + id);
        }
        return current.get(jobId);
    }

    public void replace(JobRecord record) {
        AtomicReferenceArray<JobRecord> current = jobs;
        if (current == null) {
            throw new IllegalStateException("Batch " + id + " has not started.");
        }
        JobRecord previous = current.get(record.id());
        if (previous.attempt() > record.attempt()) {
            throw new IllegalStateException("Stale update for job " + record.id() + " in batch " + id);
        }
        current.set(record.id(), record);
    }

    public void moveCursor(int index) {
        cursor = index;
    }

    public void clearCursor() {
        cursor = null;
    }

    public void finishProcessing() {
        processing = false;
    }

    public boolean isProcessing() {
        return processing;
    }

    public boolean isCancelled() {
        return cancellation.isCancellationRequested();
    }

    /**
     * Cancels the batch together with any retry currently queued or running for it.
     *
     * @return {@code true} if this call requested the cancellation
     */
    public boolean cancel() {
        boolean first = cancellation.cancel();
        retryTokens.forEach(CancellationToken::cancel);
        return first;
    }

    public CancellationToken openRetryToken() {
        CancellationToken token = new CancellationToken();
        retryTokens.add(token);
        return token;
    }

    public void closeRetryToken(CancellationToken token) {
        retryTokens.remove(token);
    }

    public BatchSnapshot snapshot() {
        List<DocumentRef> pending;
        synchronized (this) {
            pending = List.copyOf(submissions);
        }
        AtomicReferenceArray<JobRecord> current = jobs;
        List<JobRecord> copy = new ArrayList<>();
        if (current != null) {
            for (int i = 0; i < current.length(); i++) {
                copy.add(current.get(i));
            }
        }
        return new BatchSnapshot(id, masterDocuments, mode, createdAt, current != null, processing,
                isCancelled(), cursor, pending, copy);
    }

    private void requireNotStarted() {
        if (jobs != null) {
            throw new IllegalStateException("Batch " + id + " has already started; submissions are fixed.");
        }
    }
}
