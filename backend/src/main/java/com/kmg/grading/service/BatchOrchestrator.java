package com.kmg.grading.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.grading.client.GradingServiceClient;
import com.kmg.grading.client.PipelineStatus;
import com.kmg.grading.config.GradingProperties;
import com.kmg.grading.dto.EvaluationResultView;
import com.kmg.grading.model.*;
import com.kmg.grading.repo.ArchivedResult;
import com.kmg.grading.repo.ResultArchiveRepository;
import com.kmg.grading.service.DocumentInspector.DocumentRejectedException;
import com.kmg.grading.service.ScoreAggregator.AggregationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Owns every batch and drives its jobs one at a time through upload, polling and aggregation.
 *
 * <p>All dispatching happens on the single {@code gradingWorker} thread, so batch runs and manual
 * retries never overlap. Callers on other threads only read snapshots or flip cancellation flags.
 */
@Service
public class BatchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final GradingServiceClient gradingClient;
    private final RateLimitedClient rateLimitedClient;
    private final ScoreAggregator scoreAggregator;
    private final DocumentInspector documentInspector;
    private final ResultArchiveRepository archiveRepository;
    private final EventService eventService;
    private final GradingProperties properties;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Executor worker;
    private final List<SectionSpec> sectionSpecs;

    private final Map<String, BatchState> batches = new ConcurrentHashMap<>();
    private final AtomicReference<String> runningBatchId = new AtomicReference<>(null);

    public BatchOrchestrator(
            GradingServiceClient gradingClient,
            RateLimitedClient rateLimitedClient,
            ScoreAggregator scoreAggregator,
            DocumentInspector documentInspector,
            ResultArchiveRepository archiveRepository,
            EventService eventService,
            GradingProperties properties,
            ObjectMapper objectMapper,
            Sleeper sleeper,
            Clock clock,
            @Qualifier("gradingWorker") Executor worker
    ) {
        this.gradingClient = gradingClient;
        this.rateLimitedClient = rateLimitedClient;
        this.scoreAggregator = scoreAggregator;
        this.documentInspector = documentInspector;
        this.archiveRepository = archiveRepository;
        this.eventService = eventService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.clock = clock;
        this.worker = worker;
        this.sectionSpecs = properties.getScoring().toSectionSpecs();
    }

    public String createBatch(MasterDocuments masterDocuments, ScoringMode mode) {
        documentInspector.inspect(masterDocuments.questionPaper());
        documentInspector.inspect(masterDocuments.answerKey());

        String batchId = UUID.randomUUID().toString();
        ScoringMode effectiveMode = mode == null ? properties.getScoring().getDefaultMode() : mode;
        BatchState state = new BatchState(batchId, masterDocuments, effectiveMode, now(),
                properties.getBatch().getMaxStudents());
        batches.put(batchId, state);

        log.info("Batch {} created ({} scoring)", batchId, effectiveMode);
        eventService.publish("batch-created", batchId, "Batch created", Map.of("mode", effectiveMode.name()));
        return batchId;
    }

    /**
     * @return how many of the documents were queued; duplicates and documents over the cap are skipped
     */
    public int addSubmissions(String batchId, List<DocumentRef> documents) {
        BatchState state = requireBatch(batchId);
        int accepted = 0;
        for (DocumentRef document : documents) {
            if (state.addSubmission(document)) {
                accepted++;
            } else {
                log.info("Batch {}: skipped {} (duplicate or batch full)", batchId, document.name());
            }
        }
        return accepted;
    }

    public DocumentRef removeSubmission(String batchId, int index) {
        return requireBatch(batchId).removeSubmission(index);
    }

    public synchronized void startBatch(String batchId) {
        if (runningBatchId.get() != null) {
            throw new IllegalStateException("Another batch is already running.");
        }

        BatchState state = requireBatch(batchId);
        state.start();
        runningBatchId.set(batchId);
        eventService.publish("batch-started", batchId, "Batch started", Map.of("total", state.size()));

        try {
            worker.execute(() -> runBatch(state));
        } catch (RejectedExecutionException e) {
            runningBatchId.set(null);
            state.finishProcessing();
            throw e;
        }
    }

    /**
     * Requests cancellation. The job in flight fails as cancelled at its next check; jobs not yet
     * dispatched stay waiting.
     */
    public void cancelBatch(String batchId) {
        BatchState state = requireBatch(batchId);
        if (state.cancel()) {
            log.info("Batch {}: cancellation requested", batchId);
            eventService.publish("batch-cancel-requested", batchId, "Cancellation requested", null);
        }
    }

    public synchronized void retryJob(String batchId, int jobId) {
        BatchState state = requireBatch(batchId);
        JobRecord current = state.job(jobId);
        if (current.status() != JobStatus.FAILED) {
            throw new IllegalStateException("Only failed jobs can be retried; job " + jobId + " is " + current.status());
        }

        JobRecord queued = current.nextAttempt();
        state.replace(queued);
        CancellationToken token = state.openRetryToken();
        publishJob("job-retry-queued", state, queued, "Retry queued");

        try {
            worker.execute(() -> runRetry(state, jobId, token));
        } catch (RejectedExecutionException e) {
            state.closeRetryToken(token);
            state.replace(queued.failed(JobFailure.of(FailureKind.SUBMISSION_FAILURE, "Worker unavailable"), now()));
            throw e;
        }
    }

    public BatchSnapshot getBatch(String batchId) {
        return requireBatch(batchId).snapshot();
    }

    public JobRecord getJob(String batchId, int jobId) {
        return requireBatch(batchId).job(jobId);
    }

    public List<BatchSnapshot> listBatches() {
        return batches.values().stream()
                .map(BatchState::snapshot)
                .sorted(Comparator.comparing(BatchSnapshot::createdAt).thenComparing(BatchSnapshot::id))
                .toList();
    }

    private BatchState requireBatch(String batchId) {
        BatchState state = batches.get(batchId);
        if (state == null) {
            throw new NoSuchElementException("Batch not found: " + batchId);
        }
        return state;
    }

    private void runBatch(BatchState state) {
        String batchId = state.id();
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("batchId", batchId);
        report.put("mode", state.mode().name());
        report.put("startedAt", now().toString());
        String outcome = "COMPLETED";

        try {
            for (int i = 0; i < state.size(); i++) {
                if (state.isCancelled()) {
                    break;
                }
                if (state.job(i).status() != JobStatus.WAITING) {
                    continue;
                }
                ensureNothingInFlight(state);
                state.moveCursor(i);
                processJob(state, i, state.cancellation());
            }
            if (state.isCancelled()) {
                outcome = "CANCELLED";
            }
        } catch (RuntimeException e) {
            log.error("Batch {} aborted: {}", batchId, e.getMessage(), e);
            outcome = "FAILED";
            report.put("error", e.getMessage());
        } finally {
            state.clearCursor();
            state.finishProcessing();
            runningBatchId.set(null);

            BatchSnapshot snapshot = state.snapshot();
            report.put("status", outcome);
            report.put("endedAt", now().toString());
            report.put("jobs", snapshot.jobs().stream().map(this::reportEntry).toList());
            writeReport(batchId, report);

            log.info("Batch {} finished: {}", batchId, outcome);
            eventService.publish("batch-" + outcome.toLowerCase(Locale.ROOT), batchId, "Batch " + outcome.toLowerCase(Locale.ROOT),
                    Map.of("total", snapshot.jobs().size()));
        }
    }

    private void runRetry(BatchState state, int jobId, CancellationToken cancellation) {
        try {
            if (cancellation.isCancellationRequested()) {
                fail(state, jobId, JobFailure.of(FailureKind.CANCELLED, "Cancelled before the retry started"));
                return;
            }
            ensureNothingInFlight(state);
            state.moveCursor(jobId);
            processJob(state, jobId, cancellation);
        } catch (RuntimeException e) {
            log.error("Retry of job {} in batch {} aborted: {}", jobId, state.id(), e.getMessage(), e);
        } finally {
            state.clearCursor();
            state.closeRetryToken(cancellation);
        }
    }

    private void ensureNothingInFlight(BatchState state) {
        for (int i = 0; i < state.size(); i++) {
            JobRecord job = state.job(i);
            if (job.status().isInFlight()) {
                throw new IllegalStateException("Job " + i + " in batch " + state.id() + " is still " + job.status());
            }
        }
    }

    private void processJob(BatchState state, int jobId, CancellationToken cancellation) {
        JobRecord job = state.job(jobId).uploading(now());
        state.replace(job);
        publishJob("job-started", state, job, "Evaluation started");

        try {
            documentInspector.inspect(job.document());

            DocumentRef document = job.document();
            CallOutcome<String> submission = rateLimitedClient.call(
                    "submit " + document.name(),
                    () -> gradingClient.submit(state.masterDocuments(), document, state.mode()),
                    cancellation,
                    backoffListener(state, jobId)
            );
            recordDelay(state, jobId, submission);
            if (!submission.isSuccess()) {
                fail(state, jobId, failureFor(submission, FailureKind.SUBMISSION_FAILURE));
                return;
            }

            JobRecord submitted = state.job(jobId).submitted(submission.payload(), "Extracting text...");
            state.replace(submitted);
            publishJob("job-progress", state, submitted, "Submitted to grading service");

            pollUntilDone(state, jobId, submission.payload(), cancellation);
        } catch (DocumentRejectedException e) {
            fail(state, jobId, JobFailure.of(FailureKind.SUBMISSION_FAILURE, e.getMessage()));
        } catch (AggregationException e) {
            fail(state, jobId, JobFailure.of(FailureKind.AGGREGATION_ERROR, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Job {} in batch {} failed unexpectedly: {}", jobId, state.id(), e.getMessage(), e);
            FailureKind kind = state.job(jobId).status() == JobStatus.UPLOADING
                    ? FailureKind.SUBMISSION_FAILURE
                    : FailureKind.POLLING_FAILURE;
            fail(state, jobId, JobFailure.of(kind, e.getMessage()));
        }
    }

    private void pollUntilDone(BatchState state, int jobId, String externalJobId, CancellationToken cancellation) {
        Duration interval = properties.getPolling().getInterval();
        int maxPolls = properties.getPolling().getMaxPolls();
        int polls = 0;

        while (true) {
            if (cancellation.isCancellationRequested()) {
                fail(state, jobId, JobFailure.of(FailureKind.CANCELLED, "Cancelled by user"));
                return;
            }
            if (maxPolls > 0 && polls >= maxPolls) {
                fail(state, jobId, JobFailure.of(FailureKind.POLLING_FAILURE,
                        "No result after " + polls + " status checks"));
                return;
            }

            try {
                sleeper.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail(state, jobId, JobFailure.of(FailureKind.CANCELLED, "Interrupted while waiting for the grading service"));
                return;
            }
            if (cancellation.isCancellationRequested()) {
                fail(state, jobId, JobFailure.of(FailureKind.CANCELLED, "Cancelled by user"));
                return;
            }

            polls++;
            CallOutcome<PipelineStatus> polled = rateLimitedClient.call(
                    "status " + externalJobId,
                    () -> gradingClient.pollStatus(externalJobId),
                    cancellation,
                    backoffListener(state, jobId)
            );
            recordDelay(state, jobId, polled);
            if (!polled.isSuccess()) {
                fail(state, jobId, failureFor(polled, FailureKind.POLLING_FAILURE));
                return;
            }

            PipelineStatus status = polled.payload();
            switch (status.state()) {
                case PROCESSING -> advance(state, jobId, status.stage());
                case FAILED -> {
                    String error = status.error() == null || status.error().isBlank()
                            ? "Grading service reported failure" + (status.stage() == null ? "" : " at " + status.stage())
                            : status.error();
                    fail(state, jobId, JobFailure.of(FailureKind.POLLING_FAILURE, error));
                    return;
                }
                case COMPLETED -> {
                    complete(state, jobId, externalJobId, cancellation);
                    return;
                }
            }
        }
    }

    private void advance(BatchState state, int jobId, String stage) {
        JobRecord current = state.job(jobId);
        JobStatus phase = StageMapper.phaseFor(stage, current.status());
        String detail = stage == null || stage.isBlank() ? current.stageDetail() : stage;
        if (phase == current.status() && Objects.equals(detail, current.stageDetail())) {
            return;
        }
        JobRecord advanced = current.advancedTo(phase, detail);
        state.replace(advanced);
        publishJob("job-progress", state, advanced, detail == null ? phase.name() : detail);
    }

    private void complete(BatchState state, int jobId, String externalJobId, CancellationToken cancellation) {
        update(state, jobId, job -> job.advancedTo(JobStatus.GRADING, "Fetching results..."));

        CallOutcome<RawGrade> fetched = rateLimitedClient.call(
                "result " + externalJobId,
                () -> gradingClient.fetchResult(externalJobId),
                cancellation,
                backoffListener(state, jobId)
        );
        recordDelay(state, jobId, fetched);
        if (!fetched.isSuccess()) {
            fail(state, jobId, failureFor(fetched, FailureKind.POLLING_FAILURE));
            return;
        }

        AggregatedResult result = scoreAggregator.aggregate(fetched.payload(), sectionSpecs, state.mode());
        JobRecord completed = state.job(jobId).completed(result, now());
        state.replace(completed);
        archive(state, completed);

        log.info("Batch {}: {} scored {}/{} ({})", state.id(), completed.sourceDocument(),
                result.grandTotal(), result.maxPossible(), result.passed() ? "PASS" : "FAIL");
        publishJob("job-completed", state, completed, "Evaluation complete");
    }

    private void archive(BatchState state, JobRecord job) {
        AggregatedResult result = job.result();
        try {
            archiveRepository.save(new ArchivedResult(
                    state.id(),
                    job.id(),
                    job.attempt(),
                    job.sourceDocument(),
                    job.externalJobId(),
                    state.mode().name(),
                    result.grandTotal(),
                    result.maxPossible(),
                    result.passed(),
                    objectMapper.writeValueAsString(EvaluationResultView.from(result)),
                    job.endedAt()
            ));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to archive result of {} in batch {}: {}", job.sourceDocument(), state.id(), e.getMessage());
        }
    }

    private void fail(BatchState state, int jobId, JobFailure failure) {
        JobRecord current = state.job(jobId);
        if (current.status().isTerminal()) {
            return;
        }
        JobRecord failed = current.failed(failure, now());
        state.replace(failed);

        if (failure.isCancellation()) {
            log.info("Batch {}: {} cancelled", state.id(), failed.sourceDocument());
        } else {
            log.warn("Batch {}: {} failed ({}): {}", state.id(), failed.sourceDocument(), failure.kind(),
                    failure.message());
        }
        publishJob("job-failed", state, failed, failure.message() == null ? failure.kind().name() : failure.message());
    }

    private static JobFailure failureFor(CallOutcome<?> outcome, FailureKind serviceErrorKind) {
        return switch (outcome.kind()) {
            case RATE_LIMIT_EXHAUSTED -> JobFailure.of(FailureKind.RATE_LIMIT_EXHAUSTED, outcome.message());
            case CANCELLED -> JobFailure.of(FailureKind.CANCELLED, "Cancelled by user");
            case SERVICE_ERROR -> JobFailure.of(serviceErrorKind, outcome.message());
            case SUCCESS -> throw new IllegalArgumentException("Not a failed call");
        };
    }

    private RateLimitedClient.BackoffListener backoffListener(BatchState state, int jobId) {
        return (operation, retry, maxRetries, delay) -> {
            String detail = "Rate limited, retry " + retry + "/" + maxRetries + " in " + delay.toSeconds() + "s";
            update(state, jobId, job -> job.withStageDetail(detail));
            eventService.publish("job-rate-limited", state.id(), detail, Map.of(
                    "jobId", jobId,
                    "retry", retry,
                    "delayMs", delay.toMillis()
            ));
        };
    }

    private void recordDelay(BatchState state, int jobId, CallOutcome<?> outcome) {
        update(state, jobId, job -> job.withAddedDelay(outcome.waited()));
    }

    private void update(BatchState state, int jobId, UnaryOperator<JobRecord> change) {
        state.replace(change.apply(state.job(jobId)));
    }

    private void publishJob(String type, BatchState state, JobRecord job, String message) {
        eventService.publish(type, state.id(), message, Map.of(
                "jobId", job.id(),
                "document", job.sourceDocument(),
                "status", job.status().name(),
                "attempt", job.attempt()
        ));
    }

    private Map<String, Object> reportEntry(JobRecord job) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("jobId", job.id());
        entry.put("document", job.sourceDocument());
        entry.put("status", job.status().name());
        entry.put("attempt", job.attempt());
        entry.put("rateLimitDelayMs", job.rateLimitDelay().toMillis());
        if (job.result() != null) {
            entry.put("grandTotal", job.result().grandTotal());
            entry.put("maxPossible", job.result().maxPossible());
            entry.put("result", job.result().passed() ? "PASS" : "FAIL");
        }
        if (job.failure() != null) {
            entry.put("failure", job.failure().kind().name());
            entry.put("error", job.failure().message());
        }
        return entry;
    }

    private void writeReport(String batchId, Map<String, Object> report) {
        try {
            Path reportDir = Path.of(properties.getOutput().getReportDir());
            Files.createDirectories(reportDir);
            Path reportPath = reportDir.resolve("batch-" + batchId + ".json");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
        } catch (IOException e) {
            log.warn("Failed to write report for batch {}: {}", batchId, e.getMessage());
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
