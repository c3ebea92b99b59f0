package com.kmg.grading.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.grading.client.GradingServiceClient;
import com.kmg.grading.client.PipelineStatus;
import com.kmg.grading.config.GradingProperties;
import com.kmg.grading.dto.BatchProgress;
import com.kmg.grading.model.*;
import com.kmg.grading.repo.ArchivedResult;
import com.kmg.grading.repo.ResultArchiveRepository;
import com.kmg.grading.service.DocumentInspector.DocumentRejectedException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BatchOrchestratorTest {

    @TempDir
    Path tempDir;

    @Mock
    private ResultArchiveRepository archiveRepository;

    private final List<Duration> sleeps = new ArrayList<>();
    private final List<Runnable> queuedWork = new ArrayList<>();
    private final FakeGradingClient gradingClient = new FakeGradingClient();
    private final StatusReporter statusReporter = new StatusReporter();

    private GradingProperties properties;
    private MasterDocuments master;

    @BeforeEach
    void setUp() throws IOException {
        properties = new GradingProperties();
        properties.setBaseDir(tempDir.toString());
        properties.getOutput().setReportDir(tempDir.resolve("reports").toString());
        properties.getPolling().setMaxPolls(5);
        properties.getRetry().setMaxRetries(2);

        master = new MasterDocuments(
                DocumentRef.of(pdf("question-paper.pdf").toString()),
                DocumentRef.of(pdf("answer-key.pdf").toString())
        );
    }

    private BatchOrchestrator orchestrator(Executor worker) {
        Sleeper sleeper = sleeps::add;
        BatchOrchestrator orchestrator = new BatchOrchestrator(
                gradingClient,
                new RateLimitedClient(sleeper, properties.getRetry().getMaxRetries(), Duration.ofSeconds(5),
                        Duration.ofSeconds(80)),
                new ScoreAggregator(properties.getScoring().getPassThreshold()),
                new DocumentInspector(),
                archiveRepository,
                new EventService(Clock.systemUTC()),
                properties,
                new ObjectMapper(),
                sleeper,
                Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC),
                worker
        );
        gradingClient.orchestrator = orchestrator;
        return orchestrator;
    }

    private BatchOrchestrator inlineOrchestrator() {
        return orchestrator(Runnable::run);
    }

    private Path pdf(String name) throws IOException {
        Path file = tempDir.resolve(name);
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            document.save(file.toFile());
        }
        return file;
    }

    private String batchWithStudents(BatchOrchestrator orchestrator, String... names) throws IOException {
        String batchId = orchestrator.createBatch(master, ScoringMode.LIBERAL);
        List<DocumentRef> students = new ArrayList<>();
        for (String name : names) {
            students.add(DocumentRef.of(pdf(name).toString()));
        }
        assertThat(orchestrator.addSubmissions(batchId, students)).isEqualTo(names.length);
        gradingClient.batchId = batchId;
        return batchId;
    }

    private static RawGrade sectionAGrade(double q1, double q2, double q3) {
        return new RawGrade(List.of(new SectionGrade("A", List.of("Q1", "Q2", "Q3"), List.of(
                new QuestionGrade("Q1", q1, 5.0, null),
                new QuestionGrade("Q2", q2, 5.0, null),
                new QuestionGrade("Q3", q3, 5.0, null)
        ))), null, null);
    }

    @Test
    void evaluatesEveryStudentInOrderOneAtATime() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = batchWithStudents(orchestrator, "alice.pdf", "bob.pdf", "carol.pdf");

        orchestrator.startBatch(batchId);

        BatchSnapshot batch = orchestrator.getBatch(batchId);
        assertThat(batch.jobs()).extracting(JobRecord::status).containsOnly(JobStatus.COMPLETED);
        assertThat(batch.processing()).isFalse();
        assertThat(gradingClient.submitted).containsExactly("alice.pdf", "bob.pdf", "carol.pdf");
        assertThat(gradingClient.maxInFlightSeen).isEqualTo(1);

        SectionResult sectionA = batch.jobs().get(0).result().sections().get(0);
        assertThat(sectionA.retainedQuestions()).containsExactly("Q1", "Q2");
        assertThat(sectionA.discardedQuestions()).containsExactly("Q3");
        assertThat(sectionA.sectionTotal()).isEqualTo(9.0);
        assertThat(batch.jobs().get(0).externalJobId()).isEqualTo("ext-alice.pdf");

        verify(archiveRepository, times(3)).save(any(ArchivedResult.class));
        assertThat(Files.exists(tempDir.resolve("reports").resolve("batch-" + batchId + ".json"))).isTrue();
        assertThat(statusReporter.report(batch).statusText()).isEqualTo("All evaluations completed successfully!");
    }

    @Test
    void relaysPipelineStagesWithoutMovingBackwards() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = batchWithStudents(orchestrator, "alice.pdf");
        List<JobStatus> seenAtPoll = new ArrayList<>();
        gradingClient.onPoll = (document, poll) -> seenAtPoll.add(orchestrator.getJob(batchId, 0).status());

        orchestrator.startBatch(batchId);

        assertThat(seenAtPoll).containsExactly(JobStatus.EXTRACTING, JobStatus.EXTRACTING, JobStatus.GRADING);
        assertThat(sleeps).hasSize(3).containsOnly(Duration.ofSeconds(3));
    }

    @Test
    void failedSubmissionDoesNotBlockTheNextStudent() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = batchWithStudents(orchestrator, "alice.pdf", "bob.pdf", "carol.pdf");
        gradingClient.rejectSubmission.add("bob.pdf");

        orchestrator.startBatch(batchId);

        BatchSnapshot batch = orchestrator.getBatch(batchId);
        assertThat(batch.jobs()).extracting(JobRecord::status)
                .containsExactly(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.COMPLETED);
        assertThat(batch.jobs().get(1).failure().kind()).isEqualTo(FailureKind.SUBMISSION_FAILURE);
        assertThat(statusReporter.report(batch).statusText()).isEqualTo("Completed with 1 error");
    }

    @Test
    void cancellingDuringPollingStopsTheBatch() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = batchWithStudents(orchestrator, "alice.pdf", "bob.pdf", "carol.pdf");
        gradingClient.onPoll = (document, poll) -> {
            if (document.equals("bob.pdf") && poll == 1) {
                orchestrator.cancelBatch(batchId);
            }
        };

        orchestrator.startBatch(batchId);

        BatchSnapshot batch = orchestrator.getBatch(batchId);
        assertThat(batch.jobs().get(0).status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(batch.jobs().get(1).status()).isEqualTo(JobStatus.FAILED);
        assertThat(batch.jobs().get(1).failure().isCancellation()).isTrue();
        assertThat(batch.jobs().get(2).status()).isEqualTo(JobStatus.WAITING);
        assertThat(gradingClient.submitted).doesNotContain("carol.pdf");

        BatchProgress progress = statusReporter.report(batch);
        assertThat(progress.statusText()).isEqualTo("Cancelled after 2 of 3 students");
        assertThat(progress.cancelled()).isEqualTo(1);
        assertThat(progress.waiting()).isEqualTo(1);
    }

    @Test
    void pollBudgetFailsAJobThatNeverFinishes() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = batchWithStudents(orchestrator, "alice.pdf", "bob.pdf");
        gradingClient.neverComplete.add("alice.pdf");

        orchestrator.startBatch(batchId);

        JobRecord alice = orchestrator.getJob(batchId, 0);
        assertThat(alice.status()).isEqualTo(JobStatus.FAILED);
        assertThat(alice.failure().kind()).isEqualTo(FailureKind.POLLING_FAILURE);
        assertThat(alice.failure().message()).isEqualTo("No result after 5 status checks");
        assertThat(gradingClient.polls.get("alice.pdf")).isEqualTo(5);
        assertThat(orchestrator.getJob(batchId, 1).status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void upstreamFailureCarriesTheServiceError() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = batchWithStudents(orchestrator, "alice.pdf");
        gradingClient.upstreamFailure.put("alice.pdf", "OCR produced no text");

        orchestrator.startBatch(batchId);

        JobRecord alice = orchestrator.getJob(batchId, 0);
        assertThat(alice.failure()).isEqualTo(JobFailure.of(FailureKind.POLLING_FAILURE, "OCR produced no text"));
        assertThat(statusReporter.report(orchestrator.getBatch(batchId)).statusText())
                .isEqualTo("All evaluations failed");
    }

    @Test
    void persistentRateLimitFailsTheJobAndRecordsTheDelay() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = batchWithStudents(orchestrator, "alice.pdf");
        gradingClient.rateLimitSubmission.add("alice.pdf");

        orchestrator.startBatch(batchId);

        JobRecord alice = orchestrator.getJob(batchId, 0);
        assertThat(alice.failure().kind()).isEqualTo(FailureKind.RATE_LIMIT_EXHAUSTED);
        assertThat(alice.rateLimitDelay()).isEqualTo(Duration.ofSeconds(4));
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @Test
    void malformedGradeIsAnAggregationError() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = batchWithStudents(orchestrator, "alice.pdf", "bob.pdf");
        gradingClient.results.put("alice.pdf", sectionAGrade(7, 5, 3));

        orchestrator.startBatch(batchId);

        assertThat(orchestrator.getJob(batchId, 0).failure().kind()).isEqualTo(FailureKind.AGGREGATION_ERROR);
        assertThat(orchestrator.getJob(batchId, 1).status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void unreadableStudentDocumentIsNeverSubmitted() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = orchestrator.createBatch(master, ScoringMode.STRICT);
        Path notPdf = Files.writeString(tempDir.resolve("scan.pdf"), "not a pdf");
        orchestrator.addSubmissions(batchId, List.of(DocumentRef.of(notPdf.toString())));
        gradingClient.batchId = batchId;

        orchestrator.startBatch(batchId);

        JobRecord job = orchestrator.getJob(batchId, 0);
        assertThat(job.failure().kind()).isEqualTo(FailureKind.SUBMISSION_FAILURE);
        assertThat(gradingClient.submitted).isEmpty();
    }

    @Test
    void retryRunsAFailedJobAgainAsANewAttempt() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = batchWithStudents(orchestrator, "alice.pdf", "bob.pdf");
        gradingClient.rejectSubmission.add("bob.pdf");
        orchestrator.startBatch(batchId);
        assertThat(orchestrator.getJob(batchId, 1).status()).isEqualTo(JobStatus.FAILED);

        gradingClient.rejectSubmission.clear();
        orchestrator.retryJob(batchId, 1);

        JobRecord bob = orchestrator.getJob(batchId, 1);
        assertThat(bob.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(bob.attempt()).isEqualTo(2);
        assertThat(bob.sourceDocument()).isEqualTo("bob.pdf");

        ArgumentCaptor<ArchivedResult> archived = ArgumentCaptor.forClass(ArchivedResult.class);
        verify(archiveRepository, times(2)).save(archived.capture());
        assertThat(archived.getAllValues()).extracting(ArchivedResult::sourceDocument, ArchivedResult::attempt)
                .containsExactly(
                        tuple("alice.pdf", 1),
                        tuple("bob.pdf", 2)
                );
    }

    @Test
    void onlyFailedJobsCanBeRetried() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = batchWithStudents(orchestrator, "alice.pdf");
        orchestrator.startBatch(batchId);

        assertThatThrownBy(() -> orchestrator.retryJob(batchId, 0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("COMPLETED");
    }

    @Test
    void queuedRetryIsCancelledWithTheBatch() throws IOException {
        BatchOrchestrator orchestrator = orchestrator(queuedWork::add);
        String batchId = batchWithStudents(orchestrator, "alice.pdf");
        gradingClient.rejectSubmission.add("alice.pdf");
        orchestrator.startBatch(batchId);
        runQueuedWork();
        gradingClient.rejectSubmission.clear();

        orchestrator.retryJob(batchId, 0);
        assertThat(orchestrator.getJob(batchId, 0).status()).isEqualTo(JobStatus.WAITING);
        orchestrator.cancelBatch(batchId);
        runQueuedWork();

        JobRecord alice = orchestrator.getJob(batchId, 0);
        assertThat(alice.attempt()).isEqualTo(2);
        assertThat(alice.failure().kind()).isEqualTo(FailureKind.CANCELLED);
        assertThat(gradingClient.submitted).isEmpty();
    }

    @Test
    void onlyOneBatchRunsAtATime() throws IOException {
        BatchOrchestrator orchestrator = orchestrator(queuedWork::add);
        String first = batchWithStudents(orchestrator, "alice.pdf");
        String second = orchestrator.createBatch(master, ScoringMode.LIBERAL);
        orchestrator.addSubmissions(second, List.of(DocumentRef.of(pdf("bob.pdf").toString())));

        orchestrator.startBatch(first);

        assertThat(statusReporter.report(orchestrator.getBatch(first)).statusText())
                .isEqualTo("Starting evaluation...");
        assertThatThrownBy(() -> orchestrator.startBatch(second))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Another batch is already running.");

        runQueuedWork();
        orchestrator.startBatch(second);
        runQueuedWork();
        assertThat(orchestrator.getJob(second, 0).status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void startedBatchRejectsSecondStartAndNewSubmissions() throws IOException {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = batchWithStudents(orchestrator, "alice.pdf");
        orchestrator.startBatch(batchId);

        assertThatThrownBy(() -> orchestrator.startBatch(batchId)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> orchestrator.addSubmissions(batchId, List.of(DocumentRef.of(pdf("late.pdf").toString()))))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> orchestrator.removeSubmission(batchId, 0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyBatchCannotStart() {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = orchestrator.createBatch(master, null);

        assertThat(orchestrator.getBatch(batchId).mode()).isEqualTo(ScoringMode.LIBERAL);
        assertThatThrownBy(() -> orchestrator.startBatch(batchId))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no student submissions");
        assertThatThrownBy(() -> orchestrator.startBatch(batchId))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void submissionsAreDedupedAndCapped() throws IOException {
        properties.getBatch().setMaxStudents(2);
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = orchestrator.createBatch(master, ScoringMode.LIBERAL);
        DocumentRef alice = DocumentRef.of(pdf("alice.pdf").toString());

        int accepted = orchestrator.addSubmissions(batchId, List.of(
                alice,
                alice,
                DocumentRef.of(pdf("bob.pdf").toString()),
                DocumentRef.of(pdf("carol.pdf").toString())
        ));

        assertThat(accepted).isEqualTo(2);
        assertThat(orchestrator.getBatch(batchId).pendingSubmissions()).extracting(DocumentRef::name)
                .containsExactly("alice.pdf", "bob.pdf");

        assertThat(orchestrator.removeSubmission(batchId, 0).name()).isEqualTo("alice.pdf");
        assertThatThrownBy(() -> orchestrator.removeSubmission(batchId, 5)).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void missingMasterDocumentIsRejected() {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        MasterDocuments missing = new MasterDocuments(
                DocumentRef.of(tempDir.resolve("nope.pdf").toString()), master.answerKey());

        assertThatThrownBy(() -> orchestrator.createBatch(missing, ScoringMode.LIBERAL))
                .isInstanceOf(DocumentRejectedException.class);
        assertThat(orchestrator.listBatches()).isEmpty();
    }

    @Test
    void unknownIdsAreReportedAsMissing() {
        BatchOrchestrator orchestrator = inlineOrchestrator();
        String batchId = orchestrator.createBatch(master, ScoringMode.LIBERAL);

        assertThatThrownBy(() -> orchestrator.getBatch("missing")).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> orchestrator.cancelBatch("missing")).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> orchestrator.getJob(batchId, 0)).isInstanceOf(NoSuchElementException.class);
    }

    private void runQueuedWork() {
        while (!queuedWork.isEmpty()) {
            queuedWork.remove(0).run();
        }
    }

    /**
     * Scripted grading pipeline keyed by student document name. Checks on every call that no more than one
     * job of the batch is in flight.
     */
    private static final class FakeGradingClient implements GradingServiceClient {
        private final Set<String> rejectSubmission = new HashSet<>();
        private final Set<String> rateLimitSubmission = new HashSet<>();
        private final Set<String> neverComplete = new HashSet<>();
        private final Map<String, String> upstreamFailure = new HashMap<>();
        private final Map<String, RawGrade> results = new HashMap<>();
        private final List<String> submitted = new ArrayList<>();
        private final Map<String, Integer> polls = new HashMap<>();
        private BiConsumer<String, Integer> onPoll = (document, poll) -> {
        };
        private BatchOrchestrator orchestrator;
        private String batchId;
        private int maxInFlightSeen;

        @Override
        public String submit(MasterDocuments masterDocuments, DocumentRef studentDocument, ScoringMode mode) {
            checkSequencing();
            if (rateLimitSubmission.contains(studentDocument.name())) {
                throw new RateLimitedException("429", Duration.ofSeconds(2));
            }
            if (rejectSubmission.contains(studentDocument.name())) {
                throw new ServiceCallException("upload rejected", 400);
            }
            submitted.add(studentDocument.name());
            return "ext-" + studentDocument.name();
        }

        @Override
        public PipelineStatus pollStatus(String externalJobId) {
            checkSequencing();
            String document = externalJobId.substring("ext-".length());
            int poll = polls.merge(document, 1, Integer::sum);
            onPoll.accept(document, poll);

            if (upstreamFailure.containsKey(document)) {
                return new PipelineStatus(PipelineStatus.State.FAILED, "OCR", upstreamFailure.get(document));
            }
            if (!neverComplete.contains(document) && poll > 2) {
                return new PipelineStatus(PipelineStatus.State.COMPLETED, "Done", null);
            }
            return new PipelineStatus(PipelineStatus.State.PROCESSING,
                    poll == 1 ? "Extracting text (OCR)" : "Evaluating Section A", null);
        }

        @Override
        public RawGrade fetchResult(String externalJobId) {
            String document = externalJobId.substring("ext-".length());
            return results.getOrDefault(document, sectionAGrade(4, 5, 3));
        }

        private void checkSequencing() {
            if (orchestrator == null || batchId == null) {
                return;
            }
            int inFlight = (int) orchestrator.getBatch(batchId).jobs().stream()
                    .filter(job -> job.status().isInFlight())
                    .count();
            maxInFlightSeen = Math.max(maxInFlightSeen, inFlight);
        }
    }
}
