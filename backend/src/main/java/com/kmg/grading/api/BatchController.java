package com.kmg.grading.api;

import com.kmg.grading.dto.*;
import com.kmg.grading.model.BatchSnapshot;
import com.kmg.grading.model.DocumentRef;
import com.kmg.grading.model.JobRecord;
import com.kmg.grading.model.JobStatus;
import com.kmg.grading.model.MasterDocuments;
import com.kmg.grading.repo.ArchivedResult;
import com.kmg.grading.repo.ResultArchiveRepository;
import com.kmg.grading.service.BatchOrchestrator;
import com.kmg.grading.service.StatusReporter;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/batches")
public class BatchController {
    private final BatchOrchestrator orchestrator;
    private final StatusReporter statusReporter;
    private final ResultArchiveRepository archiveRepository;

    public BatchController(BatchOrchestrator orchestrator, StatusReporter statusReporter,
                           ResultArchiveRepository archiveRepository) {
        this.orchestrator = orchestrator;
        this.statusReporter = statusReporter;
        this.archiveRepository = archiveRepository;
    }

    @PostMapping
    public CreateBatchResponse createBatch(@Valid @RequestBody CreateBatchRequest request) {
        MasterDocuments master = new MasterDocuments(
                DocumentRef.of(request.questionPaper()),
                DocumentRef.of(request.answerKey())
        );
        String batchId = orchestrator.createBatch(master, request.mode());
        if (request.students() != null && !request.students().isEmpty()) {
            orchestrator.addSubmissions(batchId, toDocuments(request.students()));
        }
        return new CreateBatchResponse(batchId);
    }

    @GetMapping
    public List<BatchView> listBatches() {
        return orchestrator.listBatches().stream()
                .map(this::toView)
                .toList();
    }

    @GetMapping("/{id}")
    public BatchView getBatch(@PathVariable String id) {
        return toView(orchestrator.getBatch(id));
    }

    @PostMapping("/{id}/students")
    public AddStudentsResponse addStudents(@PathVariable String id, @Valid @RequestBody AddStudentsRequest request) {
        int accepted = orchestrator.addSubmissions(id, toDocuments(request.documents()));
        return new AddStudentsResponse(accepted, pendingNames(id));
    }

    @DeleteMapping("/{id}/students/{index}")
    public AddStudentsResponse removeStudent(@PathVariable String id, @PathVariable int index) {
        orchestrator.removeSubmission(id, index);
        return new AddStudentsResponse(0, pendingNames(id));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<Void> start(@PathVariable String id) {
        orchestrator.startBatch(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String id) {
        orchestrator.cancelBatch(id);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{id}/progress")
    public BatchProgress progress(@PathVariable String id) {
        return statusReporter.report(orchestrator.getBatch(id));
    }

    @GetMapping("/{id}/jobs/{jobId}")
    public JobView getJob(@PathVariable String id, @PathVariable int jobId) {
        return JobView.from(orchestrator.getJob(id, jobId));
    }

    @GetMapping("/{id}/jobs/{jobId}/result")
    public EvaluationResultView getJobResult(@PathVariable String id, @PathVariable int jobId) {
        JobRecord job = orchestrator.getJob(id, jobId);
        if (job.status() != JobStatus.COMPLETED) {
            throw new IllegalStateException("Job " + jobId + " has no result yet; it is " + job.status());
        }
        return EvaluationResultView.from(job.result());
    }

    @PostMapping("/{id}/jobs/{jobId}/retry")
    public ResponseEntity<Void> retry(@PathVariable String id, @PathVariable int jobId) {
        orchestrator.retryJob(id, jobId);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{id}/archive")
    public List<ArchivedResult> archivedResults(@PathVariable String id) {
        orchestrator.getBatch(id);
        return archiveRepository.findByBatchId(id);
    }

    private BatchView toView(BatchSnapshot snapshot) {
        return BatchView.from(snapshot, statusReporter.report(snapshot));
    }

    private List<String> pendingNames(String batchId) {
        return orchestrator.getBatch(batchId).pendingSubmissions().stream()
                .map(DocumentRef::name)
                .toList();
    }

    private static List<DocumentRef> toDocuments(List<String> paths) {
        return paths.stream()
                .map(DocumentRef::of)
                .toList();
    }
}
