package com.kmg.grading.dto;

import com.kmg.grading.model.BatchSnapshot;
import com.kmg.grading.model.DocumentRef;
import com.kmg.grading.model.ScoringMode;

import java.util.List;

public record BatchView(
        String id,
        ScoringMode mode,
        String questionPaper,
        String answerKey,
        String createdAt,
        boolean started,
        boolean processing,
        boolean cancelled,
        List<String> pendingSubmissions,
        List<JobView> jobs,
        BatchProgress progress
) {
    public static BatchView from(BatchSnapshot snapshot, BatchProgress progress) {
        return new BatchView(
                snapshot.id(),
                snapshot.mode(),
                snapshot.masterDocuments().questionPaper().name(),
                snapshot.masterDocuments().answerKey().name(),
                snapshot.createdAt() == null ? null : snapshot.createdAt().toString(),
                snapshot.started(),
                snapshot.processing(),
                snapshot.cancelled(),
                snapshot.pendingSubmissions().stream().map(DocumentRef::name).toList(),
                snapshot.jobs().stream().map(JobView::from).toList(),
                progress
        );
    }
}
