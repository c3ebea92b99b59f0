package com.kmg.grading.model;

import java.util.Objects;

public record MasterDocuments(DocumentRef questionPaper, DocumentRef answerKey) {
    public MasterDocuments {
        Objects.requireNonNull(questionPaper, "A question paper is required.");
        Objects.requireNonNull(answerKey, "An answer key is required.");
    }
}
