package com.kmg.grading.model;

public record QuestionGrade(
        String questionId,
        Double awardedMarks,
        Double maxMarks,
        String remarks
) {
}
