package com.kmg.grading.dto;

import com.kmg.grading.model.ScoringMode;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record CreateBatchRequest(
        @NotBlank String questionPaper,
        @NotBlank String answerKey,
        ScoringMode mode,
        List<String> students
) {
}
