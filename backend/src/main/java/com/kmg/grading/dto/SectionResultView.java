package com.kmg.grading.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmg.grading.model.SectionResult;

import java.util.List;

public record SectionResultView(
        String section,
        @JsonProperty("retained_questions") List<String> retainedQuestions,
        @JsonProperty("discarded_questions") List<String> discardedQuestions,
        @JsonProperty("section_total") double sectionTotal,
        @JsonProperty("section_max") double sectionMax
) {
    public static SectionResultView from(SectionResult section) {
        return new SectionResultView(
                section.section(),
                section.retainedQuestions(),
                section.discardedQuestions(),
                section.sectionTotal(),
                section.sectionMax()
        );
    }
}
