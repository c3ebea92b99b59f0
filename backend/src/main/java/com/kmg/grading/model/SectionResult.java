package com.kmg.grading.model;

import java.util.List;

public record SectionResult(
        String section,
        List<String> retainedQuestions,
        List<String> discardedQuestions,
        double sectionTotal,
        double sectionMax
) {
    public SectionResult {
        retainedQuestions = List.copyOf(retainedQuestions);
        discardedQuestions = List.copyOf(discardedQuestions);
    }
}
