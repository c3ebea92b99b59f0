package com.kmg.grading.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmg.grading.model.AggregatedResult;

import java.util.List;

/**
 * Published result contract. Field names are fixed; the top-level question lists span all sections in
 * section order.
 */
public record EvaluationResultView(
        @JsonProperty("retained_questions") List<String> retainedQuestions,
        @JsonProperty("discarded_questions") List<String> discardedQuestions,
        List<SectionResultView> sections,
        @JsonProperty("grand_total") double grandTotal,
        @JsonProperty("max_marks") double maxMarks,
        double percentage,
        String grade,
        String result,
        @JsonProperty("overall_feedback") String overallFeedback,
        @JsonProperty("audit_log") List<String> auditLog
) {
    public static EvaluationResultView from(AggregatedResult aggregated) {
        return new EvaluationResultView(
                aggregated.sections().stream().flatMap(s -> s.retainedQuestions().stream()).toList(),
                aggregated.sections().stream().flatMap(s -> s.discardedQuestions().stream()).toList(),
                aggregated.sections().stream().map(SectionResultView::from).toList(),
                aggregated.grandTotal(),
                aggregated.maxPossible(),
                aggregated.percentage(),
                aggregated.grade(),
                aggregated.passed() ? "PASS" : "FAIL",
                aggregated.overallFeedback(),
                aggregated.auditLog()
        );
    }

    public SectionResultView section(String name) {
        return sections.stream()
                .filter(s -> s.section().equals(name))
                .findFirst()
                .orElse(null);
    }
}
