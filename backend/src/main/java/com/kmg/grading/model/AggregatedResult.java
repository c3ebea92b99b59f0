package com.kmg.grading.model;

import java.util.List;

public record AggregatedResult(
        List<SectionResult> sections,
        double grandTotal,
        double maxPossible,
        double percentage,
        String grade,
        boolean passed,
        String overallFeedback,
        List<String> auditLog
) {
    public AggregatedResult {
        sections = List.copyOf(sections);
        auditLog = List.copyOf(auditLog);
    }
}
