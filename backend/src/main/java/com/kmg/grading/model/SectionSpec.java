package com.kmg.grading.model;

/**
 * Per-section scoring rule. A student who answers {@code dropThreshold} or more questions keeps only
 * the best {@code dropThreshold - 1}; {@code questionMax} is the value of a question slot the student
 * left unanswered.
 */
public record SectionSpec(String section, int dropThreshold, double questionMax) {
    public SectionSpec {
        if (section == null || section.isBlank()) {
            throw new IllegalArgumentException("Section name is required.");
        }
        if (dropThreshold < 2) {
            throw new IllegalArgumentException("Drop threshold must be at least 2 for section " + section);
        }
        if (questionMax <= 0) {
            throw new IllegalArgumentException("Question max must be positive for section " + section);
        }
    }

    public int retainedSlots() {
        return dropThreshold - 1;
    }
}
