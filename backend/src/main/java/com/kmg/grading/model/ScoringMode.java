package com.kmg.grading.model;

import java.util.Locale;

/**
 * Grading strictness requested from the grading service. Strict grading awards whole marks only
 * (short-answer and true/false items); liberal grading allows partial credit on multi-mark questions.
 */
public enum ScoringMode {
    STRICT,
    LIBERAL;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
