package com.kmg.grading.client;

import java.util.Locale;

/**
 * What the grading pipeline reports for a submitted document.
 */
public record PipelineStatus(State state, String stage, String error) {

    public enum State {
        PROCESSING,
        COMPLETED,
        FAILED;

        public static State parse(String value) {
            if (value == null) {
                return PROCESSING;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "completed", "complete", "done" -> COMPLETED;
                case "failed", "error" -> FAILED;
                default -> PROCESSING;
            };
        }
    }
}
