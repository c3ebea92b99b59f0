package com.kmg.grading.model;

import java.util.Locale;

public enum Verdict {
    PASS,
    FAIL;

    public static Verdict parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "PASS", "PASSED" -> PASS;
            case "FAIL", "FAILED" -> FAIL;
            default -> null;
        };
    }
}
