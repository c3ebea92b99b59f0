package com.kmg.grading.service;

import com.kmg.grading.model.JobStatus;

import java.util.List;
import java.util.Locale;

/**
 * Maps the pipeline's free-text stage onto a job phase. Unrecognized stages keep the current phase and
 * a phase never moves backwards.
 */
public final class StageMapper {
    private static final List<String> EXTRACTION_MARKERS = List.of("OCR", "EXTRACT", "UPLOAD", "TEXT", "PARS");
    private static final List<String> GRADING_MARKERS = List.of("EVAL", "SECTION", "GRAD", "AGGREG", "SCOR", "FINAL");

    private StageMapper() {
    }

    public static JobStatus phaseFor(String stage, JobStatus current) {
        JobStatus floor = current.ordinal() < JobStatus.EXTRACTING.ordinal() ? JobStatus.EXTRACTING : current;
        if (stage == null || stage.isBlank()) {
            return floor;
        }

        String normalized = stage.toUpperCase(Locale.ROOT);
        JobStatus reported = null;
        if (GRADING_MARKERS.stream().anyMatch(normalized::contains)) {
            reported = JobStatus.GRADING;
        } else if (EXTRACTION_MARKERS.stream().anyMatch(normalized::contains)) {
            reported = JobStatus.EXTRACTING;
        }

        if (reported == null || reported.ordinal() < floor.ordinal()) {
            return floor;
        }
        return reported;
    }
}
