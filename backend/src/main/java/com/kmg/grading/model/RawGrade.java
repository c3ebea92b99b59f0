package com.kmg.grading.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record RawGrade(
        List<SectionGrade> sections,
        Verdict verdict,
        String overallFeedback
) {
    public RawGrade {
        sections = sections == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(sections));
    }
}
