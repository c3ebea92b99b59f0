package com.kmg.grading.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Grades the grading service returned for one section. {@code answeredQuestionIds} lists what the
 * student actually attempted; when it is empty every graded question counts as answered. Null entries
 * are kept so that aggregation can reject them.
 */
public record SectionGrade(
        String section,
        List<String> answeredQuestionIds,
        List<QuestionGrade> questions
) {
    public SectionGrade {
        answeredQuestionIds = answeredQuestionIds == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(answeredQuestionIds));
        questions = questions == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(questions));
    }
}
