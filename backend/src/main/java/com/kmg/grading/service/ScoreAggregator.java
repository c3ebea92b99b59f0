package com.kmg.grading.service;

import com.kmg.grading.config.GradingProperties;
import com.kmg.grading.model.AggregatedResult;
import com.kmg.grading.model.QuestionGrade;
import com.kmg.grading.model.RawGrade;
import com.kmg.grading.model.ScoringMode;
import com.kmg.grading.model.SectionGrade;
import com.kmg.grading.model.SectionResult;
import com.kmg.grading.model.SectionSpec;
import com.kmg.grading.model.Verdict;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns per-question grades into section and grand totals.
 *
 * <p>In a section where the student answered the drop threshold (or more), only the best
 * {@code threshold - 1} answers count; the rest stay in the output as discarded. Ranking is by awarded
 * marks, and on a tie the lexicographically later question id is the one discarded. The same inputs
 * always give the same result.
 *
 * <p>A grade with no sections at all is rejected. A configured section missing from an otherwise
 * populated grade counts as not attempted.
 */
@Service
public class ScoreAggregator {
    private static final Comparator<QuestionGrade> BEST_FIRST = Comparator
            .comparing(QuestionGrade::awardedMarks, Comparator.reverseOrder())
            .thenComparing(QuestionGrade::questionId);

    private final double passThreshold;

    @Autowired
    public ScoreAggregator(GradingProperties properties) {
        this(properties.getScoring().getPassThreshold());
    }

    public ScoreAggregator(double passThreshold) {
        if (passThreshold < 0 || passThreshold > 1) {
            throw new IllegalArgumentException("Pass threshold must be between 0 and 1: " + passThreshold);
        }
        this.passThreshold = passThreshold;
    }

    public AggregatedResult aggregate(RawGrade rawGrade, List<SectionSpec> sectionSpecs, ScoringMode mode) {
        if (rawGrade == null) {
            throw new AggregationException("No grade data returned.");
        }
        if (sectionSpecs == null || sectionSpecs.isEmpty()) {
            throw new AggregationException("No sections configured.");
        }
        if (rawGrade.sections().isEmpty()) {
            throw new AggregationException("No section data returned.");
        }

        Map<String, SectionGrade> gradedSections = indexSections(rawGrade, sectionSpecs);
        List<SectionResult> sections = new ArrayList<>();
        List<String> auditLog = new ArrayList<>();
        List<String> breakdown = new ArrayList<>();
        double grandTotal = 0;
        double maxPossible = 0;

        for (SectionSpec spec : sectionSpecs) {
            SectionGrade graded = gradedSections.get(spec.section());
            SectionResult section = aggregateSection(spec, graded, mode, auditLog);
            sections.add(section);
            grandTotal += section.sectionTotal();
            maxPossible += section.sectionMax();
            breakdown.add(describeSection(section, graded));
        }

        double percentage = maxPossible > 0 ? Math.round(grandTotal / maxPossible * 1000) / 10.0 : 0.0;
        boolean passed = rawGrade.verdict() != null
                ? rawGrade.verdict() == Verdict.PASS
                : maxPossible > 0 && grandTotal / maxPossible >= passThreshold;
        String feedback = rawGrade.overallFeedback() != null && !rawGrade.overallFeedback().isBlank()
                ? rawGrade.overallFeedback()
                : overallFeedback(passed, grandTotal, maxPossible, percentage, breakdown);

        return new AggregatedResult(sections, grandTotal, maxPossible, percentage, gradeFor(percentage), passed,
                feedback, auditLog);
    }

    private Map<String, SectionGrade> indexSections(RawGrade rawGrade, List<SectionSpec> sectionSpecs) {
        Set<String> known = new HashSet<>();
        sectionSpecs.forEach(spec -> known.add(normalizeSection(spec.section())));

        Map<String, SectionGrade> indexed = new LinkedHashMap<>();
        for (SectionGrade section : rawGrade.sections()) {
            if (section == null || section.section() == null || section.section().isBlank()) {
                throw new AggregationException("Graded section without a name.");
            }
            String key = normalizeSection(section.section());
            if (!known.contains(key)) {
                throw new AggregationException("Grade contains unknown section " + section.section());
            }
            if (indexed.put(key, section) != null) {
                throw new AggregationException("Section " + section.section() + " was graded twice.");
            }
        }

        Map<String, SectionGrade> bySpecName = new LinkedHashMap<>();
        for (SectionSpec spec : sectionSpecs) {
            SectionGrade graded = indexed.get(normalizeSection(spec.section()));
            if (graded != null) {
                bySpecName.put(spec.section(), graded);
            }
        }
        return bySpecName;
    }

    private SectionResult aggregateSection(SectionSpec spec, SectionGrade graded, ScoringMode mode,
                                           List<String> auditLog) {
        List<QuestionGrade> answered = answeredQuestions(spec, graded, mode);
        List<QuestionGrade> ranked = answered.stream().sorted(BEST_FIRST).toList();

        int keep = ranked.size() >= spec.dropThreshold() ? spec.retainedSlots() : ranked.size();
        List<QuestionGrade> retained = ranked.subList(0, keep).stream()
                .sorted(Comparator.comparing(QuestionGrade::questionId))
                .toList();
        List<QuestionGrade> discarded = ranked.subList(keep, ranked.size()).stream()
                .sorted(Comparator.comparing(QuestionGrade::questionId))
                .toList();

        double sectionTotal = 0;
        double sectionMax = 0;
        for (QuestionGrade question : retained) {
            sectionTotal += question.awardedMarks();
            sectionMax += question.maxMarks();
        }
        int unansweredSlots = Math.max(0, spec.retainedSlots() - retained.size());
        sectionMax += unansweredSlots * spec.questionMax();

        for (QuestionGrade dropped : discarded) {
            auditLog.add("Dropped " + dropped.questionId() + " (lowest in Section " + spec.section() + ", "
                    + formatMarks(dropped.awardedMarks()) + "/" + formatMarks(dropped.maxMarks()) + ")");
        }

        return new SectionResult(
                spec.section(),
                retained.stream().map(QuestionGrade::questionId).toList(),
                discarded.stream().map(QuestionGrade::questionId).toList(),
                sectionTotal,
                sectionMax
        );
    }

    private List<QuestionGrade> answeredQuestions(SectionSpec spec, SectionGrade graded, ScoringMode mode) {
        if (graded == null) {
            return List.of();
        }

        Map<String, QuestionGrade> byId = new TreeMap<>();
        for (QuestionGrade question : graded.questions()) {
            if (question == null || question.questionId() == null || question.questionId().isBlank()) {
                throw new AggregationException("Section " + spec.section() + " has a grade without a question id.");
            }
            if (byId.put(question.questionId(), question) != null) {
                throw new AggregationException("Question " + question.questionId() + " in section "
                        + spec.section() + " was graded twice.");
            }
        }

        List<String> answeredIds = graded.answeredQuestionIds().isEmpty()
                ? new ArrayList<>(byId.keySet())
                : graded.answeredQuestionIds();

        Set<String> seen = new HashSet<>();
        List<QuestionGrade> answered = new ArrayList<>();
        for (String questionId : answeredIds) {
            if (questionId == null || questionId.isBlank()) {
                throw new AggregationException("Section " + spec.section() + " lists a blank answered question.");
            }
            if (!seen.add(questionId)) {
                throw new AggregationException("Question " + questionId + " is listed twice in section "
                        + spec.section());
            }
            QuestionGrade question = byId.get(questionId);
            if (question == null) {
                throw new AggregationException("Answered question " + questionId + " in section "
                        + spec.section() + " has no grade.");
            }
            validate(spec, question, mode);
            answered.add(question);
        }
        return answered;
    }

    private void validate(SectionSpec spec, QuestionGrade question, ScoringMode mode) {
        String label = question.questionId() + " (section " + spec.section() + ")";
        Double awarded = question.awardedMarks();
        Double max = question.maxMarks();
        if (awarded == null || max == null) {
            throw new AggregationException("Question " + label + " is missing its marks.");
        }
        if (!Double.isFinite(awarded) || !Double.isFinite(max)) {
            throw new AggregationException("Question " + label + " has non-numeric marks.");
        }
        if (max <= 0) {
            throw new AggregationException("Question " + label + " has non-positive max marks " + max);
        }
        if (awarded < 0) {
            throw new AggregationException("Question " + label + " has negative marks " + awarded);
        }
        if (awarded > max) {
            throw new AggregationException("Question " + label + " awarded " + awarded + " out of " + max);
        }
        if (mode == ScoringMode.STRICT && awarded != Math.rint(awarded)) {
            throw new AggregationException("Question " + label + " has fractional marks " + awarded
                    + " under strict scoring.");
        }
    }

    private String describeSection(SectionResult section, SectionGrade graded) {
        String line = "Section " + section.section() + ": " + formatMarks(section.sectionTotal()) + "/"
                + formatMarks(section.sectionMax());
        if (graded == null) {
            return line + " (not attempted)";
        }
        if (!section.discardedQuestions().isEmpty()) {
            return line + " (dropped " + String.join(", ", section.discardedQuestions()) + ")";
        }
        return line;
    }

    private String overallFeedback(boolean passed, double grandTotal, double maxPossible, double percentage,
                                   List<String> breakdown) {
        StringBuilder feedback = new StringBuilder();
        feedback.append("Result: ").append(passed ? "PASS" : "FAIL").append('\n');
        feedback.append(performanceRemark(percentage)).append('\n');
        feedback.append("\nSection breakdown:\n");
        for (String line : breakdown) {
            feedback.append("  - ").append(line).append('\n');
        }
        feedback.append("\nFinal Score: ").append(formatMarks(grandTotal)).append('/')
                .append(formatMarks(maxPossible)).append(" (").append(percentage).append("%)");
        return feedback.toString();
    }

    private String performanceRemark(double percentage) {
        if (percentage >= 80) {
            return "Excellent performance! Strong understanding of concepts.";
        }
        if (percentage >= 60) {
            return "Good performance with solid grasp of fundamentals.";
        }
        if (percentage >= 50) {
            return "Average performance. Some concepts need more attention.";
        }
        if (percentage >= 40) {
            return "Below average. Focus on understanding core concepts.";
        }
        return "Needs significant improvement. Review all topics thoroughly.";
    }

    static String gradeFor(double percentage) {
        if (percentage >= 90) {
            return "O";
        }
        if (percentage >= 80) {
            return "A+";
        }
        if (percentage >= 70) {
            return "A";
        }
        if (percentage >= 60) {
            return "B+";
        }
        if (percentage >= 55) {
            return "B";
        }
        if (percentage >= 50) {
            return "C";
        }
        if (percentage >= 45) {
            return "D";
        }
        return "F";
    }

    private static String normalizeSection(String section) {
        return section.trim().toUpperCase(Locale.ROOT);
    }

    private static String formatMarks(double marks) {
        if (marks == Math.rint(marks)) {
            return String.valueOf((long) marks);
        }
        return String.valueOf(marks);
    }

    public static class AggregationException extends RuntimeException {
        public AggregationException(String message) {
            super(message);
        }
    }
}
