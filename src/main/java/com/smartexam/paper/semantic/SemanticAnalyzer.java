package com.smartexam.paper.semantic;

import com.smartexam.paper.config.AnalysisSettings;
import com.smartexam.paper.domain.DomainModels.Difficulty;
import com.smartexam.paper.domain.DomainModels.QuestionNode;
import com.smartexam.paper.dsl.DslModels.PaperHeader;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

import static com.smartexam.paper.semantic.SemanticModels.*;

/**
 * Runs the five paper checks and folds them into a {@link SemanticReport}.
 * Total over its input: an empty question list produces SKIP and 0% results, never an exception.
 */
@Component
public class SemanticAnalyzer {
    static final int MARKS_FAIL_PENALTY = 20;
    static final int TIME_WARN_PENALTY = 10;
    static final int DIFFICULTY_WARN_PENALTY = 15;
    static final BigDecimal CRISPNESS_PENALTY_FACTOR = new BigDecimal("0.3");

    private final QuestionClassifier classifier;

    public SemanticAnalyzer(QuestionClassifier classifier) {
        this.classifier = classifier;
    }

    public SemanticReport analyze(List<QuestionNode> questions,
                                  PaperHeader header,
                                  String sourceText,
                                  String syllabus,
                                  AnalysisSettings settings) {
        List<QuestionNode> nodes = questions == null ? List.of() : questions;

        MarksCheck marks = validateMarks(nodes, header.totalMarks());
        TimeCheck time = estimateTime(nodes, header.totalTime(), settings);
        DifficultyCheck difficulty = analyzeDifficulty(nodes, settings);
        CoverageCheck coverage = checkSyllabusCoverage(syllabus, sourceText, settings);
        CrispnessCheck crispness = analyzeCrispness(nodes, settings);

        Map<String, CheckResult> checks = new LinkedHashMap<>();
        checks.put(MARKS_VALIDATION, marks);
        checks.put(TIME_ESTIMATION, time);
        checks.put(DIFFICULTY_DISTRIBUTION, difficulty);
        checks.put(SYLLABUS_COVERAGE, coverage);
        checks.put(CRISPNESS_ANALYSIS, crispness);

        Map<String, Number> statistics = new LinkedHashMap<>();
        statistics.put("total_questions", nodes.size());
        statistics.put("total_marks_calculated", marks.calculatedTotal());
        statistics.put("total_marks_declared", marks.declaredTotal());
        statistics.put("estimated_time_minutes", time.estimatedTime());
        statistics.put("declared_time_minutes", time.declaredTime());
        statistics.put("difficulty_easy_count", difficulty.easyCount());
        statistics.put("difficulty_medium_count", difficulty.mediumCount());
        statistics.put("difficulty_hard_count", difficulty.hardCount());
        statistics.put("difficulty_easy_percentage", difficulty.easyPercentage());
        statistics.put("difficulty_medium_percentage", difficulty.mediumPercentage());
        statistics.put("difficulty_hard_percentage", difficulty.hardPercentage());
        statistics.put("crisp_count", crispness.crispCount());
        statistics.put("verbose_count", crispness.verboseCount());
        statistics.put("ambiguous_count", crispness.ambiguousCount());
        statistics.put("crispness_percentage", crispness.crispnessPercentage());
        if (coverage.status() != CheckStatus.SKIP) {
            statistics.put("coverage_percentage", coverage.coveragePercentage());
        }

        List<String> warnings = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        collectFindings(marks, time, difficulty, coverage, crispness, settings, warnings, suggestions);

        return new SemanticReport(checks, statistics, warnings, suggestions, score(marks, time, difficulty, crispness));
    }

    MarksCheck validateMarks(List<QuestionNode> nodes, int declaredTotal) {
        int calculated = nodes.stream().mapToInt(QuestionNode::marks).sum();
        boolean valid = declaredTotal <= 0 || calculated == declaredTotal;
        int difference = Math.abs(calculated - declaredTotal);
        return new MarksCheck(valid ? CheckStatus.PASS : CheckStatus.FAIL,
                valid ? "Marks sum matches declared total" : "Marks mismatch: " + difference + " marks difference",
                calculated, declaredTotal, difference);
    }

    TimeCheck estimateTime(List<QuestionNode> nodes, int declaredTime, AnalysisSettings settings) {
        long raw = 0;
        for (QuestionNode node : nodes) {
            raw += (long) node.marks() * classifier.minutesPerMark(node.difficulty(), settings);
        }
        int estimated = BigDecimal.valueOf(raw)
                .multiply(BigDecimal.valueOf(settings.timeBuffer()))
                .setScale(0, RoundingMode.DOWN)
                .intValue();
        int difference = Math.abs(estimated - declaredTime);
        boolean within = declaredTime <= 0 || difference <= settings.timeToleranceMinutes();
        return new TimeCheck(within ? CheckStatus.PASS : CheckStatus.WARN,
                "Estimated time: " + estimated + " minutes vs declared: " + declaredTime + " minutes",
                estimated, declaredTime, difference);
    }

    DifficultyCheck analyzeDifficulty(List<QuestionNode> nodes, AnalysisSettings settings) {
        int easy = count(nodes, Difficulty.EASY);
        int medium = count(nodes, Difficulty.MEDIUM);
        int hard = count(nodes, Difficulty.HARD);
        int total = nodes.size();
        if (total == 0) {
            return new DifficultyCheck(CheckStatus.SKIP, "No questions to classify", 0, 0, 0, 0.0, 0.0, 0.0);
        }

        double easyPct = percent(easy, total);
        double mediumPct = percent(medium, total);
        double hardPct = percent(hard, total);
        boolean balanced = within(easyPct, settings.easyMinPercent(), settings.easyMaxPercent())
                && within(mediumPct, settings.mediumMinPercent(), settings.mediumMaxPercent())
                && within(hardPct, settings.hardMinPercent(), settings.hardMaxPercent());
        return new DifficultyCheck(balanced ? CheckStatus.PASS : CheckStatus.WARN,
                balanced ? "Difficulty distribution is balanced" : "Difficulty distribution needs improvement",
                easy, medium, hard, easyPct, mediumPct, hardPct);
    }

    CoverageCheck checkSyllabusCoverage(String syllabus, String sourceText, AnalysisSettings settings) {
        if (syllabus == null || syllabus.isBlank()) {
            return CoverageCheck.skipped("No syllabus information available");
        }
        List<String> topics = SyllabusTopics.extract(syllabus, settings);
        if (topics.isEmpty()) {
            return CoverageCheck.skipped("Could not extract topics from syllabus");
        }

        String text = sourceText == null ? "" : sourceText.toLowerCase(Locale.ROOT);
        List<String> covered = new ArrayList<>();
        List<String> uncovered = new ArrayList<>();
        for (String topic : topics) {
            if (text.contains(topic.toLowerCase(Locale.ROOT))) covered.add(topic);
            else uncovered.add(topic);
        }
        double coveragePct = percent(covered.size(), topics.size());
        return new CoverageCheck(coveragePct >= settings.coverageThresholdPercent() ? CheckStatus.PASS : CheckStatus.WARN,
                covered.size() + "/" + topics.size() + " topics covered",
                List.copyOf(covered), List.copyOf(uncovered), coveragePct);
    }

    CrispnessCheck analyzeCrispness(List<QuestionNode> nodes, AnalysisSettings settings) {
        int crisp = 0, verbose = 0, ambiguous = 0;
        for (QuestionNode node : nodes) {
            switch (node.crispness()) {
                case CRISP -> crisp++;
                case VERBOSE -> verbose++;
                case AMBIGUOUS -> ambiguous++;
            }
        }
        int total = nodes.size();
        if (total == 0) {
            return new CrispnessCheck(CheckStatus.SKIP, "No questions to assess", 0, 0, 0, 0.0);
        }
        double crispPct = percent(crisp, total);
        return new CrispnessCheck(crispPct >= settings.crispThresholdPercent() ? CheckStatus.PASS : CheckStatus.WARN,
                crisp + "/" + total + " questions are crisp and clear",
                crisp, verbose, ambiguous, crispPct);
    }

    private void collectFindings(MarksCheck marks, TimeCheck time, DifficultyCheck difficulty,
                                 CoverageCheck coverage, CrispnessCheck crispness, AnalysisSettings settings,
                                 List<String> warnings, List<String> suggestions) {
        if (marks.status() == CheckStatus.FAIL) {
            warnings.add("Marks sum mismatch: " + marks.message());
            suggestions.add("Review and correct the marks allocation to match the declared total");
        }

        // keyed on the gap alone: an undeclared time still passes the check but gets the finding
        if (time.difference() > settings.timeToleranceMinutes()) {
            warnings.add("Time allocation mismatch: " + time.difference() + " minutes difference");
            if (time.estimatedTime() > time.declaredTime()) {
                suggestions.add("Consider increasing allotted time or reducing question complexity");
            } else {
                suggestions.add("Consider adding more questions or increasing difficulty");
            }
        }

        if (difficulty.status() == CheckStatus.WARN) {
            if (difficulty.easyPercentage() < settings.easyMinPercent()) {
                suggestions.add("Add more easy-level questions (define, state, list)");
            }
            if (difficulty.easyPercentage() > settings.easyMaxPercent()) {
                suggestions.add("Reduce easy-level questions and add more challenging ones");
            }
            if (difficulty.hardPercentage() < settings.hardMinPercent()) {
                suggestions.add("Add more hard-level questions (design, construct, analyze)");
            }
            if (difficulty.hardPercentage() > settings.hardMaxPercent()) {
                suggestions.add("Reduce hard-level questions for better balance");
            }
        }

        if (crispness.verboseCount() > 0) {
            suggestions.add("Simplify " + crispness.verboseCount() + " verbose question(s)");
        }
        if (crispness.ambiguousCount() > 0) {
            suggestions.add("Clarify " + crispness.ambiguousCount() + " ambiguous question(s)");
        }

        if (coverage.status() == CheckStatus.WARN) {
            warnings.add("Syllabus topics not covered: " + String.join(", ", coverage.uncoveredTopics()));
        }
    }

    int score(MarksCheck marks, TimeCheck time, DifficultyCheck difficulty, CrispnessCheck crispness) {
        int score = 100;
        if (marks.status() == CheckStatus.FAIL) score -= MARKS_FAIL_PENALTY;
        if (time.status() == CheckStatus.WARN) score -= TIME_WARN_PENALTY;
        if (difficulty.status() == CheckStatus.WARN) score -= DIFFICULTY_WARN_PENALTY;
        if (crispness.status() != CheckStatus.SKIP) {
            score -= BigDecimal.valueOf(100)
                    .subtract(BigDecimal.valueOf(crispness.crispnessPercentage()))
                    .multiply(CRISPNESS_PENALTY_FACTOR)
                    .setScale(0, RoundingMode.FLOOR)
                    .intValue();
        }
        return Math.max(0, Math.min(100, score));
    }

    private int count(List<QuestionNode> nodes, Difficulty difficulty) {
        return (int) nodes.stream().filter(n -> n.difficulty() == difficulty).count();
    }

    private boolean within(double value, double min, double max) {
        return value >= min && value <= max;
    }

    static double percent(int part, int total) {
        if (total <= 0) return 0.0;
        return BigDecimal.valueOf(part * 100L)
                .divide(BigDecimal.valueOf(total), 1, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
