package com.smartexam.paper.semantic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SemanticModels {
    public enum CheckStatus { PASS, WARN, FAIL, SKIP }

    public interface CheckResult {
        CheckStatus status();

        String message();
    }

    public record MarksCheck(CheckStatus status, String message,
                             int calculatedTotal, int declaredTotal, int difference) implements CheckResult {}

    public record TimeCheck(CheckStatus status, String message,
                            int estimatedTime, int declaredTime, int difference) implements CheckResult {}

    public record DifficultyCheck(CheckStatus status, String message,
                                  int easyCount, int mediumCount, int hardCount,
                                  double easyPercentage, double mediumPercentage, double hardPercentage) implements CheckResult {}

    public record CoverageCheck(CheckStatus status, String message,
                                List<String> coveredTopics, List<String> uncoveredTopics,
                                double coveragePercentage) implements CheckResult {
        public static CoverageCheck skipped(String message) {
            return new CoverageCheck(CheckStatus.SKIP, message, List.of(), List.of(), 0.0);
        }
    }

    public record CrispnessCheck(CheckStatus status, String message,
                                 int crispCount, int verboseCount, int ambiguousCount,
                                 double crispnessPercentage) implements CheckResult {}

    /**
     * Outcome of one analysis pass. Downstream collaborators may only add to it through {@link #merge}.
     */
    public record SemanticReport(Map<String, CheckResult> checks,
                                 Map<String, Number> statistics,
                                 List<String> warnings,
                                 List<String> suggestions,
                                 int crispnessScore) {
        public SemanticReport {
            checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
            statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
            warnings = List.copyOf(warnings);
            suggestions = List.copyOf(suggestions);
            crispnessScore = Math.max(0, Math.min(100, crispnessScore));
        }

        public CheckResult check(String name) {
            return checks.get(name);
        }

        /**
         * Adds findings of another collaborator. Checks already present are kept, new ones appended;
         * warnings and suggestions are appended; the score is not re-derived.
         */
        public SemanticReport merge(Map<String, CheckResult> extraChecks,
                                    List<String> extraWarnings,
                                    List<String> extraSuggestions) {
            Map<String, CheckResult> mergedChecks = new LinkedHashMap<>(checks);
            extraChecks.forEach(mergedChecks::putIfAbsent);

            List<String> mergedWarnings = new ArrayList<>(warnings);
            mergedWarnings.addAll(extraWarnings);
            List<String> mergedSuggestions = new ArrayList<>(suggestions);
            mergedSuggestions.addAll(extraSuggestions);

            return new SemanticReport(mergedChecks, statistics, mergedWarnings, mergedSuggestions, crispnessScore);
        }
    }

    public static final String MARKS_VALIDATION = "marks_validation";
    public static final String TIME_ESTIMATION = "time_estimation";
    public static final String DIFFICULTY_DISTRIBUTION = "difficulty_distribution";
    public static final String SYLLABUS_COVERAGE = "syllabus_coverage";
    public static final String CRISPNESS_ANALYSIS = "crispness_analysis";
}
