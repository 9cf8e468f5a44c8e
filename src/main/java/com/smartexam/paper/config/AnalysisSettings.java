package com.smartexam.paper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunable thresholds of one compilation run.
 * <p>
 * Bound from {@code exam.analysis.*}, but always handed to the pipeline explicitly:
 * no component reads configuration on its own. Percent values are in the 0..100 range.
 */
@ConfigurationProperties(prefix = "exam.analysis")
public record AnalysisSettings(
        @DefaultValue("Unknown Subject") String defaultSubject,
        @DefaultValue("100") int defaultTotalMarks,
        @DefaultValue("180") int defaultTotalTime,
        @DefaultValue("15") int timeToleranceMinutes,
        @DefaultValue("1.10") double timeBuffer,
        @DefaultValue("2") int easyMinutesPerMark,
        @DefaultValue("3") int mediumMinutesPerMark,
        @DefaultValue("4") int hardMinutesPerMark,
        @DefaultValue("20") double easyMinPercent,
        @DefaultValue("40") double easyMaxPercent,
        @DefaultValue("40") double mediumMinPercent,
        @DefaultValue("60") double mediumMaxPercent,
        @DefaultValue("10") double hardMinPercent,
        @DefaultValue("30") double hardMaxPercent,
        @DefaultValue("70") double coverageThresholdPercent,
        @DefaultValue("10") int maxTopics,
        @DefaultValue("4") int minTopicLength,
        @DefaultValue("70") double crispThresholdPercent,
        @DefaultValue("100") int verboseWordLimit,
        @DefaultValue("800") int fallbackTextLimit) {

    public static AnalysisSettings defaults() {
        return new AnalysisSettings("Unknown Subject", 100, 180, 15, 1.10,
                2, 3, 4,
                20, 40, 40, 60, 10, 30,
                70, 10, 4,
                70, 100, 800);
    }

    public AnalysisSettings withTimeTolerance(int minutes) {
        return new AnalysisSettings(defaultSubject, defaultTotalMarks, defaultTotalTime, minutes, timeBuffer,
                easyMinutesPerMark, mediumMinutesPerMark, hardMinutesPerMark,
                easyMinPercent, easyMaxPercent, mediumMinPercent, mediumMaxPercent, hardMinPercent, hardMaxPercent,
                coverageThresholdPercent, maxTopics, minTopicLength,
                crispThresholdPercent, verboseWordLimit, fallbackTextLimit);
    }

    public AnalysisSettings withDifficultyBands(double easyMin, double easyMax,
                                                double mediumMin, double mediumMax,
                                                double hardMin, double hardMax) {
        return new AnalysisSettings(defaultSubject, defaultTotalMarks, defaultTotalTime, timeToleranceMinutes, timeBuffer,
                easyMinutesPerMark, mediumMinutesPerMark, hardMinutesPerMark,
                easyMin, easyMax, mediumMin, mediumMax, hardMin, hardMax,
                coverageThresholdPercent, maxTopics, minTopicLength,
                crispThresholdPercent, verboseWordLimit, fallbackTextLimit);
    }
}
