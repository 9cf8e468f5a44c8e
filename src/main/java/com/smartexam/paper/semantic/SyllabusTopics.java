package com.smartexam.paper.semantic;

import com.smartexam.paper.config.AnalysisSettings;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

public final class SyllabusTopics {
    private static final Pattern SEPARATORS = Pattern.compile("[,;:\\n]");

    private SyllabusTopics() {}

    public static List<String> extract(String syllabus, AnalysisSettings settings) {
        if (syllabus == null || syllabus.isBlank()) return List.of();
        return Arrays.stream(SEPARATORS.split(syllabus.replace("\r", "")))
                .map(String::trim)
                .filter(t -> t.length() >= settings.minTopicLength())
                .limit(settings.maxTopics())
                .toList();
    }
}
