package com.smartexam.paper.normalize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns recognized paper text into canonical line-oriented form.
 * Every step leaves already clean text untouched, so {@code normalize(normalize(x)) == normalize(x)}.
 */
@Component
public class TextNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TextNormalizer.class);

    private static final Pattern HYPHEN_BREAK = Pattern.compile("(\\w+)-\\h*\\n\\s*(\\w+)");
    private static final Pattern O_BETWEEN_DIGITS = Pattern.compile("(?<=\\d)O(?=\\d)");
    private static final Pattern O_BEFORE_CLOSER = Pattern.compile("(?<=\\d)O(?=[)\\]])");
    private static final Pattern BRACKET_L = Pattern.compile("\\[l]");
    private static final Pattern PAREN_L = Pattern.compile("\\(l\\)");
    private static final Pattern SPACE_RUN = Pattern.compile("\\h+");

    // longer keywords first so "Total Marks" is not split before "Marks".
    // No break after a hyphen, spaced or not: the next pass would rejoin it as a broken word.
    private static final List<String> HEADER_KEYWORDS = List.of(
            "Total Marks", "Maximum Marks", "Subject", "Syllabus", "Course", "Time", "Exam", "Date");
    private static final Pattern HEADER_BREAK = Pattern.compile(
            "(?<=[^\\n-])(?<!-\\h)(?=\\b(?:" + String.join("|", HEADER_KEYWORDS.stream().map(k -> k.replace(" ", "\\s+")).toList()) + ")\\b)",
            Pattern.CASE_INSENSITIVE);

    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            log.warn("Rejected paper text: input is empty or whitespace-only");
            throw new EmptyInputException("Empty text provided for preprocessing");
        }

        String text = raw.replace("\r\n", "\n").replace('\r', '\n');
        text = HYPHEN_BREAK.matcher(text).replaceAll("$1$2");
        text = fixOcrConfusables(text);
        text = tidyLines(text);
        text = HEADER_BREAK.matcher(text).replaceAll("\n");
        return tidyLines(text);
    }

    String fixOcrConfusables(String text) {
        text = O_BETWEEN_DIGITS.matcher(text).replaceAll("0");
        text = O_BEFORE_CLOSER.matcher(text).replaceAll("0");
        text = BRACKET_L.matcher(text).replaceAll("[1]");
        return PAREN_L.matcher(text).replaceAll("(1)");
    }

    private String tidyLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n")) {
            String cleaned = SPACE_RUN.matcher(line.strip()).replaceAll(" ");
            if (!cleaned.isEmpty()) lines.add(cleaned);
        }
        return String.join("\n", lines);
    }
}
