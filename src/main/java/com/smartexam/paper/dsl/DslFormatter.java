package com.smartexam.paper.dsl;

import com.smartexam.paper.config.AnalysisSettings;
import com.smartexam.paper.dsl.DslModels.DslDocument;
import com.smartexam.paper.dsl.DslModels.PaperHeader;
import com.smartexam.paper.dsl.DslModels.QuestionSegment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits clean paper text into a header and question segments and renders them as markup.
 * Total: missing header fields fall back to the configured defaults, a paper without question
 * markers yields an empty {@code [QUESTION_LIST]}.
 */
@Component
public class DslFormatter {
    private static final Pattern SUBJECT = Pattern.compile("\\bSubject\\b:?[ \\t]*(.*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOTAL_MARKS = Pattern.compile("\\b(?:Total|Maximum)\\s+Marks\\b:?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOTAL_TIME = Pattern.compile("\\bTime\\b:?\\s*(\\d+)\\s*(hours?|hrs?|minutes?|mins?)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern QUESTION_START = Pattern.compile("(?=\\bQ\\.?\\s*\\d+\\b|\\b\\d+\\.\\s)", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUESTION_MARKER = Pattern.compile("^(?:Q\\.?\\s*\\d+\\s*[.):]?|\\d+\\.)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUESTION_MARKS = Pattern.compile("[\\[(](\\d+)\\s*(?:M|marks?)[\\])]", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPACE_RUN = Pattern.compile("\\h{2,}");

    public DslDocument format(String cleanText, String syllabusPath, AnalysisSettings settings) {
        String text = cleanText == null ? "" : cleanText;

        Matcher firstQuestion = QUESTION_START.matcher(text);
        int questionStart = firstQuestion.find() ? firstQuestion.start() : -1;
        String headerBlock = questionStart < 0 ? text : text.substring(0, questionStart);

        PaperHeader header = extractHeader(headerBlock, syllabusPath, settings);
        List<QuestionSegment> questions = questionStart < 0
                ? List.of()
                : extractQuestions(text.substring(questionStart));

        return new DslDocument(header, questions, render(header, questions));
    }

    PaperHeader extractHeader(String headerBlock, String syllabusPath, AnalysisSettings settings) {
        String subject = settings.defaultSubject();
        int totalMarks = settings.defaultTotalMarks();
        int totalTime = settings.defaultTotalTime();

        Matcher subjectMatcher = SUBJECT.matcher(headerBlock);
        if (subjectMatcher.find() && !subjectMatcher.group(1).isBlank()) {
            subject = subjectMatcher.group(1).trim();
        }

        Matcher marksMatcher = TOTAL_MARKS.matcher(headerBlock);
        if (marksMatcher.find()) {
            totalMarks = parseOr(marksMatcher.group(1), totalMarks);
        }

        Matcher timeMatcher = TOTAL_TIME.matcher(headerBlock);
        if (timeMatcher.find()) {
            int value = parseOr(timeMatcher.group(1), -1);
            if (value >= 0) {
                totalTime = timeMatcher.group(2).toLowerCase().startsWith("h") ? value * 60 : value;
            }
        }
        return new PaperHeader(subject, totalMarks, totalTime, syllabusPath == null ? "" : syllabusPath);
    }

    List<QuestionSegment> extractQuestions(String questionBlock) {
        List<Integer> starts = new ArrayList<>();
        Matcher matcher = QUESTION_START.matcher(questionBlock);
        while (matcher.find()) {
            starts.add(matcher.start());
        }

        List<QuestionSegment> questions = new ArrayList<>();
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : questionBlock.length();
            String segment = questionBlock.substring(starts.get(i), end).trim();
            if (segment.isEmpty()) continue;

            int marks = 0;
            Matcher marksMatcher = QUESTION_MARKS.matcher(segment);
            if (marksMatcher.find()) {
                marks = parseOr(marksMatcher.group(1), 0);
                segment = QUESTION_MARKS.matcher(segment).replaceAll("");
            }

            String body = QUESTION_MARKER.matcher(segment.trim()).replaceFirst("");
            body = SPACE_RUN.matcher(body).replaceAll(" ").trim();
            questions.add(new QuestionSegment(body, marks));
        }
        return questions;
    }

    String render(PaperHeader header, List<QuestionSegment> questions) {
        StringBuilder sb = new StringBuilder();
        sb.append("[HEADER]\n");
        sb.append("    SUBJECT: ").append(DslStrings.quote(header.subject())).append('\n');
        sb.append("    TOTAL_MARKS: ").append(header.totalMarks()).append('\n');
        sb.append("    TOTAL_TIME: ").append(header.totalTime()).append('\n');
        sb.append("    SYLLABUS_PATH: ").append(DslStrings.quote(header.syllabusPath())).append('\n');
        sb.append("[/HEADER]\n\n");
        sb.append("[QUESTION_LIST]\n");
        for (QuestionSegment q : questions) {
            sb.append("    [QUESTION]\n");
            sb.append("        Q_TEXT: ").append(DslStrings.quote(q.text())).append('\n');
            sb.append("        Q_MARKS: ").append(q.marks()).append('\n');
            sb.append("    [/QUESTION]\n");
        }
        sb.append("[/QUESTION_LIST]\n");
        return sb.toString();
    }

    private int parseOr(String digits, int fallback) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
