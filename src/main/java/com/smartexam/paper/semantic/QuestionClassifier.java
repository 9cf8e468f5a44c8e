package com.smartexam.paper.semantic;

import com.smartexam.paper.config.AnalysisSettings;
import com.smartexam.paper.domain.DomainModels.Crispness;
import com.smartexam.paper.domain.DomainModels.Difficulty;
import com.smartexam.paper.domain.DomainModels.QuestionNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword heuristics deriving the per-question attributes.
 * Difficulty keywords match anywhere in the lowercased text, so inflected verbs ("implementing", "listed") count.
 * Priority is HARD over MEDIUM over EASY; text without any keyword is MEDIUM.
 */
@Component
public class QuestionClassifier {
    public static final Set<String> EASY_KEYWORDS = Set.of(
            "define", "state", "list", "identify", "name", "mention", "label", "write");
    public static final Set<String> MEDIUM_KEYWORDS = Set.of(
            "explain", "prove", "derive", "compare", "discuss", "describe", "illustrate", "differentiate", "outline");
    public static final Set<String> HARD_KEYWORDS = Set.of(
            "design", "construct", "develop", "implement", "optimize", "synthesize", "analyze", "evaluate", "create", "formulate");

    private static final Pattern VAGUE_TERMS = Pattern.compile("\\b(?:something|anything|etc|and\\s+so\\s+on)\\b", Pattern.CASE_INSENSITIVE);

    public QuestionNode classify(String text, int marks, int line, List<String> topics, AnalysisSettings settings) {
        String safeText = text == null ? "" : text;
        int safeMarks = Math.max(0, marks);
        Difficulty difficulty = difficulty(safeText);
        return new QuestionNode(safeText, safeMarks, difficulty, crispness(safeText, settings),
                safeMarks * minutesPerMark(difficulty, settings), topicOf(safeText, topics), line);
    }

    public Difficulty difficulty(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (HARD_KEYWORDS.stream().anyMatch(lower::contains)) return Difficulty.HARD;
        if (MEDIUM_KEYWORDS.stream().anyMatch(lower::contains)) return Difficulty.MEDIUM;
        if (EASY_KEYWORDS.stream().anyMatch(lower::contains)) return Difficulty.EASY;
        return Difficulty.MEDIUM;
    }

    public Crispness crispness(String text, AnalysisSettings settings) {
        if (wordCount(text) > settings.verboseWordLimit()) return Crispness.VERBOSE;
        if (VAGUE_TERMS.matcher(text).find()) return Crispness.AMBIGUOUS;
        return Crispness.CRISP;
    }

    public int minutesPerMark(Difficulty difficulty, AnalysisSettings settings) {
        return switch (difficulty) {
            case EASY -> settings.easyMinutesPerMark();
            case HARD -> settings.hardMinutesPerMark();
            case MEDIUM -> settings.mediumMinutesPerMark();
        };
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private String topicOf(String text, List<String> topics) {
        if (topics == null || topics.isEmpty()) return null;
        String lower = text.toLowerCase(Locale.ROOT);
        return topics.stream()
                .filter(t -> lower.contains(t.toLowerCase(Locale.ROOT)))
                .findFirst()
                .orElse(null);
    }
}
