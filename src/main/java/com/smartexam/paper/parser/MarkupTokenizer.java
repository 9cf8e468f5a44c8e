package com.smartexam.paper.parser;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.smartexam.paper.parser.ParserDtos.*;

/**
 * One token per non-blank markup line. Never fails: anything unrecognized becomes {@link TokenKind#RAW}.
 */
@Component
public class MarkupTokenizer {
    static final Set<String> STRUCTURAL_TAGS = Set.of(
            "[HEADER]", "[/HEADER]", "[QUESTION_LIST]", "[/QUESTION_LIST]", "[QUESTION]", "[/QUESTION]");

    public List<Token> tokenize(String markup) {
        if (markup == null || markup.isEmpty()) return List.of();

        List<Token> tokens = new ArrayList<>();
        String[] lines = markup.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].trim();
            if (trimmed.isEmpty()) continue;
            tokens.add(new Token(classify(trimmed), trimmed, i + 1));
        }
        return List.copyOf(tokens);
    }

    TokenKind classify(String line) {
        String upper = line.toUpperCase(Locale.ROOT);
        if (isTag(upper)) return TokenKind.TAG;
        if (upper.startsWith("SUBJECT:")) return TokenKind.SUBJECT;
        if (upper.startsWith("TOTAL_MARKS:")) return TokenKind.TOTAL_MARKS;
        if (upper.startsWith("Q_TEXT")) return TokenKind.Q_TEXT;
        if (upper.startsWith("Q_MARKS")) return TokenKind.Q_MARKS;
        return TokenKind.RAW;
    }

    private boolean isTag(String upper) {
        return STRUCTURAL_TAGS.contains(upper);
    }
}
