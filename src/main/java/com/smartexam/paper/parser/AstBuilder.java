package com.smartexam.paper.parser;

import com.smartexam.paper.config.AnalysisSettings;
import com.smartexam.paper.domain.DomainModels.PaperAst;
import com.smartexam.paper.domain.DomainModels.QuestionNode;
import com.smartexam.paper.dsl.DslStrings;
import com.smartexam.paper.semantic.QuestionClassifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.smartexam.paper.parser.ParserDtos.*;

/**
 * Folds the token stream into question nodes.
 * <p>
 * A question is emitted as soon as both its text and marks are known. Text still waiting for marks
 * is flushed with 0 marks when the next text, a closing tag or the end of the stream arrives.
 * Marks seen before the text are attached to that text. If nothing is recognized at all a single
 * node is synthesized from the raw lines, so the result is never empty.
 */
@Component
public class AstBuilder {
    private final QuestionClassifier classifier;

    public AstBuilder(QuestionClassifier classifier) {
        this.classifier = classifier;
    }

    private enum State { AWAITING_TEXT, AWAITING_MARKS }

    public PaperAst build(List<Token> tokens, List<String> syllabusTopics, AnalysisSettings settings) {
        List<QuestionNode> nodes = new ArrayList<>();
        State state = State.AWAITING_TEXT;
        String pendingText = null;
        int pendingLine = 0;
        Integer heldMarks = null;

        for (Token token : tokens) {
            switch (token.kind()) {
                case Q_TEXT -> {
                    String text = DslStrings.fieldValue(token.value());
                    if (text.isEmpty()) continue;
                    if (state == State.AWAITING_MARKS) {
                        nodes.add(node(pendingText, 0, pendingLine, syllabusTopics, settings));
                    }
                    if (heldMarks != null) {
                        nodes.add(node(text, heldMarks, token.line(), syllabusTopics, settings));
                        heldMarks = null;
                        state = State.AWAITING_TEXT;
                    } else {
                        pendingText = text;
                        pendingLine = token.line();
                        state = State.AWAITING_MARKS;
                    }
                }
                case Q_MARKS -> {
                    int marks = parseMarks(token.value());
                    if (state == State.AWAITING_MARKS) {
                        nodes.add(node(pendingText, marks, pendingLine, syllabusTopics, settings));
                        pendingText = null;
                        state = State.AWAITING_TEXT;
                    } else {
                        heldMarks = marks;
                    }
                }
                case TAG -> {
                    if (isQuestionBoundary(token.value())) {
                        if (state == State.AWAITING_MARKS) {
                            nodes.add(node(pendingText, 0, pendingLine, syllabusTopics, settings));
                            pendingText = null;
                            state = State.AWAITING_TEXT;
                        }
                        heldMarks = null;
                    }
                }
                default -> {
                }
            }
        }
        if (state == State.AWAITING_MARKS) {
            nodes.add(node(pendingText, 0, pendingLine, syllabusTopics, settings));
        }

        if (nodes.isEmpty()) {
            return new PaperAst(List.of(node(fallbackText(tokens, settings), 0, 0, syllabusTopics, settings)), true);
        }
        return new PaperAst(nodes, false);
    }

    public PaperAst build(List<Token> tokens, AnalysisSettings settings) {
        return build(tokens, List.of(), settings);
    }

    static int parseMarks(String value) {
        int colon = value.indexOf(':');
        String digits = (colon < 0 ? value : value.substring(colon + 1)).chars()
                .filter(Character::isDigit)
                .collect(StringBuilder::new, StringBuilder::appendCodePoint, StringBuilder::append)
                .toString();
        if (digits.isEmpty()) return 0;
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private boolean isQuestionBoundary(String tag) {
        return tag.equalsIgnoreCase("[QUESTION]")
                || tag.equalsIgnoreCase("[/QUESTION]")
                || tag.equalsIgnoreCase("[/QUESTION_LIST]");
    }

    private String fallbackText(List<Token> tokens, AnalysisSettings settings) {
        String raw = tokens.stream()
                .filter(t -> t.kind() == TokenKind.RAW || t.kind() == TokenKind.Q_TEXT)
                .map(Token::value)
                .collect(Collectors.joining("\n"));
        return raw.length() > settings.fallbackTextLimit() ? raw.substring(0, settings.fallbackTextLimit()) : raw;
    }

    private QuestionNode node(String text, int marks, int line, List<String> topics, AnalysisSettings settings) {
        return classifier.classify(text, marks, line, topics, settings);
    }
}
