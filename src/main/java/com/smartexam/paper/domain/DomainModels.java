package com.smartexam.paper.domain;

import java.util.List;
import java.util.Optional;

public class DomainModels {
    public enum Difficulty { EASY, MEDIUM, HARD }

    public enum Crispness { CRISP, VERBOSE, AMBIGUOUS }

    public record QuestionNode(String text,
                               int marks,
                               Difficulty difficulty,
                               Crispness crispness,
                               int estimatedTime,
                               String syllabusTopic,
                               int line) {
        public Optional<String> topic() {
            return Optional.ofNullable(syllabusTopic);
        }
    }

    /**
     * Question list of one paper. Never empty: when no question could be recognized the builder
     * synthesizes a single node and sets {@code synthesized}.
     */
    public record PaperAst(List<QuestionNode> questions, boolean synthesized) {
        public PaperAst {
            if (questions == null || questions.isEmpty()) {
                throw new IllegalArgumentException("AST must contain at least one question");
            }
            questions = List.copyOf(questions);
        }

        public int size() {
            return questions.size();
        }
    }
}
