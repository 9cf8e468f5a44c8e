package com.smartexam.paper.export;

import com.smartexam.paper.domain.DomainModels.PaperAst;
import com.smartexam.paper.domain.DomainModels.QuestionNode;
import org.springframework.stereotype.Component;

/**
 * Graphviz view of the question list: a root record for the paper and one record per question.
 */
@Component
public class AstDotRenderer {
    static final int LABEL_TEXT_LIMIT = 120;

    public String render(String subject, PaperAst ast) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph AST {\n");
        sb.append("  node [shape=record];\n");
        sb.append("  root [label=\"{Paper|").append(escapeLabel(subject == null ? "" : subject)).append("}\"];\n");

        int index = 1;
        for (QuestionNode q : ast.questions()) {
            String text = q.text().length() > LABEL_TEXT_LIMIT ? q.text().substring(0, LABEL_TEXT_LIMIT) + "..." : q.text();
            sb.append("  q").append(index)
                    .append(" [label=\"{Q").append(index)
                    .append("|Marks: ").append(q.marks())
                    .append("|").append(q.difficulty())
                    .append("|").append(escapeLabel(text))
                    .append("}\"];\n");
            sb.append("  root -> q").append(index).append(";\n");
            index++;
        }
        sb.append("}\n");
        return sb.toString();
    }

    static String escapeLabel(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"', '{', '}', '|', '<', '>', '\\' -> sb.append('\\').append(c);
                case '\n' -> sb.append("\\n");
                case '\r' -> { }
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
