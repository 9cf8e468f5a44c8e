package com.smartexam.paper.dsl;

import java.util.List;

public class DslModels {
    public record PaperHeader(String subject, int totalMarks, int totalTime, String syllabusPath) {}

    public record QuestionSegment(String text, int marks) {}

    /**
     * Result of formatting: the extracted values and the markup rendered from them.
     */
    public record DslDocument(PaperHeader header, List<QuestionSegment> questions, String markup) {}
}
