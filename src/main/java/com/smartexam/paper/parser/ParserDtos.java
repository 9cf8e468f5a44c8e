package com.smartexam.paper.parser;

public class ParserDtos {
    public enum TokenKind { TAG, SUBJECT, TOTAL_MARKS, Q_TEXT, Q_MARKS, RAW }

    public record Token(TokenKind kind, String value, int line) {}
}
