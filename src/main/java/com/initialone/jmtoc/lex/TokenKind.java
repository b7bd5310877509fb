package com.initialone.jmtoc.lex;

public enum TokenKind {
    IDENTIFIER,
    /** Identifier from the structural keyword set, seen at statement start. */
    KEYWORD,
    NUMBER,
    /** Single-quoted character array literal, quotes included. */
    STRING,
    /** Double-quoted string literal, quotes included. */
    DQ_STRING,
    OPERATOR,
    OPEN,
    CLOSE,
    SEMICOLON,
    COMMA,
    NEWLINE,
    /** {@code %} comment up to (not including) the end of line. */
    COMMENT,
    /** {@code %{ ... %}} comment spanning whole lines. */
    BLOCK_COMMENT,
    /** {@code ...} plus the rest of its line and the line break. */
    CONTINUATION,
    EOF;

    /** Tokens that never take part in statement structure. */
    public boolean isTrivia() {
        return this == COMMENT || this == BLOCK_COMMENT || this == CONTINUATION || this == NEWLINE;
    }

    public boolean isComment() {
        return this == COMMENT || this == BLOCK_COMMENT;
    }
}
