package com.initialone.jmtoc.lex;

/**
 * Lexeme with its source span. {@code start}/{@code end} are offsets into the scanned text so
 * the parser can copy raw source (default values, method bodies) byte for byte.
 *
 * @param depth          bracket nesting depth at the token (openers and closers report the
 *                       depth outside the pair)
 * @param statementStart first significant token of a logical statement
 */
public record Token(TokenKind kind, String text, int start, int end, int line, int column,
                    int depth, boolean statementStart) {

    public boolean is(String lexeme) {
        return text.equals(lexeme);
    }

    public boolean is(TokenKind k, String lexeme) {
        return kind == k && text.equals(lexeme);
    }

    public boolean isWord() {
        return kind == TokenKind.IDENTIFIER || kind == TokenKind.KEYWORD;
    }

    /** Line of the last character, ignoring a trailing line break. */
    public int lastLine() {
        int n = line;
        int limit = text.endsWith("\n") ? text.length() - 1 : text.length();
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') n++;
        }
        return n;
    }

    /** True when the statement has ended at this token (only meaningful outside brackets). */
    public boolean endsStatement() {
        if (depth > 0) return kind == TokenKind.EOF;
        return kind == TokenKind.NEWLINE || kind == TokenKind.SEMICOLON || kind == TokenKind.COMMA
                || kind == TokenKind.COMMENT || kind == TokenKind.BLOCK_COMMENT || kind == TokenKind.EOF;
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + line + ":" + column;
    }
}
