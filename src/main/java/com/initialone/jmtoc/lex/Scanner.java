package com.initialone.jmtoc.lex;

import com.initialone.jmtoc.diagnostics.LexException;
import com.initialone.jmtoc.diagnostics.SyntaxException;
import com.initialone.jmtoc.diagnostics.TranslationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for MATLAB classdef files.
 *
 * Runs as a state machine over the raw text (outside literal / inside a quoted literal /
 * inside a line or block comment) because quotes and brackets only mean something in some
 * states: a {@code '} can be a transpose or a literal start depending on what precedes it,
 * and a bracket inside a literal must not change the nesting depth.
 *
 * Whitespace other than line breaks is not tokenized; the offsets on each {@link Token} are
 * enough to recover it.
 */
public final class Scanner {

    /** Words that structure a classdef file or a function body. */
    public static final Set<String> KEYWORDS = Set.of(
            "classdef", "properties", "methods", "events", "enumeration", "end", "function",
            "if", "elseif", "else", "for", "parfor", "while", "switch", "case", "otherwise",
            "try", "catch", "spmd", "arguments");

    /** Keywords that form a complete statement, so whatever follows on the line starts a new one. */
    private static final Set<String> SELF_CONTAINED = Set.of("end", "else", "otherwise", "try");

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
            "==", "~=", "<=", ">=", "&&", "||", ".*", "./", ".^", ".\\", ".'");

    private enum State { OUTSIDE, IN_SINGLE_QUOTED, IN_DOUBLE_QUOTED, IN_LINE_COMMENT, IN_BLOCK_COMMENT }

    private final String sourceName;
    private final String text;

    private State state = State.OUTSIDE;
    private int pos;
    private int line = 1;
    private int column = 1;

    /* start of the token under construction */
    private int tokStart;
    private int tokLine;
    private int tokColumn;

    private int blockCommentDepth;
    private boolean nextStartsStatement = true;
    private Token lastSignificant;

    private final Deque<Token> openBrackets = new ArrayDeque<>();
    private final List<Token> tokens = new ArrayList<>();

    public Scanner(String sourceName, String text) {
        this.sourceName = sourceName;
        this.text = text;
    }

    public List<Token> scan() throws TranslationException {
        while (pos < text.length()) {
            switch (state) {
                case OUTSIDE -> scanOutside();
                case IN_SINGLE_QUOTED -> scanQuoted('\'', TokenKind.STRING);
                case IN_DOUBLE_QUOTED -> scanQuoted('"', TokenKind.DQ_STRING);
                case IN_LINE_COMMENT -> scanLineComment();
                case IN_BLOCK_COMMENT -> scanBlockComment();
            }
        }

        switch (state) {
            case IN_SINGLE_QUOTED, IN_DOUBLE_QUOTED ->
                    throw new LexException(sourceName, tokLine, tokColumn, "unterminated string literal");
            case IN_BLOCK_COMMENT ->
                    throw new LexException(sourceName, tokLine, tokColumn, "unterminated block comment");
            case IN_LINE_COMMENT -> emit(TokenKind.COMMENT);
            default -> { }
        }
        if (!openBrackets.isEmpty()) {
            Token open = openBrackets.peek();
            throw new SyntaxException(sourceName, open.line(), open.column(),
                    "unbalanced '" + open.text() + "': no matching closing bracket");
        }
        tokens.add(new Token(TokenKind.EOF, "", pos, pos, line, column, 0, nextStartsStatement));
        return tokens;
    }

    /* ================= states ================= */

    private void scanOutside() throws TranslationException {
        char c = text.charAt(pos);

        if (c == '\n') {
            mark();
            advance();
            emit(TokenKind.NEWLINE);
            if (depth() == 0) nextStartsStatement = true;
            return;
        }
        if (Character.isWhitespace(c)) {
            advance();
            return;
        }
        if (c == '%') {
            mark();
            if (opensBlockComment()) {
                advanceTo(endOfLine() < text.length() ? endOfLine() + 1 : text.length());
                blockCommentDepth = 1;
                state = State.IN_BLOCK_COMMENT;
            } else {
                state = State.IN_LINE_COMMENT;
            }
            return;
        }
        if (text.startsWith("...", pos)) {
            mark();
            int eol = endOfLine();
            advanceTo(eol < text.length() ? eol + 1 : text.length());
            emit(TokenKind.CONTINUATION);
            return;
        }
        if (c == '\'') {
            if (isTransposeContext()) {
                mark();
                advance();
                emit(TokenKind.OPERATOR);
            } else {
                mark();
                advance();
                state = State.IN_SINGLE_QUOTED;
            }
            return;
        }
        if (c == '"') {
            mark();
            advance();
            state = State.IN_DOUBLE_QUOTED;
            return;
        }
        if (Character.isLetter(c)) {
            scanWord();
            return;
        }
        if (Character.isDigit(c) || (c == '.' && nextIsDigit() && !isTransposeContext())) {
            scanNumber();
            return;
        }
        switch (c) {
            case '(', '[', '{' -> {
                mark();
                advance();
                Token open = emit(TokenKind.OPEN);
                openBrackets.push(open);
            }
            case ')', ']', '}' -> closeBracket(c);
            case ';' -> {
                mark();
                advance();
                emit(TokenKind.SEMICOLON);
                if (depth() == 0) nextStartsStatement = true;
            }
            case ',' -> {
                mark();
                advance();
                emit(TokenKind.COMMA);
                if (depth() == 0) nextStartsStatement = true;
            }
            default -> {
                mark();
                String two = pos + 2 <= text.length() ? text.substring(pos, pos + 2) : "";
                advanceTo(pos + (TWO_CHAR_OPERATORS.contains(two) ? 2 : 1));
                emit(TokenKind.OPERATOR);
            }
        }
    }

    private void scanQuoted(char quote, TokenKind kind) throws TranslationException {
        char c = text.charAt(pos);
        if (c == '\n') {
            throw new LexException(sourceName, tokLine, tokColumn, "unterminated string literal");
        }
        if (c == quote) {
            if (pos + 1 < text.length() && text.charAt(pos + 1) == quote) {
                advanceTo(pos + 2);
                return;
            }
            advance();
            emit(kind);
            state = State.OUTSIDE;
            return;
        }
        advance();
    }

    private void scanLineComment() {
        int eol = endOfLine();
        advanceTo(eol);
        emit(TokenKind.COMMENT);
        state = State.OUTSIDE;
    }

    /** {@code pos} is always at the start of a line here. */
    private void scanBlockComment() {
        int eol = endOfLine();
        String content = text.substring(pos, eol).trim();
        if (content.equals("%{")) {
            blockCommentDepth++;
        } else if (content.equals("%}")) {
            blockCommentDepth--;
            if (blockCommentDepth == 0) {
                advanceTo(text.indexOf("%}", pos) + 2);
                emit(TokenKind.BLOCK_COMMENT);
                state = State.OUTSIDE;
                return;
            }
        }
        advanceTo(eol < text.length() ? eol + 1 : text.length());
    }

    /* ================= helpers ================= */

    private void scanWord() {
        mark();
        while (pos < text.length()) {
            char ch = text.charAt(pos);
            if (Character.isLetterOrDigit(ch) || ch == '_') {
                advance();
            } else {
                break;
            }
        }
        String word = text.substring(tokStart, pos);
        boolean keyword = nextStartsStatement && depth() == 0 && KEYWORDS.contains(word);
        emit(keyword ? TokenKind.KEYWORD : TokenKind.IDENTIFIER);
        if (keyword && SELF_CONTAINED.contains(word)) {
            nextStartsStatement = true;
        }
    }

    private void scanNumber() {
        mark();
        skipDigits();
        if (pos < text.length() && text.charAt(pos) == '.' && !text.startsWith("...", pos)
                && !isOperatorAfterDot()) {
            advance();
            skipDigits();
        }
        if (pos < text.length() && "eEdD".indexOf(text.charAt(pos)) >= 0) {
            int save = pos;
            int saveColumn = column;
            advance();
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) advance();
            if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                skipDigits();
            } else {
                pos = save;
                column = saveColumn;
            }
        }
        if (pos < text.length() && (text.charAt(pos) == 'i' || text.charAt(pos) == 'j')) {
            advance();
        }
        emit(TokenKind.NUMBER);
    }

    /** {@code 2.*x} is {@code 2 .* x}, not {@code 2. * x}. */
    private boolean isOperatorAfterDot() {
        if (pos + 1 >= text.length()) return false;
        return "*/^\\'".indexOf(text.charAt(pos + 1)) >= 0;
    }

    private void skipDigits() {
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) advance();
    }

    private void closeBracket(char c) throws TranslationException {
        char expected = switch (c) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
        if (openBrackets.isEmpty()) {
            throw new SyntaxException(sourceName, line, column, "unbalanced '" + c + "': nothing to close");
        }
        Token open = openBrackets.peek();
        if (open.text().charAt(0) != expected) {
            throw new SyntaxException(sourceName, line, column,
                    "unbalanced '" + c + "': '" + open.text() + "' opened at line " + open.line()
                            + ", column " + open.column() + " is still open");
        }
        openBrackets.pop();
        mark();
        advance();
        emit(TokenKind.CLOSE);
    }

    /**
     * A quote right after a value (identifier, number, closing bracket, dot or another
     * transpose) with no space in between is the transpose operator.
     */
    private boolean isTransposeContext() {
        Token prev = lastSignificant;
        if (prev == null || prev.end() != pos) return false;
        return switch (prev.kind()) {
            case IDENTIFIER, KEYWORD, NUMBER, CLOSE -> true;
            case OPERATOR -> prev.is("'") || prev.is(".'") || prev.is(".");
            default -> false;
        };
    }

    /** {@code %{} alone on its line (surrounding whitespace allowed). */
    private boolean opensBlockComment() {
        if (!text.startsWith("%{", pos)) return false;
        int lineStart = text.lastIndexOf('\n', pos - 1) + 1;
        if (!text.substring(lineStart, pos).isBlank()) return false;
        return text.substring(pos + 2, endOfLine()).isBlank();
    }

    private boolean nextIsDigit() {
        return pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1));
    }

    private int endOfLine() {
        int eol = text.indexOf('\n', pos);
        return eol < 0 ? text.length() : eol;
    }

    private int depth() {
        return openBrackets.size();
    }

    private void mark() {
        tokStart = pos;
        tokLine = line;
        tokColumn = column;
    }

    private void advance() {
        if (text.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private void advanceTo(int target) {
        while (pos < target) advance();
    }

    private Token emit(TokenKind kind) {
        String lexeme = text.substring(tokStart, pos);
        boolean significant = !kind.isTrivia();
        int d = depth();
        boolean starts = significant && nextStartsStatement && d == 0;
        Token t = new Token(kind, lexeme, tokStart, pos, tokLine, tokColumn, d, starts);
        tokens.add(t);
        if (significant) {
            lastSignificant = t;
            nextStartsStatement = false;
        }
        return t;
    }
}
