package com.initialone.jmtoc.ast;

import com.initialone.jmtoc.diagnostics.Diagnostic;
import com.initialone.jmtoc.diagnostics.SyntaxException;
import com.initialone.jmtoc.diagnostics.TranslationException;
import com.initialone.jmtoc.diagnostics.UnsupportedConstructException;
import com.initialone.jmtoc.lex.Scanner;
import com.initialone.jmtoc.lex.Token;
import com.initialone.jmtoc.lex.TokenKind;
import com.initialone.jmtoc.model.AccessorKind;
import com.initialone.jmtoc.model.Attribute;
import com.initialone.jmtoc.model.Block;
import com.initialone.jmtoc.model.BlockKind;
import com.initialone.jmtoc.model.ClassDeclaration;
import com.initialone.jmtoc.model.Declaration;
import com.initialone.jmtoc.model.DocComment;
import com.initialone.jmtoc.model.Modifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for one classdef file.
 *
 * Structural keywords only count at the start of a statement. The scanner flags the tokens
 * that follow a line break, {@code ;} or {@code ,}; after a class header, an attribute list
 * or a block header the parser itself treats the next token as a new statement, which is what
 * allows {@code classdef A < B  properties  x;  end end} on one line.
 */
public final class ClassParser {

    /** Statement keywords that open a block closed by {@code end} inside a function body. */
    private static final Set<String> BODY_OPENERS = Set.of(
            "if", "for", "parfor", "while", "switch", "try", "spmd", "function");

    private final String sourceName;
    private final String text;
    private final List<Token> tokens;
    private int pos;
    private Token previous;
    private Token forcedStart;

    private final List<SourceItem> items = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /* comment block being collected between statements */
    private List<String> pendingLines;
    private int pendingStart;
    private int pendingEnd;
    private int pendingColumn;

    public ClassParser(String sourceName, String text, List<Token> tokens) {
        this.sourceName = sourceName;
        this.text = text;
        this.tokens = tokens;
    }

    /** Scans and parses {@code text}. */
    public static ParsedClass parse(String sourceName, String text) throws TranslationException {
        List<Token> tokens = new Scanner(sourceName, text).scan();
        return new ClassParser(sourceName, text, tokens).parse();
    }

    public ParsedClass parse() throws TranslationException {
        skipTrivia();
        Token first = peek();
        if (!atKeyword("classdef")) {
            if (first.kind() == TokenKind.EOF) {
                throw new UnsupportedConstructException(sourceName, first.line(), first.column(),
                        "no classdef found: script files are not supported");
            }
            if (atKeyword("function")) {
                throw unsupported(first, "function files are not supported, expected 'classdef'");
            }
            throw unsupported(first, "expected 'classdef', found '" + first.text()
                    + "': script files are not supported");
        }

        ClassDeclaration cls = parseHeader();
        parseClassBody(cls);
        parseAfterClass();
        resolveAccessors(cls);
        return new ParsedClass(sourceName, cls, List.copyOf(items), diagnostics);
    }

    /* ================= class level ================= */

    private ClassDeclaration parseHeader() throws TranslationException {
        Token keyword = next();
        skipContinuations();
        List<Attribute> attributes = peek().is(TokenKind.OPEN, "(") ? parseAttributes() : List.of();

        skipContinuations();
        Token nameToken = expectWord("class name");
        ClassDeclaration cls = new ClassDeclaration(nameToken.text(), keyword.line(), keyword.column());
        cls.setAttributes(attributes);

        skipContinuations();
        if (peek().is(TokenKind.OPERATOR, "<")) {
            next();
            while (true) {
                skipContinuations();
                cls.addSuperclass(parseDottedName("superclass name"));
                skipContinuations();
                if (peek().is(TokenKind.OPERATOR, "&") || peek().kind() == TokenKind.COMMA) {
                    next();
                    skipSeparatorLayout();
                    continue;
                }
                break;
            }
        }
        cls.setAnchorLine(previous.lastLine());
        items.add(new SourceItem.Anchor(cls));
        forceStatementStart();
        return cls;
    }

    private void parseClassBody(ClassDeclaration cls) throws TranslationException {
        while (true) {
            skipTrivia();
            Token t = peek();
            if (t.kind() == TokenKind.EOF) {
                throw new SyntaxException(sourceName, cls.startLine(), cls.column(),
                        "missing 'end' for classdef '" + cls.name() + "'");
            }
            if (!t.isWord() || !atStatementStart(t)) {
                throw syntax(t, "unexpected '" + t.text() + "' in classdef body");
            }
            String word = t.text();
            if (word.equals("end")) {
                next();
                items.add(new SourceItem.Statement(t.line()));
                forceStatementStart();
                return;
            }
            if (word.equals("enumeration")) {
                throw unsupported(t, "enumeration blocks are not supported");
            }
            BlockKind kind = BlockKind.fromKeyword(word);
            if (kind == null) {
                throw syntax(t, "unrecognized block keyword '" + word + "' in classdef body");
            }
            cls.addBlock(parseBlock(kind));
        }
    }

    private void parseAfterClass() throws TranslationException {
        skipTrivia();
        Token t = peek();
        if (t.kind() == TokenKind.EOF) {
            return;
        }
        if (atKeyword("function")) {
            throw unsupported(t, "local functions after the classdef block are not supported");
        }
        throw syntax(t, "unexpected '" + t.text() + "' after the end of the classdef block");
    }

    /* ================= blocks ================= */

    private Block parseBlock(BlockKind kind) throws TranslationException {
        Token keyword = next();
        skipContinuations();
        List<Attribute> attributes = peek().is(TokenKind.OPEN, "(") ? parseAttributes() : List.of();
        Block block = new Block(kind, attributes, keyword.line(), keyword.column());
        boolean abstractBlock = kind == BlockKind.METHODS
                && AttributeResolver.isEnabled(attributes, Modifier.ABSTRACT);

        items.add(new SourceItem.Statement(keyword.line()));
        forceStatementStart();

        while (true) {
            skipTrivia();
            Token t = peek();
            if (t.kind() == TokenKind.EOF) {
                throw new SyntaxException(sourceName, keyword.line(), keyword.column(),
                        "unterminated '" + kind.keyword() + "' block: missing 'end'");
            }
            if (atKeyword("end")) {
                next();
                items.add(new SourceItem.Statement(t.line()));
                forceStatementStart();
                return block;
            }
            switch (kind) {
                case PROPERTIES -> block.add(parseProperty());
                case EVENTS -> block.add(parseEvent());
                case METHODS -> block.add(parseMethod(abstractBlock));
            }
        }
    }

    /**
     * {@code ( Key, ~Key, Key = value, ... )}. Values are kept as raw text; the resolver
     * interprets them.
     */
    private List<Attribute> parseAttributes() throws TranslationException {
        Token open = next();
        int listDepth = open.depth() + 1;
        List<Attribute> out = new ArrayList<>();
        while (true) {
            skipInsideBrackets();
            Token t = peek();
            if (t.is(TokenKind.CLOSE, ")") && t.depth() == open.depth()) {
                next();
                return out;
            }
            if (t.kind() == TokenKind.COMMA) {
                next();
                continue;
            }
            boolean negated = false;
            if (t.is(TokenKind.OPERATOR, "~") || t.is(TokenKind.OPERATOR, "!")) {
                negated = true;
                next();
                skipInsideBrackets();
                t = peek();
            }
            if (!t.isWord()) {
                throw syntax(t, "expected attribute name, found '" + t.text() + "'");
            }
            next();
            skipInsideBrackets();
            String value = null;
            if (peek().is(TokenKind.OPERATOR, "=")) {
                next();
                skipInsideBrackets();
                value = captureAttributeValue(listDepth);
            }
            out.add(new Attribute(t.text(), value, negated, t.line(), t.column()));
        }
    }

    private String captureAttributeValue(int listDepth) throws TranslationException {
        Token first = peek();
        Token last = null;
        while (true) {
            Token t = peek();
            boolean listComma = t.kind() == TokenKind.COMMA && t.depth() == listDepth;
            boolean listClose = t.kind() == TokenKind.CLOSE && t.depth() == listDepth - 1;
            if (t.kind() == TokenKind.EOF || listComma || listClose) {
                break;
            }
            last = next();
        }
        if (last == null) {
            throw syntax(first, "missing attribute value after '='");
        }
        return text.substring(first.start(), last.end()).strip();
    }

    /* ================= members ================= */

    private Declaration parseProperty() throws TranslationException {
        Token nameToken = peek();
        if (!nameToken.isWord()) {
            throw syntax(nameToken, "expected property name, found '" + nameToken.text() + "'");
        }
        next();
        Declaration d = new Declaration(nameToken.text(), nameToken.line(), nameToken.column());

        skipContinuations();
        if (peek().is(TokenKind.OPERATOR, "@")) {
            next();
            skipContinuations();
            d.setType(parseDottedName("property type"));
        } else {
            if (peek().is(TokenKind.OPEN, "(")) {
                skipBracketed();
                skipContinuations();
            }
            if (peek().isWord()) {
                d.setType(parseDottedName("property type"));
                skipContinuations();
            }
            if (peek().is(TokenKind.OPEN, "{")) {
                skipBracketed();
            }
        }

        skipContinuations();
        if (peek().is(TokenKind.OPERATOR, "=")) {
            next();
            skipContinuations();
            d.setDefaultValue(captureUntilStatementEnd());
        }
        expectStatementEnd("property '" + d.name() + "'");
        d.setAnchorLine(previous.lastLine());
        items.add(new SourceItem.Anchor(d));
        return d;
    }

    private Declaration parseEvent() throws TranslationException {
        Token nameToken = expectWord("event name");
        Declaration d = new Declaration(nameToken.text(), nameToken.line(), nameToken.column());
        skipContinuations();
        expectStatementEnd("event '" + d.name() + "'");
        items.add(new SourceItem.Anchor(d));
        return d;
    }

    private Declaration parseMethod(boolean abstractBlock) throws TranslationException {
        Token start = peek();
        boolean hasFunctionKeyword = atKeyword("function");
        if (hasFunctionKeyword) {
            next();
            skipContinuations();
        }

        List<String> returns = new ArrayList<>();
        if (hasAssignmentAhead()) {
            if (peek().is(TokenKind.OPEN, "[")) {
                returns.addAll(parseNameList("[", "]", "output name"));
            } else {
                returns.add(expectWord("output name").text());
            }
            skipContinuations();
            expectOperator("=");
            skipContinuations();
        }

        Token nameToken = peek();
        String name = parseDottedName("method name");
        List<String> params = new ArrayList<>();
        skipContinuations();
        if (peek().is(TokenKind.OPEN, "(")) {
            params.addAll(parseNameList("(", ")", "parameter name"));
        }
        expectStatementEnd("signature of '" + name + "'");

        Declaration d = new Declaration(name, start.line(), start.column());
        d.setReturns(returns);
        d.setParameters(params);
        d.setAnchorLine(previous.lastLine());
        markIfAccessor(d, nameToken);
        items.add(new SourceItem.Anchor(d));

        if (abstractBlock) {
            d.setAbstract(true);
        } else if (!hasFunctionKeyword) {
            d.setExternal(true);
        } else {
            collectDocAfterSignature(d);
            d.setBody(parseFunctionBody(start, name));
            items.add(new SourceItem.Statement(previous.line()));
            forceStatementStart();
        }
        return d;
    }

    private void markIfAccessor(Declaration d, Token nameToken) throws TranslationException {
        String[] parts = d.name().split("\\.");
        if (parts.length < 2) {
            return;
        }
        AccessorKind kind = AccessorKind.fromPrefix(parts[0]);
        if (kind == null || parts.length != 2) {
            throw unsupported(nameToken, "dotted method name '" + d.name() + "' is not a property accessor");
        }
        d.markAccessor(kind, parts[1]);
    }

    /**
     * MATLAB help text sits right below the signature, inside the body. That block (and a
     * comment on the signature line itself) is taken out of the body and becomes a comment item
     * directly after the method's anchor.
     */
    private void collectDocAfterSignature(Declaration d) {
        List<String> lines = new ArrayList<>();
        int startLine = -1;
        int endLine = -1;
        int column = 1;

        while (peek().kind() == TokenKind.SEMICOLON || peek().kind() == TokenKind.COMMA) {
            next();
        }
        if (peek().kind() == TokenKind.COMMENT) {
            Token c = next();
            lines.add(stripPercent(c.text()));
            startLine = c.line();
            endLine = c.line();
            column = c.column();
        }
        if (peek().kind() == TokenKind.NEWLINE) {
            next();
        }
        while (peek().kind().isComment()) {
            Token c = peek();
            int expected = lines.isEmpty() ? d.anchorLine() + 1 : endLine + 1;
            if (c.line() != expected) {
                break;
            }
            next();
            if (lines.isEmpty()) {
                startLine = c.line();
                column = c.column();
            }
            lines.addAll(commentLines(c));
            endLine = c.lastLine();
            if (peek().kind() == TokenKind.NEWLINE) {
                next();
            }
        }
        if (!lines.isEmpty()) {
            items.add(new SourceItem.Comments(DocComment.of(lines, startLine, endLine, column)));
        }
    }

    /**
     * Copies the body up to the matching {@code end}, keeping its layout. MATLAB comments
     * become {@code //} comments so they cannot interfere with the surrounding pseudo-code.
     */
    private String parseFunctionBody(Token functionToken, String name) throws TranslationException {
        StringBuilder body = new StringBuilder();
        int cursor = tokens.get(pos - 1).end();
        int depth = 1;
        while (true) {
            Token t = peek();
            if (t.kind() == TokenKind.EOF) {
                throw new SyntaxException(sourceName, functionToken.line(), functionToken.column(),
                        "missing 'end' for function '" + name + "'");
            }
            if (t.isWord() && atStatementStart(t)) {
                if (BODY_OPENERS.contains(t.text()) || isArgumentsBlock()) {
                    depth++;
                } else if (t.is("end")) {
                    depth--;
                    if (depth == 0) {
                        body.append(text, cursor, t.start());
                        next();
                        return body.toString().stripTrailing();
                    }
                }
            }
            body.append(text, cursor, t.start());
            body.append(renderBodyToken(t));
            cursor = t.end();
            next();
        }
    }

    /** {@code arguments} opens a validation block only when nothing but a line end or attributes follow. */
    private boolean isArgumentsBlock() {
        Token t = peek();
        if (!t.is("arguments")) {
            return false;
        }
        Token after = pos + 1 < tokens.size() ? tokens.get(pos + 1) : t;
        return after.kind() == TokenKind.NEWLINE || after.kind().isComment()
                || after.kind() == TokenKind.EOF || after.is(TokenKind.OPEN, "(");
    }

    private static String renderBodyToken(Token t) {
        if (t.kind() == TokenKind.COMMENT) {
            return "//" + t.text().substring(1);
        }
        if (t.kind() == TokenKind.BLOCK_COMMENT) {
            return "//" + t.text().replace("\n", "\n//");
        }
        if (t.kind() == TokenKind.STRING) {
            return cString(t.text(), '\'');
        }
        if (t.kind() == TokenKind.DQ_STRING) {
            return cString(t.text(), '"');
        }
        return t.text();
    }

    /** Re-quotes a literal the way a C lexer reads it, so braces and quotes inside stay inert. */
    static String cString(String literal, char quote) {
        String inner = literal.substring(1, literal.length() - 1)
                .replace(String.valueOf(quote) + quote, String.valueOf(quote));
        return "\"" + inner.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /* ================= statement helpers ================= */

    /** Raw source of the rest of the statement, continuations and inner line breaks included. */
    private String captureUntilStatementEnd() throws TranslationException {
        Token first = peek();
        if (first.endsStatement()) {
            throw syntax(first, "missing default value after '='");
        }
        Token last = first;
        while (!peek().endsStatement()) {
            last = next();
        }
        return text.substring(first.start(), last.end()).stripTrailing();
    }

    private boolean hasAssignmentAhead() {
        for (int i = pos; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.endsStatement()) {
                return false;
            }
            if (t.depth() == 0 && t.is(TokenKind.OPERATOR, "=")) {
                return true;
            }
        }
        return false;
    }

    private List<String> parseNameList(String open, String close, String what) throws TranslationException {
        Token openToken = next();
        if (!openToken.is(open)) {
            throw syntax(openToken, "expected '" + open + "'");
        }
        List<String> names = new ArrayList<>();
        while (true) {
            skipInsideBrackets();
            Token t = peek();
            if (t.is(TokenKind.CLOSE, close) && t.depth() == openToken.depth()) {
                next();
                return names;
            }
            if (t.kind() == TokenKind.COMMA) {
                next();
            } else if (t.isWord() || t.is(TokenKind.OPERATOR, "~")) {
                names.add(next().text());
            } else {
                throw syntax(t, "unexpected '" + t.text() + "', expected " + what);
            }
        }
    }

    private String parseDottedName(String what) throws TranslationException {
        StringBuilder name = new StringBuilder(expectWord(what).text());
        while (peek().is(TokenKind.OPERATOR, ".") && peek().start() == previous.end()) {
            next();
            name.append('.').append(expectWord(what).text());
        }
        return name.toString();
    }

    private void skipBracketed() {
        Token open = next();
        while (!(peek().kind() == TokenKind.CLOSE && peek().depth() == open.depth())
                && peek().kind() != TokenKind.EOF) {
            next();
        }
        next();
    }

    private void expectStatementEnd(String context) throws TranslationException {
        Token t = peek();
        if (!t.endsStatement()) {
            throw syntax(t, "unexpected '" + t.text() + "' after " + context);
        }
    }

    private void expectOperator(String op) throws TranslationException {
        Token t = peek();
        if (!t.is(TokenKind.OPERATOR, op)) {
            throw syntax(t, "expected '" + op + "', found '" + t.text() + "'");
        }
        next();
    }

    private Token expectWord(String what) throws TranslationException {
        Token t = peek();
        if (!t.isWord()) {
            throw syntax(t, "expected " + what + ", found '" + describe(t) + "'");
        }
        return next();
    }

    private boolean atStatementStart(Token t) {
        return t.statementStart() || t == forcedStart;
    }

    private boolean atKeyword(String word) {
        Token t = peek();
        return t.isWord() && t.is(word) && atStatementStart(t);
    }

    /** The next significant token on the same logical line starts a new statement. */
    private void forceStatementStart() {
        int i = pos;
        while (tokens.get(i).kind() == TokenKind.CONTINUATION) {
            i++;
        }
        Token t = tokens.get(i);
        if (!t.kind().isTrivia()) {
            forcedStart = t;
        }
    }

    /* ================= trivia and comment blocks ================= */

    /**
     * Skips statement separators and collects comments into blocks. A block ends at a blank
     * line or at the next statement.
     */
    private void skipTrivia() {
        while (true) {
            Token t = peek();
            TokenKind k = t.kind();
            if (k.isComment()) {
                addToPendingComments(t);
                next();
            } else if (k == TokenKind.NEWLINE || k == TokenKind.CONTINUATION
                    || ((k == TokenKind.SEMICOLON || k == TokenKind.COMMA) && t.depth() == 0)) {
                next();
            } else {
                flushPendingComments();
                return;
            }
        }
    }

    private void addToPendingComments(Token t) {
        if (pendingLines != null && (t.line() > pendingEnd + 1 || trailsCode(t))) {
            flushPendingComments();
        }
        if (pendingLines == null) {
            pendingLines = new ArrayList<>();
            pendingStart = t.line();
            pendingColumn = t.column();
        }
        pendingLines.addAll(commentLines(t));
        pendingEnd = t.lastLine();
    }

    /** Comment on the same line as the code before it. */
    private boolean trailsCode(Token comment) {
        if (pos == 0) {
            return false;
        }
        Token before = tokens.get(pos - 1);
        return before.kind() != TokenKind.NEWLINE && before.line() == comment.line();
    }

    private void flushPendingComments() {
        if (pendingLines != null) {
            items.add(new SourceItem.Comments(
                    DocComment.of(pendingLines, pendingStart, pendingEnd, pendingColumn)));
            pendingLines = null;
        }
    }

    /** Comment text without the {@code %} markers; block comments lose their delimiter lines. */
    private static List<String> commentLines(Token t) {
        if (t.kind() == TokenKind.COMMENT) {
            return List.of(stripPercent(t.text()));
        }
        String[] raw = t.text().split("\n", -1);
        List<String> out = new ArrayList<>();
        for (int i = 1; i < raw.length - 1; i++) {
            out.add(raw[i]);
        }
        return out;
    }

    private static String stripPercent(String comment) {
        int i = 0;
        while (i < comment.length() && comment.charAt(i) == '%') i++;
        return comment.substring(i);
    }

    /* ================= token access ================= */

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.kind() != TokenKind.EOF) {
            pos++;
        }
        if (!t.kind().isTrivia()) {
            previous = t;
        }
        return t;
    }

    private void skipContinuations() {
        while (peek().kind() == TokenKind.CONTINUATION) {
            next();
        }
    }

    /** Inside brackets line breaks and comments carry no meaning. */
    private void skipInsideBrackets() {
        while (peek().kind().isTrivia()) {
            next();
        }
    }

    /** After {@code &} or {@code ,} in a superclass list the next name may be on a new line. */
    private void skipSeparatorLayout() {
        while (peek().kind() == TokenKind.NEWLINE || peek().kind() == TokenKind.CONTINUATION) {
            next();
        }
    }

    /* ================= accessors ================= */

    private void resolveAccessors(ClassDeclaration cls) throws TranslationException {
        for (Declaration d : cls.declarations()) {
            if (!d.isAccessor()) {
                continue;
            }
            Declaration property = cls.findProperty(d.accessedProperty());
            if (property == null) {
                throw new SyntaxException(sourceName, d.startLine(), d.column(),
                        "accessor '" + d.name() + "' refers to undeclared property '"
                                + d.accessedProperty() + "'");
            }
            int expected = d.accessorKind() == AccessorKind.GET ? 1 : 2;
            if (d.parameters().size() != expected) {
                String rule = d.accessorKind() == AccessorKind.GET
                        ? "must take only the object argument"
                        : "must take the object and exactly one value argument";
                throw new SyntaxException(sourceName, d.startLine(), d.column(),
                        "accessor '" + d.name() + "' " + rule);
            }
            if (AttributeResolver.isEnabled(d.block().attributes(), Modifier.STATIC)) {
                throw new SyntaxException(sourceName, d.startLine(), d.column(),
                        "accessor '" + d.name() + "' cannot be static");
            }
            d.setAccessorTarget(property);
        }
    }

    /* ================= errors ================= */

    private SyntaxException syntax(Token t, String message) {
        return new SyntaxException(sourceName, t.line(), t.column(), message);
    }

    private UnsupportedConstructException unsupported(Token t, String message) {
        return new UnsupportedConstructException(sourceName, t.line(), t.column(), message);
    }

    private static String describe(Token t) {
        return switch (t.kind()) {
            case EOF -> "end of file";
            case NEWLINE -> "end of line";
            default -> t.text();
        };
    }
}
