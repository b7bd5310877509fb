package com.initialone.jmtoc.lex;

import com.initialone.jmtoc.diagnostics.LexException;
import com.initialone.jmtoc.diagnostics.SyntaxException;
import com.initialone.jmtoc.diagnostics.TranslationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ScannerTest {

    private static List<Token> scan(String text) throws TranslationException {
        return new Scanner("t.m", text).scan();
    }

    private static String kinds(List<Token> tokens) {
        return tokens.stream().map(t -> t.kind().name()).collect(Collectors.joining(" "));
    }

    @Test
    void quoteAfterIdentifierIsTranspose() throws Exception {
        List<Token> tokens = scan("a = b';");
        assertEquals("IDENTIFIER OPERATOR IDENTIFIER OPERATOR SEMICOLON EOF", kinds(tokens));
        assertEquals("'", tokens.get(3).text());
    }

    @Test
    void quoteAfterSpaceStartsLiteral() throws Exception {
        List<Token> tokens = scan("disp 'it''s (not) a bracket'");
        assertEquals(TokenKind.STRING, tokens.get(1).kind());
        assertEquals("'it''s (not) a bracket'", tokens.get(1).text());
        assertEquals(0, tokens.get(1).depth());
    }

    @Test
    void transposeChainsAfterClosingBracket() throws Exception {
        List<Token> tokens = scan("x = (a)'';");
        assertEquals("IDENTIFIER OPERATOR OPEN IDENTIFIER CLOSE OPERATOR OPERATOR SEMICOLON EOF", kinds(tokens));
    }

    @Test
    void doubleQuotedStringKeepsPercentSign() throws Exception {
        List<Token> tokens = scan("s = \"100% sure\" % real comment");
        assertEquals(TokenKind.DQ_STRING, tokens.get(2).kind());
        assertEquals(TokenKind.COMMENT, tokens.get(3).kind());
        assertEquals("% real comment", tokens.get(3).text());
    }

    @Test
    void keywordsOnlyAtStatementStart() throws Exception {
        List<Token> tokens = scan("end\nx(end) = 1; end");
        assertEquals(TokenKind.KEYWORD, tokens.get(0).kind());
        Token inner = tokens.stream().filter(t -> t.is("end") && t.depth() == 1).findFirst().orElseThrow();
        assertEquals(TokenKind.IDENTIFIER, inner.kind());
        assertEquals(TokenKind.KEYWORD, tokens.get(tokens.size() - 2).kind());
    }

    @Test
    void commaAndSemicolonStartNewStatements() throws Exception {
        List<Token> tokens = scan("a = 1, b = 2; c");
        List<String> starts = tokens.stream().filter(Token::statementStart).map(Token::text).collect(Collectors.toList());
        assertEquals(List.of("a", "b", "c"), starts);
    }

    @Test
    void continuationJoinsLines() throws Exception {
        List<Token> tokens = scan("x = 1 + ... comment\n  2\ny");
        assertEquals(TokenKind.CONTINUATION, tokens.get(4).kind());
        assertEquals("... comment\n", tokens.get(4).text());
        Token two = tokens.get(5);
        assertEquals("2", two.text());
        assertFalse(two.statementStart());
        assertEquals(2, two.line());
        assertEquals("y", tokens.get(7).text());
        assertTrue(tokens.get(7).statementStart());
    }

    @Test
    void blockCommentsNest() throws Exception {
        String text = "%{\nouter\n  %{\n  inner\n  %}\nstill outer\n%}\nx";
        List<Token> tokens = scan(text);
        assertEquals(TokenKind.BLOCK_COMMENT, tokens.get(0).kind());
        assertEquals(7, tokens.get(0).lastLine());
        assertEquals("x", tokens.get(2).text());
        assertEquals(8, tokens.get(2).line());
    }

    @Test
    void percentBraceWithTextIsLineComment() throws Exception {
        List<Token> tokens = scan("%{ not a block\nx");
        assertEquals(TokenKind.COMMENT, tokens.get(0).kind());
    }

    @Test
    void bracketDepthIgnoresLiteralContent() throws Exception {
        List<Token> tokens = scan("c = {'(', ']'};");
        Token close = tokens.get(tokens.size() - 3);
        assertEquals("}", close.text());
        assertEquals(0, close.depth());
    }

    @Test
    void numbersWithExponentAndImaginaryUnit() throws Exception {
        List<Token> tokens = scan("z = 1.5e-3 + .5i;");
        assertEquals("1.5e-3", tokens.get(2).text());
        assertEquals(".5i", tokens.get(4).text());
    }

    @Test
    void elementwiseOperatorAfterNumber() throws Exception {
        List<Token> tokens = scan("y = 2.*x;");
        assertEquals("2", tokens.get(2).text());
        assertEquals(".*", tokens.get(3).text());
    }

    @Test
    void unterminatedStringReportsOpener() {
        LexException e = assertThrows(LexException.class, () -> scan("x = 1;\ny = 'abc\nz"));
        assertEquals(2, e.getLine());
        assertEquals(5, e.getColumn());
        assertEquals("t.m:2:5: unterminated string literal", e.getMessage());
    }

    @Test
    void unterminatedBlockCommentReportsOpener() {
        LexException e = assertThrows(LexException.class, () -> scan("x\n%{\nnever closed\n"));
        assertEquals(2, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void unclosedBracketIsSyntaxError() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> scan("x = [1, 2;\n"));
        assertEquals(1, e.getLine());
        assertEquals(5, e.getColumn());
    }

    @Test
    void mismatchedCloserIsSyntaxError() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> scan("x = (1]"));
        assertTrue(e.getDetail().contains("'(' opened at line 1, column 5"));
    }
}
