package com.initialone.jmtoc.diagnostics;

/** Unexpected token, unbalanced bracket or unterminated block. */
public class SyntaxException extends TranslationException {

    public SyntaxException(String source, int line, int column, String detail) {
        super(source, line, column, detail);
    }

    @Override
    public Diagnostic.Kind kind() {
        return Diagnostic.Kind.SYNTAX_ERROR;
    }
}
