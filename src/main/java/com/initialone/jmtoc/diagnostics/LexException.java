package com.initialone.jmtoc.diagnostics;

/** Unterminated literal or block comment. */
public class LexException extends TranslationException {

    public LexException(String source, int line, int column, String detail) {
        super(source, line, column, detail);
    }

    @Override
    public Diagnostic.Kind kind() {
        return Diagnostic.Kind.LEX_ERROR;
    }
}
