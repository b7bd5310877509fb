package com.initialone.jmtoc.diagnostics;

/** A construct the scanner and parser recognize but the translation does not handle. */
public class UnsupportedConstructException extends TranslationException {

    public UnsupportedConstructException(String source, int line, int column, String detail) {
        super(source, line, column, detail);
    }

    @Override
    public Diagnostic.Kind kind() {
        return Diagnostic.Kind.UNSUPPORTED_CONSTRUCT;
    }
}
