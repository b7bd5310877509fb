package com.initialone.jmtoc.diagnostics;

/**
 * Fatal problem in one source file. Carries the exact location so drivers can print
 * {@code path:line:column: message} and move on to the next file.
 */
public abstract class TranslationException extends Exception {

    private final String source;
    private final int line;
    private final int column;
    private final String detail;

    protected TranslationException(String source, int line, int column, String detail) {
        super(source + ":" + line + ":" + column + ": " + detail);
        this.source = source;
        this.line = line;
        this.column = column;
        this.detail = detail;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** Message without the location prefix. */
    public String getDetail() {
        return detail;
    }

    public abstract Diagnostic.Kind kind();

    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Severity.ERROR, kind(), source, line, column, detail);
    }
}
