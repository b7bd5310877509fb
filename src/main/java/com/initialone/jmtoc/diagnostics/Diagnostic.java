package com.initialone.jmtoc.diagnostics;

import java.util.Locale;

/**
 * One entry of the diagnostic stream. Fatal errors of a file end up here too when the
 * batch driver records them.
 */
public record Diagnostic(Severity severity, Kind kind, String source, int line, int column, String message) {

    public enum Severity { INFO, WARNING, ERROR }

    public enum Kind {
        LEX_ERROR,
        SYNTAX_ERROR,
        UNSUPPORTED_CONSTRUCT,
        ASSOCIATION_AMBIGUITY,
        ATTRIBUTE_CONFLICT,
        UNKNOWN_ATTRIBUTE,
        PARAMETER_COUNT,
        IO_ERROR
    }

    public static Diagnostic info(Kind kind, String source, int line, int column, String message) {
        return new Diagnostic(Severity.INFO, kind, source, line, column, message);
    }

    public static Diagnostic warning(Kind kind, String source, int line, int column, String message) {
        return new Diagnostic(Severity.WARNING, kind, source, line, column, message);
    }

    /** {@code path:line:column: message} for errors, with the severity spelled out otherwise. */
    public String format() {
        String prefix = source + ":" + line + ":" + column + ": ";
        if (severity == Severity.ERROR) {
            return prefix + message;
        }
        return prefix + severity.name().toLowerCase(Locale.ROOT) + ": " + message;
    }
}
