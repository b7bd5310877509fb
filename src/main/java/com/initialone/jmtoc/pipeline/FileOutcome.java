package com.initialone.jmtoc.pipeline;

import com.initialone.jmtoc.diagnostics.Diagnostic;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of one file in a batch.
 *
 * @param diagnostics non-fatal diagnostics, plus the fatal one when {@code status} is FAILED
 * @param error       message of the failure, {@code null} unless FAILED
 */
public record FileOutcome(Path source, Path target, Status status, List<Diagnostic> diagnostics, String error) {

    public enum Status { OK, FAILED, CANCELLED }

    static FileOutcome ok(Path source, Path target, List<Diagnostic> diagnostics) {
        return new FileOutcome(source, target, Status.OK, diagnostics, null);
    }

    static FileOutcome failed(Path source, Path target, List<Diagnostic> diagnostics, String error) {
        return new FileOutcome(source, target, Status.FAILED, diagnostics, error);
    }

    static FileOutcome cancelled(Path source, Path target) {
        return new FileOutcome(source, target, Status.CANCELLED, List.of(), null);
    }
}
