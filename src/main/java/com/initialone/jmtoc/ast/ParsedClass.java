package com.initialone.jmtoc.ast;

import com.initialone.jmtoc.diagnostics.Diagnostic;
import com.initialone.jmtoc.model.ClassDeclaration;

import java.util.List;

/** Parser output: the declaration tree plus what the later stages need from the source. */
public record ParsedClass(String sourceName, ClassDeclaration declaration, List<SourceItem> items,
                          List<Diagnostic> diagnostics) {
}
