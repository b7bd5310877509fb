package com.initialone.jmtoc.ast;

import com.initialone.jmtoc.model.DocComment;
import com.initialone.jmtoc.model.Documentable;

/**
 * Flat, file-ordered view of a parsed class used for documentation binding: declarations,
 * comment blocks and every other statement, so the associator can tell whether a comment is
 * directly adjacent to a declaration or separated from it by code.
 */
public interface SourceItem {

    /** A class or member declaration. */
    record Anchor(Documentable target) implements SourceItem { }

    /** A block of consecutive comment lines. */
    record Comments(DocComment comment) implements SourceItem { }

    /** Any other statement: block headers, {@code end}, method bodies. */
    record Statement(int line) implements SourceItem { }
}
