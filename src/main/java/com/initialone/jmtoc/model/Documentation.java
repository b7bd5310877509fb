package com.initialone.jmtoc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Everything that ends up in the emitted comment of one declaration. */
public final class Documentation {

    private DocComment primary;
    private final List<DocComment> supplementary = new ArrayList<>();
    private final Set<String> notes = new LinkedHashSet<>();

    public DocComment primary() {
        return primary;
    }

    public boolean hasPrimary() {
        return primary != null;
    }

    public void setPrimary(DocComment comment) {
        this.primary = comment;
    }

    /** Supplementary blocks in file order. */
    public List<DocComment> supplementary() {
        return Collections.unmodifiableList(supplementary);
    }

    public void addSupplementary(DocComment comment) {
        supplementary.add(comment);
    }

    /** Generated {@code @note} texts, first insertion wins the position. */
    public List<String> notes() {
        return List.copyOf(notes);
    }

    public void addNote(String note) {
        notes.add(note);
    }

    public boolean hasText() {
        return primary != null || !supplementary.isEmpty();
    }

    public boolean isEmpty() {
        return !hasText() && notes.isEmpty();
    }
}
