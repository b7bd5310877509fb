package com.initialone.jmtoc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** A {@code properties}, {@code methods} or {@code events} block and its members. */
public final class Block {

    private final BlockKind kind;
    private final List<Attribute> attributes;
    private final int line;
    private final int column;
    private final List<Declaration> declarations = new ArrayList<>();

    /* filled in by the attribute resolver */
    private Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
    private AccessPair access = AccessPair.PUBLIC;
    private final Set<String> notes = new LinkedHashSet<>();

    public Block(BlockKind kind, List<Attribute> attributes, int line, int column) {
        this.kind = kind;
        this.attributes = List.copyOf(attributes);
        this.line = line;
        this.column = column;
    }

    public BlockKind kind() {
        return kind;
    }

    public List<Attribute> attributes() {
        return attributes;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public List<Declaration> declarations() {
        return Collections.unmodifiableList(declarations);
    }

    public void add(Declaration declaration) {
        declaration.setBlock(this);
        declarations.add(declaration);
    }

    public Set<Modifier> modifiers() {
        return Collections.unmodifiableSet(modifiers);
    }

    public boolean has(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    public void setModifiers(Set<Modifier> modifiers) {
        this.modifiers = modifiers.isEmpty() ? EnumSet.noneOf(Modifier.class) : EnumSet.copyOf(modifiers);
    }

    public AccessPair access() {
        return access;
    }

    public void setAccess(AccessPair access) {
        this.access = access;
    }

    /** Notes every member of this block carries (attribute notes, access notes, conflicts). */
    public List<String> notes() {
        return List.copyOf(notes);
    }

    public void addNote(String note) {
        notes.add(note);
    }
}
