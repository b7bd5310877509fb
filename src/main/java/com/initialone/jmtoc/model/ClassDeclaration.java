package com.initialone.jmtoc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Root of the declaration tree. Exactly one per source file. */
public final class ClassDeclaration implements Documentable {

    private final String name;
    private final int startLine;
    private final int column;
    private int anchorLine;

    private final List<String> superclasses = new ArrayList<>();
    private final List<Attribute> attributes = new ArrayList<>();
    private final List<Block> blocks = new ArrayList<>();
    private Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
    private String group;

    private final Documentation documentation = new Documentation();

    public ClassDeclaration(String name, int startLine, int column) {
        this.name = name;
        this.startLine = startLine;
        this.column = column;
        this.anchorLine = startLine;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int startLine() {
        return startLine;
    }

    public int column() {
        return column;
    }

    @Override
    public int anchorLine() {
        return anchorLine;
    }

    public void setAnchorLine(int anchorLine) {
        this.anchorLine = anchorLine;
    }

    @Override
    public Documentation documentation() {
        return documentation;
    }

    /** Superclass names as written, dotted. */
    public List<String> superclasses() {
        return Collections.unmodifiableList(superclasses);
    }

    public void addSuperclass(String dottedName) {
        superclasses.add(dottedName);
    }

    public List<Attribute> attributes() {
        return Collections.unmodifiableList(attributes);
    }

    public void setAttributes(List<Attribute> list) {
        attributes.clear();
        attributes.addAll(list);
    }

    public Set<Modifier> modifiers() {
        return Collections.unmodifiableSet(modifiers);
    }

    public void setModifiers(Set<Modifier> modifiers) {
        this.modifiers = modifiers.isEmpty() ? EnumSet.noneOf(Modifier.class) : EnumSet.copyOf(modifiers);
    }

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    public void addBlock(Block block) {
        blocks.add(block);
    }

    /** Output grouping tag ({@code @ingroup}), supplied from outside; may be {@code null}. */
    public String group() {
        return group;
    }

    public void setGroup(String group) {
        this.group = group;
    }

    /** All declarations in file order. */
    public List<Declaration> declarations() {
        return blocks.stream()
                .flatMap(b -> b.declarations().stream())
                .collect(Collectors.toList());
    }

    /** Members with the given name in the given block kinds, file order. Accessors never match. */
    public List<Declaration> findMembers(String memberName, Set<BlockKind> kinds) {
        return declarations().stream()
                .filter(d -> kinds.contains(d.kind()))
                .filter(d -> !d.isAccessor())
                .filter(d -> d.name().equals(memberName))
                .collect(Collectors.toList());
    }

    public Declaration findProperty(String propertyName) {
        List<Declaration> found = findMembers(propertyName, EnumSet.of(BlockKind.PROPERTIES));
        return found.isEmpty() ? null : found.get(0);
    }
}
