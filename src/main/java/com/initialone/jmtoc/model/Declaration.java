package com.initialone.jmtoc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A property, method or event member. The owning {@link Block} is set when the declaration is
 * added to it.
 *
 * Accessor methods ({@code get.P}, {@code set.P}) are plain method declarations that carry a
 * back-reference to the property they serve; the property does not own them.
 */
public final class Declaration implements Documentable {

    private final String name;
    private final int startLine;
    private final int column;
    private int anchorLine;

    private Block block;

    private String type;
    private String defaultValue;

    private final List<String> parameters = new ArrayList<>();
    private final List<String> returns = new ArrayList<>();
    private boolean abstractMethod;
    private boolean external;
    private String body;

    private AccessorKind accessorKind;
    private String accessedProperty;
    private Declaration accessorTarget;

    private final Documentation documentation = new Documentation();

    public Declaration(String name, int startLine, int column) {
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

    public Block block() {
        return block;
    }

    void setBlock(Block block) {
        this.block = block;
    }

    public BlockKind kind() {
        return block.kind();
    }

    /** Dotted type name as written, or {@code null}. */
    public String type() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    /** Default value exactly as written after {@code =}, or {@code null}. */
    public String defaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    public List<String> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    public void setParameters(List<String> names) {
        parameters.clear();
        parameters.addAll(names);
    }

    public List<String> returns() {
        return Collections.unmodifiableList(returns);
    }

    public void setReturns(List<String> names) {
        returns.clear();
        returns.addAll(names);
    }

    public boolean isAbstract() {
        return abstractMethod;
    }

    public void setAbstract(boolean abstractMethod) {
        this.abstractMethod = abstractMethod;
        if (abstractMethod) {
            this.body = null;
        }
    }

    /** Signature-only method in a non-abstract block, implemented in its own file. */
    public boolean isExternal() {
        return external;
    }

    public void setExternal(boolean external) {
        this.external = external;
    }

    /** Method body rendered for the output, or {@code null} for abstract and external methods. */
    public String body() {
        return body;
    }

    public void setBody(String body) {
        if (abstractMethod && body != null) {
            throw new IllegalStateException("abstract method " + name + " cannot carry a body");
        }
        this.body = body;
    }

    public boolean isAccessor() {
        return accessorKind != null;
    }

    public AccessorKind accessorKind() {
        return accessorKind;
    }

    /** Name of the property this accessor serves. */
    public String accessedProperty() {
        return accessedProperty;
    }

    public void markAccessor(AccessorKind kind, String propertyName) {
        this.accessorKind = kind;
        this.accessedProperty = propertyName;
    }

    /** Resolved property declaration, set once the whole class is parsed. */
    public Declaration accessorTarget() {
        return accessorTarget;
    }

    public void setAccessorTarget(Declaration property) {
        this.accessorTarget = property;
    }

    /** Name used in the output: accessors are rendered under their property's name. */
    public String emittedName() {
        return isAccessor() ? accessedProperty : name;
    }
}
