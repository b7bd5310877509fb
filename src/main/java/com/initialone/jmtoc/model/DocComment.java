package com.initialone.jmtoc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A block of consecutive comment lines. Each line keeps its text after the leading
 * {@code %} characters, spacing included.
 *
 * A block whose first line is {@code @var name}, {@code @fn name}, {@code @event name} or
 * {@code @class name} names its target explicitly; the tag line is removed from {@link #lines()}.
 */
public final class DocComment {

    public enum Role { PRIMARY, SUPPLEMENTARY }

    private static final Pattern TAG = Pattern.compile(
            "^\\s*[@\\\\](var|fn|event|class)\\s+([A-Za-z][\\w.]*)\\s?(.*)$");

    private final List<String> lines;
    private final int startLine;
    private final int endLine;
    private final int column;
    private final String tagCommand;
    private final String tagTarget;

    private Documentable target;
    private Role role;

    private DocComment(List<String> lines, int startLine, int endLine, int column,
                       String tagCommand, String tagTarget) {
        this.lines = Collections.unmodifiableList(lines);
        this.startLine = startLine;
        this.endLine = endLine;
        this.column = column;
        this.tagCommand = tagCommand;
        this.tagTarget = tagTarget;
    }

    public static DocComment of(List<String> rawLines, int startLine, int endLine, int column) {
        List<String> body = new ArrayList<>(rawLines);
        int first = 0;
        while (first < body.size() && body.get(first).isBlank()) first++;
        if (first < body.size()) {
            Matcher m = TAG.matcher(body.get(first));
            if (m.matches()) {
                List<String> rest = new ArrayList<>();
                if (!m.group(3).isBlank()) rest.add(" " + m.group(3));
                rest.addAll(body.subList(first + 1, body.size()));
                return new DocComment(rest, startLine, endLine, column, m.group(1), m.group(2));
            }
        }
        return new DocComment(body, startLine, endLine, column, null, null);
    }

    public List<String> lines() {
        return lines;
    }

    public int startLine() {
        return startLine;
    }

    public int endLine() {
        return endLine;
    }

    public int column() {
        return column;
    }

    public boolean isTagged() {
        return tagTarget != null;
    }

    /** {@code var}, {@code fn}, {@code event} or {@code class}; {@code null} when untagged. */
    public String tagCommand() {
        return tagCommand;
    }

    public String tagTarget() {
        return tagTarget;
    }

    public Documentable target() {
        return target;
    }

    public Role role() {
        return role;
    }

    public void bind(Documentable target, Role role) {
        this.target = target;
        this.role = role;
    }

    public boolean isBound() {
        return target != null;
    }
}
