package com.initialone.jmtoc.model;

/**
 * One entry of an attribute list as written: {@code Constant}, {@code ~Hidden} or
 * {@code SetAccess = private}.
 *
 * @param value raw value text, {@code null} for a bare keyword
 */
public record Attribute(String key, String value, boolean negated, int line, int column) {

    public boolean isBare() {
        return value == null;
    }

    /** Value as it should be compared: bare keywords are {@code true}, negated ones {@code false}. */
    public String effectiveValue() {
        if (value != null) return value;
        return negated ? "false" : "true";
    }
}
