package com.initialone.jmtoc.model;

import java.util.Locale;

/** Access level of a member, ordered from least to most restrictive. */
public enum Access {
    PUBLIC,
    PROTECTED,
    PRIVATE;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
