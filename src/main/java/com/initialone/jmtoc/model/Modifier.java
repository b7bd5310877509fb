package com.initialone.jmtoc.model;

import java.util.Locale;

/**
 * Boolean block and class attributes. Declaration order is the order they are listed in
 * region annotations.
 */
public enum Modifier {
    ABORT_SET("AbortSet"),
    ABSTRACT("Abstract"),
    CONSTANT("Constant"),
    DEPENDENT("Dependent"),
    GET_OBSERVABLE("GetObservable"),
    HIDDEN("Hidden"),
    NON_COPYABLE("NonCopyable"),
    SEALED("Sealed"),
    SET_OBSERVABLE("SetObservable"),
    STATIC("Static"),
    TRANSIENT("Transient");

    private final String attributeName;

    Modifier(String attributeName) {
        this.attributeName = attributeName;
    }

    /** Spelling used in MATLAB attribute lists. */
    public String attributeName() {
        return attributeName;
    }

    /** Case-insensitive lookup by attribute name, or {@code null}. */
    public static Modifier fromAttributeName(String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        for (Modifier m : values()) {
            if (m.attributeName.toLowerCase(Locale.ROOT).equals(wanted)) {
                return m;
            }
        }
        return null;
    }
}
