package com.initialone.jmtoc.model;

/** Property accessor methods, named {@code get.<property>} and {@code set.<property>}. */
public enum AccessorKind {
    GET("get"),
    SET("set");

    private final String prefix;

    AccessorKind(String prefix) {
        this.prefix = prefix;
    }

    public static AccessorKind fromPrefix(String prefix) {
        for (AccessorKind k : values()) {
            if (k.prefix.equals(prefix)) return k;
        }
        return null;
    }
}
