package com.initialone.jmtoc.model;

public enum BlockKind {
    PROPERTIES("properties"),
    METHODS("methods"),
    EVENTS("events");

    private final String keyword;

    BlockKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static BlockKind fromKeyword(String word) {
        for (BlockKind k : values()) {
            if (k.keyword.equals(word)) return k;
        }
        return null;
    }
}
