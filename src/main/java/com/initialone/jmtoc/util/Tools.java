package com.initialone.jmtoc.util;

import java.nio.file.Path;

public class Tools {

    /** {@code a.b.C} -> {@code ::a::b::C} */
    public static String qualify(String dotted) {
        return "::" + dotted.replace(".", "::");
    }

    /** {@code dir/Foo.m} -> {@code dir/Foo.cc} */
    public static Path withExtension(Path file, String ext) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return file.resolveSibling(base + ext);
    }

    /** Head of a long text for console output, cut at {@code max} characters. */
    public static String preview(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max) + " [...]";
    }
}
