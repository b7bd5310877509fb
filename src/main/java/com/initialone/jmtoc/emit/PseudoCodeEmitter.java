package com.initialone.jmtoc.emit;

import com.initialone.jmtoc.ast.TypeSubstitution;
import com.initialone.jmtoc.model.Access;
import com.initialone.jmtoc.model.Block;
import com.initialone.jmtoc.model.ClassDeclaration;
import com.initialone.jmtoc.model.Declaration;
import com.initialone.jmtoc.model.DocComment;
import com.initialone.jmtoc.model.Documentation;
import com.initialone.jmtoc.model.Modifier;
import com.initialone.jmtoc.util.Tools;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes the C++-like pseudo-code doxygen reads in place of the MATLAB file.
 *
 * Every declaration is followed by its own comment ({@code @var} / {@code @fn}), so doxygen never
 * has to guess what a comment belongs to. Members are grouped into access regions; a new region
 * header is only written when access or modifiers change.
 */
public final class PseudoCodeEmitter {

    static final String BANNER = """
            /* (Autoinserted by jmtoc)
             * This source code has been filtered by jmtoc, which renders a MATLAB classdef file as
             * pseudo-code that can be processed by the doxygen documentation tool.
             *
             * It can neither be interpreted by MATLAB nor compiled by a C++ compiler.
             * Except for the comments, the function bodies of the M-file are untouched.
             */
            """;

    private static final String INDENT = "    ";

    private final MacroTable macros;

    public PseudoCodeEmitter(MacroTable macros) {
        this.macros = macros;
    }

    public String emit(ClassDeclaration cls) {
        TypeSubstitution types = new TypeSubstitution(cls);
        StringBuilder out = new StringBuilder(BANNER).append('\n');

        classHeader(out, cls);

        Region current = null;
        for (Block block : cls.blocks()) {
            Region region = new Region(block.access().effective(), block.modifiers());
            for (Declaration d : block.declarations()) {
                if (!region.equals(current)) {
                    out.append('\n').append(region.header()).append('\n');
                    current = region;
                }
                out.append('\n');
                switch (block.kind()) {
                    case PROPERTIES -> property(out, d, types);
                    case EVENTS -> event(out, d, types);
                    case METHODS -> method(out, d, types);
                }
            }
        }
        out.append("\n};\n");
        return out.toString();
    }

    /* ================= class ================= */

    private void classHeader(StringBuilder out, ClassDeclaration cls) {
        out.append("class ").append(cls.name());
        List<String> bases = cls.superclasses();
        for (int i = 0; i < bases.size(); i++) {
            out.append('\n').append(i == 0 ? "  :public " : "   public ").append(Tools.qualify(bases.get(i)));
            if (i < bases.size() - 1) out.append(',');
        }
        out.append(" {\n");

        List<String> lines = new ArrayList<>();
        if (cls.group() != null && !cls.group().isBlank()) {
            lines.add(" @ingroup " + cls.group());
        }
        lines.addAll(docLines(cls.documentation(), null));
        comment(out, "@class \"" + cls.name() + "\"", lines);
    }

    /* ================= members ================= */

    private void property(StringBuilder out, Declaration d, TypeSubstitution types) {
        out.append(INDENT);
        if (d.block().has(Modifier.CONSTANT)) {
            out.append("static const ");
        }
        out.append(types.typeOf(d)).append(' ').append(d.name());
        if (d.defaultValue() != null) {
            out.append(" = ").append(d.defaultValue());
        }
        out.append(";\n");
        memberComment(out, "@var " + d.name(), d.documentation(), d.defaultValue());
    }

    private void event(StringBuilder out, Declaration d, TypeSubstitution types) {
        out.append(INDENT).append(types.typeOf(d)).append(' ').append(d.name()).append(";\n");
        memberComment(out, "@var " + d.name(), d.documentation(), null);
    }

    private void method(StringBuilder out, Declaration d, TypeSubstitution types) {
        String signature = types.signature(d);
        if (d.isAccessor()) {
            out.append("#if 0 //jmtoc: '").append(d.name()).append("'\n");
            out.append(signature);
            if (d.body() == null) {
                out.append(";\n");
            } else {
                body(out, d.body());
            }
            out.append("\n#endif\n");
        } else if (d.isAbstract()) {
            out.append(INDENT).append(types.isStatic(d) ? "static " : "virtual ").append(signature).append(" = 0;\n");
        } else {
            out.append(INDENT);
            if (types.isStatic(d)) out.append("static ");
            out.append(signature);
            if (d.isExternal()) {
                out.append(";\n");
            } else {
                body(out, d.body());
            }
        }
        memberComment(out, "@fn " + signature, d.documentation(), null);
    }

    private static void body(StringBuilder out, String body) {
        out.append(" {\n");
        if (body != null && !body.isBlank()) {
            out.append(body).append('\n');
        }
        out.append(INDENT).append("}\n");
    }

    /* ================= comments ================= */

    /** Members without text or notes get no comment; a default alone does not justify one. */
    private void memberComment(StringBuilder out, String head, Documentation doc, String defaultValue) {
        if (doc.isEmpty()) {
            return;
        }
        comment(out, head, docLines(doc, defaultValue));
    }

    private List<String> docLines(Documentation doc, String defaultValue) {
        List<String> lines = new ArrayList<>();
        if (doc.hasPrimary()) {
            lines.addAll(macros.expand(doc.primary().lines()));
        }
        for (DocComment extra : doc.supplementary()) {
            if (!lines.isEmpty()) lines.add("");
            lines.addAll(macros.expand(extra.lines()));
        }
        if (!doc.notes().isEmpty() && !lines.isEmpty()) {
            lines.add("");
        }
        for (String note : doc.notes()) {
            lines.add(" @note " + note);
        }
        if (defaultValue != null) {
            String[] parts = defaultValue.split("\n", -1);
            lines.add(" <br/>@b Default: " + parts[0]);
            for (int i = 1; i < parts.length; i++) {
                lines.add(parts[i]);
            }
        }
        return lines;
    }

    private static void comment(StringBuilder out, String head, List<String> lines) {
        out.append("/** ").append(head).append('\n');
        for (String line : lines) {
            out.append("  *").append(escape(line)).append('\n');
        }
        out.append("  */\n");
    }

    /** A literal comment terminator inside documentation text would end the comment early. */
    static String escape(String text) {
        return text.replace("*/", "* /");
    }

    /* ================= regions ================= */

    private record Region(Access access, Set<Modifier> modifiers) {

        String header() {
            String head = "  " + access.keyword() + ":";
            if (modifiers.isEmpty()) {
                return head;
            }
            return head + " /* ( " + modifiers.stream()
                    .map(Modifier::attributeName)
                    .collect(Collectors.joining(", ")) + " ) */";
        }
    }
}
