package com.initialone.jmtoc.ast;

import com.initialone.jmtoc.diagnostics.Diagnostic;
import com.initialone.jmtoc.model.BlockKind;
import com.initialone.jmtoc.model.ClassDeclaration;
import com.initialone.jmtoc.model.Declaration;
import com.initialone.jmtoc.model.DocComment;
import com.initialone.jmtoc.model.Documentable;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds comment blocks to the class and its members.
 *
 * <ul>
 *   <li>trailing: the block starts on the declaration's last signature line or on the line after
 *       it, with nothing in between;</li>
 *   <li>leading: the block ends on the line right before the declaration starts;</li>
 *   <li>tagged ({@code @var x}, {@code @fn f}, {@code @event e}, {@code @class C}): bound by name,
 *       wherever they are, and appended after the primary text.</li>
 * </ul>
 *
 * Trailing wins over leading. Blocks that bind to nothing are dropped.
 */
public final class DocAssociator {

    private final String sourceName;
    private final List<Diagnostic> diagnostics;

    public DocAssociator(String sourceName, List<Diagnostic> diagnostics) {
        this.sourceName = sourceName;
        this.diagnostics = diagnostics;
    }

    public void associate(ParsedClass parsed) {
        List<SourceItem> items = parsed.items();
        Map<Documentable, DocComment> primary = new LinkedHashMap<>();
        Map<Documentable, DocComment> leading = new LinkedHashMap<>();

        // trailing first, so a block between two members goes to the one above it
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof SourceItem.Comments c) || c.comment().isTagged()) continue;
            Documentable above = trailingTarget(items, i);
            if (above != null && !primary.containsKey(above)) {
                primary.put(above, c.comment());
                c.comment().bind(above, DocComment.Role.PRIMARY);
                Documentable below = leadingTarget(items, i);
                if (below != null) {
                    info(c.comment(), "comment block between '" + above.name() + "' and '" + below.name()
                            + "' is bound to '" + above.name() + "'");
                }
            }
        }

        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof SourceItem.Comments c) || c.comment().isTagged()) continue;
            if (c.comment().isBound()) continue;
            Documentable below = leadingTarget(items, i);
            if (below == null) continue;
            if (primary.containsKey(below)) {
                info(c.comment(), "comment block above '" + below.name()
                        + "' is ignored, the block after its declaration documents it");
                continue;
            }
            leading.put(below, c.comment());
        }
        leading.forEach((target, comment) -> {
            comment.bind(target, DocComment.Role.PRIMARY);
            primary.put(target, comment);
        });
        primary.forEach((target, comment) -> target.documentation().setPrimary(comment));

        for (SourceItem item : items) {
            if (item instanceof SourceItem.Comments c && c.comment().isTagged()) {
                bindTagged(parsed.declaration(), c.comment());
            }
        }
    }

    /** The declaration anchored directly before item {@code i}, if the block starts close enough. */
    private static Documentable trailingTarget(List<SourceItem> items, int i) {
        if (i == 0 || !(items.get(i - 1) instanceof SourceItem.Anchor a)) return null;
        DocComment c = ((SourceItem.Comments) items.get(i)).comment();
        int anchor = a.target().anchorLine();
        return c.startLine() == anchor || c.startLine() == anchor + 1 ? a.target() : null;
    }

    /** The declaration anchored directly after item {@code i}, if the block ends on the line above it. */
    private static Documentable leadingTarget(List<SourceItem> items, int i) {
        if (i + 1 >= items.size() || !(items.get(i + 1) instanceof SourceItem.Anchor a)) return null;
        DocComment c = ((SourceItem.Comments) items.get(i)).comment();
        return c.endLine() == a.target().startLine() - 1 ? a.target() : null;
    }

    private void bindTagged(ClassDeclaration cls, DocComment comment) {
        String command = comment.tagCommand();
        String target = comment.tagTarget();
        List<Documentable> candidates = new ArrayList<>();
        if (command.equals("class")) {
            if (cls.name().equals(target)) candidates.add(cls);
        } else {
            candidates.addAll(cls.findMembers(target, kindsFor(command)));
            if (candidates.isEmpty() && command.equals("fn")) {
                // accessors are documented under the property they serve
                for (Declaration d : cls.declarations()) {
                    if (d.isAccessor() && d.name().equals(target)) candidates.add(d);
                }
            }
        }
        if (candidates.isEmpty()) {
            info(comment, "@" + command + " '" + target + "' does not name a "
                    + (command.equals("class") ? "class" : "member") + " of '" + cls.name() + "'; block dropped");
            return;
        }
        if (candidates.size() > 1) {
            info(comment, "@" + command + " '" + target + "' matches " + candidates.size()
                    + " declarations; bound to the first");
        }
        Documentable bound = candidates.get(0);
        comment.bind(bound, DocComment.Role.SUPPLEMENTARY);
        bound.documentation().addSupplementary(comment);
    }

    private static Set<BlockKind> kindsFor(String command) {
        return switch (command) {
            case "var" -> EnumSet.of(BlockKind.PROPERTIES, BlockKind.EVENTS);
            case "event" -> EnumSet.of(BlockKind.EVENTS);
            default -> EnumSet.of(BlockKind.METHODS);
        };
    }

    private void info(DocComment comment, String message) {
        diagnostics.add(Diagnostic.info(Diagnostic.Kind.ASSOCIATION_AMBIGUITY, sourceName,
                comment.startLine(), comment.column(), message));
    }
}
