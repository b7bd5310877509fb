package com.initialone.jmtoc.ast;

import com.initialone.jmtoc.diagnostics.Diagnostic;
import com.initialone.jmtoc.model.Access;
import com.initialone.jmtoc.model.AccessPair;
import com.initialone.jmtoc.model.AccessorKind;
import com.initialone.jmtoc.model.Attribute;
import com.initialone.jmtoc.model.Block;
import com.initialone.jmtoc.model.BlockKind;
import com.initialone.jmtoc.model.ClassDeclaration;
import com.initialone.jmtoc.model.Declaration;
import com.initialone.jmtoc.model.Modifier;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Turns attribute lists into access pairs, modifier sets and the notes that accompany them.
 *
 * Repeated keys with different values are not resolved in favour of either occurrence: the key
 * is treated as absent and the conflict is both reported and written into the output as a note.
 */
public final class AttributeResolver {

    /** Modifiers that get a note on every member they apply to. */
    private static final Set<Modifier> NOTED = EnumSet.of(
            Modifier.HIDDEN, Modifier.TRANSIENT, Modifier.DEPENDENT, Modifier.SEALED,
            Modifier.SET_OBSERVABLE, Modifier.GET_OBSERVABLE, Modifier.ABORT_SET, Modifier.NON_COPYABLE);

    /** Attributes MATLAB knows that have no influence on the rendering. */
    private static final Set<String> IGNORED = Set.of(
            "description", "detaileddescription", "constructonload", "handlecompatible",
            "inferiorclasses", "allowedsubclasses", "framework", "partialmatchpriority");

    static final String PROPERTY_ATTRIBUTES_LINK = "<a href=\"http://www.mathworks.de/help/techdoc/matlab_oop/brjjwby.html\">"
            + "Matlab documentation of property attributes.</a>";
    static final String METHOD_ATTRIBUTES_LINK = "<a href=\"http://www.mathworks.com/help/matlab/matlab_oop/method-attributes.html\">"
            + "matlab documentation of method attributes.</a>";

    private final String sourceName;
    private final List<Diagnostic> diagnostics;

    public AttributeResolver(String sourceName, List<Diagnostic> diagnostics) {
        this.sourceName = sourceName;
        this.diagnostics = diagnostics;
    }

    public void resolve(ClassDeclaration cls) {
        resolveClass(cls);
        for (Block block : cls.blocks()) {
            resolveBlock(block);
            for (Declaration d : block.declarations()) {
                block.notes().forEach(d.documentation()::addNote);
                if (block.kind() == BlockKind.PROPERTIES && block.has(Modifier.CONSTANT)
                        && d.defaultValue() == null) {
                    d.setDefaultValue("[]");
                }
            }
        }
        addAccessorNotes(cls);
    }

    /**
     * True when {@code modifier} is switched on by the list. Used by the parser before the full
     * resolution runs; a conflicting key counts as not set.
     */
    public static boolean isEnabled(List<Attribute> attributes, Modifier modifier) {
        Boolean result = null;
        for (Attribute a : attributes) {
            if (Modifier.fromAttributeName(a.key()) != modifier) continue;
            Boolean value = toBoolean(a.effectiveValue());
            if (value == null || (result != null && !result.equals(value))) {
                return false;
            }
            result = value;
        }
        return Boolean.TRUE.equals(result);
    }

    /* ================= class ================= */

    private void resolveClass(ClassDeclaration cls) {
        Map<String, String> values = collect(cls.attributes(), "class", note -> cls.documentation().addNote(note));
        Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        for (Map.Entry<String, String> e : values.entrySet()) {
            Modifier m = Modifier.fromAttributeName(e.getKey());
            if (m == null) {
                if (!IGNORED.contains(lower(e.getKey()))) {
                    unknown(cls.attributes(), e.getKey(), "class");
                }
                continue;
            }
            Boolean on = booleanOrWarn(cls.attributes(), e.getKey(), e.getValue());
            if (Boolean.TRUE.equals(on)) {
                modifiers.add(m);
            }
        }
        cls.setModifiers(modifiers);
        if (modifiers.contains(Modifier.SEALED)) {
            cls.documentation().addNote("This class has the class property <tt>Sealed</tt> and cannot be derived from.");
        }
        if (modifiers.contains(Modifier.ABSTRACT)) {
            cls.documentation().addNote("This class has the class property <tt>Abstract</tt> and cannot be instantiated.");
        }
        if (modifiers.contains(Modifier.HIDDEN)) {
            cls.documentation().addNote("This class has the class property <tt>Hidden</tt> and is not listed by the MATLAB help functions.");
        }
    }

    /* ================= blocks ================= */

    private void resolveBlock(Block block) {
        String subject = subject(block.kind());
        Map<String, String> values = collect(block.attributes(), subject, block::addNote);

        boolean events = block.kind() == BlockKind.EVENTS;
        String setKey = events ? "notifyaccess" : "setaccess";
        String getKey = events ? "listenaccess" : "getaccess";

        Access both = null;
        Access set = null;
        Access get = null;
        Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);

        for (Map.Entry<String, String> e : values.entrySet()) {
            String key = lower(e.getKey());
            if (key.equals("access")) {
                both = accessOrWarn(block.attributes(), e.getKey(), e.getValue());
            } else if (key.equals(setKey)) {
                set = accessOrWarn(block.attributes(), e.getKey(), e.getValue());
            } else if (key.equals(getKey)) {
                get = accessOrWarn(block.attributes(), e.getKey(), e.getValue());
            } else if (Modifier.fromAttributeName(key) != null) {
                Modifier m = Modifier.fromAttributeName(key);
                if (Boolean.TRUE.equals(booleanOrWarn(block.attributes(), e.getKey(), e.getValue()))) {
                    modifiers.add(m);
                }
            } else if (!IGNORED.contains(key)) {
                unknown(block.attributes(), e.getKey(), subject);
            }
        }

        Access setAccess = set != null ? set : both != null ? both : Access.PUBLIC;
        Access getAccess = get != null ? get : both != null ? both : Access.PUBLIC;
        AccessPair pair = new AccessPair(setAccess, getAccess);
        block.setAccess(pair);
        block.setModifiers(modifiers);

        for (Modifier m : modifiers) {
            if (NOTED.contains(m)) {
                block.addNote(attributeNote(block.kind(), m.attributeName()));
            }
        }
        if (!pair.isSymmetric()) {
            String setName = events ? "NotifyAccess" : "SetAccess";
            String getName = events ? "ListenAccess" : "GetAccess";
            block.addNote("This " + subject + " has non-unique access specifier: <tt>"
                    + setName + " = " + setAccess.keyword() + ", "
                    + getName + " = " + getAccess.keyword() + "</tt>");
        }
        String link = documentationLink(block.kind());
        if (link != null && (!pair.isSymmetric() || modifiers.stream().anyMatch(NOTED::contains))) {
            block.addNote(link);
        }
    }

    /** Pointer to the MATLAB reference for the attributes noted above it; events have none. */
    private static String documentationLink(BlockKind kind) {
        return switch (kind) {
            case PROPERTIES -> PROPERTY_ATTRIBUTES_LINK;
            case METHODS -> METHOD_ATTRIBUTES_LINK;
            case EVENTS -> null;
        };
    }

    private static String attributeNote(BlockKind kind, String attribute) {
        return switch (kind) {
            case PROPERTIES -> "This property has the MATLAB attribute @c " + attribute + " set to true.";
            case METHODS -> "This method has the MATLAB method attribute @c " + attribute + " set to true.";
            case EVENTS -> "This event has the MATLAB attribute @c " + attribute + " set to true.";
        };
    }

    /* ================= accessors ================= */

    private void addAccessorNotes(ClassDeclaration cls) {
        Map<Declaration, Set<AccessorKind>> byProperty = new LinkedHashMap<>();
        for (Declaration d : cls.declarations()) {
            if (d.isAccessor() && d.accessorTarget() != null) {
                byProperty.computeIfAbsent(d.accessorTarget(), k -> EnumSet.noneOf(AccessorKind.class))
                        .add(d.accessorKind());
            }
        }
        byProperty.forEach((property, kinds) -> {
            String when;
            if (kinds.size() == 2) {
                when = "retrieved or changed";
            } else if (kinds.contains(AccessorKind.GET)) {
                when = "retrieved";
            } else {
                when = "changed";
            }
            property.documentation().addNote("This property has custom functionality when its value is " + when + ".");
        });
    }

    /* ================= attribute values ================= */

    /**
     * Key to value, keys in first-seen order. Repeats with the same value collapse; repeats with
     * different values drop the key and leave a note.
     */
    private Map<String, String> collect(List<Attribute> attributes, String subject,
                                        Consumer<String> noteSink) {
        Map<String, String> values = new LinkedHashMap<>();
        Map<String, List<String>> seen = new LinkedHashMap<>();
        Map<String, String> spelling = new LinkedHashMap<>();
        for (Attribute a : attributes) {
            String key = lower(a.key());
            spelling.putIfAbsent(key, a.key());
            seen.computeIfAbsent(key, k -> new ArrayList<>()).add(normalize(a.effectiveValue()));
        }
        for (Map.Entry<String, List<String>> e : seen.entrySet()) {
            List<String> distinct = e.getValue().stream().distinct().toList();
            String key = spelling.get(e.getKey());
            if (distinct.size() > 1) {
                Attribute first = find(attributes, e.getKey());
                diagnostics.add(Diagnostic.warning(Diagnostic.Kind.ATTRIBUTE_CONFLICT, sourceName,
                        first.line(), first.column(),
                        "attribute '" + key + "' is given conflicting values " + distinct
                                + "; it is ignored"));
                noteSink.accept("The " + subject + " attribute <tt>" + key + "</tt> is given conflicting values ("
                        + String.join(", ", distinct) + ") and is ignored.");
                continue;
            }
            values.put(key, distinct.get(0));
        }
        return values;
    }

    private Access accessOrWarn(List<Attribute> attributes, String key, String value) {
        Access access = toAccess(value);
        if (access == null) {
            Attribute a = find(attributes, lower(key));
            diagnostics.add(Diagnostic.warning(Diagnostic.Kind.UNKNOWN_ATTRIBUTE, sourceName, a.line(), a.column(),
                    "unrecognized value '" + value + "' for attribute '" + key + "'; using public"));
        }
        return access;
    }

    private Boolean booleanOrWarn(List<Attribute> attributes, String key, String value) {
        Boolean b = toBoolean(value);
        if (b == null) {
            Attribute a = find(attributes, lower(key));
            diagnostics.add(Diagnostic.warning(Diagnostic.Kind.UNKNOWN_ATTRIBUTE, sourceName, a.line(), a.column(),
                    "attribute '" + key + "' expects true or false, found '" + value + "'"));
        }
        return b;
    }

    private void unknown(List<Attribute> attributes, String key, String subject) {
        Attribute a = find(attributes, lower(key));
        diagnostics.add(Diagnostic.warning(Diagnostic.Kind.UNKNOWN_ATTRIBUTE, sourceName, a.line(), a.column(),
                "unknown " + subject + " attribute '" + key + "'"));
    }

    /**
     * {@code immutable} can only be set during construction, which is closest to private.
     * Meta-class lists grant access to named classes only, which is rendered as protected;
     * an empty list grants access to nobody.
     */
    static Access toAccess(String raw) {
        String v = normalize(raw);
        if (v.equals("{}")) return Access.PRIVATE;
        if (v.startsWith("?") || v.startsWith("{")) return Access.PROTECTED;
        return switch (v) {
            case "public" -> Access.PUBLIC;
            case "protected" -> Access.PROTECTED;
            case "private", "immutable" -> Access.PRIVATE;
            default -> null;
        };
    }

    static Boolean toBoolean(String raw) {
        return switch (normalize(raw)) {
            case "true", "1" -> Boolean.TRUE;
            case "false", "0" -> Boolean.FALSE;
            default -> null;
        };
    }

    /** Lower case, quotes and inner blanks removed: {@code 'Private'} and {@code private} compare equal. */
    private static String normalize(String raw) {
        String v = raw.strip();
        if (v.length() >= 2 && (v.startsWith("'") && v.endsWith("'") || v.startsWith("\"") && v.endsWith("\""))) {
            v = v.substring(1, v.length() - 1);
        }
        return v.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    private static Attribute find(List<Attribute> attributes, String lowerKey) {
        for (Attribute a : attributes) {
            if (lower(a.key()).equals(lowerKey)) return a;
        }
        throw new IllegalStateException("attribute not found: " + lowerKey);
    }

    private static String subject(BlockKind kind) {
        return switch (kind) {
            case PROPERTIES -> "property";
            case METHODS -> "method";
            case EVENTS -> "event";
        };
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
