package com.initialone.jmtoc.ast;

import com.initialone.jmtoc.diagnostics.Diagnostic;
import com.initialone.jmtoc.model.Access;
import com.initialone.jmtoc.model.AccessPair;
import com.initialone.jmtoc.model.Block;
import com.initialone.jmtoc.model.ClassDeclaration;
import com.initialone.jmtoc.model.Modifier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AttributeResolverTest {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private ClassDeclaration resolve(String src) throws Exception {
        ClassDeclaration cls = ClassParser.parse("A.m", src).declaration();
        new AttributeResolver("A.m", diagnostics).resolve(cls);
        return cls;
    }

    private Block onlyBlock(String attributes) throws Exception {
        return resolve("classdef A\n properties " + attributes + "\n  p\n end\nend\n").blocks().get(0);
    }

    @Test
    void defaultIsPublic() throws Exception {
        Block b = onlyBlock("");
        assertEquals(AccessPair.PUBLIC, b.access());
        assertTrue(b.modifiers().isEmpty());
        assertTrue(b.declarations().get(0).documentation().notes().isEmpty());
    }

    @Test
    void specificAccessOverridesAccessRegardlessOfOrder() throws Exception {
        Block b = onlyBlock("(SetAccess = private, Access = protected)");
        assertEquals(new AccessPair(Access.PRIVATE, Access.PROTECTED), b.access());
        assertEquals(Access.PROTECTED, b.access().effective());
    }

    @Test
    void asymmetricAccessGetsExactlyOneNote() throws Exception {
        Block b = onlyBlock("(SetAccess = private, GetAccess = protected)");
        List<String> notes = b.declarations().get(0).documentation().notes();
        assertEquals(List.of("This property has non-unique access specifier: "
                + "<tt>SetAccess = private, GetAccess = protected</tt>",
                AttributeResolver.PROPERTY_ATTRIBUTES_LINK), notes);
    }

    @Test
    void immutableAndMetaClassListsMapToKnownLevels() throws Exception {
        assertEquals(Access.PRIVATE, onlyBlock("(SetAccess = immutable)").access().setAccess());
        assertEquals(Access.PROTECTED, onlyBlock("(Access = ?pkg.Friend)").access().getAccess());
        assertEquals(Access.PROTECTED, onlyBlock("(Access = {?A, ?B})").access().getAccess());
        assertEquals(Access.PRIVATE, onlyBlock("(Access = {})").access().getAccess());
        assertEquals(Access.PRIVATE, onlyBlock("(Access = 'private')").access().getAccess());
    }

    @Test
    void eventsUseNotifyAndListenAccess() throws Exception {
        ClassDeclaration cls = resolve("classdef A\n events (NotifyAccess = private)\n  E\n end\nend\n");
        Block b = cls.blocks().get(0);
        assertEquals(new AccessPair(Access.PRIVATE, Access.PUBLIC), b.access());
        assertTrue(b.notes().get(0).contains("NotifyAccess = private, ListenAccess = public"));
    }

    @Test
    void hiddenAndTransientBecomeNotes() throws Exception {
        Block b = onlyBlock("(Hidden, Transient = true)");
        assertEquals(Set.of(Modifier.HIDDEN, Modifier.TRANSIENT), b.modifiers());
        assertEquals(List.of(
                "This property has the MATLAB attribute @c Hidden set to true.",
                "This property has the MATLAB attribute @c Transient set to true.",
                AttributeResolver.PROPERTY_ATTRIBUTES_LINK),
                b.declarations().get(0).documentation().notes());
    }

    @Test
    void attributeNotesEndWithDocumentationLink() throws Exception {
        ClassDeclaration cls = resolve("classdef A\n methods (Hidden)\n  function f(obj)\n  end\n end\n"
                + " methods (Static)\n  function g()\n  end\n end\nend\n");
        List<String> hidden = cls.blocks().get(0).declarations().get(0).documentation().notes();
        assertEquals(2, hidden.size());
        assertEquals(AttributeResolver.METHOD_ATTRIBUTES_LINK, hidden.get(1));
        assertTrue(hidden.get(1).contains("matlab_oop/method-attributes.html"));
        assertTrue(cls.blocks().get(1).declarations().get(0).documentation().notes().isEmpty());

        Block events = resolve("classdef A\n events (NotifyAccess = private)\n  E\n end\nend\n").blocks().get(0);
        assertEquals(1, events.notes().size(), "events have no attribute reference page");
    }

    @Test
    void negatedAndFalseAttributesAreOff() throws Exception {
        assertTrue(onlyBlock("(~Hidden, Constant = false)").modifiers().isEmpty());
    }

    @Test
    void constantWithoutDefaultGetsEmptyMatrix() throws Exception {
        Block b = onlyBlock("(Constant)");
        assertEquals("[]", b.declarations().get(0).defaultValue());
    }

    @Test
    void conflictingKeyIsIgnoredAndFlagged() throws Exception {
        Block b = onlyBlock("(Access = private, Access = public, Hidden)");
        assertEquals(AccessPair.PUBLIC, b.access());
        assertTrue(b.has(Modifier.HIDDEN));
        assertEquals(1, diagnostics.size());
        Diagnostic d = diagnostics.get(0);
        assertEquals(Diagnostic.Kind.ATTRIBUTE_CONFLICT, d.kind());
        assertEquals(Diagnostic.Severity.WARNING, d.severity());
        assertEquals(2, d.line());
        assertTrue(b.declarations().get(0).documentation().notes().get(0)
                .contains("<tt>Access</tt> is given conflicting values (private, public)"));
    }

    @Test
    void repeatedKeyWithSameValueIsFine() throws Exception {
        Block b = onlyBlock("(Hidden, Hidden = true)");
        assertTrue(b.has(Modifier.HIDDEN));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void unknownAttributesAreReported() throws Exception {
        Block b = onlyBlock("(Fancy, Description = 'ok', Access = sometimes)");
        assertEquals(AccessPair.PUBLIC, b.access());
        assertEquals(2, diagnostics.size());
        assertTrue(diagnostics.stream().allMatch(d -> d.kind() == Diagnostic.Kind.UNKNOWN_ATTRIBUTE));
    }

    @Test
    void classAttributesProduceClassNotes() throws Exception {
        ClassDeclaration cls = resolve("classdef (Sealed, Abstract, ConstructOnLoad) A\nend\n");
        assertEquals(Set.of(Modifier.SEALED, Modifier.ABSTRACT), cls.modifiers());
        assertEquals(2, cls.documentation().notes().size());
        assertTrue(cls.documentation().notes().get(0).contains("<tt>Sealed</tt> and cannot be derived from"));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void accessorsAddNotesToTheirProperty() throws Exception {
        String src = String.join("\n",
                "classdef A",
                " properties",
                "  both",
                "  readOnly",
                "  plain",
                " end",
                " methods",
                "  function v = get.both(obj)",
                "  end",
                "  function set.both(obj, v)",
                "  end",
                "  function v = get.readOnly(obj)",
                "  end",
                " end",
                "end",
                "");
        ClassDeclaration cls = resolve(src);
        assertEquals(List.of("This property has custom functionality when its value is retrieved or changed."),
                cls.findProperty("both").documentation().notes());
        assertEquals(List.of("This property has custom functionality when its value is retrieved."),
                cls.findProperty("readOnly").documentation().notes());
        assertTrue(cls.findProperty("plain").documentation().notes().isEmpty());
    }

    @Test
    void abstractDetectionUsedByParser() throws Exception {
        ClassDeclaration cls = ClassParser.parse("A.m",
                "classdef A\n methods (Abstract = true)\n  f(obj)\n end\nend\n").declaration();
        assertTrue(cls.declarations().get(0).isAbstract());
        assertNull(cls.declarations().get(0).body());

        cls = ClassParser.parse("A.m",
                "classdef A\n methods (Abstract, Abstract = false)\n  f(obj)\n end\nend\n").declaration();
        assertFalse(cls.declarations().get(0).isAbstract());
    }
}
