package com.initialone.jmtoc.ast;

import com.initialone.jmtoc.diagnostics.Diagnostic;
import com.initialone.jmtoc.model.ClassDeclaration;
import com.initialone.jmtoc.model.Declaration;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TypeSubstitutionTest {

    private static ClassDeclaration shape() throws Exception {
        return ClassParser.parse("Shape.m", ClassParserTest.fixture("Shape.m")).declaration();
    }

    private static Declaration byName(ClassDeclaration cls, String name) {
        return cls.declarations().stream().filter(d -> d.name().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void propertyAndEventTypes() throws Exception {
        ClassDeclaration cls = shape();
        TypeSubstitution types = new TypeSubstitution(cls);
        assertEquals("::grid::Rect", types.typeOf(cls.findProperty("Grid")));
        assertEquals("matlabtypesubstitute", types.typeOf(cls.findProperty("Vertices")));
        assertEquals("EVENT", types.typeOf(byName(cls, "Moved")));
    }

    @Test
    void multipleReturnsKeepTheirOrder() throws Exception {
        ClassDeclaration cls = shape();
        TypeSubstitution types = new TypeSubstitution(cls);
        assertEquals("mlhsSubst<mlhsInnerSubst<void,area> ,mlhsInnerSubst<void,perimeter> >",
                types.returnConstruct(byName(cls, "measure")));
        assertEquals("mlhsSubst<mlhsInnerSubst<void,area> ,mlhsInnerSubst<void,perimeter> > "
                        + "measure(matlabtypesubstitute scale)",
                types.signature(byName(cls, "measure")));
    }

    @Test
    void constructorHasNoReturnAndKeepsAllParameters() throws Exception {
        ClassDeclaration cls = shape();
        TypeSubstitution types = new TypeSubstitution(cls);
        Declaration ctor = byName(cls, "Shape");
        assertNull(types.returnConstruct(ctor));
        assertEquals("Shape(matlabtypesubstitute grid,matlabtypesubstitute label)", types.signature(ctor));
    }

    @Test
    void staticMethodsKeepTheirFirstParameter() throws Exception {
        ClassDeclaration cls = ClassParser.parse("A.m",
                "classdef A\n methods (Static)\n  function r = make(n)\n  end\n end\nend\n").declaration();
        new AttributeResolver("A.m", new ArrayList<>()).resolve(cls);
        assertEquals("mlhsInnerSubst<void,r> make(matlabtypesubstitute n)",
                new TypeSubstitution(cls).signature(cls.declarations().get(0)));
    }

    @Test
    void accessorsRenderUnderPropertyName() throws Exception {
        ClassDeclaration cls = shape();
        TypeSubstitution types = new TypeSubstitution(cls);
        assertEquals("mlhsInnerSubst<void,v> Label()", types.signature(byName(cls, "get.Label")));
        assertEquals("noret::substitute Color(matlabtypesubstitute c)", types.signature(byName(cls, "set.Color")));
    }

    @Test
    void ignoredParametersGetPlaceholderNames() throws Exception {
        ClassDeclaration cls = shape();
        assertEquals("noret::substitute move(matlabtypesubstitute dx,matlabtypesubstitute unused1)",
                new TypeSubstitution(cls).signature(byName(cls, "move")));
    }

    @Test
    void methodWithoutObjectParameterIsReported() throws Exception {
        ClassDeclaration cls = ClassParser.parse("A.m", String.join("\n",
                "classdef A",
                " methods",
                "  function obj = A()",
                "  end",
                "  function broken()",
                "  end",
                " end",
                " methods (Static)",
                "  function ok()",
                "  end",
                " end",
                "end", "")).declaration();
        List<Diagnostic> diagnostics = new ArrayList<>();
        new AttributeResolver("A.m", diagnostics).resolve(cls);
        new TypeSubstitution(cls).checkParameters("A.m", diagnostics);
        assertEquals(1, diagnostics.size());
        Diagnostic d = diagnostics.get(0);
        assertEquals(Diagnostic.Kind.PARAMETER_COUNT, d.kind());
        assertEquals(5, d.line());
        assertTrue(d.message().contains("'broken'"));
        assertEquals("noret::substitute broken()", new TypeSubstitution(cls).signature(cls.declarations().get(1)));
    }
}
