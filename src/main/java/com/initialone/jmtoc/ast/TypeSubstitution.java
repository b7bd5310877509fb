package com.initialone.jmtoc.ast;

import com.initialone.jmtoc.diagnostics.Diagnostic;
import com.initialone.jmtoc.model.AccessorKind;
import com.initialone.jmtoc.model.BlockKind;
import com.initialone.jmtoc.model.ClassDeclaration;
import com.initialone.jmtoc.model.Declaration;
import com.initialone.jmtoc.model.Modifier;
import com.initialone.jmtoc.util.Tools;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Syntactic stand-ins for the types MATLAB never writes down: placeholder types, qualified
 * type names and the return constructs doxygen sees in front of a method name.
 */
public final class TypeSubstitution {

    public static final String UNTYPED = "matlabtypesubstitute";
    public static final String EVENT = "EVENT";
    public static final String NO_RETURN = "noret::substitute";

    private final ClassDeclaration cls;

    public TypeSubstitution(ClassDeclaration cls) {
        this.cls = cls;
    }

    /** Type token of a property or event. */
    public String typeOf(Declaration member) {
        if (member.kind() == BlockKind.EVENTS) {
            return EVENT;
        }
        return member.type() == null ? UNTYPED : Tools.qualify(member.type());
    }

    /** {@code null} for the constructor, which has no return construct. */
    public String returnConstruct(Declaration method) {
        if (isConstructor(method)) {
            return null;
        }
        if (method.accessorKind() == AccessorKind.SET) {
            return NO_RETURN;
        }
        List<String> returns = method.returns();
        if (returns.isEmpty()) {
            return NO_RETURN;
        }
        if (returns.size() == 1) {
            return inner(returns.get(0));
        }
        return "mlhsSubst<" + returns.stream().map(r -> inner(r) + " ").collect(Collectors.joining(",")) + ">";
    }

    private static String inner(String name) {
        return "mlhsInnerSubst<void," + name + ">";
    }

    /** Parameters as they appear in the signature; the object argument is dropped where MATLAB passes it implicitly. */
    public List<String> parameters(Declaration method) {
        List<String> params = method.parameters();
        if (takesObject(method) && !params.isEmpty()) {
            params = params.subList(1, params.size());
        }
        List<String> out = new ArrayList<>(params.size());
        int unused = 0;
        for (String p : params) {
            String name = p.equals("~") ? "unused" + (++unused) : p;
            out.add(UNTYPED + " " + name);
        }
        return out;
    }

    /** {@code ret name(T a,T b)}, as used both in the declaration and in its {@code @fn} line. */
    public String signature(Declaration method) {
        String ret = returnConstruct(method);
        String head = ret == null ? method.emittedName() : ret + " " + method.emittedName();
        return head + "(" + String.join(",", parameters(method)) + ")";
    }

    public boolean isConstructor(Declaration method) {
        return !method.isAccessor() && method.name().equals(cls.name());
    }

    public boolean isStatic(Declaration method) {
        return method.block().has(Modifier.STATIC);
    }

    private boolean takesObject(Declaration method) {
        return !isStatic(method) && !isConstructor(method);
    }

    /**
     * Warns about ordinary methods that cannot receive the object. Accessor arity is enforced by
     * the parser.
     */
    public void checkParameters(String sourceName, List<Diagnostic> diagnostics) {
        for (Declaration d : cls.declarations()) {
            if (d.kind() != BlockKind.METHODS || d.isAccessor() || !takesObject(d)) continue;
            if (d.parameters().isEmpty()) {
                diagnostics.add(Diagnostic.warning(Diagnostic.Kind.PARAMETER_COUNT, sourceName,
                        d.startLine(), d.column(),
                        "method '" + d.name() + "' is neither static nor a constructor but declares no object parameter"));
            }
        }
    }
}
