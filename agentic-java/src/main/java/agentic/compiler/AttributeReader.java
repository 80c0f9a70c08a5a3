package agentic.compiler;

import agentic.ast.expr.Expr;
import agentic.ast.expr.JsxElement;
import agentic.diag.SourceLocation;
import agentic.ir.RuntimeVar;
import agentic.sema.ElementAttributes;
import agentic.sema.ExprText;
import agentic.sema.ResolveException;
import agentic.sema.StaticEvaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Typed, statically evaluated access to one element's attributes. */
final class AttributeReader {
    private final JsxElement element;
    private final ElementAttributes attributes;
    private final StaticEvaluator evaluator;

    AttributeReader(JsxElement element, TransformContext ctx) {
        this.element = element;
        this.attributes = ElementAttributes.collect(element, ctx.spreads());
        this.evaluator = ctx.evaluator();
    }

    boolean has(String name) {
        return attributes.has(name);
    }

    Expr expr(String name) {
        return attributes.get(name);
    }

    ElementAttributes all() {
        return attributes;
    }

    Object value(String name) {
        Expr e = attributes.get(name);
        return e == null ? null : evaluator.evaluate(e);
    }

    String requireString(String name) {
        String s = string(name);
        if (s == null) throw missing(name);
        return s;
    }

    /** String attribute; numbers and runtime variables are rendered as text. */
    String string(String name) {
        Object v = value(name);
        if (v == null) return null;
        if (v instanceof String || v instanceof Number || v instanceof RuntimeVar) return StaticEvaluator.toText(v);
        throw wrongType(name, "a string");
    }

    Integer integer(String name) {
        Object v = value(name);
        if (v == null) return null;
        if (!(v instanceof Long l)) throw wrongType(name, "an integer");
        if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
            throw new ResolveException("<" + element.name() + "> attribute '" + name + "' is out of range: " + l,
                    attributes.get(name).loc());
        }
        return l.intValue();
    }

    boolean bool(String name, boolean fallback) {
        Object v = value(name);
        if (v == null) return fallback;
        if (v instanceof Boolean b) return b;
        throw wrongType(name, "a boolean");
    }

    List<?> list(String name) {
        Object v = value(name);
        if (v == null) return List.of();
        if (v instanceof List<?> l) return l;
        throw wrongType(name, "an array");
    }

    List<String> stringList(String name) {
        List<String> out = new ArrayList<>();
        for (Object o : list(name)) {
            if (!(o instanceof String s)) throw wrongType(name, "an array of strings");
            out.add(s);
        }
        return out;
    }

    Map<String, Object> map(String name) {
        Object v = value(name);
        if (v == null) return null;
        if (!(v instanceof Map<?, ?> m)) throw wrongType(name, "an object");
        Map<String, Object> out = new LinkedHashMap<>();
        m.forEach((k, val) -> out.put((String) k, val));
        return out;
    }

    /** Runtime variable the element writes to. Only the whole variable can be assigned. */
    RuntimeVar targetVar(String name) {
        Expr e = attributes.get(name);
        if (e == null) return null;
        Object v = evaluator.evaluate(e);
        if (!(v instanceof RuntimeVar rv)) {
            throw new ResolveException("<" + element.name() + "> attribute '" + name
                    + "' must reference a declared runtime variable, got " + ExprText.describe(e), e.loc());
        }
        if (!rv.path().isEmpty()) {
            throw new ResolveException("<" + element.name() + "> attribute '" + name
                    + "' must be a declared runtime variable, not a property path", e.loc());
        }
        return rv;
    }

    RuntimeVar requireTargetVar(String name) {
        RuntimeVar v = targetVar(name);
        if (v == null) throw missing(name);
        return v;
    }

    ResolveException missing(String name) {
        return new ResolveException("<" + element.name() + "> requires '" + name + "'", element.loc());
    }

    ResolveException wrongType(String name, String expected) {
        Expr e = attributes.get(name);
        SourceLocation loc = e == null ? element.loc() : e.loc();
        return new ResolveException("<" + element.name() + "> attribute '" + name + "' must be " + expected, loc);
    }
}
