package agentic.compiler;

import agentic.ast.decl.VarDecl;
import agentic.ast.expr.*;
import agentic.ast.type.NamedTypeRef;
import agentic.ast.type.TypeRef;
import agentic.diag.SourceLocation;
import agentic.ir.*;
import agentic.sema.*;

import java.util.*;

/**
 * Runtime variables, runtime functions, agent outputs and state helpers.
 */
final class VariableCompiler {
    private VariableCompiler() {}

    /** Classifies a const declaration by its initializer. */
    static Symbol declare(VarDecl v, TransformContext ctx) {
        if (!(v.initializer() instanceof CallExpr call) || call.calleeName() == null) {
            return new Symbol.Local(v.name(), v);
        }
        switch (call.calleeName()) {
            case "useRuntimeVar": {
                String name = stringArg(call, "useRuntimeVar");
                RuntimeVar var = IrErrors.at(call.loc(), () -> RuntimeVar.of(name));
                String typeText = call.typeArgs().isEmpty() ? null : call.typeArgs().get(0).text();
                if (ctx.atRoot()) ctx.addDeclaration(new RuntimeVarDeclNode(var, typeText));
                return new Symbol.RuntimeVariable(v.name(), var);
            }
            case "useVariable": {
                String name = stringArg(call, "useVariable");
                return new Symbol.RuntimeVariable(v.name(), IrErrors.at(call.loc(), () -> RuntimeVar.of(name)));
            }
            case "runtimeFn": {
                if (call.args().size() != 1 || !(call.args().get(0) instanceof Identifier fn)) {
                    throw new ResolveException("runtimeFn requires a function identifier", call.loc());
                }
                return new Symbol.RuntimeFunction(v.name(), fn.name());
            }
            case "useOutput": {
                String agent = stringArg(call, "useOutput");
                TypeReference type = typeReference(call.typeArgs(), 0, call.loc(), ctx);
                List<String> custom = customStatuses(type, ctx);
                OutputReference ref = IrErrors.at(call.loc(), () -> new OutputReference(agent, type, custom));
                return new Symbol.Output(v.name(), ref);
            }
            case "useStateRef":
                return new Symbol.StateRef(v.name(), stringArg(call, "useStateRef"));
            default:
                return new Symbol.Local(v.name(), v);
        }
    }

    /** Type argument {@code index} as a reference into the current module, or ANY. */
    static TypeReference typeReference(List<TypeRef> typeArgs, int index, SourceLocation loc, TransformContext ctx) {
        if (typeArgs.size() <= index) return TypeReference.ANY;
        TypeRef t = typeArgs.get(index);
        if (!(t instanceof NamedTypeRef named) || !named.args().isEmpty()) return TypeReference.ANY;
        if (named.name().equals("any") || named.name().equals("unknown")) return TypeReference.ANY;
        return TypeReference.named(named.name(), ctx.module().path(), loc);
    }

    private static List<String> customStatuses(TypeReference type, TransformContext ctx) {
        Optional<TypeShape> shape = ctx.types().resolve(type);
        if (shape.isEmpty()) return List.of();
        return shape.get().field("status")
                .map(f -> f.literals().stream().filter(s -> !ReturnStatus.isStandard(s)).toList())
                .orElse(List.of());
    }

    // ---------- elements ----------

    static RuntimeCallNode runtimeCall(JsxElement el, Symbol.RuntimeFunction fn, TransformContext ctx) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        Map<String, Object> args = attrs.map("args");
        Map<String, RuntimeArg> converted = new LinkedHashMap<>();
        if (args != null) {
            args.forEach((k, v) -> converted.put(k, v instanceof RuntimeVar rv
                    ? new RuntimeArg.Reference(rv)
                    : new RuntimeArg.Literal(plain(v))));
        }
        return new RuntimeCallNode(fn.functionName(), converted, attrs.requireTargetVar("output"));
    }

    static ReadStateNode readState(JsxElement el, TransformContext ctx) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        return new ReadStateNode(attrs.requireString("state"), attrs.requireTargetVar("into"), attrs.string("field"));
    }

    static WriteStateNode writeState(JsxElement el, TransformContext ctx) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        String key = attrs.requireString("state");
        if (attrs.has("merge")) {
            if (attrs.has("field") || attrs.has("value")) {
                throw new ResolveException("<WriteState> takes either 'merge' or 'field' and 'value'", el.loc());
            }
            Map<String, Object> merge = new LinkedHashMap<>();
            attrs.map("merge").forEach((k, v) -> merge.put(k, plain(v)));
            return WriteStateNode.merge(key, merge);
        }
        String field = attrs.requireString("field");
        Object value = attrs.value("value");
        if (value instanceof RuntimeVar rv) {
            return WriteStateNode.field(key, field, null, rv);
        }
        if (value instanceof String s) {
            return WriteStateNode.field(key, field, s, null);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return WriteStateNode.field(key, field, StaticEvaluator.toText(value), null);
        }
        throw attrs.missing("value");
    }

    static AssignNode assign(JsxElement el, TransformContext ctx) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        RuntimeVar target = attrs.requireTargetVar("var");
        List<String> sources = new ArrayList<>();
        for (String attr : List.of("bash", "value", "env")) {
            if (attrs.has(attr)) sources.add(attr);
        }
        if (sources.size() != 1) {
            throw new ResolveException("<Assign> takes exactly one of 'bash', 'value' or 'env'", el.loc());
        }
        String attr = sources.get(0);
        AssignNode.Source source = AssignNode.Source.valueOf(attr.toUpperCase(Locale.ROOT));
        String content = attrs.requireString(attr);
        String comment = attrs.string("comment");
        return IrErrors.at(el.loc(), () -> new AssignNode(target, source, content, comment, false));
    }

    /** Assign children in order; a {@code <br/>} puts a blank line before the next one. */
    static AssignGroupNode assignGroup(JsxElement el, TransformContext ctx) {
        List<AssignNode> assignments = new ArrayList<>();
        boolean blankBefore = false;
        for (Expr child : el.children()) {
            if (child instanceof JsxText t && t.isBlank()) continue;
            if (child instanceof JsxExpressionContainer c && c.isEmpty()) continue;
            if (!(child instanceof JsxElement element)) {
                throw new ResolveException("AssignGroup can only contain Assign or br elements", child.loc());
            }
            if (element.name().equals("br")) {
                blankBefore = true;
                continue;
            }
            if (!element.name().equals("Assign")) {
                throw new ResolveException("AssignGroup can only contain Assign or br elements, found: "
                        + element.name(), element.loc());
            }
            AssignNode node = assign(element, ctx);
            assignments.add(blankBefore ? node.withBlankBefore() : node);
            blankBefore = false;
        }
        return IrErrors.at(el.loc(), () -> new AssignGroupNode(assignments));
    }

    /**
     * Converts an evaluated value to plain JSON data: runtime variables nested anywhere become
     * their {@code $NAME.path} reference.
     */
    static Object plain(Object v) {
        if (v instanceof RuntimeVar rv) return rv.reference();
        if (v instanceof List<?> list) {
            List<Object> out = new ArrayList<>();
            for (Object o : list) out.add(plain(o));
            return out;
        }
        if (v instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, val) -> out.put((String) k, plain(val)));
            return out;
        }
        if (v instanceof ConfigValue || v instanceof OutputReference) {
            throw new IrValidationException("Value cannot be serialized: " + v);
        }
        return v;
    }

    private static String stringArg(CallExpr call, String fn) {
        if (call.args().isEmpty() || !(call.args().get(0) instanceof StringLiteral s)) {
            throw new ResolveException(fn + " requires a string literal argument", call.loc());
        }
        return s.value();
    }
}
