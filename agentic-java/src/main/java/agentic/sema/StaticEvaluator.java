package agentic.sema;

import agentic.ast.decl.VarDecl;
import agentic.ast.expr.*;
import agentic.ir.ConfigValue;
import agentic.ir.RuntimeVar;

import java.util.*;

/**
 * Folds attribute expressions into Java values at compile time.
 *
 * <p>Results are Strings, Longs (integral numbers), Doubles, Booleans, null, Lists, Maps,
 * {@link RuntimeVar} handles, {@link agentic.ir.OutputReference}s and {@link ConfigValue.Env}
 * for {@code process.env.NAME}.
 */
public final class StaticEvaluator {
    private final SymbolTable symbols;
    private final Set<VarDecl> evaluating = new HashSet<>();

    public StaticEvaluator(SymbolTable symbols) {
        this.symbols = symbols;
    }

    public Object evaluate(Expr e) {
        if (e instanceof StringLiteral s) return s.value();
        if (e instanceof NumberLiteral n) return n.isIntegral() ? (Object) (long) n.value() : (Object) n.value();
        if (e instanceof BoolLiteral b) return b.value();
        if (e instanceof NullLiteral) return null;
        if (e instanceof TemplateLiteral t) return template(t);
        if (e instanceof ArrayLiteral a) {
            List<Object> out = new ArrayList<>();
            for (Expr el : a.elements()) out.add(evaluate(el));
            return out;
        }
        if (e instanceof ObjectLiteral o) return object(o);
        if (e instanceof Identifier id) return identifier(id);
        if (e instanceof MemberExpr m) return member(m);
        if (e instanceof IndexExpr i) return index(i);
        if (e instanceof UnaryExpr u && u.op() == UnaryExpr.Operator.NEG) {
            Object v = evaluate(u.operand());
            if (v instanceof Long l) return -l;
            if (v instanceof Double d) return -d;
        }
        if (e instanceof UnaryExpr u && u.op() == UnaryExpr.Operator.NOT) {
            Object v = evaluate(u.operand());
            if (v instanceof Boolean b) return !b;
        }
        throw cannotEvaluate(e);
    }

    /** Text form used when a value is spliced into prose or a template. */
    public static String toText(Object v) {
        if (v == null) return "";
        if (v instanceof RuntimeVar rv) return rv.reference();
        if (v instanceof Double d && d == Math.rint(d) && !d.isInfinite()) return Long.toString(d.longValue());
        return v.toString();
    }

    private Object template(TemplateLiteral t) {
        StringBuilder sb = new StringBuilder(t.quasis().get(0));
        for (int i = 0; i < t.expressions().size(); i++) {
            Expr part = t.expressions().get(i);
            Object v = evaluate(part);
            if (v instanceof Map || v instanceof List || v instanceof ConfigValue) {
                throw cannotEvaluate(part);
            }
            sb.append(toText(v)).append(t.quasis().get(i + 1));
        }
        return sb.toString();
    }

    private Map<String, Object> object(ObjectLiteral o) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (ObjectLiteral.Member m : o.members()) {
            if (m instanceof ObjectLiteral.KeyValue kv) {
                out.put(kv.key(), evaluate(kv.value()));
            } else {
                ObjectLiteral.Spread s = (ObjectLiteral.Spread) m;
                Object v = evaluate(s.argument());
                if (!(v instanceof Map<?, ?> map)) {
                    throw new ResolveException("Object spread must name an object, got " + ExprText.describe(s.argument()),
                            s.loc());
                }
                map.forEach((k, val) -> out.put((String) k, val));
            }
        }
        return out;
    }

    private Object identifier(Identifier id) {
        Symbol sym = symbols.lookup(id.name());
        if (sym instanceof Symbol.RuntimeVariable rv) return rv.var();
        if (sym instanceof Symbol.Output o) return o.ref();
        if (sym instanceof Symbol.StateRef s) return s.key();
        if (sym instanceof Symbol.Local local && local.decl().constant() && local.decl().initializer() != null) {
            VarDecl decl = local.decl();
            if (!evaluating.add(decl)) {
                throw new ResolveException("Circular constant reference: " + id.name(), id.loc());
            }
            try {
                return evaluate(decl.initializer());
            } finally {
                evaluating.remove(decl);
            }
        }
        throw cannotEvaluate(id);
    }

    private Object member(MemberExpr m) {
        if (m.object() instanceof MemberExpr inner
                && inner.object() instanceof Identifier root
                && root.name().equals("process") && inner.property().equals("env")
                && symbols.lookup("process") == null) {
            return new ConfigValue.Env(m.property());
        }
        if (m.object() instanceof Identifier id && symbols.lookup(id.name()) instanceof Symbol.RenderContext ctx) {
            String value = ctx.values().get(m.property());
            if (!ctx.values().containsKey(m.property())) {
                throw new ResolveException("Unknown render context property '" + m.property() + "'. Available: "
                        + String.join(", ", ctx.values().keySet()), m.loc());
            }
            return value;
        }
        Object target = evaluate(m.object());
        if (target instanceof RuntimeVar rv) return rv.field(m.property());
        if (target instanceof Map<?, ?> map && map.containsKey(m.property())) return map.get(m.property());
        if (target instanceof List<?> list && m.property().equals("length")) return (long) list.size();
        throw cannotEvaluate(m);
    }

    private Object index(IndexExpr i) {
        Object target = evaluate(i.object());
        Object idx = evaluate(i.index());
        if (idx instanceof Long l && (l < 0 || l > Integer.MAX_VALUE)) {
            throw new ResolveException("Index out of range: " + ExprText.describe(i), i.loc());
        }
        if (target instanceof RuntimeVar rv) {
            if (idx instanceof Long l) return rv.index(l.intValue());
            if (idx instanceof String s) return rv.field(s);
        }
        if (target instanceof List<?> list && idx instanceof Long l && l >= 0 && l < list.size()) {
            return list.get(l.intValue());
        }
        if (target instanceof Map<?, ?> map && idx instanceof String s && map.containsKey(s)) {
            return map.get(s);
        }
        throw cannotEvaluate(i);
    }

    private static ResolveException cannotEvaluate(Expr e) {
        return new ResolveException("Cannot evaluate " + ExprText.describe(e) + " at compile time", e.loc());
    }
}
