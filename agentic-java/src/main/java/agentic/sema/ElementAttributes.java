package agentic.sema;

import agentic.ast.expr.BoolLiteral;
import agentic.ast.expr.Expr;
import agentic.ast.expr.JsxAttribute;
import agentic.ast.expr.JsxElement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Effective attributes of one element after spreads, processed left to right so the last write
 * wins. Bare attributes such as {@code multiSelect} read as {@code true}.
 */
public final class ElementAttributes {
    private final JsxElement element;
    private final Map<String, Expr> values;

    private ElementAttributes(JsxElement element, Map<String, Expr> values) {
        this.element = element;
        this.values = values;
    }

    public static ElementAttributes collect(JsxElement element, SpreadResolver spreads) {
        Map<String, Expr> values = new LinkedHashMap<>();
        for (JsxAttribute a : element.attributes()) {
            if (a instanceof JsxAttribute.Named n) {
                values.remove(n.name());
                values.put(n.name(), n.value() == null ? new BoolLiteral(true, n.loc()) : n.value());
            } else {
                for (Map.Entry<String, Expr> e : spreads.resolve((JsxAttribute.Spread) a).entrySet()) {
                    values.remove(e.getKey());
                    values.put(e.getKey(), e.getValue());
                }
            }
        }
        return new ElementAttributes(element, Collections.unmodifiableMap(values));
    }

    public JsxElement element() {
        return element;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /** Expression for {@code name}, or null. */
    public Expr get(String name) {
        return values.get(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
