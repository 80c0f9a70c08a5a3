package agentic.ast.expr;

import agentic.ast.type.TypeRef;
import agentic.diag.SourceLocation;

import java.util.List;

/**
 * {@code <Name<T...> attrs>children</Name>}. Member names such as {@code Init.Call} are kept dotted.
 */
public record JsxElement(
        String name,
        List<TypeRef> typeArgs,
        List<JsxAttribute> attributes,
        List<Expr> children,
        boolean selfClosing,
        SourceLocation loc
) implements Expr {

    public boolean isIntrinsic() {
        return !name.isEmpty() && Character.isLowerCase(name.charAt(0)) && !name.contains(".");
    }

    public JsxAttribute.Named attribute(String attrName) {
        JsxAttribute.Named found = null;
        for (JsxAttribute a : attributes) {
            if (a instanceof JsxAttribute.Named n && n.name().equals(attrName)) found = n;
        }
        return found;
    }
}
