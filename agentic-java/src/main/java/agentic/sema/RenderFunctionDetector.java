package agentic.sema;

import agentic.ast.expr.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognizes {@code <Command ...>{(ctx) => <>...</>}</Command>}: a root whose only non-blank
 * child is an arrow function with at most one parameter.
 */
public final class RenderFunctionDetector {
    private RenderFunctionDetector() {}

    public static DocumentContent detect(JsxElement root) {
        List<Expr> significant = new ArrayList<>();
        for (Expr child : root.children()) {
            if (child instanceof JsxText t && t.isBlank()) continue;
            if (child instanceof JsxExpressionContainer c && c.isEmpty()) continue;
            significant.add(child);
        }
        if (significant.size() != 1
                || !(significant.get(0) instanceof JsxExpressionContainer c)
                || !(c.expression() instanceof ArrowFunction fn)) {
            return new DocumentContent.Literal(root.children());
        }
        if (fn.params().size() > 1) {
            throw new ResolveException("Render function accepts at most one parameter, got " + fn.params().size(),
                    fn.loc());
        }
        String what = "Render function of <" + root.name() + ">";
        FunctionBody body = fn.blockBody() != null
                ? FunctionBody.ofBlock(fn.blockBody(), what, fn.loc())
                : FunctionBody.ofExpression(fn.expressionBody(), what);
        String param = fn.params().isEmpty() ? null : fn.params().get(0).name();
        return new DocumentContent.Deferred(param, body);
    }
}
