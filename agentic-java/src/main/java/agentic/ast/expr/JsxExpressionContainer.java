package agentic.ast.expr;

import agentic.diag.SourceLocation;

/** {@code {expr}} inside JSX children; {@code expression} is null for {@code {}} and comments. */
public record JsxExpressionContainer(Expr expression, SourceLocation loc) implements Expr {
    public boolean isEmpty() {
        return expression == null;
    }
}
