package agentic.ast.expr;

import agentic.diag.SourceLocation;

public record NumberLiteral(double value, SourceLocation loc) implements Expr {
    public boolean isIntegral() {
        return value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15;
    }
}
