package agentic.ast.expr;

import agentic.diag.SourceLocation;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right,
        SourceLocation loc
) implements Expr {

    public enum Operator {
        EQ, NE, LT, GT, LE, GE,
        AND, OR
    }
}
