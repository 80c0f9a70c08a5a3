package agentic.ast.expr;

import agentic.diag.SourceLocation;

public record UnaryExpr(Operator op, Expr operand, SourceLocation loc) implements Expr {
    public enum Operator { NOT, NEG }
}
