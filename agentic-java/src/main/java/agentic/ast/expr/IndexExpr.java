package agentic.ast.expr;

import agentic.diag.SourceLocation;

public record IndexExpr(Expr object, Expr index, SourceLocation loc) implements Expr {}
