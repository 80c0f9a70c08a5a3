package agentic.ast.expr;

import agentic.diag.SourceLocation;

public record MemberExpr(Expr object, String property, SourceLocation loc) implements Expr {}
