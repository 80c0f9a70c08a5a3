package agentic.ast.expr;

import agentic.diag.SourceLocation;

import java.util.List;

public record ArrayLiteral(List<Expr> elements, SourceLocation loc) implements Expr {}
