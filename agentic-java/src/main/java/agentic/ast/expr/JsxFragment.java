package agentic.ast.expr;

import agentic.diag.SourceLocation;

import java.util.List;

public record JsxFragment(List<Expr> children, SourceLocation loc) implements Expr {}
