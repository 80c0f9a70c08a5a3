package agentic.ast.expr;

import agentic.diag.SourceLocation;

public record Identifier(String name, SourceLocation loc) implements Expr {}
