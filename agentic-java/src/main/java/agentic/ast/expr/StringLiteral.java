package agentic.ast.expr;

import agentic.diag.SourceLocation;

public record StringLiteral(String value, SourceLocation loc) implements Expr {}
