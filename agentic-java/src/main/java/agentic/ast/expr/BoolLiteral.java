package agentic.ast.expr;

import agentic.diag.SourceLocation;

public record BoolLiteral(boolean value, SourceLocation loc) implements Expr {}
