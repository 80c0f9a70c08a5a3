package agentic.ast.expr;

import agentic.diag.SourceLocation;

/** {@code null} or {@code undefined}. */
public record NullLiteral(SourceLocation loc) implements Expr {}
