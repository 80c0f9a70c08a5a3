package agentic.ast.expr;

import agentic.diag.SourceLocation;

import java.util.List;

/**
 * Template literal. {@code quasis} always has one more element than {@code expressions}:
 * quasis[0] expr[0] quasis[1] ... expr[n-1] quasis[n].
 */
public record TemplateLiteral(
        List<String> quasis,
        List<Expr> expressions,
        SourceLocation loc
) implements Expr {}
