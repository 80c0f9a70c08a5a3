package agentic.ast.decl;

import agentic.ast.expr.Expr;
import agentic.diag.SourceLocation;

public record ExportDefaultDecl(
        Expr value,
        SourceLocation loc
) implements Decl {}
