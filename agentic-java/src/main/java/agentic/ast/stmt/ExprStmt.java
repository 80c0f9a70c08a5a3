package agentic.ast.stmt;

import agentic.ast.expr.Expr;
import agentic.diag.SourceLocation;

public record ExprStmt(Expr expr, SourceLocation loc) implements Stmt {}
