package agentic.ast.stmt;

import agentic.ast.expr.Expr;
import agentic.diag.SourceLocation;

public record ReturnStmt(Expr value, SourceLocation loc) implements Stmt {}
