package agentic.ast.stmt;

import agentic.diag.SourceLocation;

public sealed interface Stmt permits BlockStmt, ReturnStmt, VarDeclStmt, ExprStmt {
    SourceLocation loc();
}
