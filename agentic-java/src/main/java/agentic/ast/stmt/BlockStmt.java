package agentic.ast.stmt;

import agentic.diag.SourceLocation;

import java.util.List;

public record BlockStmt(List<Stmt> statements, SourceLocation loc) implements Stmt {}
